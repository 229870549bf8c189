package com.logistics.reconciliation.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Lets picocli obtain commands from the Spring context, so they can have
 * services injected. Mixins and converters that are not beans are created
 * by picocli's default factory.
 */
@Component
@RequiredArgsConstructor
public class SpringCommandFactory implements CommandLine.IFactory {

    private final ApplicationContext applicationContext;

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        String[] beanNames = applicationContext.getBeanNamesForType(cls);
        if (beanNames.length == 1) {
            return applicationContext.getBean(beanNames[0], cls);
        }
        return CommandLine.defaultFactory().create(cls);
    }
}

package com.logistics.reconciliation.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Root of the command line. Every operation is a subcommand.
 */
@Component
@Command(name = "reconciliation",
        mixinStandardHelpOptions = true,
        version = "order-reconciliation-service 1.0.0",
        description = "Order reconciliation and transfer between the Source and Target stores",
        subcommands = {
                CompareDataCommand.class,
                CreatePayloadCommand.class,
                CreatePayloadsCommand.class,
                ListPayloadsCommand.class,
                GetPayloadCommand.class,
                CopyProductsCommand.class,
                CopyProductsUpsertCommand.class,
                CopyOrdersCommand.class,
                CopyOrdersUpsertCommand.class,
                FillOrderDetailsCommand.class,
                ValidateCommand.class
        })
public class ReconciliationCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return ExitCodes.USAGE;
    }
}

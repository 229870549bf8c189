package com.logistics.reconciliation.cli;

import com.logistics.reconciliation.exception.TransferRunException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Arrays;

/**
 * Runs the command line when the {@code cli} profile is active and hands
 * the command's exit code to Spring Boot.
 */
@Component
@Profile("cli")
@RequiredArgsConstructor
@Slf4j
public class CommandLineRunnerAdapter implements CommandLineRunner, ExitCodeGenerator {

    private final ReconciliationCommand rootCommand;
    private final SpringCommandFactory commandFactory;

    private int exitCode;

    @Override
    public void run(String... args) {
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--spring."))
                .toArray(String[]::new);
        exitCode = commandLine().execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(rootCommand, commandFactory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExitCodeExceptionMapper(ExitCodes::forException)
                .setExecutionExceptionHandler(CommandLineRunnerAdapter::handleExecutionException);
    }

    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        int code = ExitCodes.forException(e);
        if (code == ExitCodes.FAILURE) {
            log.error("Command {} failed", commandLine.getCommandName(), e);
        }
        commandLine.getErr().println("Error: " + e.getMessage());
        if (e instanceof TransferRunException runException && runException.getCursor() != null
                && runException.getCursor().lastKey() != null) {
            commandLine.getErr().println("Resume with: --resume-after=" + runException.getCursor().lastKey());
        }
        commandLine.getErr().flush();
        return code;
    }
}

package com.logistics.reconciliation.cli;

import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.PayloadNotFoundException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.exception.TransferCancelledException;
import picocli.CommandLine;

/**
 * Process exit codes of the command line.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;
    public static final int NOT_FOUND = 3;
    public static final int RETRY_EXHAUSTED = 4;
    public static final int FATAL = 5;
    public static final int CANCELLED = 130;

    private ExitCodes() {
    }

    public static int forException(Throwable e) {
        if (e instanceof CommandLine.ParameterException || e instanceof IllegalArgumentException) {
            return USAGE;
        }
        if (e instanceof OrderNotFoundException || e instanceof PayloadNotFoundException) {
            return NOT_FOUND;
        }
        if (e instanceof RetryExhaustedException) {
            return RETRY_EXHAUSTED;
        }
        if (e instanceof FatalTransferException) {
            return FATAL;
        }
        if (e instanceof TransferCancelledException) {
            return CANCELLED;
        }
        return FAILURE;
    }
}

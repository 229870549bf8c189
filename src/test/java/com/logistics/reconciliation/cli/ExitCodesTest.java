package com.logistics.reconciliation.cli;

import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.PayloadNotFoundException;
import com.logistics.reconciliation.exception.ReconciliationException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.exception.TransferCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExitCodesTest {

    @Test
    @DisplayName("Should map each failure kind to its exit code")
    void shouldMapFailures() {
        assertThat(ExitCodes.forException(new IllegalArgumentException("bad date"))).isEqualTo(ExitCodes.USAGE);
        assertThat(ExitCodes.forException(new OrderNotFoundException("DO-1"))).isEqualTo(ExitCodes.NOT_FOUND);
        assertThat(ExitCodes.forException(new PayloadNotFoundException("DO-1"))).isEqualTo(ExitCodes.NOT_FOUND);
        assertThat(ExitCodes.forException(new RetryExhaustedException("read", 3, new RuntimeException("down"))))
                .isEqualTo(ExitCodes.RETRY_EXHAUSTED);
        assertThat(ExitCodes.forException(new FatalTransferException("write", new RuntimeException("constraint"))))
                .isEqualTo(ExitCodes.FATAL);
        assertThat(ExitCodes.forException(new TransferCancelledException("shutdown")))
                .isEqualTo(ExitCodes.CANCELLED);
        assertThat(ExitCodes.forException(new ReconciliationException("other"))).isEqualTo(ExitCodes.FAILURE);
        assertThat(ExitCodes.forException(new IllegalStateException("boom"))).isEqualTo(ExitCodes.FAILURE);
    }
}

package com.logistics.reconciliation.service.transfer;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the tokens of active runs so that context shutdown (SIGINT included)
 * stops them at the next page boundary.
 * <p>
 * Depends on both pools so it is destroyed before they close.
 */
@Component
@DependsOn({"sourceDataSource", "targetDataSource"})
@Slf4j
public class CancellationRegistry {

    private final Set<CancellationToken> active = ConcurrentHashMap.newKeySet();

    public CancellationToken open(String runName) {
        CancellationToken token = new CancellationToken(runName);
        active.add(token);
        return token;
    }

    public void close(CancellationToken token) {
        active.remove(token);
    }

    public int activeCount() {
        return active.size();
    }

    public void cancelAll(String reason) {
        for (CancellationToken token : active) {
            log.warn("Cancelling run '{}': {}", token.getRunName(), reason);
            token.cancel(reason);
        }
    }

    @PreDestroy
    public void onShutdown() {
        if (!active.isEmpty()) {
            cancelAll("application shutting down");
        }
    }
}

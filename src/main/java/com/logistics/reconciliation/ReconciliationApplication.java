package com.logistics.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Profiles;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Order Reconciliation Service
 * <p>
 * Reconciles order and product data between the Source store (system of
 * record, read-only) and the Target cleansing store.
 * <p>
 * Key Features:
 * - Per-order line count comparison by do_number
 * - Batched, resumable product and order transfers with retry and backoff
 * - Normalized order payloads built from the Target outbound projection
 * - REST API, and a command line when started with the {@code cli} profile
 */
@SpringBootApplication
@EnableScheduling
public class ReconciliationApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(ReconciliationApplication.class, args);
        if (context.getEnvironment().acceptsProfiles(Profiles.of("cli"))) {
            System.exit(SpringApplication.exit(context));
        }
    }
}

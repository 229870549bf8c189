package com.logistics.reconciliation.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Tables that can be transferred and validated, by the name operators use.
 */
public enum TransferTable {
    PRODUCTS("products"),
    ORDERS("orders"),
    ORDER_LINES("order-lines");

    private final String cliName;

    TransferTable(String cliName) {
        this.cliName = cliName;
    }

    public String getCliName() {
        return cliName;
    }

    public static TransferTable fromName(String name) {
        for (TransferTable table : values()) {
            if (table.cliName.equalsIgnoreCase(name) || table.name().equalsIgnoreCase(name)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown table '" + name + "', expected one of: "
                + Arrays.stream(values()).map(TransferTable::getCliName).collect(Collectors.joining(", ")));
    }
}

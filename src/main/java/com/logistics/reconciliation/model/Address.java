package com.logistics.reconciliation.model;

/**
 * Origin or destination block of an order header.
 */
public record Address(
        String name,
        String address1,
        String address2,
        String city,
        String zipCode,
        String phone,
        String email
) {

    public static Address empty() {
        return new Address(null, null, null, null, null, null, null);
    }
}

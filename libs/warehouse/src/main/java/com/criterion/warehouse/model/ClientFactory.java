package com.criterion.warehouse.model;

import java.time.Instant;

/** Factory methods for creating validated {@link Client} instances. */
public final class ClientFactory {

    private ClientFactory() {
        // utility class
    }

    /** Creates an active client with an open-ended contract. */
    public static Client create(String id, String name, String contactEmail, ClientTier tier, Instant contractStart) {
        return create(id, name, contactEmail, tier, contractStart, null, true);
    }

    /**
     * Creates a client.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static Client create(
            String id,
            String name,
            String contactEmail,
            ClientTier tier,
            Instant contractStart,
            Instant contractEnd,
            boolean active) {
        var client = new Client(id, name, contactEmail, tier, contractStart, contractEnd, active);
        WarehouseValidator.validate(client).throwIfInvalid("client " + id);
        return client;
    }
}

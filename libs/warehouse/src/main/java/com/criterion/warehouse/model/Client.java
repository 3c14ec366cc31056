package com.criterion.warehouse.model;

import java.time.Instant;

/**
 * An online retailer using the warehouse's 3PL services.
 *
 * @param id client identifier (e.g., "TR001")
 * @param name display name
 * @param contactEmail operations contact
 * @param tier contracted service tier
 * @param contractStart start of the service contract
 * @param contractEnd end of the service contract, or null for an open-ended contract
 * @param active whether the client is currently active
 */
public record Client(
        String id,
        String name,
        String contactEmail,
        ClientTier tier,
        Instant contractStart,
        Instant contractEnd,
        boolean active) {}

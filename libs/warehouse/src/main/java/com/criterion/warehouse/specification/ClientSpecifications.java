package com.criterion.warehouse.specification;

import static com.criterion.warehouse.specification.Arguments.requireNonNegative;
import static com.criterion.warehouse.specification.Arguments.requireNonNull;
import static com.criterion.warehouse.specification.Rules.rule;

import com.criterion.specification.Specification;
import com.criterion.warehouse.model.Client;
import com.criterion.warehouse.model.ClientTier;
import java.time.Clock;
import java.time.Duration;

/** Rules over {@link Client} candidates. */
public final class ClientSpecifications {

    /** Minimum contract length, in days, for a long-term contract. */
    public static final int LONG_TERM_CONTRACT_DAYS = 365;

    private ClientSpecifications() {
        // utility class
    }

    public static Specification<Client> isActive() {
        return rule("client.isActive", Client::active);
    }

    public static Specification<Client> isTier(ClientTier tier) {
        requireNonNull(tier, "tier");
        return rule("client.isTier[" + tier + "]", c -> c.tier() == tier);
    }

    public static Specification<Client> isPremiumOrEnterprise() {
        return rule(
                "client.isPremiumOrEnterprise",
                c -> c.tier() == ClientTier.PREMIUM || c.tier() == ClientTier.ENTERPRISE);
    }

    /** Satisfied when the contract end lies strictly before the clock's current instant. */
    public static Specification<Client> hasExpiredContract(Clock clock) {
        requireNonNull(clock, "clock");
        return rule(
                "client.hasExpiredContract",
                c -> c.contractEnd() != null && c.contractEnd().isBefore(clock.instant()));
    }

    /**
     * Satisfied when the contract ends within {@code days} whole days from now. Contracts with
     * no end date never expire.
     *
     * @throws IllegalArgumentException if {@code days} is negative
     */
    public static Specification<Client> contractExpiring(Clock clock, int days) {
        requireNonNull(clock, "clock");
        requireNonNegative(days, "days");
        return rule("client.contractExpiring[" + days + "d]", c -> {
            if (c.contractEnd() == null) {
                return false;
            }
            long daysRemaining = Duration.between(clock.instant(), c.contractEnd()).toDays();
            return daysRemaining >= 0 && daysRemaining <= days;
        });
    }

    /** Satisfied by fixed-term contracts lasting at least {@value #LONG_TERM_CONTRACT_DAYS} days. */
    public static Specification<Client> hasLongTermContract() {
        return rule("client.hasLongTermContract", c -> c.contractStart() != null
                && c.contractEnd() != null
                && Duration.between(c.contractStart(), c.contractEnd()).toDays() >= LONG_TERM_CONTRACT_DAYS);
    }
}

package com.flagship.retail_ledger.exception;

import com.flagship.retail_ledger.pricing.PriceTier;

import java.util.Map;
import java.util.UUID;

public class TierUnavailableException extends LedgerException {

    private final PriceTier tier;

    public TierUnavailableException(UUID itemId, PriceTier tier) {
        super(ErrorKind.TIER_UNAVAILABLE,
            "Item " + itemId + " has no " + tier.name().toLowerCase() + " price",
            Map.of("item_id", itemId, "tier", tier));
        this.tier = tier;
    }

    public PriceTier getTier() {
        return tier;
    }
}

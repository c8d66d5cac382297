package com.flagship.retail_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class InsufficientStockException extends LedgerException {

    private final UUID itemId;
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientStockException(UUID itemId, String itemName, BigDecimal available, BigDecimal requested) {
        super(ErrorKind.INSUFFICIENT_STOCK,
            String.format("Insufficient stock for item \"%s\". Available: %s, Requested: %s",
                itemName, available.stripTrailingZeros().toPlainString(),
                requested.stripTrailingZeros().toPlainString()),
            Map.of("item_id", itemId,
                "available", available.stripTrailingZeros().toPlainString(),
                "requested", requested.stripTrailingZeros().toPlainString()));
        this.itemId = itemId;
        this.available = available;
        this.requested = requested;
    }

    public UUID getItemId() {
        return itemId;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}

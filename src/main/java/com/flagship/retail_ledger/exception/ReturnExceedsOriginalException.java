package com.flagship.retail_ledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

public class ReturnExceedsOriginalException extends LedgerException {

    private final BigDecimal remaining;

    public ReturnExceedsOriginalException(UUID lineId, BigDecimal requested, BigDecimal remaining) {
        super(ErrorKind.RETURN_EXCEEDS_ORIGINAL,
            String.format("Return quantity %s exceeds remaining returnable quantity %s",
                requested.stripTrailingZeros().toPlainString(), remaining.stripTrailingZeros().toPlainString()),
            Map.of("line_id", lineId,
                "requested", requested.stripTrailingZeros().toPlainString(),
                "remaining", remaining.stripTrailingZeros().toPlainString()));
        this.remaining = remaining;
    }

    public BigDecimal getRemaining() {
        return remaining;
    }
}

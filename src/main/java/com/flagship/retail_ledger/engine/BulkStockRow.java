package com.flagship.retail_ledger.engine;

import com.flagship.retail_ledger.stock.AdjustmentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One row of a bulk stock adjustment. The item is identified by id or, when no id is given, by
 * its name (case-insensitive, within the tenant).
 */
@Value
@Builder
public class BulkStockRow {
    UUID itemId;
    String name;
    AdjustmentType type;
    BigDecimal quantity;
    String reason;
}

package com.flagship.retail_ledger.unit;

import lombok.Value;

/**
 * A stock quantity expressed as whole outer units plus loose pieces.
 */
@Value
public class CartonBreakdown {
    long cartons;
    int pieces;

    public static CartonBreakdown of(long cartons, int pieces) {
        return new CartonBreakdown(cartons, pieces);
    }
}

package com.flagship.retail_ledger.unit;

import com.flagship.retail_ledger.exception.InvalidUnitInputException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts between the carton/piece representation used at the counter and the single
 * decimal quantity the stock ledger stores.
 *
 * Items with {@code piecesPerUnit == 1} (plain count or weight mode) bypass conversion and are
 * only checked for non-negativity.
 */
public final class UnitConverter {

    /** Scale of stored quantities. */
    public static final int QUANTITY_SCALE = 6;

    /**
     * Largest carton size whose single piece is still distinguishable at {@link #QUANTITY_SCALE}.
     * Beyond it, rounding error times piecesPerUnit can reach half a piece.
     */
    public static final int MAX_PIECES_PER_UNIT = BigDecimal.TEN.pow(QUANTITY_SCALE).intValueExact() - 1;

    private static final BigDecimal HALF_STEP = new BigDecimal("0.5");

    private UnitConverter() {
    }

    /**
     * Returns {@code cartons + pieces / piecesPerUnit}.
     *
     * @throws InvalidUnitInputException if cartons or pieces are negative, pieces is not a proper
     *                                   remainder, or piecesPerUnit is outside
     *                                   {@code [1, MAX_PIECES_PER_UNIT]}
     */
    public static BigDecimal toQuantity(long cartons, int pieces, int piecesPerUnit) {
        checkPiecesPerUnit(piecesPerUnit);
        if (cartons < 0) {
            throw new InvalidUnitInputException("cartons must not be negative, got " + cartons);
        }
        if (pieces < 0) {
            throw new InvalidUnitInputException("pieces must not be negative, got " + pieces);
        }
        if (pieces >= piecesPerUnit) {
            throw new InvalidUnitInputException(
                String.format("pieces (%d) must be less than piecesPerUnit (%d)", pieces, piecesPerUnit));
        }

        BigDecimal fraction = BigDecimal.valueOf(pieces)
            .divide(BigDecimal.valueOf(piecesPerUnit), QUANTITY_SCALE, RoundingMode.HALF_UP);
        return BigDecimal.valueOf(cartons).add(fraction).setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Splits a stored quantity back into cartons and loose pieces. Pieces are rounded to the
     * nearest whole piece; a rounding that reaches a full carton carries over.
     */
    public static CartonBreakdown fromQuantity(BigDecimal quantity, int piecesPerUnit) {
        checkPiecesPerUnit(piecesPerUnit);
        validateQuantity(quantity);

        BigDecimal cartons = quantity.setScale(0, RoundingMode.FLOOR);
        int pieces = quantity.subtract(cartons)
            .multiply(BigDecimal.valueOf(piecesPerUnit))
            .setScale(0, RoundingMode.HALF_UP)
            .intValueExact();

        long wholeCartons = cartons.longValueExact();
        if (pieces >= piecesPerUnit) {
            wholeCartons += pieces / piecesPerUnit;
            pieces = pieces % piecesPerUnit;
        }
        return CartonBreakdown.of(wholeCartons, pieces);
    }

    public static void checkPiecesPerUnit(int piecesPerUnit) {
        if (piecesPerUnit < 1) {
            throw new InvalidUnitInputException("piecesPerUnit must be at least 1, got " + piecesPerUnit);
        }
        if (piecesPerUnit > MAX_PIECES_PER_UNIT) {
            throw new InvalidUnitInputException(
                String.format("piecesPerUnit must be at most %d, got %d", MAX_PIECES_PER_UNIT, piecesPerUnit));
        }
    }

    /**
     * Weight/count mode entry: any non-negative decimal is accepted as-is.
     */
    public static BigDecimal validateQuantity(BigDecimal quantity) {
        if (quantity == null) {
            throw new InvalidUnitInputException("quantity is required");
        }
        if (quantity.signum() < 0) {
            throw new InvalidUnitInputException("quantity must not be negative, got " + quantity.toPlainString());
        }
        return quantity;
    }

    /**
     * Resolves the quantity of a document line entered either as a decimal quantity or as
     * cartons plus loose pieces. Exactly one of the two forms must be used.
     */
    public static BigDecimal resolveLineQuantity(BigDecimal quantity, Long cartons, Integer pieces,
                                                 int piecesPerUnit) {
        boolean cartonForm = cartons != null || pieces != null;
        if (cartonForm && quantity != null) {
            throw new InvalidUnitInputException("Give either quantity or cartons/pieces, not both");
        }
        if (cartonForm) {
            return toQuantity(cartons != null ? cartons : 0L, pieces != null ? pieces : 0, piecesPerUnit);
        }
        return validateQuantity(quantity).setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Snaps to the nearest 0.5 step, the convention of the stepper controls for weighed goods.
     * Never applied by the engine itself.
     */
    public static BigDecimal snapToHalfStep(BigDecimal quantity) {
        validateQuantity(quantity);
        return quantity.divide(HALF_STEP, 0, RoundingMode.HALF_UP).multiply(HALF_STEP);
    }

    /**
     * Carton mode: more than one piece per unit.
     */
    public static boolean isCartonMode(int piecesPerUnit) {
        return piecesPerUnit > 1;
    }
}

package com.flagship.retail_ledger.unit;

import com.flagship.retail_ledger.exception.ErrorKind;
import com.flagship.retail_ledger.exception.InvalidUnitInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Carton/piece conversion. No Spring context needed.
 */
class UnitConverterTest {

    @Test
    @DisplayName("Cartons plus loose pieces become a fractional quantity")
    void testToQuantity() {
        assertEquals(0, new BigDecimal("2.5").compareTo(UnitConverter.toQuantity(2, 6, 12)));
        assertEquals(0, new BigDecimal("3").compareTo(UnitConverter.toQuantity(3, 0, 12)));
        assertEquals(6, UnitConverter.toQuantity(1, 1, 3).scale());
        assertEquals(0, new BigDecimal("1.333333").compareTo(UnitConverter.toQuantity(1, 1, 3)));
    }

    @Test
    @DisplayName("Pieces must be a proper remainder of the carton size")
    void testPiecesOutOfRange() {
        InvalidUnitInputException e = assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.toQuantity(1, 12, 12));
        assertEquals(ErrorKind.INVALID_UNIT_INPUT, e.getKind());

        assertThrows(InvalidUnitInputException.class, () -> UnitConverter.toQuantity(-1, 0, 12));
        assertThrows(InvalidUnitInputException.class, () -> UnitConverter.toQuantity(1, -1, 12));
        assertThrows(InvalidUnitInputException.class, () -> UnitConverter.toQuantity(1, 0, 0));
    }

    @Test
    @DisplayName("Converting back recovers the original cartons and pieces")
    void testRoundTrip() {
        for (int pieces = 0; pieces < 7; pieces++) {
            BigDecimal quantity = UnitConverter.toQuantity(4, pieces, 7);
            CartonBreakdown breakdown = UnitConverter.fromQuantity(quantity, 7);
            assertEquals(4, breakdown.getCartons());
            assertEquals(pieces, breakdown.getPieces());
        }
    }

    @Test
    @DisplayName("Round trip holds for single pieces up to the largest carton size")
    void testRoundTripAtCartonSizeLimit() {
        int[] sizes = {2, 12, 999, 1_000, 65_536, 999_983, UnitConverter.MAX_PIECES_PER_UNIT};
        for (int size : sizes) {
            for (int pieces : new int[]{1, size / 2, size - 1}) {
                CartonBreakdown breakdown = UnitConverter.fromQuantity(UnitConverter.toQuantity(3, pieces, size), size);
                assertEquals(3, breakdown.getCartons(), "cartons for piecesPerUnit " + size);
                assertEquals(pieces, breakdown.getPieces(), "pieces for piecesPerUnit " + size);
            }
        }
    }

    @Test
    @DisplayName("Carton sizes too fine for the stored scale are rejected")
    void testPiecesPerUnitAboveLimit() {
        assertEquals(999_999, UnitConverter.MAX_PIECES_PER_UNIT);
        assertThrows(InvalidUnitInputException.class, () -> UnitConverter.toQuantity(0, 1, 1_000_000));
        assertThrows(InvalidUnitInputException.class, () -> UnitConverter.toQuantity(0, 1, 1_500_000));
        assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.fromQuantity(new BigDecimal("0.000001"), 1_500_000));
        assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.resolveLineQuantity(null, 0L, 1, 2_000_000));
    }

    @Test
    @DisplayName("A piece rounding up to a full carton carries over")
    void testFromQuantityCarry() {
        CartonBreakdown breakdown = UnitConverter.fromQuantity(new BigDecimal("1.99"), 12);
        assertEquals(2, breakdown.getCartons());
        assertEquals(0, breakdown.getPieces());
    }

    @Test
    @DisplayName("A line quantity is given as a decimal or as cartons/pieces, never both")
    void testResolveLineQuantity() {
        assertEquals(0, new BigDecimal("0.75").compareTo(
            UnitConverter.resolveLineQuantity(new BigDecimal("0.75"), null, null, 1)));
        assertEquals(0, new BigDecimal("1.25").compareTo(
            UnitConverter.resolveLineQuantity(null, 1L, 6, 24)));
        assertEquals(0, new BigDecimal("0.5").compareTo(
            UnitConverter.resolveLineQuantity(null, null, 12, 24)));

        assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.resolveLineQuantity(BigDecimal.ONE, 1L, null, 24));
        assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.resolveLineQuantity(null, null, null, 24));
        assertThrows(InvalidUnitInputException.class,
            () -> UnitConverter.resolveLineQuantity(new BigDecimal("-1"), null, null, 1));
    }

    @Test
    @DisplayName("Half-step snapping is available but separate from conversion")
    void testSnapToHalfStep() {
        assertEquals(0, new BigDecimal("1.5").compareTo(UnitConverter.snapToHalfStep(new BigDecimal("1.4"))));
        assertEquals(0, new BigDecimal("2.0").compareTo(UnitConverter.snapToHalfStep(new BigDecimal("1.8"))));
        assertEquals(0, new BigDecimal("1.2").compareTo(
            UnitConverter.resolveLineQuantity(new BigDecimal("1.2"), null, null, 1)));
    }
}

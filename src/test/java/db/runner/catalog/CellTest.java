package db.runner.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class CellTest {

    @Test
    void unsignedDigitStringsAreIntegers() {
        Cell c = Cell.infer("42");
        assertEquals(DataType.INTEGER, c.type());
        assertEquals(BigInteger.valueOf(42), c.value());
        assertEquals("42", c.toString());
    }

    @Test
    void leadingZerosRenderAsWrittenButCompareNumerically() {
        Cell zip = Cell.infer("007");
        assertEquals("007", zip.toString());
        assertEquals(Cell.infer("7"), zip);
        assertEquals(Cell.infer("7").hashCode(), zip.hashCode());
        assertEquals(0, zip.compareTo(Cell.ofInteger(7)));
        assertTrue(zip.compareTo(Cell.infer("10")) < 0);
    }

    @Test
    void integersBeyondLongRangeStayExact() {
        String big = "123456789012345678901234567890";
        Cell c = Cell.infer(big);
        assertTrue(c.isInteger());
        assertEquals(big, c.toString());
    }

    // Numeric inference is deliberately literal: signs and decimal points keep a value TEXT.
    @Test
    void negativeAndDecimalNumbersStayText() {
        assertEquals(DataType.TEXT, Cell.infer("-5").type());
        assertEquals(DataType.TEXT, Cell.infer("1.5").type());
        assertEquals(DataType.TEXT, Cell.infer("+3").type());
        assertEquals(DataType.TEXT, Cell.infer("").type());
        assertEquals(DataType.TEXT, Cell.infer(" 1").type());
    }

    @Test
    void textNumbersCompareLexicographically() {
        // "-10" < "-2" as text; numerically it would be the other way round
        assertTrue(Cell.infer("-10").compareTo(Cell.infer("-2")) < 0);
        assertTrue(Cell.infer("10").compareTo(Cell.infer("9")) > 0);
    }

    @Test
    void integerAndTextWithSameSpellingAreNotEqual() {
        assertNotEquals(Cell.infer("1"), Cell.ofText("1"));
    }

    @Test
    void mixedTypesOrderIntegersFirst() {
        List<Cell> cells = new ArrayList<>(List.of(Cell.ofText("a"), Cell.ofInteger(5), Cell.ofText("0"), Cell.ofInteger(-1)));
        Collections.sort(cells);
        assertEquals(List.of(Cell.ofInteger(-1), Cell.ofInteger(5), Cell.ofText("0"), Cell.ofText("a")), cells);
    }

    @Test
    void constructorRejectsMismatchedValue() {
        assertThrows(IllegalArgumentException.class, () -> new Cell(DataType.INTEGER, "12"));
        assertThrows(IllegalArgumentException.class, () -> new Cell(DataType.TEXT, BigInteger.ONE));
    }
}

package com.example.routines.docgen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UnitConverterTest {
    private static final double DELTA = 0.001;

    @Test
    public void testBareNumbersAreMillimetres() {
        assertEquals(56.693, UnitConverter.toPoints(20, 0), DELTA);
        assertEquals(56.693, UnitConverter.toPoints("20", 0), DELTA);
        assertEquals(56.693, UnitConverter.toPoints("20mm", 0), DELTA);
    }

    @Test
    public void testUnitSuffixes() {
        assertEquals(72, UnitConverter.toPoints("1in", 0), DELTA);
        assertEquals(72, UnitConverter.toPoints("2.54cm", 0), DELTA);
        assertEquals(10, UnitConverter.toPoints("10pt", 0), DELTA);
        assertEquals(72, UnitConverter.toPoints(" 1 IN ", 0), DELTA);
    }

    @Test
    public void testMissingValueUsesFallback() {
        assertEquals(UnitConverter.mm(40), UnitConverter.toPoints(null, 40), DELTA);
    }

    @Test
    public void testUnparseableValueIsZero() {
        assertEquals(0, UnitConverter.toPoints("wide", 40), DELTA);
        assertFalse(UnitConverter.parse("wide").isPresent());
        assertFalse(UnitConverter.parse("12furlongs").isPresent());
    }
}

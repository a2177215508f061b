package com.stationery.tracker.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhoneNumbersTest {

    @Test
    void localNumber_ShouldGetCountryCode() {
        assertEquals("+255712345678", PhoneNumbers.toInternational("0712 345 678", "+255"));
    }

    @Test
    void internationalNumber_ShouldBeKept() {
        assertEquals("+254700111222", PhoneNumbers.toInternational("+254-700-111-222", "+255"));
    }

    @Test
    void numberWithoutPlus_ShouldGetOne() {
        assertEquals("+255712345678", PhoneNumbers.toInternational("255712345678", "+255"));
    }

    @Test
    void blankNumber_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> PhoneNumbers.toInternational("  ", "+255"));
        assertThrows(IllegalArgumentException.class, () -> PhoneNumbers.toInternational(null, "+255"));
    }
}

package com.kgbio.lookup.model;

import com.kgbio.lookup.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.Year;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class YearFilterTest {

    @Test
    public void acceptsRangeBounds() {
        assertEquals(1000, YearFilter.of(1000).year().getAsInt());
        int now = Year.now().getValue();
        assertEquals(now, YearFilter.of(now).year().getAsInt());
    }

    @Test
    public void rejectsOutOfRange() {
        assertThrows(ValidationException.class, () -> YearFilter.of(999));
        assertThrows(ValidationException.class, () -> YearFilter.of(Year.now().getValue() + 1));
    }

    @Test
    public void upperBoundFollowsClock() {
        Clock clock = Clock.fixed(Instant.parse("2020-06-01T00:00:00Z"), ZoneOffset.UTC);
        assertEquals(2020, YearFilter.of(2020, clock).year().getAsInt());
        assertThrows(ValidationException.class, () -> YearFilter.of(2021, clock));
    }

    @Test
    public void nullMeansCurrent() {
        assertTrue(YearFilter.ofNullable(null).isCurrent());
        assertTrue(YearFilter.ofNullable(null).year().isEmpty());
        assertFalse(YearFilter.ofNullable(2017).isCurrent());
    }
}

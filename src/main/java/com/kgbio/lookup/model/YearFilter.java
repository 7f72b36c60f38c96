package com.kgbio.lookup.model;

import com.kgbio.lookup.exception.ValidationException;

import java.time.Clock;
import java.time.Year;
import java.util.OptionalInt;

/**
 * Year a statement must overlap. {@link #current()} leaves the year to the query service's own
 * clock at execution time; a fixed year must lie in {@code [1000, current year]}.
 */
public final class YearFilter {
    public static final int MIN_YEAR = 1000;

    private static final YearFilter CURRENT = new YearFilter(null);

    private final Integer year;

    private YearFilter(Integer year) {
        this.year = year;
    }

    public static YearFilter current() {
        return CURRENT;
    }

    public static YearFilter of(int year) {
        return of(year, Clock.systemDefaultZone());
    }

    public static YearFilter of(int year, Clock clock) {
        int max = Year.now(clock).getValue();
        if (year < MIN_YEAR || year > max) {
            throw new ValidationException("invalid year: " + year + ", expected range " + MIN_YEAR + ".." + max);
        }
        return new YearFilter(year);
    }

    /** Null maps to {@link #current()}. */
    public static YearFilter ofNullable(Integer year) {
        return year == null ? current() : of(year);
    }

    public boolean isCurrent() { return year == null; }

    public OptionalInt year() {
        return year == null ? OptionalInt.empty() : OptionalInt.of(year);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof YearFilter other)) return false;
        return year == null ? other.year == null : year.equals(other.year);
    }

    @Override
    public int hashCode() { return year == null ? 0 : year; }

    @Override
    public String toString() { return year == null ? "current" : String.valueOf(year); }
}

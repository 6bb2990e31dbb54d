package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.TestFixtures;
import io.github.cyfko.reportql.core.exception.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.Period;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DateRanges Tests")
class DateRangesTest {

    @Test
    @DisplayName("Should recognize relative expressions")
    void shouldRecognizeRelativeExpressions() {
        assertTrue(DateRanges.isRelative("today"));
        assertTrue(DateRanges.isRelative("yesterday"));
        assertTrue(DateRanges.isRelative("30daysAgo"));
        assertFalse(DateRanges.isRelative("2020-01-01"));
        assertFalse(DateRanges.isRelative(null));
    }

    @Test
    @DisplayName("Should normalize expressions to their wire form")
    void shouldNormalize() {
        assertEquals("today", DateRanges.normalize(" Today "));
        assertEquals("7daysAgo", DateRanges.normalize("7DAYSAGO"));
        assertEquals("2020-02-29", DateRanges.normalize("2020-02-29"));
    }

    @Test
    @DisplayName("Should reject anything that is not a date")
    void shouldRejectGarbage() {
        assertThrows(QueryValidationException.class, () -> DateRanges.normalize("last week"));
        assertThrows(QueryValidationException.class, () -> DateRanges.normalize("2020-02-30"));
        assertThrows(QueryValidationException.class, () -> DateRanges.normalize(""));
    }

    @Test
    @DisplayName("Should resolve relative expressions against the clock")
    void shouldResolveRelativeExpressions() {
        assertEquals(LocalDate.of(2020, 3, 15), DateRanges.resolve("today", TestFixtures.CLOCK));
        assertEquals(LocalDate.of(2020, 3, 14), DateRanges.resolve("yesterday", TestFixtures.CLOCK));
        assertEquals(LocalDate.of(2020, 3, 5), DateRanges.resolve("10daysAgo", TestFixtures.CLOCK));
    }

    @Test
    @DisplayName("Should keep relative expressions when no duration is given")
    void shouldKeepRelativeExpressions() {
        // When
        DateRanges.DateRange range = DateRanges.range("30daysAgo", null, null, TestFixtures.CLOCK);

        // Then
        assertEquals(new DateRanges.DateRange("30daysAgo", "today"), range);
    }

    @Test
    @DisplayName("Should resolve the start when a duration is added")
    void shouldResolveStartForDurations() {
        // When
        DateRanges.DateRange range = DateRanges.range("yesterday", null, Period.ofDays(2), TestFixtures.CLOCK);

        // Then
        assertEquals(new DateRanges.DateRange("2020-03-14", "2020-03-15"), range);
    }

    @Test
    @DisplayName("Should order the range of a negative duration")
    void shouldOrderNegativeDurations() {
        // When
        DateRanges.DateRange range = DateRanges.range("2020-01-31", null, Period.ofDays(-7), TestFixtures.CLOCK);

        // Then
        assertEquals(new DateRanges.DateRange("2020-01-25", "2020-01-31"), range);
    }

    @Test
    @DisplayName("Should count mixed-sign durations as past ones")
    void shouldShortenMixedSignDurations() {
        // When
        DateRanges.DateRange range = DateRanges.range("2020-01-01", null, Period.of(0, 1, -5), TestFixtures.CLOCK);

        // Then
        assertEquals(new DateRanges.DateRange("2020-01-01", "2020-01-28"), range);
    }

    @Test
    @DisplayName("Should span whole months when only months are given")
    void shouldSpanWholeMonths() {
        assertEquals(new DateRanges.DateRange("2014-01-01", "2014-01-31"),
                DateRanges.range("2014-01-01", null, Period.ofMonths(1), TestFixtures.CLOCK));
        assertEquals(new DateRanges.DateRange("2020-01-01", "2020-01-31"),
                DateRanges.range("2020-01-31", null, Period.ofMonths(-1), TestFixtures.CLOCK));
    }

    @Test
    @DisplayName("Should reject day counts that do not fit a date")
    void shouldRejectOverflowingDayCounts() {
        QueryValidationException exception = assertThrows(QueryValidationException.class,
                () -> DateRanges.normalize("99999999999daysAgo"));

        assertTrue(exception.getMessage().startsWith("Invalid date: 99999999999daysAgo"));
    }

    @Test
    @DisplayName("Should reject a stop date together with a duration")
    void shouldRejectStopAndDuration() {
        assertThrows(QueryValidationException.class,
                () -> DateRanges.range("2020-01-01", "2020-01-31", Period.ofDays(3), TestFixtures.CLOCK));
    }
}

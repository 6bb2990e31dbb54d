package io.github.cyfko.reportql.core.api;

import io.github.cyfko.reportql.core.exception.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Selector Tests")
class SelectorTest {

    @ParameterizedTest
    @CsvSource({
            "eq, ==",
            "ne, !=",
            "gt, >",
            "lt, <",
            "gte, >=",
            "lte, <=",
            "contains, =@",
            "ncontains, !@",
            "re, =~",
            "nre, !~"
    })
    @DisplayName("Should resolve every selector by code and by symbol")
    void shouldResolveByCodeAndSymbol(String code, String symbol) {
        // When
        Selector byCode = Selector.fromString(code);
        Selector bySymbol = Selector.fromString(symbol);

        // Then
        assertSame(byCode, bySymbol);
        assertEquals(symbol, byCode.getSymbol());
    }

    @Test
    @DisplayName("Should ignore the case of codes")
    void shouldIgnoreCase() {
        assertEquals(Selector.GTE, Selector.fromString("GTE"));
    }

    @Test
    @DisplayName("Should reject unknown selectors")
    void shouldRejectUnknown() {
        QueryValidationException exception = assertThrows(QueryValidationException.class,
                () -> Selector.fromString("like"));

        assertEquals("like is not a valid selector. Choose from: " + Selector.codes(), exception.getMessage());
    }

    @Test
    @DisplayName("Should render dates in basic ISO format")
    void shouldRenderDates() {
        assertEquals("ga:date>=20200101", Selector.GTE.apply("ga:date", LocalDate.of(2020, 1, 1)));
    }

    @Test
    @DisplayName("Should escape backslashes before separators")
    void shouldEscapeBackslashes() {
        assertEquals("a\\\\\\,b", Selector.render("a\\,b"));
    }
}

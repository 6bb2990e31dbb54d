package io.github.cyfko.reportql.core.query;

import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date expressions understood by the reporting service.
 * <p>
 * Two kinds of expressions are accepted:
 * </p>
 * <ul>
 *   <li><strong>absolute</strong>: ISO dates, {@code 2020-01-31}</li>
 *   <li><strong>relative</strong>: {@code today}, {@code yesterday} and {@code NdaysAgo}</li>
 * </ul>
 * <p>
 * Relative expressions are sent as is; the service resolves them when the request runs.
 * They are only resolved locally when a duration has to be added to them.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DateRanges {

    public static final String TODAY = "today";
    public static final String YESTERDAY = "yesterday";

    private static final Pattern DAYS_AGO = Pattern.compile("(\\d+)daysago");

    private DateRanges() {
    }

    /**
     * Resolved start and stop of a date range, as wire expressions.
     *
     * @param start start date expression
     * @param stop  stop date expression
     */
    public record DateRange(String start, String stop) {
    }

    /**
     * @param expression date expression
     * @return {@code true} for {@code today}, {@code yesterday} and {@code NdaysAgo}
     */
    public static boolean isRelative(String expression) {
        if (expression == null) {
            return false;
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);
        return TODAY.equals(normalized) || YESTERDAY.equals(normalized) || DAYS_AGO.matcher(normalized).matches();
    }

    /**
     * Validates a date expression and brings it into its canonical wire form.
     *
     * @param expression ISO date or relative expression
     * @return e.g. {@code 2020-01-31} or {@code 7daysAgo}
     * @throws QueryValidationException if the expression is not a date
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new QueryValidationException("A date is required. Use yyyy-MM-dd, today, yesterday or NdaysAgo.");
        }
        String normalized = expression.trim().toLowerCase(Locale.ROOT);
        if (TODAY.equals(normalized) || YESTERDAY.equals(normalized)) {
            return normalized;
        }
        Matcher daysAgo = DAYS_AGO.matcher(normalized);
        if (daysAgo.matches()) {
            try {
                return Integer.parseInt(daysAgo.group(1)) + "daysAgo";
            } catch (NumberFormatException e) {
                throw new QueryValidationException("Invalid date: " + expression + ". Too many days ago.", e);
            }
        }
        return parse(expression.trim()).toString();
    }

    /**
     * Resolves a date expression into a calendar day.
     *
     * @param expression ISO date or relative expression
     * @param clock      clock giving "today"
     * @return the calendar day
     * @throws QueryValidationException if the expression is not a date
     */
    public static LocalDate resolve(String expression, Clock clock) {
        String normalized = normalize(expression);
        LocalDate today = LocalDate.now(clock);
        if (TODAY.equals(normalized)) {
            return today;
        }
        if (YESTERDAY.equals(normalized)) {
            return today.minusDays(1);
        }
        Matcher daysAgo = DAYS_AGO.matcher(normalized.toLowerCase(Locale.ROOT));
        if (daysAgo.matches()) {
            return today.minusDays(Long.parseLong(daysAgo.group(1)));
        }
        return LocalDate.parse(normalized);
    }

    /**
     * Computes the date range of a query.
     * <p>
     * Without a stop date and a duration, the range ends {@code today}. A duration counts the
     * start day in: {@code days = 1} is the start day alone. Negative durations reach into
     * the past, and the resulting pair is ordered. A duration with a negative month or day
     * part counts as a past one: {@code months = 1, days = -5} ends one month and four days
     * after the start.
     * </p>
     *
     * @param start    start date expression
     * @param stop     stop date expression, may be {@code null}
     * @param duration duration, may be {@code null} or zero
     * @param clock    clock used to resolve a relative start when a duration is given
     * @return the range
     * @throws QueryValidationException on malformed dates, or when both a stop date and a duration are given
     */
    public static DateRange range(String start, String stop, Period duration, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        boolean hasDuration = duration != null && !duration.isZero();

        if (hasDuration && stop != null) {
            throw new QueryValidationException("Specify either a stop date or a duration, not both.");
        }

        if (!hasDuration) {
            return new DateRange(normalize(start), stop == null ? TODAY : normalize(stop));
        }

        // the start day counts: one day less forward, one day less backward
        boolean past = duration.getDays() < 0 || duration.toTotalMonths() < 0;
        Period inclusive = Period.of(0, (int) duration.toTotalMonths(), duration.getDays() + (past ? 1 : -1));

        LocalDate from = resolve(start, clock);
        LocalDate to = from.plus(inclusive);

        return to.isBefore(from)
                ? new DateRange(to.toString(), from.toString())
                : new DateRange(from.toString(), to.toString());
    }

    private static LocalDate parse(String expression) {
        try {
            return LocalDate.parse(expression);
        } catch (DateTimeParseException e) {
            throw new QueryValidationException(
                    "Invalid date: " + expression + ". Use yyyy-MM-dd, today, yesterday or NdaysAgo.", e);
        }
    }
}

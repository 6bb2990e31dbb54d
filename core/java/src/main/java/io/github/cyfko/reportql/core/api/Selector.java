package io.github.cyfko.reportql.core.api;

import io.github.cyfko.reportql.core.exception.QueryValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Comparison operators understood by the reporting service in filter and segment
 * expressions.
 * <p>
 * Each selector has a short code, used in keyword selections such as
 * {@code sessions__gt}, and the wire symbol placed between the column identifier and
 * the value in the compiled expression.
 * </p>
 *
 * <ul>
 *     <li>EQ / ==</li>
 *     <li>NE / !=</li>
 *     <li>GT / &gt;</li>
 *     <li>LT / &lt;</li>
 *     <li>GTE / &gt;=</li>
 *     <li>LTE / &lt;=</li>
 *     <li>CONTAINS / =@</li>
 *     <li>NCONTAINS / !@</li>
 *     <li>RE / =~</li>
 *     <li>NRE / !~</li>
 * </ul>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Selector gt = Selector.fromString("gt");
 * String expression = gt.apply("ga:sessions", 10);   // "ga:sessions>10"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Selector {

    /** Exact match: "==" */
    EQ("eq", "=="),

    /** Does not match: "!=" */
    NE("ne", "!="),

    /** Greater than: "&gt;" */
    GT("gt", ">"),

    /** Less than: "&lt;" */
    LT("lt", "<"),

    /** Greater than or equal: "&gt;=" */
    GTE("gte", ">="),

    /** Less than or equal: "&lt;=" */
    LTE("lte", "<="),

    /** Contains substring: "=@" */
    CONTAINS("contains", "=@"),

    /** Does not contain substring: "!@" */
    NCONTAINS("ncontains", "!@"),

    /** Matches regular expression: "=~" */
    RE("re", "=~"),

    /** Does not match regular expression: "!~" */
    NRE("nre", "!~");

    private final String code;
    private final String symbol;

    Selector(String code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    /**
     * Returns the keyword code of this selector, e.g. {@code "gt"}.
     *
     * @return the lower-case code
     */
    public String getCode() {
        return code;
    }

    /**
     * Returns the wire symbol of this selector, e.g. {@code ">"}.
     *
     * @return the symbol inserted between column and value
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Compiles one {@code (column, this, value)} triple into a wire expression.
     *
     * @param columnId the wire identifier of the column, e.g. {@code ga:sessions}
     * @param value    the operand, rendered with {@link #render(Object)}
     * @return the compiled expression
     */
    public String apply(String columnId, Object value) {
        return columnId + symbol + render(value);
    }

    /**
     * Finds a selector by code or symbol, ignoring case.
     *
     * @param value code ({@code gt}) or symbol ({@code >})
     * @return the matching selector
     * @throws QueryValidationException if nothing matches; the message enumerates valid selectors
     */
    public static Selector fromString(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (Selector selector : values()) {
                if (selector.code.equalsIgnoreCase(trimmed) || selector.symbol.equals(trimmed)) {
                    return selector;
                }
            }
        }
        throw new QueryValidationException(
                value + " is not a valid selector. Choose from: " + codes());
    }

    /**
     * Comma-separated list of every selector code, in declaration order.
     *
     * @return e.g. {@code "eq, ne, gt, ..."}
     */
    public static String codes() {
        return Arrays.stream(values()).map(Selector::getCode).collect(Collectors.joining(", "));
    }

    /**
     * Renders an operand for the expression grammar. Commas, semicolons and
     * backslashes are escaped with a backslash since they are separators on the wire.
     *
     * @param value operand; {@link LocalDate} renders as {@code yyyyMMdd}
     * @return the escaped operand
     */
    public static String render(Object value) {
        String text;
        if (value instanceof LocalDate date) {
            text = date.format(DateTimeFormatter.BASIC_ISO_DATE);
        } else if (value instanceof Enum<?> constant) {
            text = constant.name().toLowerCase(Locale.ROOT);
        } else {
            text = String.valueOf(value);
        }
        return text.replace("\\", "\\\\").replace(",", "\\,").replace(";", "\\;");
    }
}

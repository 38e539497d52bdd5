package io.refdata.dataset;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Target types a raw cell can be coerced to. Null and blank strings become null cells for every type.
 */
public enum ColumnType {
    DATE,
    TIMESTAMP,
    INTEGER,
    FLOAT,
    STRING;

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    public static ColumnType of(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Coerces a raw value (JSON scalar or CSV text) into this type.
     *
     * @throws SchemaException when a non-blank value cannot be represented
     */
    public Object parse(Object raw, String column) throws SchemaException {
        if (raw == null) return null;
        if (raw instanceof String s && s.isBlank() && this != STRING) return null;
        try {
            return switch (this) {
                case DATE -> raw instanceof LocalDate d ? d : LocalDate.parse(raw.toString().trim(), DATE_FORMAT);
                case TIMESTAMP -> raw instanceof LocalDateTime t ? t : LocalDateTime.parse(raw.toString().trim());
                case INTEGER -> toLong(raw);
                case FLOAT -> raw instanceof Number n ? n.doubleValue() : Double.parseDouble(raw.toString().trim());
                case STRING -> raw.toString();
            };
        } catch (DateTimeParseException | NumberFormatException | ArithmeticException e) {
            throw new SchemaException("column " + column + ": cannot read '" + raw + "' as " + label(), e);
        }
    }

    /** Text form used by the CSV codec; the inverse of {@link #parse}. */
    public String format(Object value) {
        if (value == null) return null;
        return switch (this) {
            case DATE, TIMESTAMP, INTEGER, STRING -> value.toString();
            case FLOAT -> Double.toString(((Number) value).doubleValue());
        };
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long l) return l;
        if (raw instanceof Integer i) return i.longValue();
        // 12.0 is accepted, 12.5 is not
        return new BigDecimal(raw.toString().trim()).longValueExact();
    }
}

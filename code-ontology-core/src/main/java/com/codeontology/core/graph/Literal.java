package com.codeontology.core.graph;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Typed literal value.
 *
 * @param lexicalForm lexical representation of the value
 * @param datatype XML Schema datatype
 */
public record Literal(String lexicalForm, XsdDatatype datatype) implements RdfTerm {

    /**
     * Compact constructor with validation.
     */
    public Literal {
        Objects.requireNonNull(lexicalForm, "lexicalForm must not be null");
        Objects.requireNonNull(datatype, "datatype must not be null");
        if (datatype == XsdDatatype.NON_NEGATIVE_INTEGER && Long.parseLong(lexicalForm) < 0) {
            throw new IllegalArgumentException("nonNegativeInteger must be >= 0, got " + lexicalForm);
        }
        if (datatype == XsdDatatype.POSITIVE_INTEGER && Long.parseLong(lexicalForm) < 1) {
            throw new IllegalArgumentException("positiveInteger must be >= 1, got " + lexicalForm);
        }
    }

    public static Literal string(String value) {
        return new Literal(value, XsdDatatype.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(Long.toString(value), XsdDatatype.INTEGER);
    }

    public static Literal integer(BigInteger value) {
        return new Literal(value.toString(), XsdDatatype.INTEGER);
    }

    public static Literal nonNegative(long value) {
        return new Literal(Long.toString(value), XsdDatatype.NON_NEGATIVE_INTEGER);
    }

    public static Literal positive(long value) {
        return new Literal(Long.toString(value), XsdDatatype.POSITIVE_INTEGER);
    }

    public static Literal decimal(double value) {
        return new Literal(Double.toString(value), XsdDatatype.DOUBLE);
    }

    public static Literal bool(boolean value) {
        return new Literal(Boolean.toString(value), XsdDatatype.BOOLEAN);
    }

    public static Literal date(LocalDate value) {
        return new Literal(value.format(DateTimeFormatter.ISO_LOCAL_DATE), XsdDatatype.DATE);
    }

    public static Literal dateTime(OffsetDateTime value) {
        return new Literal(value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), XsdDatatype.DATE_TIME);
    }

    /**
     * Converts a Java value to a literal with its natural datatype.
     *
     * <p>Integral numbers map to xsd:integer, floating point to xsd:double, booleans to
     * xsd:boolean, dates to xsd:date/xsd:dateTime and everything else to xsd:string.
     *
     * @param value value to convert
     * @return typed literal
     */
    public static Literal of(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return integer(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return integer(big);
        }
        if (value instanceof Double || value instanceof Float) {
            return decimal(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof LocalDate d) {
            return date(d);
        }
        if (value instanceof OffsetDateTime dt) {
            return dateTime(dt);
        }
        return string(String.valueOf(value));
    }

    @Override
    public String toNTriples() {
        String quoted = "\"" + escape(lexicalForm) + "\"";
        if (datatype == XsdDatatype.STRING) {
            return quoted;
        }
        return quoted + "^^" + datatype.iri().toNTriples();
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}

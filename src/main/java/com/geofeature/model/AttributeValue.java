package com.geofeature.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

/**
 * Attribute value held in a feature slot: null, boolean, integer, double or string.
 * Instances are immutable.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AttributeValue {

    public enum Type {
        NULL,
        BOOLEAN,
        INTEGER,
        DOUBLE,
        STRING
    }

    /**
     * The default value of every unset slot
     */
    public static final AttributeValue NULL = new AttributeValue(Type.NULL, null);

    private static final AttributeValue TRUE = new AttributeValue(Type.BOOLEAN, Boolean.TRUE);
    private static final AttributeValue FALSE = new AttributeValue(Type.BOOLEAN, Boolean.FALSE);

    private final Type type;
    private final Object value;

    public static AttributeValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static AttributeValue of(long value) {
        return new AttributeValue(Type.INTEGER, value);
    }

    public static AttributeValue of(double value) {
        return new AttributeValue(Type.DOUBLE, value);
    }

    public static AttributeValue of(String value) {
        return value == null ? NULL : new AttributeValue(Type.STRING, value);
    }

    /**
     * Convert a plain Java object into an attribute value
     */
    public static AttributeValue of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof AttributeValue) {
            return (AttributeValue) value;
        }
        if (value instanceof Boolean) {
            return of(((Boolean) value).booleanValue());
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence) {
            return of(value.toString());
        }
        throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
    }

    public boolean isNull() {
        return type == Type.NULL;
    }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.DOUBLE;
    }

    /**
     * Get value as String, empty for null
     */
    public String asString() {
        return toString();
    }

    /**
     * Get value as long. Doubles are truncated, unparseable strings and null give 0.
     */
    public long asLong() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value ? 1L : 0L;
            case INTEGER:
                return (Long) value;
            case DOUBLE:
                return (long) ((Double) value).doubleValue();
            case STRING:
                try {
                    return Long.parseLong(((String) value).trim());
                } catch (NumberFormatException e) {
                    return (long) asDouble();
                }
            default:
                return 0L;
        }
    }

    /**
     * Get value as double. Unparseable strings and null give 0.
     */
    public double asDouble() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value ? 1.0 : 0.0;
            case INTEGER:
                return ((Long) value).doubleValue();
            case DOUBLE:
                return (Double) value;
            case STRING:
                try {
                    return Double.parseDouble(((String) value).trim());
                } catch (NumberFormatException e) {
                    return 0.0;
                }
            default:
                return 0.0;
        }
    }

    /**
     * Get value as boolean. Numbers are true when non-zero, strings when non-empty.
     */
    public boolean asBoolean() {
        switch (type) {
            case BOOLEAN:
                return (Boolean) value;
            case INTEGER:
                return (Long) value != 0L;
            case DOUBLE:
                return (Double) value != 0.0;
            case STRING:
                return !((String) value).isEmpty();
            default:
                return false;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeValue)) return false;
        AttributeValue other = (AttributeValue) o;

        // 100 and 100.0 are the same attribute value
        if (isNumeric() && other.isNumeric()) {
            if (type == Type.INTEGER && other.type == Type.INTEGER) {
                return value.equals(other.value);
            }
            if (type == Type.DOUBLE && other.type == Type.DOUBLE) {
                double a = (Double) value;
                double b = (Double) other.value;
                return a == b || Double.compare(a, b) == 0;
            }
            double d = type == Type.DOUBLE ? (Double) value : (Double) other.value;
            long l = type == Type.INTEGER ? (Long) value : (Long) other.value;
            return isExactLong(d) && (long) d == l;
        }
        if (type != other.type) return false;
        return type == Type.NULL || value.equals(other.value);
    }

    // integral and inside the long range, so the cast to long is exact
    private static boolean isExactLong(double d) {
        return d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
    }

    @Override
    public int hashCode() {
        if (type == Type.INTEGER) {
            return Long.hashCode((Long) value);
        }
        if (type == Type.DOUBLE) {
            double d = (Double) value;
            return isExactLong(d) ? Long.hashCode((long) d) : Double.hashCode(d);
        }
        return type == Type.NULL ? 0 : value.hashCode();
    }

    @Override
    public String toString() {
        switch (type) {
            case NULL:
                return "";
            case DOUBLE:
                return formatDouble((Double) value);
            default:
                return value.toString();
        }
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        if (d == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}

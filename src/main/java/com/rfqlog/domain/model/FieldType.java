package com.rfqlog.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Serialization rules for tracked fields.
 * Every rule maps a typed value to a canonical string that is stable across runs and locales;
 * {@code null} always maps to {@link #EMPTY}.
 */
public enum FieldType {

    TEXT {
        @Override
        protected String serializeValue(Object value, List<String> allowedValues) {
            if (!(value instanceof CharSequence)) {
                throw new IllegalArgumentException("expected text but got " + typeName(value));
            }
            return value.toString().strip();
        }
    },

    DECIMAL {
        @Override
        protected String serializeValue(Object value, List<String> allowedValues) {
            BigDecimal decimal = toBigDecimal(value);
            try {
                BigDecimal normalized = decimal.stripTrailingZeros();
                if (normalized.scale() < 1) {
                    normalized = normalized.setScale(1);
                }
                return normalized.toPlainString();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("number out of range: " + abbreviate(value));
            }
        }

        @Override
        public boolean isUnset(String canonical) {
            return super.isUnset(canonical) || new BigDecimal(canonical).signum() == 0;
        }
    },

    INTEGER {
        @Override
        protected String serializeValue(Object value, List<String> allowedValues) {
            BigDecimal decimal = toBigDecimal(value);
            try {
                return decimal.toBigIntegerExact().toString();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("expected a whole number but got " + abbreviate(value));
            }
        }

        @Override
        public boolean isUnset(String canonical) {
            return super.isUnset(canonical) || new BigInteger(canonical).signum() == 0;
        }
    },

    BOOLEAN {
        @Override
        protected String serializeValue(Object value, List<String> allowedValues) {
            if (value instanceof Boolean) {
                return value.toString();
            }
            if (value instanceof CharSequence) {
                String text = value.toString().strip();
                if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                    return text.toLowerCase(Locale.ROOT);
                }
            }
            throw new IllegalArgumentException("expected true or false but got " + value);
        }
    },

    CHOICE {
        @Override
        protected String serializeValue(Object value, List<String> allowedValues) {
            String candidate;
            if (value instanceof Enum<?>) {
                candidate = ((Enum<?>) value).name();
            } else if (value instanceof CharSequence) {
                candidate = value.toString().strip();
            } else {
                throw new IllegalArgumentException("expected one of " + allowedValues + " but got " + typeName(value));
            }
            for (String allowed : allowedValues) {
                if (allowed.equalsIgnoreCase(candidate)) {
                    return allowed;
                }
            }
            throw new IllegalArgumentException("expected one of " + allowedValues + " but got " + candidate);
        }
    };

    /** Canonical form of a missing value */
    public static final String EMPTY = "";

    /** Longest canonical value the revision log can hold */
    public static final int MAX_LENGTH = 4000;

    /**
     * Serialize a value to its canonical form
     * @param value the typed value, may be null
     * @param allowedValues permitted values for {@link #CHOICE}, ignored otherwise
     * @return canonical string, never null
     * @throws IllegalArgumentException if the value cannot be represented by this type
     */
    public String serialize(Object value, List<String> allowedValues) {
        if (value == null) {
            return EMPTY;
        }
        return serializeValue(value, allowedValues);
    }

    protected abstract String serializeValue(Object value, List<String> allowedValues);

    /**
     * Whether a canonical value counts as "not filled in" when a record is first created
     */
    public boolean isUnset(String canonical) {
        return canonical == null || canonical.isEmpty();
    }

    private static BigDecimal toBigDecimal(Object value) {
        return checkMagnitude(parseNumber(value), value);
    }

    // Plain notation of the number must fit into MAX_LENGTH characters
    private static BigDecimal checkMagnitude(BigDecimal decimal, Object value) {
        long integerDigits = (long) decimal.precision() - decimal.scale();
        if (integerDigits > MAX_LENGTH || decimal.scale() > MAX_LENGTH) {
            throw new IllegalArgumentException("number out of range: " + abbreviate(value));
        }
        return decimal;
    }

    private static String abbreviate(Object value) {
        String text = value.toString();
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }

    private static BigDecimal parseNumber(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("expected a finite number but got " + value);
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof CharSequence) {
            try {
                return new BigDecimal(value.toString().strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("expected a number but got '" + value + "'");
            }
        }
        throw new IllegalArgumentException("expected a number but got " + typeName(value));
    }

    private static String typeName(Object value) {
        return value.getClass().getSimpleName();
    }
}

package io.murt;

import java.math.BigInteger;

/**
 * A runtime parameter value, classified by how it can be written into a query string.
 * <ul>
 *     <li>{@link Text} - JSON strings, used as-is</li>
 *     <li>{@link Whole} - JSON integers, written as decimal text</li>
 *     <li>{@link Other} - everything else (booleans, fractions, nulls, arrays and objects), which cannot be
 *     used as a query parameter</li>
 * </ul>
 */
public abstract class ParamValue {

    private ParamValue() {
    }

    /**
     * Classifies a value produced by the JSON parser
     *
     * @param value A string, number, boolean, list, map or null
     * @return The classified value
     */
    public static ParamValue of(Object value) {
        if (value instanceof String) {
            return new Text((String) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new Whole(BigInteger.valueOf(((Number) value).longValue()));
        }
        if (value instanceof BigInteger) {
            return new Whole((BigInteger) value);
        }
        return new Other(value);
    }

    /**
     * @param name The parameter name, used in the error message
     * @return The value as it should appear in a query string, before URL encoding
     * @throws InvalidParameterException if the value has no query string form
     */
    public abstract String toQueryText(String name) throws InvalidParameterException;

    /**
     * A string value
     */
    public static final class Text extends ParamValue {
        private final String value;

        Text(String value) {
            this.value = value;
        }

        @Override
        public String toQueryText(String name) {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * An integral number of any size
     */
    public static final class Whole extends ParamValue {
        private final BigInteger value;

        Whole(BigInteger value) {
            this.value = value;
        }

        @Override
        public String toQueryText(String name) {
            return value.toString();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * A value of any other JSON type
     */
    public static final class Other extends ParamValue {
        private final Object value;

        Other(Object value) {
            this.value = value;
        }

        @Override
        public String toQueryText(String name) throws InvalidParameterException {
            String type = value == null ? "null" : value.getClass().getSimpleName();
            throw new InvalidParameterException(name, "Parameter '" + name + "' must be a string or an integer to be sent as a query parameter but was " + type);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }
}

package com.williamcallahan.llmrouter.domain;

import java.util.List;

/**
 * JSON value shapes accepted for optional request parameters.
 */
public enum ParameterValueKind {
    NUMBER {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Number number && Double.isFinite(number.doubleValue());
        }
    },
    INTEGER {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Integer || value instanceof Long || value instanceof Short;
        }
    },
    BOOLEAN {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Boolean;
        }
    },
    STRING {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }
    },
    STRING_OR_LIST {
        @Override
        public boolean accepts(Object value) {
            if (value instanceof String) {
                return true;
            }
            if (value instanceof List<?> values) {
                return values.stream().allMatch(String.class::isInstance);
            }
            return false;
        }
    };

    /**
     * Checks whether a value has this shape.
     *
     * @param value candidate parameter value
     * @return true when the value can be sent under a parameter of this kind
     */
    public abstract boolean accepts(Object value);
}

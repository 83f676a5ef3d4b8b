package com.e2eq.restcore.model.persistent.commands;

import com.e2eq.restcore.util.ParseUtils;

/**
 * Scalar type of a filter value. Values that can not be coerced become the filter default.
 */
public enum FilterFieldType {
    BOOL {
        @Override
        public Object convert(Object raw, Object defaultValue) {
            return ParseUtils.parseBool(raw, (Boolean) defaultValue);
        }
    },
    INT {
        @Override
        public Object convert(Object raw, Object defaultValue) {
            return ParseUtils.parseLong(raw, toLong(defaultValue));
        }
    },
    FLOAT {
        @Override
        public Object convert(Object raw, Object defaultValue) {
            return ParseUtils.parseDouble(raw, defaultValue == null ? null : ((Number) defaultValue).doubleValue());
        }
    },
    /** epoch seconds */
    DATE {
        @Override
        public Object convert(Object raw, Object defaultValue) {
            return ParseUtils.parseDateToUnixTs(raw, toLong(defaultValue));
        }
    },
    UUID {
        @Override
        public Object convert(Object raw, Object defaultValue) {
            return ParseUtils.parseUuid(raw, (java.util.UUID) defaultValue);
        }
    };

    public abstract Object convert(Object raw, Object defaultValue);

    private static Long toLong(Object value) {
        return value == null ? null : ((Number) value).longValue();
    }
}

package com.fincheck.formula;

import java.util.Locale;

/**
 * 未识别到时间偏移标记时的处理方式
 */
public enum OnUnrecognized {
    IGNORE,
    WARN,
    RAISE;

    public static OnUnrecognized fromString(String value) {
        if (value == null || value.isEmpty()) {
            return WARN;
        }
        try {
            return OnUnrecognized.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未定义的错误处理方式: " + value, e);
        }
    }
}

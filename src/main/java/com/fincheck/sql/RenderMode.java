package com.fincheck.sql;

import java.util.Locale;

/**
 * 校验结果列的渲染方式
 * - CASE: CASE WHEN 条件 THEN 0 ELSE 等级 END
 * - COALESCE: COALESCE(条件, false)
 */
public enum RenderMode {
    CASE,
    COALESCE;

    public static RenderMode fromString(String value) {
        if (value == null || value.isEmpty()) {
            return CASE;
        }
        try {
            return RenderMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown render mode: " + value, e);
        }
    }
}

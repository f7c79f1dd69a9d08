package com.fincheck.formula;

/**
 * 时间偏移单位，code 用于拼接列名
 */
public enum ShiftUnit {
    YEAR("Y"),
    QUARTER("Q"),
    MONTH("M"),
    YEAR_END("YEND");

    private final String code;

    ShiftUnit(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

package com.fincheck.formula;

/**
 * 时间偏移方向：backward 取历史时期，forward 取未来时期，current 取当期
 */
public enum ShiftDirection {
    CURRENT("current"),
    FORWARD("forward"),
    BACKWARD("backward");

    private final String code;

    ShiftDirection(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

package com.fincheck.formula;

/**
 * 区间开闭，取值与 pandas between() 的 inclusive 参数一致
 */
public enum Inclusivity {
    BOTH("both", '[', ']'),
    LEFT("left", '[', ')'),
    RIGHT("right", '(', ']'),
    NEITHER("neither", '(', ')');

    private final String code;
    private final char open;
    private final char close;

    Inclusivity(String code, char open, char close) {
        this.code = code;
        this.open = open;
        this.close = close;
    }

    public String getCode() {
        return code;
    }

    public char getOpen() {
        return open;
    }

    public char getClose() {
        return close;
    }

    public static Inclusivity fromBrackets(char open, char close) {
        for (Inclusivity inclusivity : values()) {
            if (inclusivity.open == open && inclusivity.close == close) {
                return inclusivity;
            }
        }
        return null;
    }
}

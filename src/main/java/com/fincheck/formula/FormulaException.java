package com.fincheck.formula;

/**
 * 公式编译异常
 *
 * 解析或渲染失败时抛出，消息中总是包含出错的原始文本，便于配置表维护者定位。
 */
public class FormulaException extends RuntimeException {

    public enum ErrorType {
        MALFORMED_FORMULA,
        COMPARISON_FORM,
        UNRECOGNIZED_SHIFT_MARKER,
        UNRECOGNIZED_SHIFT_UNIT,
        UNRECOGNIZED_SHIFT_DIRECTION,
        MISSING_SHIFT_OFFSET,
        MALFORMED_RANGE,
        INVALID_NUMERIC_LITERAL,
        UNKNOWN_COMPARISON_METHOD
    }

    private final ErrorType errorType;
    private final String input;

    public FormulaException(ErrorType errorType, String message, String input) {
        super(message + ": " + input);
        this.errorType = errorType;
        this.input = input;
    }

    public FormulaException(ErrorType errorType, String message, String input, Throwable cause) {
        super(message + ": " + input, cause);
        this.errorType = errorType;
        this.input = input;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getInput() {
        return input;
    }
}

package com.fincheck.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单条规则的失败信息，不影响其他规则
 */
public class RuleFailure {
    @JsonProperty("code")
    private final String code;

    @JsonProperty("expression")
    private final String expression;

    @JsonProperty("message")
    private final String message;

    public RuleFailure(String code, String expression, String message) {
        this.code = code;
        this.expression = expression;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getExpression() {
        return expression;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}

package com.fincheck.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fincheck.meta.RuleFamily;

public class RenderedRule {
    @JsonProperty("code")
    private final String code;

    @JsonProperty("family")
    private final RuleFamily family;

    @JsonProperty("level")
    private final Integer level;

    @JsonProperty("condition")
    private final String condition;

    @JsonProperty("column")
    private final String column;

    public RenderedRule(String code, RuleFamily family, Integer level, String condition, String column) {
        this.code = code;
        this.family = family;
        this.level = level;
        this.condition = condition;
        this.column = column;
    }

    public String getCode() {
        return code;
    }

    public RuleFamily getFamily() {
        return family;
    }

    public Integer getLevel() {
        return level;
    }

    /**
     * 改写后的 SQL 条件
     */
    public String getCondition() {
        return condition;
    }

    /**
     * 视图中的整列定义
     */
    public String getColumn() {
        return column;
    }
}

package com.fincheck.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 检查视图生成结果：语句、已生成的规则列、失败的规则
 */
public class CheckViewResult {
    @JsonProperty("sql")
    private final String sql;

    @JsonProperty("rendered_rules")
    private final List<RenderedRule> renderedRules;

    @JsonProperty("failures")
    private final List<RuleFailure> failures;

    @JsonProperty("generated_at")
    private final LocalDateTime generatedAt;

    public CheckViewResult(String sql, List<RenderedRule> renderedRules, List<RuleFailure> failures) {
        this.sql = sql;
        this.renderedRules = List.copyOf(renderedRules);
        this.failures = List.copyOf(failures);
        this.generatedAt = LocalDateTime.now();
    }

    public String getSql() {
        return sql;
    }

    public List<RenderedRule> getRenderedRules() {
        return renderedRules;
    }

    public List<RuleFailure> getFailures() {
        return failures;
    }

    public LocalDateTime getGeneratedAt() {
        return generatedAt;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

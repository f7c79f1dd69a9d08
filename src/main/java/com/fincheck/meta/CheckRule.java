package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 校验规则配置行
 *
 * 会计等式校验取 condition 列的判断公式（accounting_equation 仅作展示）；
 * 重要科目校验取 subject_code 列，为科目虚拟代码组成的表达式。
 * keyword_code 指定不套 COALESCE 的字段。
 */
public class CheckRule {
    @JsonProperty("code")
    private String code;

    @JsonProperty("accounting_equation")
    private String accountingEquation;

    @JsonProperty("subject_code")
    private String subjectCode;

    @JsonProperty("condition")
    private String condition;

    @JsonProperty("level")
    private Integer level;

    @JsonProperty("tips")
    private String tips;

    @JsonProperty("model_code")
    private String modelCode;

    @JsonProperty("keyword_code")
    private String keywordCode;

    @JsonProperty("family")
    private RuleFamily family;

    public CheckRule() {
    }

    public CheckRule(RuleFamily family, String code, String expression, Integer level, String modelCode) {
        this.family = family;
        this.code = code;
        if (family == RuleFamily.IMPORTANT_SUBJECT) {
            this.subjectCode = expression;
        } else {
            this.condition = expression;
        }
        this.level = level;
        this.modelCode = modelCode;
    }

    /**
     * 参与生成校验列的表达式
     */
    @JsonIgnore
    public String getCheckExpression() {
        return family == RuleFamily.IMPORTANT_SUBJECT ? subjectCode : condition;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getAccountingEquation() {
        return accountingEquation;
    }

    public void setAccountingEquation(String accountingEquation) {
        this.accountingEquation = accountingEquation;
    }

    public String getSubjectCode() {
        return subjectCode;
    }

    public void setSubjectCode(String subjectCode) {
        this.subjectCode = subjectCode;
    }

    public String getCondition() {
        return condition;
    }

    public void setCondition(String condition) {
        this.condition = condition;
    }

    public Integer getLevel() {
        return level;
    }

    public void setLevel(Integer level) {
        this.level = level;
    }

    public String getTips() {
        return tips;
    }

    public void setTips(String tips) {
        this.tips = tips;
    }

    public String getModelCode() {
        return modelCode;
    }

    public void setModelCode(String modelCode) {
        this.modelCode = modelCode;
    }

    public String getKeywordCode() {
        return keywordCode;
    }

    public void setKeywordCode(String keywordCode) {
        this.keywordCode = keywordCode;
    }

    public RuleFamily getFamily() {
        return family;
    }

    public void setFamily(RuleFamily family) {
        this.family = family;
    }
}

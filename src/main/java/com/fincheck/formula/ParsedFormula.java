package com.fincheck.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 公式拆解结果
 *
 * 每种类型只填充自己的字段，其余为 null。formula 字段总是包含公式用到的全部字段，
 * 字段解析只读取它。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParsedFormula {

    @JsonProperty("type")
    private final FormulaKind kind;

    @JsonProperty("formula")
    private final String formula;

    @JsonProperty("time_unit")
    private String timeUnit;

    @JsonProperty("stats_method")
    private String statsMethod;

    @JsonProperty("stats_field")
    private String statsField;

    @JsonProperty("group_keys")
    private List<String> groupKeys;

    @JsonProperty("condition")
    private String condition;

    @JsonProperty("target")
    private String target;

    @JsonProperty("direction")
    private String direction;

    @JsonProperty("dimension_names")
    private List<String> dimensionNames;

    private ParsedFormula(FormulaKind kind, String formula) {
        this.kind = kind;
        this.formula = formula;
    }

    public static ParsedFormula compute(String formula) {
        return new ParsedFormula(FormulaKind.COMPUTE, formula);
    }

    public static ParsedFormula fixedParamJudge(String formula) {
        return new ParsedFormula(FormulaKind.FIXED_PARAM_JUDGE, formula);
    }

    public static ParsedFormula timeCalc(String timeUnit, String formula) {
        ParsedFormula parsed = new ParsedFormula(FormulaKind.TIME_CALC, formula);
        parsed.timeUnit = timeUnit;
        return parsed;
    }

    /**
     * formula 由 统计字段、分组字段、条件 逗号拼接而成，顺序固定
     */
    public static ParsedFormula stats(String statsMethod, String statsField, List<String> groupKeys, String condition) {
        StringBuilder sb = new StringBuilder(statsField);
        for (String key : groupKeys) {
            sb.append(',').append(key);
        }
        sb.append(',').append(condition);

        ParsedFormula parsed = new ParsedFormula(FormulaKind.STATS, sb.toString());
        parsed.statsMethod = statsMethod;
        parsed.statsField = statsField;
        parsed.groupKeys = List.copyOf(groupKeys);
        parsed.condition = condition;
        return parsed;
    }

    /**
     * formula 为 target + "+" + 维度字段以 "*" 连接
     */
    public static ParsedFormula freeParamJudge(String target, String direction, List<String> dimensionNames) {
        ParsedFormula parsed = new ParsedFormula(FormulaKind.FREE_PARAM_JUDGE,
            target + "+" + String.join("*", dimensionNames));
        parsed.target = target;
        parsed.direction = direction;
        parsed.dimensionNames = List.copyOf(dimensionNames);
        return parsed;
    }

    public FormulaKind getKind() {
        return kind;
    }

    public String getFormula() {
        return formula;
    }

    public String getTimeUnit() {
        return timeUnit;
    }

    public String getStatsMethod() {
        return statsMethod;
    }

    public String getStatsField() {
        return statsField;
    }

    public List<String> getGroupKeys() {
        return groupKeys;
    }

    public String getCondition() {
        return condition;
    }

    /**
     * 旧名称，与 condition 相同
     */
    @JsonProperty("add_condition")
    public String getAddCondition() {
        return condition;
    }

    public String getTarget() {
        return target;
    }

    public String getDirection() {
        return direction;
    }

    public List<String> getDimensionNames() {
        return dimensionNames;
    }

    @Override
    public String toString() {
        return "ParsedFormula{" + kind.getLabel() + ": " + formula + "}";
    }
}

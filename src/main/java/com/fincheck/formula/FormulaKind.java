package com.fincheck.formula;

/**
 * 公式类型，label 为配置表中使用的中文名称
 */
public enum FormulaKind {
    COMPUTE("计算"),
    FIXED_PARAM_JUDGE("定参判断"),
    TIME_CALC("时间计算"),
    STATS("统计"),
    FREE_PARAM_JUDGE("不定参判断");

    private final String label;

    FormulaKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

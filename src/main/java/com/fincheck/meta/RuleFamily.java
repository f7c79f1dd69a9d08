package com.fincheck.meta;

/**
 * 校验规则族：跨字段会计等式校验、重要科目非零校验
 */
public enum RuleFamily {
    CROSS,
    IMPORTANT_SUBJECT
}

package com.fincheck.formula;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 值域：左边界、右边界和开闭方式
 *
 * 边界总保留原文本；按数值解析时 lowerValue/upperValue 为对应数字，否则为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RangeSpec {

    @JsonProperty("lower")
    private final String lower;

    @JsonProperty("upper")
    private final String upper;

    @JsonProperty("lower_value")
    private final Double lowerValue;

    @JsonProperty("upper_value")
    private final Double upperValue;

    @JsonProperty("inclusive")
    private final Inclusivity inclusivity;

    public RangeSpec(String lower, String upper, Inclusivity inclusivity) {
        this(lower, upper, null, null, inclusivity);
    }

    public RangeSpec(String lower, String upper, Double lowerValue, Double upperValue, Inclusivity inclusivity) {
        this.lower = lower;
        this.upper = upper;
        this.lowerValue = lowerValue;
        this.upperValue = upperValue;
        this.inclusivity = inclusivity;
    }

    public String getLower() {
        return lower;
    }

    public String getUpper() {
        return upper;
    }

    public Double getLowerValue() {
        return lowerValue;
    }

    public Double getUpperValue() {
        return upperValue;
    }

    public Inclusivity getInclusivity() {
        return inclusivity;
    }

    public boolean isNumeric() {
        return lowerValue != null && upperValue != null;
    }

    /**
     * 还原为区间写法，如 [1,2)
     */
    public String render() {
        return inclusivity.getOpen() + lower + "," + upper + inclusivity.getClose();
    }

    @Override
    public String toString() {
        return render();
    }
}

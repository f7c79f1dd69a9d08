package com.fincheck.formula;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 带可执行后缀的字段，如 A.isna()、B.str.contains("x")
 */
public final class ExecutableFieldToken implements SpecialField {

    @JsonProperty("origin")
    private final String origin;

    @JsonProperty("executable")
    private final String suffix;

    public ExecutableFieldToken(String origin, String suffix) {
        this.origin = origin;
        this.suffix = suffix;
    }

    @Override
    public String getOrigin() {
        return origin;
    }

    public String getSuffix() {
        return suffix;
    }

    @Override
    @JsonProperty("source")
    public String getSource() {
        return origin + suffix;
    }

    @Override
    @JsonProperty("success")
    public boolean isSuccess() {
        return true;
    }

    @Override
    public String toCanonicalName() {
        return getSource();
    }
}

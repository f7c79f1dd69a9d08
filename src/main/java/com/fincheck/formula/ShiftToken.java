package com.fincheck.formula;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 时间偏移字段
 *
 * offset：backward 为正数，forward 为负数，current 为 0。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ShiftToken implements SpecialField {

    public enum Status {
        /** 识别到偏移 */
        SHIFTED,
        /** 本期、当期等，不需要偏移 */
        CURRENT_PERIOD,
        /** 字段上没有偏移标记 */
        NO_MARKER
    }

    private static final String CANONICAL_FORMAT = "%s_%s%s%d";

    @JsonProperty("source")
    private final String source;

    @JsonProperty("origin")
    private final String origin;

    @JsonProperty("unit")
    private final ShiftUnit unit;

    @JsonProperty("direction")
    private final ShiftDirection direction;

    @JsonProperty("offset")
    private final int offset;

    @JsonIgnore
    private final Status status;

    private ShiftToken(String source, String origin, ShiftUnit unit, ShiftDirection direction, int offset, Status status) {
        this.source = source;
        this.origin = origin;
        this.unit = unit;
        this.direction = direction;
        this.offset = offset;
        this.status = status;
    }

    public static ShiftToken shifted(String source, String origin, ShiftUnit unit, ShiftDirection direction, int offset) {
        return new ShiftToken(source, origin, unit, direction, offset, Status.SHIFTED);
    }

    public static ShiftToken currentPeriod(String source, String origin) {
        return new ShiftToken(source, origin, null, null, 0, Status.CURRENT_PERIOD);
    }

    public static ShiftToken noMarker(String source) {
        return new ShiftToken(source, source, null, null, 0, Status.NO_MARKER);
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public String getOrigin() {
        return origin;
    }

    public ShiftUnit getUnit() {
        return unit;
    }

    public ShiftDirection getDirection() {
        return direction;
    }

    public int getOffset() {
        return offset;
    }

    public Status getStatus() {
        return status;
    }

    @Override
    @JsonProperty("success")
    public boolean isSuccess() {
        return status == Status.SHIFTED;
    }

    /**
     * {origin}_{unit}{direction}{abs(offset)}，如 A_Ybackward1
     */
    @Override
    public String toCanonicalName() {
        if (!isSuccess() || unit == null) {
            return source;
        }
        return String.format(CANONICAL_FORMAT, origin, unit.getCode(), direction.getCode(), Math.abs(offset));
    }

    @Override
    public String toString() {
        return "ShiftToken{" + source + " -> " + toCanonicalName() + "}";
    }
}

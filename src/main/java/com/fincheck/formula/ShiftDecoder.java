package com.fincheck.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 特殊字段拆解器
 *
 * 偏移符号：^ 年份偏移，~ 季度偏移，° 年末偏移。参数 1 为上一期，-1 为下一期，° 后 0 为本年末。
 * 也可以用自然语言标记，如 "上年"、"下季"、"上上月"、"本年末"，此时由调用方传入 sign。
 *
 * {@link #tryDecode} 不处理“无标记”的情况，只返回结果；{@link #decode} 在其外层按
 * {@link OnUnrecognized} 决定忽略、告警或抛出。
 */
public final class ShiftDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ShiftDecoder.class);

    /** 年份、季度、年末 */
    static final List<String> SHIFT_OPERATORS = List.of("^", "~", "°");

    private static final Pattern SHIFT_PATTERN = Pattern.compile("(.*)("
        + SHIFT_OPERATORS.stream().map(Pattern::quote).collect(Collectors.joining("|"))
        + ")(.*)");
    private static final Pattern EXECUTABLE_PATTERN = Pattern.compile("([a-zA-Z0-9_]+)\\.[a-z]+");
    private static final Pattern OFFSET_PATTERN = Pattern.compile("-?\\d+");

    private static final Set<String> CURRENT_PERIOD_SIGNS = Set.of("本期", "当期", "");

    private static final List<String> YEAR_END_MARKERS = List.of("end", "末", "°");
    private static final List<String> YEAR_MARKERS = List.of("year", "年", "^", "期");
    private static final List<String> QUARTER_MARKERS = List.of("quarter", "季", "~");
    private static final List<String> MONTH_MARKERS = List.of("month", "月");

    private static final List<String> CURRENT_MARKERS = List.of("本", "当", "°0");
    private static final List<String> FORWARD_MARKERS = List.of("下", "^-", "~-", "°-");
    private static final List<String> BACKWARD_MARKERS = List.of("上", "^", "~", "°");

    private ShiftDecoder() {
    }

    public static SpecialField decode(String field, String sign, OnUnrecognized onUnrecognized) {
        SpecialField decoded = tryDecode(field, sign);
        if (decoded instanceof ShiftToken && ((ShiftToken) decoded).getStatus() == ShiftToken.Status.NO_MARKER) {
            switch (onUnrecognized) {
                case RAISE:
                    throw new FormulaException(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_MARKER,
                        "未定义的特殊字段", field);
                case WARN:
                    logger.warn("未定义的特殊字段 {}", field);
                    break;
                default:
                    break;
            }
        }
        return decoded;
    }

    /**
     * 拆解特殊字段。sign 为空时从字段本身识别偏移符号；可执行后缀优先于时间偏移。
     */
    public static SpecialField tryDecode(String field, String sign) {
        Matcher executable = EXECUTABLE_PATTERN.matcher(field);
        if (executable.lookingAt()) {
            String origin = executable.group(1);
            return new ExecutableFieldToken(origin, field.substring(origin.length()));
        }

        String origin = field;
        if (sign == null) {
            Matcher shift = SHIFT_PATTERN.matcher(field);
            if (!shift.matches()) {
                return ShiftToken.noMarker(field);
            }
            origin = shift.group(1);
            sign = shift.group(2) + shift.group(3);
        }

        sign = sign.toLowerCase(Locale.ROOT);
        if (CURRENT_PERIOD_SIGNS.contains(sign)) {
            return ShiftToken.currentPeriod(field, origin);
        }

        ShiftUnit unit = decodeUnit(sign);
        ShiftDirection direction = decodeDirection(sign);
        int offset = decodeOffset(sign, direction);
        return ShiftToken.shifted(field, origin, unit, direction, offset);
    }

    static ShiftUnit decodeUnit(String sign) {
        // 年末优先
        if (containsAny(sign, YEAR_END_MARKERS)) {
            return ShiftUnit.YEAR_END;
        } else if (containsAny(sign, YEAR_MARKERS)) {
            return ShiftUnit.YEAR;
        } else if (containsAny(sign, QUARTER_MARKERS)) {
            return ShiftUnit.QUARTER;
        } else if (containsAny(sign, MONTH_MARKERS)) {
            return ShiftUnit.MONTH;
        }
        throw new FormulaException(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_UNIT, "未识别时间偏移标记", sign);
    }

    static ShiftDirection decodeDirection(String sign) {
        if (containsAny(sign, CURRENT_MARKERS)) {
            return ShiftDirection.CURRENT;
        } else if (containsAny(sign, FORWARD_MARKERS)) {
            return ShiftDirection.FORWARD;
        } else if (containsAny(sign, BACKWARD_MARKERS)) {
            return ShiftDirection.BACKWARD;
        }
        throw new FormulaException(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_DIRECTION, "未识别时间偏移方向", sign);
    }

    /**
     * 优先使用标记中的整数；forward 时强制为负数。没有整数时按 "上"/"下" 的个数计数。
     */
    static int decodeOffset(String sign, ShiftDirection direction) {
        Matcher matcher = OFFSET_PATTERN.matcher(sign);
        if (matcher.find()) {
            int offset;
            try {
                offset = Integer.parseInt(matcher.group());
            } catch (NumberFormatException e) {
                throw new FormulaException(FormulaException.ErrorType.MISSING_SHIFT_OFFSET, "时间偏移量超出范围", sign, e);
            }
            // 取绝对值后须仍在 int 范围内
            if (offset == Integer.MIN_VALUE) {
                throw new FormulaException(FormulaException.ErrorType.MISSING_SHIFT_OFFSET, "时间偏移量超出范围", sign);
            }
            return direction == ShiftDirection.FORWARD ? -Math.abs(offset) : offset;
        }

        if (sign.contains("上")) {
            return countOf(sign, '上');
        } else if (sign.contains("下")) {
            return -countOf(sign, '下');
        } else if (containsAny(sign, CURRENT_MARKERS)) {
            return 0;
        }
        throw new FormulaException(FormulaException.ErrorType.MISSING_SHIFT_OFFSET, "未找到时间偏移量", sign);
    }

    private static boolean containsAny(String sign, List<String> markers) {
        for (String marker : markers) {
            if (sign.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static int countOf(String sign, char c) {
        int count = 0;
        for (int i = 0; i < sign.length(); i++) {
            if (sign.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }
}

package com.fincheck.formula;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 值域与阈值转换
 *
 * - 区间字符串 "(-2,-1],[1,2)" 与 {@link RangeSpec} 互转
 * - 比较方法 + 阈值（配置表中的两列）转为区间写法或可执行比较语句
 *
 * 比较方法：大于、小于、大于等于、小于等于（或 > < >= <=）用于单阈值；
 * 双阈值用 "外"/"内" 表示区间外/区间内，"左包"、"右包" 表示包含对应边界，默认不包含。
 */
public final class RangeCodec {

    public static final String INFINITY = "∞";

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> GREATER = Set.of("大于", ">");
    private static final Set<String> LESS = Set.of("小于", "<");
    private static final Set<String> GREATER_OR_EQUAL = Set.of("大于等于", ">=");
    private static final Set<String> LESS_OR_EQUAL = Set.of("小于等于", "<=");
    private static final Set<String> SYMBOL_METHODS = Set.of(">", "<", ">=", "<=");

    private static final String OUTSIDE = "外";
    private static final String INSIDE = "内";
    private static final String LEFT_INCLUDED = "左包";
    private static final String RIGHT_INCLUDED = "右包";

    private RangeCodec() {
    }

    /**
     * 拆分多个值域，如 "(-2,-1],[1,2)"
     */
    public static List<RangeSpec> parseMultiRange(String text, boolean numeric) {
        String cleaned = FormulaText.clean(text);
        if (cleaned == null || cleaned.isEmpty()) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_RANGE, "值域为空", String.valueOf(text));
        }
        cleaned = cleaned.replace("),", ")|").replace("],", "]|");
        List<RangeSpec> ranges = new ArrayList<>();
        for (String range : cleaned.split("\\|", -1)) {
            ranges.add(parseRange(range, numeric));
        }
        return ranges;
    }

    /**
     * 拆分单个值域：第一部分首字符与第二部分末字符决定开闭
     */
    public static RangeSpec parseRange(String text, boolean numeric) {
        String cleaned = FormulaText.clean(text);
        if (cleaned == null) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_RANGE, "值域为空", "null");
        }
        String[] parts = cleaned.split(",", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_RANGE, "值域格式错误", cleaned);
        }

        Inclusivity inclusivity = Inclusivity.fromBrackets(parts[0].charAt(0), parts[1].charAt(parts[1].length() - 1));
        if (inclusivity == null) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_RANGE, "值域括号错误", cleaned);
        }
        String lower = parts[0].substring(1);
        String upper = parts[1].substring(0, parts[1].length() - 1);
        if (lower.isEmpty() || upper.isEmpty()) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_RANGE, "值域缺少边界", cleaned);
        }

        if (!numeric) {
            return new RangeSpec(lower, upper, inclusivity);
        }
        return new RangeSpec(lower, upper, toNumber(lower), toNumber(upper), inclusivity);
    }

    /**
     * 字符串转数字；inf 和 ∞ 视为无穷，可带正负号
     */
    public static double toNumber(String text) {
        if (text == null || text.isEmpty()) {
            throw new FormulaException(FormulaException.ErrorType.INVALID_NUMERIC_LITERAL, "无法转换为数字", String.valueOf(text));
        }
        boolean negative = text.startsWith("-");
        String body = negative || text.startsWith("+") ? text.substring(1) : text;

        double value;
        if (body.toLowerCase(Locale.ROOT).contains("inf") || body.contains(INFINITY)) {
            value = Double.POSITIVE_INFINITY;
        } else if (DECIMAL_PATTERN.matcher(body).matches()) {
            value = Double.parseDouble(body);
        } else {
            throw new FormulaException(FormulaException.ErrorType.INVALID_NUMERIC_LITERAL, "无法转换为数字", text);
        }
        return negative ? -value : value;
    }

    /**
     * 比较方法和阈值转为区间写法，双阈值默认不包含边界
     * <pre>
     * "大于", [0.1]             -> (0.1, +∞)
     * "大于", [0.1, null]       -> (0.1, +∞)
     * "外右包含", [0.1, 0.2]    -> (-∞, 0.1)|[0.2, +∞)
     * </pre>
     */
    public static String renderRange(String method, List<?> thresholds) {
        checkThresholdCount(method, thresholds);
        thresholds = reduceThresholds(method, thresholds);

        if (thresholds.size() == 1) {
            String th = formatThreshold(thresholds.get(0));
            if (GREATER.contains(method)) {
                return "(" + th + ", +" + INFINITY + ")";
            } else if (LESS.contains(method)) {
                return "(-" + INFINITY + ", " + th + ")";
            } else if (GREATER_OR_EQUAL.contains(method)) {
                return "[" + th + ", +" + INFINITY + ")";
            } else if (LESS_OR_EQUAL.contains(method)) {
                return "(-" + INFINITY + ", " + th + "]";
            }
            throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD, "未知的单参数比较方法", method);
        }

        List<?> sorted = sortIfNumeric(thresholds);
        String th1 = formatThreshold(sorted.get(0));
        String th2 = formatThreshold(sorted.get(1));
        if (method.contains(OUTSIDE)) {
            char leftBound = method.contains(LEFT_INCLUDED) ? ']' : ')';
            char rightBound = method.contains(RIGHT_INCLUDED) ? '[' : '(';
            return "(-" + INFINITY + ", " + th1 + leftBound + "|" + rightBound + th2 + ", +" + INFINITY + ")";
        } else if (method.contains(INSIDE)) {
            char leftBound = method.contains(LEFT_INCLUDED) ? '[' : '(';
            char rightBound = method.contains(RIGHT_INCLUDED) ? ']' : ')';
            return leftBound + th1 + ", " + th2 + rightBound;
        }
        throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD, "未知的双参数比较方法", method);
    }

    /**
     * 比较方法和阈值转为比较语句，code 可以是字段也可以是列名
     * <pre>
     * "大于", [0.1]          -> code>0.1
     * "外左包", [1, 9]       -> code<=1 | code>9
     * "内", [1, 9]           -> code>1 & code<9
     * </pre>
     * 第二个阈值为空或为假值时按单阈值处理。
     */
    public static String renderComparison(String code, String method, List<?> thresholds) {
        checkThresholdCount(method, thresholds);

        thresholds = reduceThresholds(method, thresholds);

        if (thresholds.size() == 1) {
            String th = formatThreshold(thresholds.get(0));
            if (GREATER.contains(method)) {
                return code + ">" + th;
            } else if (LESS.contains(method)) {
                return code + "<" + th;
            } else if (GREATER_OR_EQUAL.contains(method)) {
                return code + ">=" + th;
            } else if (LESS_OR_EQUAL.contains(method)) {
                return code + "<=" + th;
            }
            throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD, "未知的单参数比较方法", method);
        }

        List<?> sorted = sortIfNumeric(thresholds);
        String th1 = formatThreshold(sorted.get(0));
        String th2 = formatThreshold(sorted.get(1));
        String leftEq = method.contains(LEFT_INCLUDED) ? "=" : "";
        String rightEq = method.contains(RIGHT_INCLUDED) ? "=" : "";

        // TODO: 区间外的左右分支固定为 < 与 >，与限定词出现的先后无关，需业务确认
        if (method.contains(OUTSIDE)) {
            return code + "<" + leftEq + th1 + " | " + code + ">" + rightEq + th2;
        } else if (method.contains(INSIDE)) {
            return code + ">" + leftEq + th1 + " & " + code + "<" + rightEq + th2;
        }
        throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD, "未知的双参数比较方法", method);
    }

    private static void checkThresholdCount(String method, Collection<?> thresholds) {
        if (method == null) {
            throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD, "比较方法为空", "null");
        }
        if (thresholds == null || thresholds.isEmpty() || thresholds.size() > 2) {
            throw new FormulaException(FormulaException.ErrorType.UNKNOWN_COMPARISON_METHOD,
                "阈值数量错误", method + " " + thresholds);
        }
    }

    /**
     * 单参数比较方法或第二个阈值为空、假值时只保留第一个阈值
     */
    static List<?> reduceThresholds(String method, List<?> thresholds) {
        boolean singleThreshold = method.contains("大于")
            || method.contains("小于")
            || SYMBOL_METHODS.contains(method)
            || thresholds.size() == 1
            || isFalsy(thresholds.get(1));
        return singleThreshold ? Collections.singletonList(thresholds.get(0)) : thresholds;
    }

    static boolean isFalsy(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d == 0 || Double.isNaN(d);
        }
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        return FormulaText.isBlankOrPlaceholder(value.toString());
    }

    /**
     * 阈值全部为数字时升序排列，含列名等字符串时保持原顺序
     */
    private static List<?> sortIfNumeric(List<?> thresholds) {
        for (Object threshold : thresholds) {
            if (!(threshold instanceof Number)) {
                return thresholds;
            }
        }
        List<Number> sorted = new ArrayList<>();
        for (Object threshold : thresholds) {
            sorted.add((Number) threshold);
        }
        sorted.sort(Comparator.comparingDouble(Number::doubleValue));
        return sorted;
    }

    static String formatThreshold(Object threshold) {
        if (threshold instanceof Double || threshold instanceof Float) {
            double d = ((Number) threshold).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return (d > 0 ? "+" : "-") + INFINITY;
            }
            return new BigDecimal(threshold.toString()).stripTrailingZeros().toPlainString();
        }
        if (threshold instanceof BigDecimal) {
            return ((BigDecimal) threshold).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(threshold);
    }
}

package com.fincheck.formula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 字段解析器
 *
 * 把公式按运算符切分为字段。去重模式下返回的是字段原名（去掉时间偏移和可执行后缀），
 * 顺序为首次出现顺序，调用方不应依赖该顺序。
 */
public final class FieldExtractor {

    private static final String STOP_SYMBOLS = ",+-*/()=<>%#&|";

    /** 偏移符后紧跟负号时不应被切开 */
    private static final Map<String, String> PROTECTED_SEQUENCES;

    static {
        Map<String, String> protectedSequences = new LinkedHashMap<>();
        protectedSequences.put("^-", "^^");
        protectedSequences.put("~-", "~~");
        protectedSequences.put("°-", "°°");
        PROTECTED_SEQUENCES = protectedSequences;
    }

    static final Set<String> SPECIAL_WORDS = Set.of(
        "match", "exact_match",
        "year", "Y",
        "quarter", "Q",
        "month", "M",
        "day", "D",
        "count", "sum", "mean", "quantile",
        "abs",
        "True", "False", "TRUE", "FALSE", "true", "false"
    );

    private static final String SUFFIX_MARKERS = "~^°.";

    private FieldExtractor() {
    }

    public static List<String> extract(String formula, boolean unique) {
        List<String> fields = new ArrayList<>();
        for (String token : tokenize(formula)) {
            if (token.isEmpty() || isNumeric(token) || token.contains("\"") || SPECIAL_WORDS.contains(token)) {
                continue;
            }
            if (token.contains(".") && !token.endsWith(")")) {
                token = token + "()";
            }
            fields.add(token);
        }

        if (!unique) {
            return fields;
        }
        Set<String> origins = new LinkedHashSet<>();
        for (String field : new LinkedHashSet<>(fields)) {
            String origin = stripSuffix(field);
            if (!origin.isEmpty()) {
                origins.add(origin);
            }
        }
        return new ArrayList<>(origins);
    }

    static List<String> tokenize(String formula) {
        String text = formula;
        for (Map.Entry<String, String> entry : PROTECTED_SEQUENCES.entrySet()) {
            text = text.replace(entry.getKey(), entry.getValue());
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(STOP_SYMBOLS.indexOf(c) >= 0 ? ' ' : c);
        }
        text = sb.toString().trim().replaceAll(" {2,}", " ");
        for (Map.Entry<String, String> entry : PROTECTED_SEQUENCES.entrySet()) {
            text = text.replace(entry.getValue(), entry.getKey());
        }

        List<String> tokens = new ArrayList<>();
        for (String token : text.split(" ")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 纯数字或小数（忽略小数点和负号）
     */
    static boolean isNumeric(String token) {
        String digits = token.replace(".", "").replace("-", "");
        if (digits.isEmpty()) {
            return false;
        }
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 截去第一个 ~ ^ ° . 及其后的内容
     */
    static String stripSuffix(String field) {
        for (int i = 0; i < field.length(); i++) {
            if (SUFFIX_MARKERS.indexOf(field.charAt(i)) >= 0) {
                return field.substring(0, i);
            }
        }
        return field;
    }
}

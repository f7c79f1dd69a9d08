package com.fincheck.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 文本清洗器
 *
 * 两个清洗级别不能互换：
 * - clean: 公式文本，全角符号统一为半角，去除全部空白
 * - simpleClean: 参数文本，只去空格、统一逗号，并把占位符视为空串
 */
public final class FormulaText {

    private static final Map<Character, String> UNIFY_MAPPER;

    static {
        Map<Character, String> mapper = new LinkedHashMap<>();
        mapper.put('～', "~");
        mapper.put('（', "(");
        mapper.put('）', ")");
        mapper.put('＋', "+");
        mapper.put('－', "-");
        mapper.put('×', "*");
        mapper.put('÷', "/");
        mapper.put('，', ",");
        mapper.put('：', ":");
        mapper.put('；', ";");
        mapper.put('＝', "=");
        mapper.put('＜', "<");
        mapper.put('＞', ">");
        mapper.put('≤', "<=");
        mapper.put('≥', ">=");
        mapper.put('≠', "!=");
        mapper.put('％', "%");
        mapper.put('＃', "#");
        mapper.put('＆', "&");
        mapper.put('＠', "@");
        mapper.put('＄', "$");
        mapper.put('＊', "*");
        mapper.put('＂', "\"");
        mapper.put('“', "\"");
        mapper.put('”', "\"");
        mapper.put('＇', "'");
        mapper.put('‘', "'");
        mapper.put('’', "'");
        mapper.put('［', "[");
        mapper.put('］', "]");
        mapper.put('｛', "{");
        mapper.put('｝', "}");
        mapper.put('｜', "|");
        mapper.put('／', "/");
        UNIFY_MAPPER = Collections.unmodifiableMap(mapper);
    }

    /** 参数文本中表示“无值”的占位符（小写比较） */
    private static final Set<String> EMPTY_PLACEHOLDERS = Set.of("-", "nan", "none");

    private FormulaText() {
    }

    /**
     * 公式清洗：全角转半角并去除所有空白（含全角空格）。null 原样返回。
     */
    public static String clean(String formula) {
        if (formula == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(formula.length());
        for (int i = 0; i < formula.length(); i++) {
            char c = formula.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                continue;
            }
            String mapped = UNIFY_MAPPER.get(c);
            if (mapped != null) {
                sb.append(mapped);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * 按列清洗，空值保持为 null，不会变成字符串 "null"。
     */
    public static List<String> cleanAll(List<String> formulas) {
        List<String> cleaned = new ArrayList<>(formulas.size());
        for (String formula : formulas) {
            cleaned.add(clean(formula));
        }
        return cleaned;
    }

    /**
     * 简单清洗：去空格，中文逗号转英文逗号；"-"、"nan"、"None" 等占位符视为空串。
     */
    public static String simpleClean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.replace(" ", "").replace('，', ',');
        if (EMPTY_PLACEHOLDERS.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return "";
        }
        return cleaned;
    }

    /**
     * 按列简单清洗，空值填充为空串。
     */
    public static List<String> simpleCleanAll(List<String> texts) {
        List<String> cleaned = new ArrayList<>(texts.size());
        for (String text : texts) {
            cleaned.add(simpleClean(text));
        }
        return cleaned;
    }

    /**
     * 占位符判断，与 simpleClean 的规则一致。
     */
    public static boolean isBlankOrPlaceholder(String text) {
        return simpleClean(text).isEmpty();
    }
}

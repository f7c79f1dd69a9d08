package com.fincheck.sql;

import com.fincheck.formula.FormulaText;
import com.fincheck.meta.SubjectEntry;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 虚拟字段代码到物理字段代码的替换
 *
 * 替换表按虚拟代码长度从长到短排列，并且只匹配完整标识符，一次扫描完成：
 * 短代码不会改写长代码的一部分，也不会改写已替换出的片段。
 */
public class FieldCodeResolver {

    private static final String IDENTIFIER_CHAR = "[\\p{L}\\p{N}_]";

    private final List<Map.Entry<String, String>> mappings;

    public FieldCodeResolver(Collection<SubjectEntry> subjects) {
        List<Map.Entry<String, String>> entries = new ArrayList<>();
        for (SubjectEntry subject : subjects) {
            if (FormulaText.isBlankOrPlaceholder(subject.getFieldVirtualCode())) {
                continue;
            }
            entries.add(new AbstractMap.SimpleImmutableEntry<>(subject.getFieldVirtualCode(), subject.getFieldCode()));
        }
        this.mappings = sortByKeyLength(entries);
    }

    /**
     * 按虚拟代码长度降序排列的替换表
     */
    public List<Map.Entry<String, String>> getMappings() {
        return mappings;
    }

    /**
     * 虚拟代码替换为物理代码
     */
    public String resolve(String formula) {
        return substitute(formula, mappings);
    }

    /**
     * 虚拟代码替换为 "物理代码<>0"，用于重要科目非零校验
     */
    public String resolveNonZero(String expression) {
        List<Map.Entry<String, String>> nonZero = new ArrayList<>(mappings.size());
        for (Map.Entry<String, String> entry : mappings) {
            nonZero.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), entry.getValue() + "<>0"));
        }
        return substitute(expression, nonZero);
    }

    /**
     * 一次扫描完成全部替换，replacements 的顺序即匹配优先级
     */
    public static String substitute(String text, List<Map.Entry<String, String>> replacements) {
        if (text == null || text.isEmpty() || replacements.isEmpty()) {
            return text;
        }
        Map<String, String> lookup = new HashMap<>();
        StringBuilder alternation = new StringBuilder();
        for (Map.Entry<String, String> entry : replacements) {
            if (lookup.containsKey(entry.getKey())) {
                continue;
            }
            lookup.put(entry.getKey(), entry.getValue());
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(Pattern.quote(entry.getKey()));
        }

        Pattern pattern = Pattern.compile(
            "(?<!" + IDENTIFIER_CHAR + ")(?:" + alternation + ")(?!" + IDENTIFIER_CHAR + ")");
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(lookup.get(matcher.group())));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    static List<Map.Entry<String, String>> sortByKeyLength(List<Map.Entry<String, String>> entries) {
        List<Map.Entry<String, String>> sorted = new ArrayList<>(entries);
        sorted.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        return List.copyOf(sorted);
    }
}

package com.fincheck.formula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 公式编译入口：清洗 → 拆解 → 字段解析 / 特殊字段转换 / 值域转换 → 拼接
 *
 * 无状态，可在多线程间共享。
 */
public class FormulaCompiler {

    private final OnUnrecognized defaultPolicy;

    public FormulaCompiler() {
        this(OnUnrecognized.WARN);
    }

    public FormulaCompiler(OnUnrecognized defaultPolicy) {
        this.defaultPolicy = defaultPolicy;
    }

    public OnUnrecognized getDefaultPolicy() {
        return defaultPolicy;
    }

    // ==================== 清洗 ====================

    public String clean(String formula) {
        return FormulaText.clean(formula);
    }

    public List<String> cleanAll(List<String> formulas) {
        return FormulaText.cleanAll(formulas);
    }

    public String simpleClean(String text) {
        return FormulaText.simpleClean(text);
    }

    public List<String> simpleCleanAll(List<String> texts) {
        return FormulaText.simpleCleanAll(texts);
    }

    // ==================== 拆解 ====================

    /**
     * 清洗后拆解
     */
    public ParsedFormula parse(String formula) {
        return FormulaParser.parse(FormulaText.clean(formula));
    }

    public List<ParsedFormula> parseAll(List<String> formulas) {
        List<ParsedFormula> parsed = new ArrayList<>(formulas.size());
        for (String formula : formulas) {
            parsed.add(formula == null ? null : parse(formula));
        }
        return parsed;
    }

    public boolean verifyStrictEqualityForm(String formula) {
        return FormulaParser.verifyStrictEqualityForm(formula);
    }

    // ==================== 字段 ====================

    /**
     * 公式中使用的字段；unique 为 true 时去重并去掉偏移、可执行后缀
     */
    public List<String> parseFields(String formula, boolean unique) {
        ParsedFormula parsed = parse(formula);
        return FieldExtractor.extract(parsed.getFormula(), unique);
    }

    public List<String> parseFields(String formula) {
        return parseFields(formula, true);
    }

    public List<List<String>> parseFieldsAll(List<String> formulas, boolean unique) {
        List<List<String>> fields = new ArrayList<>(formulas.size());
        for (String formula : formulas) {
            fields.add(formula == null ? null : parseFields(formula, unique));
        }
        return fields;
    }

    // ==================== 特殊字段 ====================

    public SpecialField decodeSpecialField(String field, String sign, OnUnrecognized policy) {
        return ShiftDecoder.decode(field, sign, policy != null ? policy : defaultPolicy);
    }

    public String translateSpecialField(String field, String sign, OnUnrecognized policy) {
        return decodeSpecialField(field, sign, policy).toCanonicalName();
    }

    public String translateSpecialField(String field) {
        return translateSpecialField(field, null, defaultPolicy);
    }

    /**
     * 批量转换，按原字段长度从长到短排列，供调用方做最长优先替换
     */
    public Map<String, String> translateSpecialFields(List<String> fields, String sign, OnUnrecognized policy) {
        List<String> ordered = new ArrayList<>(fields);
        ordered.sort((a, b) -> Integer.compare(b.length(), a.length()));

        Map<String, String> translated = new LinkedHashMap<>();
        for (String field : ordered) {
            if (!translated.containsKey(field)) {
                translated.put(field, translateSpecialField(field, sign, policy));
            }
        }
        return translated;
    }

    // ==================== 值域 ====================

    public List<RangeSpec> parseMultiRange(String text, boolean numeric) {
        return RangeCodec.parseMultiRange(text, numeric);
    }

    public RangeSpec parseRange(String text, boolean numeric) {
        return RangeCodec.parseRange(text, numeric);
    }

    public double toNumber(String text) {
        return RangeCodec.toNumber(text);
    }

    public String renderRange(String method, List<?> thresholds) {
        return RangeCodec.renderRange(method, thresholds);
    }

    public String renderComparison(String code, String method, List<?> thresholds) {
        return RangeCodec.renderComparison(code, method, thresholds);
    }

    // ==================== 拼接 ====================

    public String concatenate(List<List<String>> groups, String operator) {
        return FormulaConcatenator.concatenate(groups, operator);
    }
}

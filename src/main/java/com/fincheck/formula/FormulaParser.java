package com.fincheck.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 公式拆解器
 *
 * 按 ";" 拆分子句、按 "," 拆分参数，根据结构和首个参数识别公式类型：
 * - 无 ";"：单一公式，包含比较符为定参判断，否则为计算
 * - 有 ";"：首参数为时间单位是时间计算，为统计方法是统计，其余为不定参判断
 *
 * 输入应已经过 {@link FormulaText#clean(String)}。
 */
public final class FormulaParser {

    public static final String CLAUSE_SEPARATOR = ";";
    public static final String ARGUMENT_SEPARATOR = ",";

    /** 比较符及判空、包含、匹配类访问器；长的在前，剥离时不会残留半个符号 */
    static final List<String> COMPARISON_OPERATORS = List.of(
        "==", "!=", "<=", ">=", "<", ">",
        ".isna()", ".isnull()", ".notna()", ".notnull()",
        ".isin", ".str.contains"
    );

    static final List<String> TIME_UNIT_HEADS = List.of("year", "Y", "quarter", "Q", "month", "M", "day", "D");
    static final List<String> STATS_HEADS = List.of("count", "sum", "mean", "quantile");

    private static final Map<String, FormulaKind> HEAD_MAPPER;

    static {
        Map<String, FormulaKind> mapper = new HashMap<>();
        for (String head : TIME_UNIT_HEADS) {
            mapper.put(head, FormulaKind.TIME_CALC);
        }
        for (String head : STATS_HEADS) {
            mapper.put(head, FormulaKind.STATS);
        }
        HEAD_MAPPER = Collections.unmodifiableMap(mapper);
    }

    private FormulaParser() {
    }

    public static ParsedFormula parse(String formula) {
        if (formula == null) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_FORMULA, "公式为空", "null");
        }
        if (!formula.contains(CLAUSE_SEPARATOR)) {
            return parseSingle(formula);
        }
        return parseMultiClause(formula);
    }

    public static FormulaKind classify(String formula) {
        return parse(formula).getKind();
    }

    private static ParsedFormula parseSingle(String formula) {
        if (formula.contains(ARGUMENT_SEPARATOR)) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_FORMULA,
                "单一计算公式中存在\",\"", formula);
        }
        if (containsComparison(formula)) {
            if (!verifyStrictEqualityForm(formula)) {
                throw new FormulaException(FormulaException.ErrorType.COMPARISON_FORM,
                    "单一定参判断公式中存在不规范的单等号或<>", formula);
            }
            return ParsedFormula.fixedParamJudge(formula);
        }
        return ParsedFormula.compute(formula);
    }

    private static ParsedFormula parseMultiClause(String formula) {
        List<List<String>> clauses = splitClauses(formula);
        List<String> firstClause = clauses.get(0);
        String head = firstClause.get(0);
        FormulaKind kind = HEAD_MAPPER.getOrDefault(head, FormulaKind.FREE_PARAM_JUDGE);

        switch (kind) {
            case TIME_CALC:
                requireClauses(clauses, 2, formula);
                return ParsedFormula.timeCalc(head, clauses.get(1).get(0));
            case STATS:
                requireClauses(clauses, 3, formula);
                String statsField = firstClause.size() > 1
                    ? String.join(ARGUMENT_SEPARATOR, firstClause.subList(1, firstClause.size()))
                    : "";
                return ParsedFormula.stats(head, statsField, clauses.get(1), clauses.get(2).get(0));
            default:
                requireClauses(clauses, 2, formula);
                if (firstClause.size() < 2) {
                    throw new FormulaException(FormulaException.ErrorType.MALFORMED_FORMULA,
                        "不定参判断公式缺少判断方向", formula);
                }
                return ParsedFormula.freeParamJudge(head, firstClause.get(1), clauses.get(1));
        }
    }

    /**
     * 拆成双层列表：外层为子句，内层为参数。保留空串，与原始位置一一对应。
     */
    static List<List<String>> splitClauses(String formula) {
        List<List<String>> clauses = new ArrayList<>();
        for (String clause : formula.split(CLAUSE_SEPARATOR, -1)) {
            clauses.add(Arrays.asList(clause.split(ARGUMENT_SEPARATOR, -1)));
        }
        return clauses;
    }

    private static void requireClauses(List<List<String>> clauses, int count, String formula) {
        if (clauses.size() < count) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_FORMULA,
                "公式子句数量不足，至少需要" + count + "个", formula);
        }
    }

    static boolean containsComparison(String formula) {
        for (String sign : COMPARISON_OPERATORS) {
            if (formula.contains(sign)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 比较符只允许双字符形式：剥离所有合法比较符后，不应再出现单个 "=" 或 "<>"。
     * 含参数赋值的字符串不适用。
     */
    public static boolean verifyStrictEqualityForm(String formula) {
        // "<>" 需在剥离 "<"、">" 之前判断
        if (formula.contains("<>")) {
            return false;
        }
        String residual = formula;
        for (String sign : COMPARISON_OPERATORS) {
            residual = residual.replace(sign, "");
        }
        return !residual.contains("=") && !residual.contains("<>");
    }
}

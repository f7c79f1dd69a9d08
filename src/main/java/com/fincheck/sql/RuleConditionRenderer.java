package com.fincheck.sql;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.formula.FormulaException;
import com.fincheck.formula.FormulaText;
import com.fincheck.meta.CheckRule;
import com.fincheck.meta.RuleFamily;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 校验规则的条件改写为 SQL 条件
 *
 * 会计等式：除关键字外的字段套 COALESCE(字段, 0)，== 改为 =，再替换为物理字段代码。
 * 重要科目：每个科目虚拟代码改为 "物理代码<>0"。
 */
public class RuleConditionRenderer {

    private final FormulaCompiler compiler;
    private final FieldCodeResolver resolver;

    public RuleConditionRenderer(FormulaCompiler compiler, FieldCodeResolver resolver) {
        this.compiler = compiler;
        this.resolver = resolver;
    }

    public String render(CheckRule rule) {
        String expression = rule.getCheckExpression();
        if (FormulaText.isBlankOrPlaceholder(expression)) {
            throw new FormulaException(FormulaException.ErrorType.MALFORMED_FORMULA,
                "校验表达式为空", String.valueOf(rule.getCode()));
        }
        // 科目表达式可能含 AND/OR，保留空格
        if (rule.getFamily() == RuleFamily.IMPORTANT_SUBJECT) {
            return resolver.resolveNonZero(expression.trim());
        }
        return renderCross(FormulaText.clean(expression), rule.getKeywordCode());
    }

    String renderCross(String condition, String keywordCode) {
        List<String> fields = compiler.parseFields(condition);

        List<Map.Entry<String, String>> wrapped = new ArrayList<>();
        for (String field : fields) {
            if (field.equals(String.valueOf(keywordCode))) {
                continue;
            }
            wrapped.add(new AbstractMap.SimpleImmutableEntry<>(field, "COALESCE(" + field + ", 0)"));
        }
        String formula = FieldCodeResolver.substitute(condition, FieldCodeResolver.sortByKeyLength(wrapped));
        formula = formula.replace("==", "=");
        return resolver.resolve(formula);
    }
}

package com.fincheck.sql;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.formula.FormulaException;
import com.fincheck.meta.CheckRule;
import com.fincheck.meta.RuleFamily;
import com.fincheck.meta.SubjectEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("规则条件改写测试")
class RuleConditionRendererTest {

    private final RuleConditionRenderer renderer = new RuleConditionRenderer(new FormulaCompiler(),
        new FieldCodeResolver(List.of(
            new SubjectEntry("ZC", "assets"),
            new SubjectEntry("ZCZJ", "tot_assets"),
            new SubjectEntry("FZ", "liab"),
            new SubjectEntry("FZHJ", "tot_liab"),
            new SubjectEntry("YYSR", "oper_rev"),
            new SubjectEntry("JLR", "net_profit"))));

    private static CheckRule cross(String condition, String keywordCode) {
        CheckRule rule = new CheckRule(RuleFamily.CROSS, "c", condition, 1, "model1");
        rule.setKeywordCode(keywordCode);
        return rule;
    }

    @Test
    @DisplayName("会计等式：字段套 COALESCE 后替换为物理代码")
    void testCross() {
        assertEquals("COALESCE(tot_assets, 0)>=COALESCE(assets, 0)", renderer.render(cross("ZCZJ >= ZC", null)));
        assertEquals("abs(COALESCE(tot_assets, 0)-COALESCE(liab, 0))<=1",
            renderer.render(cross("abs(ZCZJ-FZ)<=1", null)));
    }

    @Test
    @DisplayName("关键字不套 COALESCE，== 改为 =")
    void testCrossWithKeyword() {
        assertEquals("tot_liab=COALESCE(liab, 0)*2", renderer.render(cross("FZHJ==FZ*2", "FZHJ")));
    }

    @Test
    @DisplayName("字典中没有的字段保持原样")
    void testUnknownField() {
        assertEquals("COALESCE(assets, 0)+COALESCE(X, 0)>0", renderer.render(cross("ZC+X>0", null)));
    }

    @Test
    @DisplayName("重要科目：虚拟代码改为非零条件")
    void testImportantSubject() {
        CheckRule rule = new CheckRule(RuleFamily.IMPORTANT_SUBJECT, "i", "YYSR OR JLR", 2, "model1");
        assertEquals("oper_rev<>0 OR net_profit<>0", renderer.render(rule));
    }

    @Test
    @DisplayName("单等号条件与空条件报错")
    void testInvalidCondition() {
        FormulaException e = assertThrows(FormulaException.class, () -> renderer.render(cross("ZC=FZ", null)));
        assertEquals(FormulaException.ErrorType.COMPARISON_FORM, e.getErrorType());

        e = assertThrows(FormulaException.class, () -> renderer.render(cross("-", null)));
        assertEquals(FormulaException.ErrorType.MALFORMED_FORMULA, e.getErrorType());
    }
}

package com.fincheck.service;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.formula.OnUnrecognized;
import com.fincheck.meta.Loader;
import com.fincheck.sql.CheckViewSqlGenerator;
import com.fincheck.sql.RenderMode;
import com.fincheck.sql.SqlVerifier;
import com.fincheck.sql.TableDdlGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("检查视图生成测试")
class CheckViewServiceTest {

    private Loader loader;

    @BeforeEach
    void setUp() throws Exception {
        loader = new Loader("classpath:fixtures/check-config-test.yaml");
        loader.load();
    }

    private CheckViewService service(SqlVerifier verifier) {
        CheckViewSqlGenerator viewGenerator = new CheckViewSqlGenerator("public", "c_check",
            "public.temp_avaliable_data2", "tad2", List.of("crmcode", "tyear", "tquarter"), RenderMode.CASE);
        return new CheckViewService(loader, new FormulaCompiler(OnUnrecognized.WARN), viewGenerator,
            new TableDdlGenerator("public"), verifier, "model1", Set.of(1, 2));
    }

    private static List<String> codes(List<RenderedRule> rules) {
        return rules.stream().map(RenderedRule::getCode).toList();
    }

    @Test
    @DisplayName("按模型和等级筛选规则，失败规则单独记录")
    void testGenerateCheckView() {
        CheckViewResult result = service(new SqlVerifier()).generateCheckView();

        assertEquals(List.of("c001", "c002", "i001", "i002"), codes(result.getRenderedRules()));
        assertEquals(List.of("c005", "i003"), result.getFailures().stream().map(RuleFailure::getCode).toList());
        assertTrue(result.hasFailures());
        assertNotNull(result.getGeneratedAt());

        String sql = result.getSql();
        assertTrue(sql.startsWith("CREATE OR REPLACE VIEW public.c_check\nAS\nSELECT\ntad2.crmcode AS crmcode,\n"));
        assertTrue(sql.contains("CASE WHEN COALESCE(tot_assets, 0)>=COALESCE(assets, 0) THEN 0 ELSE 1 END AS c001"));
        assertTrue(sql.contains("CASE WHEN tot_liab=COALESCE(liab, 0)*2 THEN 0 ELSE 2 END AS c002"));
        assertTrue(sql.contains("CASE WHEN tot_assets<>0 THEN 0 ELSE 1 END AS i001"));
        assertTrue(sql.contains("CASE WHEN oper_rev<>0 OR net_profit<>0 THEN 0 ELSE 2 END AS i002"));
        assertTrue(sql.contains("FROM public.temp_avaliable_data2 AS tad2;\n"));
        assertTrue(sql.contains("COMMENT ON COLUMN public.c_check.c001 IS '资产校验, chk01';"));
        assertFalse(sql.contains("c003"));
        assertFalse(sql.contains("c004"));
        assertFalse(sql.contains("c005"));
    }

    @Test
    @DisplayName("失败信息包含原始表达式")
    void testFailureDetails() {
        CheckViewResult result = service(new SqlVerifier()).generateCheckView();
        RuleFailure comparison = result.getFailures().get(0);
        assertEquals("ZC=FZ", comparison.getExpression());
        assertNotNull(comparison.getMessage());

        RuleFailure syntax = result.getFailures().get(1);
        assertEquals("YYSR AND", syntax.getExpression());
    }

    @Test
    @DisplayName("关闭语法校验时只记录公式错误")
    void testWithoutVerification() {
        CheckViewResult result = service(null).generateCheckView();
        assertEquals(List.of("c001", "c002", "i001", "i002", "i003"), codes(result.getRenderedRules()));
        assertEquals(1, result.getFailures().size());
        assertEquals("c005", result.getFailures().get(0).getCode());
    }

    @Test
    @DisplayName("建表语句")
    void testGenerateTableDdl() throws Exception {
        CheckViewService service = service(null);
        assertTrue(service.generateTableDdl("f_test").startsWith("CREATE TABLE IF NOT EXISTS public.f_test (\n"));
        assertThrows(Loader.NotFoundException.class, () -> service.generateTableDdl("nope"));
        assertEquals(2, service.listTables().size());
    }

    @Test
    @DisplayName("重新加载配置")
    void testReload() throws Exception {
        CheckViewService service = service(null);
        service.reload();
        assertEquals(8, loader.listRules().size());
    }
}

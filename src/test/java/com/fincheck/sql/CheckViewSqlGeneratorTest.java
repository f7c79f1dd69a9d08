package com.fincheck.sql;

import com.fincheck.meta.FieldInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("检查视图语句测试")
class CheckViewSqlGeneratorTest {

    private static CheckViewSqlGenerator generator(RenderMode mode) {
        return new CheckViewSqlGenerator("public", "c_check", "public.src", "s",
            List.of("crmcode", "tyear"), mode);
    }

    @Test
    @DisplayName("CASE 渲染")
    void testRenderColumnCase() {
        assertEquals("CASE WHEN a>b THEN 0 ELSE 2 END AS c001",
            generator(RenderMode.CASE).renderColumn("c001", "a>b", 2));
    }

    @Test
    @DisplayName("COALESCE 渲染")
    void testRenderColumnCoalesce() {
        assertEquals("COALESCE(a>b, false) AS c001",
            generator(RenderMode.COALESCE).renderColumn("c001", "a>b", 2));
    }

    @Test
    @DisplayName("完整视图语句带字段注释")
    void testRenderView() {
        FieldInfo field = new FieldInfo();
        field.setTableCode("c_check");
        field.setFieldCode("c001");
        field.setFieldName("资产校验");
        field.setHistoryCode("chk01");

        CheckViewSqlGenerator generator = generator(RenderMode.CASE);
        String sql = generator.renderView(List.of(generator.renderColumn("c001", "a>b", 1)), List.of(field));

        String expected = "CREATE OR REPLACE VIEW public.c_check\n"
            + "AS\n"
            + "SELECT\n"
            + "s.crmcode AS crmcode,\n"
            + "s.tyear AS tyear,\n"
            + "CASE WHEN a>b THEN 0 ELSE 1 END AS c001\n"
            + "FROM public.src AS s;\n"
            + "COMMENT ON COLUMN public.c_check.c001 IS '资产校验, chk01';\n";
        assertEquals(expected, sql);
    }

    @Test
    @DisplayName("没有校验列时只选主键列")
    void testRenderSelectWithoutRules() {
        assertEquals("SELECT\ns.crmcode AS crmcode,\ns.tyear AS tyear\nFROM public.src AS s",
            generator(RenderMode.CASE).renderSelect(List.of()));
    }

    @Test
    @DisplayName("渲染方式解析")
    void testRenderModeFromString() {
        assertEquals(RenderMode.COALESCE, RenderMode.fromString("coalesce"));
        assertEquals(RenderMode.CASE, RenderMode.fromString(""));
        assertThrows(IllegalArgumentException.class, () -> RenderMode.fromString("if"));
    }
}

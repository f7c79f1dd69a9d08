package com.fincheck.sql;

import com.fincheck.meta.SubjectEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("虚拟代码替换测试")
class FieldCodeResolverTest {

    private final FieldCodeResolver resolver = new FieldCodeResolver(List.of(
        new SubjectEntry("ZC", "assets"),
        new SubjectEntry("ZCZJ", "tot_assets"),
        new SubjectEntry("-", "placeholder")));

    @Test
    @DisplayName("替换表按虚拟代码长度降序")
    void testMappingsOrdered() {
        List<Map.Entry<String, String>> mappings = resolver.getMappings();
        assertEquals(2, mappings.size());
        assertEquals("ZCZJ", mappings.get(0).getKey());
        assertEquals("ZC", mappings.get(1).getKey());
    }

    @Test
    @DisplayName("短代码不改写长代码")
    void testLongestFirst() {
        assertEquals("tot_assets-assets", resolver.resolve("ZCZJ-ZC"));
        assertEquals("COALESCE(tot_assets, 0)>=COALESCE(assets, 0)",
            resolver.resolve("COALESCE(ZCZJ, 0)>=COALESCE(ZC, 0)"));
    }

    @Test
    @DisplayName("只替换完整标识符")
    void testIdentifierBoundary() {
        assertEquals("ZCX+assets+XZC", resolver.resolve("ZCX+ZC+XZC"));
    }

    @Test
    @DisplayName("已替换的片段不再被替换")
    void testSinglePass() {
        FieldCodeResolver chained = new FieldCodeResolver(List.of(
            new SubjectEntry("A", "B"),
            new SubjectEntry("B", "C")));
        assertEquals("B+C", chained.resolve("A+B"));
    }

    @Test
    @DisplayName("中文虚拟代码")
    void testChineseCodes() {
        FieldCodeResolver chinese = new FieldCodeResolver(List.of(
            new SubjectEntry("资产", "assets"),
            new SubjectEntry("资产总计", "tot_assets")));
        assertEquals("tot_assets-assets", chinese.resolve("资产总计-资产"));
    }

    @Test
    @DisplayName("非零条件替换")
    void testResolveNonZero() {
        assertEquals("tot_assets<>0 OR assets<>0", resolver.resolveNonZero("ZCZJ OR ZC"));
    }

    @Test
    @DisplayName("空文本与空替换表")
    void testEmpty() {
        assertNull(FieldCodeResolver.substitute(null, resolver.getMappings()));
        assertEquals("ZC", FieldCodeResolver.substitute("ZC", List.of()));
        assertEquals("ZC", new FieldCodeResolver(List.of()).resolve("ZC"));
    }
}

package com.fincheck.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("条件拼接测试")
class FormulaConcatenatorTest {

    @Test
    @DisplayName("无效编组丢弃，单个片段不加括号")
    void testSingleValidGroup() {
        List<List<String>> groups = List.of(List.of("a", "=", "1"), List.of("", "irrelevant"));
        assertEquals("a=1", FormulaConcatenator.concatenate(groups, "AND"));
    }

    @Test
    @DisplayName("没有有效编组时返回 null")
    void testNoGroup() {
        assertNull(FormulaConcatenator.concatenate(List.of(), "AND"));
        assertNull(FormulaConcatenator.concatenate(null, "AND"));
        assertNull(FormulaConcatenator.concatenate(List.of(List.of("a", "nan")), "AND"));
    }

    @Test
    @DisplayName("多个片段加括号后用逻辑符连接")
    void testMultipleGroups() {
        List<List<String>> groups = List.of(
            List.of("a", ">", "1"),
            List.of("b", "<", "2"),
            Arrays.asList("c", null),
            List.of("d", "==", "None"));
        assertEquals("(a>1) & (b<2)", FormulaConcatenator.concatenate(groups, " & "));
    }
}

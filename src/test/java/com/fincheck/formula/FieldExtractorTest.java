package com.fincheck.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("字段解析测试")
class FieldExtractorTest {

    @Test
    @DisplayName("按运算符切分字段")
    void testExtractBasic() {
        assertEquals(List.of("A", "B", "C"), FieldExtractor.extract("A+B*C", true));
    }

    @Test
    @DisplayName("数字、带引号字符串、保留字不是字段")
    void testExtractSkipsLiterals() {
        List<String> fields = FieldExtractor.extract("A+100-2.5+\"x\"+sum+abs(B)", true);
        assertEquals(List.of("A", "B"), fields);
        assertFalse(fields.contains("100"));
        assertFalse(fields.contains("\"x\""));
    }

    @Test
    @DisplayName("偏移符后的负号不切开")
    void testExtractKeepsNegativeShift() {
        assertEquals(List.of("A^1", "A^-1", "B~-2"), FieldExtractor.extract("A^1-A^-1+B~-2", false));
    }

    @Test
    @DisplayName("可执行字段补全括号")
    void testExtractExecutableField() {
        assertEquals(List.of("B.abs()", "C.isna()"), FieldExtractor.extract("B.abs+C.isna()", false));
    }

    @Test
    @DisplayName("去重模式返回字段原名，按首次出现顺序")
    void testExtractUnique() {
        assertEquals(List.of("A", "B", "C"), FieldExtractor.extract("A^1-A°0+B.abs()*A-C~-1", true));
    }

    @Test
    @DisplayName("非去重模式保留重复")
    void testExtractNotUnique() {
        assertEquals(List.of("A", "A", "B"), FieldExtractor.extract("A*A>=B", false));
    }

    @Test
    @DisplayName("数字判断忽略小数点和负号")
    void testIsNumeric() {
        assertTrue(FieldExtractor.isNumeric("12"));
        assertTrue(FieldExtractor.isNumeric("-1.5"));
        assertFalse(FieldExtractor.isNumeric("."));
        assertFalse(FieldExtractor.isNumeric("A1"));
    }
}

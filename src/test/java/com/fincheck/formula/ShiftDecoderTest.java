package com.fincheck.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("特殊字段拆解测试")
class ShiftDecoderTest {

    private static ShiftToken decodeShift(String field, String sign) {
        SpecialField decoded = ShiftDecoder.tryDecode(field, sign);
        assertInstanceOf(ShiftToken.class, decoded);
        return (ShiftToken) decoded;
    }

    @Test
    @DisplayName("年份偏移 ^1 为上一年")
    void testYearBackward() {
        ShiftToken token = decodeShift("A^1", null);
        assertTrue(token.isSuccess());
        assertEquals("A", token.getOrigin());
        assertEquals(ShiftUnit.YEAR, token.getUnit());
        assertEquals(ShiftDirection.BACKWARD, token.getDirection());
        assertEquals(1, token.getOffset());
        assertEquals("A_Ybackward1", token.toCanonicalName());
    }

    @Test
    @DisplayName("年末偏移 °0 为本年末")
    void testYearEndCurrent() {
        ShiftToken token = decodeShift("A°0", null);
        assertEquals(ShiftUnit.YEAR_END, token.getUnit());
        assertEquals(ShiftDirection.CURRENT, token.getDirection());
        assertEquals(0, token.getOffset());
        assertEquals("A_YENDcurrent0", token.toCanonicalName());
    }

    @Test
    @DisplayName("负参数为向后偏移，编码取绝对值")
    void testForward() {
        ShiftToken quarter = decodeShift("A~-1", null);
        assertEquals(ShiftUnit.QUARTER, quarter.getUnit());
        assertEquals(ShiftDirection.FORWARD, quarter.getDirection());
        assertEquals(-1, quarter.getOffset());
        assertEquals("A_Qforward1", quarter.toCanonicalName());

        assertEquals("A_YENDforward1", decodeShift("A°-1", null).toCanonicalName());
        assertEquals("A_YENDbackward1", decodeShift("A°1", null).toCanonicalName());
        assertEquals("B_Qbackward2", decodeShift("B~2", null).toCanonicalName());
    }

    @Test
    @DisplayName("自然语言标记按 上/下 个数计数")
    void testNaturalLanguageSign() {
        assertEquals("A_Mbackward2", decodeShift("A", "上上月").toCanonicalName());
        assertEquals("A_Qforward1", decodeShift("A", "下季").toCanonicalName());
        assertEquals("A_YENDcurrent0", decodeShift("A", "本年末").toCanonicalName());
        assertEquals("A_Ybackward1", decodeShift("A", "上年").toCanonicalName());
    }

    @Test
    @DisplayName("本期标记返回原字段")
    void testCurrentPeriod() {
        ShiftToken token = decodeShift("A", "本期");
        assertEquals(ShiftToken.Status.CURRENT_PERIOD, token.getStatus());
        assertFalse(token.isSuccess());
        assertEquals("A", token.toCanonicalName());
    }

    @Test
    @DisplayName("可执行后缀优先")
    void testExecutable() {
        SpecialField decoded = ShiftDecoder.tryDecode("A.abs()", null);
        assertInstanceOf(ExecutableFieldToken.class, decoded);
        assertEquals("A", decoded.getOrigin());
        assertEquals(".abs()", ((ExecutableFieldToken) decoded).getSuffix());
        assertEquals("A.abs()", decoded.toCanonicalName());
        assertTrue(decoded.isSuccess());
    }

    @Test
    @DisplayName("无标记时按处理方式忽略、告警或抛出")
    void testNoMarkerPolicy() {
        SpecialField ignored = ShiftDecoder.decode("B", null, OnUnrecognized.IGNORE);
        assertFalse(ignored.isSuccess());
        assertEquals("B", ignored.toCanonicalName());

        SpecialField warned = ShiftDecoder.decode("B", null, OnUnrecognized.WARN);
        assertEquals(ShiftToken.Status.NO_MARKER, ((ShiftToken) warned).getStatus());

        FormulaException e = assertThrows(FormulaException.class,
            () -> ShiftDecoder.decode("B", null, OnUnrecognized.RAISE));
        assertEquals(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_MARKER, e.getErrorType());
    }

    @Test
    @DisplayName("无法识别的单位、方向、偏移量")
    void testMalformedSigns() {
        assertEquals(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_UNIT,
            assertThrows(FormulaException.class, () -> ShiftDecoder.tryDecode("A", "xyz")).getErrorType());
        assertEquals(FormulaException.ErrorType.UNRECOGNIZED_SHIFT_DIRECTION,
            assertThrows(FormulaException.class, () -> ShiftDecoder.tryDecode("A", "年")).getErrorType());
        assertEquals(FormulaException.ErrorType.MISSING_SHIFT_OFFSET,
            assertThrows(FormulaException.class, () -> ShiftDecoder.tryDecode("A^", null)).getErrorType());
    }

    @Test
    @DisplayName("偏移量超出整数范围")
    void testOffsetOutOfRange() {
        assertEquals(FormulaException.ErrorType.MISSING_SHIFT_OFFSET,
            assertThrows(FormulaException.class, () -> ShiftDecoder.tryDecode("A^-2147483648", null)).getErrorType());
        assertEquals(FormulaException.ErrorType.MISSING_SHIFT_OFFSET,
            assertThrows(FormulaException.class, () -> ShiftDecoder.tryDecode("A^99999999999", null)).getErrorType());
        assertEquals(-2147483647, ((ShiftToken) ShiftDecoder.tryDecode("A^-2147483647", null)).getOffset());
    }

    @Test
    @DisplayName("处理方式解析")
    void testOnUnrecognizedFromString() {
        assertEquals(OnUnrecognized.RAISE, OnUnrecognized.fromString("raise"));
        assertEquals(OnUnrecognized.WARN, OnUnrecognized.fromString(null));
        assertThrows(IllegalArgumentException.class, () -> OnUnrecognized.fromString("abort"));
    }
}

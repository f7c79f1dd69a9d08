package com.fincheck.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 按编组拼接条件公式
 *
 * 内层列表为一个语句的各个元素（直接拼接），外层为各个编组（用逻辑符连接）。
 * 含空值或占位符的编组整体丢弃。
 */
public final class FormulaConcatenator {

    private static final Set<String> INVALID_ELEMENTS = Set.of("", "-", "nan", "NaN", "NAN", "None");

    private FormulaConcatenator() {
    }

    /**
     * @return 条件字符串；没有有效编组时返回 null，表示无条件
     */
    public static String concatenate(List<List<String>> groups, String operator) {
        List<String> fragments = new ArrayList<>();
        if (groups != null) {
            for (List<String> group : groups) {
                if (isValid(group)) {
                    fragments.add(String.join("", group));
                }
            }
        }

        if (fragments.isEmpty()) {
            return null;
        }
        if (fragments.size() == 1) {
            return fragments.get(0);
        }
        return "(" + String.join(")" + operator + "(", fragments) + ")";
    }

    static boolean isValid(List<String> group) {
        if (group == null) {
            return false;
        }
        for (String element : group) {
            if (element == null || INVALID_ELEMENTS.contains(element)) {
                return false;
            }
        }
        return true;
    }
}

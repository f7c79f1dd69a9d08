package com.fincheck.sql;

import com.fincheck.formula.FormulaText;
import com.fincheck.meta.FieldInfo;
import com.fincheck.meta.TableInfo;

/**
 * COMMENT ON 语句
 */
public final class CommentStatements {

    private CommentStatements() {
    }

    /**
     * COMMENT ON COLUMN schema.table.field IS '中文名[, 同步代码][, 旧代码][: 备注]';
     */
    public static String columnComment(FieldInfo field, String schema) {
        StringBuilder text = new StringBuilder();
        if (present(field.getFieldName())) {
            text.append(field.getFieldName());
        }
        if (present(field.getSyncFieldCode())) {
            text.append(", ").append(field.getSyncFieldCode());
        }
        if (present(field.getHistoryCode())) {
            text.append(", ").append(field.getHistoryCode());
        }
        if (present(field.getRemarks())) {
            text.append(": ").append(field.getRemarks());
        }
        return "COMMENT ON COLUMN " + schema + "." + field.getTableCode() + "." + field.getFieldCode()
            + " IS " + quote(text.toString()) + ";";
    }

    /**
     * 表名为空时返回空串
     */
    public static String tableComment(TableInfo table, String schema) {
        if (!present(table.getTableName())) {
            return "";
        }
        return "COMMENT ON TABLE " + schema + "." + table.getTableCode() + " IS " + quote(table.getTableName()) + ";";
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static boolean present(String value) {
        return !FormulaText.isBlankOrPlaceholder(value);
    }
}

package com.fincheck.sql;

import com.fincheck.meta.FieldInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查视图语句拼接
 * <pre>
 * CREATE OR REPLACE VIEW public.c_check
 * AS
 * SELECT
 * tad2.crmcode AS crmcode,
 * ...
 * CASE WHEN ... THEN 0 ELSE 1 END AS chk001
 * FROM public.temp_avaliable_data2 AS tad2;
 * COMMENT ON COLUMN ...
 * </pre>
 */
public class CheckViewSqlGenerator {

    private final String schema;
    private final String viewName;
    private final String sourceTable;
    private final String sourceAlias;
    private final List<String> keyColumns;
    private final RenderMode renderMode;

    public CheckViewSqlGenerator(String schema, String viewName, String sourceTable, String sourceAlias,
                                 List<String> keyColumns, RenderMode renderMode) {
        this.schema = schema;
        this.viewName = viewName;
        this.sourceTable = sourceTable;
        this.sourceAlias = sourceAlias;
        this.keyColumns = List.copyOf(keyColumns);
        this.renderMode = renderMode;
    }

    public String getViewName() {
        return viewName;
    }

    public String getSchema() {
        return schema;
    }

    /**
     * 单条校验列
     */
    public String renderColumn(String code, String condition, Integer level) {
        if (renderMode == RenderMode.COALESCE) {
            return "COALESCE(" + condition + ", false) AS " + code;
        }
        return "CASE WHEN " + condition + " THEN 0 ELSE " + level + " END AS " + code;
    }

    /**
     * 主键列在前，校验列在后
     */
    public List<String> renderSelectItems(List<String> columns) {
        List<String> items = new ArrayList<>();
        for (String key : keyColumns) {
            items.add(sourceAlias + "." + key + " AS " + key);
        }
        items.addAll(columns);
        return items;
    }

    /**
     * 视图的 SELECT 部分，不含结尾分号
     */
    public String renderSelect(List<String> columns) {
        return "SELECT\n" + String.join(",\n", renderSelectItems(columns)) + "\nFROM " + sourceTable + " AS " + sourceAlias;
    }

    /**
     * 完整视图语句，后接视图字段的注释
     */
    public String renderView(List<String> columns, List<FieldInfo> viewFields) {
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE OR REPLACE VIEW ").append(schema).append('.').append(viewName).append('\n')
            .append("AS\n")
            .append(renderSelect(columns)).append(";\n");
        for (FieldInfo field : viewFields) {
            sql.append(CommentStatements.columnComment(field, schema)).append('\n');
        }
        return sql.toString();
    }
}

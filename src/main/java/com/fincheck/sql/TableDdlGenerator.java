package com.fincheck.sql;

import com.fincheck.formula.FormulaText;
import com.fincheck.meta.FieldInfo;
import com.fincheck.meta.TableConstraint;
import com.fincheck.meta.TableInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 建表语句拼接：字段定义、约束、注释、update_at 触发器
 */
public class TableDdlGenerator {

    private static final String INDENT = "    ";
    private static final String UPDATE_AT_FIELD = "update_at";
    private static final String TRIGGER_SUFFIX = "update";
    private static final String TRIGGER_FUNCTION = "set_update_at";

    private final String schema;

    public TableDdlGenerator(String schema) {
        this.schema = schema;
    }

    public String generate(TableInfo table, List<FieldInfo> fields, List<TableConstraint> constraints) {
        List<String> defs = new ArrayList<>();
        for (FieldInfo field : fields) {
            defs.add(fieldDefinition(field));
        }
        for (List<TableConstraint> group : groupByName(constraints).values()) {
            defs.add(constraintDefinition(group));
        }

        String createTable = "CREATE TABLE IF NOT EXISTS " + schema + "." + table.getTableCode() + " (\n"
            + String.join(",\n", defs) + "\n);\n";

        List<String> extra = new ArrayList<>();
        String tableComment = CommentStatements.tableComment(table, schema);
        if (!tableComment.isEmpty()) {
            extra.add(tableComment);
        }
        List<String> columnComments = new ArrayList<>();
        for (FieldInfo field : fields) {
            columnComments.add(CommentStatements.columnComment(field, schema));
        }
        if (!columnComments.isEmpty()) {
            extra.add(String.join("\n", columnComments));
        }
        if (fields.stream().anyMatch(f -> UPDATE_AT_FIELD.equals(f.getFieldCode()))) {
            extra.add(triggerDefinition(table.getTableCode()));
        }
        return createTable + String.join("\n\n", extra);
    }

    /**
     * 有默认值且允许为空时不写 NULL
     */
    String fieldDefinition(FieldInfo field) {
        StringBuilder def = new StringBuilder(INDENT).append(field.getFieldCode());
        if (!FormulaText.isBlankOrPlaceholder(field.getDataTypePara())) {
            def.append(' ').append(field.getDataTypePara());
        }
        boolean hasDefault = !FormulaText.isBlankOrPlaceholder(field.getDefaultValue());
        if (hasDefault) {
            def.append(" DEFAULT ").append(field.getDefaultValue());
        }
        if (field.isNotNull()) {
            def.append(" NOT NULL");
        } else if (!hasDefault) {
            def.append(" NULL");
        }
        return def.toString();
    }

    /**
     * 外键两行配置，其余约束一行
     */
    String constraintDefinition(List<TableConstraint> rows) {
        TableConstraint owner;
        TableConstraint reference = null;
        if (rows.size() == 1) {
            owner = rows.get(0);
            if (isForeignKey(owner)) {
                throw new IllegalArgumentException("foreign key constraint '" + owner.getConstraintName() + "' should have two rows");
            }
        } else if (rows.size() == 2) {
            owner = rows.stream().filter(r -> FormulaText.isBlankOrPlaceholder(r.getFkRefTo())).findFirst().orElse(null);
            reference = rows.stream().filter(r -> !FormulaText.isBlankOrPlaceholder(r.getFkRefTo())).findFirst().orElse(null);
            if (owner == null || reference == null || !isForeignKey(owner)) {
                throw new IllegalArgumentException("constraint '" + rows.get(0).getConstraintName()
                    + "': one of the two rows should be the foreign key owner, the other its reference");
            }
        } else {
            throw new IllegalArgumentException("constraint '" + rows.get(0).getConstraintName() + "' should have one or two rows");
        }

        String name = owner.getConstraintName();
        if (owner.getColumns().isEmpty() || (reference != null && reference.getColumns().isEmpty())) {
            throw new IllegalArgumentException("constraint '" + name + "' should define columns");
        }
        String columns = String.join(", ", owner.getColumns());
        String type = owner.getConstraintType() == null ? "" : owner.getConstraintType().toLowerCase(Locale.ROOT);
        switch (type) {
            case "pk":
                return INDENT + "CONSTRAINT " + name + " PRIMARY KEY (" + columns + ")";
            case "uq":
                return INDENT + "CONSTRAINT " + name + " UNIQUE (" + columns + ")";
            case "idx":
                return INDENT + "CONSTRAINT " + name + " INDEX (" + columns + ")";
            case "fk":
                if (FormulaText.isBlankOrPlaceholder(reference.getFkLimit())) {
                    throw new IllegalArgumentException("foreign key constraint '" + name
                        + "' must define fk_limit, like 'ON DELETE RESTRICT ON UPDATE CASCADE'");
                }
                return INDENT + "CONSTRAINT " + name + " FOREIGN KEY (" + columns + ") REFERENCES "
                    + schema + "." + reference.getFkRefTo() + "(" + String.join(", ", reference.getColumns()) + ") "
                    + reference.getFkLimit();
            default:
                throw new IllegalArgumentException(owner.getOwnerTable() + ": unsupported constraint type: " + owner.getConstraintType());
        }
    }

    String triggerDefinition(String tableCode) {
        return "CREATE TRIGGER " + tableCode + "_" + TRIGGER_SUFFIX + " BEFORE \n"
            + INDENT + "UPDATE ON " + schema + "." + tableCode + " \n"
            + INDENT + "FOR EACH ROW EXECUTE FUNCTION " + TRIGGER_FUNCTION + "();";
    }

    private static boolean isForeignKey(TableConstraint constraint) {
        return "fk".equalsIgnoreCase(constraint.getConstraintType());
    }

    /**
     * 按约束名分组，按约束名排序
     */
    private static Map<String, List<TableConstraint>> groupByName(List<TableConstraint> constraints) {
        Map<String, List<TableConstraint>> groups = new TreeMap<>();
        for (TableConstraint constraint : constraints) {
            groups.computeIfAbsent(constraint.getConstraintName(), k -> new ArrayList<>()).add(constraint);
        }
        return groups;
    }
}

package com.fincheck.meta;

import com.fincheck.formula.FormulaText;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 配置表加载器，加载后只读，reload 时整体替换
 */
public class Loader {
    private final Parser parser;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private CheckConfig config;

    public Loader(String filePath) {
        this.parser = new Parser(filePath);
    }

    public void load() throws IOException, Validator.ValidationException {
        lock.writeLock().lock();
        try {
            CheckConfig parsedConfig = parser.parse();
            markFamily(parsedConfig.getCrossChecks(), RuleFamily.CROSS);
            markFamily(parsedConfig.getImportantSubjectChecks(), RuleFamily.IMPORTANT_SUBJECT);

            Validator configValidator = new Validator(parsedConfig);
            configValidator.validate();
            this.config = parsedConfig;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void markFamily(List<CheckRule> rules, RuleFamily family) {
        for (CheckRule rule : rules) {
            rule.setFamily(family);
        }
    }

    public CheckConfig getConfig() {
        lock.readLock().lock();
        try {
            return config;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reload() throws IOException, Validator.ValidationException {
        load();
    }

    public List<SubjectEntry> listSubjects() {
        CheckConfig current = getConfig();
        if (current == null) {
            return List.of();
        }
        return List.copyOf(current.getSubjects());
    }

    /**
     * 全部校验规则，会计等式在前
     */
    public List<CheckRule> listRules() {
        CheckConfig current = getConfig();
        if (current == null) {
            return List.of();
        }
        List<CheckRule> rules = new ArrayList<>(current.getCrossChecks());
        rules.addAll(current.getImportantSubjectChecks());
        return rules;
    }

    /**
     * table_code 为 "-" 的行不算作表
     */
    public List<TableInfo> listTables() {
        CheckConfig current = getConfig();
        if (current == null) {
            return List.of();
        }
        return current.getTables().stream()
            .filter(t -> !FormulaText.isBlankOrPlaceholder(t.getTableCode()))
            .toList();
    }

    public TableInfo getTable(String tableCode) throws NotFoundException {
        for (TableInfo table : listTables()) {
            if (tableCode.equals(table.getTableCode())) {
                return table;
            }
        }
        throw new NotFoundException("table '" + tableCode + "' not found");
    }

    /**
     * 表的字段，按 field_order 排序
     */
    public List<FieldInfo> getFields(String tableCode) throws NotFoundException {
        getTable(tableCode);
        return findFields(tableCode);
    }

    /**
     * 不要求表清单中存在该表，检查视图的字段注释用
     */
    public List<FieldInfo> findFields(String tableCode) {
        CheckConfig current = getConfig();
        if (current == null) {
            return List.of();
        }
        return current.getFields().stream()
            .filter(f -> tableCode.equals(f.getTableCode()))
            .sorted(Comparator.comparing(FieldInfo::getFieldOrder, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    public List<TableConstraint> getConstraints(String tableCode) throws NotFoundException {
        getTable(tableCode);
        return getConfig().getConstraints().stream()
            .filter(c -> tableCode.equals(c.getOwnerTable()))
            .toList();
    }

    public static class NotFoundException extends Exception {
        public NotFoundException(String message) {
            super(message);
        }
    }
}

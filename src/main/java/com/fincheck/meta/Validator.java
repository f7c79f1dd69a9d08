package com.fincheck.meta;

import com.fincheck.formula.FormulaText;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 配置表结构校验。不校验公式中的字段是否存在。
 */
public class Validator {
    private static final Set<String> VALID_CONSTRAINT_TYPES = Set.of("pk", "uq", "idx", "fk");

    private final CheckConfig config;

    public Validator(CheckConfig config) {
        this.config = config;
    }

    public void validate() throws ValidationException {
        validateSubjects();
        validateRules(config.getCrossChecks(), "cross_checks");
        validateRules(config.getImportantSubjectChecks(), "important_subject_checks");
        validateFields();
        validateConstraints();
    }

    private void validateSubjects() throws ValidationException {
        Set<String> virtualCodes = new HashSet<>();
        List<SubjectEntry> subjects = config.getSubjects();
        for (int i = 0; i < subjects.size(); i++) {
            SubjectEntry subject = subjects.get(i);
            if (isAbsent(subject.getFieldVirtualCode())) {
                throw new ValidationException("subject_dict[" + i + "]: field_virtual_code is required");
            }
            if (isAbsent(subject.getFieldCode())) {
                throw new ValidationException("subject_dict[" + subject.getFieldVirtualCode() + "]: field_code is required");
            }
            if (!virtualCodes.add(subject.getFieldVirtualCode())) {
                throw new ValidationException("duplicate field_virtual_code: " + subject.getFieldVirtualCode());
            }
        }
    }

    private void validateRules(List<CheckRule> rules, String group) throws ValidationException {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            CheckRule rule = rules.get(i);
            if (isAbsent(rule.getCode())) {
                throw new ValidationException(group + "[" + i + "]: code is required");
            }
            if (!codes.add(rule.getCode())) {
                throw new ValidationException("duplicate rule code in " + group + ": " + rule.getCode());
            }
        }
    }

    private void validateFields() throws ValidationException {
        List<FieldInfo> fields = config.getFields();
        for (int i = 0; i < fields.size(); i++) {
            FieldInfo field = fields.get(i);
            if (isAbsent(field.getTableCode()) || isAbsent(field.getFieldCode())) {
                throw new ValidationException("fields[" + i + "]: table_code and field_code are required");
            }
        }
    }

    private void validateConstraints() throws ValidationException {
        for (TableConstraint constraint : config.getConstraints()) {
            if (isAbsent(constraint.getConstraintName())) {
                throw new ValidationException("constraints[" + constraint.getOwnerTable() + "]: constraint_name is required");
            }
            String type = constraint.getConstraintType();
            if (type != null && !VALID_CONSTRAINT_TYPES.contains(type.toLowerCase())) {
                throw new ValidationException("constraint '" + constraint.getConstraintName() + "': invalid constraint_type '" + type + "'");
            }
            if (constraint.getColumns().isEmpty()) {
                throw new ValidationException("constraint '" + constraint.getConstraintName() + "': columns is required");
            }
        }
    }

    private static boolean isAbsent(String value) {
        return FormulaText.isBlankOrPlaceholder(value);
    }

    public static class ValidationException extends Exception {
        public ValidationException(String message) {
            super(message);
        }
    }
}

package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 配置表集合，对应 YAML 文件的根节点
 */
public class CheckConfig {
    @JsonProperty("subject_dict")
    private List<SubjectEntry> subjects = new ArrayList<>();

    @JsonProperty("cross_checks")
    private List<CheckRule> crossChecks = new ArrayList<>();

    @JsonProperty("important_subject_checks")
    private List<CheckRule> importantSubjectChecks = new ArrayList<>();

    @JsonProperty("tables")
    private List<TableInfo> tables = new ArrayList<>();

    @JsonProperty("fields")
    private List<FieldInfo> fields = new ArrayList<>();

    @JsonProperty("constraints")
    private List<TableConstraint> constraints = new ArrayList<>();

    public List<SubjectEntry> getSubjects() {
        return subjects;
    }

    public void setSubjects(List<SubjectEntry> subjects) {
        this.subjects = subjects != null ? subjects : new ArrayList<>();
    }

    public List<CheckRule> getCrossChecks() {
        return crossChecks;
    }

    public void setCrossChecks(List<CheckRule> crossChecks) {
        this.crossChecks = crossChecks != null ? crossChecks : new ArrayList<>();
    }

    public List<CheckRule> getImportantSubjectChecks() {
        return importantSubjectChecks;
    }

    public void setImportantSubjectChecks(List<CheckRule> importantSubjectChecks) {
        this.importantSubjectChecks = importantSubjectChecks != null ? importantSubjectChecks : new ArrayList<>();
    }

    public List<TableInfo> getTables() {
        return tables;
    }

    public void setTables(List<TableInfo> tables) {
        this.tables = tables != null ? tables : new ArrayList<>();
    }

    public List<FieldInfo> getFields() {
        return fields;
    }

    public void setFields(List<FieldInfo> fields) {
        this.fields = fields != null ? fields : new ArrayList<>();
    }

    public List<TableConstraint> getConstraints() {
        return constraints;
    }

    public void setConstraints(List<TableConstraint> constraints) {
        this.constraints = constraints != null ? constraints : new ArrayList<>();
    }
}

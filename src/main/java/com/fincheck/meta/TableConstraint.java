package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 表约束行。外键由两行组成：fk_ref_to 为空的是本表一行，另一行为被引用表及其列。
 */
public class TableConstraint {
    @JsonProperty("owner_table")
    private String ownerTable;

    @JsonProperty("constraint_name")
    private String constraintName;

    @JsonProperty("constraint_type")
    private String constraintType;

    @JsonProperty("fk_ref_to")
    private String fkRefTo;

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("fk_limit")
    private String fkLimit;

    public String getOwnerTable() {
        return ownerTable;
    }

    public void setOwnerTable(String ownerTable) {
        this.ownerTable = ownerTable;
    }

    public String getConstraintName() {
        return constraintName;
    }

    public void setConstraintName(String constraintName) {
        this.constraintName = constraintName;
    }

    public String getConstraintType() {
        return constraintType;
    }

    public void setConstraintType(String constraintType) {
        this.constraintType = constraintType;
    }

    public String getFkRefTo() {
        return fkRefTo;
    }

    public void setFkRefTo(String fkRefTo) {
        this.fkRefTo = fkRefTo;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns == null ? new ArrayList<>() : columns;
    }

    public String getFkLimit() {
        return fkLimit;
    }

    public void setFkLimit(String fkLimit) {
        this.fkLimit = fkLimit;
    }
}

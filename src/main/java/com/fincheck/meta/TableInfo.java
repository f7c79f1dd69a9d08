package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

public class TableInfo {
    @JsonProperty("table_code")
    private String tableCode;

    @JsonProperty("table_name")
    private String tableName;

    public TableInfo() {
    }

    public TableInfo(String tableCode, String tableName) {
        this.tableCode = tableCode;
        this.tableName = tableName;
    }

    public String getTableCode() {
        return tableCode;
    }

    public void setTableCode(String tableCode) {
        this.tableCode = tableCode;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }
}

package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 字段字典行，文本列中的 "-"、"nan" 等占位符视为无值
 */
public class FieldInfo {
    @JsonProperty("table_code")
    private String tableCode;

    @JsonProperty("field_order")
    private Integer fieldOrder;

    @JsonProperty("field_code")
    private String fieldCode;

    @JsonProperty("field_name")
    private String fieldName;

    @JsonProperty("data_type_para")
    private String dataTypePara;

    @JsonProperty("default_value")
    private String defaultValue;

    @JsonProperty("is_not_null")
    private boolean notNull;

    @JsonProperty("enable_status")
    private String enableStatus;

    @JsonProperty("sync_field_code")
    private String syncFieldCode;

    @JsonProperty("history_code")
    private String historyCode;

    @JsonProperty("remarks")
    private String remarks;

    public String getTableCode() {
        return tableCode;
    }

    public void setTableCode(String tableCode) {
        this.tableCode = tableCode;
    }

    public Integer getFieldOrder() {
        return fieldOrder;
    }

    public void setFieldOrder(Integer fieldOrder) {
        this.fieldOrder = fieldOrder;
    }

    public String getFieldCode() {
        return fieldCode;
    }

    public void setFieldCode(String fieldCode) {
        this.fieldCode = fieldCode;
    }

    public String getFieldName() {
        return fieldName;
    }

    public void setFieldName(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getDataTypePara() {
        return dataTypePara;
    }

    public void setDataTypePara(String dataTypePara) {
        this.dataTypePara = dataTypePara;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public boolean isNotNull() {
        return notNull;
    }

    public void setNotNull(boolean notNull) {
        this.notNull = notNull;
    }

    public String getEnableStatus() {
        return enableStatus;
    }

    public void setEnableStatus(String enableStatus) {
        this.enableStatus = enableStatus;
    }

    public String getSyncFieldCode() {
        return syncFieldCode;
    }

    public void setSyncFieldCode(String syncFieldCode) {
        this.syncFieldCode = syncFieldCode;
    }

    public String getHistoryCode() {
        return historyCode;
    }

    public void setHistoryCode(String historyCode) {
        this.historyCode = historyCode;
    }

    public String getRemarks() {
        return remarks;
    }

    public void setRemarks(String remarks) {
        this.remarks = remarks;
    }
}

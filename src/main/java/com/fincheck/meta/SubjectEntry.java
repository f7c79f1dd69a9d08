package com.fincheck.meta;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 科目字典：虚拟代码与物理字段代码的对应
 */
public class SubjectEntry {
    @JsonProperty("field_code")
    private String fieldCode;

    @JsonProperty("field_name")
    private String fieldName;

    @JsonProperty("field_virtual_code")
    private String fieldVirtualCode;

    @JsonProperty("field_history_code")
    private String fieldHistoryCode;

    public SubjectEntry() {
    }

    public SubjectEntry(String fieldVirtualCode, String fieldCode) {
        this.fieldVirtualCode = fieldVirtualCode;
        this.fieldCode = fieldCode;
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

    public String getFieldVirtualCode() {
        return fieldVirtualCode;
    }

    public void setFieldVirtualCode(String fieldVirtualCode) {
        this.fieldVirtualCode = fieldVirtualCode;
    }

    public String getFieldHistoryCode() {
        return fieldHistoryCode;
    }

    public void setFieldHistoryCode(String fieldHistoryCode) {
        this.fieldHistoryCode = fieldHistoryCode;
    }
}

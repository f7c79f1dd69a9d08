package com.fincheck.formula;

/**
 * 特殊标记字段的拆解结果：时间偏移字段或带可执行后缀的字段
 */
public interface SpecialField {

    /** 原始字段（去掉标记部分） */
    String getOrigin();

    /** 被拆解前的文本 */
    String getSource();

    boolean isSuccess();

    /**
     * 与字段特殊处理后的列名一致；只有时间偏移会被转换，其余返回原文本
     */
    String toCanonicalName();
}

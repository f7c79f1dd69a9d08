package com.fincheck.sql;

/**
 * 生成的 SQL 无法通过语法校验
 */
public class SqlVerificationException extends RuntimeException {
    private final String sql;

    public SqlVerificationException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}

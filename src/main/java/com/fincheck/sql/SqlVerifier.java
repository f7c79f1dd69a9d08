package com.fincheck.sql;

import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 用 Calcite 解析器校验生成的条件表达式和查询语句，只检查语法
 */
public class SqlVerifier {
    private static final Logger logger = LoggerFactory.getLogger(SqlVerifier.class);

    private static final String PLACEHOLDER_TABLE = "t";

    private final SqlParser.Config parserConfig;

    public SqlVerifier() {
        // LENIENT 允许 != 写法
        this.parserConfig = SqlParser.config().withConformance(SqlConformanceEnum.LENIENT);
    }

    /**
     * 只校验选择列表，来源表固定为占位表
     */
    public SqlNode verifySelectList(List<String> items, String context) {
        return verifyQuery("SELECT " + String.join(", ", items) + " FROM " + PLACEHOLDER_TABLE, context);
    }

    public SqlNode verifyQuery(String query, String context) {
        String cleaned = query.trim();
        while (cleaned.endsWith(";")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        try {
            return SqlParser.create(cleaned, parserConfig).parseQuery();
        } catch (SqlParseException e) {
            logger.debug("[verifyQuery] {} 解析失败: {}", context, e.getMessage());
            throw new SqlVerificationException(context + ": 查询语法错误 (" + firstLine(e.getMessage()) + ")", cleaned, e);
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}

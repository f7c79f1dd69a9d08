package com.fincheck.service;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.formula.FormulaException;
import com.fincheck.meta.CheckRule;
import com.fincheck.meta.Loader;
import com.fincheck.meta.TableInfo;
import com.fincheck.meta.Validator;
import com.fincheck.sql.CheckViewSqlGenerator;
import com.fincheck.sql.FieldCodeResolver;
import com.fincheck.sql.RuleConditionRenderer;
import com.fincheck.sql.SqlVerificationException;
import com.fincheck.sql.SqlVerifier;
import com.fincheck.sql.TableDdlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 检查视图与建表语句生成
 *
 * 单条规则改写或校验失败时记录到结果的 failures 中并跳过该规则，其余规则照常生成。
 */
public class CheckViewService {
    private static final Logger logger = LoggerFactory.getLogger(CheckViewService.class);

    private final Loader loader;
    private final FormulaCompiler compiler;
    private final CheckViewSqlGenerator viewGenerator;
    private final TableDdlGenerator ddlGenerator;
    private final SqlVerifier verifier;
    private final String modelCode;
    private final Set<Integer> levels;

    /**
     * @param verifier 为 null 时不做语法校验
     */
    public CheckViewService(Loader loader, FormulaCompiler compiler, CheckViewSqlGenerator viewGenerator,
                            TableDdlGenerator ddlGenerator, SqlVerifier verifier,
                            String modelCode, Set<Integer> levels) {
        this.loader = loader;
        this.compiler = compiler;
        this.viewGenerator = viewGenerator;
        this.ddlGenerator = ddlGenerator;
        this.verifier = verifier;
        this.modelCode = modelCode;
        this.levels = Set.copyOf(levels);
    }

    public CheckViewResult generateCheckView() {
        List<CheckRule> rules = selectRules(loader.listRules());
        RuleConditionRenderer renderer = new RuleConditionRenderer(compiler, new FieldCodeResolver(loader.listSubjects()));

        List<RenderedRule> rendered = new ArrayList<>();
        List<RuleFailure> failures = new ArrayList<>();
        for (CheckRule rule : rules) {
            try {
                String condition = renderer.render(rule);
                String column = viewGenerator.renderColumn(rule.getCode(), condition, rule.getLevel());
                if (verifier != null) {
                    verifier.verifySelectList(List.of(column), rule.getCode());
                }
                rendered.add(new RenderedRule(rule.getCode(), rule.getFamily(), rule.getLevel(), condition, column));
            } catch (FormulaException | SqlVerificationException e) {
                logger.warn("[generateCheckView] 规则 {} 生成失败: {}", rule.getCode(), e.getMessage());
                failures.add(new RuleFailure(rule.getCode(), rule.getCheckExpression(), e.getMessage()));
            }
        }

        List<String> columns = rendered.stream().map(RenderedRule::getColumn).toList();
        if (verifier != null) {
            verifier.verifySelectList(viewGenerator.renderSelectItems(columns), viewGenerator.getViewName());
        }
        String sql = viewGenerator.renderView(columns, loader.findFields(viewGenerator.getViewName()));
        logger.info("[generateCheckView] 生成检查视图 {}: {} 条规则, {} 条失败",
            viewGenerator.getViewName(), rendered.size(), failures.size());
        return new CheckViewResult(sql, rendered, failures);
    }

    /**
     * 按模型代码与等级筛选
     */
    List<CheckRule> selectRules(List<CheckRule> rules) {
        List<CheckRule> selected = new ArrayList<>();
        for (CheckRule rule : rules) {
            if (modelCode.equals(rule.getModelCode()) && rule.getLevel() != null && levels.contains(rule.getLevel())) {
                selected.add(rule);
            }
        }
        return selected;
    }

    public String generateTableDdl(String tableCode) throws Loader.NotFoundException {
        TableInfo table = loader.getTable(tableCode);
        return ddlGenerator.generate(table, loader.getFields(tableCode), loader.getConstraints(tableCode));
    }

    public List<TableInfo> listTables() {
        return loader.listTables();
    }

    public void reload() throws IOException, Validator.ValidationException {
        loader.reload();
        logger.info("[reload] 配置表已重新加载: {} 条规则, {} 个科目", loader.listRules().size(), loader.listSubjects().size());
    }
}

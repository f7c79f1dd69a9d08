package com.fincheck;

import com.fincheck.config.Config;
import com.fincheck.formula.FormulaCompiler;
import com.fincheck.meta.Loader;
import com.fincheck.meta.Validator;
import com.fincheck.service.CheckViewService;
import com.fincheck.sql.CheckViewSqlGenerator;
import com.fincheck.sql.SqlVerifier;
import com.fincheck.sql.TableDdlGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.util.HashSet;

@SpringBootApplication
public class FinCheckApplication {
    private static final Logger logger = LoggerFactory.getLogger(FinCheckApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(FinCheckApplication.class, args);
    }

    @Bean
    public Loader checkConfigLoader(Config config) {
        String filePath = config.getCheckConfigPath();
        Loader loader = new Loader(filePath);
        try {
            loader.load();
            logger.info("Check config loaded successfully: {} subjects, {} rules, {} tables",
                loader.listSubjects().size(), loader.listRules().size(), loader.listTables().size());
        } catch (IOException | Validator.ValidationException e) {
            logger.error("Failed to load check config from: {}", filePath, e);
            throw new RuntimeException("Failed to load check config: " + e.getMessage(), e);
        }
        return loader;
    }

    @Bean
    public FormulaCompiler formulaCompiler(Config config) {
        return new FormulaCompiler(config.getShiftOnUnrecognized());
    }

    @Bean
    public SqlVerifier sqlVerifier() {
        return new SqlVerifier();
    }

    @Bean
    public CheckViewSqlGenerator checkViewSqlGenerator(Config config) {
        return new CheckViewSqlGenerator(config.getViewSchema(), config.getViewName(),
            config.getSourceTable(), config.getSourceAlias(), config.getKeyColumns(), config.getRenderMode());
    }

    @Bean
    public TableDdlGenerator tableDdlGenerator(Config config) {
        return new TableDdlGenerator(config.getViewSchema());
    }

    @Bean
    public CheckViewService checkViewService(Config config, Loader loader, FormulaCompiler compiler,
                                             CheckViewSqlGenerator viewGenerator, TableDdlGenerator ddlGenerator,
                                             SqlVerifier verifier) {
        return new CheckViewService(loader, compiler, viewGenerator, ddlGenerator,
            config.isVerifySql() ? verifier : null,
            config.getModelCode(), new HashSet<>(config.getLevels()));
    }
}

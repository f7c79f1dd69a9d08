package com.fincheck.config;

import com.fincheck.formula.OnUnrecognized;
import com.fincheck.sql.RenderMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Configuration
public class Config {

    @Value("${check.config.path:classpath:check-config.yaml}")
    private String checkConfigPath;

    @Value("${check.view.schema:public}")
    private String viewSchema;

    @Value("${check.view.name:c_check}")
    private String viewName;

    @Value("${check.view.source-table:public.temp_avaliable_data2}")
    private String sourceTable;

    @Value("${check.view.source-alias:tad2}")
    private String sourceAlias;

    @Value("${check.view.key-columns:crmcode,tyear,tquarter}")
    private String[] keyColumns;

    @Value("${check.view.render-mode:case}")
    private String renderMode;

    @Value("${check.view.model-code:model1}")
    private String modelCode;

    @Value("${check.view.levels:1,2}")
    private String[] levels;

    @Value("${check.view.verify-sql:true}")
    private boolean verifySql;

    @Value("${formula.shift.on-unrecognized:warn}")
    private String shiftOnUnrecognized;

    public String getCheckConfigPath() {
        return checkConfigPath;
    }

    public String getViewSchema() {
        return viewSchema;
    }

    public String getViewName() {
        return viewName;
    }

    public String getSourceTable() {
        return sourceTable;
    }

    public String getSourceAlias() {
        return sourceAlias;
    }

    public List<String> getKeyColumns() {
        return trimAll(keyColumns);
    }

    public RenderMode getRenderMode() {
        return RenderMode.fromString(renderMode);
    }

    public String getModelCode() {
        return modelCode;
    }

    public List<Integer> getLevels() {
        List<Integer> parsed = new ArrayList<>();
        for (String level : trimAll(levels)) {
            parsed.add(Integer.parseInt(level));
        }
        return parsed;
    }

    public boolean isVerifySql() {
        return verifySql;
    }

    public OnUnrecognized getShiftOnUnrecognized() {
        return OnUnrecognized.fromString(shiftOnUnrecognized);
    }

    private static List<String> trimAll(String[] values) {
        return Arrays.stream(values)
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .toList();
    }
}

package com.fincheck.controller;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.meta.Loader;
import com.fincheck.service.CheckViewService;
import com.fincheck.sql.CheckViewSqlGenerator;
import com.fincheck.sql.RenderMode;
import com.fincheck.sql.SqlVerifier;
import com.fincheck.sql.TableDdlGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Set;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("检查视图接口测试")
class CheckViewControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() throws Exception {
        Loader loader = new Loader("classpath:fixtures/check-config-test.yaml");
        loader.load();
        CheckViewSqlGenerator viewGenerator = new CheckViewSqlGenerator("public", "c_check",
            "public.temp_avaliable_data2", "tad2", List.of("crmcode", "tyear", "tquarter"), RenderMode.COALESCE);
        CheckViewService service = new CheckViewService(loader, new FormulaCompiler(), viewGenerator,
            new TableDdlGenerator("public"), new SqlVerifier(), "model1", Set.of(1, 2));
        mockMvc = MockMvcBuilders.standaloneSetup(new CheckViewController(service)).build();
    }

    @Test
    @DisplayName("生成检查视图")
    void testGenerateCheckView() throws Exception {
        mockMvc.perform(get("/api/v1/check-view/sql"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.rendered_rules.length()").value(4))
            .andExpect(jsonPath("$.data.rendered_rules[0].column").value("COALESCE(COALESCE(tot_assets, 0)>=COALESCE(assets, 0), false) AS c001"))
            .andExpect(jsonPath("$.data.failures.length()").value(2))
            .andExpect(jsonPath("$.data.failures[1].code").value("i003"));
    }

    @Test
    @DisplayName("关键列配置错误导致整体语句校验失败时返回 500")
    void testGenerateCheckViewInvalidKeyColumns() throws Exception {
        Loader loader = new Loader("classpath:fixtures/check-config-test.yaml");
        loader.load();
        CheckViewSqlGenerator viewGenerator = new CheckViewSqlGenerator("public", "c_check",
            "public.temp_avaliable_data2", "tad2", List.of("crmcode", "tyear quarter"), RenderMode.COALESCE);
        CheckViewService service = new CheckViewService(loader, new FormulaCompiler(), viewGenerator,
            new TableDdlGenerator("public"), new SqlVerifier(), "model1", Set.of(1, 2));
        MockMvc invalidMockMvc = MockMvcBuilders.standaloneSetup(new CheckViewController(service)).build();

        invalidMockMvc.perform(get("/api/v1/check-view/sql"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(500));
    }

    @Test
    @DisplayName("表清单与建表语句")
    void testTables() throws Exception {
        mockMvc.perform(get("/api/v1/check-view/tables"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.length()").value(2));

        mockMvc.perform(get("/api/v1/check-view/tables/f_test/ddl"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/check-view/tables/nope/ddl"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value(404));
    }

    @Test
    @DisplayName("重新加载配置")
    void testReload() throws Exception {
        mockMvc.perform(post("/api/v1/check-view/reload"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").value("reloaded"));
    }
}

package com.fincheck.controller;

import com.fincheck.meta.Loader;
import com.fincheck.meta.TableInfo;
import com.fincheck.meta.Validator;
import com.fincheck.service.CheckViewResult;
import com.fincheck.service.CheckViewService;
import com.fincheck.sql.SqlVerificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/check-view")
public class CheckViewController {
    private static final Logger logger = LoggerFactory.getLogger(CheckViewController.class);

    private final CheckViewService checkViewService;

    public CheckViewController(CheckViewService checkViewService) {
        this.checkViewService = checkViewService;
    }

    @GetMapping("/sql")
    public ResponseEntity<ApiResponse<CheckViewResult>> generateCheckView() {
        try {
            return ResponseEntity.ok(ApiResponse.success(checkViewService.generateCheckView()));
        } catch (SqlVerificationException e) {
            logger.error("[generateCheckView] 检查视图语句校验失败", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, e.getMessage()));
        }
    }

    @GetMapping("/tables")
    public ResponseEntity<ApiResponse<List<TableInfo>>> listTables() {
        return ResponseEntity.ok(ApiResponse.success(checkViewService.listTables()));
    }

    @GetMapping("/tables/{tableCode}/ddl")
    public ResponseEntity<ApiResponse<String>> generateTableDdl(@PathVariable String tableCode) {
        try {
            return ResponseEntity.ok(ApiResponse.success(checkViewService.generateTableDdl(tableCode)));
        } catch (Loader.NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(400, e.getMessage()));
        }
    }

    @PostMapping("/reload")
    public ResponseEntity<ApiResponse<String>> reload() {
        try {
            checkViewService.reload();
            return ResponseEntity.ok(ApiResponse.success("reloaded"));
        } catch (IOException | Validator.ValidationException e) {
            logger.error("[reload] 配置表重新加载失败", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, e.getMessage()));
        }
    }
}

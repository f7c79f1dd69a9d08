package com.fincheck.controller;

import com.fincheck.formula.FormulaCompiler;
import com.fincheck.formula.FormulaException;
import com.fincheck.formula.OnUnrecognized;
import com.fincheck.formula.ParsedFormula;
import com.fincheck.formula.RangeSpec;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/formula")
public class FormulaController {
    private final FormulaCompiler compiler;

    public FormulaController(FormulaCompiler compiler) {
        this.compiler = compiler;
    }

    @PostMapping("/parse")
    public ResponseEntity<ApiResponse<ParsedFormula>> parse(@RequestBody Map<String, Object> request) {
        String formula = (String) request.get("formula");
        if (formula == null || formula.isBlank()) {
            return badRequest("formula不能为空");
        }
        try {
            return ResponseEntity.ok(ApiResponse.success(compiler.parse(formula)));
        } catch (FormulaException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/fields")
    public ResponseEntity<ApiResponse<List<String>>> parseFields(@RequestBody Map<String, Object> request) {
        String formula = (String) request.get("formula");
        if (formula == null || formula.isBlank()) {
            return badRequest("formula不能为空");
        }
        boolean unique = !Boolean.FALSE.equals(request.get("unique"));
        try {
            return ResponseEntity.ok(ApiResponse.success(compiler.parseFields(formula, unique)));
        } catch (FormulaException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/special-fields")
    @SuppressWarnings("unchecked")
    public ResponseEntity<ApiResponse<Map<String, String>>> translateSpecialFields(@RequestBody Map<String, Object> request) {
        List<String> fields = (List<String>) request.get("fields");
        if (fields == null || fields.isEmpty()) {
            return badRequest("fields不能为空");
        }
        String sign = (String) request.get("sign");
        try {
            OnUnrecognized policy = request.containsKey("on_unrecognized")
                ? OnUnrecognized.fromString((String) request.get("on_unrecognized"))
                : null;
            return ResponseEntity.ok(ApiResponse.success(compiler.translateSpecialFields(fields, sign, policy)));
        } catch (FormulaException e) {
            return badRequest(e);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
    }

    @PostMapping("/range")
    public ResponseEntity<ApiResponse<List<RangeSpec>>> parseRange(@RequestBody Map<String, Object> request) {
        String range = (String) request.get("range");
        if (range == null || range.isBlank()) {
            return badRequest("range不能为空");
        }
        boolean numeric = !Boolean.FALSE.equals(request.get("numeric"));
        try {
            return ResponseEntity.ok(ApiResponse.success(compiler.parseMultiRange(range, numeric)));
        } catch (FormulaException e) {
            return badRequest(e);
        }
    }

    /**
     * 同时返回比较语句和区间写法
     */
    @PostMapping("/compare")
    public ResponseEntity<ApiResponse<Map<String, String>>> renderComparison(@RequestBody Map<String, Object> request) {
        String code = (String) request.get("code");
        String method = (String) request.get("method");
        Object thresholds = request.get("thresholds");
        if (code == null || method == null || !(thresholds instanceof List)) {
            return badRequest("code、method、thresholds不能为空");
        }
        try {
            List<?> values = (List<?>) thresholds;
            Map<String, String> result = new HashMap<>();
            result.put("expression", compiler.renderComparison(code, method, values));
            result.put("range", compiler.renderRange(method, values));
            return ResponseEntity.ok(ApiResponse.success(result));
        } catch (FormulaException e) {
            return badRequest(e);
        }
    }

    @PostMapping("/concat")
    @SuppressWarnings("unchecked")
    public ResponseEntity<ApiResponse<String>> concatenate(@RequestBody Map<String, Object> request) {
        List<List<String>> groups = (List<List<String>>) request.get("groups");
        String operator = (String) request.getOrDefault("operator", "&");
        return ResponseEntity.ok(ApiResponse.success(compiler.concatenate(groups, operator)));
    }

    private static <T> ResponseEntity<ApiResponse<T>> badRequest(FormulaException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, e.getErrorType() + ": " + e.getMessage()));
    }

    private static <T> ResponseEntity<ApiResponse<T>> badRequest(String message) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiResponse.error(400, message));
    }
}

package com.compliance.guardian.controller;

import com.compliance.guardian.exception.BatchRejectedException;
import com.compliance.guardian.model.BatchResult;
import com.compliance.guardian.service.EmailPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/imports")
@Tag(name = "Imports", description = "Bulk email import: normalize, classify, apply rules, open cases")
public class ImportController {

    private final EmailPipelineService pipelineService;

    public ImportController(EmailPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Operation(summary = "Import a batch of email rows",
            description = "Each row is an object of column name to cell value. Required columns: " +
                    "sender, subject and body (or content). Rows with an empty sender or subject, or an " +
                    "unparsable date, are skipped and reported; a batch missing a required column is rejected.")
    @PostMapping
    public ResponseEntity<?> importBatch(
            @RequestBody List<Map<String, String>> rows,
            @Parameter(description = "Who is importing; recorded on any case opened", example = "analyst1")
            @RequestParam(required = false) String actor) {
        try {
            BatchResult result = pipelineService.processBatch(rows, actor);
            return ResponseEntity.ok(result);
        } catch (BatchRejectedException e) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", e.getMessage());
            body.put("type", "BATCH_REJECTED");
            body.put("missingColumns", e.getMissingColumns());
            return ResponseEntity.badRequest().body(body);
        }
    }
}

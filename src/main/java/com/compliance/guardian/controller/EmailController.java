package com.compliance.guardian.controller;

import com.compliance.guardian.exception.ModelTrainingException;
import com.compliance.guardian.model.Email;
import com.compliance.guardian.model.ReclassifyResult;
import com.compliance.guardian.repository.EmailRepository;
import com.compliance.guardian.service.EmailPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/emails")
@Tag(name = "Emails", description = "Imported emails and bulk reclassification")
public class EmailController {

    private final EmailRepository emailRepository;
    private final EmailPipelineService pipelineService;

    public EmailController(EmailRepository emailRepository, EmailPipelineService pipelineService) {
        this.emailRepository = emailRepository;
        this.pipelineService = pipelineService;
    }

    @Operation(summary = "Get an email with its current score, category and case link")
    @GetMapping("/{emailId}")
    public ResponseEntity<Email> getEmail(
            @Parameter(description = "Email ID")
            @PathVariable String emailId) {
        Email email = emailRepository.findById(emailId);
        if (email == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(email);
    }

    @Operation(summary = "Reclassify all stored emails",
            description = "Re-runs the active model and admin rules over every email. Opens cases for newly " +
                    "escalated emails and re-opens an email once if its case was closed as a false positive. " +
                    "With retrain=true the model is first retrained from resolved cases and import labels.")
    @PostMapping("/reclassify")
    public ResponseEntity<?> reclassify(
            @Parameter(description = "Retrain the classifier before reclassifying", example = "false")
            @RequestParam(defaultValue = "false") boolean retrain,
            @RequestParam(required = false) String actor) {
        if (!retrain) {
            return ResponseEntity.ok(pipelineService.reclassifyAll(actor));
        }
        try {
            ReclassifyResult result = pipelineService.retrainAndReclassify(actor);
            return ResponseEntity.ok(result);
        } catch (ModelTrainingException e) {
            return ResponseEntity.unprocessableEntity()
                    .body(Map.of("error", e.getMessage(), "type", "MODEL_TRAINING"));
        }
    }
}

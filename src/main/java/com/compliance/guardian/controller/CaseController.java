package com.compliance.guardian.controller;

import com.compliance.guardian.exception.CaseNotFoundException;
import com.compliance.guardian.exception.ConcurrentCaseModificationException;
import com.compliance.guardian.exception.DuplicateCaseException;
import com.compliance.guardian.exception.EmailNotFoundException;
import com.compliance.guardian.exception.InvalidTransitionException;
import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.CaseStatusUpdateRequest;
import com.compliance.guardian.model.InvestigationCase;
import com.compliance.guardian.model.PagedResponse;
import com.compliance.guardian.service.CaseLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cases")
@Tag(name = "Cases", description = "Investigation case lifecycle with optimistic concurrency")
public class CaseController {

    private final CaseLifecycleService caseLifecycleService;

    public CaseController(CaseLifecycleService caseLifecycleService) {
        this.caseLifecycleService = caseLifecycleService;
    }

    @GetMapping
    @Operation(summary = "List cases",
            description = "Newest first. Use the returned nextCursor as 'before' to fetch the next page.")
    public ResponseEntity<?> listCases(
            @Parameter(description = "Filter by status", example = "OPEN")
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String emailId,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: only cases created before this epoch millis")
            @RequestParam(required = false) Long before) {
        try {
            CaseStatus caseStatus = status != null ? CaseStatus.parse(status) : null;
            PagedResponse<InvestigationCase> page =
                    caseLifecycleService.listCases(caseStatus, emailId, Math.max(1, limit), before);
            return ResponseEntity.ok(page);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
        }
    }

    @GetMapping("/{caseId}")
    @Operation(summary = "Get a case with its audit trail")
    public ResponseEntity<InvestigationCase> getCase(@PathVariable String caseId) {
        try {
            return ResponseEntity.ok(caseLifecycleService.getCase(caseId));
        } catch (CaseNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping
    @Operation(summary = "Open a case manually",
            description = "Body: emailId (required), reason, actor. Fails with 409 if the email already has a case.")
    public ResponseEntity<?> createCase(@RequestBody Map<String, String> body) {
        String emailId = body.get("emailId");
        if (emailId == null || emailId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "emailId is required"));
        }
        String reason = body.getOrDefault("reason", "Opened manually");
        String actor = body.getOrDefault("actor", "ops");

        try {
            InvestigationCase created = caseLifecycleService.createCase(emailId, reason, actor);
            return ResponseEntity.status(HttpStatus.CREATED).body(created);
        } catch (EmailNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (DuplicateCaseException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "type", "DUPLICATE_CASE"));
        }
    }

    @PostMapping("/{caseId}/status")
    @Operation(summary = "Change case status",
            description = "Requires the expectedVersion last read. Returns 409 when the transition is not " +
                    "allowed from the current status or when the case was modified since that version.")
    public ResponseEntity<?> updateStatus(@PathVariable String caseId,
                                          @RequestBody CaseStatusUpdateRequest request) {
        if (request.getTargetStatus() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "targetStatus is required"));
        }
        if (request.getExpectedVersion() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "expectedVersion is required"));
        }
        String actor = request.getActor() != null ? request.getActor() : "ops";

        CaseStatus target;
        try {
            target = CaseStatus.parse(request.getTargetStatus());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Unknown status: " + request.getTargetStatus()));
        }

        try {
            InvestigationCase updated = caseLifecycleService.transition(caseId, request.getExpectedVersion(),
                    target, actor, request.getReason(), request.getResolutionNotes());
            return ResponseEntity.ok(updated);
        } catch (CaseNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvalidTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "type", "INVALID_TRANSITION"));
        } catch (ConcurrentCaseModificationException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "type", "CONCURRENT_MODIFICATION"));
        }
    }

    @PostMapping("/{caseId}/assign")
    @Operation(summary = "Assign a case to an investigator",
            description = "Body: assignee (required), expectedVersion (required), actor.")
    public ResponseEntity<?> assign(@PathVariable String caseId, @RequestBody Map<String, String> body) {
        String assignee = body.get("assignee");
        String version = body.get("expectedVersion");
        if (assignee == null || assignee.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "assignee is required"));
        }
        if (version == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "expectedVersion is required"));
        }

        try {
            int expectedVersion = Integer.parseInt(version.trim());
            InvestigationCase updated = caseLifecycleService.assign(caseId, expectedVersion, assignee,
                    body.getOrDefault("actor", "ops"));
            return ResponseEntity.ok(updated);
        } catch (NumberFormatException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "expectedVersion must be a number"));
        } catch (CaseNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (ConcurrentCaseModificationException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "type", "CONCURRENT_MODIFICATION"));
        }
    }
}

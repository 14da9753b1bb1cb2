package com.compliance.guardian.controller;

import com.compliance.guardian.model.FlaggedSender;
import com.compliance.guardian.service.SenderRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/senders")
@Tag(name = "Sender Registry", description = "Flag and unflag senders whose mail is always reviewed")
public class SenderController {

    private final SenderRegistryService senderRegistryService;

    public SenderController(SenderRegistryService senderRegistryService) {
        this.senderRegistryService = senderRegistryService;
    }

    @GetMapping
    @Operation(summary = "List flagged senders")
    public ResponseEntity<List<FlaggedSender>> listSenders(
            @Parameter(description = "Only currently active flags", example = "true")
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(senderRegistryService.list(activeOnly));
    }

    @GetMapping("/{sender}")
    @Operation(summary = "Get the registry entry for a sender")
    public ResponseEntity<FlaggedSender> getSender(@PathVariable String sender) {
        FlaggedSender entry = senderRegistryService.get(sender);
        if (entry == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(entry);
    }

    @PostMapping
    @Operation(summary = "Flag a sender",
            description = "Body: sender (required), reason, actor. Re-flagging an active sender updates its reason.")
    public ResponseEntity<?> flagSender(@RequestBody Map<String, String> body) {
        String sender = body.get("sender");
        if (sender == null || sender.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "sender is required"));
        }
        FlaggedSender flagged = senderRegistryService.flag(sender, body.get("reason"),
                body.getOrDefault("actor", "ops"));
        return ResponseEntity.ok(flagged);
    }

    @DeleteMapping("/{sender}")
    @Operation(summary = "Unflag a sender", description = "The registry entry is kept with active=false.")
    public ResponseEntity<Void> unflagSender(
            @PathVariable String sender,
            @RequestParam(defaultValue = "ops") String actor) {
        boolean unflagged = senderRegistryService.unflag(sender, actor);
        if (!unflagged) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}

package com.compliance.guardian.controller;

import com.compliance.guardian.model.CaseStatus;
import com.compliance.guardian.model.Category;
import com.compliance.guardian.model.StatsFilter;
import com.compliance.guardian.service.DashboardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/dashboard")
@Tag(name = "Dashboard", description = "Aggregate counts for the compliance dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/stats")
    @Operation(summary = "Get dashboard statistics",
            description = "Counts by case status, category, risk level and day. All filters are optional.")
    public ResponseEntity<?> getStats(
            @Parameter(description = "Epoch millis, inclusive") @RequestParam(required = false) Long fromDate,
            @Parameter(description = "Epoch millis, inclusive") @RequestParam(required = false) Long toDate,
            @Parameter(example = "OPEN") @RequestParam(required = false) String status,
            @Parameter(example = "POLICY_VIOLATION") @RequestParam(required = false) String category) {
        StatsFilter filter = StatsFilter.builder().fromDate(fromDate).toDate(toDate).build();
        if (status != null) {
            try {
                filter.setStatus(CaseStatus.parse(status));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown status: " + status));
            }
        }
        if (category != null) {
            Category parsed = Category.fromLabel(category);
            if (parsed == null) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown category: " + category));
            }
            filter.setCategory(parsed);
        }
        return ResponseEntity.ok(dashboardService.getStats(filter));
    }
}

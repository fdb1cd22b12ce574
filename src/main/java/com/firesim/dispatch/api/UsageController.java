package com.firesim.dispatch.api;

import com.firesim.core.cost.UsageTracker;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * REST controller for estimated usage cost.
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageController {

    private final UsageTracker usageTracker;

    public UsageController(UsageTracker usageTracker) {
        this.usageTracker = usageTracker;
    }

    /**
     * GET /api/v1/usage/summary: Daily estimate; defaults to today (UTC).
     */
    @GetMapping("/summary")
    public ResponseEntity<UsageTracker.DailySummary> summary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(date != null ? usageTracker.dailySummary(date) : usageTracker.dailySummary());
    }
}

package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.DailyPlanSummary;
import io.github.drompincen.planloop.protocol.api.DailySummaryDto;
import io.github.drompincen.planloop.protocol.api.GenerateDailyPlanRequest;
import io.github.drompincen.planloop.protocol.api.MarkTaskCompleteRequest;
import io.github.drompincen.planloop.runtime.daily.DailyPlanningService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/daily")
public class DailyPlanController {

    private final DailyPlanningService dailyPlanningService;

    public DailyPlanController(DailyPlanningService dailyPlanningService) {
        this.dailyPlanningService = dailyPlanningService;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateDailyPlanRequest request) {
        if (request == null || request.userId() == null || request.userId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "userId is required"));
        }
        return ResponseEntity.ok(dailyPlanningService.generateDailyPlan(
                request.userId(), request.targetDate(), request.regenerate()));
    }

    @GetMapping("/today/{userId}")
    public List<DailySummaryDto> today(@PathVariable String userId) {
        return dailyPlanningService.getTodayPlan(userId);
    }

    @PostMapping("/tasks/complete")
    public ResponseEntity<?> complete(@RequestBody MarkTaskCompleteRequest request) {
        if (request == null || request.taskId() == null || request.userId() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "taskId and userId are required"));
        }
        try {
            return ResponseEntity.ok(dailyPlanningService.markTaskComplete(
                    request.taskId(), request.userId(), request.hoursWorked()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/summary/{userId}")
    public DailyPlanSummary summary(@PathVariable String userId,
                                    @RequestParam(required = false)
                                    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return dailyPlanningService.getPlanSummary(userId, date);
    }
}

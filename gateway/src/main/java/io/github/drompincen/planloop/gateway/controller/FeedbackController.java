package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.FeedbackDto;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import io.github.drompincen.planloop.protocol.api.SubmitFeedbackRequest;
import io.github.drompincen.planloop.runtime.feedback.FeedbackService;
import io.github.drompincen.planloop.runtime.feedback.FeedbackValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {

    private final FeedbackService feedbackService;

    public FeedbackController(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    /** Accepts the feedback and returns before any model work happens. */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody SubmitFeedbackRequest request) {
        try {
            return ResponseEntity.accepted().body(feedbackService.submit(request));
        } catch (FeedbackValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{feedbackId}")
    public ResponseEntity<FeedbackDto> get(@PathVariable String feedbackId) {
        return feedbackService.get(feedbackId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<FeedbackDto> list(@RequestParam(required = false) String projectId,
                                  @RequestParam(required = false) FeedbackStatus status) {
        return feedbackService.list(projectId, status);
    }
}

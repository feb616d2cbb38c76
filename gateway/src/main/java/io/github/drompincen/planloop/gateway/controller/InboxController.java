package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.CreateInboxItemRequest;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import io.github.drompincen.planloop.runtime.inbox.InboxService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/inbox")
public class InboxController {

    private final InboxService inboxService;

    public InboxController(InboxService inboxService) {
        this.inboxService = inboxService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateInboxItemRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request body is required"));
        }
        try {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(inboxService.createItem(request.userId(), request.content(), request.tags()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    public List<InboxItemDto> list(@RequestParam String userId,
                                   @RequestParam(required = false) InboxItemDto.InboxStatus status) {
        return inboxService.listItems(userId, status);
    }

    @GetMapping("/{inboxItemId}")
    public ResponseEntity<InboxItemDto> get(@PathVariable String inboxItemId) {
        return inboxService.getItem(inboxItemId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{inboxItemId}/process")
    public ResponseEntity<?> process(@PathVariable String inboxItemId,
                                     @RequestParam String userId,
                                     @RequestParam(defaultValue = "true") boolean autoPlan) {
        try {
            return ResponseEntity.ok(inboxService.processItem(inboxItemId, userId, autoPlan));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}

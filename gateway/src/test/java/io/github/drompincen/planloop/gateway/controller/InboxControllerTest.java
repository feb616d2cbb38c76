package io.github.drompincen.planloop.gateway.controller;

import io.github.drompincen.planloop.protocol.api.CreateInboxItemRequest;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import io.github.drompincen.planloop.runtime.inbox.InboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboxControllerTest {

    @Mock private InboxService inboxService;

    private InboxController controller;

    @BeforeEach
    void setUp() {
        controller = new InboxController(inboxService);
    }

    @Test
    void createReturnsCreated() {
        InboxItemDto dto = item(InboxItemDto.InboxStatus.UNPROCESSED);
        when(inboxService.createItem("alice", "Buy milk", List.of())).thenReturn(dto);

        ResponseEntity<?> response = controller.create(new CreateInboxItemRequest("alice", "Buy milk", List.of()));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(response.getBody()).isEqualTo(dto);
    }

    @Test
    void createWithBlankContentIsBadRequest() {
        when(inboxService.createItem("alice", "", null))
                .thenThrow(new IllegalArgumentException("Inbox item content must not be empty"));

        assertThat(controller.create(new CreateInboxItemRequest("alice", "", null))
                .getStatusCode().value()).isEqualTo(400);
    }

    @Test
    void processReturnsUpdatedItem() {
        InboxItemDto processed = item(InboxItemDto.InboxStatus.PROCESSED);
        when(inboxService.processItem("item-1", "alice", true)).thenReturn(processed);

        ResponseEntity<?> response = controller.process("item-1", "alice", true);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(processed);
    }

    @Test
    void processUnknownItemIsNotFound() {
        when(inboxService.processItem("nope", "alice", true))
                .thenThrow(new IllegalArgumentException("Inbox item not found: nope"));

        assertThat(controller.process("nope", "alice", true).getStatusCode().value()).isEqualTo(404);
    }

    private static InboxItemDto item(InboxItemDto.InboxStatus status) {
        return new InboxItemDto("item-1", "alice", "Buy milk", List.of(), status, null,
                null, null, null, Instant.now(), Instant.now());
    }
}

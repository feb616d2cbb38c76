package io.github.drompincen.planloop.protocol.api;

import java.util.List;

public record CreateInboxItemRequest(
        String userId,
        String content,
        List<String> tags
) {}

package io.github.drompincen.planloop.persistence.repository;

import java.time.Instant;

public interface InboxItemRepositoryCustom {

    /** UNPROCESSED to PROCESSING for the owning user. Returns false if the item was not claimable. */
    boolean claimForProcessing(String inboxItemId, String userId, Instant now);
}

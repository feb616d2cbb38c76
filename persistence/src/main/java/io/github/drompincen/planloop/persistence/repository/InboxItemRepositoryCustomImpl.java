package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.InboxItemDocument;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

public class InboxItemRepositoryCustomImpl implements InboxItemRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public InboxItemRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean claimForProcessing(String inboxItemId, String userId, Instant now) {
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(inboxItemId))
                .addCriteria(Criteria.where("userId").is(userId))
                .addCriteria(Criteria.where("status").is(InboxItemDto.InboxStatus.UNPROCESSED));
        Update update = new Update()
                .set("status", InboxItemDto.InboxStatus.PROCESSING)
                .set("updatedAt", now);
        return mongoTemplate.updateFirst(query, update, InboxItemDocument.class).getModifiedCount() == 1;
    }
}

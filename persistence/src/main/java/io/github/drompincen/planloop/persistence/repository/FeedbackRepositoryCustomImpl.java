package io.github.drompincen.planloop.persistence.repository;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.protocol.api.AdjustmentDto;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

public class FeedbackRepositoryCustomImpl implements FeedbackRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public FeedbackRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean claimForProcessing(String feedbackId, Instant now) {
        Update update = new Update()
                .set("status", FeedbackStatus.PROCESSING)
                .set("processingStartedAt", now);
        return transition(feedbackId, FeedbackStatus.PENDING, update);
    }

    @Override
    public boolean completeWithAdjustments(String feedbackId, String summary,
                                           List<AdjustmentDto> adjustments, Instant now) {
        Update update = new Update()
                .set("status", FeedbackStatus.COMPLETED)
                .set("summary", summary)
                .set("adjustments", List.copyOf(adjustments))
                .set("processedAt", now);
        return transition(feedbackId, FeedbackStatus.PROCESSING, update);
    }

    @Override
    public boolean markFailed(String feedbackId, String reason, Instant now) {
        Update update = new Update()
                .set("status", FeedbackStatus.FAILED)
                .set("failureReason", reason)
                .set("processedAt", now);
        return transition(feedbackId, FeedbackStatus.PROCESSING, update);
    }

    private boolean transition(String feedbackId, FeedbackStatus expected, Update update) {
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(feedbackId))
                .addCriteria(Criteria.where("status").is(expected));
        UpdateResult result = mongoTemplate.updateFirst(query, update, FeedbackDocument.class);
        return result.getModifiedCount() == 1;
    }
}

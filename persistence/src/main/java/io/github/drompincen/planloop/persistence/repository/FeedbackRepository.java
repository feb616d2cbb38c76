package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface FeedbackRepository extends MongoRepository<FeedbackDocument, String>, FeedbackRepositoryCustom {
    List<FeedbackDocument> findByProjectIdOrderByCreatedAtDesc(String projectId);
    List<FeedbackDocument> findByProjectIdAndStatusOrderByCreatedAtDesc(String projectId, FeedbackStatus status);
    List<FeedbackDocument> findByStatusOrderByCreatedAtDesc(FeedbackStatus status);
    List<FeedbackDocument> findByStatusAndCreatedAtBefore(FeedbackStatus status, Instant createdBefore);
}

package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.LlmCallLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LlmCallLogRepository extends MongoRepository<LlmCallLogDocument, String> {
    List<LlmCallLogDocument> findByReferenceIdOrderByTimestampAsc(String referenceId);
    List<LlmCallLogDocument> findByPurposeOrderByTimestampDesc(String purpose);
}

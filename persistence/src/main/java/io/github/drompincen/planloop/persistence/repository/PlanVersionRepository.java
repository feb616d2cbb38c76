package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.PlanVersionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PlanVersionRepository extends MongoRepository<PlanVersionDocument, String> {
    Optional<PlanVersionDocument> findFirstByProjectIdOrderByVersionNumberDesc(String projectId);
    List<PlanVersionDocument> findByProjectIdOrderByVersionNumberDesc(String projectId);
}

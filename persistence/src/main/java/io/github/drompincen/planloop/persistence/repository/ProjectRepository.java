package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    List<ProjectDocument> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}

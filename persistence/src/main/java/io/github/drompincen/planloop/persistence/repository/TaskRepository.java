package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.TaskDocument;
import io.github.drompincen.planloop.protocol.api.TaskDto;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface TaskRepository extends MongoRepository<TaskDocument, String> {
    List<TaskDocument> findByProjectId(String projectId);
    List<TaskDocument> findByProjectIdOrderByCreatedAtAsc(String projectId);
    List<TaskDocument> findByAssigneeIdAndStatusIn(String assigneeId, Collection<TaskDto.TaskStatus> statuses);
}

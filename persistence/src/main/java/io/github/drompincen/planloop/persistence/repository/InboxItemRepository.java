package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.InboxItemDocument;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface InboxItemRepository extends MongoRepository<InboxItemDocument, String>, InboxItemRepositoryCustom {
    List<InboxItemDocument> findByUserIdOrderByCreatedAtDesc(String userId);
    List<InboxItemDocument> findByUserIdAndStatusOrderByCreatedAtDesc(String userId, InboxItemDto.InboxStatus status);
}

package io.github.drompincen.planloop.persistence.repository;

import io.github.drompincen.planloop.persistence.document.DailySummaryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DailySummaryRepository extends MongoRepository<DailySummaryDocument, String> {
    List<DailySummaryDocument> findByUserIdAndDateOrderByRankAsc(String userId, LocalDate date);
    Optional<DailySummaryDocument> findFirstByUserIdAndDateAndTaskId(String userId, LocalDate date, String taskId);
    void deleteByUserIdAndDate(String userId, LocalDate date);
}

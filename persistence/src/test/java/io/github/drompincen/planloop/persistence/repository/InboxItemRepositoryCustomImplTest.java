package io.github.drompincen.planloop.persistence.repository;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.planloop.persistence.document.InboxItemDocument;
import io.github.drompincen.planloop.protocol.api.InboxItemDto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InboxItemRepositoryCustomImplTest {

    @Mock private MongoTemplate mongoTemplate;

    @Test
    void claimIsScopedToOwnerAndUnprocessedStatus() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(InboxItemDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));
        InboxItemRepositoryCustomImpl repository = new InboxItemRepositoryCustomImpl(mongoTemplate);

        boolean claimed = repository.claimForProcessing("item-1", "user-1", Instant.EPOCH);

        assertThat(claimed).isTrue();
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).updateFirst(query.capture(), any(Update.class), eq(InboxItemDocument.class));
        assertThat(query.getValue().getQueryObject().get("userId")).isEqualTo("user-1");
        assertThat(query.getValue().getQueryObject().get("status"))
                .isEqualTo(InboxItemDto.InboxStatus.UNPROCESSED);
    }

    @Test
    void alreadyProcessedItemIsNotClaimed() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(InboxItemDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(new InboxItemRepositoryCustomImpl(mongoTemplate)
                .claimForProcessing("item-1", "user-1", Instant.EPOCH)).isFalse();
    }
}

package io.github.drompincen.planloop.protocol.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AdjustmentTypeTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void fromWireAcceptsWireAndConstantNames() {
        assertThat(AdjustmentType.fromWire("task_priority")).isEqualTo(AdjustmentType.TASK_PRIORITY);
        assertThat(AdjustmentType.fromWire("NEW_TASK")).isEqualTo(AdjustmentType.NEW_TASK);
        assertThat(AdjustmentType.fromWire("remove-task")).isEqualTo(AdjustmentType.REMOVE_TASK);
    }

    @Test
    void unknownTypeFallsBackToGeneral() {
        assertThat(AdjustmentType.fromWire("reorganize")).isEqualTo(AdjustmentType.GENERAL);
        assertThat(AdjustmentType.fromWire(null)).isEqualTo(AdjustmentType.GENERAL);
    }

    @Test
    void adjustmentSerializesWithSnakeCaseKeys() throws Exception {
        AdjustmentDto dto = new AdjustmentDto("a1", "f1", AdjustmentType.TASK_ESTIMATE, "t1",
                "Raise estimate", "4", "8", "More work than expected", Instant.parse("2026-01-05T10:00:00Z"));

        String json = mapper.writeValueAsString(dto);

        assertThat(json).contains("\"adjustment_type\":\"task_estimate\"");
        assertThat(json).contains("\"original_value\":\"4\"");
        assertThat(json).contains("\"new_value\":\"8\"");
        assertThat(json).contains("\"feedback_id\":\"f1\"");
    }
}

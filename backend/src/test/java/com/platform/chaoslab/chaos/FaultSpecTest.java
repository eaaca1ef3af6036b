package com.platform.chaoslab.chaos;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.chaoslab.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FaultSpecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testDefaults() {
        FaultSpec spec = FaultSpec.builder().faultType(FaultType.TIMEOUT).build();

        assertThat(spec.probability()).isEqualTo(1.0);
        assertThat(spec.affectedTargets()).isEmpty();
        assertThat(spec.durationMs()).isNull();
        assertThat(spec.errorCode()).isNull();
    }

    @Test
    void testIncompleteSpecCanBeBuilt() {
        FaultSpec latency = FaultSpec.builder().faultType(FaultType.LATENCY).build();
        FaultSpec error = FaultSpec.builder().faultType(FaultType.ERROR).build();

        assertThat(latency.durationMs()).isNull();
        assertThat(error.errorCode()).isNull();
    }

    @Test
    void testProbabilityOutOfRangeRejected() {
        assertThatThrownBy(() -> FaultSpec.builder().faultType(FaultType.ERROR).probability(1.5).build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("probability");
        assertThatThrownBy(() -> FaultSpec.builder().faultType(FaultType.ERROR).probability(-0.1).build())
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> FaultSpec.builder().faultType(FaultType.ERROR).probability(Double.NaN).build())
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void testNegativeDurationRejected() {
        assertThatThrownBy(() -> FaultSpec.builder().faultType(FaultType.LATENCY).durationMs(-1L).build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("duration_ms");
    }

    @Test
    void testMissingTypeRejected() {
        assertThatThrownBy(() -> FaultSpec.builder().build())
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("fault_type");
    }

    @Test
    void testTargetsAreCopied() {
        List<String> targets = new ArrayList<>(List.of("db"));
        FaultSpec spec = FaultSpec.builder().faultType(FaultType.TIMEOUT).affectedTargets(targets).build();

        targets.add("cache");

        assertThat(spec.affectedTargets()).containsExactly("db");
    }

    @Test
    void testReadsSnakeCaseJson() throws Exception {
        String json = """
            {"fault_type": "ERROR", "probability": 0.25, "error_code": 503,
             "error_message": "down", "affected_targets": ["api"]}
            """;

        FaultSpec spec = mapper.readValue(json, FaultSpec.class);

        assertThat(spec.faultType()).isEqualTo(FaultType.ERROR);
        assertThat(spec.probability()).isEqualTo(0.25);
        assertThat(spec.errorCode()).isEqualTo(503);
        assertThat(spec.errorMessage()).isEqualTo("down");
        assertThat(spec.affectedTargets()).containsExactly("api");
    }

    @Test
    void testWritesWireName() throws Exception {
        FaultSpec spec = FaultSpec.builder().faultType(FaultType.PARTIAL_FAILURE).build();

        String json = mapper.writeValueAsString(spec);

        assertThat(json).contains("\"fault_type\":\"partial_failure\"");
        assertThat(json).doesNotContain("duration_ms");
    }

    @Test
    void testFaultTypeParsing() {
        assertThat(FaultType.fromValue("resource_exhaustion")).isEqualTo(FaultType.RESOURCE_EXHAUSTION);
        assertThat(FaultType.fromValue(" Latency ")).isEqualTo(FaultType.LATENCY);
        assertThatThrownBy(() -> FaultType.fromValue("meteor"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("meteor");
        assertThat(FaultType.LATENCY.raisesFailure()).isFalse();
        assertThat(FaultType.TIMEOUT.raisesFailure()).isTrue();
    }
}

package com.platform.chaoslab.api;

import com.platform.chaoslab.chaos.FaultInjector;
import com.platform.chaoslab.chaos.FaultType;
import com.platform.chaoslab.error.ExperimentNotFoundException;
import com.platform.chaoslab.error.FaultConfigurationException;
import com.platform.chaoslab.error.InvalidExperimentStateException;
import com.platform.chaoslab.observability.LoggingConfig;
import com.platform.chaoslab.observability.MetricsRegistry;
import com.platform.chaoslab.observability.StructuredLogger;
import com.platform.chaoslab.scheduler.ExperimentDefinition;
import com.platform.chaoslab.scheduler.ExperimentInfo;
import com.platform.chaoslab.scheduler.ExperimentScheduler;
import com.platform.chaoslab.scheduler.ExperimentStats;
import com.platform.chaoslab.scheduler.ExperimentStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChaosController.class)
@Import({LoggingConfig.class, ChaosControllerTest.Beans.class})
class ChaosControllerTest {

    @TestConfiguration
    static class Beans {
        @Bean
        FaultInjector faultInjector() {
            return new FaultInjector();
        }

        @Bean
        MetricsRegistry metricsRegistry() {
            return new MetricsRegistry(new SimpleMeterRegistry());
        }

        @Bean
        StructuredLogger structuredLogger() {
            return new StructuredLogger("chaos-lab", "test");
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ExperimentScheduler scheduler;

    @MockBean
    private ExperimentRunner experimentRunner;

    private static ExperimentInfo pendingInfo(String id) {
        ExperimentDefinition definition = ExperimentDefinition.builder()
            .experimentId(id).name("demo").durationSeconds(1).build();
        return new ExperimentInfo(id, "demo", ExperimentStatus.PENDING, false, definition);
    }

    @Test
    void testInjectReportsRaisedFaultInBody() throws Exception {
        mockMvc.perform(post("/api/chaos/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fault_type\": \"error\", \"error_code\": 503, \"message\": \"x\", \"target\": \"search\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fault_type").value("error"))
            .andExpect(jsonPath("$.target").value("search"))
            .andExpect(jsonPath("$.raised").value(true))
            .andExpect(jsonPath("$.exception_type").value("ChaosErrorException"))
            .andExpect(jsonPath("$.message").value("[503] x"));
    }

    @Test
    void testInjectLatencyRaisesNothing() throws Exception {
        mockMvc.perform(post("/api/chaos/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fault_type\": \"latency\", \"duration_ms\": 10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.raised").value(false))
            .andExpect(jsonPath("$.target").value("*"))
            .andExpect(jsonPath("$.exception_type").doesNotExist());
    }

    @Test
    void testInjectRequiresFaultType() throws Exception {
        mockMvc.perform(post("/api/chaos/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"duration_ms\": 10}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CL-100"))
            .andExpect(jsonPath("$.field_errors[0].field").value("faultType"));
    }

    @Test
    void testInjectRejectsUnknownFaultType() throws Exception {
        mockMvc.perform(post("/api/chaos/inject")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fault_type\": \"meteor\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CL-103"))
            .andExpect(jsonPath("$.field_errors[0].field").value("fault_type"));
    }

    @Test
    void testScheduleReturnsCreated() throws Exception {
        when(scheduler.schedule(any(ExperimentDefinition.class))).thenReturn("exp-1");
        when(scheduler.getStatus("exp-1")).thenReturn(ExperimentStatus.PENDING);

        mockMvc.perform(post("/api/chaos/experiments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"name": "demo", "duration_seconds": 2,
                     "fault_specs": [{"fault_type": "timeout", "probability": 0.5}]}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.experiment_id").value("exp-1"))
            .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    void testScheduleRejectsInvalidDefinition() throws Exception {
        mockMvc.perform(post("/api/chaos/experiments")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"demo\", \"duration_seconds\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CL-103"));
    }

    @Test
    void testRunUnknownExperimentIsNotFound() throws Exception {
        when(scheduler.run("nope")).thenThrow(new ExperimentNotFoundException("nope"));

        mockMvc.perform(post("/api/chaos/experiments/nope/run").param("wait", "true")
                .header(LoggingConfig.CORRELATION_ID_HEADER, "corr-123"))
            .andExpect(status().isNotFound())
            .andExpect(header().string(LoggingConfig.CORRELATION_ID_HEADER, "corr-123"))
            .andExpect(jsonPath("$.code").value("CL-302"))
            .andExpect(jsonPath("$.trace_id").value("corr-123"))
            .andExpect(jsonPath("$.fatal").value(false))
            .andExpect(jsonPath("$.metadata.resource_id").value("nope"));
    }

    @Test
    void testRunWithMisconfiguredFaultIsBadRequest() throws Exception {
        when(scheduler.run("bad")).thenThrow(new FaultConfigurationException(FaultType.LATENCY, "duration_ms"));

        mockMvc.perform(post("/api/chaos/experiments/bad/run").param("wait", "true"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("CL-500"))
            .andExpect(jsonPath("$.metadata.field").value("duration_ms"));
    }

    @Test
    void testRunAsyncIsAccepted() throws Exception {
        when(experimentRunner.submit("exp-1")).thenReturn(pendingInfo("exp-1"));

        mockMvc.perform(post("/api/chaos/experiments/exp-1/run"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.experiment_id").value("exp-1"))
            .andExpect(jsonPath("$.status").value("pending"));

        verify(experimentRunner).submit("exp-1");
    }

    @Test
    void testRunConflictIsReported() throws Exception {
        when(experimentRunner.submit("busy")).thenThrow(
            new InvalidExperimentStateException("busy", ExperimentStatus.RUNNING, ExperimentStatus.RUNNING));

        mockMvc.perform(post("/api/chaos/experiments/busy/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("CL-520"))
            .andExpect(jsonPath("$.metadata.current_status").value("running"));
    }

    @Test
    void testAbortReturnsExperiment() throws Exception {
        when(scheduler.getExperiment("exp-1")).thenReturn(
            new ExperimentInfo("exp-1", "demo", ExperimentStatus.PENDING, true, pendingInfo("exp-1").definition()));

        mockMvc.perform(post("/api/chaos/experiments/exp-1/abort"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.abort_requested").value(true));

        verify(scheduler).abort("exp-1");
    }

    @Test
    void testMissingResultIsNotFound() throws Exception {
        when(scheduler.getResult("exp-1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/chaos/experiments/exp-1/result"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CL-300"));
    }

    @Test
    void testFaultTypesUseWireNames() throws Exception {
        mockMvc.perform(get("/api/chaos/fault-types"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(6))
            .andExpect(jsonPath("$[0]").value("latency"))
            .andExpect(jsonPath("$[5]").value("data_corruption"));
    }

    @Test
    void testStats() throws Exception {
        when(scheduler.getStats()).thenReturn(new ExperimentStats(3, 1, 1, 1, 0));

        mockMvc.perform(get("/api/chaos/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(3))
            .andExpect(jsonPath("$.completed").value(1));
    }
}

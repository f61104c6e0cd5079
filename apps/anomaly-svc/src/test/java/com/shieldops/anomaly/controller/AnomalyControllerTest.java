package com.shieldops.anomaly.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shieldops.anomaly.controller.dto.BaselineUpdateRequestDto;
import com.shieldops.anomaly.controller.dto.DetectionRequestDto;
import com.shieldops.anomaly.security.TraceIdFilter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AnomalyControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void detectReturnsFlaggedPoints() throws Exception {
        List<Double> values = new ArrayList<>(Collections.nCopies(20, 50.0));
        values.add(500.0);
        DetectionRequestDto request = new DetectionRequestDto(
                "api.latency", values, null, Map.of("region", "eu-west-1"), "zscore", 2.0, null);

        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(header().exists(TraceIdFilter.TRACE_HEADER))
                .andExpect(jsonPath("$.metricName").value("api.latency"))
                .andExpect(jsonPath("$.algorithm").value("zscore"))
                .andExpect(jsonPath("$.totalPoints").value(21))
                .andExpect(jsonPath("$.anomalyCount").value(1))
                .andExpect(jsonPath("$.anomalies[0].details.index").value(20))
                .andExpect(jsonPath("$.anomalies[0].details.raw_value").value(500.0))
                .andExpect(jsonPath("$.anomalies[0].threshold").value(2.0))
                .andExpect(jsonPath("$.anomalies[0].anomaly").value(true))
                .andExpect(jsonPath("$.anomalies[0].point.labels.region").value("eu-west-1"));
    }

    @Test
    void detectSerializesOverflowingScoreAsInfinity() throws Exception {
        DetectionRequestDto request = new DetectionRequestDto(
                "tiny.spread.http", List.of(0.0, 0.0, 1e-300, 1e-300, 1e10), null, null, "iqr", 1.5, null);

        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalyCount").value(1))
                .andExpect(jsonPath("$.anomalies[0].details.index").value(4))
                .andExpect(jsonPath("$.anomalies[0].score").value("Infinity"));
    }

    @Test
    void detectWithUnknownAlgorithmIsBadRequest() throws Exception {
        DetectionRequestDto request = new DetectionRequestDto(
                "bad.algo", List.of(1.0, 2.0, 3.0), null, null, "nonexistent", null, null);

        mockMvc.perform(post("/anomaly/detect")
                        .header(TraceIdFilter.TRACE_HEADER, "trace-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value(containsString("zscore, iqr, ema, seasonal")))
                .andExpect(jsonPath("$.traceId").value("trace-123"));
    }

    @Test
    void detectRejectsMissingMetricName() throws Exception {
        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":[1.0,2.0]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.metricName").exists());
    }

    @Test
    void detectRejectsZeroWindow() throws Exception {
        DetectionRequestDto request = new DetectionRequestDto(
                "window.zero", List.of(1.0, 2.0), null, null, "ema", 2.0, 0);

        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void detectionCreatesListedBaseline() throws Exception {
        DetectionRequestDto request = new DetectionRequestDto(
                "detected.metric", List.of(1.0, 2.0, 3.0, 4.0, 5.0), null, null, "zscore", null, null);
        mockMvc.perform(post("/anomaly/detect")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk());

        mockMvc.perform(get("/anomaly/baselines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].metricName").value(hasItem("detected.metric")));
    }

    @Test
    void postedBaselineIsReadableByName() throws Exception {
        BaselineUpdateRequestDto request = new BaselineUpdateRequestDto("my.metric", List.of(10.0, 20.0, 30.0));

        mockMvc.perform(post("/anomaly/baselines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricName").value("my.metric"))
                .andExpect(jsonPath("$.mean").value(20.0))
                .andExpect(jsonPath("$.percentiles.p50").value(20.0));

        mockMvc.perform(get("/anomaly/baselines/my.metric"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metricName").value("my.metric"))
                .andExpect(jsonPath("$.count").value(3));
    }

    @Test
    void missingBaselineIsNotFound() throws Exception {
        mockMvc.perform(get("/anomaly/baselines/nonexistent"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BASELINE_NOT_FOUND"))
                .andExpect(jsonPath("$.details.metricName").value("nonexistent"));
    }

    @Test
    void postBaselineWithoutValuesIsBadRequest() throws Exception {
        BaselineUpdateRequestDto request = new BaselineUpdateRequestDto("empty", List.of());

        mockMvc.perform(post("/anomaly/baselines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void deleteResetsBaseline() throws Exception {
        BaselineUpdateRequestDto request = new BaselineUpdateRequestDto("reset.me", List.of(1.0, 2.0));
        mockMvc.perform(post("/anomaly/baselines")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/anomaly/baselines/reset.me"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/anomaly/baselines/reset.me"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/anomaly/baselines/reset.me"))
                .andExpect(status().isNotFound());
    }
}

package com.shieldops.anomaly.controller;

import com.shieldops.anomaly.analytics.AnomalyDetector;
import com.shieldops.anomaly.analytics.BaselineNotFoundException;
import com.shieldops.anomaly.controller.dto.BaselineResponseDto;
import com.shieldops.anomaly.controller.dto.BaselineUpdateRequestDto;
import com.shieldops.anomaly.controller.dto.DetectionRequestDto;
import com.shieldops.anomaly.controller.dto.DetectionResponseDto;
import com.shieldops.anomaly.model.AnomalyResult;
import com.shieldops.anomaly.model.Baseline;
import com.shieldops.anomaly.model.DetectionRequest;
import com.shieldops.anomaly.model.DetectionResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomaly")
public class AnomalyController {

    private final AnomalyDetector anomalyDetector;

    public AnomalyController(AnomalyDetector anomalyDetector) {
        this.anomalyDetector = anomalyDetector;
    }

    @PostMapping("/detect")
    public ResponseEntity<DetectionResponseDto> detect(@Valid @RequestBody DetectionRequestDto request) {
        DetectionResponse response = anomalyDetector.detect(new DetectionRequest(
                request.metricName(),
                request.values(),
                request.timestamps(),
                request.labels(),
                request.algorithm(),
                request.sensitivity(),
                request.windowSize()
        ));
        return ResponseEntity.ok(map(response));
    }

    @GetMapping("/baselines")
    public ResponseEntity<List<BaselineResponseDto>> listBaselines() {
        return ResponseEntity.ok(anomalyDetector.listBaselines().stream()
                .map(this::map)
                .toList());
    }

    @GetMapping("/baselines/{metricName}")
    public ResponseEntity<BaselineResponseDto> getBaseline(@PathVariable("metricName") String metricName) {
        Baseline baseline = anomalyDetector.getBaseline(metricName)
                .orElseThrow(() -> new BaselineNotFoundException(metricName));
        return ResponseEntity.ok(map(baseline));
    }

    @PostMapping("/baselines")
    public ResponseEntity<BaselineResponseDto> updateBaseline(@Valid @RequestBody BaselineUpdateRequestDto request) {
        Baseline baseline = anomalyDetector.updateBaseline(request.metricName(), request.values());
        return ResponseEntity.ok(map(baseline));
    }

    @DeleteMapping("/baselines/{metricName}")
    public ResponseEntity<Void> resetBaseline(@PathVariable("metricName") String metricName) {
        if (!anomalyDetector.resetBaseline(metricName)) {
            throw new BaselineNotFoundException(metricName);
        }
        return ResponseEntity.noContent().build();
    }

    private DetectionResponseDto map(DetectionResponse response) {
        return new DetectionResponseDto(
                response.metricName(),
                response.anomalies().stream()
                        .map(this::map)
                        .toList(),
                response.totalPoints(),
                response.anomalyCount(),
                response.algorithm()
        );
    }

    private DetectionResponseDto.AnomalyDto map(AnomalyResult result) {
        return new DetectionResponseDto.AnomalyDto(
                result.metricName(),
                new DetectionResponseDto.PointDto(result.point().timestamp(), result.point().value(), result.point().labels()),
                result.score(),
                result.threshold(),
                result.anomaly(),
                result.algorithm(),
                result.details()
        );
    }

    private BaselineResponseDto map(Baseline baseline) {
        return new BaselineResponseDto(
                baseline.metricName(),
                baseline.mean(),
                baseline.stdDev(),
                baseline.min(),
                baseline.max(),
                baseline.count(),
                baseline.updatedAt(),
                baseline.percentiles()
        );
    }
}

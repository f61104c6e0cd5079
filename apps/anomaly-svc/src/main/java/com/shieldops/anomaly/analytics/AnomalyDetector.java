package com.shieldops.anomaly.analytics;

import com.shieldops.anomaly.config.AnomalyProperties;
import com.shieldops.anomaly.model.AnomalyResult;
import com.shieldops.anomaly.model.Baseline;
import com.shieldops.anomaly.model.DetectionRequest;
import com.shieldops.anomaly.model.DetectionResponse;
import com.shieldops.anomaly.model.Sample;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point of the engine. Routes a {@link DetectionRequest} to one detector,
 * materialises the flagged points as {@link AnomalyResult}s and folds the whole
 * input into the metric's baseline.
 */
@Service
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private static final int SCORE_SCALE = 4;

    private final BaselineStore baselineStore;
    private final TimestampResolver timestampResolver;
    private final AnomalyProperties.Detection defaults;
    private final ZScoreDetector zScoreDetector = new ZScoreDetector();
    private final IqrDetector iqrDetector = new IqrDetector();
    private final EmaDetector emaDetector = new EmaDetector();
    private final SeasonalDetector seasonalDetector = new SeasonalDetector(zScoreDetector);

    @Autowired
    public AnomalyDetector(BaselineStore baselineStore, AnomalyProperties properties, Clock clock) {
        this.baselineStore = baselineStore;
        this.timestampResolver = new TimestampResolver(clock);
        this.defaults = properties.detection();
        log.info("Anomaly detector ready: defaultAlgorithm={} defaultSensitivity={} defaultWindowSize={}",
                defaults.defaultAlgorithm().id(), defaults.defaultSensitivity(), defaults.defaultWindowSize());
    }

    public DetectionResponse detect(DetectionRequest request) {
        DetectionAlgorithm algorithm = request.algorithm() == null
                ? defaults.defaultAlgorithm()
                : DetectionAlgorithm.parse(request.algorithm());
        double sensitivity = Optional.ofNullable(request.sensitivity()).orElse(defaults.defaultSensitivity());
        int windowSize = Optional.ofNullable(request.windowSize()).orElse(defaults.defaultWindowSize());
        List<Double> values = request.values();

        List<PointScore> scores = score(algorithm, values, sensitivity, windowSize);

        List<AnomalyResult> anomalies = new ArrayList<>();
        for (PointScore point : scores) {
            if (!point.anomaly()) {
                continue;
            }
            double rawValue = values.get(point.index());
            Sample sample = new Sample(
                    timestampResolver.resolve(request.timestamps(), point.index()),
                    rawValue,
                    request.labels()
            );
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("index", point.index());
            details.put("raw_value", rawValue);
            anomalies.add(new AnomalyResult(
                    request.metricName(),
                    sample,
                    round(point.score()),
                    sensitivity,
                    true,
                    algorithm.id(),
                    details
            ));
        }

        baselineStore.update(request.metricName(), values);

        log.debug("Anomaly detection ({}): metric={} points={} anomalies={}",
                algorithm.id(), request.metricName(), values.size(), anomalies.size());
        return new DetectionResponse(request.metricName(), anomalies, values.size(), anomalies.size(), algorithm.id());
    }

    public Baseline updateBaseline(String metricName, List<Double> values) {
        return baselineStore.update(metricName, values);
    }

    public Optional<Baseline> getBaseline(String metricName) {
        return baselineStore.get(metricName);
    }

    public List<Baseline> listBaselines() {
        return baselineStore.list();
    }

    public boolean resetBaseline(String metricName) {
        return baselineStore.reset(metricName);
    }

    private List<PointScore> score(DetectionAlgorithm algorithm, List<Double> values, double sensitivity, int windowSize) {
        return switch (algorithm) {
            case ZSCORE -> zScoreDetector.detect(values, sensitivity);
            // IQR has no window; sensitivity doubles as the fence multiplier
            case IQR -> iqrDetector.detect(values, sensitivity);
            case EMA -> emaDetector.detect(values, windowSize, sensitivity);
            case SEASONAL -> seasonalDetector.detect(values, windowSize, sensitivity);
        };
    }

    private static double round(double score) {
        if (!Double.isFinite(score)) {
            // a vanishing IQR can push the fence distance past double range
            return score;
        }
        return BigDecimal.valueOf(score).setScale(SCORE_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}

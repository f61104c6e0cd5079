package com.shieldops.anomaly.analytics;

import com.shieldops.anomaly.model.Baseline;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per-metric value history and the baseline derived from it.
 * <p>
 * Histories are unbounded. Every update appends to the history and recomputes
 * the baseline over all of it. The append and recompute for one metric run
 * inside {@link ConcurrentHashMap#compute}, so updates to the same metric are
 * serialized while different metrics proceed in parallel. Baselines are
 * immutable, reads never block.
 */
@Component
public class BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

    private static final double[] TRACKED_PERCENTILES = {50, 95, 99};

    private final Map<String, List<Double>> histories = new ConcurrentHashMap<>();
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public BaselineStore(Clock clock) {
        this.clock = clock;
    }

    public Baseline update(String metricName, List<Double> values) {
        Baseline[] updated = new Baseline[1];
        histories.compute(metricName, (name, history) -> {
            List<Double> merged = history == null ? new ArrayList<>() : history;
            merged.addAll(values);
            Baseline baseline = compute(name, merged);
            baselines.put(name, baseline);
            updated[0] = baseline;
            return merged;
        });
        log.debug("Baseline recomputed: metric={} added={} count={}", metricName, values.size(), updated[0].count());
        return updated[0];
    }

    public Optional<Baseline> get(String metricName) {
        return Optional.ofNullable(baselines.get(metricName));
    }

    public List<Baseline> list() {
        return baselines.values().stream()
                .sorted(Comparator.comparing(Baseline::metricName))
                .toList();
    }

    public int size() {
        return baselines.size();
    }

    /**
     * Drops the history and baseline of one metric.
     *
     * @return {@code true} when the metric existed
     */
    public boolean reset(String metricName) {
        boolean[] removed = new boolean[1];
        histories.computeIfPresent(metricName, (name, history) -> {
            baselines.remove(name);
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            log.info("Baseline reset: metric={}", metricName);
        }
        return removed[0];
    }

    private Baseline compute(String metricName, List<Double> history) {
        List<Double> sorted = Statistics.sortedCopy(history);
        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (double p : TRACKED_PERCENTILES) {
            percentiles.put("p" + (int) p, Statistics.percentileOfSorted(sorted, p));
        }
        double min = sorted.isEmpty() ? 0d : sorted.get(0);
        double max = sorted.isEmpty() ? 0d : sorted.get(sorted.size() - 1);
        return new Baseline(
                metricName,
                Statistics.mean(history),
                Statistics.populationStdDev(history),
                min,
                max,
                history.size(),
                clock.instant(),
                percentiles
        );
    }
}

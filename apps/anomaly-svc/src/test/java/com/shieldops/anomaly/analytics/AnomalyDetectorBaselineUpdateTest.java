package com.shieldops.anomaly.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.shieldops.anomaly.config.AnomalyProperties;
import com.shieldops.anomaly.model.DetectionRequest;
import java.time.Clock;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorBaselineUpdateTest {

    @Mock
    private BaselineStore baselineStore;

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(baselineStore, new AnomalyProperties(null), Clock.systemUTC());
    }

    @Test
    void updatesBaselineWithFullInputEvenWithoutAnomalies() {
        List<Double> values = Collections.nCopies(10, 5.0);

        detector.detect(new DetectionRequest("flat", values, "zscore"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Double>> captor = ArgumentCaptor.forClass(List.class);
        verify(baselineStore).update(eq("flat"), captor.capture());
        assertThat(captor.getValue()).hasSize(10).containsOnly(5.0);
    }

    @Test
    void rejectedAlgorithmNeverReachesStore() {
        assertThatThrownBy(() -> detector.detect(new DetectionRequest("x", List.of(1.0), "median")))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(baselineStore);
    }
}

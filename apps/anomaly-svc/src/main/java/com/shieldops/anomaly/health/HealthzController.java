package com.shieldops.anomaly.health;

import com.shieldops.anomaly.analytics.BaselineStore;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public liveness probe. Reports how many metrics currently carry a baseline;
 * Actuator health stays available for internal checks.
 */
@RestController
public class HealthzController {

    private final BaselineStore baselineStore;

    public HealthzController(BaselineStore baselineStore) {
        this.baselineStore = baselineStore;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("baselines", baselineStore.size());
        return body;
    }
}

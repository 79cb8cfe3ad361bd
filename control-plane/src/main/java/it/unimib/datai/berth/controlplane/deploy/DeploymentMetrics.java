package it.unimib.datai.berth.controlplane.deploy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import it.unimib.datai.berth.common.model.DeploymentStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DeploymentMetrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> deploymentCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> reclaimCounters = new ConcurrentHashMap<>();
    private final Timer healthCheckTimer;

    public DeploymentMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.healthCheckTimer = Timer.builder("deployment_healthcheck_ms")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void deployment(DeploymentStatus outcome) {
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        deploymentCounters.computeIfAbsent(tag, key -> Counter.builder("deployment_total")
                .tag("outcome", key)
                .register(registry)).increment();
    }

    public void healthCheck(Duration elapsed) {
        healthCheckTimer.record(elapsed);
    }

    public void reclaim(String kind, boolean success) {
        String outcome = success ? "success" : "failure";
        reclaimCounters.computeIfAbsent(kind + ":" + outcome, key -> Counter.builder("reclaim_total")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)).increment();
    }
}

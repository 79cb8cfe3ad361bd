package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.HealthCheckKind;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.config.HealthCheckProperties;
import it.unimib.datai.berth.controlplane.wait.Deadline;
import it.unimib.datai.berth.controlplane.wait.OperationCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * GETs the health check path on the deployment's own URL, authenticating with the
 * caller's token. Only HTTP 200 is healthy.
 */
@Component
public class HttpPathHealthProbe implements HealthProbe {
    private static final Logger log = LoggerFactory.getLogger(HttpPathHealthProbe.class);

    private final HttpClient http;
    private final String scheme;
    private final Duration requestCap;

    @Autowired
    public HttpPathHealthProbe(@Qualifier("healthProbeHttpClient") HttpClient http, HealthCheckProperties properties) {
        this(http, properties.probeSchemeOrDefault(), Duration.ofSeconds(properties.probeRequestCapSecondsOrDefault()));
    }

    HttpPathHealthProbe(HttpClient http, String scheme, Duration requestCap) {
        this.http = http;
        this.scheme = scheme;
        this.requestCap = requestCap;
    }

    @Override
    public HealthCheckKind kind() {
        return HealthCheckKind.PATH;
    }

    @Override
    public ProbeResult probe(Deployment deployment, ClusterTask task, String authToken, Deadline deadline) {
        if (deployment.previewUrl() == null || deployment.previewUrl().isBlank()) {
            return ProbeResult.unhealthy("The deployment has no URL to run the healthcheck against");
        }
        Deadline requestDeadline = deadline.cappedAt(requestCap);
        Duration timeout = requestDeadline.remaining();
        if (timeout.isZero()) {
            throw new ProbeTimeoutException(HealthMonitor.PROBE_TIMEOUT_REASON);
        }

        URI uri = URI.create(scheme + "://" + deployment.previewUrl() + deployment.service().healthCheck().value());
        HttpRequest.Builder req = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout);
        if (authToken != null && !authToken.isBlank()) {
            req.header("Authorization", "Token " + authToken);
        }

        log.debug("Probing {} for deployment {} (timeout {}ms)", uri, deployment.hash(), timeout.toMillis());
        try {
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            return new ProbeResult(resp.statusCode() == 200, resp.body());
        } catch (HttpTimeoutException e) {
            if (deadline.expired()) {
                throw new ProbeTimeoutException(HealthMonitor.PROBE_TIMEOUT_REASON, e);
            }
            return ProbeResult.unhealthy("The healthcheck request to " + uri + " timed out after "
                    + timeout.toMillis() + "ms");
        } catch (IOException e) {
            return ProbeResult.unhealthy("The healthcheck request to " + uri + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while probing " + uri);
        }
    }
}

package it.unimib.datai.berth.controlplane.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.transport.DockerHttpClient;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.DockerEngineClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.function.Function;

@Configuration
public class DockerClientConfig {

    private static final Logger log = LoggerFactory.getLogger(DockerClientConfig.class);
    static final String DEFAULT_HOST = "tcp://localhost:2375";

    private final Function<String, String> env;

    public DockerClientConfig() {
        this(System::getenv);
    }

    DockerClientConfig(Function<String, String> env) {
        this.env = env;
    }

    @Bean
    public DockerHttpClient dockerHttpClient(DockerProperties properties) {
        DefaultDockerClientConfig config = clientConfig(properties);
        return new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .connectionTimeout(Duration.ofMillis(properties.connectTimeoutMsOrDefault()))
                .responseTimeout(Duration.ofMillis(properties.requestTimeoutMsOrDefault()))
                .build();
    }

    @Bean
    public DockerClient dockerClient(DockerProperties properties, DockerHttpClient dockerHttpClient) {
        DefaultDockerClientConfig config = clientConfig(properties);
        log.info("Docker Engine API: host={}, apiVersion={}", config.getDockerHost(), config.getApiVersion());
        return DockerClientImpl.getInstance(config, dockerHttpClient);
    }

    @Bean
    public ClusterClient clusterClient(DockerClient dockerClient, DockerHttpClient dockerHttpClient,
                                       DockerProperties properties) {
        return new DockerEngineClient(dockerClient, dockerHttpClient, properties.apiVersionOrDefault(),
                Duration.ofMillis(properties.requestTimeoutMsOrDefault()),
                Duration.ofMillis(properties.pullTimeoutMsOrDefault()));
    }

    DefaultDockerClientConfig clientConfig(DockerProperties properties) {
        String version = properties.apiVersionOrDefault();
        return DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(resolveHost(properties.host()))
                .withApiVersion(version.startsWith("v") ? version.substring(1) : version)
                .build();
    }

    String resolveHost(String configured) {
        if (configured != null && !configured.isBlank()) {
            return toDockerHost(configured.trim());
        }
        String dockerHost = env.apply("DOCKER_HOST");
        if (dockerHost != null && (dockerHost.startsWith("tcp://") || dockerHost.startsWith("unix://"))) {
            return dockerHost.trim();
        }
        if (dockerHost != null && !dockerHost.isBlank()) {
            log.warn("Ignoring DOCKER_HOST={}: only tcp:// and unix:// endpoints are supported", dockerHost);
        }
        return DEFAULT_HOST;
    }

    private static String toDockerHost(String host) {
        String trimmed = host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
        return trimmed.startsWith("http://") ? "tcp://" + trimmed.substring("http://".length()) : trimmed;
    }
}

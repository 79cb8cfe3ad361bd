package it.unimib.datai.berth.controlplane.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * HTTP clients for the proxy admin API and for user health endpoints.
 */
@Configuration
public class HttpClientConfig {

    private static final Duration PROBE_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public RestClient proxyAdminRestClient(ProxyProperties properties) {
        Duration timeout = Duration.ofMillis(properties.requestTimeoutMsOrDefault());
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return RestClient.builder()
                .baseUrl(properties.adminUrlOrDefault())
                .requestFactory(factory)
                .build();
    }

    @Bean
    public HttpClient healthProbeHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(PROBE_CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }
}

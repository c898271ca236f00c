package com.copytrader.config;

import com.copytrader.exception.BrokerException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import lombok.Getter;
import lombok.Setter;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and client beans for the Delta Exchange private socket and
 * REST API.
 *
 * <p>Binds to the {@code delta.*} prefix in application.properties. Provides:
 * <ul>
 *   <li>An {@link OkHttpClient} for the private WebSocket, with protocol pings every
 *       {@code ping-interval} and {@code ping-timeout} bounding the upgrade handshake.</li>
 *   <li>A {@link RestClient} for order submission with separate connect and read timeouts.</li>
 * </ul>
 *
 * <p>Credentials have no defaults; the application refuses to start without them.
 */
@Configuration
@ConfigurationProperties(prefix = "delta")
@Validated
@Getter
@Setter
public class DeltaConfig {

    private static final Logger log = LoggerFactory.getLogger(DeltaConfig.class);

    /** Whether the socket session loop starts with the application. */
    private boolean enabled = true;

    @NotBlank
    private String wsUrl = "wss://socket.india.delta.exchange";

    @NotBlank
    private String apiBase = "https://api.india.delta.exchange";

    @NotBlank
    private String apiKey;

    @NotBlank
    private String apiSecret;

    /** Disables TLS certificate verification on the socket. Never enable outside a lab. */
    private boolean wsInsecure = false;

    private String userAgent = "java-rest-client";

    /**
     * Protocol ping period. OkHttp fails the session when a pong has not arrived by the next
     * ping, so this is also the pong deadline.
     */
    @NotNull
    private Duration pingInterval = Duration.ofSeconds(30);

    /**
     * Connect and upgrade-handshake timeout of the socket. OkHttp has no separate pong timeout
     * (see {@link #pingInterval}), so the {@code PING_TIMEOUT} bound lands on session setup.
     */
    @NotNull
    private Duration pingTimeout = Duration.ofSeconds(5);

    /** REST read timeout. */
    @NotNull
    private Duration httpTimeout = Duration.ofSeconds(10);

    /** REST connect timeout. */
    @NotNull
    private Duration httpConnTimeout = Duration.ofMillis(3050);

    /** Total attempts per order request, including the first. */
    @Min(1)
    private int httpRetries = 3;

    @NotNull
    private Duration retryBackoffBase = Duration.ofMillis(500);

    @NotNull
    private Duration retryBackoffMax = Duration.ofSeconds(4);

    private boolean heartbeatEnabled = true;

    @Valid
    private Reconnect reconnect = new Reconnect();

    /** OkHttp client used only for the private WebSocket session. */
    @Bean
    public OkHttpClient deltaSocketClient() {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS)
                .connectTimeout(pingTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS);
        if (wsInsecure) {
            log.warn("delta.ws-insecure=true: TLS certificate verification is DISABLED for {}", wsUrl);
            applyTrustAll(builder);
        }
        return builder.build();
    }

    /** RestClient for {@code POST /v2/orders}. Signing headers are added per request. */
    @Bean
    public RestClient deltaRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(httpConnTimeout);
        requestFactory.setReadTimeout(httpTimeout);
        log.info("Creating Delta RestClient for {} with API key: {}", apiBase, maskApiKey(apiKey));
        return RestClient.builder()
                .baseUrl(apiBase)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    private void applyTrustAll(OkHttpClient.Builder builder) {
        X509TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {}

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {}

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[] {trustAll}, new SecureRandom());
            builder.sslSocketFactory(sslContext.getSocketFactory(), trustAll);
            builder.hostnameVerifier((hostname, session) -> true);
        } catch (GeneralSecurityException e) {
            throw new BrokerException("Unable to build insecure TLS context", e);
        }
    }

    private String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }

    @Getter
    @Setter
    public static class Reconnect {

        /** First wait after a failed session, and the wait after any healthy session. */
        @NotNull
        private Duration backoffBase = Duration.ofSeconds(1);

        @NotNull
        private Duration backoffMax = Duration.ofSeconds(60);

        /** Upper bound of the random fraction added to each wait. */
        @DecimalMin("0.0")
        private double backoffJitter = 0.4;
    }
}

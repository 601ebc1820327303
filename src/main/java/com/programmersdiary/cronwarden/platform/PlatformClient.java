package com.programmersdiary.cronwarden.platform;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.programmersdiary.cronwarden.scheduling.ReportSender;
import com.programmersdiary.cronwarden.scheduling.ScanTrigger;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

/**
 * Calls the vulnerability platform API when scan and report jobs fire. Network failures and
 * 5xx responses are retried with capped exponential backoff; every other non-201 answer fails at
 * once. Connect and read timeouts keep a hung platform from pinning a worker thread.
 */
@Component
public class PlatformClient implements ScanTrigger, ReportSender {

    private static final Logger log = LoggerFactory.getLogger(PlatformClient.class);
    private static final String CREATE_SCAN_PATH = "/v1/teams/{teamId}/scans";
    private static final String SEND_REPORT_PATH = "/v1/teams/{teamId}/report/digest";
    private static final double RANDOMIZATION_FACTOR = 0.5;

    private final RestClient restClient;
    private final String user;
    private final Retry retry;

    @Autowired
    public PlatformClient(
            @Value("${cronwarden.platform.url:http://localhost:8081}") String url,
            @Value("${cronwarden.platform.user:cronwarden}") String user,
            @Value("${cronwarden.platform.token:}") String token,
            @Value("${cronwarden.platform.connect-timeout:10s}") Duration connectTimeout,
            @Value("${cronwarden.platform.read-timeout:30s}") Duration readTimeout,
            @Value("${cronwarden.platform.retry.max-attempts:25}") int maxAttempts,
            @Value("${cronwarden.platform.retry.initial-interval:500ms}") Duration initialInterval,
            @Value("${cronwarden.platform.retry.multiplier:1.5}") double multiplier,
            @Value("${cronwarden.platform.retry.max-interval:60s}") Duration maxInterval) {
        this(RestClient.builder().baseUrl(url).requestFactory(requestFactory(connectTimeout, readTimeout)),
                user, token, retry(maxAttempts, backoff(initialInterval, multiplier, maxInterval)));
    }

    PlatformClient(RestClient.Builder builder, String user, String token, Retry retry) {
        this.restClient = builder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (token != null ? token : ""))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.user = user;
        this.retry = retry;
        retry.getEventPublisher().onRetry(event -> log.warn("Platform call failed (attempt {}), retrying in {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    /**
     * Randomized exponential backoff whose base interval stops growing at {@code maxInterval}.
     */
    static IntervalFunction backoff(Duration initialInterval, double multiplier, Duration maxInterval) {
        return IntervalFunction.ofExponentialRandomBackoff(
                initialInterval, multiplier, RANDOMIZATION_FACTOR, maxInterval);
    }

    static Retry retry(int maxAttempts, IntervalFunction backoff) {
        var config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnException(PlatformClient::isTransient)
                .build();
        return Retry.of("platform", config);
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof ResourceAccessException) {
            return true;
        }
        return t instanceof PlatformRequestException e && e.isRetryable();
    }

    @Override
    public void triggerScan(String programId, String teamId) {
        var request = new ScanRequest(programId, Instant.now(), user);
        retry.executeRunnable(() -> post(CREATE_SCAN_PATH, teamId, request));
    }

    @Override
    public void sendReport(String teamId) {
        retry.executeRunnable(() -> post(SEND_REPORT_PATH, teamId, null));
    }

    private void post(String path, String teamId, Object body) {
        var request = restClient.post().uri(path, teamId);
        if (body != null) {
            request.body(body);
        }
        request.retrieve()
                .onStatus(status -> status.value() != HttpStatus.CREATED.value(), (req, response) -> {
                    var content = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    throw new PlatformRequestException(response.getStatusCode(), content);
                })
                .toBodilessEntity();
    }

    record ScanRequest(
            @JsonProperty("program_id") String programId,
            @JsonProperty("scheduled_time") Instant scheduledTime,
            @JsonProperty("requested_by") String requestedBy) {
    }
}

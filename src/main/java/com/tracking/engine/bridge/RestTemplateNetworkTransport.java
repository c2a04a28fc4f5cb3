package com.tracking.engine.bridge;

import com.tracking.engine.config.TrackingProperties;
import com.tracking.engine.exception.SyncException;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.platform.NetworkTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link NetworkTransport} backed by {@link RestTemplate}.
 *
 * Non-2xx answers are returned as-is (the sync pipeline classifies them).
 * Only failures without an HTTP status become {@link SyncException}s:
 * read timeouts as TIMEOUT, every other I/O failure as SYNC_RETRYABLE.
 *
 * One RestTemplate is kept per distinct read timeout.
 */
@Component
@Slf4j
public class RestTemplateNetworkTransport implements NetworkTransport {

    private final RestTemplateBuilder restTemplateBuilder;
    private final TrackingProperties properties;
    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    public RestTemplateNetworkTransport(RestTemplateBuilder restTemplateBuilder, TrackingProperties properties) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.properties = properties;
    }

    @Override
    public TransportResponse send(String method, String url, Map<String, String> headers, String body, Duration timeout) {
        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        headers.forEach(httpHeaders::set);

        try {
            ResponseEntity<String> response = templateFor(timeout).exchange(
                url,
                HttpMethod.valueOf(method),
                new HttpEntity<>(body, httpHeaders),
                String.class
            );
            return new TransportResponse(response.getStatusCode().value(), response.getBody());
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new SyncException(TrackingErrorKind.TIMEOUT, "Sync request timed out after " + timeout, e);
            }
            throw new SyncException(TrackingErrorKind.SYNC_RETRYABLE, "Sync request failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SyncException(TrackingErrorKind.SYNC_RETRYABLE, "Sync request failed: " + e.getMessage(), e);
        }
    }

    private RestTemplate templateFor(Duration timeout) {
        return templates.computeIfAbsent(timeout, readTimeout -> restTemplateBuilder
            .setConnectTimeout(properties.getSync().getConnectTimeout())
            .setReadTimeout(readTimeout)
            .additionalInterceptors(new LoggingInterceptor())
            .errorHandler(new PassThroughErrorHandler())
            .build());
    }

    /**
     * Lets 4xx/5xx answers reach the caller as responses instead of exceptions.
     */
    private static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // never called, hasError is always false
        }
    }

    private static class LoggingInterceptor implements ClientHttpRequestInterceptor {

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body,
                                            ClientHttpRequestExecution execution) throws IOException {
            long start = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("Sync {} {} -> {} in {}ms ({} bytes)",
                    request.getMethod(), request.getURI(), response.getStatusCode().value(),
                    System.currentTimeMillis() - start, body.length);
            return response;
        }
    }
}

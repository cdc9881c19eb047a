package com.mk.fx.qa.burst.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * HTTP client that sends requests to a single target URL. Supports static header management and
 * connect/request timeouts. This implementation does not include retry logic: every call is a
 * single attempt that either yields a response (whatever its status) or a {@link
 * TransportException}.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

    /** Default connection timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    /** Default request timeout. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private static final String CONTENT_TYPE = "Content-Type";

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Target URI of every request. */
    private final URI targetUri;

    /** Deadline applied to every request. */
    private final Duration requestTimeout;

    /**
     * Constructs a client with the default timeouts.
     *
     * @param targetUrl the URL every request is sent to
     * @param headers headers to include in all requests
     */
    public LoadHttpClient(String targetUrl, Map<String, String> headers) {
        this(targetUrl, DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, headers);
    }

    /**
     * Constructs a client with explicit timeouts.
     *
     * @param targetUrl the URL every request is sent to
     * @param connectTimeout connection timeout
     * @param requestTimeout deadline for each request, from send until the response is read
     * @param headers headers to include in all requests
     */
    public LoadHttpClient(
            String targetUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            Map<String, String> headers) {

        this.targetUri = parseTargetUrl(targetUrl);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
        Objects.requireNonNull(connectTimeout, "Connection timeout cannot be null");

        // h2c upgrade attempts are pointless against plain load targets
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Target URL: {}, Connection timeout: {}ms, Request timeout: {}ms",
                targetUri,
                connectTimeout.toMillis(),
                requestTimeout.toMillis());
    }

    /**
     * Executes a synchronous request against the target URL.
     *
     * @param request the request to execute
     * @return the response data, for any status code
     * @throws TransportException if no response could be obtained
     */
    public RestResponseData execute(Request request) {
        Objects.requireNonNull(request, "Request cannot be null");

        if (request.getMethod() == null) {
            throw new IllegalArgumentException("Request method is required");
        }

        try {
            var httpRequest = buildHttpRequest(request);
            var startTime = System.nanoTime();

            log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

            var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            var duration = (System.nanoTime() - startTime) / 1_000_000;

            log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
            return buildResponseData(response, duration);

        } catch (HttpTimeoutException e) {
            throw new TransportException(
                    "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted", e);
        } catch (Exception e) {
            throw new TransportException("Error executing request: " + describe(e), e);
        }
    }

    /**
     * Builds an HTTP request from the given Request.
     *
     * @param request the Request to build
     * @return the constructed HttpRequest
     * @throws JsonProcessingException if the body cannot be serialised
     */
    private HttpRequest buildHttpRequest(Request request) throws JsonProcessingException {
        var requestBuilder = HttpRequest.newBuilder()
                .uri(targetUri)
                .timeout(requestTimeout);

        // client headers
        headers.forEach(requestBuilder::header);

        // request-specific headers override
        if (request.getHeaders() != null) {
            request.getHeaders().forEach(requestBuilder::setHeader);
        }

        if (request.getBody() != null) {
            var jsonBody = JsonUtil.toJson(request.getBody());
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody));
            if (!hasHeader(request, CONTENT_TYPE)) {
                requestBuilder.setHeader(CONTENT_TYPE, "application/json");
            }
        } else {
            requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
        }

        return requestBuilder.build();
    }

    private boolean hasHeader(Request request, String name) {
        if (headers.keySet().stream().anyMatch(name::equalsIgnoreCase)) {
            return true;
        }
        return request.getHeaders() != null
                && request.getHeaders().keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    /**
     * Builds a RestResponseData object from the HTTP response.
     *
     * @param response the HTTP response
     * @param durationMs the duration of the request in milliseconds
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(HttpResponse<String> response, long durationMs) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setBody(response.body());
        result.setResponseTimeMs(durationMs);
        return result;
    }

    private static String describe(Exception e) {
        var message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    /**
     * Parses and validates a target URL.
     *
     * @param targetUrl the URL to validate
     * @return the parsed URI
     * @throws NullPointerException if the URL is null
     * @throws IllegalArgumentException if the URL is empty, malformed, not http(s) or has no host
     */
    public static URI parseTargetUrl(String targetUrl) {
        Objects.requireNonNull(targetUrl, "Target URL cannot be null");
        var trimmed = targetUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Target URL cannot be empty");
        }
        var uri = URI.create(trimmed);
        var scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Target URL must use http or https: " + targetUrl);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("Target URL has no host: " + targetUrl);
        }
        return uri;
    }

    public URI getTargetUri() {
        return targetUri;
    }

    @Override
    public void close() {
        log.debug("LoadHttpClient for {} closed", targetUri);
    }
}

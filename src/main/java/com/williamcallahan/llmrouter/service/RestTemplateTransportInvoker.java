package com.williamcallahan.llmrouter.service;

import com.williamcallahan.llmrouter.domain.Credential;
import com.williamcallahan.llmrouter.support.DiagnosticText;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.http.client.ClientHttpRequestFactoryBuilder;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link TransportInvoker} backed by Spring's {@link RestTemplate}.
 *
 * <p>HTTP error statuses are handed back untouched so the provider normalizer can classify them;
 * only failures without a response become {@link TransportException}. Interrupting the calling
 * thread aborts the call; the interrupt flag stays set.</p>
 */
public class RestTemplateTransportInvoker implements TransportInvoker {
    private static final Logger log = LoggerFactory.getLogger(RestTemplateTransportInvoker.class);

    private final RestTemplate restTemplate;

    /**
     * Creates a transport with fixed connect and read timeouts on the JDK {@code HttpClient}.
     *
     * @param restTemplateBuilder RestTemplate builder
     * @param connectTimeout connection establishment deadline
     * @param readTimeout response deadline
     */
    public RestTemplateTransportInvoker(
            RestTemplateBuilder restTemplateBuilder, Duration connectTimeout, Duration readTimeout) {
        this.restTemplate = Objects.requireNonNull(restTemplateBuilder, "restTemplateBuilder")
                .requestFactoryBuilder(ClientHttpRequestFactoryBuilder.jdk())
                .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                .readTimeout(Objects.requireNonNull(readTimeout, "readTimeout"))
                .errorHandler(new PassThroughResponseErrorHandler())
                .build();
    }

    @Override
    public TransportResponse invoke(TransportRequest request, Credential credential) throws TransportException {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(credential, "credential");

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(credential.secret());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (request.body() != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        HttpEntity<byte[]> entity = new HttpEntity<>(
                request.body() == null ? null : request.body().getBytes(StandardCharsets.UTF_8), headers);
        HttpMethod method = HttpMethod.valueOf(request.method().toUpperCase(Locale.ROOT));

        log.debug("[TRANSPORT] {} {} (credential={})", method, request.url(), credential.masked());
        try {
            ResponseEntity<byte[]> response =
                    restTemplate.exchange(URI.create(request.url()), method, entity, byte[].class);
            int statusCode = response.getStatusCode().value();
            log.debug("[TRANSPORT] {} {} -> HTTP {}", method, request.url(), statusCode);
            return new TransportResponse(statusCode, decodeBody(response.getBody()));
        } catch (RestClientException clientException) {
            boolean cancelled = isCancellation(clientException);
            boolean timedOut = !cancelled && isTimeout(clientException);
            if (cancelled) {
                Thread.currentThread().interrupt();
            }
            String details = DiagnosticText.sanitize(clientException.getMessage());
            log.warn("[TRANSPORT] {} {} failed without response (timedOut={}, cancelled={}): {}",
                    method, request.url(), timedOut, cancelled, details.isBlank() ? "no details" : details);
            throw new TransportException(
                    failurePrefix(timedOut, cancelled) + request.url()
                            + (details.isBlank() ? "" : " (" + details + ")"),
                    timedOut,
                    cancelled,
                    clientException);
        }
    }

    /** JSON bodies are UTF-8 whatever charset, if any, the vendor declares. */
    private static String decodeBody(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    private static String failurePrefix(boolean timedOut, boolean cancelled) {
        if (cancelled) {
            return "Request cancelled: ";
        }
        return timedOut ? "Request timed out: " : "Request failed: ";
    }

    private static boolean isCancellation(Throwable failure) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        Throwable current = failure;
        while (current != null) {
            if (current instanceof InterruptedException
                    || current instanceof ClosedByInterruptException
                    || (current instanceof InterruptedIOException && !(current instanceof SocketTimeoutException))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTimeout(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("timed out")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /** Treats every status as a response to be classified downstream. */
    private static final class PassThroughResponseErrorHandler extends DefaultResponseErrorHandler {
        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }
    }
}

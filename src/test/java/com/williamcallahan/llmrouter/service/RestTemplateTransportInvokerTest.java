package com.williamcallahan.llmrouter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.williamcallahan.llmrouter.domain.Credential;
import com.williamcallahan.llmrouter.domain.CredentialSource;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

/**
 * Verifies the RestTemplate transport returns raw UTF-8 responses and classifies failures without a response.
 */
class RestTemplateTransportInvokerTest {
    private static final Credential BOGUS_KEY = new Credential("bogus-key", CredentialSource.EXPLICIT);

    @Test
    void sendsBearerCredentialAndJsonBody() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicReference<String> authorizationHeader = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        AtomicReference<String> requestBody = new AtomicReference<>();

        httpServer.createContext("/v1/chat/completions", exchange -> {
            authorizationHeader.set(exchange.getRequestHeaders().getFirst("Authorization"));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respondJson(exchange, 200, "{\"ok\":true}");
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            TransportResponse response = newInvoker(Duration.ofSeconds(5)).invoke(
                    new TransportRequest("POST", baseUrl(httpServer) + "/v1/chat/completions", "{\"model\":\"m\"}"),
                    BOGUS_KEY);

            assertEquals(200, response.statusCode());
            assertEquals("{\"ok\":true}", response.body());
            assertEquals("Bearer bogus-key", authorizationHeader.get());
            assertTrue(contentType.get().startsWith("application/json"));
            assertEquals("{\"model\":\"m\"}", requestBody.get());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void returnsErrorStatusesWithoutThrowing() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);

        httpServer.createContext("/v1/models", exchange -> {
            exchange.getRequestBody().readAllBytes();
            respondJson(exchange, 401, "{\"status\":401,\"title\":\"Unauthorized\"}");
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            TransportResponse response = newInvoker(Duration.ofSeconds(5)).invoke(
                    new TransportRequest("GET", baseUrl(httpServer) + "/v1/models", null), BOGUS_KEY);

            assertEquals(401, response.statusCode());
            assertFalse(response.isSuccessful());
            assertTrue(response.body().contains("Unauthorized"));
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void slowResponseIsReportedAsTimeout() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);

        httpServer.createContext("/v1/embeddings", exchange -> {
            exchange.getRequestBody().readAllBytes();
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
            respondJson(exchange, 200, "{\"data\":[]}");
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            RestTemplateTransportInvoker invoker = newInvoker(Duration.ofMillis(500));
            TransportRequest request =
                    new TransportRequest("POST", baseUrl(httpServer) + "/v1/embeddings", "{\"input\":\"x\"}");

            TransportException thrown = assertThrows(TransportException.class, () -> invoker.invoke(request, BOGUS_KEY));

            assertTrue(thrown.isTimedOut());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void bodyWithoutDeclaredCharsetIsReadAsUtf8() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);

        httpServer.createContext("/v1/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            byte[] responseBytes = "{\"content\":\"café ✓\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, responseBytes.length);
            try (OutputStream outputStream = exchange.getResponseBody()) {
                outputStream.write(responseBytes);
            }
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            TransportResponse response = newInvoker(Duration.ofSeconds(5)).invoke(
                    new TransportRequest("POST", baseUrl(httpServer) + "/v1/chat/completions", "{\"model\":\"m\"}"),
                    BOGUS_KEY);

            assertEquals("{\"content\":\"café ✓\"}", response.body());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void nonAsciiRequestBodyIsSentAsUtf8() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicReference<String> requestBody = new AtomicReference<>();

        httpServer.createContext("/v1/embeddings", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respondJson(exchange, 200, "{\"data\":[]}");
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            newInvoker(Duration.ofSeconds(5)).invoke(
                    new TransportRequest("POST", baseUrl(httpServer) + "/v1/embeddings", "{\"input\":\"naïve ✓\"}"),
                    BOGUS_KEY);

            assertEquals("{\"input\":\"naïve ✓\"}", requestBody.get());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void interruptedCallerIsReportedAsCancelled() throws Exception {
        ExecutorService serverExecutor = Executors.newSingleThreadExecutor();
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);

        httpServer.createContext("/v1/chat/completions", exchange -> {
            exchange.getRequestBody().readAllBytes();
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            }
            respondJson(exchange, 200, "{\"ok\":true}");
        });

        httpServer.setExecutor(serverExecutor);
        httpServer.start();
        try {
            RestTemplateTransportInvoker invoker = newInvoker(Duration.ofSeconds(10));
            TransportRequest request =
                    new TransportRequest("POST", baseUrl(httpServer) + "/v1/chat/completions", "{\"model\":\"m\"}");
            AtomicReference<TransportException> failure = new AtomicReference<>();
            AtomicBoolean interruptFlagKept = new AtomicBoolean();
            Thread caller = new Thread(() -> {
                try {
                    invoker.invoke(request, BOGUS_KEY);
                } catch (TransportException transportException) {
                    failure.set(transportException);
                    interruptFlagKept.set(Thread.currentThread().isInterrupted());
                }
            }, "transport-caller");

            caller.start();
            Thread.sleep(500);
            caller.interrupt();
            caller.join(4_000);

            assertFalse(caller.isAlive());
            assertNotNull(failure.get());
            assertTrue(failure.get().isCancelled());
            assertFalse(failure.get().isTimedOut());
            assertTrue(failure.get().getMessage().startsWith("Request cancelled: "));
            assertTrue(interruptFlagKept.get());
        } finally {
            httpServer.stop(0);
            serverExecutor.shutdownNow();
        }
    }

    @Test
    void connectionFailureIsNotATimeout() throws Exception {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        String unreachableBaseUrl = baseUrl(httpServer);
        httpServer.stop(0);

        TransportException thrown = assertThrows(TransportException.class, () -> newInvoker(Duration.ofSeconds(5))
                .invoke(new TransportRequest("GET", unreachableBaseUrl + "/v1/models", null), BOGUS_KEY));

        assertFalse(thrown.isTimedOut());
        assertFalse(thrown.isCancelled());
        assertFalse(thrown.getMessage().contains("bogus-key"));
    }

    private static RestTemplateTransportInvoker newInvoker(Duration readTimeout) {
        return new RestTemplateTransportInvoker(new RestTemplateBuilder(), Duration.ofSeconds(2), readTimeout);
    }

    private static String baseUrl(HttpServer httpServer) {
        return "http://" + httpServer.getAddress().getHostString() + ":" + httpServer.getAddress().getPort();
    }

    private static void respondJson(HttpExchange exchange, int statusCode, String responseJson) throws IOException {
        byte[] jsonBytes = responseJson.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, jsonBytes.length);
        try (OutputStream outputStream = exchange.getResponseBody()) {
            outputStream.write(jsonBytes);
        }
    }
}

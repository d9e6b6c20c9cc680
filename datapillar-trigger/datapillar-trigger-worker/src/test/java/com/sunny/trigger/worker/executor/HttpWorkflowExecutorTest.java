package com.sunny.trigger.worker.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.sunny.trigger.worker.runtime.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpWorkflowExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> receivedPath = new AtomicReference<>();
    private final AtomicReference<String> receivedKey = new AtomicReference<>();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final CountDownLatch releaseSlowResponse = new CountDownLatch(1);

    private HttpServer server;
    private ExecutorService serverPool;
    private volatile int status = 200;
    private volatile String responseBody = "{\"success\":true}";
    private volatile boolean slow;

    @BeforeEach
    void setUp() throws IOException {
        serverPool = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(serverPool);
        server.createContext("/api/workflow/", exchange -> {
            receivedPath.set(exchange.getRequestURI().getPath());
            receivedKey.set(exchange.getRequestHeaders().getFirst("X-Service-Key"));
            try (InputStream in = exchange.getRequestBody()) {
                receivedBody.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            if (slow) {
                try {
                    releaseSlowResponse.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        releaseSlowResponse.countDown();
        server.stop(0);
        serverPool.shutdownNow();
    }

    @Test
    void execute_shouldPostExecutionAndParseSuccess() throws Exception {
        responseBody = "{\"success\":true,\"output\":{\"rows\":3}}";
        JsonNode input = objectMapper.readTree("{\"triggerType\":\"schedule\",\"scheduleId\":\"sch-1\"}");

        WorkflowExecutionResult result = executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", input), new CancellationToken());

        assertTrue(result.success());
        assertEquals(3, result.output().get("rows").asInt());
        assertEquals("/api/workflow/wf-1/execute", receivedPath.get());
        assertEquals("service-key", receivedKey.get());
        JsonNode body = objectMapper.readTree(receivedBody.get());
        assertEquals("exec-1", body.get("executionId").asText());
        assertEquals("sch-1", body.get("input").get("scheduleId").asText());
    }

    @Test
    void execute_businessFailureShouldBeReturnedAsResult() {
        responseBody = "{\"success\":false,\"error\":\"step 3 failed\"}";

        WorkflowExecutionResult result = executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", null), new CancellationToken());

        assertFalse(result.success());
        assertEquals("step 3 failed", result.error());
        assertNull(result.output());
    }

    @Test
    void execute_non2xxShouldRaise() {
        status = 500;
        responseBody = "{\"error\":\"internal\"}";

        WorkflowExecutorException ex = assertThrows(WorkflowExecutorException.class, () -> executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", null), new CancellationToken()));

        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void execute_responseWithoutSuccessShouldRaise() {
        responseBody = "{\"ok\":true}";

        assertThrows(WorkflowExecutorException.class, () -> executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", null), new CancellationToken()));
    }

    @Test
    void execute_cancelShouldAbortWaiting() {
        slow = true;
        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        assertThrows(WorkflowCancelledException.class, () -> executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", null), token));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 4000);
    }

    @Test
    void execute_alreadyCancelledShouldNotSendRequest() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThrows(WorkflowCancelledException.class, () -> executor().execute(
                new WorkflowExecutionRequest("wf-1", "exec-1", null), token));
        assertNull(receivedPath.get());
    }

    private HttpWorkflowExecutor executor() {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new HttpWorkflowExecutor(HttpClient.newHttpClient(), baseUrl, "service-key",
                Duration.ofSeconds(10), objectMapper);
    }
}

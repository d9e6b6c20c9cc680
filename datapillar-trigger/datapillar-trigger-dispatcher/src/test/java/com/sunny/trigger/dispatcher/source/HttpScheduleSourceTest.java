package com.sunny.trigger.dispatcher.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpScheduleSourceTest {

    private HttpServer server;
    private final AtomicReference<String> receivedKey = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String body = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/internal/schedules", exchange -> {
            receivedKey.set(exchange.getRequestHeaders().getFirst("X-Service-Key"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void fetchEnabled_shouldSendServiceKeyAndParseData() {
        body = """
                {"code":0,"data":[
                  {"id":"sch-1","workflowId":"wf-1","cronExpression":"0 * * * *","timezone":"UTC","enabled":true},
                  {"id":"sch-2","workflowId":"wf-2","cronExpression":"30 8 * * 1-5","timezone":"America/New_York","extra":"x"}
                ]}
                """;

        List<ScheduleDefinition> schedules = source("shared-secret").fetchEnabled();

        assertEquals("shared-secret", receivedKey.get());
        assertEquals(2, schedules.size());
        assertEquals("sch-1", schedules.get(0).id());
        assertEquals("America/New_York", schedules.get(1).timezone());
        assertTrue(schedules.get(1).isEnabled());
    }

    @Test
    void fetchEnabled_shouldKeepDisabledFlag() {
        body = "{\"code\":0,\"data\":[{\"id\":\"sch-1\",\"workflowId\":\"wf-1\",\"cronExpression\":\"0 * * * *\","
                + "\"timezone\":\"UTC\",\"enabled\":false}]}";

        assertFalse(source("k").fetchEnabled().get(0).isEnabled());
    }

    @Test
    void fetchEnabled_shouldFailOnUnauthorized() {
        status = 401;
        body = "{\"code\":401,\"message\":\"未授权\"}";

        ScheduleSourceException ex = assertThrows(ScheduleSourceException.class, () -> source("wrong").fetchEnabled());

        assertTrue(ex.getMessage().contains("401"));
    }

    @Test
    void fetchEnabled_shouldFailOnMalformedBody() {
        body = "{\"code\":0}";

        assertThrows(ScheduleSourceException.class, () -> source("k").fetchEnabled());
    }

    @Test
    void fetchEnabled_shouldFailWhenUnreachable() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpScheduleSource unreachable = new HttpScheduleSource(HttpClient.newHttpClient(),
                "http://127.0.0.1:" + closedPort, "k", Duration.ofSeconds(2), new ObjectMapper());

        assertThrows(ScheduleSourceException.class, unreachable::fetchEnabled);
    }

    private HttpScheduleSource source(String key) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        return new HttpScheduleSource(HttpClient.newHttpClient(), baseUrl, key, Duration.ofSeconds(5), new ObjectMapper());
    }
}

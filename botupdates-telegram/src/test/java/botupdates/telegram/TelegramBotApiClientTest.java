package botupdates.telegram;

import botupdates.BotUpdate;
import botupdates.UpstreamConflictException;
import botupdates.UpstreamFailureException;
import botupdates.UpstreamRateLimitedException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramBotApiClientTest {

    private static final String TOKEN = "123456:AbC-dEf/ghi";
    private static final Set<String> ALLOWED = new LinkedHashSet<>(List.of("message", "my_chat_member"));

    private HttpServer server;
    private ExecutorService serverExecutor;
    private TelegramBotApiClient client;

    private volatile int status = 200;
    private volatile String body = "{\"ok\":true,\"result\":[]}";
    private volatile CountDownLatch block;
    private final CountDownLatch requestEntered = new CountDownLatch(1);
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            requestEntered.countDown();
            CountDownLatch latch = block;
            if (latch != null) {
                try {
                    latch.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        client = TelegramBotApiClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
                .requestTimeoutMargin(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void stopServer() {
        CountDownLatch latch = block;
        if (latch != null) {
            latch.countDown();
        }
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    // ── Success ─────────────────────────────────────────────────────

    @Test
    void parsesUpdatesInOrderWithTypeAndPayload() throws Exception {
        body = "{\"ok\":true,\"result\":["
                + "{\"update_id\":41,\"message\":{\"message_id\":1,\"text\":\"hi\"}},"
                + "{\"update_id\":42,\"my_chat_member\":{\"chat\":{\"id\":-100,\"type\":\"channel\"}}}"
                + "]}";

        List<BotUpdate> updates = client.getUpdates(TOKEN, 41, Duration.ZERO, 100, ALLOWED);

        assertEquals(2, updates.size());
        assertEquals(41L, updates.get(0).updateId());
        assertEquals("message", updates.get(0).type());
        assertTrue(updates.get(0).payloadJson().contains("\"text\":\"hi\""));
        assertEquals(42L, updates.get(1).updateId());
        assertEquals("my_chat_member", updates.get(1).type());
    }

    @Test
    void emptyResultYieldsEmptyList() throws Exception {
        assertTrue(client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED).isEmpty());
    }

    @Test
    void skipsEntriesWithoutNumericUpdateId() throws Exception {
        body = "{\"ok\":true,\"result\":["
                + "{\"message\":{}},"
                + "{\"update_id\":\"seven\",\"message\":{}},"
                + "{\"update_id\":8,\"channel_post\":{}}"
                + "]}";

        List<BotUpdate> updates = client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED);

        assertEquals(1, updates.size());
        assertEquals(8L, updates.get(0).updateId());
        assertEquals("channel_post", updates.get(0).type());
    }

    @Test
    void sendsQueryParametersAndEncodedToken() throws Exception {
        client.getUpdates(TOKEN, 77, Duration.ofSeconds(3), 50, ALLOWED);

        assertEquals("/bot" + TOKEN + "/getUpdates", lastPath.get());
        Map<String, String> query = parseQuery(lastQuery.get());
        assertEquals("77", query.get("offset"));
        assertEquals("50", query.get("limit"));
        assertEquals("3", query.get("timeout"));
        assertEquals("[\"message\",\"my_chat_member\"]", query.get("allowed_updates"));
    }

    // ── Error mapping ───────────────────────────────────────────────

    @Test
    void conflictMapsToConflictException() {
        status = 409;
        body = "{\"ok\":false,\"error_code\":409,\"description\":\"Conflict: terminated by other getUpdates request\"}";

        assertThrows(UpstreamConflictException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
    }

    @Test
    void conflictWithoutJsonBodyStillMapsToConflict() {
        status = 409;
        body = "<html>conflict</html>";

        assertThrows(UpstreamConflictException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
    }

    @Test
    void rateLimitCarriesRetryAfter() {
        status = 429;
        body = "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 17\","
                + "\"parameters\":{\"retry_after\":17}}";

        UpstreamRateLimitedException e = assertThrows(UpstreamRateLimitedException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
        assertEquals(Duration.ofSeconds(17), e.retryAfter());
    }

    @Test
    void notOkResponseMapsToFailureWithErrorCode() {
        status = 401;
        body = "{\"ok\":false,\"error_code\":401,\"description\":\"Unauthorized\"}";

        UpstreamFailureException e = assertThrows(UpstreamFailureException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
        assertEquals(401, e.errorCode());
        assertTrue(e.getMessage().contains("Unauthorized"));
        assertFalse(e.getMessage().contains(TOKEN));
    }

    @Test
    void serverErrorMapsToFailure() {
        status = 500;
        body = "internal error";

        UpstreamFailureException e = assertThrows(UpstreamFailureException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
        assertEquals(500, e.errorCode());
    }

    @Test
    void malformedJsonMapsToFailure() {
        body = "{\"ok\":true,\"result\":[";

        assertThrows(UpstreamFailureException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
    }

    @Test
    void missingResultMapsToFailure() {
        body = "{\"ok\":true}";

        assertThrows(UpstreamFailureException.class,
                () -> client.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
    }

    // ── Timeouts and cancellation ───────────────────────────────────

    @Test
    void requestTimeoutMapsToFailure() {
        block = new CountDownLatch(1);
        TelegramBotApiClient impatient = TelegramBotApiClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort())
                .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
                .requestTimeoutMargin(Duration.ofMillis(200))
                .build();

        UpstreamFailureException e = assertThrows(UpstreamFailureException.class,
                () -> impatient.getUpdates(TOKEN, 0, Duration.ZERO, 100, ALLOWED));
        assertFalse(e.getMessage().contains(TOKEN));
    }

    @Test
    void interruptAbandonsBlockedCall() throws Exception {
        block = new CountDownLatch(1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                client.getUpdates(TOKEN, 0, Duration.ofSeconds(25), 100, ALLOWED);
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();

        assertTrue(requestEntered.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(2_000);

        assertFalse(caller.isAlive());
        assertInstanceOf(InterruptedException.class, thrown.get());
    }

    // ── Builder ─────────────────────────────────────────────────────

    @Test
    void builderRejectsNegativeMargin() {
        assertThrows(IllegalArgumentException.class, () ->
                TelegramBotApiClient.builder().requestTimeoutMargin(Duration.ofSeconds(-1)).build());
    }

    @Test
    void builderRejectsBlankBaseUrl() {
        assertThrows(IllegalArgumentException.class, () ->
                TelegramBotApiClient.builder().baseUrl(" / ").build());
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> result = new HashMap<>();
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            result.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return result;
    }
}

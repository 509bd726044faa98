package com.vidyarthi.node.transport;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidyarthi.node.safety.InputGuard;
import com.vidyarthi.node.safety.SecurityEventLog;
import com.vidyarthi.node.transport.GatewayException.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecureGatewayTest {

    private static final String CHAT_URL = "https://openrouter.ai/api/v1/chat/completions";

    private ScriptedTransport transport;
    private SecurityEventLog events;
    private SecureGateway gateway;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        events = new SecurityEventLog();
        gateway = newGateway(GatewayConfig.defaults().withRetryDelay(Duration.ZERO));
    }

    private SecureGateway newGateway(GatewayConfig config) {
        return new SecureGateway(transport, new InputGuard(events), events, config);
    }

    // ==================== Allowlist ====================

    @Test
    void isAllowed_acceptsListedHosts() {
        assertThat(gateway.isAllowed("https://openrouter.ai/x")).isTrue();
        assertThat(gateway.isAllowed("https://generativelanguage.googleapis.com/v1beta/models")).isTrue();
        assertThat(gateway.isAllowed("http://localhost:8000/health")).isTrue();
        assertThat(gateway.isAllowed("http://192.168.1.20:8000/sync")).isTrue();
        assertThat(gateway.isAllowed("https://my-app.firebaseapp.com")).isTrue();
    }

    @Test
    void isAllowed_refusesUnlistedHostsAndRecordsEvent() {
        assertThat(gateway.isAllowed("https://evil.example.com")).isFalse();

        List<SecurityEventLog.SecurityEvent> blocked = events.recent("Blocked unauthorized domain");
        assertThat(blocked).hasSize(1);
        assertThat(blocked.get(0).details()).containsEntry("host", "evil.example.com");
    }

    @Test
    void isAllowed_refusesNonHttpSchemesEvenInDevelopmentMode() {
        SecureGateway development = newGateway(GatewayConfig.defaults().withDevelopmentMode(true));

        assertThat(gateway.isAllowed("javascript:alert(1)")).isFalse();
        assertThat(development.isAllowed("javascript:alert(1)")).isFalse();
        assertThat(development.isAllowed("ftp://files.example.com")).isFalse();
        assertThat(events.recent("Blocked non-HTTP scheme")).isNotEmpty();
    }

    @Test
    void isAllowed_developmentModeAcceptsAnyHttpHost() {
        SecureGateway development = newGateway(GatewayConfig.defaults().withDevelopmentMode(true));

        assertThat(development.isAllowed("https://evil.example.com")).isTrue();
    }

    @Test
    void isAllowed_rejectsMalformedInput() {
        assertThat(gateway.isAllowed(null)).isFalse();
        assertThat(gateway.isAllowed("")).isFalse();
        assertThat(gateway.isAllowed("http://bad host/")).isFalse();
        assertThat(gateway.isAllowed("https:///no-host")).isFalse();
    }

    @Test
    void isAllowed_matchesHostSubstrings() {
        // substring matching is permissive: any host containing a listed fragment passes
        assertThat(gateway.isAllowed("https://openrouter.ai.attacker.net")).isTrue();
    }

    @Test
    void disallowedUrl_isNeverSent() {
        assertThatThrownBy(() -> gateway.get("https://evil.example.com/data", Map.of()))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).reason()).isEqualTo(Reason.DISALLOWED_URL));

        assertThat(transport.requests()).isEmpty();
    }

    // ==================== Headers ====================

    @Test
    void post_sendsDefaultHeaders() throws Exception {
        gateway.post(CHAT_URL, Map.of(), Map.of("prompt", "Explain fractions"));

        Map<String, String> headers = transport.lastRequest().headers();
        assertThat(headers)
                .containsEntry("Content-Type", "application/json")
                .containsEntry("Accept", "application/json")
                .containsEntry("User-Agent", "VidyarthiApp/1.0");
    }

    @Test
    void get_hasNoContentType() throws Exception {
        gateway.get("https://openrouter.ai/api/v1/models", null);

        assertThat(transport.lastRequest().headers()).doesNotContainKey("Content-Type");
        assertThat(transport.lastRequest().method()).isEqualTo("GET");
        assertThat(transport.lastRequest().body()).isNull();
    }

    @Test
    void callerHeaders_winCaseInsensitively() {
        Map<String, String> merged = gateway.mergeHeaders("POST", Map.of(
                "accept", "text/plain",
                "Authorization", "Bearer token"
        ));

        assertThat(merged)
                .containsEntry("accept", "text/plain")
                .containsEntry("Authorization", "Bearer token")
                .containsEntry("Content-Type", "application/json")
                .doesNotContainKey("Accept")
                .hasSize(4);
    }

    // ==================== Body Sanitization ====================

    @Test
    void post_dropsInjectedFieldsAndSanitizesTheRest() throws Exception {
        // Given
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("question", "What is <b>gravity</b>?");
        body.put("student", "x' OR '1'='1");
        body.put("grade", 7);

        // When
        gateway.post(CHAT_URL, Map.of(), body);

        // Then
        Map<String, Object> sent = new ObjectMapper().readValue(transport.lastRequest().body(), new TypeReference<>() {});
        assertThat(sent).containsOnlyKeys("question", "grade");
        assertThat(sent.get("question")).isEqualTo("What is &lt;b&gt;gravity&lt;/b&gt;?");
        assertThat(sent.get("grade")).isEqualTo(7);
        assertThat(events.recent("SQL injection attempt blocked"))
                .singleElement()
                .satisfies(e -> assertThat(e.details()).containsEntry("field", "student"));
    }

    @Test
    void post_canSkipSanitization() throws Exception {
        gateway.post(CHAT_URL, Map.of(), Map.of("html", "<b>bold</b>"), Duration.ofSeconds(5), false);

        assertThat(transport.lastRequest().body()).isEqualTo("{\"html\":\"<b>bold</b>\"}");
        assertThat(transport.lastRequest().timeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void post_withoutBodySendsNothing() throws Exception {
        gateway.post(CHAT_URL, null, null);

        assertThat(transport.lastRequest().body()).isNull();
    }

    // ==================== Retries ====================

    @Test
    void transientFailures_areRetried() throws Exception {
        transport.fail(new ConnectException("Connection refused"))
                .fail(new UnknownHostException("openrouter.ai"))
                .fail(new HttpConnectTimeoutException("connect timed out"))
                .respond(200, "{\"ok\":true}");

        GatewayResponse response = gateway.get(CHAT_URL, Map.of());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(transport.requests()).hasSize(4);
    }

    @Test
    void retries_areBounded() {
        for (int i = 0; i < 5; i++) {
            transport.fail(new SocketException("Network is unreachable"));
        }

        assertThatThrownBy(() -> gateway.post(CHAT_URL, Map.of(), Map.of("q", "hi")))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).reason()).isEqualTo(Reason.NETWORK));

        assertThat(transport.requests()).hasSize(4);
        assertThat(events.recent("Network error after retries")).hasSize(1);
    }

    @Test
    void requestTimeout_isNotRetried() {
        transport.fail(new HttpTimeoutException("request timed out"));

        assertThatThrownBy(() -> gateway.get(CHAT_URL, Map.of()))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).reason()).isEqualTo(Reason.TIMEOUT));

        assertThat(transport.requests()).hasSize(1);
    }

    @Test
    void otherIoFailures_areNotRetried() {
        transport.fail(new IOException("stream closed"));

        assertThatThrownBy(() -> gateway.get(CHAT_URL, Map.of()))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).reason()).isEqualTo(Reason.CLIENT));

        assertThat(transport.requests()).hasSize(1);
    }

    // ==================== Responses ====================

    @Test
    void errorResponses_areLoggedWithPreviewButReturned() throws Exception {
        transport.respond(503, "x".repeat(500));

        GatewayResponse response = gateway.get(CHAT_URL, Map.of());

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(events.recent("HTTP error response"))
                .singleElement()
                .satisfies(e -> assertThat(e.details().get("body_preview")).hasSize(100));
    }

    @Test
    void largeResponses_areLogged() {
        gateway.validateResponse(new GatewayResponse(200, "a".repeat(SecureGateway.LARGE_RESPONSE_BYTES + 1)));

        assertThat(events.recent("Unusually large response")).hasSize(1);
    }

    @Test
    void largeResponses_areMeasuredInUtf8Bytes() {
        // Given a Devanagari body: 3 bytes per character, fewer characters than the limit
        int characters = SecureGateway.LARGE_RESPONSE_BYTES / 3 + 1;
        String body = "\u0905".repeat(characters);

        // When
        gateway.validateResponse(new GatewayResponse(200, body));
        gateway.validateResponse(new GatewayResponse(200, "a".repeat(SecureGateway.LARGE_RESPONSE_BYTES)));

        // Then
        assertThat(events.recent("Unusually large response"))
                .singleElement()
                .satisfies(e -> assertThat(e.details()).containsEntry("size_bytes", String.valueOf(characters * 3)));
    }

    @Test
    void parseJson_returnsObject() throws Exception {
        Map<String, Object> parsed = gateway.parseJson(new GatewayResponse(200, "{\"answer\":\"42\",\"tokens\":12}"));

        assertThat(parsed).containsEntry("answer", "42").containsEntry("tokens", 12);
    }

    @Test
    void parseJson_rejectsNonObjects() {
        assertThatThrownBy(() -> gateway.parseJson(new GatewayResponse(200, "[1,2,3]")))
                .isInstanceOf(GatewayException.class)
                .satisfies(e -> assertThat(((GatewayException) e).reason()).isEqualTo(Reason.MALFORMED_RESPONSE));
        assertThatThrownBy(() -> gateway.parseJson(new GatewayResponse(200, "<html>")))
                .isInstanceOf(GatewayException.class);
        assertThatThrownBy(() -> gateway.parseJson(new GatewayResponse(200, "")))
                .isInstanceOf(GatewayException.class);
        assertThat(events.recent("JSON parse error")).hasSize(3);
    }
}

package com.codeheadsystems.delegate.springboot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.delegate.client.accessor.SessionKeyAccessor;
import com.codeheadsystems.delegate.client.exceptions.SessionKeyAccessorException;
import com.codeheadsystems.delegate.client.model.ServerConnectionInfo;
import com.codeheadsystems.delegate.model.DecisionResponse;
import com.codeheadsystems.delegate.model.ExtendExpiryRequest;
import com.codeheadsystems.delegate.model.GrantRequest;
import com.codeheadsystems.delegate.model.OperationRequest;
import com.codeheadsystems.delegate.model.SessionKeyResponse;
import com.codeheadsystems.delegate.model.UpdateLimitsRequest;
import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SessionKeyIntegrationTest {

  private static final String OWNER = "0xaaaa000000000000000000000000000000000001";
  private static final String TARGET = "0xcccc000000000000000000000000000000000003";

  @LocalServerPort
  private int port;

  @Autowired
  private OwnerTokenManager tokenManager;

  private HttpClient httpClient;
  private SessionKeyAccessor accessor;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    accessor = accessorFor(OWNER);
  }

  private SessionKeyAccessor accessorFor(String accountId) {
    return new SessionKeyAccessor(httpClient, new ObjectMapper(),
        new ServerConnectionInfo(URI.create(baseUrl()), tokenManager.issueToken(accountId)));
  }

  private static GrantRequest grant(String keyId, String spendingLimit, String dailyLimit) {
    long expiry = Instant.now().plusSeconds(86_400).getEpochSecond();
    return new GrantRequest(keyId, spendingLimit, dailyLimit, expiry, List.of(TARGET));
  }

  @Test
  void perTransactionLimitDeniesWithLimitAndAttempted() {
    String keyId = "0xbbbb000000000000000000000000000000000301";
    accessor.grant(OWNER, grant(keyId, "100", "1000"));

    DecisionResponse decision = accessor.authorize(OWNER, keyId, new OperationRequest(TARGET, "101"));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("SPENDING_LIMIT_EXCEEDED");
    assertThat(decision.limit()).isEqualTo("100");
    assertThat(decision.attempted()).isEqualTo("101");
    assertThat(accessor.getUsage(OWNER, keyId).usedToday()).isEqualTo("0");
  }

  @Test
  void validityCheckDoesNotBookUsage() {
    String keyId = "0xbbbb000000000000000000000000000000000302";
    accessor.grant(OWNER, grant(keyId, "100", "1000"));

    DecisionResponse decision = accessor.checkValidity(OWNER, keyId, new OperationRequest(TARGET, "60"));

    assertThat(decision.allowed()).isTrue();
    assertThat(decision.reason()).isNull();
    assertThat(accessor.getUsage(OWNER, keyId).usedToday()).isEqualTo("0");
  }

  @Test
  void updateLimitsAndExtendExpiry() {
    String keyId = "0xbbbb000000000000000000000000000000000303";
    SessionKeyResponse granted = accessor.grant(OWNER, grant(keyId, "100", "1000"));
    long later = granted.expiryTime() + 3600;

    SessionKeyResponse updated = accessor.updateLimits(OWNER, keyId, new UpdateLimitsRequest("500", "5000"));
    SessionKeyResponse extended = accessor.extendExpiry(OWNER, keyId, new ExtendExpiryRequest(later));

    assertThat(updated.spendingLimit()).isEqualTo("500");
    assertThat(updated.dailyLimit()).isEqualTo("5000");
    assertThat(extended.expiryTime()).isEqualTo(later);
    assertThat(accessor.get(OWNER, keyId).expiryTime()).isEqualTo(later);
  }

  @Test
  void shorteningExpiryIsRejected() {
    String keyId = "0xbbbb000000000000000000000000000000000304";
    SessionKeyResponse granted = accessor.grant(OWNER, grant(keyId, "100", "1000"));

    assertThatThrownBy(() -> accessor.extendExpiry(OWNER, keyId,
        new ExtendExpiryRequest(granted.expiryTime() - 60)))
        .isInstanceOfSatisfying(SessionKeyAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(400);
          assertThat(e.errorCode()).isEqualTo("INVALID_EXPIRY");
        });
  }

  @Test
  void revokeThenRevokeAgainIsHarmless() {
    String keyId = "0xbbbb000000000000000000000000000000000305";
    accessor.grant(OWNER, grant(keyId, "100", "1000"));

    assertThat(accessor.revoke(OWNER, keyId).revoked()).isTrue();
    assertThat(accessor.revoke(OWNER, keyId).revoked()).isFalse();
    assertThat(accessor.listActive(OWNER).keyIds()).doesNotContain(keyId);
  }

  @Test
  void malformedAmountIsBadRequest() {
    assertThatThrownBy(() -> accessor.grant(OWNER,
        grant("0xbbbb000000000000000000000000000000000306", "-5", "1000")))
        .isInstanceOfSatisfying(SessionKeyAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(400);
          assertThat(e.errorCode()).isEqualTo("BAD_REQUEST");
        });
  }

  @Test
  void unrepresentableExpiryIsBadRequest() {
    GrantRequest request = new GrantRequest("0xbbbb000000000000000000000000000000000307", "100", "1000",
        Long.MAX_VALUE, List.of(TARGET));

    assertThatThrownBy(() -> accessor.grant(OWNER, request))
        .isInstanceOfSatisfying(SessionKeyAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(400);
          assertThat(e.errorCode()).isEqualTo("BAD_REQUEST");
        });
  }

  @Test
  void unknownKeyIsNotFound() {
    assertThatThrownBy(() -> accessor.get(OWNER, "0xbbbb00000000000000000000000000000000ffff"))
        .isInstanceOfSatisfying(SessionKeyAccessorException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(404);
          assertThat(e.errorCode()).isEqualTo("NOT_FOUND");
        });
  }

  @Test
  void otherAccountsOwnerIsForbidden() {
    SessionKeyAccessor intruder = accessorFor("0xeeee000000000000000000000000000000000009");

    assertThatThrownBy(() -> intruder.emergencyRevokeAll(OWNER))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("403");
  }

  @Test
  void noToken_returns401() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/accounts/" + OWNER + "/session-keys"))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("\"UNAUTHORIZED\"");
  }

  @Test
  void foreignAccountPath_isRejectedWithErrorBody() throws Exception {
    String intruderToken = tokenManager.issueToken("0xeeee000000000000000000000000000000000009");
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/accounts/" + OWNER + "/session-keys"))
        .header("Authorization", "Bearer " + intruderToken)
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(403);
    assertThat(response.body()).contains("\"FORBIDDEN\"");
  }

  @Test
  void bogusToken_returns401() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/accounts/" + OWNER + "/session-keys"))
        .header("Authorization", "Bearer not-a-real-token")
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void healthEndpointIsPublicAndReportsTheStore() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/actuator/health"))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"UP\"").contains("sessionKeyStore");
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", port);
  }
}

package com.codeheadsystems.delegate.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.delegate.client.exceptions.SessionKeyAccessorException;
import com.codeheadsystems.delegate.client.model.ServerConnectionInfo;
import com.codeheadsystems.delegate.model.DecisionResponse;
import com.codeheadsystems.delegate.model.GrantRequest;
import com.codeheadsystems.delegate.model.OperationRequest;
import com.codeheadsystems.delegate.model.SessionKeyResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionKeyAccessorTest {

  private static final String ACCOUNT = "0xaaaa";
  private static final String KEY = "0xbbbb";

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private SessionKeyAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new SessionKeyAccessor(httpClient, new ObjectMapper(),
        new ServerConnectionInfo(URI.create("http://localhost:8080/"), "token-123"));
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private void respond(int status, String body) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
  }

  private HttpRequest sentRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    return captor.getValue();
  }

  @Test
  void grant_postsToAccountPath_withBearerToken() throws Exception {
    respond(201, "{\"accountId\":\"0xaaaa\",\"keyId\":\"0xbbbb\",\"spendingLimit\":\"1\",\"dailyLimit\":\"2\","
        + "\"usedToday\":\"0\",\"lastUsedDay\":19792,\"expiryTime\":1900000000,\"allowedTargets\":[],\"active\":true}");

    SessionKeyResponse key = accessor.grant(ACCOUNT, new GrantRequest(KEY, "1", "2", 1_900_000_000L, List.of()));

    assertThat(key.keyId()).isEqualTo(KEY);
    HttpRequest request = sentRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri()).isEqualTo(URI.create("http://localhost:8080/accounts/0xaaaa/session-keys"));
    assertThat(request.headers().firstValue("Authorization")).contains("Bearer token-123");
  }

  @Test
  void authorize_denialIsReturnedNotThrown() throws Exception {
    respond(200, "{\"allowed\":false,\"reason\":\"DAILY_LIMIT_EXCEEDED\",\"message\":\"Exceeds daily limit\","
        + "\"limit\":\"10\",\"attempted\":\"11\"}");

    DecisionResponse decision = accessor.authorize(ACCOUNT, KEY, new OperationRequest("0xcc", "1"));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo("DAILY_LIMIT_EXCEEDED");
    assertThat(sentRequest().uri().getPath()).isEqualTo("/accounts/0xaaaa/session-keys/0xbbbb/authorizations");
  }

  @Test
  void listAll_usesQueryFlag() throws Exception {
    respond(200, "{\"accountId\":\"0xaaaa\",\"sessionKeys\":[]}");

    assertThat(accessor.listAll(ACCOUNT).sessionKeys()).isEmpty();
    assertThat(sentRequest().uri().getQuery()).isEqualTo("all=true");
  }

  @Test
  void errorStatus_carriesServerErrorCode() throws Exception {
    respond(404, "{\"error\":\"NOT_FOUND\",\"message\":\"Session key not found\"}");

    assertThatThrownBy(() -> accessor.get(ACCOUNT, KEY))
        .isInstanceOf(SessionKeyAccessorException.class)
        .satisfies(e -> {
          SessionKeyAccessorException ex = (SessionKeyAccessorException) e;
          assertThat(ex.statusCode()).isEqualTo(404);
          assertThat(ex.errorCode()).isEqualTo("NOT_FOUND");
        });
  }

  @Test
  void errorStatus_withUnstructuredBody_hasNoErrorCode() throws Exception {
    respond(500, "<html>oops</html>");

    assertThatThrownBy(() -> accessor.getUsage(ACCOUNT, KEY))
        .isInstanceOf(SessionKeyAccessorException.class)
        .satisfies(e -> assertThat(((SessionKeyAccessorException) e).errorCode()).isNull());
  }

  @Test
  void unauthorizedAndForbidden_areSecurityExceptions() throws Exception {
    when(response.statusCode()).thenReturn(401, 403);
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> accessor.listActive(ACCOUNT)).isInstanceOf(SecurityException.class);
    assertThatThrownBy(() -> accessor.emergencyRevokeAll(ACCOUNT)).isInstanceOf(SecurityException.class);
  }

  @Test
  void ioFailure_isWrapped() throws Exception {
    doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> accessor.revoke(ACCOUNT, KEY))
        .isInstanceOf(SessionKeyAccessorException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void interrupt_isWrappedAndFlagRestored() throws Exception {
    doThrow(new InterruptedException()).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> accessor.get(ACCOUNT, KEY)).isInstanceOf(SessionKeyAccessorException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }
}

package com.codeheadsystems.delegate.client.accessor;

import com.codeheadsystems.delegate.client.exceptions.SessionKeyAccessorException;
import com.codeheadsystems.delegate.client.model.ServerConnectionInfo;
import com.codeheadsystems.delegate.model.ActiveKeysResponse;
import com.codeheadsystems.delegate.model.DecisionResponse;
import com.codeheadsystems.delegate.model.EmergencyRevokeResponse;
import com.codeheadsystems.delegate.model.ErrorResponse;
import com.codeheadsystems.delegate.model.ExtendExpiryRequest;
import com.codeheadsystems.delegate.model.GrantRequest;
import com.codeheadsystems.delegate.model.OperationRequest;
import com.codeheadsystems.delegate.model.RevokeResponse;
import com.codeheadsystems.delegate.model.SessionKeyListResponse;
import com.codeheadsystems.delegate.model.SessionKeyResponse;
import com.codeheadsystems.delegate.model.UpdateLimitsRequest;
import com.codeheadsystems.delegate.model.UsageResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the session key endpoints under {@code /accounts/{accountId}/session-keys}.
 * <p>
 * Every call carries the owner's bearer token from {@link ServerConnectionInfo}.  A 401 or 403
 * response is surfaced as a {@link SecurityException}; any other error status, I/O failure or
 * interruption as a {@link SessionKeyAccessorException}.  Policy denials are not errors: they
 * come back as a {@link DecisionResponse} with {@code allowed == false}.
 */
@Singleton
public class SessionKeyAccessor {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;

  /**
   * Instantiates a new Session key accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the server and the owner token to use
   */
  @Inject
  public SessionKeyAccessor(final HttpClient httpClient,
                            final ObjectMapper objectMapper,
                            final ServerConnectionInfo connectionInfo) {
    log.info("SessionKeyAccessor({})", connectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  // ── Lifecycle ──────────────────────────────────────────────────────────────

  public SessionKeyResponse grant(final String accountId, final GrantRequest request) {
    log.debug("grant(accountId={}, keyId={})", accountId, request.keyId());
    return send("POST", path(accountId), request, SessionKeyResponse.class);
  }

  public RevokeResponse revoke(final String accountId, final String keyId) {
    log.debug("revoke(accountId={}, keyId={})", accountId, keyId);
    return send("DELETE", path(accountId, keyId), null, RevokeResponse.class);
  }

  public SessionKeyResponse updateLimits(final String accountId, final String keyId,
                                         final UpdateLimitsRequest request) {
    log.debug("updateLimits(accountId={}, keyId={})", accountId, keyId);
    return send("PUT", path(accountId, keyId) + "/limits", request, SessionKeyResponse.class);
  }

  public SessionKeyResponse extendExpiry(final String accountId, final String keyId,
                                         final ExtendExpiryRequest request) {
    log.debug("extendExpiry(accountId={}, keyId={})", accountId, keyId);
    return send("PUT", path(accountId, keyId) + "/expiry", request, SessionKeyResponse.class);
  }

  /**
   * Revokes every active key of the account.
   *
   * @param accountId the account
   * @return the number of keys revoked
   */
  public EmergencyRevokeResponse emergencyRevokeAll(final String accountId) {
    log.debug("emergencyRevokeAll(accountId={})", accountId);
    return send("POST", path(accountId) + "/emergency-revoke", null, EmergencyRevokeResponse.class);
  }

  // ── Queries ────────────────────────────────────────────────────────────────

  public SessionKeyResponse get(final String accountId, final String keyId) {
    log.debug("get(accountId={}, keyId={})", accountId, keyId);
    return send("GET", path(accountId, keyId), null, SessionKeyResponse.class);
  }

  public ActiveKeysResponse listActive(final String accountId) {
    log.debug("listActive(accountId={})", accountId);
    return send("GET", path(accountId), null, ActiveKeysResponse.class);
  }

  public SessionKeyListResponse listAll(final String accountId) {
    log.debug("listAll(accountId={})", accountId);
    return send("GET", path(accountId) + "?all=true", null, SessionKeyListResponse.class);
  }

  public UsageResponse getUsage(final String accountId, final String keyId) {
    log.debug("getUsage(accountId={}, keyId={})", accountId, keyId);
    return send("GET", path(accountId, keyId) + "/usage", null, UsageResponse.class);
  }

  // ── Policy ─────────────────────────────────────────────────────────────────

  /**
   * Dry-run policy check; nothing is recorded.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param request   target and value
   * @return the decision
   */
  public DecisionResponse checkValidity(final String accountId, final String keyId,
                                        final OperationRequest request) {
    log.debug("checkValidity(accountId={}, keyId={})", accountId, keyId);
    return send("POST", path(accountId, keyId) + "/validity", request, DecisionResponse.class);
  }

  /**
   * Policy check that books the value against the day's budget when allowed.
   *
   * @param accountId the account
   * @param keyId     the key
   * @param request   target and value
   * @return the decision
   */
  public DecisionResponse authorize(final String accountId, final String keyId,
                                    final OperationRequest request) {
    log.debug("authorize(accountId={}, keyId={})", accountId, keyId);
    return send("POST", path(accountId, keyId) + "/authorizations", request, DecisionResponse.class);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private String path(String accountId) {
    return "/accounts/" + encode(accountId) + "/session-keys";
  }

  private String path(String accountId, String keyId) {
    return path(accountId) + "/" + encode(keyId);
  }

  private static String encode(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8);
  }

  private <T> T send(String method, String path, Object body, Class<T> responseType) {
    URI base = connectionInfo.endpoint();
    URI uri = URI.create(base.toString().replaceAll("/+$", "") + path);
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .header("Accept", "application/json");
      if (body == null) {
        builder.method(method, HttpRequest.BodyPublishers.noBody());
      } else {
        builder.header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      }
      if (connectionInfo.bearerToken() != null) {
        builder.header("Authorization", "Bearer " + connectionInfo.bearerToken());
      }
      HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      checkStatus(method, uri, response);
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new SessionKeyAccessorException("HTTP request failed: " + method + " " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SessionKeyAccessorException("HTTP request interrupted: " + method + " " + uri, e);
    }
  }

  private void checkStatus(String method, URI uri, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode == 401 || statusCode == 403) {
      throw new SecurityException("Server rejected request (" + statusCode + "): " + method + " " + uri);
    }
    if (statusCode >= 400) {
      ErrorResponse error = parseError(response.body());
      String detail = error == null ? "" : ": " + error.error() + " " + error.message();
      throw new SessionKeyAccessorException("Server returned HTTP " + statusCode + detail, null,
          statusCode, error == null ? null : error.error());
    }
  }

  private ErrorResponse parseError(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ErrorResponse.class);
    } catch (JsonProcessingException e) {
      log.debug("Error body is not an ErrorResponse: {}", e.getOriginalMessage());
      return null;
    }
  }
}

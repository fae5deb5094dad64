package com.codeheadsystems.delegate.springboot.controller;

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
import com.codeheadsystems.delegate.server.manager.SessionKeyManager;
import com.codeheadsystems.delegate.server.model.Identities;
import com.codeheadsystems.delegate.server.model.SessionKey;
import com.codeheadsystems.delegate.server.model.SessionKeyResult;
import com.codeheadsystems.delegate.server.resource.WireMapper;
import com.codeheadsystems.delegate.springboot.security.DelegatePrincipal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Spring MVC counterpart of the JAX-RS session key resource: same routes, bodies and status codes.
 * Lifecycle errors and malformed input come back as an {@link ErrorResponse}.
 */
@RestController
@RequestMapping("/accounts/{accountId}/session-keys")
public class SessionKeyController {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyController.class);

  private final SessionKeyManager manager;

  public SessionKeyController(SessionKeyManager manager) {
    this.manager = manager;
  }

  @PostMapping
  public ResponseEntity<SessionKeyResponse> grant(@AuthenticationPrincipal DelegatePrincipal principal,
                                                  @PathVariable("accountId") String accountId,
                                                  @RequestBody GrantRequest req) {
    log.debug("grant()");
    requireOwner(principal, accountId);
    SessionKeyResult<SessionKey> result = manager.grant(accountId,
        WireMapper.requireText(req.keyId(), "keyId"),
        WireMapper.parseAmount(req.spendingLimit(), "spendingLimit"),
        WireMapper.parseAmount(req.dailyLimit(), "dailyLimit"),
        WireMapper.parseInstant(req.expiryTime(), "expiryTime"),
        req.allowedTargets());
    return ResponseEntity.status(HttpStatus.CREATED).body(WireMapper.toResponse(unwrap(result)));
  }

  @GetMapping
  public ResponseEntity<?> list(@AuthenticationPrincipal DelegatePrincipal principal,
                                @PathVariable("accountId") String accountId,
                                @RequestParam(name = "all", defaultValue = "false") boolean all) {
    log.debug("list(all={})", all);
    String account = requireOwner(principal, accountId);
    if (all) {
      List<SessionKeyResponse> keys = manager.listAll(account).stream().map(WireMapper::toResponse).toList();
      return ResponseEntity.ok(new SessionKeyListResponse(account, keys));
    }
    return ResponseEntity.ok(new ActiveKeysResponse(account, List.copyOf(manager.listActive(account))));
  }

  @PostMapping("/emergency-revoke")
  public EmergencyRevokeResponse emergencyRevokeAll(@AuthenticationPrincipal DelegatePrincipal principal,
                                                    @PathVariable("accountId") String accountId) {
    log.debug("emergencyRevokeAll()");
    String account = requireOwner(principal, accountId);
    return new EmergencyRevokeResponse(account, unwrap(manager.emergencyRevokeAll(account)));
  }

  @GetMapping("/{keyId}")
  public SessionKeyResponse get(@AuthenticationPrincipal DelegatePrincipal principal,
                                @PathVariable("accountId") String accountId,
                                @PathVariable("keyId") String keyId) {
    log.debug("get()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(unwrap(manager.get(accountId, keyId)));
  }

  @DeleteMapping("/{keyId}")
  public RevokeResponse revoke(@AuthenticationPrincipal DelegatePrincipal principal,
                               @PathVariable("accountId") String accountId,
                               @PathVariable("keyId") String keyId) {
    log.debug("revoke()");
    requireOwner(principal, accountId);
    return new RevokeResponse(Identities.normalize(keyId), unwrap(manager.revoke(accountId, keyId)));
  }

  @PutMapping("/{keyId}/limits")
  public SessionKeyResponse updateLimits(@AuthenticationPrincipal DelegatePrincipal principal,
                                         @PathVariable("accountId") String accountId,
                                         @PathVariable("keyId") String keyId,
                                         @RequestBody UpdateLimitsRequest req) {
    log.debug("updateLimits()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(unwrap(manager.updateLimits(accountId, keyId,
        WireMapper.parseAmount(req.spendingLimit(), "spendingLimit"),
        WireMapper.parseAmount(req.dailyLimit(), "dailyLimit"))));
  }

  @PutMapping("/{keyId}/expiry")
  public SessionKeyResponse extendExpiry(@AuthenticationPrincipal DelegatePrincipal principal,
                                         @PathVariable("accountId") String accountId,
                                         @PathVariable("keyId") String keyId,
                                         @RequestBody ExtendExpiryRequest req) {
    log.debug("extendExpiry()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(unwrap(manager.extendExpiry(accountId, keyId,
        WireMapper.parseInstant(req.expiryTime(), "expiryTime"))));
  }

  @GetMapping("/{keyId}/usage")
  public UsageResponse usage(@AuthenticationPrincipal DelegatePrincipal principal,
                             @PathVariable("accountId") String accountId,
                             @PathVariable("keyId") String keyId) {
    log.debug("usage()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(unwrap(manager.getUsage(accountId, keyId)));
  }

  @PostMapping("/{keyId}/validity")
  public DecisionResponse checkValidity(@AuthenticationPrincipal DelegatePrincipal principal,
                                        @PathVariable("accountId") String accountId,
                                        @PathVariable("keyId") String keyId,
                                        @RequestBody OperationRequest req) {
    log.debug("checkValidity()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(manager.checkValidity(accountId, keyId,
        WireMapper.requireText(req.target(), "target"),
        WireMapper.parseAmount(req.value(), "value")));
  }

  @PostMapping("/{keyId}/authorizations")
  public DecisionResponse authorize(@AuthenticationPrincipal DelegatePrincipal principal,
                                    @PathVariable("accountId") String accountId,
                                    @PathVariable("keyId") String keyId,
                                    @RequestBody OperationRequest req) {
    log.debug("authorize()");
    requireOwner(principal, accountId);
    return WireMapper.toResponse(manager.authorize(accountId, keyId,
        WireMapper.requireText(req.target(), "target"),
        WireMapper.parseAmount(req.value(), "value")));
  }

  // ── Error mapping ─────────────────────────────────────────────────────────

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ErrorResponse> handleApiException(ApiException e) {
    return ResponseEntity.status(e.status).body(new ErrorResponse(e.error, e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e) {
    log.debug("Rejected input: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
    log.debug("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", "Request body is missing or malformed"));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private static String requireOwner(DelegatePrincipal principal, String accountId) {
    if (principal == null) {
      throw new ApiException(HttpStatus.UNAUTHORIZED.value(), "UNAUTHORIZED", "Authentication required");
    }
    String account = Identities.normalize(accountId);
    if (!principal.getName().equals(account)) {
      log.warn("Principal {} denied access to account {}", principal.getName(), account);
      throw new ApiException(HttpStatus.FORBIDDEN.value(), "FORBIDDEN", "Not the owner of this account");
    }
    return account;
  }

  private static <T> T unwrap(SessionKeyResult<T> result) {
    if (result.isSuccess()) {
      return result.value();
    }
    ErrorResponse body = WireMapper.toError(result);
    throw new ApiException(WireMapper.httpStatus(result.error().orElseThrow()), body.error(), body.message());
  }

  static class ApiException extends RuntimeException {

    private final int status;
    private final String error;

    ApiException(int status, String error, String message) {
      super(message);
      this.status = status;
      this.error = error;
    }
  }
}

package com.codeheadsystems.delegate.server.resource;

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
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.math.BigInteger;
import java.security.Principal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the session key engine for one account.
 * <p>
 * Endpoints, all under {@code /accounts/{accountId}/session-keys}:
 * <ul>
 *   <li>{@code POST   /}                        grant (201)</li>
 *   <li>{@code GET    /}                        active key ids, or every record with {@code ?all=true}</li>
 *   <li>{@code POST   /emergency-revoke}        revoke every active key</li>
 *   <li>{@code GET    /{keyId}}                 one record</li>
 *   <li>{@code DELETE /{keyId}}                 revoke</li>
 *   <li>{@code PUT    /{keyId}/limits}          replace limits</li>
 *   <li>{@code PUT    /{keyId}/expiry}          extend expiry</li>
 *   <li>{@code GET    /{keyId}/usage}           usage statistics</li>
 *   <li>{@code POST   /{keyId}/validity}        dry-run policy check</li>
 *   <li>{@code POST   /{keyId}/authorizations}  policy check that books usage</li>
 * </ul>
 * <p>
 * The caller must be authenticated as the owner of {@code accountId}: no principal gives 401,
 * a principal for another account gives 403. Lifecycle errors come back as an
 * {@link ErrorResponse}; policy denials are a normal 200 {@link DecisionResponse}.
 */
@Path("/accounts/{accountId}/session-keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@PermitAll
public class SessionKeyResource {

  private static final Logger log = LoggerFactory.getLogger(SessionKeyResource.class);

  private final SessionKeyManager manager;

  public SessionKeyResource(SessionKeyManager manager) {
    this.manager = manager;
  }

  @POST
  public Response grant(@Context SecurityContext securityContext,
                        @PathParam("accountId") String accountId,
                        GrantRequest req) {
    log.debug("grant()");
    requireOwner(securityContext, accountId);
    requireBody(req);
    SessionKeyResult<SessionKey> result = parsing(() -> manager.grant(accountId,
        WireMapper.requireText(req.keyId(), "keyId"),
        WireMapper.parseAmount(req.spendingLimit(), "spendingLimit"),
        WireMapper.parseAmount(req.dailyLimit(), "dailyLimit"),
        WireMapper.parseInstant(req.expiryTime(), "expiryTime"),
        req.allowedTargets()));
    return Response.status(Response.Status.CREATED)
        .entity(WireMapper.toResponse(unwrap(result)))
        .build();
  }

  @GET
  public Response list(@Context SecurityContext securityContext,
                       @PathParam("accountId") String accountId,
                       @QueryParam("all") boolean all) {
    log.debug("list(all={})", all);
    String account = requireOwner(securityContext, accountId);
    if (all) {
      List<SessionKeyResponse> keys = new ArrayList<>();
      manager.listAll(account).forEach(key -> keys.add(WireMapper.toResponse(key)));
      return Response.ok(new SessionKeyListResponse(account, keys)).build();
    }
    return Response.ok(new ActiveKeysResponse(account, List.copyOf(manager.listActive(account)))).build();
  }

  @POST
  @Path("/emergency-revoke")
  public EmergencyRevokeResponse emergencyRevokeAll(@Context SecurityContext securityContext,
                                                    @PathParam("accountId") String accountId) {
    log.debug("emergencyRevokeAll()");
    String account = requireOwner(securityContext, accountId);
    return new EmergencyRevokeResponse(account, unwrap(manager.emergencyRevokeAll(account)));
  }

  @GET
  @Path("/{keyId}")
  public SessionKeyResponse get(@Context SecurityContext securityContext,
                                @PathParam("accountId") String accountId,
                                @PathParam("keyId") String keyId) {
    log.debug("get()");
    requireOwner(securityContext, accountId);
    return WireMapper.toResponse(unwrap(manager.get(accountId, keyId)));
  }

  @DELETE
  @Path("/{keyId}")
  public RevokeResponse revoke(@Context SecurityContext securityContext,
                               @PathParam("accountId") String accountId,
                               @PathParam("keyId") String keyId) {
    log.debug("revoke()");
    requireOwner(securityContext, accountId);
    return new RevokeResponse(Identities.normalize(keyId), unwrap(manager.revoke(accountId, keyId)));
  }

  @PUT
  @Path("/{keyId}/limits")
  public SessionKeyResponse updateLimits(@Context SecurityContext securityContext,
                                         @PathParam("accountId") String accountId,
                                         @PathParam("keyId") String keyId,
                                         UpdateLimitsRequest req) {
    log.debug("updateLimits()");
    requireOwner(securityContext, accountId);
    requireBody(req);
    return WireMapper.toResponse(unwrap(parsing(() -> manager.updateLimits(accountId, keyId,
        WireMapper.parseAmount(req.spendingLimit(), "spendingLimit"),
        WireMapper.parseAmount(req.dailyLimit(), "dailyLimit")))));
  }

  @PUT
  @Path("/{keyId}/expiry")
  public SessionKeyResponse extendExpiry(@Context SecurityContext securityContext,
                                         @PathParam("accountId") String accountId,
                                         @PathParam("keyId") String keyId,
                                         ExtendExpiryRequest req) {
    log.debug("extendExpiry()");
    requireOwner(securityContext, accountId);
    requireBody(req);
    return WireMapper.toResponse(unwrap(parsing(() -> manager.extendExpiry(accountId, keyId,
        WireMapper.parseInstant(req.expiryTime(), "expiryTime")))));
  }

  @GET
  @Path("/{keyId}/usage")
  public UsageResponse usage(@Context SecurityContext securityContext,
                             @PathParam("accountId") String accountId,
                             @PathParam("keyId") String keyId) {
    log.debug("usage()");
    requireOwner(securityContext, accountId);
    return WireMapper.toResponse(unwrap(manager.getUsage(accountId, keyId)));
  }

  @POST
  @Path("/{keyId}/validity")
  public DecisionResponse checkValidity(@Context SecurityContext securityContext,
                                        @PathParam("accountId") String accountId,
                                        @PathParam("keyId") String keyId,
                                        OperationRequest req) {
    log.debug("checkValidity()");
    requireOwner(securityContext, accountId);
    requireBody(req);
    return WireMapper.toResponse(parsing(() -> manager.checkValidity(accountId, keyId,
        WireMapper.requireText(req.target(), "target"),
        WireMapper.parseAmount(req.value(), "value"))));
  }

  @POST
  @Path("/{keyId}/authorizations")
  public DecisionResponse authorize(@Context SecurityContext securityContext,
                                    @PathParam("accountId") String accountId,
                                    @PathParam("keyId") String keyId,
                                    OperationRequest req) {
    log.debug("authorize()");
    requireOwner(securityContext, accountId);
    requireBody(req);
    return WireMapper.toResponse(parsing(() -> manager.authorize(accountId, keyId,
        WireMapper.requireText(req.target(), "target"),
        WireMapper.parseAmount(req.value(), "value"))));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private static String requireOwner(SecurityContext securityContext, String accountId) {
    Principal principal = securityContext == null ? null : securityContext.getUserPrincipal();
    if (principal == null) {
      throw error(Response.Status.UNAUTHORIZED.getStatusCode(), "UNAUTHORIZED", "Authentication required");
    }
    String account = Identities.normalize(accountId);
    if (!principal.getName().equals(account)) {
      log.warn("Principal {} denied access to account {}", principal.getName(), account);
      throw error(Response.Status.FORBIDDEN.getStatusCode(), "FORBIDDEN", "Not the owner of this account");
    }
    return account;
  }

  private static void requireBody(Object body) {
    if (body == null) {
      throw error(Response.Status.BAD_REQUEST.getStatusCode(), "BAD_REQUEST", "Request body is required");
    }
  }

  private static <T> T parsing(Supplier<T> call) {
    try {
      return call.get();
    } catch (IllegalArgumentException e) {
      throw error(Response.Status.BAD_REQUEST.getStatusCode(), "BAD_REQUEST", e.getMessage());
    }
  }

  private static <T> T unwrap(SessionKeyResult<T> result) {
    if (result.isSuccess()) {
      return result.value();
    }
    ErrorResponse body = WireMapper.toError(result);
    throw error(WireMapper.httpStatus(result.error().orElseThrow()), body.error(), body.message());
  }

  private static WebApplicationException error(int status, String error, String message) {
    return new WebApplicationException(message, Response.status(status)
        .entity(new ErrorResponse(error, message))
        .type(MediaType.APPLICATION_JSON_TYPE)
        .build());
  }
}

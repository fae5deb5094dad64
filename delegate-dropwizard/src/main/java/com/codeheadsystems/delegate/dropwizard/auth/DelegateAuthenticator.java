package com.codeheadsystems.delegate.dropwizard.auth;

import com.codeheadsystems.delegate.server.auth.OwnerTokenManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates owner bearer tokens using {@link OwnerTokenManager}.
 */
public class DelegateAuthenticator implements Authenticator<String, DelegatePrincipal> {

  private final OwnerTokenManager tokenManager;

  /**
   * Instantiates a new Delegate authenticator.
   *
   * @param tokenManager the token manager
   */
  public DelegateAuthenticator(OwnerTokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  public Optional<DelegatePrincipal> authenticate(String token) throws AuthenticationException {
    return tokenManager.verify(token)
        .map(result -> new DelegatePrincipal(result.accountId(), result.jti()));
  }
}

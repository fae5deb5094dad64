package com.codeheadsystems.delegate.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated account owner.
 *
 * @param accountId normalized account id from the token subject
 * @param jti       token ID
 */
public record DelegatePrincipal(String accountId, String jti) implements Principal {

  @Override
  public String getName() {
    return accountId;
  }
}

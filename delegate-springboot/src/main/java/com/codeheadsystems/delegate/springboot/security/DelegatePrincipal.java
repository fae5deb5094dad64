package com.codeheadsystems.delegate.springboot.security;

import java.security.Principal;

public record DelegatePrincipal(String accountId, String jti) implements Principal {

  @Override
  public String getName() {
    return accountId;
  }
}

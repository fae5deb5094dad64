package com.codeheadsystems.delegate.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the session key server.
 * <p>
 * For production, supply {@code jwtSecretHex} (a hex-encoded 32-byte random value, shared with
 * whatever issues owner tokens) and a {@code storageDirectory} so that grants and daily usage
 * survive restarts.  Omitting either falls back to dev-only behavior with a warning.
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class DelegateConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for owner tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Owner token time-to-live in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 3600;

  /**
   * Owner token issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "delegate";

  /**
   * Directory for the file-backed session key store. Empty selects the in-memory store.
   */
  private String storageDirectory = "";

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public String getStorageDirectory() {
    return storageDirectory;
  }

  @JsonProperty
  public void setStorageDirectory(String storageDirectory) {
    this.storageDirectory = storageDirectory;
  }
}

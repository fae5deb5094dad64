package com.codeheadsystems.delegate.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "delegate")
public class DelegateProperties {

  private String jwtSecretHex = "";
  private long jwtTtlSeconds = 3600;
  private String jwtIssuer = "delegate";
  private String storageDirectory = "";

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public String getStorageDirectory() {
    return storageDirectory;
  }

  public void setStorageDirectory(String storageDirectory) {
    this.storageDirectory = storageDirectory;
  }
}

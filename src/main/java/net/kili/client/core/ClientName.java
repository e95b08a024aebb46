package net.kili.client.core;

/**
 * Identity of the calling client, sent as the {@code apollographql-client-name} header so the
 * backend can tell SDK, CLI and internal traffic apart.
 */
public enum ClientName {
  SDK("java-sdk"),
  CLI("java-cli"),
  INTERNAL("java-internal");

  private final String headerValue;

  ClientName(String headerValue) {
    this.headerValue = headerValue;
  }

  public String getHeaderValue() {
    return headerValue;
  }
}

package net.kili.client.graphql;

/** How a failed GraphQL call is recovered from. */
public enum FailureKind {
  /** The locally cached schema rejected the document. Triggers one schema refresh. */
  LOCAL_VALIDATION(false),

  /** The document or its variables are wrong. Never retried. */
  PERMANENT(false),

  /** The backend or the network failed for a reason unrelated to the document. */
  TRANSIENT(true),

  /** The API key was refused. Never retried. */
  AUTHENTICATION(false);

  private final boolean retryable;

  FailureKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}

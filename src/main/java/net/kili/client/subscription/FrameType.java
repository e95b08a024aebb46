package net.kili.client.subscription;

/** Message types of the {@code graphql-ws} protocol. */
public enum FrameType {
  CONNECTION_INIT("connection_init"),
  CONNECTION_ACK("connection_ack"),
  CONNECTION_ERROR("connection_error"),
  CONNECTION_TERMINATE("connection_terminate"),
  KEEP_ALIVE("ka"),
  START("start"),
  STOP("stop"),
  DATA("data"),
  ERROR("error"),
  COMPLETE("complete"),
  UNKNOWN(null);

  private final String wireName;

  FrameType(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  /** @return true for frames ending a subscription */
  public boolean isTerminal() {
    return this == ERROR || this == COMPLETE;
  }

  /**
   * @param wireName value of the {@code type} member, null when absent
   * @return the frame type; a missing type means a data frame
   */
  public static FrameType fromWireName(String wireName) {
    if (wireName == null) {
      return DATA;
    }
    for (FrameType type : values()) {
      if (wireName.equals(type.wireName)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}

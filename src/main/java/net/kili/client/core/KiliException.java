package net.kili.client.core;

import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * Base exception of the client. Every unrecoverable condition reaches the caller as a
 * KiliException (or a subclass) carrying an {@link ErrorCode} and the original cause.
 */
public class KiliException extends Exception {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(KiliException.class);

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;
  private final transient Object[] params;

  /**
   * @param errorCode error code
   * @param params message parameters
   */
  public KiliException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  /**
   * @param cause original cause, may be null
   * @param errorCode error code
   * @param params message parameters
   */
  public KiliException(Throwable cause, ErrorCode errorCode, Object... params) {
    super(errorCode.formatMessage(params), cause);
    this.errorCode = errorCode;
    this.params = params;

    logger.debug("Kili exception: {}, code: {}", getMessage(), errorCode.getMessageCode());
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Get the vendor code
   *
   * @return numeric code of the error
   */
  public int getVendorCode() {
    return errorCode.getMessageCode();
  }

  public Object[] getParams() {
    return params;
  }
}

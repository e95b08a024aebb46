package net.kili.client.graphql;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import net.kili.client.core.SystemUtil;

/**
 * Per-call tracing headers. A fresh context, with its own call id and time, is created for every
 * logical call; retries of that call reuse it.
 */
public class CallContext {
  public static final String HEADER_CALL_UUID = "kili-client-call-uuid";
  public static final String HEADER_CALL_TIME = "kili-client-call-time";
  public static final String HEADER_METHOD_NAME = "kili-client-method-name";
  public static final String HEADER_PLATFORM_NAME = "kili-client-platform-name";
  public static final String HEADER_PLATFORM_VERSION = "kili-client-platform-version";

  static final String PLATFORM_NAME = "java";

  private final String callId;
  private final Instant callTime;
  private final String methodName;

  private CallContext(String callId, Instant callTime, String methodName) {
    this.callId = callId;
    this.callTime = callTime;
    this.methodName = methodName;
  }

  /** @return a context without method name */
  public static CallContext create() {
    return create(null);
  }

  /**
   * @param methodName name of the SDK method issuing the call, may be null
   * @return a new context
   */
  public static CallContext create(String methodName) {
    return new CallContext(UUID.randomUUID().toString(), Instant.now(), methodName);
  }

  public String getCallId() {
    return callId;
  }

  public Instant getCallTime() {
    return callTime;
  }

  public String getMethodName() {
    return methodName;
  }

  /** @return headers describing this call */
  public Map<String, String> toHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(HEADER_CALL_UUID, callId);
    headers.put(HEADER_CALL_TIME, callTime.toString());
    if (methodName != null) {
      headers.put(HEADER_METHOD_NAME, methodName);
    }
    headers.put(HEADER_PLATFORM_NAME, PLATFORM_NAME);
    String javaVersion = SystemUtil.systemGetProperty("java.version");
    if (javaVersion != null) {
      headers.put(HEADER_PLATFORM_VERSION, javaVersion);
    }
    return headers;
  }
}

package net.kili.client.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.core.ObjectMapperFactory;

/** One JSON message of the {@code graphql-ws} protocol. */
public final class Frame {
  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final ObjectNode json;

  private Frame(ObjectNode json) {
    this.json = json;
  }

  /**
   * @param text received message
   * @return the decoded frame
   * @throws KiliException with {@link ErrorCode#SUBSCRIPTION_ERROR} if the message is not a JSON
   *     object
   */
  public static Frame parse(String text) throws KiliException {
    JsonNode node;
    try {
      node = mapper.readTree(text);
    } catch (JsonProcessingException ex) {
      throw new KiliException(ex, ErrorCode.SUBSCRIPTION_ERROR, "malformed frame: " + text);
    }
    if (node == null || !node.isObject()) {
      throw new KiliException(ErrorCode.SUBSCRIPTION_ERROR, "malformed frame: " + text);
    }
    return new Frame((ObjectNode) node);
  }

  /**
   * @param headers headers forwarded to the server
   * @param authorization authorization value
   * @return {@code {"type": "connection_init", "payload": {"headers": ..., "Authorization": ...}}}
   */
  public static Frame connectionInit(Map<String, String> headers, String authorization) {
    ObjectNode json = mapper.createObjectNode();
    json.put("type", FrameType.CONNECTION_INIT.getWireName());
    ObjectNode payload = json.putObject("payload");
    payload.set("headers", mapper.valueToTree(headers));
    payload.put("Authorization", authorization);
    return new Frame(json);
  }

  /**
   * @param id session id
   * @param payload {@code {headers, query, variables}} of the subscription
   * @return {@code {"id": ..., "type": "start", "payload": ...}}
   */
  public static Frame start(String id, ObjectNode payload) {
    ObjectNode json = mapper.createObjectNode();
    json.put("id", id);
    json.put("type", FrameType.START.getWireName());
    json.set("payload", payload.deepCopy());
    return new Frame(json);
  }

  /**
   * @param id session id
   * @return {@code {"id": ..., "type": "stop"}}
   */
  public static Frame stop(String id) {
    ObjectNode json = mapper.createObjectNode();
    json.put("id", id);
    json.put("type", FrameType.STOP.getWireName());
    return new Frame(json);
  }

  public FrameType getType() {
    JsonNode type = json.get("type");
    return FrameType.fromWireName(type == null || type.isNull() ? null : type.asText());
  }

  /** @return session id, null for connection level frames */
  public String getId() {
    JsonNode id = json.get("id");
    return id == null || id.isNull() ? null : id.asText();
  }

  /** @return the payload member, null if absent */
  public JsonNode getPayload() {
    JsonNode payload = json.get("payload");
    return payload == null || payload.isNull() ? null : payload;
  }

  /** @return a copy of the whole frame */
  public ObjectNode toJsonNode() {
    return json.deepCopy();
  }

  public String toJson() {
    return json.toString();
  }

  @Override
  public String toString() {
    return json.toString();
  }
}

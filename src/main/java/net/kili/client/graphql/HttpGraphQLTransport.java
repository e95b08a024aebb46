package net.kili.client.graphql;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import net.kili.client.core.ClientSession;
import net.kili.client.core.Constants;
import net.kili.client.core.HttpUtil;
import net.kili.client.core.ObjectMapperFactory;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;
import net.kili.client.util.SecretDetector;
import net.kili.client.util.Stopwatch;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;

/** Sends GraphQL operations as JSON over HTTP POST with the Apache pooled client. */
public class HttpGraphQLTransport implements GraphQLTransport {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(HttpGraphQLTransport.class);

  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private final ClientSession session;
  private final CloseableHttpClient httpClient;

  public HttpGraphQLTransport(ClientSession session) {
    this(session, HttpUtil.getHttpClient(session.isVerify(), session.getTimeout()));
  }

  HttpGraphQLTransport(ClientSession session, CloseableHttpClient httpClient) {
    this.session = session;
    this.httpClient = httpClient;
  }

  @Override
  public String getEndpoint() {
    return session.getEndpoint();
  }

  @Override
  public GraphQLResponse execute(GraphQLRequest request) throws IOException {
    HttpPost post = new HttpPost(session.getEndpoint());
    setHeaders(post, request.getHeaders());
    String body = mapper.writeValueAsString(request.toJson(mapper));
    post.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));

    logger.debug("Sending GraphQL request: {}", request);
    Stopwatch stopwatch = Stopwatch.createStarted();
    try (CloseableHttpResponse response = httpClient.execute(post)) {
      int statusCode = response.getStatusLine().getStatusCode();
      String responseBody = readBody(response.getEntity());
      stopwatch.stop();
      logger.debug(
          "GraphQL request returned HTTP {} in {} ms", statusCode, stopwatch.elapsedMillis());
      if (statusCode >= 300) {
        logger.debug("Response body: {}", truncate(responseBody));
      }
      return GraphQLResponse.fromJson(statusCode, responseBody);
    }
  }

  @Override
  public String fetchBackendVersion() {
    String url = session.getVersionEndpoint();
    HttpGet get = new HttpGet(url);
    setHeaders(get, null);
    try (CloseableHttpResponse response = httpClient.execute(get)) {
      int statusCode = response.getStatusLine().getStatusCode();
      String body = readBody(response.getEntity());
      if (statusCode != 200 || body == null) {
        logger.debug("Version endpoint {} returned HTTP {}", url, statusCode);
        return null;
      }
      JsonNode version = parseVersion(body);
      if (version == null || !version.isTextual()) {
        logger.debug("Version endpoint {} returned no version string", url);
        return null;
      }
      return version.asText();
    } catch (IOException ex) {
      logger.warn("Failed to read the backend version from {}: {}", url, ex.getMessage());
      return null;
    }
  }

  private static JsonNode parseVersion(String body) {
    try {
      JsonNode root = mapper.readTree(body);
      return root == null ? null : root.get("version");
    } catch (IOException ex) {
      logger.debug("Version response is not JSON: {}", ex.getMessage());
      return null;
    }
  }

  private void setHeaders(HttpRequestBase request, Map<String, String> extraHeaders) {
    request.setHeader(Constants.HEADER_AUTHORIZATION, session.getAuthorization());
    request.setHeader(Constants.HEADER_ACCEPT, Constants.APPLICATION_JSON);
    request.setHeader(Constants.HEADER_CONTENT_TYPE, Constants.APPLICATION_JSON);
    request.setHeader(Constants.HEADER_CLIENT_NAME, session.getClientName().getHeaderValue());
    request.setHeader(Constants.HEADER_CLIENT_VERSION, session.getClientVersion());
    if (extraHeaders != null) {
      for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
        request.setHeader(header.getKey(), header.getValue());
      }
    }
  }

  private static String readBody(HttpEntity entity) throws IOException {
    if (entity == null) {
      return null;
    }
    StringWriter writer = new StringWriter();
    try (InputStream ins = entity.getContent()) {
      IOUtils.copy(ins, writer, StandardCharsets.UTF_8);
    }
    return writer.toString();
  }

  private static String truncate(String body) {
    if (body == null) {
      return null;
    }
    String masked = SecretDetector.maskSecrets(body);
    return masked.length() <= 1000 ? masked : masked.substring(0, 1000) + "...";
  }
}

package net.kili.client.graphql;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import net.kili.client.category.TestTags;
import net.kili.client.core.ClientName;
import net.kili.client.core.ClientSession;
import net.kili.client.core.KiliException;
import net.kili.client.core.ObjectMapperFactory;
import org.apache.commons.io.IOUtils;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@Tag(TestTags.GRAPHQL)
public class HttpGraphQLTransportTest {
  private static final ObjectMapper mapper = ObjectMapperFactory.getObjectMapper();

  private CloseableHttpClient httpClient;
  private HttpGraphQLTransport transport;

  @BeforeEach
  public void setUp() throws KiliException {
    ClientSession session =
        ClientSession.builder()
            .endpoint(FakeGraphQLServer.ENDPOINT)
            .apiKey("test-api-key-0123456789")
            .clientName(ClientName.CLI)
            .clientVersion("2.3.4")
            .build();
    httpClient = mock(CloseableHttpClient.class);
    transport = new HttpGraphQLTransport(session, httpClient);
  }

  private void respond(int status, String body) throws IOException {
    CloseableHttpResponse response = mock(CloseableHttpResponse.class);
    StatusLine statusLine = mock(StatusLine.class);
    when(statusLine.getStatusCode()).thenReturn(status);
    when(response.getStatusLine()).thenReturn(statusLine);
    when(response.getEntity())
        .thenReturn(body == null ? null : new StringEntity(body, ContentType.APPLICATION_JSON));
    when(httpClient.execute(any(HttpUriRequest.class))).thenReturn(response);
  }

  @Test
  public void testExecuteSendsHeadersAndBody() throws IOException {
    respond(200, "{\"data\":{\"me\":{\"id\":\"user-1\"}}}");

    GraphQLResponse response =
        transport.execute(
            new GraphQLRequest(
                "query { me { id } }",
                Collections.singletonMap("first", 10),
                null,
                Collections.singletonMap(CallContext.HEADER_METHOD_NAME, "projects")));

    assertTrue(response.isSuccess());
    assertEquals("user-1", response.getData().get("me").get("id").asText());

    ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient).execute(captor.capture());
    HttpUriRequest sent = captor.getValue();
    assertEquals("POST", sent.getMethod());
    assertEquals(FakeGraphQLServer.ENDPOINT, sent.getURI().toString());
    assertEquals(
        "X-API-Key: test-api-key-0123456789", sent.getFirstHeader("Authorization").getValue());
    assertEquals("java-cli", sent.getFirstHeader("apollographql-client-name").getValue());
    assertEquals("2.3.4", sent.getFirstHeader("apollographql-client-version").getValue());
    assertEquals("projects", sent.getFirstHeader("kili-client-method-name").getValue());

    String body =
        IOUtils.toString(
            ((HttpEntityEnclosingRequestBase) sent).getEntity().getContent(),
            StandardCharsets.UTF_8);
    JsonNode json = mapper.readTree(body);
    assertEquals("query { me { id } }", json.get("query").asText());
    assertEquals(10, json.get("variables").get("first").asInt());
    assertFalse(json.has("operationName"));
  }

  @Test
  public void testErrorResponseIsReturned() throws IOException {
    respond(400, "{\"errors\":[{\"message\":\"Syntax Error\"}]}");

    GraphQLResponse response = transport.execute(new GraphQLRequest("query {", null));

    assertFalse(response.isSuccess());
    assertEquals(400, response.getStatusCode());
    assertEquals("Syntax Error", response.getErrors().get(0).get("message").asText());
  }

  @Test
  public void testNonJsonBody() throws IOException {
    respond(502, "<html>Bad Gateway</html>");

    GraphQLResponse response = transport.execute(new GraphQLRequest("query { me { id } }", null));

    assertNull(response.getData());
    assertNull(response.getErrors());
    assertThat(response.getBody(), containsString("Bad Gateway"));
  }

  @Test
  public void testNetworkFailureIsThrown() throws IOException {
    when(httpClient.execute(any(HttpUriRequest.class))).thenThrow(new IOException("reset"));

    assertThrows(
        IOException.class, () -> transport.execute(new GraphQLRequest("query { me { id } }", null)));
  }

  @Test
  public void testFetchBackendVersion() throws IOException {
    respond(200, "{\"version\":\"2.150.0\"}");

    assertEquals("2.150.0", transport.fetchBackendVersion());

    ArgumentCaptor<HttpUriRequest> captor = ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(httpClient).execute(captor.capture());
    assertEquals("GET", captor.getValue().getMethod());
    assertEquals(
        "https://fake.kili.test/api/label/v2/version", captor.getValue().getURI().toString());
  }

  @Test
  public void testBackendVersionUnavailable() throws IOException {
    respond(404, "not found");
    assertNull(transport.fetchBackendVersion());

    respond(200, "{\"version\":12}");
    assertNull(transport.fetchBackendVersion());

    respond(200, "maintenance");
    assertNull(transport.fetchBackendVersion());

    when(httpClient.execute(any(HttpUriRequest.class))).thenThrow(new IOException("refused"));
    assertNull(transport.fetchBackendVersion());
  }
}

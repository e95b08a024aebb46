package net.kili.client.graphql;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.kili.client.category.TestTags;
import net.kili.client.core.ClientSession;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.core.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag(TestTags.GRAPHQL)
public class GraphQLClientTest {
  private static final String COUNT_PROJECTS =
      "query($where: ProjectWhere!) { countProjects(where: $where) }";
  private static final String ME = "query { me { id email } }";

  @TempDir Path cacheDir;

  private FakeGraphQLServer server;

  @BeforeEach
  public void setUp() {
    server = new FakeGraphQLServer("current.graphql");
  }

  private ClientSession.Builder sessionBuilder() {
    return ClientSession.builder()
        .endpoint(FakeGraphQLServer.ENDPOINT)
        .apiKey("test-api-key-0123456789")
        .schemaCacheDir(cacheDir)
        .skipChecks(false)
        .maxAttempts(4)
        .backoff(1, 2)
        .rateLimiter(RateLimiter.UNLIMITED);
  }

  private Path cacheFile() {
    return cacheDir.resolve("fake.kili.test_1.0.0.graphql");
  }

  private void seedCache(Path file, String schemaResource) throws IOException {
    Files.write(
        file, FakeGraphQLServer.readSchema(schemaResource).getBytes(StandardCharsets.UTF_8));
  }

  private static Map<String, Object> where(Object id) {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("id", id);
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("where", where);
    return variables;
  }

  @Test
  public void testFirstClientIntrospectsAndCachesTheSchema() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);

    assertEquals(1, server.introspectionCalls.get());
    assertTrue(Files.isRegularFile(cacheFile()));
    assertEquals(cacheFile(), client.getSchemaHandle().getCachePath());

    new GraphQLClient(sessionBuilder().build(), server);
    assertEquals(1, server.introspectionCalls.get());
  }

  @Test
  public void testExecute() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);

    JsonNode data = client.execute(ME, null);

    assertEquals("user-1", data.get("me").get("id").asText());
    assertEquals(1, server.queryCalls.get());
  }

  @Test
  public void testStaleCachedSchemaIsReplaced() throws Exception {
    Files.createDirectories(cacheDir);
    seedCache(cacheFile(), "stale.graphql");
    Path sibling = cacheDir.resolve("localhost_4000_0.1.0.graphql");
    seedCache(sibling, "stale.graphql");
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    assertEquals(0, server.introspectionCalls.get());

    JsonNode data = client.execute(COUNT_PROJECTS, where("project-1"));

    assertEquals(1, data.get("countProjects").asInt());
    assertEquals(1, server.introspectionCalls.get());
    assertEquals(1, server.queryCalls.get());
    assertFalse(Files.exists(sibling));
    assertThat(
        new String(Files.readAllBytes(cacheFile()), StandardCharsets.UTF_8),
        containsString("countProjects"));

    GraphQLClient next = new GraphQLClient(sessionBuilder().build(), server);
    next.execute(COUNT_PROJECTS, where("project-1"));
    assertEquals(1, server.introspectionCalls.get());
  }

  @Test
  public void testInvalidQueryIsNotSent() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    byte[] cachedBefore = Files.readAllBytes(cacheFile());

    GraphQLException ex =
        assertThrows(
            GraphQLException.class, () -> client.execute("query { me { nickname } }", null));

    assertEquals(FailureKind.PERMANENT, ex.getFailureKind());
    assertEquals(ErrorCode.GRAPHQL_ERROR, ex.getErrorCode());
    assertThat(ex.getMessage(), containsString("nickname"));
    assertNotNull(ex.getErrors());
    assertEquals(0, server.queryCalls.get());
    // initial load and the confirmation
    assertEquals(2, server.introspectionCalls.get());
    assertArrayEquals(cachedBefore, Files.readAllBytes(cacheFile()));
  }

  @Test
  public void testInvalidQueryWithoutLocalSchemaIsSentOnce() throws Exception {
    GraphQLClient client =
        new GraphQLClient(sessionBuilder().schemaCachingEnabled(false).build(), server);

    GraphQLException ex =
        assertThrows(
            GraphQLException.class, () -> client.execute("query { me { nickname } }", null));

    assertEquals(FailureKind.PERMANENT, ex.getFailureKind());
    assertEquals(400, ex.getHttpStatus());
    assertEquals(1, server.queryCalls.get());
    assertEquals(0, server.introspectionCalls.get());
    assertNull(client.getSchemaHandle());
  }

  @Test
  public void testTransientFailuresAreRetried() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    for (int i = 0; i < 3; i++) {
      server.failNext(
          FakeGraphQLServer.errorResponse(
              200,
              "[unexpectedRetrieving] Flagsmith API call failed with status code: 502",
              "OPERATION_RESOLUTION_FAILURE"));
    }

    JsonNode data = client.execute(ME, null);

    assertEquals("user-1", data.get("me").get("id").asText());
    assertEquals(4, server.queryCalls.get());
  }

  @Test
  public void testTransientFailuresExhaustAttempts() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    for (int i = 0; i < 5; i++) {
      server.failNext(FakeGraphQLServer.errorResponse(503, "Service Unavailable", null));
    }

    GraphQLException ex = assertThrows(GraphQLException.class, () -> client.execute(ME, null));

    assertEquals(FailureKind.TRANSIENT, ex.getFailureKind());
    assertEquals(503, ex.getHttpStatus());
    assertEquals(4, server.queryCalls.get());
  }

  @Test
  public void testBareServerErrorIsRetried() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    server.failNext(
        GraphQLResponse.fromJson(500, "<html><h1>500 Internal Server Error</h1></html>"));

    JsonNode data = client.execute(ME, null);

    assertEquals("user-1", data.get("me").get("id").asText());
    assertEquals(2, server.queryCalls.get());
  }

  @Test
  public void testNetworkFailureIsRetried() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    server.failNext(new IOException("connection reset"));

    JsonNode data = client.execute(ME, null);

    assertEquals("jane@kili.test", data.get("me").get("email").asText());
    assertEquals(2, server.queryCalls.get());
  }

  @Test
  public void testAuthenticationFailureIsNotRetried() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    server.failNext(FakeGraphQLServer.errorResponse(401, "Invalid API key", null));

    GraphQLException ex = assertThrows(GraphQLException.class, () -> client.execute(ME, null));

    assertEquals(FailureKind.AUTHENTICATION, ex.getFailureKind());
    assertEquals(ErrorCode.AUTHENTICATION_FAILED, ex.getErrorCode());
    assertEquals(1, server.queryCalls.get());
  }

  @Test
  public void testServerSidePermanentFailureIsNotRetried() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    server.failNext(
        FakeGraphQLServer.errorResponse(
            200, "Variable \\\"$where\\\" got invalid value 3", "INTERNAL_SERVER_ERROR"));

    GraphQLException ex = assertThrows(GraphQLException.class, () -> client.execute(ME, null));

    assertEquals(FailureKind.PERMANENT, ex.getFailureKind());
    assertEquals(1, server.queryCalls.get());
  }

  @Test
  public void testResponseWithoutDataIsPermanent() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    server.failNext(GraphQLResponse.fromJson(200, "{}"));

    GraphQLException ex = assertThrows(GraphQLException.class, () -> client.execute(ME, null));

    assertEquals(FailureKind.PERMANENT, ex.getFailureKind());
  }

  @Test
  public void testEveryAttemptTakesARateLimiterSlot() throws Exception {
    RateLimiter rateLimiter = mock(RateLimiter.class);
    GraphQLClient client =
        new GraphQLClient(sessionBuilder().rateLimiter(rateLimiter).build(), server);
    server.failNext(new IOException("connection reset"));
    server.failNext(FakeGraphQLServer.errorResponse(502, "Bad Gateway", null));

    client.execute(ME, null);

    verify(rateLimiter, times(3)).acquire();
  }

  @Test
  public void testRateLimiterFailureStopsTheCall() throws Exception {
    RateLimiter exhausted =
        () -> {
          throw new KiliException(ErrorCode.RATE_LIMIT_TIMEOUT, 10L);
        };
    GraphQLClient client =
        new GraphQLClient(sessionBuilder().rateLimiter(exhausted).build(), server);

    KiliException ex = assertThrows(KiliException.class, () -> client.execute(ME, null));

    assertEquals(ErrorCode.RATE_LIMIT_TIMEOUT, ex.getErrorCode());
    assertEquals(0, server.queryCalls.get());
  }

  @Test
  public void testNullVariablesAreNotSent() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    Map<String, Object> variables = where(null);
    variables.put("first", null);

    client.execute(
        "query($where: ProjectWhere!) { projects(where: $where, first: 10, skip: 0) { id } }",
        variables);

    Map<String, Object> sent = server.queryRequests().get(0).getVariables();
    assertEquals(Collections.singletonMap("where", Collections.emptyMap()), sent);
  }

  @Test
  public void testCallContextHeadersAreSent() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    CallContext context = CallContext.create("count_projects");

    client.execute(COUNT_PROJECTS, where("project-1"), context);

    Map<String, String> headers = server.queryRequests().get(0).getHeaders();
    assertEquals(context.getCallId(), headers.get(CallContext.HEADER_CALL_UUID));
    assertEquals("count_projects", headers.get(CallContext.HEADER_METHOD_NAME));
    assertEquals("java", headers.get(CallContext.HEADER_PLATFORM_NAME));
  }

  @Test
  public void testConcurrentStaleCallsRefreshOnce() throws Exception {
    Files.createDirectories(cacheDir);
    seedCache(cacheFile(), "stale.graphql");
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    int threads = 16;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<JsonNode>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  return client.execute(COUNT_PROJECTS, where("project-1"));
                }));
      }
      start.countDown();
      for (Future<JsonNode> future : futures) {
        assertEquals(1, future.get(30, TimeUnit.SECONDS).get("countProjects").asInt());
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, server.introspectionCalls.get());
    assertEquals(threads, server.queryCalls.get());
  }

  @Test
  public void testRefreshSchema() throws Exception {
    server.setSchema("stale.graphql");
    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);
    SchemaHandle before = client.getSchemaHandle();
    server.setSchema("current.graphql");

    SchemaHandle after = client.refreshSchema();

    assertSame(after, client.getSchemaHandle());
    assertEquals(before.getCachePath(), after.getCachePath());
    assertNotNull(after.getSchema().getQueryType().getFieldDefinition("countProjects"));
    assertEquals(2, server.introspectionCalls.get());
  }

  @Test
  public void testNoBackendVersionMeansNoLocalSchema() throws Exception {
    server.setVersion(null);

    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);

    assertNull(client.getSchemaHandle());
    assertNull(client.refreshSchema());
    assertEquals(0, server.introspectionCalls.get());
    assertEquals("user-1", client.execute(ME, null).get("me").get("id").asText());
  }

  @Test
  public void testSkipChecksMeansNoLocalSchema() throws Exception {
    GraphQLClient client = new GraphQLClient(sessionBuilder().skipChecks(true).build(), server);

    assertNull(client.getSchemaHandle());
    assertEquals(0, server.versionCalls.get());
  }

  @Test
  public void testCachingWithoutDirectoryFails() throws Exception {
    ClientSession session = sessionBuilder().schemaCacheDir(null).build();

    KiliException ex = assertThrows(KiliException.class, () -> new GraphQLClient(session, server));

    assertEquals(ErrorCode.SCHEMA_CACHE_DIR_REQUIRED, ex.getErrorCode());
  }

  @Test
  public void testUnreadableCacheIsReplaced() throws Exception {
    Files.createDirectories(cacheDir);
    Files.write(cacheFile(), "type Query {".getBytes(StandardCharsets.UTF_8));
    Path olderVersion = cacheDir.resolve("fake.kili.test_0.9.0.graphql");
    seedCache(olderVersion, "stale.graphql");

    GraphQLClient client = new GraphQLClient(sessionBuilder().build(), server);

    assertNotNull(client.getSchemaHandle());
    assertEquals(1, server.introspectionCalls.get());
    assertFalse(Files.exists(olderVersion));
    assertThat(
        new String(Files.readAllBytes(cacheFile()), StandardCharsets.UTF_8),
        containsString("countProjects"));
  }
}

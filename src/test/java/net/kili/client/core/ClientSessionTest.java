package net.kili.client.core;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Paths;
import java.time.Duration;
import net.kili.client.SystemPropertyOverrider;
import net.kili.client.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
public class ClientSessionTest {
  private static final String API_KEY = "test-api-key-0123456789";

  @Test
  public void testDefaults() throws KiliException {
    try (SystemPropertyOverrider endpoint =
            new SystemPropertyOverrider("kili.apiEndpoint", null);
        SystemPropertyOverrider trials = new SystemPropertyOverrider("kili.trialsNumber", null)) {
      ClientSession session = ClientSession.builder().apiKey(API_KEY).build();

      assertEquals(Constants.DEFAULT_MAX_ATTEMPTS, session.getMaxAttempts());
      assertEquals(Constants.DEFAULT_TIMEOUT, session.getTimeout());
      assertEquals(ClientName.SDK, session.getClientName());
      assertTrue(session.isSchemaCachingEnabled());
      assertSame(WindowRateLimiter.getProcessWideInstance(), session.getRateLimiter());
      assertEquals("X-API-Key: " + API_KEY, session.getAuthorization());
    }
  }

  @Test
  public void testDerivedEndpoints() throws KiliException {
    ClientSession session =
        ClientSession.builder()
            .apiKey(API_KEY)
            .endpoint("https://cloud.kili-technology.com/api/label/v2/graphql")
            .build();

    assertEquals(
        "wss://cloud.kili-technology.com/api/label/v2/graphql", session.getWebSocketEndpoint());
    assertEquals(
        "https://cloud.kili-technology.com/api/label/v2/version", session.getVersionEndpoint());

    ClientSession local =
        ClientSession.builder()
            .apiKey(API_KEY)
            .endpoint("http://localhost:4000/api/label/v2/graphql")
            .build();
    assertEquals("ws://localhost:4000/api/label/v2/graphql", local.getWebSocketEndpoint());
  }

  @Test
  public void testSystemPropertiesAreUsedWhenBuilderValueIsMissing() throws KiliException {
    try (SystemPropertyOverrider endpoint =
            new SystemPropertyOverrider(
                "kili.apiEndpoint", "http://localhost:4000/api/label/v2/graphql");
        SystemPropertyOverrider trials = new SystemPropertyOverrider("kili.trialsNumber", "4");
        SystemPropertyOverrider verify = new SystemPropertyOverrider("kili.verify", "false");
        SystemPropertyOverrider cacheDir =
            new SystemPropertyOverrider("kili.graphqlSchemaCacheDir", "/tmp/kili-schemas")) {
      ClientSession session = ClientSession.builder().apiKey(API_KEY).build();

      assertEquals("http://localhost:4000/api/label/v2/graphql", session.getEndpoint());
      assertEquals(4, session.getMaxAttempts());
      assertFalse(session.isVerify());
      assertEquals(Paths.get("/tmp/kili-schemas"), session.getSchemaCacheDir());

      ClientSession explicit =
          ClientSession.builder()
              .apiKey(API_KEY)
              .endpoint("https://fake.kili.test/api/label/v2/graphql")
              .maxAttempts(2)
              .verify(true)
              .build();
      assertEquals("https://fake.kili.test/api/label/v2/graphql", explicit.getEndpoint());
      assertEquals(2, explicit.getMaxAttempts());
      assertTrue(explicit.isVerify());
    }
  }

  @Test
  public void testExplicitNullCacheDirIsKept() throws KiliException {
    ClientSession session = ClientSession.builder().apiKey(API_KEY).schemaCacheDir(null).build();

    assertNull(session.getSchemaCacheDir());
  }

  @Test
  public void testMissingApiKey() {
    try (SystemPropertyOverrider apiKey = new SystemPropertyOverrider("kili.apiKey", "")) {
      KiliException ex = assertThrows(KiliException.class, () -> ClientSession.builder().build());

      assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());
      assertThat(ex.getMessage(), containsString("KILI_API_KEY"));
    }
  }

  @Test
  public void testApiKeyFromSystemProperty() throws KiliException {
    try (SystemPropertyOverrider apiKey = new SystemPropertyOverrider("kili.apiKey", API_KEY)) {
      assertEquals(API_KEY, ClientSession.builder().build().getApiKey());
    }
  }

  @Test
  public void testInvalidSettings() {
    KiliException attempts =
        assertThrows(
            KiliException.class,
            () -> ClientSession.builder().apiKey(API_KEY).maxAttempts(0).build());
    assertEquals(ErrorCode.INVALID_CONFIGURATION, attempts.getErrorCode());

    KiliException backoff =
        assertThrows(
            KiliException.class,
            () -> ClientSession.builder().apiKey(API_KEY).backoff(100, 10).build());
    assertEquals(ErrorCode.INVALID_CONFIGURATION, backoff.getErrorCode());

    KiliException threads =
        assertThrows(
            KiliException.class,
            () -> ClientSession.builder().apiKey(API_KEY).dispatcherThreads(0).build());
    assertEquals(ErrorCode.INVALID_CONFIGURATION, threads.getErrorCode());
  }

  @Test
  public void testToStringMasksApiKey() throws KiliException {
    ClientSession session =
        ClientSession.builder().apiKey(API_KEY).timeout(Duration.ofSeconds(5)).build();

    assertThat(session.toString(), not(containsString(API_KEY)));
    assertThat(session.toString(), containsString("apiKey=****"));
  }

  @Test
  public void testDefaultCacheDirEndsWithKiliGraphql() {
    assertTrue(ClientSession.getDefaultSchemaCacheDir().endsWith(Paths.get("kili", "graphql")));
  }
}

package net.kili.client.graphql;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.kili.client.category.TestTags;
import net.kili.client.core.Constants;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag(TestTags.GRAPHQL)
public class SchemaCacheTest {
  private static final String SDL = "type Query { me: String }\n";

  @TempDir Path tempDir;

  private Path cacheDir;
  private SchemaCache cache;

  @BeforeEach
  public void setUp() {
    cacheDir = tempDir.resolve("kili").resolve("graphql");
    cache = new SchemaCache(cacheDir);
  }

  @Test
  public void testCacheFileName() throws KiliException {
    assertEquals(
        "localhost_4000_1.2.3.graphql",
        SchemaCache.cacheFileName("http://localhost:4000/api/label/v2/graphql", "1.2.3"));
    assertEquals(
        "cloud.kili-technology.com_v2_abc.graphql",
        SchemaCache.cacheFileName(
            "https://cloud.kili-technology.com/api/label/v2/graphql", "v2/abc"));
  }

  @Test
  public void testCacheFileNameOfInvalidEndpoint() {
    KiliException ex =
        assertThrows(KiliException.class, () -> SchemaCache.cacheFileName("not a url", "1"));
    assertEquals(ErrorCode.INVALID_CONFIGURATION, ex.getErrorCode());

    KiliException noHost =
        assertThrows(KiliException.class, () -> SchemaCache.cacheFileName("/graphql", "1"));
    assertEquals(ErrorCode.INVALID_CONFIGURATION, noHost.getErrorCode());
  }

  @Test
  public void testReadMissingOrEmptyFile() throws IOException {
    Path file = cacheDir.resolve("missing.graphql");
    assertNull(cache.read(file));

    Files.createDirectories(cacheDir);
    Files.createFile(file);
    assertNull(cache.read(file));
  }

  @Test
  public void testWriteThenRead() throws KiliException {
    Path file = cache.pathFor("https://fake.kili.test/api/label/v2/graphql", "1.0.0");

    cache.write(file, SDL);

    assertEquals(cacheDir.resolve("fake.kili.test_1.0.0.graphql"), file);
    assertEquals(SDL, cache.read(file));
    cache.write(file, "type Query { projects: String }\n");
    assertEquals("type Query { projects: String }\n", cache.read(file));
  }

  @Test
  public void testWriteFailure() throws IOException {
    Files.createDirectories(tempDir);
    Path blocker = tempDir.resolve("file");
    Files.createFile(blocker);
    SchemaCache broken = new SchemaCache(blocker.resolve("graphql"));

    KiliException ex =
        assertThrows(
            KiliException.class,
            () -> broken.write(blocker.resolve("graphql").resolve("x.graphql"), SDL));
    assertEquals(ErrorCode.SCHEMA_CACHE_WRITE_FAILED, ex.getErrorCode());
  }

  @Test
  public void testPurgeHostKeepsOtherHosts() throws KiliException {
    String endpoint = "https://fake.kili.test/api/label/v2/graphql";
    Path old = cache.pathFor(endpoint, "0.9.0");
    Path current = cache.pathFor(endpoint, "1.0.0");
    Path otherHost = cache.pathFor("http://localhost:4000/api/label/v2/graphql", "1.0.0");
    cache.write(old, SDL);
    cache.write(current, SDL);
    cache.write(otherHost, SDL);

    List<Path> deleted = cache.purgeHost(endpoint, current);

    assertThat(deleted, containsInAnyOrder(old));
    assertTrue(Files.exists(current));
    assertTrue(Files.exists(otherHost));
  }

  @Test
  public void testPurgeAll() throws KiliException, IOException {
    Path first = cache.pathFor("https://fake.kili.test/api/label/v2/graphql", "1.0.0");
    Path second = cache.pathFor("http://localhost:4000/api/label/v2/graphql", "1.0.0");
    cache.write(first, SDL);
    cache.write(second, SDL);
    Path unrelated = cacheDir.resolve("notes.txt");
    Files.write(unrelated, new byte[] {1});

    List<Path> deleted = cache.purgeAll();

    assertThat(deleted, containsInAnyOrder(first, second));
    assertTrue(Files.exists(unrelated));
  }

  @Test
  public void testPurgeOfMissingDirectory() {
    assertTrue(cache.purgeAll().isEmpty());
  }

  @Test
  public void testWithLockRemovesTheLock() throws KiliException {
    Path lock = cacheDir.resolve(Constants.SCHEMA_CACHE_LOCK_NAME);

    String result =
        cache.withLock(
            () -> {
              assertTrue(Files.isDirectory(lock));
              return "done";
            });

    assertEquals("done", result);
    assertFalse(Files.exists(lock));
  }

  @Test
  public void testWithLockRemovesTheLockOnFailure() {
    Path lock = cacheDir.resolve(Constants.SCHEMA_CACHE_LOCK_NAME);

    assertThrows(
        KiliException.class,
        () ->
            cache.withLock(
                () -> {
                  throw new KiliException(
                      ErrorCode.SCHEMA_CACHE_WRITE_FAILED, "schema.graphql", "boom");
                }));

    assertFalse(Files.exists(lock));
  }

  @Test
  public void testExpiredLockIsRemoved() throws Exception {
    Path lock = cacheDir.resolve(Constants.SCHEMA_CACHE_LOCK_NAME);
    Files.createDirectories(lock);
    TimeUnit.MILLISECONDS.sleep(20);
    cache.setCacheLockExpirationInSeconds(0);

    AtomicInteger runs = new AtomicInteger();
    cache.withLock(runs::incrementAndGet);

    assertEquals(1, runs.get());
    assertFalse(Files.exists(lock));
  }

  @Test
  public void testLockSerializesCaches() throws Exception {
    SchemaCache other = new SchemaCache(cacheDir);
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<?> first = executor.submit(() -> runLocked(cache, inside, maxInside));
      Future<?> second = executor.submit(() -> runLocked(other, inside, maxInside));
      first.get(10, TimeUnit.SECONDS);
      second.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, maxInside.get());
  }

  private static Void runLocked(SchemaCache cache, AtomicInteger inside, AtomicInteger maxInside)
      throws KiliException {
    return cache.withLock(
        () -> {
          maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
          try {
            TimeUnit.MILLISECONDS.sleep(100);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
          inside.decrementAndGet();
          return null;
        });
  }
}

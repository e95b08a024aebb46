package net.kili.client.graphql;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import net.kili.client.core.Constants;
import net.kili.client.core.ErrorCode;
import net.kili.client.core.KiliException;
import net.kili.client.log.KiliLogger;
import net.kili.client.log.KiliLoggerFactory;

/**
 * On-disk cache of GraphQL schemas, one SDL file per (endpoint host, backend version) pair.
 *
 * <p>Processes sharing the cache directory are kept apart by a lock directory created with {@link
 * File#mkdirs()}. A lock older than its expiration is considered abandoned and removed. Files are
 * written to a temporary sibling and moved into place, so readers never see a partial schema.
 */
public class SchemaCache {
  private static final KiliLogger logger = KiliLoggerFactory.getLogger(SchemaCache.class);

  private static final long LOCK_RETRY_INTERVAL_IN_MILLIS = 50;

  private final Path cacheDir;
  private final File cacheLockFile;
  private long cacheLockExpirationInMilliseconds =
      TimeUnit.SECONDS.toMillis(Constants.SCHEMA_CACHE_LOCK_EXPIRATION_IN_SECONDS);

  /** Work done while holding the cache directory lock. */
  @FunctionalInterface
  public interface CacheAction<T> {
    T run() throws KiliException;
  }

  /**
   * @param cacheDir cache root, created on first write if missing
   */
  public SchemaCache(Path cacheDir) {
    this.cacheDir = cacheDir;
    this.cacheLockFile = cacheDir.resolve(Constants.SCHEMA_CACHE_LOCK_NAME).toFile();
  }

  SchemaCache setCacheLockExpirationInSeconds(long cacheLockExpirationInSeconds) {
    this.cacheLockExpirationInMilliseconds = cacheLockExpirationInSeconds * 1000;
    return this;
  }

  public Path getCacheDir() {
    return cacheDir;
  }

  /**
   * File name of the cache entry: {@code <host>_<version>.graphql}, every character outside
   * {@code [A-Za-z0-9._-]} replaced by an underscore.
   *
   * @param endpoint GraphQL endpoint URL
   * @param version backend build version
   * @return file name
   * @throws KiliException if the endpoint is not a valid URL
   */
  public static String cacheFileName(String endpoint, String version) throws KiliException {
    return hostPrefix(endpoint) + "_" + sanitize(version) + Constants.SCHEMA_FILE_EXTENSION;
  }

  static String hostPrefix(String endpoint) throws KiliException {
    String authority;
    try {
      authority = new URI(endpoint).getRawAuthority();
    } catch (URISyntaxException ex) {
      throw new KiliException(ex, ErrorCode.INVALID_CONFIGURATION, "invalid endpoint " + endpoint);
    }
    if (authority == null) {
      throw new KiliException(
          ErrorCode.INVALID_CONFIGURATION, "endpoint has no host: " + endpoint);
    }
    return sanitize(authority);
  }

  private static String sanitize(String value) {
    return value.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  /**
   * @param endpoint GraphQL endpoint URL
   * @param version backend build version
   * @return path of the cache entry for this pair
   * @throws KiliException if the endpoint is not a valid URL
   */
  public Path pathFor(String endpoint, String version) throws KiliException {
    return cacheDir.resolve(cacheFileName(endpoint, version));
  }

  /**
   * Reads a cache entry.
   *
   * @param cacheFile cache entry
   * @return the SDL, or null when the file is missing, empty or unreadable
   */
  public String read(Path cacheFile) {
    try {
      if (!Files.isRegularFile(cacheFile) || Files.size(cacheFile) == 0) {
        logger.debug("Schema cache file doesn't exist or is empty. File: {}", cacheFile);
        return null;
      }
      return new String(Files.readAllBytes(cacheFile), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      logger.debug("Failed to read the schema cache file. File: {}, Err: {}", cacheFile, ex);
      return null;
    }
  }

  /**
   * Writes a cache entry, replacing any previous content.
   *
   * @param cacheFile cache entry
   * @param sdl schema document
   * @throws KiliException with {@link ErrorCode#SCHEMA_CACHE_WRITE_FAILED}
   */
  public void write(Path cacheFile, String sdl) throws KiliException {
    logger.debug("Writing schema cache file. File: {}", cacheFile);
    Path tmpFile = null;
    try {
      Files.createDirectories(cacheDir);
      tmpFile = Files.createTempFile(cacheDir, cacheFile.getFileName().toString(), ".tmp");
      Files.write(tmpFile, sdl.getBytes(StandardCharsets.UTF_8));
      try {
        Files.move(
            tmpFile,
            cacheFile,
            StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmpFile, cacheFile, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      deleteQuietly(tmpFile);
      throw new KiliException(
          ex, ErrorCode.SCHEMA_CACHE_WRITE_FAILED, cacheFile, ex.getMessage());
    }
  }

  /**
   * Deletes every cached schema of the directory.
   *
   * @return deleted files
   */
  public List<Path> purgeAll() {
    return purge(null, null);
  }

  /**
   * Deletes the cached schemas of one endpoint host, e.g. those of older backend versions.
   *
   * @param endpoint GraphQL endpoint URL
   * @param keep file to keep, may be null
   * @return deleted files
   * @throws KiliException if the endpoint is not a valid URL
   */
  public List<Path> purgeHost(String endpoint, Path keep) throws KiliException {
    return purge(hostPrefix(endpoint) + "_", keep);
  }

  private List<Path> purge(String prefix, Path keep) {
    List<Path> deleted = new ArrayList<>();
    if (!Files.isDirectory(cacheDir)) {
      return deleted;
    }
    try (DirectoryStream<Path> files =
        Files.newDirectoryStream(cacheDir, "*" + Constants.SCHEMA_FILE_EXTENSION)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        if ((prefix != null && !name.startsWith(prefix)) || file.equals(keep)) {
          continue;
        }
        if (deleteQuietly(file)) {
          deleted.add(file);
        }
      }
    } catch (IOException ex) {
      logger.warn("Failed to list the schema cache directory {}: {}", cacheDir, ex.getMessage());
    }
    if (!deleted.isEmpty()) {
      logger.debug("Purged schema cache files: {}", deleted);
    }
    return deleted;
  }

  private static boolean deleteQuietly(Path file) {
    if (file == null) {
      return false;
    }
    try {
      return Files.deleteIfExists(file);
    } catch (IOException ex) {
      logger.debug("Failed to delete the file: {}, Err: {}", file, ex.getMessage());
      return false;
    }
  }

  /**
   * Runs an action while holding the cache directory lock. If the lock cannot be obtained before
   * it expires the action runs unlocked.
   *
   * @param action work to run
   * @param <T> result type
   * @return result of the action
   * @throws KiliException raised by the action
   */
  public synchronized <T> T withLock(CacheAction<T> action) throws KiliException {
    boolean locked = tryToLockCacheDir();
    if (!locked) {
      logger.warn("Failed to lock the schema cache directory {}, proceeding unlocked", cacheDir);
    }
    try {
      return action.run();
    } finally {
      if (locked && !unlockCacheDir()) {
        logger.debug("Failed to unlock schema cache directory", false);
      }
    }
  }

  private boolean tryToLockCacheDir() {
    try {
      Files.createDirectories(cacheDir);
    } catch (IOException ex) {
      logger.debug("Failed to create the schema cache directory {}: {}", cacheDir, ex);
      return false;
    }
    long deadline = System.currentTimeMillis() + cacheLockExpirationInMilliseconds;
    while (!lockCacheDir()) {
      if (System.currentTimeMillis() > deadline) {
        deleteCacheLockIfExpired();
        return lockCacheDir();
      }
      try {
        Thread.sleep(LOCK_RETRY_INTERVAL_IN_MILLIS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.debug("Interrupted while waiting for the schema cache lock", false);
        return false;
      }
    }
    return true;
  }

  private void deleteCacheLockIfExpired() {
    long currentTime = System.currentTimeMillis();
    long lockFileTs = fileCreationTime(cacheLockFile.toPath());
    if (lockFileTs < 0) {
      logger.debug("Failed to get the timestamp of lock directory", false);
    } else if (lockFileTs < currentTime - cacheLockExpirationInMilliseconds) {
      // old lock directory
      if (!cacheLockFile.delete()) {
        logger.debug("Failed to delete the directory. Dir: {}", cacheLockFile);
      } else {
        logger.debug("Deleted expired schema cache lock directory.", false);
      }
    }
  }

  private static long fileCreationTime(Path target) {
    try {
      BasicFileAttributes attr = Files.readAttributes(target, BasicFileAttributes.class);
      return attr.creationTime().toMillis();
    } catch (IOException ex) {
      logger.debug("Failed to get creation time. File/Dir: {}, Err: {}", target, ex);
    }
    return -1;
  }

  /**
   * Lock the cache directory by creating a lock directory
   *
   * @return true if success or false
   */
  private boolean lockCacheDir() {
    return cacheLockFile.mkdirs();
  }

  /**
   * Unlock the cache directory by deleting the lock directory
   *
   * @return true if success or false
   */
  private boolean unlockCacheDir() {
    return cacheLockFile.delete();
  }
}

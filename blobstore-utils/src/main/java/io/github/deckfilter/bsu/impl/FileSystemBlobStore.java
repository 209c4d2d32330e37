package io.github.deckfilter.bsu.impl;

import io.github.deckfilter.bsu.BlobStore;
import io.github.deckfilter.bsu.BlobStoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blob store backed by files under a root directory. A key maps to the relative path of the
 * same name.
 */
public class FileSystemBlobStore implements BlobStore {

  private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);

  private final Path root;

  /**
   * Instantiates a new File system blob store.
   *
   * @param root the root directory
   */
  public FileSystemBlobStore(final Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  /**
   * Root path.
   *
   * @return the root
   */
  public Path root() {
    return root;
  }

  @Override
  public Optional<byte[]> get(final String key) {
    final Path path = resolve(key);
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      log.trace("No blob at {}", path);
      return Optional.empty();
    } catch (IOException e) {
      throw new BlobStoreException("Unable to read " + path, e);
    }
  }

  @Override
  public void put(final String key, final byte[] bytes, final String contentType) {
    final Path path = resolve(key);
    try {
      Files.createDirectories(path.getParent());
      // write next to the target then move, so readers never see a partial file
      final Path temp = Files.createTempFile(path.getParent(), ".blob", ".tmp");
      Files.write(temp, bytes);
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.trace("Wrote {} bytes to {}", bytes.length, path);
    } catch (IOException e) {
      throw new BlobStoreException("Unable to write " + path, e);
    }
  }

  private Path resolve(final String key) {
    final Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new BlobStoreException("Key escapes the store root: " + key);
    }
    return path;
  }
}

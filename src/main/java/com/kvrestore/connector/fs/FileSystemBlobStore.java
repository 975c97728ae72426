package com.kvrestore.connector.fs;

import com.kvrestore.connector.BlobObject;
import com.kvrestore.connector.BlobStore;
import com.kvrestore.core.retry.ErrorKind;
import com.kvrestore.core.retry.RemoteServiceException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BlobStore} over a local or mounted directory. A key is a relative path below the root;
 * writes go to a temporary sibling first and are moved into place atomically.
 */
public class FileSystemBlobStore implements BlobStore {

  private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);
  static final String TEMP_SUFFIX = ".kvrestore-tmp";

  private final Path root;

  public FileSystemBlobStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public List<BlobObject> list(String prefix) {
    if (!Files.isDirectory(root)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .filter(path -> !path.getFileName().toString().endsWith(TEMP_SUFFIX))
          .map(this::toKey)
          .filter(key -> key.startsWith(prefix))
          .sorted()
          .map(key -> head(key).orElse(null))
          .filter(Objects::nonNull)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw translate("list " + prefix, e);
    }
  }

  @Override
  public Optional<BlobObject> head(String key) {
    Path path = resolve(key);
    try {
      BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
      if (!attributes.isRegularFile()) {
        return Optional.empty();
      }
      return Optional.of(
          new BlobObject(key, attributes.size(), attributes.lastModifiedTime().toInstant()));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw translate("head " + key, e);
    }
  }

  @Override
  public byte[] get(String key) {
    try {
      return Files.readAllBytes(resolve(key));
    } catch (IOException e) {
      throw translate("get " + key, e);
    }
  }

  @Override
  public void put(String key, byte[] body) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
      Files.write(temp, body);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("[BlobStore] put {} ({} bytes)", key, body.length);
    } catch (IOException e) {
      throw translate("put " + key, e);
    }
  }

  @Override
  public void verifyAccessible() {
    try {
      Files.createDirectories(root);
    } catch (IOException e) {
      throw new IllegalStateException("Backup store " + root + " cannot be created", e);
    }
    if (!Files.isReadable(root) || !Files.isWritable(root)) {
      throw new IllegalStateException("Backup store " + root + " is not readable and writable");
    }
    log.info("[BlobStore] Using backup store {}", root);
  }

  @Override
  public String describe() {
    return root.toUri().toString();
  }

  public Path getRoot() {
    return root;
  }

  private Path resolve(String key) {
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new RemoteServiceException(ErrorKind.VALIDATION, "Key escapes the store root: " + key);
    }
    return path;
  }

  private String toKey(Path path) {
    return root.relativize(path).toString().replace(path.getFileSystem().getSeparator(), "/");
  }

  private static RemoteServiceException translate(String operation, IOException e) {
    if (e instanceof NoSuchFileException) {
      return new RemoteServiceException(ErrorKind.RESOURCE_NOT_FOUND, operation + " failed", e);
    }
    if (e instanceof AccessDeniedException) {
      return new RemoteServiceException(ErrorKind.ACCESS_DENIED, operation + " failed", e);
    }
    return new RemoteServiceException(
        ErrorKind.INTERNAL_ERROR, operation + " failed: " + e.getMessage(), e);
  }
}

package com.auditledger.ledger.repository;

import com.auditledger.ledger.model.AuditEvent;
import com.auditledger.ledger.model.AuditEventFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Development storage, one JSON file per event under {@code <tenant>/<yyyy>/<MM>/<dd>/}.
 *
 * <p>Ids are unique across the whole base path: each write first claims {@code .index/<id>}
 * with {@code CREATE_NEW}, and the marker holds the event file's relative path.
 */
public class FileSystemAuditStorage implements AuditStorage {

  private static final Logger logger = LoggerFactory.getLogger(FileSystemAuditStorage.class);
  private static final String SUFFIX = ".json";
  // tenant, year, month, day, file
  private static final int EVENT_DEPTH = 5;
  static final String INDEX_DIRECTORY = ".index";

  private final Path basePath;
  private final ObjectMapper objectMapper;

  public FileSystemAuditStorage(Path basePath, ObjectMapper objectMapper) {
    this.basePath = basePath;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean writeEvent(AuditEvent event) {
    final Path file;
    final Path marker;
    try {
      file = eventPath(event);
      marker = markerPath(event.id());
      Files.createDirectories(file.getParent());
      Files.createDirectories(marker.getParent());
    } catch (IOException | IllegalArgumentException ex) {
      logger.error("audit event path rejected id={} tenantId={}", event.id(), event.tenantId(), ex);
      return false;
    }
    try {
      Files.writeString(
          marker,
          basePath.relativize(file).toString(),
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE_NEW,
          StandardOpenOption.WRITE);
    } catch (FileAlreadyExistsException ex) {
      logger.debug("audit event id already stored id={}", event.id());
      return false;
    } catch (IOException ex) {
      logger.error("audit event id claim failed id={} path={}", event.id(), marker, ex);
      return false;
    }
    try (OutputStream out =
        Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, event);
    } catch (IOException ex) {
      logger.error("audit event write failed id={} path={}", event.id(), file, ex);
      releaseClaim(marker, event.id());
      return false;
    }
    if (!file.toFile().setReadOnly() || !marker.toFile().setReadOnly()) {
      logger.warn("audit event file could not be marked read-only path={}", file);
    }
    return true;
  }

  @Override
  public int writeBatch(List<AuditEvent> events) {
    int written = 0;
    for (AuditEvent event : events) {
      if (writeEvent(event)) {
        written++;
      }
    }
    return written;
  }

  @Override
  public Optional<AuditEvent> readEvent(String eventId) {
    final String fileName = StoragePaths.segment(eventId, "event id") + SUFFIX;
    final Path marker = markerPath(eventId);
    if (Files.isRegularFile(marker)) {
      final Path file = indexedFile(marker);
      try {
        // claimed but not yet written
        return Files.isRegularFile(file) ? Optional.of(read(file)) : Optional.empty();
      } catch (UncheckedIOException ex) {
        throw new AuditStorageException("audit event read failed id=" + eventId, ex);
      }
    }
    // files written without an index marker
    try (Stream<Path> files = eventFiles(basePath, EVENT_DEPTH)) {
      return files
          .filter(path -> path.getFileName().toString().equals(fileName))
          .findFirst()
          .map(this::read);
    } catch (UncheckedIOException ex) {
      throw new AuditStorageException("audit event read failed id=" + eventId, ex);
    }
  }

  @Override
  public List<AuditEvent> query(AuditEventFilter filter) {
    final Path root;
    final int depth;
    if (filter.tenantId() == null) {
      root = basePath;
      depth = EVENT_DEPTH;
    } else {
      root = basePath.resolve(tenantSegment(filter.tenantId()));
      depth = EVENT_DEPTH - 1;
    }
    try (Stream<Path> files = eventFiles(root, depth)) {
      return files
          .map(this::read)
          .filter(filter::matches)
          .sorted(
              Comparator.comparing(AuditEvent::timestamp)
                  .thenComparing(AuditEvent::id)
                  .reversed())
          .skip(filter.offset())
          .limit(filter.limit())
          .collect(Collectors.toList());
    } catch (UncheckedIOException ex) {
      throw new AuditStorageException("audit event query failed tenantId=" + filter.tenantId(), ex);
    }
  }

  private Path eventPath(AuditEvent event) {
    final ZonedDateTime utc = event.timestamp().atZone(ZoneOffset.UTC);
    return basePath
        .resolve(tenantSegment(event.tenantId()))
        .resolve(String.format("%04d", utc.getYear()))
        .resolve(String.format("%02d", utc.getMonthValue()))
        .resolve(String.format("%02d", utc.getDayOfMonth()))
        .resolve(StoragePaths.segment(event.id(), "event id") + SUFFIX);
  }

  private Path markerPath(String eventId) {
    return basePath.resolve(INDEX_DIRECTORY).resolve(StoragePaths.segment(eventId, "event id"));
  }

  private Path indexedFile(Path marker) {
    final Path file;
    try {
      file = basePath.resolve(Files.readString(marker, StandardCharsets.UTF_8).trim()).normalize();
    } catch (IOException ex) {
      throw new AuditStorageException("unreadable audit index marker " + marker, ex);
    }
    if (!file.startsWith(basePath.normalize())) {
      throw new AuditStorageException("audit index marker points outside storage " + marker, null);
    }
    return file;
  }

  private void releaseClaim(Path marker, String eventId) {
    try {
      Files.deleteIfExists(marker);
    } catch (IOException ex) {
      logger.error("audit event id claim could not be released id={} path={}", eventId, marker, ex);
    }
  }

  private static String tenantSegment(String tenantId) {
    if (INDEX_DIRECTORY.equals(tenantId)) {
      throw new IllegalArgumentException("tenant id is reserved: " + tenantId);
    }
    return StoragePaths.segment(tenantId, "tenant id");
  }

  // Only files exactly `depth` levels below root; checkpoint files sit shallower.
  private static Stream<Path> eventFiles(Path root, int depth) {
    if (!Files.isDirectory(root)) {
      return Stream.empty();
    }
    try {
      return Files.find(
          root,
          depth,
          (path, attributes) ->
              attributes.isRegularFile()
                  && root.relativize(path).getNameCount() == depth
                  && path.getFileName().toString().endsWith(SUFFIX));
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private AuditEvent read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), AuditEvent.class);
    } catch (IOException ex) {
      throw new UncheckedIOException("unreadable audit event file " + file, ex);
    }
  }
}

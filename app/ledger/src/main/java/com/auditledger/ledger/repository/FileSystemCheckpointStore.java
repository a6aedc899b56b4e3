package com.auditledger.ledger.repository;

import com.auditledger.ledger.model.Checkpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSystemCheckpointStore implements CheckpointStore {

  private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointStore.class);
  private static final String DIRECTORY = "checkpoints";
  private static final String SUFFIX = ".json";

  private final Path basePath;
  private final ObjectMapper objectMapper;

  public FileSystemCheckpointStore(Path basePath, ObjectMapper objectMapper) {
    this.basePath = basePath;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean save(Checkpoint checkpoint) {
    final Path file = checkpointPath(checkpoint.tenantId(), checkpoint.checkpointDate());
    try {
      Files.createDirectories(file.getParent());
    } catch (IOException ex) {
      throw new AuditStorageException("checkpoint directory not writable path=" + file, ex);
    }
    try (OutputStream out =
        Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, checkpoint);
    } catch (FileAlreadyExistsException ex) {
      return false;
    } catch (IOException ex) {
      throw new AuditStorageException("checkpoint write failed path=" + file, ex);
    }
    if (!file.toFile().setReadOnly()) {
      logger.warn("checkpoint file could not be marked read-only path={}", file);
    }
    return true;
  }

  @Override
  public Optional<Checkpoint> find(String tenantId, LocalDate date) {
    final Path file = checkpointPath(tenantId, date);
    return Files.isRegularFile(file) ? Optional.of(read(file)) : Optional.empty();
  }

  @Override
  public Optional<Checkpoint> findLatestBefore(String tenantId, LocalDate date) {
    return storedDates(tenantId).stream()
        .filter(stored -> stored.isBefore(date))
        .max(Comparator.naturalOrder())
        .map(stored -> read(checkpointPath(tenantId, stored)));
  }

  @Override
  public List<Checkpoint> findRange(String tenantId, LocalDate from, LocalDate to) {
    final List<Checkpoint> checkpoints = new ArrayList<>();
    storedDates(tenantId).stream()
        .filter(stored -> !stored.isBefore(from) && !stored.isAfter(to))
        .sorted()
        .forEach(stored -> checkpoints.add(read(checkpointPath(tenantId, stored))));
    return checkpoints;
  }

  private List<LocalDate> storedDates(String tenantId) {
    final Path directory = tenantDirectory(tenantId);
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    final List<LocalDate> dates = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(SUFFIX))
          .forEach(
              name -> {
                try {
                  dates.add(LocalDate.parse(name.substring(0, name.length() - SUFFIX.length())));
                } catch (DateTimeParseException ex) {
                  logger.warn("ignoring unexpected file in checkpoint directory name={}", name);
                }
              });
    } catch (IOException ex) {
      throw new AuditStorageException("checkpoint listing failed tenantId=" + tenantId, ex);
    }
    return dates;
  }

  private Path tenantDirectory(String tenantId) {
    return basePath.resolve(StoragePaths.segment(tenantId, "tenant id")).resolve(DIRECTORY);
  }

  private Path checkpointPath(String tenantId, LocalDate date) {
    return tenantDirectory(tenantId).resolve(date + SUFFIX);
  }

  private Checkpoint read(Path file) {
    try {
      return objectMapper.readValue(file.toFile(), Checkpoint.class);
    } catch (IOException ex) {
      throw new AuditStorageException("unreadable checkpoint file " + file, ex);
    }
  }
}

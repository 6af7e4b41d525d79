package com.gentoro.reportbatch.batch.results;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.reportbatch.batch.BatchItemResult;
import com.gentoro.reportbatch.exception.NotFoundException;
import com.gentoro.reportbatch.exception.StoreException;
import com.gentoro.reportbatch.exception.ValidationException;
import com.gentoro.reportbatch.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Job-scoped result files. Each file is named {@code <jobId>.json} and expires {@code ttl} after
 * it was written, independently of the job record. Files are written to a temporary name and
 * moved into place, so a reader sees either the whole payload or nothing.
 */
public final class ResultFileManager {
  private static final org.slf4j.Logger log =
      com.gentoro.reportbatch.logging.LoggingService.getLogger(ResultFileManager.class);

  private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]{0,127}");
  private static final String SUFFIX = ".json";
  private static final String TMP_SUFFIX = ".tmp";
  private static final TypeReference<List<BatchItemResult>> ITEMS = new TypeReference<>() {};

  private final Path directory;
  private final Duration ttl;
  private final Clock clock;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ResultFileManager(Path directory, Duration ttl) {
    this(directory, ttl, Clock.systemUTC());
  }

  public ResultFileManager(Path directory, Duration ttl, Clock clock) {
    this.directory = directory.toAbsolutePath().normalize();
    this.ttl = ttl;
    this.clock = clock;
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new StoreException("Cannot create results directory " + this.directory, e);
    }
  }

  /** Write an already serialized payload for {@code jobId}, replacing any earlier file. */
  public StoredResult put(String jobId, byte[] payload, int itemCount) {
    if (jobId == null || !JOB_ID.matcher(jobId).matches()) {
      throw new ValidationException("Invalid job id for result file: " + jobId);
    }
    String reference = jobId + SUFFIX;
    Path target = directory.resolve(reference);
    Path tmp = directory.resolve(jobId + TMP_SUFFIX);
    try {
      Files.write(tmp, payload);
      Files.setLastModifiedTime(tmp, FileTime.from(clock.instant()));
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      long size = Files.size(target);
      log.info("Wrote result file {} ({} items, {} bytes)", reference, itemCount, size);
      return new StoredResult(reference, itemCount, size);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw new StoreException("Failed to write result file for job " + jobId, e);
    }
  }

  /**
   * Raw bytes of a result file.
   *
   * @throws NotFoundException with {@code gone} set when the file expired or was swept
   */
  public byte[] read(String reference) {
    Path file = locate(reference);
    try {
      if (isExpired(file)) {
        throw new NotFoundException("Result file expired: " + reference, true);
      }
      return Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      throw new NotFoundException("Result file no longer available: " + reference, true);
    } catch (IOException e) {
      throw new StoreException("Failed to read result file " + reference, e);
    }
  }

  public List<BatchItemResult> get(String reference) {
    byte[] bytes = read(reference);
    try {
      return mapper.readValue(bytes, ITEMS);
    } catch (IOException e) {
      throw new StoreException("Result file " + reference + " is not readable", e);
    }
  }

  public boolean delete(String reference) {
    try {
      return Files.deleteIfExists(locate(reference));
    } catch (IOException e) {
      throw new StoreException("Failed to delete result file " + reference, e);
    }
  }

  /** Delete every result file whose TTL has elapsed, plus leftover temporary files. */
  public int sweep() {
    int removed = 0;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        if (!name.endsWith(SUFFIX) && !name.endsWith(TMP_SUFFIX)) continue;
        try {
          if (isExpired(file) && Files.deleteIfExists(file)) removed++;
        } catch (NoSuchFileException e) {
          // removed concurrently
        } catch (IOException e) {
          log.warn("Could not sweep result file {}: {}", name, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new StoreException("Failed to list results directory " + directory, e);
    }
    if (removed > 0) log.info("Swept {} expired result file(s)", removed);
    return removed;
  }

  public Path directory() {
    return directory;
  }

  private Path locate(String reference) {
    if (reference == null
        || !reference.endsWith(SUFFIX)
        || !JOB_ID.matcher(reference.substring(0, reference.length() - SUFFIX.length()))
            .matches()) {
      throw new NotFoundException("Unknown result reference: " + reference);
    }
    return directory.resolve(reference);
  }

  private boolean isExpired(Path file) throws IOException {
    Instant written = Files.getLastModifiedTime(file).toInstant();
    return !clock.instant().isBefore(written.plus(ttl));
  }
}

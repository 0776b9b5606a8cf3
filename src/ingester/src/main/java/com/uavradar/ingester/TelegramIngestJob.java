package com.uavradar.ingester;

import com.uavradar.ingester.config.IngesterProperties;
import com.uavradar.ingester.inbox.InvalidTelegramFileException;
import com.uavradar.ingester.inbox.TelegramFileReader;
import com.uavradar.ingester.redis.RedisPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class TelegramIngestJob {
  private static final Logger log = LoggerFactory.getLogger(TelegramIngestJob.class);

  private final TelegramFileReader fileReader;
  private final RedisPublisher redisPublisher;
  private final IngesterProperties properties;
  private final Counter filesCounter;
  private final Counter rejectedCounter;
  private final Counter pushCounter;
  private final Counter errorCounter;
  private final AtomicLong lastBatchSize = new AtomicLong(0);

  public TelegramIngestJob(
      TelegramFileReader fileReader,
      RedisPublisher redisPublisher,
      MeterRegistry meterRegistry,
      IngesterProperties properties) {
    this.fileReader = fileReader;
    this.redisPublisher = redisPublisher;
    this.properties = properties;
    this.filesCounter = meterRegistry.counter("ingester.files.processed.total");
    this.rejectedCounter = meterRegistry.counter("ingester.files.rejected.total");
    this.pushCounter = meterRegistry.counter("ingester.push.total");
    this.errorCounter = meterRegistry.counter("ingester.errors.total");
    meterRegistry.gauge("ingester.last_batch.size", lastBatchSize);
  }

  @PostConstruct
  public void prepareDirectories() {
    IngesterProperties.Inbox inbox = properties.inbox();
    try {
      Files.createDirectories(Paths.get(inbox.directory()));
      Files.createDirectories(Paths.get(inbox.processedDirectory()));
      Files.createDirectories(Paths.get(inbox.failedDirectory()));
    } catch (IOException ex) {
      throw new IllegalStateException("Cannot prepare telegram inbox directories", ex);
    }
    log.info(
        "Telegram inbox configured: inbox={}, processed={}, failed={}",
        inbox.directory(),
        inbox.processedDirectory(),
        inbox.failedDirectory());
  }

  @Scheduled(fixedDelayString = "${ingester.poll-ms}")
  public void ingest() {
    try {
      for (Path file : pendingFiles()) {
        ingestFile(file);
      }
    } catch (Exception ex) {
      // Keep the scheduler running even if a cycle fails.
      errorCounter.increment();
      log.error("Ingestion cycle failed", ex);
    }
  }

  private List<Path> pendingFiles() throws IOException {
    try (Stream<Path> files = Files.list(Paths.get(properties.inbox().directory()))) {
      return files
          .filter(Files::isRegularFile)
          .filter(TelegramFileReader::isSupported)
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private void ingestFile(Path file) throws IOException {
    List<String> messages;
    try {
      messages = fileReader.read(file);
    } catch (InvalidTelegramFileException ex) {
      rejectedCounter.increment();
      log.warn("Rejected telegram file {}: {}", file.getFileName(), ex.getMessage());
      moveTo(file, properties.inbox().failedDirectory());
      return;
    }

    // A file left in the inbox after a publish failure is retried under a new batch id.
    String batchId = UUID.randomUUID().toString();
    int pushed = redisPublisher.publish(batchId, "file:" + file.getFileName(), messages);
    pushCounter.increment(pushed);
    filesCounter.increment();
    lastBatchSize.set(pushed);
    moveTo(file, properties.inbox().processedDirectory());
    log.info("Read {} telegrams from {}, pushed {} as batch {}", messages.size(), file.getFileName(), pushed, batchId);
  }

  private static void moveTo(Path file, String directory) throws IOException {
    Path target = Paths.get(directory).resolve(file.getFileName());
    Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
  }
}

package com.uavradar.processor.config;

import com.uavradar.processor.batch.BatchProcessor;
import com.uavradar.processor.dedup.Deduplicator;
import com.uavradar.processor.telegram.MessageParser;
import com.uavradar.processor.validation.FlightRecordValidator;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the parse, validate and dedupe stages of the batch pipeline. */
@Configuration
public class PipelineConfig {
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public MessageParser messageParser(ProcessorProperties properties, Clock clock) {
    return new MessageParser(properties.getTerritory().toBbox(), clock);
  }

  @Bean
  public FlightRecordValidator flightRecordValidator(ProcessorProperties properties, Clock clock) {
    return new FlightRecordValidator(properties, clock);
  }

  @Bean
  public Deduplicator deduplicator() {
    return new Deduplicator();
  }

  @Bean
  public BatchProcessor batchProcessor(
      MessageParser messageParser,
      FlightRecordValidator flightRecordValidator,
      Deduplicator deduplicator,
      Clock clock) {
    return new BatchProcessor(messageParser, flightRecordValidator, deduplicator, clock);
  }
}

package com.uavradar.processor.dedup;

import com.uavradar.processor.model.ParsedRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collapses records sharing a {@link RecordFingerprint} within one batch.
 *
 * <p>The first record in input order wins. The deduplicator keeps no state between calls;
 * callers that split one batch into chunks carry the seen fingerprints themselves.
 */
public class Deduplicator {
  private static final Logger LOGGER = LoggerFactory.getLogger(Deduplicator.class);

  /**
   * Removes duplicates from a batch.
   *
   * @param records validated records in input order
   * @return unique records, removed count and duplicate groups
   */
  public DeduplicationResult dedupe(List<ParsedRecord> records) {
    return dedupe(records, new HashSet<>());
  }

  /**
   * Removes duplicates from one chunk of a batch whose earlier chunks were already deduplicated.
   *
   * <p>Records whose fingerprint is in {@code seenFingerprints} are dropped as duplicates of an
   * earlier chunk. Fingerprints of the records kept here are added to the set.
   *
   * @param records validated records in input order
   * @param seenFingerprints fingerprints kept by earlier chunks of the same batch, updated in place
   * @return unique records, removed count and duplicate groups
   */
  public DeduplicationResult dedupe(List<ParsedRecord> records, Set<String> seenFingerprints) {
    Map<String, List<ParsedRecord>> byFingerprint = new LinkedHashMap<>();
    for (ParsedRecord record : records) {
      byFingerprint.computeIfAbsent(RecordFingerprint.of(record), key -> new ArrayList<>()).add(record);
    }

    List<ParsedRecord> unique = new ArrayList<>(byFingerprint.size());
    List<List<String>> groups = new ArrayList<>();
    for (Map.Entry<String, List<ParsedRecord>> entry : byFingerprint.entrySet()) {
      List<ParsedRecord> group = entry.getValue();
      List<ParsedRecord> dropped = group;
      if (seenFingerprints.add(entry.getKey())) {
        unique.add(group.get(0));
        dropped = group.subList(1, group.size());
      }
      if (!dropped.isEmpty()) {
        groups.add(dropped.stream()
            .map(ParsedRecord::getFlightId)
            .toList());
      }
    }

    int removed = records.size() - unique.size();
    if (removed > 0) {
      LOGGER.debug("Deduplicated {} -> {} records ({} duplicate groups)",
          records.size(), unique.size(), groups.size());
    }
    return new DeduplicationResult(List.copyOf(unique), removed, List.copyOf(groups));
  }
}

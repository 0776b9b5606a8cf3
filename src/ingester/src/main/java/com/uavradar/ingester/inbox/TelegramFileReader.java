package com.uavradar.ingester.inbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uavradar.ingester.config.IngesterProperties;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reads telegram messages from inbox files.
 *
 * <p>Two layouts are supported: {@code .txt} with one message per line, and {@code .json}
 * holding an array of message strings. Content must be UTF-8.
 */
@Component
public class TelegramFileReader {
  static final Set<String> SUPPORTED_EXTENSIONS = Set.of("txt", "json");

  private final ObjectMapper objectMapper;
  private final IngesterProperties properties;

  public TelegramFileReader(ObjectMapper objectMapper, IngesterProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  /** Returns true when the file name carries an extension this reader understands. */
  public static boolean isSupported(Path file) {
    return SUPPORTED_EXTENSIONS.contains(extensionOf(file));
  }

  /**
   * Reads all messages of a file.
   *
   * @param file inbox file
   * @return messages in file order
   * @throws InvalidTelegramFileException when the file is unsupported, too large, not UTF-8,
   *     malformed, empty or holds too many messages
   * @throws IOException when the file cannot be read
   */
  public List<String> read(Path file) throws IOException {
    String extension = extensionOf(file);
    if (!SUPPORTED_EXTENSIONS.contains(extension)) {
      throw new InvalidTelegramFileException("Unsupported file type: " + file.getFileName());
    }

    long size = Files.size(file);
    long maxBytes = properties.inbox().maxFileBytes();
    if (maxBytes > 0 && size > maxBytes) {
      throw new InvalidTelegramFileException(
          "File too large: " + size + " bytes (limit " + maxBytes + ")");
    }

    String content;
    try {
      content = Files.readString(file, StandardCharsets.UTF_8);
    } catch (CharacterCodingException ex) {
      throw new InvalidTelegramFileException("File is not valid UTF-8: " + file.getFileName(), ex);
    }
    if (content.startsWith("\uFEFF")) {
      content = content.substring(1);
    }

    List<String> messages = "json".equals(extension) ? fromJson(content) : fromText(content);
    if (messages.isEmpty()) {
      throw new InvalidTelegramFileException("File contains no messages: " + file.getFileName());
    }
    int maxMessages = properties.inbox().maxMessages();
    if (maxMessages > 0 && messages.size() > maxMessages) {
      throw new InvalidTelegramFileException(
          "Too many messages: " + messages.size() + " (limit " + maxMessages + ")");
    }
    return messages;
  }

  private static List<String> fromText(String content) {
    List<String> messages = new ArrayList<>();
    for (String line : content.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        messages.add(trimmed);
      }
    }
    return messages;
  }

  private List<String> fromJson(String content) {
    JsonNode root;
    try {
      root = objectMapper.readTree(content);
    } catch (JsonProcessingException ex) {
      throw new InvalidTelegramFileException("Malformed JSON: " + ex.getOriginalMessage(), ex);
    }
    if (root == null || !root.isArray()) {
      throw new InvalidTelegramFileException("JSON content must be an array of strings");
    }

    List<String> messages = new ArrayList<>();
    for (JsonNode node : root) {
      if (!node.isTextual()) {
        throw new InvalidTelegramFileException("JSON array must only contain strings");
      }
      String trimmed = node.asText().trim();
      if (!trimmed.isEmpty()) {
        messages.add(trimmed);
      }
    }
    return messages;
  }

  private static String extensionOf(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}

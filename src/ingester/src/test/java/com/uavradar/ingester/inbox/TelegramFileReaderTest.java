package com.uavradar.ingester.inbox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uavradar.ingester.config.IngesterProperties;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TelegramFileReaderTest {

  @TempDir
  Path tempDir;

  @Test
  void readsNonBlankTrimmedLinesFromTextFile() throws Exception {
    Path file = tempDir.resolve("batch.txt");
    Files.writeString(file, "FPL-RA1234-QUAD\n\n   \n  DEP-RA5678 \r\nARR-RA9999\n", StandardCharsets.UTF_8);

    List<String> messages = reader(1024, 100).read(file);

    assertThat(messages).containsExactly("FPL-RA1234-QUAD", "DEP-RA5678", "ARR-RA9999");
  }

  @Test
  void stripsByteOrderMark() throws Exception {
    Path file = tempDir.resolve("bom.txt");
    Files.writeString(file, "\uFEFFFPL-RA1234", StandardCharsets.UTF_8);

    assertThat(reader(1024, 100).read(file)).containsExactly("FPL-RA1234");
  }

  @Test
  void readsJsonArrayOfStrings() throws Exception {
    Path file = tempDir.resolve("batch.JSON");
    Files.writeString(file, """
        ["FPL-RA1234-QUAD", "  ", "DEP-RA5678"]
        """, StandardCharsets.UTF_8);

    assertThat(reader(1024, 100).read(file)).containsExactly("FPL-RA1234-QUAD", "DEP-RA5678");
  }

  @Test
  void rejectsUnsupportedExtension() throws Exception {
    Path file = tempDir.resolve("batch.csv");
    Files.writeString(file, "FPL-RA1234", StandardCharsets.UTF_8);

    assertThat(TelegramFileReader.isSupported(file)).isFalse();
    assertThatThrownBy(() -> reader(1024, 100).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("Unsupported file type");
  }

  @Test
  void rejectsFileAboveSizeLimit() throws Exception {
    Path file = tempDir.resolve("large.txt");
    Files.writeString(file, "FPL-RA1234-QUAD-UUEE1000\n".repeat(10), StandardCharsets.UTF_8);

    assertThatThrownBy(() -> reader(64, 100).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("File too large");
  }

  @Test
  void rejectsNonUtf8Content() throws Exception {
    Path file = tempDir.resolve("latin1.txt");
    Files.write(file, new byte[] {'F', 'P', 'L', (byte) 0xC3, (byte) 0x28, '\n'});

    assertThatThrownBy(() -> reader(1024, 100).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("UTF-8");
  }

  @Test
  void rejectsMalformedJson() throws Exception {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "[\"FPL-RA1234\"", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> reader(1024, 100).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("Malformed JSON");
  }

  @Test
  void rejectsJsonThatIsNotAnArrayOfStrings() throws Exception {
    Path object = tempDir.resolve("object.json");
    Files.writeString(object, "{\"raw\": \"FPL-RA1234\"}", StandardCharsets.UTF_8);
    Path numbers = tempDir.resolve("numbers.json");
    Files.writeString(numbers, "[\"FPL-RA1234\", 42]", StandardCharsets.UTF_8);

    TelegramFileReader reader = reader(1024, 100);
    assertThatThrownBy(() -> reader.read(object)).isInstanceOf(InvalidTelegramFileException.class);
    assertThatThrownBy(() -> reader.read(numbers)).isInstanceOf(InvalidTelegramFileException.class);
  }

  @Test
  void rejectsEmptyFile() throws Exception {
    Path file = tempDir.resolve("empty.txt");
    Files.writeString(file, "\n  \n", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> reader(1024, 100).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("no messages");
  }

  @Test
  void rejectsTooManyMessages() throws Exception {
    Path file = tempDir.resolve("many.txt");
    Files.writeString(file, "A\nB\nC\n", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> reader(1024, 2).read(file))
        .isInstanceOf(InvalidTelegramFileException.class)
        .hasMessageContaining("Too many messages");
  }

  private TelegramFileReader reader(long maxFileBytes, int maxMessages) {
    IngesterProperties properties = new IngesterProperties(
        5_000,
        new IngesterProperties.Redis("uavradar:telegrams:queue"),
        new IngesterProperties.Inbox(
            tempDir.resolve("inbox").toString(),
            tempDir.resolve("processed").toString(),
            tempDir.resolve("failed").toString(),
            maxFileBytes,
            maxMessages));
    return new TelegramFileReader(new ObjectMapper(), properties);
  }
}

package com.jeffbrower.erb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConfigLoaderTest {
   @TempDir
   Path dir;

   private void write(final String yaml) throws IOException {
      Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE_NAME), yaml, StandardCharsets.UTF_8);
   }

   @Test
   void defaultsWithoutFile() {
      final FormatOptions o = ConfigLoader.load(dir);
      assertEquals(2, o.indentWidth);
      assertEquals(80, o.maxLineLength);
      assertEquals(LineEnding.LF, o.endOfLine);
   }

   @Test
   void readsFormatterSection() throws IOException {
      write("formatter:\n  indentWidth: 4\n  maxLineLength: 120\n  endOfLine: crlf\n");

      final FormatOptions o = ConfigLoader.load(dir);

      assertEquals(4, o.indentWidth);
      assertEquals(120, o.maxLineLength);
      assertEquals(LineEnding.CRLF, o.endOfLine);
   }

   @Test
   void missingKeysKeepDefaults() throws IOException {
      write("formatter:\n  maxLineLength: 100\n");

      final FormatOptions o = ConfigLoader.load(dir);

      assertEquals(2, o.indentWidth);
      assertEquals(100, o.maxLineLength);
   }

   @ParameterizedTest
   @ValueSource(strings = { "", "# nothing here\n", "formatter:\n" })
   void emptyConfigurationKeepsDefaults(final String yaml) throws IOException {
      write(yaml);
      assertEquals(80, ConfigLoader.load(dir).maxLineLength);
   }

   @ParameterizedTest
   @ValueSource(strings = {
      "formatter:\n  indentWidth: 0\n",
      "formatter:\n  maxLineLength: -1\n",
      "formatter:\n  endOfLine: cr\n",
      "formatter:\n  indentWidth: wide\n",
      "formatter:\n  tabs: true\n",
      "formatter: [\n",
   })
   void invalidConfigurationIsRejected(final String yaml) throws IOException {
      write(yaml);
      final IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(dir));
      assertTrue(e.getMessage().length() > 0);
   }

   @Test
   void lineEndingNames() {
      assertEquals(LineEnding.LF, LineEnding.of("lf"));
      assertEquals(LineEnding.CRLF, LineEnding.of(" CRLF "));
      assertEquals(LineEnding.SYSTEM, LineEnding.of("System"));
      assertThrows(IllegalArgumentException.class, () -> LineEnding.of("cr"));
   }
}

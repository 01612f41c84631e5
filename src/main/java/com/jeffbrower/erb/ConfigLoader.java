package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link FormatOptions} from a {@code .erb-formatter.yml} file:
 *
 * <pre>
 * formatter:
 *   indentWidth: 2
 *   maxLineLength: 100
 *   endOfLine: lf
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public class ConfigLoader {
   public static final String CONFIG_FILE_NAME = ".erb-formatter.yml";

   private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

   private ConfigLoader() {
      throw new UnsupportedOperationException();
   }

   /**
    * Load the configuration file from a directory, or the defaults if it has none.
    *
    * @throws IllegalArgumentException if the file cannot be read, is not valid YAML, or holds invalid values
    */
   public static FormatOptions load(final Path directory) {
      final Path file = directory.resolve(CONFIG_FILE_NAME);
      if (!Files.isRegularFile(file)) {
         log("load: no " + CONFIG_FILE_NAME + " in " + directory + ", using defaults");
         return new FormatOptions();
      }

      final YamlConfig yaml;
      try {
         final JsonNode tree = YAML.readTree(file.toFile());
         // a file with nothing but comments has no document at all
         yaml = tree == null || tree.isMissingNode() || tree.isNull() ? null : YAML.treeToValue(tree, YamlConfig.class);
      } catch (final IOException e) {
         throw new IllegalArgumentException("Invalid configuration in " + file + ": " + e.getMessage(), e);
      }

      final FormatOptions options = toOptions(yaml, file);
      log("load: " + file + ": " + options);
      return options;
   }

   private static FormatOptions toOptions(final YamlConfig yaml, final Path file) {
      final FormatOptions options = new FormatOptions();
      if (yaml == null || yaml.formatter == null) {
         // empty file, or no formatter section
         return options;
      }

      final FormatterSection section = yaml.formatter;
      if (section.indentWidth != null) {
         if (section.indentWidth <= 0) {
            throw new IllegalArgumentException("formatter.indentWidth must be positive in " + file + ": " + section.indentWidth);
         }
         options.indentWidth = section.indentWidth;
      }
      if (section.maxLineLength != null) {
         if (section.maxLineLength <= 0) {
            throw new IllegalArgumentException("formatter.maxLineLength must be positive in " + file + ": " + section.maxLineLength);
         }
         options.maxLineLength = section.maxLineLength;
      }
      if (section.endOfLine != null) {
         options.endOfLine = LineEnding.of(section.endOfLine);
      }
      return options;
   }

   private static class YamlConfig {
      public FormatterSection formatter;
   }

   private static class FormatterSection {
      public Integer indentWidth;
      public Integer maxLineLength;
      public String endOfLine;
   }
}

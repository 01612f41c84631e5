package com.jeffbrower.erb;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Formats every {@code .erb} file under the directories given as arguments, in place. Each directory's
 * {@code .erb-formatter.yml} applies to everything beneath it.
 */
public class BulkFormatter {
   public static void main(final String[] args) {
      int failures = 0;
      for (final String arg : args) {
         final Path dir = Path.of(arg);
         if (!Files.isDirectory(dir)) {
            System.err.println("Not a directory: " + arg);
            failures++;
            continue;
         }

         final FormatOptions o;
         try {
            o = ConfigLoader.load(dir);
         } catch (final IllegalArgumentException e) {
            System.err.println(e.getMessage());
            failures++;
            continue;
         }
         failures += traverse(dir, o);
      }
      if (failures > 0) {
         System.exit(1);
      }
   }

   /** @return the number of files that could not be formatted */
   static int traverse(final Path dir, final FormatOptions o) {
      final List<Path> paths;
      try (final Stream<Path> list = Files.list(dir)) {
         paths = list.sorted().collect(Collectors.toList());
      } catch (final IOException e) {
         System.err.println("Error listing files in " + dir);
         e.printStackTrace();
         return 1;
      }

      int failures = 0;
      for (final Path path : paths) {
         if (Files.isDirectory(path)) {
            failures += traverse(path, o);
         } else if (Files.isRegularFile(path) && isTemplate(path)) {
            failures += format(path, o) ? 0 : 1;
         }
      }
      return failures;
   }

   static boolean isTemplate(final Path path) {
      return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".erb");
   }

   /** @return false if the file could not be formatted */
   static boolean format(final Path file, final FormatOptions o) {
      try {
         final FormatResult result = Formatter.formatFile(file, o);
         if (!result.isSuccess()) {
            System.err.println("Error formatting file " + file + ": " + result.error.getMessage());
            return false;
         }
         if (result.ignored || !result.isChanged()) {
            System.out.println("Unchanged " + result);
            return true;
         }

         // write next to the file, then swap it in
         final String baseName = file.getFileName().toString();
         final Path tempFile = Files.createTempFile(file.toAbsolutePath().getParent(), baseName, ".tmp");
         Files.writeString(tempFile, result.formatted, StandardCharsets.UTF_8);
         Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
         System.out.println("Formatted file " + file);
         return true;
      } catch (final IOException e) {
         System.err.println("Error formatting file " + file);
         e.printStackTrace();
         return false;
      }
   }
}

package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;

import com.jeffbrower.erb.ast.DocumentNode;
import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Entry points for formatting ERB templates. */
public class Formatter {
   private Formatter() {
      throw new UnsupportedOperationException();
   }

   /**
    * Format an already parsed template. Deterministic: the same tree, source and options always give the same text.
    *
    * @param source the text the tree was parsed from; spans in the tree index into it
    */
   public static String format(final DocumentNode tree, final String source, final FormatOptions options) {
      return FormatPrinter.format(tree, source, options);
   }

   /**
    * Parse and format a template. A template containing {@code <%# erb-formatter ignore %>} is returned unchanged.
    *
    * @throws IllegalStateException if the template is structurally invalid
    */
   public static String format(final String source, final FormatOptions options) {
      final DocumentNode tree = Parser.parse(source);
      if (FormatIgnore.shouldSkip(tree)) {
         log("format: ignore directive found, leaving source unchanged");
         return source;
      }
      return format(tree, source, options);
   }

   /** Read the whole template, and write it formatted. Both streams are closed. */
   public static void format(final Reader r, final Writer w, final FormatOptions options) throws IOException {
      try (r; w) {
         w.write(format(readAll(r), options));
      }
   }

   /** Format a file's contents without writing anything. Failures are reported in the result rather than thrown. */
   public static FormatResult formatFile(final Path file, final FormatOptions options) throws IOException {
      final String source = Files.readString(file, StandardCharsets.UTF_8);
      try {
         final DocumentNode tree = Parser.parse(source);
         if (FormatIgnore.shouldSkip(tree)) {
            return new FormatResult(file, source, source, true, null);
         }
         return new FormatResult(file, source, format(tree, source, options), false, null);
      } catch (final IllegalStateException e) {
         log("formatFile: " + file + ": " + e.getMessage());
         return FormatResult.failed(file, source, e);
      }
   }

   static String readAll(final Reader r) throws IOException {
      final StringWriter w = new StringWriter();
      r.transferTo(w);
      return w.toString();
   }
}

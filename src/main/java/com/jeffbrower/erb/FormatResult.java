package com.jeffbrower.erb;

import java.nio.file.Path;

/** The outcome of formatting one file. When formatting failed or the file opted out, the output is the original text. */
public class FormatResult {
   public final Path path;
   public final String original;
   public final String formatted;
   public final boolean ignored;
   /** null unless formatting failed */
   public final Exception error;

   FormatResult(final Path path, final String original, final String formatted, final boolean ignored, final Exception error) {
      this.path = path;
      this.original = original;
      this.formatted = formatted;
      this.ignored = ignored;
      this.error = error;
   }

   static FormatResult failed(final Path path, final String original, final Exception error) {
      return new FormatResult(path, original, original, false, error);
   }

   public boolean isSuccess() {
      return error == null;
   }

   public boolean isChanged() {
      return !original.equals(formatted);
   }

   @Override
   public String toString() {
      final String status = error != null ? "error: " + error.getMessage() : ignored ? "ignored" : isChanged() ? "changed" : "unchanged";
      return path + " (" + status + ")";
   }
}

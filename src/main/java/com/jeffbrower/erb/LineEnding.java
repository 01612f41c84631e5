package com.jeffbrower.erb;

import java.util.Locale;

public enum LineEnding {
   /** Use the system line endings. */
   SYSTEM(System.lineSeparator()),

   /** Unix/macOS line endings (`\n`). */
   LF("\n"),

   /** Windows line endings (`\r\n`). */
   CRLF("\r\n");

   /** The line ending as a string. */
   public final String string;

   private LineEnding(final String string) {
      this.string = string;
   }

   /**
    * Look up a line ending by its configuration name, ignoring case ({@code "lf"}, {@code "crlf"}, {@code "system"}).
    *
    * @throws IllegalArgumentException if the name is not a known line ending
    */
   public static LineEnding of(final String name) {
      for (final LineEnding ending : values()) {
         if (ending.name().equals(name.strip().toUpperCase(Locale.ROOT))) {
            return ending;
         }
      }
      throw new IllegalArgumentException("Unknown line ending: " + name + " (expected lf, crlf or system)");
   }
}

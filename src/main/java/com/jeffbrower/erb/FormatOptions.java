package com.jeffbrower.erb;

/**
 * Options for one formatting run. Loaded from {@code .erb-formatter.yml} by {@link ConfigLoader}, or built directly.
 *
 * Embedded Ruby code is never reformatted, only the whitespace around it, so there are no Ruby-specific options.
 */
public class FormatOptions {
   /** Specify the number of spaces per indentation-level. */
   public int indentWidth = 2;

   /**
    * Specify the line length that the printer will wrap on. Single tokens that cannot be broken (a long URL, an embedded Ruby
    * tag) may still exceed it.
    */
   public int maxLineLength = 80;

   /** Specify the line endings. Valid values are LF, CRLF, and SYSTEM (use the system default). */
   public LineEnding endOfLine = LineEnding.LF;

   public FormatOptions() {
      // defaults
   }

   public FormatOptions(final int indentWidth, final int maxLineLength) {
      this.indentWidth = indentWidth;
      this.maxLineLength = maxLineLength;
   }

   @Override
   public String toString() {
      return "FormatOptions[indentWidth=" + indentWidth + ", maxLineLength=" + maxLineLength + ", endOfLine=" + endOfLine + "]";
   }
}

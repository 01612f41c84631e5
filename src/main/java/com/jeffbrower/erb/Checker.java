package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;

import java.io.IOException;
import java.io.Reader;

public class Checker {
   /** @return true if the template is already formatted, or opts out of formatting */
   public static boolean check(final Reader r, final FormatOptions o) throws IOException {
      final String source;
      try (r) {
         source = Formatter.readAll(r);
      }
      final String formatted = Formatter.format(source, o);
      if (formatted.equals(source)) {
         return true;
      }

      final int i = firstDifference(source, formatted);
      log(() -> "check: first difference at line " + lineNumber(source, i) + ": expected "
         + stringify(formatted.substring(i, Math.min(formatted.length(), i + 40))) + " but found "
         + stringify(source.substring(i, Math.min(source.length(), i + 40))));
      return false;
   }

   private Checker() {
      throw new UnsupportedOperationException();
   }

   static int firstDifference(final String a, final String b) {
      final int n = Math.min(a.length(), b.length());
      for (int i = 0; i < n; i++) {
         if (a.charAt(i) != b.charAt(i)) {
            return i;
         }
      }
      return n;
   }

   /** 1-based */
   static int lineNumber(final String s, final int offset) {
      int line = 1;
      for (int i = 0; i < offset && i < s.length(); i++) {
         if (s.charAt(i) == '\n') {
            line++;
         }
      }
      return line;
   }
}

package com.jeffbrower.erb;

import java.util.function.Supplier;

class Logger {
   private static final boolean DEBUG = System.getProperty("erb-formatter.debug", "false").equals("true");

   /** Longest string {@link #stringify} prints before eliding the middle. */
   private static final int MAX_STRINGIFY = 72;

   /** Log a message to the `System.out`, if the system property `erb-formatter.debug` is `true`. */
   static void log(final String message) {
      if (DEBUG) {
         System.out.println(message);
      }
   }

   /** Like {@link #log(String)}, for messages that are expensive to build (captured renders, joined lines). */
   static void log(final Supplier<String> message) {
      if (DEBUG) {
         System.out.println(message.get());
      }
   }

   /**
    * Print a string, escaping special characters, for use in log messages. Long strings keep their head and tail. Does not
    * produce valid java strings for special characters.
    */
   static String stringify(final String s) {
      if (s == null) {
         return "null";
      }
      final String shown = s.length() <= MAX_STRINGIFY
         ? s
         : s.substring(0, MAX_STRINGIFY / 2) + "…" + s.substring(s.length() - MAX_STRINGIFY / 2);
      final StringBuilder b = new StringBuilder("\"");
      for (final char c : shown.toCharArray()) {
         switch (c) {
            case '\n':
               b.append("\\n");
               break;
            case '\r':
               b.append("\\r");
               break;
            case '\t':
               b.append("\\t");
               break;
            case '"':
               b.append("\\\"");
               break;
            default:
               if (c >= ' ' && c < 0x7f) {
                  b.append(c);
               } else {
                  b.append("\\u{").append(Integer.toHexString(c)).append('}');
               }
               break;
         }
      }
      return b.append('"').toString();
   }
}

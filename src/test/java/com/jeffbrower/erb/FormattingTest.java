package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FormattingTest {
   @ParameterizedTest
   @ValueSource(strings = {
      "basic",
      "control_flow",
      "attributes",
      "comments",
      "text_wrap",
      "preserve",
      "inline_erb",
      "erb_tags",
      "case_and_classes",
   })
   void test(final String baseName) throws IOException {
      final String in, out;
      try (
         final InputStream isIn = ClassLoader.getSystemResourceAsStream(baseName + ".in.html.erb");
         final InputStream isOut = ClassLoader.getSystemResourceAsStream(baseName + ".out.html.erb")
      ) {
         in = new String(isIn.readAllBytes(), StandardCharsets.UTF_8);
         out = new String(isOut.readAllBytes(), StandardCharsets.UTF_8);
      }

      log("input: " + stringify(in));
      log("output: " + stringify(out));

      // verify formatting properly with 'in' -> 'out'
      testFormat(in, out, new FormatOptions());

      // verify check function returns false for mismatched input
      testCheck(in, new FormatOptions(), false);

      // verify stable by checking that 'out' -> 'out'
      testFormat(out, out, new FormatOptions());

      // verify check function returns true for matching input
      testCheck(out, new FormatOptions(), true);
   }

   private static void testFormat(final String in, final String out, final FormatOptions o) throws IOException {
      final StringWriter w = new StringWriter();
      Formatter.format(new StringReader(in), w, o);
      assertEquals(out, w.toString());
   }

   private static void testCheck(final String in, final FormatOptions o, final boolean expected) throws IOException {
      try (final StringReader r = new StringReader(in)) {
         assertEquals(expected, Checker.check(r, o));
      }
   }
}

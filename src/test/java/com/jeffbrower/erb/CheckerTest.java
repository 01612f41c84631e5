package com.jeffbrower.erb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CheckerTest {
   private static boolean check(final String source) throws IOException {
      return Checker.check(new StringReader(source), new FormatOptions());
   }

   @Test
   void formattedTemplatePasses() throws IOException {
      assertTrue(check("<div>\n  <p>Hello</p>\n</div>\n"));
   }

   @Test
   void unformattedTemplateFails() throws IOException {
      assertFalse(check("<div><p>Hello</p></div>"));
      assertFalse(check("<div>\n  <p>Hello</p>\n</div>"));
   }

   @ParameterizedTest
   @ValueSource(strings = {
      "<%# erb-formatter ignore %><div><p>x</p></div>",
      "<div><p>x</p><%#   erb-formatter ignore   %></div>",
      "<div <% if a %><%# erb-formatter ignore %><% end %>></div>",
   })
   void ignoredTemplatePasses(final String source) throws IOException {
      assertTrue(check(source));
      assertTrue(FormatIgnore.shouldSkip(Parser.parse(source)));
   }

   @ParameterizedTest
   @ValueSource(strings = {
      "<div><p>x</p></div>",
      "<%= 'erb-formatter ignore' %>",
      "<!-- erb-formatter ignore -->",
   })
   void directiveMustBeAnErbComment(final String source) {
      assertFalse(FormatIgnore.shouldSkip(Parser.parse(source)));
   }

   @Test
   void differencesAreLocated() {
      assertEquals(2, Checker.firstDifference("abcd", "abXd"));
      assertEquals(2, Checker.firstDifference("ab", "abc"));
      assertEquals(2, Checker.lineNumber("a\nb\nc", 3));
      assertEquals(1, Checker.lineNumber("abc", 2));
   }
}

package com.jeffbrower.erb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jeffbrower.erb.ast.DocumentNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormatterTest {
   private static String format(final String source) {
      return Formatter.format(source, new FormatOptions());
   }

   @Test
   void nestedBlockElements() {
      assertEquals("<div>\n  <p>Hello</p>\n</div>\n", format("<div><p>Hello</p></div>"));
   }

   @Test
   void inlineElementStaysOnOneLine() {
      assertEquals("<span>a</span>\n", format("<span>a</span>"));
   }

   @Test
   void preservedBodyIsByteIdentical() {
      assertEquals("<pre>  x\n  y</pre>\n", format("<pre>  x\n  y</pre>"));
   }

   @Test
   void controlFlowInOpenTagIsSpacedInline() {
      assertEquals(
         "<div <% if x %> class=\"y\" <% end %>></div>\n",
         format("<div <% if x %>class=\"y\"<% end %>></div>")
      );
   }

   @Test
   void longClassListWrapsWithinBudget() {
      final List<String> tokens = new ArrayList<>();
      for (int i = 1; i <= 20; i++) {
         tokens.add(String.format("token-%02d", i));
      }
      final String source = "<section><article><div class=\"" + String.join(" ", tokens) + "\">x</div></article></section>";

      final String formatted = format(source);

      final List<String> found = new ArrayList<>();
      int wrappedLines = 0;
      for (final String line : formatted.split("\n")) {
         assertTrue(line.length() <= 80, "line too long: " + line);
         if (line.strip().startsWith("token-")) {
            wrappedLines++;
            assertTrue(line.startsWith("      token-"), "tokens indented one level below the attribute: " + line);
            for (final String token : line.strip().split(" ")) {
               found.add(token);
            }
         }
      }
      assertTrue(wrappedLines > 1);
      assertEquals(tokens, found);
      assertTrue(formatted.contains("    <div class=\"\n"));
      assertTrue(formatted.contains("\n    \">\n"));
      assertEquals(formatted, format(formatted));
   }

   private static void assertLinesFit(final String formatted) {
      for (final String line : formatted.split("\n")) {
         assertTrue(line.length() <= 80, "line too long: " + line);
      }
   }

   @Test
   void classListWrapsWhenTagPrefixPushesItOver() {
      final String classes = "flex items-center justify-between px-4 py-2 bg-white shadow-md round";
      final String formatted = format("<div class=\"" + classes + "\">x</div>");

      assertEquals("<div class=\"\n  " + classes + "\n\">\n  x\n</div>\n", formatted);
      assertLinesFit(formatted);
      assertEquals(formatted, format(formatted));
   }

   @Test
   void classListWrapsEvenWhenTokensFitOneLine() {
      final List<String> tokens = new ArrayList<>();
      for (char c = 'a'; c <= 'z'; c++) {
         tokens.add(String.valueOf(c));
      }
      tokens.addAll(List.of("aa", "bb", "cc", "dd", "ee", "ff", "gg", "hh"));
      final String classes = String.join(" ", tokens);
      final String formatted = format("<input class=\"" + classes + "\" type=\"text\">");

      assertEquals("<input\n  class=\"\n    " + classes + "\n  \"\n  type=\"text\"\n>\n", formatted);
      assertLinesFit(formatted);
      assertEquals(formatted, format(formatted));
   }

   @Test
   void voidElementsHaveNoCloseTag() {
      assertEquals(
         "<div>\n  <br><img src=\"a.png\">\n  <input type=\"text\">\n</div>\n",
         format("<div><br><img src=\"a.png\"><input type=\"text\"></div>")
      );
   }

   @Test
   void multilineSiblingsAreSeparatedByBlankLine() {
      assertEquals(
         "<div>\n"
            + "  <section>\n"
            + "    <p>a</p>\n"
            + "    <p>b</p>\n"
            + "  </section>\n"
            + "\n"
            + "  <section>\n"
            + "    <p>c</p>\n"
            + "  </section>\n"
            + "</div>\n",
         format("<div>\n<section><p>a</p><p>b</p></section>\n<section><p>c</p></section>\n</div>")
      );
   }

   @Test
   void adjacentCommentsStayTogether() {
      assertEquals(
         "<!--\n  a\n  b\n-->\n<!--\n  c\n  d\n-->\n",
         format("<!--\na\nb\n-->\n<!--\nc\nd\n-->")
      );
   }

   @Test
   void authoredBlankLinesCollapseToOne() {
      assertEquals("<p>a</p>\n\n<p>b</p>\n", format("<p>a</p>\n\n\n\n<p>b</p>"));
   }

   @Test
   void punctuationStaysAttachedToInlineElement() {
      assertEquals(
         "<p>Click <a href=\"/\">here</a>, then go.</p>\n",
         format("<p>Click <a href='/'>here</a>, then go.</p>")
      );
   }

   @Test
   void inlineContentIsSpacedLikeWrappedText() {
      assertEquals("<p>Hello <b>world</b>!</p>\n", format("<p>Hello <b> world </b> !</p>"));
      assertEquals("<p>Total: $<%= price %> (<i>net</i>)</p>\n", format("<p>Total: $ <%= price %> ( <i>net</i> )</p>"));
   }

   @Test
   void emptyInputFormatsToEmptyOutput() {
      assertEquals("", format(""));
      assertEquals("", format("  \n\n \n"));
   }

   @Test
   void indentWidthIsConfigurable() {
      assertEquals("<div>\n    <p>a</p>\n</div>\n", Formatter.format("<div><p>a</p></div>", new FormatOptions(4, 80)));
   }

   @Test
   void lineEndingIsConfigurable() {
      final FormatOptions o = new FormatOptions();
      o.endOfLine = LineEnding.CRLF;
      assertEquals("<div>\r\n  <p>a</p>\r\n</div>\r\n", Formatter.format("<div><p>a</p></div>", o));
   }

   @Test
   void ignoreDirectiveLeavesSourceUnchanged() {
      final String source = "<%# erb-formatter ignore %>\n<div><p>x</p></div>";
      assertEquals(source, format(source));
   }

   @Test
   void formatsAParsedTree() {
      final String source = "<ul><li>one</li><li>two</li></ul>";
      final DocumentNode tree = Parser.parse(source);
      final String first = Formatter.format(tree, source, new FormatOptions());
      assertEquals("<ul>\n  <li>one</li>\n  <li>two</li>\n</ul>\n", first);
      // same tree and options, same text
      assertEquals(first, Formatter.format(tree, source, new FormatOptions()));
   }

   @Test
   void malformedInputIsRejected() {
      assertThrows(IllegalStateException.class, () -> format("<div><p></div>"));
   }

   @Test
   void formatFileReportsFailuresWithOriginalText(@TempDir final Path dir) throws IOException {
      final Path bad = dir.resolve("bad.html.erb");
      Files.writeString(bad, "<div><% if x %></div>", StandardCharsets.UTF_8);

      final FormatResult result = Formatter.formatFile(bad, new FormatOptions());

      assertFalse(result.isSuccess());
      assertNotNull(result.error);
      assertEquals(result.original, result.formatted);
      assertFalse(result.isChanged());
   }

   @Test
   void formatFileSkipsIgnoredFiles(@TempDir final Path dir) throws IOException {
      final Path ignored = dir.resolve("ignored.html.erb");
      Files.writeString(ignored, "<%# erb-formatter ignore %><div><p>x</p></div>", StandardCharsets.UTF_8);

      final FormatResult result = Formatter.formatFile(ignored, new FormatOptions());

      assertTrue(result.isSuccess());
      assertTrue(result.ignored);
      assertFalse(result.isChanged());
   }

   @Test
   void bulkFormatterRewritesTemplatesInPlace(@TempDir final Path dir) throws IOException {
      Files.writeString(dir.resolve(ConfigLoader.CONFIG_FILE_NAME), "formatter:\n  indentWidth: 4\n", StandardCharsets.UTF_8);
      final Path nested = Files.createDirectories(dir.resolve("views/users"));
      final Path template = nested.resolve("show.html.erb");
      final Path other = nested.resolve("notes.txt");
      Files.writeString(template, "<div><p><%= @user.name %></p></div>", StandardCharsets.UTF_8);
      Files.writeString(other, "<div><p>x</p></div>", StandardCharsets.UTF_8);

      assertEquals(0, BulkFormatter.traverse(dir, ConfigLoader.load(dir)));

      assertEquals("<div>\n    <p><%= @user.name %></p>\n</div>\n", Files.readString(template, StandardCharsets.UTF_8));
      assertEquals("<div><p>x</p></div>", Files.readString(other, StandardCharsets.UTF_8));
   }
}

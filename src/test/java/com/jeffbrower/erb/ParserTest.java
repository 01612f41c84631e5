package com.jeffbrower.erb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.CommentNode;
import com.jeffbrower.erb.ast.DoctypeNode;
import com.jeffbrower.erb.ast.DocumentNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.TextNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ParserTest {
   @Test
   void elementsNestWithSpans() {
      final String source = "<div id=\"a\"><p>Hi</p></div>";
      final DocumentNode document = Parser.parse(source);

      assertEquals(1, document.children.size());
      final ElementNode div = (ElementNode) document.children.get(0);
      assertEquals("div", div.tagName);
      assertEquals(0, div.start);
      assertEquals(source.length(), div.end);

      final AttributeNode id = (AttributeNode) div.openTag.children.get(1);
      assertEquals("id", id.name);
      assertEquals("\"", id.value.openQuote);
      assertEquals("a", ((LiteralNode) id.value.children.get(0)).content);

      final ElementNode p = (ElementNode) div.body.get(0);
      assertEquals("Hi", ((TextNode) p.body.get(0)).content);
      assertEquals("p", p.closeTag.tagName);
   }

   @Test
   void voidAndSelfClosingElementsHaveNoBody() {
      final DocumentNode document = Parser.parse("<br><img src=\"x\"/><custom-el/>");

      for (final Node node : document.children) {
         final ElementNode element = (ElementNode) node;
         assertTrue(element.isVoid(), element.tagName);
         assertTrue(element.body.isEmpty());
         assertNull(element.closeTag);
      }
   }

   @Test
   void booleanAndUnquotedAttributes() {
      final ElementNode input = (ElementNode) Parser.parse("<input disabled value=plain>").children.get(0);
      final AttributeNode disabled = (AttributeNode) input.openTag.children.get(1);
      final AttributeNode value = (AttributeNode) input.openTag.children.get(3);

      assertNull(disabled.value);
      assertEquals("", value.value.openQuote);
      assertEquals("plain", ((LiteralNode) value.value.children.get(0)).content);
   }

   @Test
   void preservedElementBodyIsRawText() {
      final String source = "<script>if (a < b) { x(\"</p>\") }</script>";
      final ElementNode script = (ElementNode) Parser.parse(source).children.get(0);

      assertEquals(1, script.body.size());
      assertEquals("if (a < b) { x(\"</p>\") }", ((TextNode) script.body.get(0)).content);
   }

   @Test
   void markupDeclarations() {
      final DocumentNode document = Parser.parse("<!DOCTYPE html><!-- note --><p>x</p>");

      assertEquals("<!DOCTYPE html>", ((DoctypeNode) document.children.get(0)).content);
      assertEquals(" note ", ((CommentNode) document.children.get(1)).content);
   }

   @ParameterizedTest
   @CsvSource(delimiter = '|', value = {
      "<%= user.name %>| <%=| user.name | %>",
      "<%== raw %>| <%==| raw | %>",
      "<%# note %>| <%#| note | %>",
      "<%- trimmed -%>| <%-| trimmed | -%>",
      "<% code %>| <%| code | %>",
   })
   void erbTagDelimiters(final String source, final String opening, final String content, final String closing) {
      final ErbContentNode tag = (ErbContentNode) Parser.parse(source).children.get(0);

      assertEquals(opening.strip(), tag.opening);
      assertEquals(" " + content.strip() + " ", tag.content);
      assertEquals(closing.strip(), tag.closing);
   }

   @Test
   void conditionalWithClauses() {
      final DocumentNode document = Parser.parse("<% if a %>A<% elsif b %>B<% else %>C<% end %>");
      final ErbControlFlowNode flow = (ErbControlFlowNode) document.children.get(0);

      assertEquals(ErbControlFlowNode.Kind.CONDITIONAL, flow.kind);
      assertEquals("A", ((TextNode) flow.body.get(0)).content);
      assertEquals(2, flow.clauses.size());
      assertEquals(" elsif b ", flow.clauses.get(0).tag.content);
      assertEquals("C", ((TextNode) flow.clauses.get(1).body.get(0)).content);
      assertEquals(" end ", flow.endTag.content);
      assertEquals(0, flow.start);
      assertEquals(document.end, flow.end);
   }

   @ParameterizedTest
   @CsvSource(delimiter = ';', value = {
      "<% items.each do |item| %>x<% end %>;BLOCK",
      "<% form_with(model: @user) do |f| %>x<% end %>;BLOCK",
      "<% list.map { |i| %>x<% } %>;BLOCK",
      "<% case kind %><% when :a %>x<% end %>;CASE",
      "<% while more? %>x<% end %>;LOOP",
      "<% unless ok %>x<% end %>;CONDITIONAL",
      "<% begin %>x<% rescue %>y<% ensure %>z<% end %>;BEGIN",
   })
   void controlFlowKinds(final String source, final ErbControlFlowNode.Kind kind) {
      assertEquals(kind, ((ErbControlFlowNode) Parser.parse(source).children.get(0)).kind);
   }

   @ParameterizedTest
   @ValueSource(strings = {
      "<%= if admin? then 'a' else 'b' end %>",
      "<%# if this were code %>",
      "<%= link_to 'Home', root_path %>",
   })
   void plainTags(final String source) {
      assertInstanceOf(ErbContentNode.class, Parser.parse(source).children.get(0));
   }

   @Test
   void controlFlowInsideOpeningTagAndAttributeValue() {
      final ElementNode div = (ElementNode) Parser.parse("<div <% if a %>hidden<% end %> class=\"x <% if b %>y<% end %>\"></div>")
         .children.get(0);

      final ErbControlFlowNode inTag = (ErbControlFlowNode) div.openTag.children.get(1);
      assertInstanceOf(AttributeNode.class, inTag.body.get(0));

      final AttributeNode attribute = (AttributeNode) div.openTag.children.get(3);
      final ErbControlFlowNode inValue = (ErbControlFlowNode) attribute.value.children.get(1);
      assertEquals("y", ((LiteralNode) inValue.body.get(0)).content);
   }

   @ParameterizedTest
   @ValueSource(strings = {
      "<div><p></div>",
      "<div>",
      "<div",
      "</div>",
      "<% if a %>x",
      "<% else %>",
      "<% for x in xs %><% elsif y %><% end %>",
      "<%= oops",
      "<!-- open",
      "<a href=\"x>",
   })
   void rejectsMalformedInput(final String source) {
      final IllegalStateException e = assertThrows(IllegalStateException.class, () -> Parser.parse(source));
      assertTrue(e.getMessage().contains("at offset"), e.getMessage());
   }
}

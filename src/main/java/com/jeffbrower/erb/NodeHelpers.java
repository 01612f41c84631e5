package com.jeffbrower.erb;

import com.jeffbrower.erb.ast.CommentNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.TextNode;
import com.jeffbrower.erb.ast.WhitespaceNode;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Stateless predicates over node shape. */
final class NodeHelpers {
   private static final Set<String> INLINE_ELEMENTS = Set.of(
      "a", "abbr", "acronym", "b", "bdo", "big", "br", "cite", "code", "dfn", "em", "hr", "i", "img", "kbd", "label", "map",
      "object", "q", "samp", "small", "span", "strong", "sub", "sup", "tt", "var", "del", "ins", "mark", "s", "u", "time", "wbr"
   );

   /** bodies of these are reproduced byte-for-byte */
   private static final Set<String> CONTENT_PRESERVING_ELEMENTS = Set.of("script", "style", "pre", "textarea");

   private static final Set<String> VOID_ELEMENTS = Set.of(
      "area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track", "wbr"
   );

   private static final Set<String> TOKEN_LIST_ATTRIBUTES = Set.of("class", "data-controller", "data-action");

   /** prefix of lint-suppression comments, which must stay on the line they annotate */
   static final String LINT_DIRECTIVE = "erblint:disable";

   private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\r\\f]+");

   private NodeHelpers() {
      throw new UnsupportedOperationException();
   }

   static boolean isInlineElement(final String tagName) {
      return INLINE_ELEMENTS.contains(tagName.toLowerCase(Locale.ROOT));
   }

   static boolean isContentPreserving(final String tagName) {
      return CONTENT_PRESERVING_ELEMENTS.contains(tagName.toLowerCase(Locale.ROOT));
   }

   static boolean isVoidElement(final String tagName) {
      return VOID_ELEMENTS.contains(tagName.toLowerCase(Locale.ROOT));
   }

   static boolean isTokenListAttribute(final String name) {
      return name != null && TOKEN_LIST_ATTRIBUTES.contains(name.toLowerCase(Locale.ROOT));
   }

   static boolean isInlineElement(final Node node) {
      return node instanceof ElementNode && isInlineElement(((ElementNode) node).tagName);
   }

   static boolean isWhitespaceOnly(final Node node) {
      if (node instanceof WhitespaceNode) {
         return true;
      }
      return node instanceof TextNode && ((TextNode) node).content.isBlank();
   }

   /** @return true for a single embedded Ruby tag, including comments */
   static boolean isDirectiveTag(final Node node) {
      return node instanceof ErbContentNode;
   }

   static boolean isControlFlowTag(final Node node) {
      return node instanceof ErbControlFlowNode;
   }

   static boolean isErbComment(final Node node) {
      return node instanceof ErbContentNode && ((ErbContentNode) node).isComment();
   }

   /** @return true for HTML and ERB comments */
   static boolean isComment(final Node node) {
      return node instanceof CommentNode || isErbComment(node);
   }

   static boolean isLintDirective(final Node node) {
      return isErbComment(node) && ((ErbContentNode) node).content.strip().startsWith(LINT_DIRECTIVE);
   }

   static boolean hasNonWhitespaceText(final Node node) {
      return node instanceof TextNode && !((TextNode) node).content.isBlank();
   }

   static boolean hasTextContent(final List<Node> children) {
      for (final Node child : children) {
         if (hasNonWhitespaceText(child)) {
            return true;
         }
      }
      return false;
   }

   /** @return true when the siblings hold non-whitespace text next to inline elements or embedded tags */
   static boolean mixedTextAndInline(final List<Node> children) {
      boolean text = false;
      boolean inline = false;
      for (final Node child : children) {
         if (hasNonWhitespaceText(child)) {
            text = true;
         } else if (isInlineElement(child) || isDirectiveTag(child)) {
            inline = true;
         }
      }
      return text && inline;
   }

   /** @return every non-whitespace child, recursively through inline elements, is text, an inline element or an ERB tag */
   static boolean allChildrenInline(final List<Node> children) {
      for (final Node child : children) {
         if (isWhitespaceOnly(child) || child instanceof TextNode) {
            continue;
         }
         if (isInlineElement(child)) {
            final ElementNode element = (ElementNode) child;
            if (isContentPreserving(element.tagName) || !allChildrenInline(element.body)) {
               return false;
            }
            continue;
         }
         if (isDirectiveTag(child) && !isMultilineComment((ErbContentNode) child)) {
            continue;
         }
         return false;
      }
      return true;
   }

   static boolean isMultilineComment(final ErbContentNode node) {
      return node.isComment() && node.content.strip().indexOf('\n') != -1;
   }

   /** @return the index of the closest earlier sibling that is not whitespace, or -1 */
   static int previousMeaningfulSibling(final List<Node> siblings, final int index) {
      for (int i = index - 1; i >= 0; i--) {
         if (!isWhitespaceOnly(siblings.get(i))) {
            return i;
         }
      }
      return -1;
   }

   static boolean spansMultipleLines(final Node node, final String source) {
      return source.substring(node.start, node.end).indexOf('\n') != -1;
   }

   /** @return true if the whitespace holds a blank line, meaning at least two line breaks */
   static boolean hasBlankLine(final String whitespace) {
      final int i = whitespace.indexOf('\n');
      return i != -1 && whitespace.indexOf('\n', i + 1) != -1;
   }

   /** Replace each run of whitespace with a single space. */
   static String collapseWhitespace(final String text) {
      return WHITESPACE.matcher(text).replaceAll(" ");
   }

   static String[] words(final String text) {
      final String stripped = text.strip();
      return stripped.isEmpty() ? new String[0] : WHITESPACE.split(stripped);
   }
}

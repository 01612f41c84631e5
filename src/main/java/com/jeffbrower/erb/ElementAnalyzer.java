package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.TextNode;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Decides, per element, whether its opening tag, content and closing tag stay on one line. Results are memoized for the
 * run, and {@code contentInline} is only ever true under an inline opening tag.
 */
final class ElementAnalyzer {
   private final FormatContext ctx;
   private final FormatPrinter printer;
   private final Set<ElementNode> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

   ElementAnalyzer(final FormatContext ctx, final FormatPrinter printer) {
      this.ctx = ctx;
      this.printer = printer;
   }

   ElementAnalysis analyze(final ElementNode element) {
      final ElementAnalysis memo = ctx.analyses.get(element);
      if (memo != null) {
         return memo;
      }
      if (!inProgress.add(element)) {
         // asked again while measuring itself
         log("analyze: re-entered <" + element.tagName + ">, rendering as block");
         return ElementAnalysis.BLOCK;
      }
      try {
         final ElementAnalysis analysis = compute(element);
         ctx.analyses.put(element, analysis);
         log(() -> "analyze: " + ctx.elementPath(element.tagName) + " " + analysis);
         return analysis;
      } finally {
         inProgress.remove(element);
      }
   }

   private ElementAnalysis compute(final ElementNode element) {
      if (NodeHelpers.isContentPreserving(element.tagName)) {
         return ElementAnalysis.BLOCK;
      }
      final boolean openTagInline = isOpenTagInline(element);
      if (element.isVoid()) {
         // nothing to put inline but the tag itself
         return new ElementAnalysis(openTagInline, openTagInline, openTagInline);
      }
      final boolean contentInline = openTagInline && isContentInline(element);
      return new ElementAnalysis(openTagInline, contentInline, contentInline);
   }

   boolean isOpenTagInline(final ElementNode element) {
      int attributes = 0;
      boolean tokenListOnly = true;
      for (final Node child : element.openTag.children) {
         if (NodeHelpers.isControlFlowTag(child)) {
            if (NodeHelpers.spansMultipleLines(child, ctx.source)) {
               return false;
            }
            tokenListOnly = false;
         } else if (child instanceof AttributeNode) {
            final AttributeNode attribute = (AttributeNode) child;
            attributes++;
            if (!NodeHelpers.isTokenListAttribute(attribute.name)) {
               tokenListOnly = false;
               if (hasMultilineLiteral(attribute)) {
                  return false;
               }
            }
         } else if (child instanceof ErbContentNode && !NodeHelpers.isLintDirective(child)) {
            attributes++;
            tokenListOnly = false;
         }
      }
      if (attributes == 0 || attributes == 1 && tokenListOnly) {
         // a lone class list wraps inside its own quotes instead
         return true;
      }
      return ctx.fits(printer.attributes.renderOpenTag(element.openTag, true));
   }

   private static boolean hasMultilineLiteral(final AttributeNode attribute) {
      if (attribute.value == null) {
         return false;
      }
      for (final Node part : attribute.value.children) {
         if (part instanceof LiteralNode && ((LiteralNode) part).content.indexOf('\n') != -1) {
            return true;
         }
      }
      return false;
   }

   boolean isContentInline(final ElementNode element) {
      boolean empty = true;
      for (final Node child : element.body) {
         if (!NodeHelpers.isWhitespaceOnly(child)) {
            empty = false;
            break;
         }
      }
      if (empty) {
         return true;
      }
      if (!NodeHelpers.allChildrenInline(element.body)) {
         return false;
      }
      if (!NodeHelpers.isInlineElement(element.tagName) && hasLineBreak(element)) {
         // authored line breaks keep a block element's content on its own lines
         return false;
      }
      // single text child, nested inline elements, or text mixed with inline content: all inline when the whole element fits
      return ctx.fits(printer.renderInline(element));
   }

   private static boolean hasLineBreak(final ElementNode element) {
      for (final Node child : element.body) {
         if (child instanceof TextNode && ((TextNode) child).content.indexOf('\n') != -1) {
            return true;
         }
      }
      return false;
   }
}

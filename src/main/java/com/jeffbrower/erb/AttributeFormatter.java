package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.AttributeValueNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.OpenTagNode;
import com.jeffbrower.erb.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.List;

/** Renders opening tags and their attributes, either on the tag's line or one attribute per line. */
final class AttributeFormatter {
   private final FormatContext ctx;
   private final FormatPrinter printer;
   /** set while an opening tag that is too long for its line is rendered on that line */
   private boolean tagOverflows;

   AttributeFormatter(final FormatContext ctx, final FormatPrinter printer) {
      this.ctx = ctx;
      this.printer = printer;
   }

   /**
    * The opening tag on one line, like {@code <a href="/" class="link">}. When measuring, class lists are never wrapped, so the
    * result is the length the tag would have if it were not broken up at all. Otherwise a class list wraps when the whole tag,
    * from its indent to the closing bracket, does not fit.
    */
   String renderOpenTag(final OpenTagNode tag, final boolean measuring) {
      if (ctx.inlineMode()) {
         return renderFlat(tag);
      }
      final String flat;
      try (final FormatContext.Capture capture = ctx.capture(true)) {
         flat = renderFlat(tag);
      }
      if (measuring || ctx.fits(flat)) {
         return flat;
      }
      log(() -> "renderOpenTag: <" + tag.tagName + "> is " + (ctx.indentColumns() + flat.length()) + " columns");
      tagOverflows = true;
      try {
         return renderFlat(tag);
      } finally {
         tagOverflows = false;
      }
   }

   private String renderFlat(final OpenTagNode tag) {
      return "<" + tag.tagName + renderAttributesInline(tag.children) + closing(tag);
   }

   /** {@code >}, or a space and {@code />} for a self-closed tag. */
   private static String closing(final OpenTagNode tag) {
      return tag.isSelfClosing() ? " />" : tag.closing;
   }

   /** Each attribute or tag preceded by one space; whitespace between them is dropped. */
   String renderAttributesInline(final List<Node> children) {
      final StringBuilder b = new StringBuilder();
      for (final Node child : children) {
         if (child instanceof WhitespaceNode) {
            continue;
         }
         b.append(' ').append(renderPart(child));
      }
      return b.toString();
   }

   private String renderPart(final Node child) {
      if (child instanceof AttributeNode) {
         return render((AttributeNode) child);
      }
      return printer.renderInline(child);
   }

   /**
    * The opening tag with one attribute per line, one level deeper than the tag:
    *
    * <pre>
    * &lt;input
    *   type="text"
    *   name="email"
    * &gt;
    * </pre>
    *
    * Lint directives stay on the first line, next to the tag name they refer to.
    */
   void renderExpanded(final OpenTagNode tag) {
      final StringBuilder first = new StringBuilder("<").append(tag.tagName);
      final List<Node> rest = new ArrayList<>();
      for (final Node child : tag.children) {
         if (NodeHelpers.isLintDirective(child)) {
            first.append(' ').append(printer.renderInline(child));
         } else if (!(child instanceof WhitespaceNode)) {
            rest.add(child);
         }
      }
      log(() -> "renderExpanded: " + tag.tagName + ", " + rest.size() + " parts");

      ctx.writeLine(first.toString());
      ctx.withIndent(() -> {
         for (final Node child : rest) {
            child.accept(printer);
         }
      });
      ctx.writeLine(tag.closing);
   }

   /** {@code name}, or {@code name="value"} with the value normalized; may span lines when a class list wraps. */
   String render(final AttributeNode attribute) {
      if (attribute.value == null) {
         return attribute.name;
      }
      final String[] rendered = new String[1];
      ctx.withAttribute(attribute.name, () -> rendered[0] = renderValue(attribute.name, attribute.value));
      return rendered[0];
   }

   String renderValue(final String name, final AttributeValueNode value) {
      final boolean tokenList = NodeHelpers.isTokenListAttribute(name);
      final StringBuilder b = new StringBuilder();
      for (final Node part : value.children) {
         if (part instanceof LiteralNode) {
            final String literal = ((LiteralNode) part).content;
            b.append(tokenList ? NodeHelpers.collapseWhitespace(literal) : literal);
         } else {
            b.append(printer.renderInline(part));
         }
      }
      final String content = tokenList ? b.toString().strip() : b.toString();
      final String quote = chooseQuote(value.openQuote, content);

      final String single = name + "=" + quote + content + quote;
      if (tokenList && !ctx.inlineMode() && !containsErb(value) && (tagOverflows || !ctx.fits(single))) {
         final String wrapped = wrapTokens(name, quote, content);
         if (wrapped != null) {
            return wrapped;
         }
      }
      return single;
   }

   /** Double quotes, unless the value itself holds one. */
   static String chooseQuote(final String original, final String content) {
      if (original.equals("\"")) {
         return original;
      }
      return content.indexOf('"') == -1 ? "\"" : original;
   }

   private static boolean containsErb(final AttributeValueNode value) {
      for (final Node part : value.children) {
         if (!(part instanceof LiteralNode)) {
            return true;
         }
      }
      return false;
   }

   /**
    * Break a token list into lines one level deeper than the attribute:
    *
    * <pre>
    * class="
    *   flex items-center
    *   justify-between
    * "
    * </pre>
    *
    * All tokens go on one line when they fit there, and a token too long for any line gets a line of its own.
    *
    * @return the wrapped attribute, or null if there are no tokens
    */
   String wrapTokens(final String name, final String quote, final String content) {
      final String tokenIndent = ctx.indent(ctx.indentLevel() + 1);
      final List<String> packed = new ArrayList<>();
      final StringBuilder line = new StringBuilder();
      for (final String token : NodeHelpers.words(content)) {
         if (line.length() == 0) {
            line.append(token);
         } else if (tokenIndent.length() + line.length() + 1 + token.length() <= ctx.options.maxLineLength) {
            line.append(' ').append(token);
         } else {
            packed.add(line.toString());
            line.setLength(0);
            line.append(token);
         }
      }
      if (line.length() > 0) {
         packed.add(line.toString());
      }
      if (packed.isEmpty()) {
         return null;
      }
      log(() -> "wrapTokens: " + name + " into " + packed.size() + " lines, " + stringify(content));

      final StringBuilder b = new StringBuilder(name).append('=').append(quote);
      for (final String packedLine : packed) {
         b.append('\n').append(tokenIndent).append(packedLine);
      }
      return b.append('\n').append(ctx.indent()).append(quote).toString();
   }
}

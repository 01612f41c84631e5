package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.CommentNode;
import com.jeffbrower.erb.ast.ErbClause;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.TextNode;
import com.jeffbrower.erb.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats embedded Ruby: the spacing inside single tags, comments, and control-flow constructs. Constructs inside an opening
 * tag or an attribute value are rendered in inline mode, on one line.
 */
final class ErbTagFormatter {
   private final FormatContext ctx;
   private final FormatPrinter printer;

   ErbTagFormatter(final FormatContext ctx, final FormatPrinter printer) {
      this.ctx = ctx;
      this.printer = printer;
   }

   /**
    * One space inside each delimiter: {@code <%=foo%>} becomes {@code <%= foo %>}. Empty tags lose their inner space, and a
    * heredoc keeps its terminator on a line of its own.
    */
   static String normalize(final ErbContentNode tag) {
      final String code = tag.content.strip();
      if (code.isEmpty()) {
         return tag.opening + tag.closing;
      }
      if (code.startsWith("<<")) {
         return tag.opening + " " + code + "\n" + tag.closing;
      }
      return tag.opening + " " + code + " " + tag.closing;
   }

   void print(final ErbContentNode tag) {
      if (tag.isComment()) {
         printComment(tag.opening, tag.content, tag.closing);
      } else {
         ctx.writeLine(normalize(tag));
      }
   }

   void printHtmlComment(final CommentNode comment) {
      if (comment.content.startsWith("[") || comment.content.startsWith(">")) {
         // conditional comments and other oddities are written as-is
         ctx.writeLine(ctx.identity.print(comment));
         return;
      }
      if (comment.content.isBlank()) {
         ctx.writeLine("<!-- -->");
         return;
      }
      printComment("<!--", comment.content, "-->");
   }

   /**
    * Single-line comments become {@code <%# text %>}. Longer ones are joined with spaces in inline mode, and otherwise put the
    * markers on lines of their own with the text dedented one level inside them.
    */
   private void printComment(final String opening, final String content, final String closing) {
      final List<String> lines = commentLines(content);
      if (lines.isEmpty()) {
         ctx.writeLine(opening + closing);
      } else if (lines.size() == 1) {
         ctx.writeLine(opening + " " + lines.get(0).strip() + " " + closing);
      } else if (ctx.inlineMode()) {
         final StringBuilder joined = new StringBuilder();
         for (final String line : lines) {
            if (!line.isBlank()) {
               joined.append(joined.length() == 0 ? "" : " ").append(line.strip());
            }
         }
         ctx.writeLine(opening + " " + joined + " " + closing);
      } else {
         ctx.writeLine(opening);
         ctx.withIndent(() -> {
            for (final String line : lines) {
               ctx.writeLine(line);
            }
         });
         ctx.writeLine(closing);
      }
   }

   /**
    * The comment's lines without the blank ones around them, dedented by their smallest common indentation. Text on the line of
    * the opening marker has no meaningful indentation, so it is only stripped.
    */
   static List<String> commentLines(final String content) {
      final String[] raw = content.split("\r?\n", -1);
      int first = 0;
      int last = raw.length - 1;
      while (first <= last && raw[first].isBlank()) {
         first++;
      }
      while (last >= first && raw[last].isBlank()) {
         last--;
      }

      int common = Integer.MAX_VALUE;
      for (int i = Math.max(first, 1); i <= last; i++) {
         if (!raw[i].isBlank()) {
            common = Math.min(common, leadingWhitespace(raw[i]));
         }
      }

      final List<String> lines = new ArrayList<>();
      for (int i = first; i <= last; i++) {
         final String line = raw[i].stripTrailing();
         if (i == 0 || line.isEmpty()) {
            lines.add(line.strip());
         } else {
            lines.add(line.substring(Math.min(common, leadingWhitespace(line))));
         }
      }
      return lines;
   }

   private static int leadingWhitespace(final String line) {
      int i = 0;
      while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
         i++;
      }
      return i;
   }

   // control flow

   /** The opening tag, each clause at the same indent, and their bodies one level deeper. */
   void printBlock(final ErbControlFlowNode node) {
      log(() -> "printBlock: " + node.kind + " at " + ctx.indentLevel());
      ctx.writeLine(normalize(node.openingTag));
      printBranch(node.body);
      for (final ErbClause clause : node.clauses) {
         ctx.writeLine(normalize(clause.tag));
         printBranch(clause.body);
      }
      ctx.writeLine(normalize(node.endTag));
   }

   private void printBranch(final List<Node> body) {
      ctx.withIndent(() -> {
         if (isAttributeBranch(body)) {
            // inside an expanded opening tag: one attribute per line
            for (final Node child : body) {
               if (!NodeHelpers.isWhitespaceOnly(child)) {
                  child.accept(printer);
               }
            }
         } else {
            printer.visitBody(body);
         }
      });
   }

   private static boolean isAttributeBranch(final List<Node> body) {
      for (final Node child : body) {
         if (child instanceof AttributeNode || child instanceof WhitespaceNode || child instanceof LiteralNode) {
            return true;
         }
      }
      return false;
   }

   /**
    * The whole construct on one line, for opening tags and attribute values:
    *
    * <pre>
    * &lt;div &lt;% if active %&gt; class="active" &lt;% end %&gt;&gt;
    * class="btn&lt;% if active %&gt; active &lt;% end %&gt;"
    * id="&lt;% if primary %&gt;main&lt;% end %&gt;"
    * </pre>
    *
    * Inside a token-list attribute, each part is separated by a space; elsewhere only attributes are.
    */
   String renderInline(final ErbControlFlowNode node) {
      final boolean tokenList = NodeHelpers.isTokenListAttribute(ctx.currentAttribute());
      final StringBuilder b = new StringBuilder(normalize(node.openingTag));
      renderInlineBranch(b, node.body, tokenList);
      for (final ErbClause clause : node.clauses) {
         b.append(normalize(clause.tag));
         renderInlineBranch(b, clause.body, tokenList);
      }
      return b.append(normalize(node.endTag)).toString();
   }

   private void renderInlineBranch(final StringBuilder b, final List<Node> body, final boolean tokenList) {
      boolean hasAttributes = false;
      for (final Node child : body) {
         if (child instanceof WhitespaceNode) {
            continue;
         }
         if (child instanceof AttributeNode) {
            b.append(' ').append(printer.attributes.render((AttributeNode) child));
            hasAttributes = true;
         } else if (child instanceof LiteralNode || child instanceof TextNode) {
            final String text = child instanceof LiteralNode ? ((LiteralNode) child).content : ((TextNode) child).content;
            if (!tokenList) {
               b.append(child instanceof TextNode ? NodeHelpers.collapseWhitespace(text) : text);
            } else if (!text.isBlank()) {
               b.append(' ').append(NodeHelpers.collapseWhitespace(text).strip());
            }
         } else {
            b.append(tokenList ? " " : "").append(printer.renderInline(child));
         }
      }
      if (hasAttributes || tokenList) {
         b.append(' ');
      }
   }
}

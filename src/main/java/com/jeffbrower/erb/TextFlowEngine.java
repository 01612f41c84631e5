package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;

import com.jeffbrower.erb.ast.DoctypeNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.ProcessingInstructionNode;
import com.jeffbrower.erb.ast.TextNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lays out a list of siblings: text and inline content is packed into lines as words, everything else takes lines of its
 * own, and blank lines are placed between the resulting segments.
 */
final class TextFlowEngine {
   private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\r\\f]+");
   private static final Pattern CLOSING_PUNCTUATION = Pattern.compile("[.,;:!?)\\]}]+");
   private static final Pattern OPENING_PUNCTUATION = Pattern.compile("[(\\[{]+");
   private static final Pattern SYMBOL = Pattern.compile("[$#@(\\[{]");

   private final FormatContext ctx;
   private final FormatPrinter printer;

   TextFlowEngine(final FormatContext ctx, final FormatPrinter printer) {
      this.ctx = ctx;
      this.printer = printer;
   }

   /** A word, or an inline fragment, waiting to be placed on a line. */
   static final class Token {
      final String text;
      /** whether whitespace separated it from the previous token in the source */
      final boolean spaceBefore;
      final boolean fromText;
      final boolean directive;
      final boolean nonWrappable;

      Token(final String text, final boolean spaceBefore, final boolean fromText, final boolean directive, final boolean nonWrappable) {
         this.text = text;
         this.spaceBefore = spaceBefore;
         this.fromText = fromText;
         this.directive = directive;
         this.nonWrappable = nonWrappable;
      }

      static Token word(final String text, final boolean spaceBefore) {
         return new Token(text, spaceBefore, true, false, false);
      }

      static Token fragment(final ContentUnit unit, final boolean spaceBefore) {
         return new Token(unit.content, spaceBefore, false, unit.node instanceof ErbContentNode, unit.nonWrappable);
      }
   }

   private static enum Segment {
      NONE,
      WORDS,
      BLOCK
   }

   /** Print the siblings as a block body at the current indent. */
   void flow(final List<Node> children) {
      new Run(children).print();
   }

   /**
    * The siblings on a single line: text whitespace collapsed and trimmed at both ends, and tokens joined by the same rules as
    * wrapped text, so that content reads the same whether or not it was wrapped.
    */
   String joinInline(final List<Node> children) {
      final List<Token> tokens = new ArrayList<>();
      boolean space = false;
      for (final Node child : children) {
         if (child instanceof TextNode) {
            space = addWords(((TextNode) child).content, space, tokens);
         } else {
            tokens.add(new Token(printer.renderInline(child), space, false, child instanceof ErbContentNode, false));
            space = false;
         }
      }
      return String.join(" ", wrap(tokens, Integer.MAX_VALUE));
   }

   /** @return whether whitespace is pending after the text */
   private static boolean addWords(final String text, final boolean spaceBefore, final List<Token> into) {
      boolean space = spaceBefore;
      final Matcher m = WHITESPACE.matcher(text);
      int i = 0;
      while (m.find()) {
         if (m.start() > i) {
            into.add(Token.word(text.substring(i, m.start()), space));
         }
         space = true;
         i = m.end();
      }
      if (i < text.length()) {
         into.add(Token.word(text.substring(i), space));
         space = false;
      }
      return space;
   }

   /**
    * Classify each sibling. Without text among the siblings, each one takes its own lines unless it touches a neighbor with no
    * whitespace between them; inline elements only count as inline when they fit on a line by themselves.
    */
   List<ContentUnit> units(final List<Node> children) {
      final boolean mixed = NodeHelpers.mixedTextAndInline(children);
      final List<ContentUnit> units = new ArrayList<>();
      for (int i = 0; i < children.size(); i++) {
         final Node child = children.get(i);
         if (child instanceof TextNode) {
            units.add(ContentUnit.text(child, ((TextNode) child).content));
         } else if ((mixed || isGlued(children, i)) && isInlineUnit(child)) {
            units.add(ContentUnit.inline(child, printer.renderInline(child), NodeHelpers.isLintDirective(child)));
         } else {
            units.add(ContentUnit.block(child));
         }
      }
      return units;
   }

   /** @return true if the sibling touches an inline element or embedded tag with no whitespace between them */
   private static boolean isGlued(final List<Node> children, final int i) {
      return i > 0 && isInlineCandidate(children.get(i - 1)) || i + 1 < children.size() && isInlineCandidate(children.get(i + 1));
   }

   private static boolean isInlineCandidate(final Node node) {
      return node instanceof ErbContentNode || NodeHelpers.isInlineElement(node);
   }

   private boolean isInlineUnit(final Node node) {
      if (node instanceof ErbContentNode) {
         return !NodeHelpers.isMultilineComment((ErbContentNode) node);
      }
      if (NodeHelpers.isInlineElement(node)) {
         return printer.analyzer.analyze((ElementNode) node).isFullyInline();
      }
      return false;
   }

   /**
    * Whether two adjacent tokens are joined with a space. Tokens written without whitespace between them stay glued, and a
    * space is dropped before closing punctuation, after opening punctuation, and between a lone symbol and a following tag.
    */
   static boolean needsSpaceBetween(final Token previous, final Token next) {
      if (!next.spaceBefore) {
         return false;
      }
      if (next.fromText && CLOSING_PUNCTUATION.matcher(next.text).matches()) {
         return false;
      }
      if (previous.fromText && OPENING_PUNCTUATION.matcher(previous.text).matches()) {
         return false;
      }
      if (previous.fromText && next.directive && SYMBOL.matcher(previous.text).matches()) {
         return false;
      }
      return true;
   }

   /** Greedily pack tokens into lines no wider than the budget. Glued tokens are never split, and non-wrappable ones never start a line. */
   static List<String> wrap(final List<Token> tokens, final int budget) {
      // join glued tokens into chunks first
      final List<StringBuilder> chunks = new ArrayList<>();
      final List<Boolean> nonWrappable = new ArrayList<>();
      Token previous = null;
      for (final Token token : tokens) {
         if (previous == null || needsSpaceBetween(previous, token)) {
            chunks.add(new StringBuilder(token.text));
            nonWrappable.add(token.nonWrappable);
         } else {
            chunks.get(chunks.size() - 1).append(token.text);
         }
         previous = token;
      }

      final List<String> lines = new ArrayList<>();
      final StringBuilder line = new StringBuilder();
      for (int i = 0; i < chunks.size(); i++) {
         final StringBuilder chunk = chunks.get(i);
         if (line.length() == 0) {
            line.append(chunk);
         } else if (line.length() + 1 + chunk.length() <= budget || nonWrappable.get(i)) {
            line.append(' ').append(chunk);
         } else {
            lines.add(line.toString());
            line.setLength(0);
            line.append(chunk);
         }
      }
      if (line.length() > 0) {
         lines.add(line.toString());
      }
      return lines;
   }

   /**
    * Whether to put a blank line between two block siblings that the author did not separate with one. Never between
    * comments; after a comment only when both sides take several lines; otherwise when either side does.
    */
   boolean shouldAddSpacing(final Node previous, final Node current) {
      if (previous instanceof DoctypeNode || previous instanceof ProcessingInstructionNode) {
         return true;
      }
      final boolean previousComment = NodeHelpers.isComment(previous);
      if (previousComment && NodeHelpers.isComment(current)) {
         return false;
      }
      if (previousComment) {
         return ctx.isMultiline(previous) && ctx.isMultiline(current);
      }
      return ctx.isMultiline(previous) || ctx.isMultiline(current);
   }

   /** Layout state for one list of siblings. */
   private final class Run {
      private final List<Node> children;
      /** spacing heuristics only apply between blocks when no text sits among them */
      private final boolean blockSiblings;
      private final List<Token> pending = new ArrayList<>();
      private Segment previous = Segment.NONE;
      private boolean spacePending;
      private boolean blankLinePending;

      Run(final List<Node> children) {
         this.children = children;
         this.blockSiblings = !NodeHelpers.hasTextContent(children);
      }

      void print() {
         final List<ContentUnit> units = units(children);
         for (int i = 0; i < units.size(); i++) {
            final ContentUnit unit = units.get(i);
            if (unit.breaksFlow) {
               flushWords();
               printBlock(unit.node, i);
            } else if (unit.atomic) {
               pending.add(Token.fragment(unit, spacePending));
            } else {
               addText(unit.content);
               continue;
            }
            spacePending = false;
         }
         flushWords();
      }

      private void addText(final String text) {
         final Matcher m = WHITESPACE.matcher(text);
         int i = 0;
         while (m.find()) {
            if (m.start() > i) {
               pending.add(Token.word(text.substring(i, m.start()), spacePending));
            }
            if (NodeHelpers.hasBlankLine(m.group())) {
               // an authored blank line ends the paragraph
               flushWords();
               blankLinePending = true;
            }
            spacePending = true;
            i = m.end();
         }
         if (i < text.length()) {
            pending.add(Token.word(text.substring(i), spacePending));
            spacePending = false;
         }
      }

      private void flushWords() {
         if (pending.isEmpty()) {
            return;
         }
         final List<String> lines = wrap(pending, ctx.lineBudget());
         log(() -> "flushWords: " + pending.size() + " tokens into " + lines.size() + " lines, first " + stringify(lines.get(0)));
         pending.clear();
         startSegment(null, null);
         for (final String line : lines) {
            ctx.writeLine(line);
         }
         previous = Segment.WORDS;
      }

      private void printBlock(final Node node, final int index) {
         final List<String> rendered = printer.renderBlock(node);
         final int p = NodeHelpers.previousMeaningfulSibling(children, index);
         startSegment(p == -1 ? null : children.get(p), node);
         ctx.addAll(rendered);
         previous = Segment.BLOCK;
      }

      /** @param sibling the closest non-whitespace sibling before the block, which is the previous block when no words came between */
      private void startSegment(final Node sibling, final Node block) {
         if (previous != Segment.NONE) {
            if (blankLinePending) {
               ctx.blankLine();
            } else if (previous == Segment.BLOCK && block != null && blockSiblings && shouldAddSpacing(sibling, block)) {
               log(() -> "spacing: between " + sibling + " and " + block);
               ctx.blankLine();
            }
         }
         blankLinePending = false;
      }
   }
}

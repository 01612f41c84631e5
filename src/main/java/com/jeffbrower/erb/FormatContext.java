package com.jeffbrower.erb;

import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * State of one formatting run: the options and source it was started with, plus the cursor the printer moves through the
 * output. Not shared between runs.
 */
final class FormatContext {
   final FormatOptions options;
   final String source;
   final IdentityPrinter identity;

   /** element analyses, by node identity */
   final Map<ElementNode, ElementAnalysis> analyses = new IdentityHashMap<>();

   /** whether a node rendered on more than one line, by node identity */
   private final Map<Node, Boolean> multiline = new IdentityHashMap<>();

   /** names of the elements being printed, innermost first */
   private final Deque<String> elementStack = new ArrayDeque<>();

   private List<String> lines = new ArrayList<>();
   private int indentLevel;
   private boolean inlineMode;
   private String currentAttribute;

   FormatContext(final FormatOptions options, final String source) {
      this.options = options;
      this.source = source;
      this.identity = new IdentityPrinter(source);
   }

   // indentation

   int indentLevel() {
      return indentLevel;
   }

   int indentColumns() {
      return indentLevel * options.indentWidth;
   }

   String indent() {
      return indent(indentLevel);
   }

   String indent(final int level) {
      return " ".repeat(level * options.indentWidth);
   }

   /** Columns left on a line at the current indent. */
   int lineBudget() {
      return options.maxLineLength - indentColumns();
   }

   boolean fits(final String rendered) {
      return rendered.indexOf('\n') == -1 && indentColumns() + rendered.length() <= options.maxLineLength;
   }

   void withIndent(final Runnable r) {
      indentLevel++;
      try {
         r.run();
      } finally {
         indentLevel--;
      }
   }

   // modes

   boolean inlineMode() {
      return inlineMode;
   }

   String currentAttribute() {
      return currentAttribute;
   }

   void withAttribute(final String name, final Runnable r) {
      final String saved = currentAttribute;
      currentAttribute = name;
      try {
         r.run();
      } finally {
         currentAttribute = saved;
      }
   }

   void withElement(final String tagName, final Runnable r) {
      elementStack.push(tagName);
      try {
         r.run();
      } finally {
         elementStack.pop();
      }
   }

   /** The open elements, outermost first, like {@code html > body > div}. */
   String elementPath() {
      final StringBuilder b = new StringBuilder();
      final Iterator<String> it = elementStack.descendingIterator();
      while (it.hasNext()) {
         if (b.length() > 0) {
            b.append(" > ");
         }
         b.append(it.next());
      }
      return b.toString();
   }

   /** The open elements followed by one more, for an element looked at before it is entered. */
   String elementPath(final String tagName) {
      final String path = elementPath();
      return path.isEmpty() ? tagName : path + " > " + tagName;
   }

   // output

   int lineCount() {
      return lines.size();
   }

   /** Start a new indented line, or in inline mode, continue the current one. */
   void writeLine(final String text) {
      if (inlineMode) {
         append(text);
      } else {
         lines.add(indent() + text);
      }
   }

   /** Continue the current line. */
   void append(final String text) {
      if (lines.isEmpty()) {
         lines.add(text);
      } else {
         final int last = lines.size() - 1;
         lines.set(last, lines.get(last) + text);
      }
   }

   /** Add already-indented lines, usually from a {@link Capture}. */
   void addAll(final List<String> captured) {
      lines.addAll(captured);
   }

   void blankLine() {
      if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
         lines.add("");
      }
   }

   /** @return true if the lines written since {@code fromLine} span more than one output line */
   boolean wroteMultipleLines(final int fromLine) {
      if (lines.size() - fromLine > 1) {
         return true;
      }
      for (int i = Math.max(0, fromLine); i < lines.size(); i++) {
         if (lines.get(i).indexOf('\n') != -1) {
            return true;
         }
      }
      return false;
   }

   void markMultiline(final Node node, final boolean value) {
      multiline.put(node, value);
   }

   /** Nodes that were never tracked count as single-line. */
   boolean isMultiline(final Node node) {
      return multiline.getOrDefault(node, false);
   }

   Capture capture(final boolean inline) {
      return new Capture(inline);
   }

   /**
    * The finished document: blank lines at either end dropped, runs of blank lines squeezed to one, trailing whitespace
    * removed, and every line terminated with the configured line ending.
    */
   String output() {
      final String eol = options.endOfLine.string;
      final List<String> out = new ArrayList<>();
      boolean previousBlank = true;
      for (final String entry : lines) {
         String line = entry.indexOf('\n') == -1 ? entry.stripTrailing() : entry;
         if (line.isEmpty()) {
            if (!previousBlank) {
               out.add(line);
            }
            previousBlank = true;
            continue;
         }
         if (!eol.equals("\n")) {
            line = line.replace("\r\n", "\n").replace("\n", eol);
         }
         out.add(line);
         previousBlank = false;
      }
      while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
         out.remove(out.size() - 1);
      }
      return out.isEmpty() ? "" : String.join(eol, out) + eol;
   }

   /**
    * Redirects output into a fresh buffer until closed, so a sub-render can be measured or placed later. Closing restores the
    * previous buffer, indent and modes however the render exits.
    */
   final class Capture implements AutoCloseable {
      private final List<String> savedLines = lines;
      private final int savedIndent = indentLevel;
      private final boolean savedInline = inlineMode;
      private final List<String> captured = new ArrayList<>();

      private Capture(final boolean inline) {
         lines = captured;
         inlineMode = inline;
      }

      List<String> lines() {
         return captured;
      }

      String text() {
         return String.join("\n", captured);
      }

      @Override
      public void close() {
         lines = savedLines;
         indentLevel = savedIndent;
         inlineMode = savedInline;
      }
   }
}

package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.AttributeValueNode;
import com.jeffbrower.erb.ast.CdataNode;
import com.jeffbrower.erb.ast.CloseTagNode;
import com.jeffbrower.erb.ast.CommentNode;
import com.jeffbrower.erb.ast.DoctypeNode;
import com.jeffbrower.erb.ast.DocumentNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.NodeVisitor;
import com.jeffbrower.erb.ast.OpenTagNode;
import com.jeffbrower.erb.ast.ProcessingInstructionNode;
import com.jeffbrower.erb.ast.TextNode;
import com.jeffbrower.erb.ast.WhitespaceNode;
import java.util.List;

/**
 * Walks the tree and writes the formatted document. In block mode every node starts on its own line at the current indent;
 * in inline mode (used for measuring, and for content that fits on one line) everything continues the current line.
 */
final class FormatPrinter implements NodeVisitor {
   final FormatContext ctx;
   final ElementAnalyzer analyzer;
   final AttributeFormatter attributes;
   final TextFlowEngine textFlow;
   final ErbTagFormatter erb;

   FormatPrinter(final FormatContext ctx) {
      this.ctx = ctx;
      this.analyzer = new ElementAnalyzer(ctx, this);
      this.attributes = new AttributeFormatter(ctx, this);
      this.textFlow = new TextFlowEngine(ctx, this);
      this.erb = new ErbTagFormatter(ctx, this);
   }

   static String format(final DocumentNode document, final String source, final FormatOptions options) {
      log("format: " + options);
      final FormatPrinter printer = new FormatPrinter(new FormatContext(options, source));
      document.accept(printer);
      return printer.ctx.output();
   }

   // rendering into isolated buffers

   /** The node rendered on one line, without touching the output. */
   String renderInline(final Node node) {
      try (final FormatContext.Capture capture = ctx.capture(true)) {
         node.accept(this);
         return capture.text();
      }
   }

   /** The node rendered as indented lines at the current indent, recording whether it took more than one. */
   List<String> renderBlock(final Node node) {
      try (final FormatContext.Capture capture = ctx.capture(false)) {
         trackBoundary(node, () -> node.accept(this));
         return capture.lines();
      }
   }

   void trackBoundary(final Node node, final Runnable render) {
      final int before = ctx.lineCount();
      render.run();
      ctx.markMultiline(node, ctx.wroteMultipleLines(before));
   }

   /** Lay out the children of a block: a document, an element body, or a branch of a control-flow construct. */
   void visitBody(final List<Node> children) {
      textFlow.flow(children);
   }

   // visitor

   @Override
   public void visitDocument(final DocumentNode node) {
      visitBody(node.children);
   }

   @Override
   public void visitElement(final ElementNode node) {
      if (ctx.inlineMode()) {
         ctx.withElement(node.tagName, () -> printInline(node));
      } else {
         // analyzed from the enclosing element, as when a sibling run classifies it
         final ElementAnalysis analysis = analyzer.analyze(node);
         ctx.withElement(node.tagName, () -> printBlock(node, analysis));
      }
   }

   private void printBlock(final ElementNode node, final ElementAnalysis analysis) {
      log(() -> "printBlock: <" + node.tagName + "> " + analysis);

      if (NodeHelpers.isContentPreserving(node.tagName)) {
         ctx.writeLine(attributes.renderOpenTag(node.openTag, false) + ctx.identity.print(node.body) + closeTag(node));
         return;
      }

      if (analysis.openTagInline) {
         ctx.writeLine(attributes.renderOpenTag(node.openTag, false));
      } else {
         attributes.renderExpanded(node.openTag);
      }
      if (node.isVoid()) {
         return;
      }

      if (analysis.contentInline) {
         ctx.append(renderInlineBody(node.body));
         ctx.append(closeTag(node));
      } else {
         ctx.withIndent(() -> visitBody(node.body));
         ctx.writeLine(closeTag(node));
      }
   }

   private void printInline(final ElementNode node) {
      ctx.append(attributes.renderOpenTag(node.openTag, false));
      if (node.isVoid()) {
         return;
      }
      if (NodeHelpers.isContentPreserving(node.tagName)) {
         ctx.append(ctx.identity.print(node.body));
      } else {
         ctx.append(renderInlineBody(node.body));
      }
      ctx.append(closeTag(node));
   }

   /** The children on one line, spaced the way wrapped text is. */
   private String renderInlineBody(final List<Node> body) {
      return textFlow.joinInline(body);
   }

   private static String closeTag(final ElementNode node) {
      return "</" + node.closeTag.tagName + ">";
   }

   @Override
   public void visitOpenTag(final OpenTagNode node) {
      ctx.writeLine(attributes.renderOpenTag(node, false));
   }

   @Override
   public void visitCloseTag(final CloseTagNode node) {
      ctx.writeLine("</" + node.tagName + ">");
   }

   @Override
   public void visitAttribute(final AttributeNode node) {
      ctx.writeLine(attributes.render(node));
   }

   @Override
   public void visitAttributeValue(final AttributeValueNode node) {
      ctx.writeLine(attributes.renderValue(ctx.currentAttribute(), node));
   }

   @Override
   public void visitText(final TextNode node) {
      if (ctx.inlineMode()) {
         ctx.append(NodeHelpers.collapseWhitespace(node.content));
      } else {
         textFlow.flow(List.of(node));
      }
   }

   @Override
   public void visitLiteral(final LiteralNode node) {
      if (ctx.inlineMode()) {
         ctx.append(node.content);
      } else if (!node.content.isBlank()) {
         ctx.writeLine(node.content.strip());
      }
   }

   @Override
   public void visitWhitespace(final WhitespaceNode node) {
      // opening tags separate their parts with exactly one space
   }

   @Override
   public void visitComment(final CommentNode node) {
      erb.printHtmlComment(node);
   }

   @Override
   public void visitDoctype(final DoctypeNode node) {
      ctx.writeLine(NodeHelpers.collapseWhitespace(node.content));
   }

   @Override
   public void visitCdata(final CdataNode node) {
      ctx.writeLine(ctx.identity.print(node));
   }

   @Override
   public void visitProcessingInstruction(final ProcessingInstructionNode node) {
      ctx.writeLine(ctx.identity.print(node));
   }

   @Override
   public void visitErbContent(final ErbContentNode node) {
      log(() -> "visitErbContent: " + stringify(node.content));
      erb.print(node);
   }

   @Override
   public void visitErbControlFlow(final ErbControlFlowNode node) {
      if (ctx.inlineMode()) {
         ctx.append(erb.renderInline(node));
      } else {
         erb.printBlock(node);
      }
   }
}

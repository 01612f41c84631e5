package com.jeffbrower.erb;

import com.jeffbrower.erb.ast.Node;

/** One piece of a sibling run, as seen by the {@link TextFlowEngine}. Built fresh for every run. */
final class ContentUnit {
   static enum Kind {
      /** raw text, split into words when flowed */
      TEXT,
      /** an already rendered fragment that moves as one word */
      INLINE,
      /** a node that takes whole lines of its own */
      BLOCK
   }

   final Kind kind;
   /** raw text for TEXT, the rendering for INLINE, unused for BLOCK */
   final String content;
   final boolean atomic;
   final boolean breaksFlow;
   final boolean nonWrappable;
   final Node node;

   private ContentUnit(
      final Kind kind,
      final String content,
      final boolean atomic,
      final boolean breaksFlow,
      final boolean nonWrappable,
      final Node node
   ) {
      this.kind = kind;
      this.content = content;
      this.atomic = atomic;
      this.breaksFlow = breaksFlow;
      this.nonWrappable = nonWrappable;
      this.node = node;
   }

   static ContentUnit text(final Node node, final String content) {
      return new ContentUnit(Kind.TEXT, content, false, false, false, node);
   }

   static ContentUnit inline(final Node node, final String rendered, final boolean nonWrappable) {
      return new ContentUnit(Kind.INLINE, rendered, true, false, nonWrappable, node);
   }

   static ContentUnit block(final Node node) {
      return new ContentUnit(Kind.BLOCK, "", true, true, false, node);
   }

   @Override
   public String toString() {
      return kind + (kind == Kind.BLOCK ? "(" + node + ")" : "(" + Logger.stringify(content) + ")");
   }
}

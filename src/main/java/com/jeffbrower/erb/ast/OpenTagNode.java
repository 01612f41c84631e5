package com.jeffbrower.erb.ast;

import java.util.List;

/**
 * The opening tag of an element. Children are {@link AttributeNode}, {@link WhitespaceNode}, {@link ErbContentNode} and
 * {@link ErbControlFlowNode} in source order.
 */
public final class OpenTagNode extends Node {
   public final String tagName;
   public final List<Node> children;
   /** either {@code ">"} or {@code "/>"} */
   public final String closing;

   public OpenTagNode(final int start, final int end, final String tagName, final List<Node> children, final String closing) {
      super(start, end);
      this.tagName = tagName;
      this.children = List.copyOf(children);
      this.closing = closing;
   }

   public boolean isSelfClosing() {
      return closing.equals("/>");
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitOpenTag(this);
   }
}

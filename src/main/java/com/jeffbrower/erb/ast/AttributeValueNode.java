package com.jeffbrower.erb.ast;

import java.util.List;

/**
 * The value of an attribute. The quotes are {@code "\""}, {@code "'"}, or empty for unquoted values. Children are
 * {@link LiteralNode}, {@link ErbContentNode} and {@link ErbControlFlowNode}.
 */
public final class AttributeValueNode extends Node {
   public final String openQuote;
   public final List<Node> children;
   public final String closeQuote;

   public AttributeValueNode(
      final int start,
      final int end,
      final String openQuote,
      final List<Node> children,
      final String closeQuote
   ) {
      super(start, end);
      this.openQuote = openQuote;
      this.children = List.copyOf(children);
      this.closeQuote = closeQuote;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitAttributeValue(this);
   }
}

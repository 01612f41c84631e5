package com.jeffbrower.erb.ast;

/** Literal text inside an attribute value. */
public final class LiteralNode extends Node {
   public final String content;

   public LiteralNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitLiteral(this);
   }
}

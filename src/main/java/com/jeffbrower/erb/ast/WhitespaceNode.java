package com.jeffbrower.erb.ast;

/** Whitespace between the parts of an opening tag. */
public final class WhitespaceNode extends Node {
   public final String value;

   public WhitespaceNode(final int start, final int end, final String value) {
      super(start, end);
      this.value = value;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitWhitespace(this);
   }
}

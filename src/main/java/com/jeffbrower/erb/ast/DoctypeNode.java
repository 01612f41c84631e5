package com.jeffbrower.erb.ast;

/** A document type declaration, as written. */
public final class DoctypeNode extends Node {
   public final String content;

   public DoctypeNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitDoctype(this);
   }
}

package com.jeffbrower.erb.ast;

public final class CloseTagNode extends Node {
   public final String tagName;

   public CloseTagNode(final int start, final int end, final String tagName) {
      super(start, end);
      this.tagName = tagName;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitCloseTag(this);
   }
}

package com.jeffbrower.erb.ast;

/** Body text, with its original whitespace. */
public final class TextNode extends Node {
   public final String content;

   public TextNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitText(this);
   }
}

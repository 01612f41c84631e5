package com.jeffbrower.erb.ast;

/** An HTML comment; {@code content} excludes the {@code <!--} and {@code -->} markers. */
public final class CommentNode extends Node {
   public final String content;

   public CommentNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitComment(this);
   }
}

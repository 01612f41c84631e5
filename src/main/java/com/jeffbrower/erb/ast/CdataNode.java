package com.jeffbrower.erb.ast;

/** A CDATA section, as written. */
public final class CdataNode extends Node {
   public final String content;

   public CdataNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitCdata(this);
   }
}

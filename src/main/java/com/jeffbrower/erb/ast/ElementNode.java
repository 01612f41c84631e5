package com.jeffbrower.erb.ast;

import java.util.List;

/** A markup element. Void and self-closed elements have an empty body and no close tag. */
public final class ElementNode extends Node {
   public final String tagName;
   public final OpenTagNode openTag;
   public final List<Node> body;
   /** null for void and self-closed elements */
   public final CloseTagNode closeTag;

   public ElementNode(
      final int start,
      final int end,
      final OpenTagNode openTag,
      final List<Node> body,
      final CloseTagNode closeTag
   ) {
      super(start, end);
      this.tagName = openTag.tagName;
      this.openTag = openTag;
      this.body = List.copyOf(body);
      this.closeTag = closeTag;
   }

   public boolean isVoid() {
      return closeTag == null;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitElement(this);
   }
}

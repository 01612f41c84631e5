package com.jeffbrower.erb.ast;

import java.util.List;

public final class DocumentNode extends Node {
   public final List<Node> children;

   public DocumentNode(final int start, final int end, final List<Node> children) {
      super(start, end);
      this.children = List.copyOf(children);
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitDocument(this);
   }
}

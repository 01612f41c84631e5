package com.jeffbrower.erb.ast;

public final class AttributeNode extends Node {
   public final String name;
   /** null for boolean attributes like {@code disabled} */
   public final AttributeValueNode value;

   public AttributeNode(final int start, final int end, final String name, final AttributeValueNode value) {
      super(start, end);
      this.name = name;
      this.value = value;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitAttribute(this);
   }
}

package com.jeffbrower.erb.ast;

/** A processing instruction or XML declaration, as written. */
public final class ProcessingInstructionNode extends Node {
   public final String content;

   public ProcessingInstructionNode(final int start, final int end, final String content) {
      super(start, end);
      this.content = content;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitProcessingInstruction(this);
   }
}

package com.jeffbrower.erb.ast;

/**
 * A node of a parsed template. Nodes are read-only; {@link #start} and {@link #end} are half-open offsets into the source the
 * tree was parsed from, and a node's span always lies within its parent's span.
 */
public abstract class Node {
   public final int start;
   public final int end;

   protected Node(final int start, final int end) {
      if (start < 0 || end < start) {
         throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
      }
      this.start = start;
      this.end = end;
   }

   public abstract void accept(NodeVisitor visitor);

   @Override
   public String toString() {
      return getClass().getSimpleName() + "[" + start + ".." + end + "]";
   }
}

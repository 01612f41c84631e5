package com.jeffbrower.erb.ast;

import java.util.List;

/**
 * A group of embedded Ruby tags forming one construct: the opening tag, its body, any secondary clauses, and the terminating
 * {@code end} (or closing brace) tag. The span runs from the opening tag to the end of the terminator.
 */
public final class ErbControlFlowNode extends Node {
   public static enum Kind {
      /** if / unless */
      CONDITIONAL,
      /** case / when / in */
      CASE,
      /** for / while / until */
      LOOP,
      /** a method call with a do or brace block */
      BLOCK,
      /** begin / rescue / ensure */
      BEGIN
   }

   public final Kind kind;
   public final ErbContentNode openingTag;
   public final List<Node> body;
   public final List<ErbClause> clauses;
   public final ErbContentNode endTag;

   public ErbControlFlowNode(
      final Kind kind,
      final ErbContentNode openingTag,
      final List<Node> body,
      final List<ErbClause> clauses,
      final ErbContentNode endTag
   ) {
      super(openingTag.start, endTag.end);
      this.kind = kind;
      this.openingTag = openingTag;
      this.body = List.copyOf(body);
      this.clauses = List.copyOf(clauses);
      this.endTag = endTag;
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitErbControlFlow(this);
   }
}

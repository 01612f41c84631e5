package com.jeffbrower.erb.ast;

import java.util.List;

/** A secondary branch of a control-flow construct ({@code elsif}, {@code else}, {@code when}, {@code rescue}, ...). */
public final class ErbClause {
   public final ErbContentNode tag;
   public final List<Node> body;

   public ErbClause(final ErbContentNode tag, final List<Node> body) {
      this.tag = tag;
      this.body = List.copyOf(body);
   }
}

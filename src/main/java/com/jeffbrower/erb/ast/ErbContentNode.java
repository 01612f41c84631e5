package com.jeffbrower.erb.ast;

/**
 * A single embedded Ruby tag, like {@code <%= user.name %>}. The opening is one of {@code <%}, {@code <%-}, {@code <%=},
 * {@code <%==} or {@code <%#}; the closing is {@code %>} or {@code -%>}. The content is everything in between, untrimmed.
 */
public final class ErbContentNode extends Node {
   public final String opening;
   public final String content;
   public final String closing;

   public ErbContentNode(final int start, final int end, final String opening, final String content, final String closing) {
      super(start, end);
      this.opening = opening;
      this.content = content;
      this.closing = closing;
   }

   public boolean isComment() {
      return opening.equals("<%#");
   }

   @Override
   public void accept(final NodeVisitor visitor) {
      visitor.visitErbContent(this);
   }
}

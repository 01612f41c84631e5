package com.jeffbrower.erb;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.DocumentNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbClause;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.Node;
import java.util.List;

/** Finds the {@code <%# erb-formatter ignore %>} comment that opts a whole file out of formatting. */
public class FormatIgnore {
   public static final String DIRECTIVE = "erb-formatter ignore";

   private FormatIgnore() {
      throw new UnsupportedOperationException();
   }

   public static boolean shouldSkip(final DocumentNode document) {
      return containsDirective(document.children);
   }

   private static boolean containsDirective(final List<Node> nodes) {
      for (final Node node : nodes) {
         if (isDirective(node)) {
            return true;
         }
         if (node instanceof ElementNode) {
            final ElementNode element = (ElementNode) node;
            if (containsDirective(element.openTag.children) || containsDirective(element.body)) {
               return true;
            }
         } else if (node instanceof AttributeNode) {
            final AttributeNode attribute = (AttributeNode) node;
            if (attribute.value != null && containsDirective(attribute.value.children)) {
               return true;
            }
         } else if (node instanceof ErbControlFlowNode) {
            final ErbControlFlowNode flow = (ErbControlFlowNode) node;
            if (containsDirective(flow.body)) {
               return true;
            }
            for (final ErbClause clause : flow.clauses) {
               if (containsDirective(clause.body)) {
                  return true;
               }
            }
         }
      }
      return false;
   }

   private static boolean isDirective(final Node node) {
      return node instanceof ErbContentNode
         && ((ErbContentNode) node).isComment()
         && ((ErbContentNode) node).content.strip().equals(DIRECTIVE);
   }
}

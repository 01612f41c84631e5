package com.jeffbrower.erb;

import com.jeffbrower.erb.ast.Node;
import java.util.List;

/** Reproduces nodes exactly as they were written, from their source spans. */
class IdentityPrinter {
   private final String source;

   IdentityPrinter(final String source) {
      this.source = source;
   }

   String print(final Node node) {
      return source.substring(node.start, node.end);
   }

   String print(final List<? extends Node> nodes) {
      if (nodes.isEmpty()) {
         return "";
      }
      // siblings are contiguous, so the whole run is one slice
      return source.substring(nodes.get(0).start, nodes.get(nodes.size() - 1).end);
   }
}

package com.jeffbrower.erb;

/** How one element renders: which of its parts stay on the line they start on. */
final class ElementAnalysis {
   /** everything on its own lines, used whenever the shape of an element is in doubt */
   static final ElementAnalysis BLOCK = new ElementAnalysis(false, false, false);

   final boolean openTagInline;
   final boolean contentInline;
   final boolean closeTagInline;

   ElementAnalysis(final boolean openTagInline, final boolean contentInline, final boolean closeTagInline) {
      if (contentInline && !openTagInline) {
         throw new IllegalArgumentException("Content cannot be inline under an expanded opening tag");
      }
      this.openTagInline = openTagInline;
      this.contentInline = contentInline;
      this.closeTagInline = closeTagInline;
   }

   boolean isFullyInline() {
      return openTagInline && contentInline && closeTagInline;
   }

   @Override
   public String toString() {
      return "ElementAnalysis[openTagInline=" + openTagInline + ", contentInline=" + contentInline + ", closeTagInline="
         + closeTagInline + "]";
   }
}

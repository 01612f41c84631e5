package com.jeffbrower.erb.ast;

/** Double dispatch over the closed set of node kinds. */
public interface NodeVisitor {
   void visitDocument(DocumentNode node);

   void visitElement(ElementNode node);

   void visitOpenTag(OpenTagNode node);

   void visitCloseTag(CloseTagNode node);

   void visitAttribute(AttributeNode node);

   void visitAttributeValue(AttributeValueNode node);

   void visitText(TextNode node);

   void visitLiteral(LiteralNode node);

   void visitWhitespace(WhitespaceNode node);

   void visitComment(CommentNode node);

   void visitDoctype(DoctypeNode node);

   void visitCdata(CdataNode node);

   void visitProcessingInstruction(ProcessingInstructionNode node);

   void visitErbContent(ErbContentNode node);

   void visitErbControlFlow(ErbControlFlowNode node);
}

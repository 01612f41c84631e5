package com.jeffbrower.erb;

import static com.jeffbrower.erb.Logger.log;
import static com.jeffbrower.erb.Logger.stringify;

import com.jeffbrower.erb.ast.AttributeNode;
import com.jeffbrower.erb.ast.AttributeValueNode;
import com.jeffbrower.erb.ast.CdataNode;
import com.jeffbrower.erb.ast.CloseTagNode;
import com.jeffbrower.erb.ast.CommentNode;
import com.jeffbrower.erb.ast.DoctypeNode;
import com.jeffbrower.erb.ast.DocumentNode;
import com.jeffbrower.erb.ast.ElementNode;
import com.jeffbrower.erb.ast.ErbClause;
import com.jeffbrower.erb.ast.ErbContentNode;
import com.jeffbrower.erb.ast.ErbControlFlowNode;
import com.jeffbrower.erb.ast.LiteralNode;
import com.jeffbrower.erb.ast.Node;
import com.jeffbrower.erb.ast.OpenTagNode;
import com.jeffbrower.erb.ast.ProcessingInstructionNode;
import com.jeffbrower.erb.ast.TextNode;
import com.jeffbrower.erb.ast.WhitespaceNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses an ERB template into a {@link DocumentNode}. Embedded Ruby tags are recognized in text, inside opening tags and
 * inside attribute values, and are grouped into {@link ErbControlFlowNode}s by their leading keyword.
 *
 * Structurally invalid input (unclosed tags, mismatched close tags, unterminated constructs) fails with an
 * {@link IllegalStateException}.
 */
public class Parser {
   private static final Pattern KEYWORD = Pattern.compile("^([a-z_]+)\\b");
   private static final Pattern BLOCK_OPENER = Pattern.compile("(?:\\bdo|\\{)\\s*(?:\\|[^|]*\\|)?$");
   private static final Pattern TRAILING_END = Pattern.compile("(?:^|[\\s;])end$");

   private static enum Context {
      BODY,
      OPEN_TAG,
      ATTRIBUTE_VALUE
   }

   private final String s;
   private int pos;

   private Parser(final String s) {
      this.s = s;
   }

   public static DocumentNode parse(final String source) {
      final Parser p = new Parser(source);
      final List<Node> children = p.parseNodes(Context.BODY, null);
      if (p.pos < source.length()) {
         // a close tag or a clause with nothing to attach to
         throw p.error("Unexpected " + stringify(p.snippet()));
      }
      return new DocumentNode(0, source.length(), children);
   }

   // base parsing methods

   /**
    * Parse sibling nodes until the context ends: a close tag in a body, {@code >} in an opening tag, the closing quote of an
    * attribute value, or an ERB clause / terminator belonging to an enclosing construct. The stopping input is not consumed.
    */
   private List<Node> parseNodes(final Context context, final String quote) {
      final List<Node> nodes = new ArrayList<>();
      while (pos < s.length()) {
         if (startsWith("<%")) {
            final int mark = pos;
            final ErbContentNode tag = parseErbTag();
            final String keyword = keyword(tag);
            if (isClause(keyword) || isTerminator(tag, keyword)) {
               // belongs to an enclosing construct, let the caller consume it
               pos = mark;
               break;
            }
            final ErbControlFlowNode.Kind kind = openerKind(tag, keyword);
            nodes.add(kind == null ? tag : parseControlFlow(tag, kind, context, quote));
            continue;
         }

         final Node node;
         if (context == Context.BODY) {
            if (startsWith("</")) {
               break;
            }
            node = isTagStart(pos) ? parseMarkup() : parseText();
         } else if (context == Context.OPEN_TAG) {
            final char c = s.charAt(pos);
            if (c == '>' || startsWith("/>")) {
               break;
            }
            node = isWhitespace(c) ? parseWhitespace() : parseAttribute();
         } else {
            if (quote.isEmpty() ? isWhitespace(s.charAt(pos)) || s.charAt(pos) == '>' : startsWith(quote)) {
               break;
            }
            node = parseLiteral(quote);
         }
         nodes.add(node);
      }
      return nodes;
   }

   private String parseName(final IntPredicate nameChar, final String what) {
      final int start = pos;
      while (pos < s.length() && nameChar.test(s.charAt(pos))) {
         pos++;
      }
      if (pos == start) {
         throw error("Expected " + what);
      }
      return s.substring(start, pos);
   }

   private static boolean isTagNameChar(final int c) {
      return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
   }

   private static boolean isAttributeNameChar(final int c) {
      switch (c) {
         case '=':
         case '>':
         case '/':
         case '"':
         case '\'':
         case '<':
            return false;
         default:
            return !isWhitespace(c);
      }
   }

   /** @return true if the character is HTML whitespace */
   static boolean isWhitespace(final int c) {
      switch (c) {
         case ' ':
         case '\t':
         case '\n':
         case '\r':
         case '\f':
            return true;
         default:
            return false;
      }
   }

   private void skipWhitespace() {
      while (pos < s.length() && isWhitespace(s.charAt(pos))) {
         pos++;
      }
   }

   /** @return true if a tag (markup or ERB) starts at the index */
   private boolean isTagStart(final int i) {
      if (i + 1 >= s.length() || s.charAt(i) != '<') {
         return false;
      }
      final char c = s.charAt(i + 1);
      return Character.isLetter(c) || c == '/' || c == '!' || c == '?' || c == '%';
   }

   private boolean startsWith(final String prefix) {
      return s.startsWith(prefix, pos);
   }

   private boolean startsWithIgnoreCase(final String prefix) {
      return s.regionMatches(true, pos, prefix, 0, prefix.length());
   }

   private void assertCharacter(final char expected) {
      if (pos >= s.length() || s.charAt(pos) != expected) {
         throw error("Expected '" + expected + "' but found " + (pos >= s.length() ? "end of input" : stringify(snippet())));
      }
      pos++;
   }

   /** Consume up to and including the terminator. */
   private void readThrough(final String terminator, final String what) {
      final int i = s.indexOf(terminator, pos);
      if (i == -1) {
         throw error("Unclosed " + what);
      }
      pos = i + terminator.length();
   }

   private String snippet() {
      return s.substring(pos, Math.min(s.length(), pos + 20));
   }

   private IllegalStateException error(final String message) {
      return new IllegalStateException(message + " at offset " + pos);
   }

   // markup

   private TextNode parseText() {
      final int start = pos;
      do {
         pos++;
      } while (pos < s.length() && !isTagStart(pos));
      return new TextNode(start, pos, s.substring(start, pos));
   }

   private Node parseMarkup() {
      // precondition: at "<", followed by a letter, "!" or "?"
      final int start = pos;

      if (startsWith("<!--")) {
         pos += 4;
         readThrough("-->", "comment");
         return new CommentNode(start, pos, s.substring(start + 4, pos - 3));
      }

      if (startsWith("<![CDATA[")) {
         readThrough("]]>", "CDATA section");
         return new CdataNode(start, pos, s.substring(start, pos));
      }

      if (startsWith("<!")) {
         readThrough(">", "doctype");
         return new DoctypeNode(start, pos, s.substring(start, pos));
      }

      if (startsWith("<?")) {
         readThrough("?>", "processing instruction");
         return new ProcessingInstructionNode(start, pos, s.substring(start, pos));
      }

      return parseElement();
   }

   private ElementNode parseElement() {
      // precondition: at "<" followed by a letter
      final int start = pos;
      pos++;
      final String tagName = parseName(Parser::isTagNameChar, "tag name");
      log("parseElement: " + tagName);

      final List<Node> attributes = parseNodes(Context.OPEN_TAG, null);
      final String closing;
      if (startsWith("/>")) {
         closing = "/>";
         pos += 2;
      } else if (pos < s.length()) {
         closing = ">";
         assertCharacter('>');
      } else {
         throw error("Unclosed tag <" + tagName + ">");
      }
      final OpenTagNode openTag = new OpenTagNode(start, pos, tagName, attributes, closing);

      final String lowerName = tagName.toLowerCase(Locale.ROOT);
      if (openTag.isSelfClosing() || NodeHelpers.isVoidElement(lowerName)) {
         return new ElementNode(start, pos, openTag, List.of(), null);
      }

      final List<Node> body;
      if (NodeHelpers.isContentPreserving(lowerName)) {
         // raw text, up to the matching close tag
         final int bodyStart = pos;
         while (pos < s.length() && !startsWithIgnoreCase("</" + tagName)) {
            pos++;
         }
         body = pos == bodyStart ? List.of() : List.of(new TextNode(bodyStart, pos, s.substring(bodyStart, pos)));
      } else {
         body = parseNodes(Context.BODY, null);
      }

      if (!startsWith("</")) {
         throw error("Unclosed element <" + tagName + ">");
      }
      final int closeStart = pos;
      pos += 2;
      final String closeName = parseName(Parser::isTagNameChar, "close tag name");
      skipWhitespace();
      assertCharacter('>');
      if (!closeName.equalsIgnoreCase(tagName)) {
         pos = closeStart;
         throw error("Expected </" + tagName + "> but found </" + closeName + ">");
      }

      return new ElementNode(start, pos, openTag, body, new CloseTagNode(closeStart, pos, closeName));
   }

   private WhitespaceNode parseWhitespace() {
      final int start = pos;
      skipWhitespace();
      return new WhitespaceNode(start, pos, s.substring(start, pos));
   }

   private AttributeNode parseAttribute() {
      final int start = pos;
      final String name = parseName(Parser::isAttributeNameChar, "attribute name");

      // there's optional whitespace around the '=' of an attribute
      final int mark = pos;
      skipWhitespace();
      if (pos >= s.length() || s.charAt(pos) != '=') {
         // boolean attribute
         pos = mark;
         return new AttributeNode(start, pos, name, null);
      }
      pos++;
      skipWhitespace();

      final int valueStart = pos;
      final AttributeValueNode value;
      if (pos < s.length() && (s.charAt(pos) == '"' || s.charAt(pos) == '\'')) {
         final String quote = String.valueOf(s.charAt(pos));
         pos++;
         final List<Node> children = parseNodes(Context.ATTRIBUTE_VALUE, quote);
         assertCharacter(quote.charAt(0));
         value = new AttributeValueNode(valueStart, pos, quote, children, quote);
      } else {
         final List<Node> children = parseNodes(Context.ATTRIBUTE_VALUE, "");
         if (children.isEmpty()) {
            throw error("Expected value for attribute " + name);
         }
         value = new AttributeValueNode(valueStart, pos, "", children, "");
      }
      return new AttributeNode(start, pos, name, value);
   }

   private LiteralNode parseLiteral(final String quote) {
      final int start = pos;
      while (pos < s.length() && !startsWith("<%")) {
         final char c = s.charAt(pos);
         if (quote.isEmpty() ? isWhitespace(c) || c == '>' : c == quote.charAt(0)) {
            break;
         }
         pos++;
      }
      if (pos >= s.length()) {
         throw error("Unclosed attribute value");
      }
      return new LiteralNode(start, pos, s.substring(start, pos));
   }

   // embedded ruby

   private ErbContentNode parseErbTag() {
      // precondition: at "<%"
      final int start = pos;
      final String opening;
      if (startsWith("<%==")) {
         opening = "<%==";
      } else if (startsWith("<%=") || startsWith("<%#") || startsWith("<%-")) {
         opening = s.substring(pos, pos + 3);
      } else {
         opening = "<%";
      }
      pos += opening.length();

      final int close = s.indexOf("%>", pos);
      if (close == -1) {
         throw error("Unclosed ERB tag");
      }
      String content = s.substring(pos, close);
      String closing = "%>";
      if (content.endsWith("-")) {
         content = content.substring(0, content.length() - 1);
         closing = "-%>";
      }
      pos = close + 2;
      return new ErbContentNode(start, pos, opening, content, closing);
   }

   private ErbControlFlowNode parseControlFlow(
      final ErbContentNode openingTag,
      final ErbControlFlowNode.Kind kind,
      final Context context,
      final String quote
   ) {
      log("parseControlFlow: " + kind + " " + stringify(openingTag.content));
      final List<Node> body = parseNodes(context, quote);
      final List<ErbClause> clauses = new ArrayList<>();
      while (true) {
         if (!startsWith("<%")) {
            throw error("Unclosed " + stringify(openingTag.content.strip()) + " opened at offset " + openingTag.start);
         }
         final int mark = pos;
         final ErbContentNode tag = parseErbTag();
         final String keyword = keyword(tag);
         if (isTerminator(tag, keyword)) {
            return new ErbControlFlowNode(kind, openingTag, body, clauses, tag);
         }
         if (!allowsClause(kind, keyword)) {
            pos = mark;
            throw error("Unexpected " + stringify(tag.content.strip()) + " in " + kind.name().toLowerCase(Locale.ROOT));
         }
         clauses.add(new ErbClause(tag, parseNodes(context, quote)));
      }
   }

   /** @return the leading Ruby keyword of a code tag, or null for comments and tags without one */
   private static String keyword(final ErbContentNode tag) {
      if (tag.isComment()) {
         return null;
      }
      final Matcher m = KEYWORD.matcher(tag.content.strip());
      return m.find() ? m.group(1) : null;
   }

   private static boolean isClause(final String keyword) {
      if (keyword == null) {
         return false;
      }
      switch (keyword) {
         case "elsif":
         case "else":
         case "when":
         case "in":
         case "rescue":
         case "ensure":
            return true;
         default:
            return false;
      }
   }

   private static boolean isTerminator(final ErbContentNode tag, final String keyword) {
      return "end".equals(keyword) || !tag.isComment() && tag.content.strip().equals("}");
   }

   private static boolean allowsClause(final ErbControlFlowNode.Kind kind, final String keyword) {
      if (!isClause(keyword)) {
         return false;
      }
      switch (kind) {
         case CONDITIONAL:
            return keyword.equals("elsif") || keyword.equals("else");
         case CASE:
            return keyword.equals("when") || keyword.equals("in") || keyword.equals("else");
         case BEGIN:
         case BLOCK:
            return keyword.equals("rescue") || keyword.equals("else") || keyword.equals("ensure");
         default:
            return false;
      }
   }

   /** @return the construct a tag opens, or null if it is a plain tag */
   private static ErbControlFlowNode.Kind openerKind(final ErbContentNode tag, final String keyword) {
      if (tag.isComment()) {
         return null;
      }
      final String code = tag.content.strip();
      if (keyword != null && TRAILING_END.matcher(code).find()) {
         // one-liner, like "if admin? then 'a' else 'b' end"
         return null;
      }
      if (keyword != null) {
         switch (keyword) {
            case "if":
            case "unless":
               return ErbControlFlowNode.Kind.CONDITIONAL;
            case "case":
               return ErbControlFlowNode.Kind.CASE;
            case "for":
            case "while":
            case "until":
               return ErbControlFlowNode.Kind.LOOP;
            case "begin":
               return ErbControlFlowNode.Kind.BEGIN;
            default:
               break;
         }
      }
      return BLOCK_OPENER.matcher(code).find() ? ErbControlFlowNode.Kind.BLOCK : null;
   }
}

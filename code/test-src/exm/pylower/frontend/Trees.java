package exm.pylower.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;

/**
 * Builds parse trees by hand, shaped the way the parser shapes them
 */
public class Trees {

  public static CstLeaf leaf(TokenKind kind, String text, int line, int col) {
    return new CstLeaf(kind, text, line, col);
  }

  /** A name or keyword on line 1 */
  public static CstLeaf name(String text, int col) {
    return new CstLeaf(TokenKind.NAME, text, 1, col);
  }

  public static CstLeaf number(String text, int col) {
    return new CstLeaf(TokenKind.NUMBER, text, 1, col);
  }

  public static CstLeaf string(String text, int col) {
    return new CstLeaf(TokenKind.STRING, text, 1, col);
  }

  /** A punctuation token on line 1, its text taken from the kind */
  public static CstLeaf op(TokenKind kind, int col) {
    return new CstLeaf(kind, text(kind), 1, col);
  }

  public static CstNode node(Symbol symbol, Cst... children) {
    return new CstNode(symbol, Arrays.asList(children));
  }

  /**
   * A statement line ending with a newline token at the given column
   */
  public static CstNode line(Cst statement, int newlineCol) {
    return node(Symbol.SIMPLE_STMT, statement,
                leaf(TokenKind.NEWLINE, "\n", statement.firstLeaf().line(),
                     newlineCol));
  }

  /**
   * A file holding the given statement lines, ending on the line after
   * the last one
   */
  public static CstNode module(Cst... lines) {
    List<Cst> children = new ArrayList<Cst>(Arrays.asList(lines));
    int endLine = lines.length == 0 ? 1 :
                  lines[lines.length - 1].firstLeaf().line() + 1;
    children.add(leaf(TokenKind.ENDMARKER, "", endLine, 0));
    return new CstNode(Symbol.FILE_INPUT, children);
  }

  private static String text(TokenKind kind) {
    switch (kind) {
      case LPAR: return "(";
      case RPAR: return ")";
      case LSQB: return "[";
      case RSQB: return "]";
      case LBRACE: return "{";
      case RBRACE: return "}";
      case COLON: return ":";
      case COMMA: return ",";
      case SEMI: return ";";
      case PLUS: return "+";
      case MINUS: return "-";
      case STAR: return "*";
      case DOUBLESTAR: return "**";
      case SLASH: return "/";
      case AT: return "@";
      case DOT: return ".";
      case EQUAL: return "=";
      case COLONEQUAL: return ":=";
      case PLUSEQUAL: return "+=";
      case LESS: return "<";
      case TILDE: return "~";
      default:
        throw new IllegalArgumentException("No text for " + kind);
    }
  }
}

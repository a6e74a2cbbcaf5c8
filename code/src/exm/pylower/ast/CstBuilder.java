/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.pylower.ast;

import java.util.List;

import org.antlr.runtime.Token;

/**
 * Builds parse trees from inside the generated ANTLR parser.
 *
 * Mirrors a pgen driver: a production that matched a single child is
 * replaced by that child, keyword tokens become NAME leaves and the end
 * of input becomes an ENDMARKER leaf with empty text.
 */
public class CstBuilder {

  private static final String KEYWORD_PREFIX = "KW_";

  public static CstLeaf leaf(Token token, String[] tokenNames) {
    if (token == null) {
      // Parser already reported an error
      return null;
    }
    if (token.getType() == Token.EOF) {
      return new CstLeaf(TokenKind.ENDMARKER, "", token.getLine(),
                         token.getCharPositionInLine());
    }
    return new CstLeaf(tokenKind(tokenNames[token.getType()]),
            token.getText(), token.getLine(), token.getCharPositionInLine());
  }

  /**
   * @param tokenName token name from the grammar, e.g. "LPAR" or "KW_IF"
   */
  public static TokenKind tokenKind(String tokenName) {
    if (tokenName.startsWith(KEYWORD_PREFIX)) {
      return TokenKind.NAME;
    }
    return TokenKind.valueOf(tokenName);
  }

  /**
   * @return the only child if there is exactly one, otherwise a new node.
   *         Null if a child is missing after a syntax error.
   */
  public static Cst node(Symbol symbol, List<Cst> children) {
    if (children.contains(null)) {
      return null;
    }
    if (children.size() == 1) {
      return children.get(0);
    }
    return new CstNode(symbol, children);
  }

  /**
   * Start symbol: never collapsed, so empty input still has a node
   */
  public static CstNode root(Symbol symbol, List<Cst> children) {
    if (children.contains(null)) {
      return null;
    }
    return new CstNode(symbol, children);
  }
}

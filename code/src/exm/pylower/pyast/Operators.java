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

package exm.pylower.pyast;

import exm.pylower.ast.TokenKind;

import com.google.common.collect.ImmutableMap;

/**
 * Operator enumerations and the tokens that spell them
 */
public class Operators {

  public static enum BinaryOperator implements AstEnum {
    ADD("Add"),
    SUB("Sub"),
    MULT("Mult"),
    MAT_MULT("MatMult"),
    DIV("Div"),
    MOD("Mod"),
    POW("Pow"),
    LSHIFT("LShift"),
    RSHIFT("RShift"),
    BIT_OR("BitOr"),
    BIT_XOR("BitXor"),
    BIT_AND("BitAnd"),
    FLOOR_DIV("FloorDiv");

    private final String astName;

    private BinaryOperator(String astName) {
      this.astName = astName;
    }

    @Override
    public String astName() {
      return astName;
    }
  }

  public static enum UnaryOperator implements AstEnum {
    INVERT("Invert"),
    NOT("Not"),
    UADD("UAdd"),
    USUB("USub");

    private final String astName;

    private UnaryOperator(String astName) {
      this.astName = astName;
    }

    @Override
    public String astName() {
      return astName;
    }
  }

  public static enum BoolOperator implements AstEnum {
    AND("And"),
    OR("Or");

    private final String astName;

    private BoolOperator(String astName) {
      this.astName = astName;
    }

    @Override
    public String astName() {
      return astName;
    }
  }

  public static enum CompareOperator implements AstEnum {
    EQ("Eq"),
    NOT_EQ("NotEq"),
    LT("Lt"),
    LT_E("LtE"),
    GT("Gt"),
    GT_E("GtE"),
    IS("Is"),
    IS_NOT("IsNot"),
    IN("In"),
    NOT_IN("NotIn");

    private final String astName;

    private CompareOperator(String astName) {
      this.astName = astName;
    }

    @Override
    public String astName() {
      return astName;
    }
  }

  private static final ImmutableMap<TokenKind, BinaryOperator> BINARY =
      ImmutableMap.<TokenKind, BinaryOperator>builder()
        .put(TokenKind.PLUS, BinaryOperator.ADD)
        .put(TokenKind.MINUS, BinaryOperator.SUB)
        .put(TokenKind.STAR, BinaryOperator.MULT)
        .put(TokenKind.AT, BinaryOperator.MAT_MULT)
        .put(TokenKind.SLASH, BinaryOperator.DIV)
        .put(TokenKind.PERCENT, BinaryOperator.MOD)
        .put(TokenKind.DOUBLESTAR, BinaryOperator.POW)
        .put(TokenKind.LEFTSHIFT, BinaryOperator.LSHIFT)
        .put(TokenKind.RIGHTSHIFT, BinaryOperator.RSHIFT)
        .put(TokenKind.VBAR, BinaryOperator.BIT_OR)
        .put(TokenKind.CIRCUMFLEX, BinaryOperator.BIT_XOR)
        .put(TokenKind.AMPER, BinaryOperator.BIT_AND)
        .put(TokenKind.DOUBLESLASH, BinaryOperator.FLOOR_DIV)
        .build();

  private static final ImmutableMap<TokenKind, BinaryOperator> AUGMENTED =
      ImmutableMap.<TokenKind, BinaryOperator>builder()
        .put(TokenKind.PLUSEQUAL, BinaryOperator.ADD)
        .put(TokenKind.MINEQUAL, BinaryOperator.SUB)
        .put(TokenKind.STAREQUAL, BinaryOperator.MULT)
        .put(TokenKind.ATEQUAL, BinaryOperator.MAT_MULT)
        .put(TokenKind.SLASHEQUAL, BinaryOperator.DIV)
        .put(TokenKind.PERCENTEQUAL, BinaryOperator.MOD)
        .put(TokenKind.DOUBLESTAREQUAL, BinaryOperator.POW)
        .put(TokenKind.LEFTSHIFTEQUAL, BinaryOperator.LSHIFT)
        .put(TokenKind.RIGHTSHIFTEQUAL, BinaryOperator.RSHIFT)
        .put(TokenKind.VBAREQUAL, BinaryOperator.BIT_OR)
        .put(TokenKind.CIRCUMFLEXEQUAL, BinaryOperator.BIT_XOR)
        .put(TokenKind.AMPEREQUAL, BinaryOperator.BIT_AND)
        .put(TokenKind.DOUBLESLASHEQUAL, BinaryOperator.FLOOR_DIV)
        .build();

  private static final ImmutableMap<TokenKind, UnaryOperator> UNARY =
      ImmutableMap.of(TokenKind.PLUS, UnaryOperator.UADD,
                      TokenKind.MINUS, UnaryOperator.USUB,
                      TokenKind.TILDE, UnaryOperator.INVERT);

  private static final ImmutableMap<TokenKind, CompareOperator> COMPARE =
      ImmutableMap.<TokenKind, CompareOperator>builder()
        .put(TokenKind.EQEQUAL, CompareOperator.EQ)
        .put(TokenKind.NOTEQUAL, CompareOperator.NOT_EQ)
        .put(TokenKind.LESS, CompareOperator.LT)
        .put(TokenKind.LESSEQUAL, CompareOperator.LT_E)
        .put(TokenKind.GREATER, CompareOperator.GT)
        .put(TokenKind.GREATEREQUAL, CompareOperator.GT_E)
        .build();

  /**
   * @return operator for a binary operator token, or null
   */
  public static BinaryOperator binaryOperator(TokenKind token) {
    return BINARY.get(token);
  }

  /**
   * @return operator for an augmented assignment token such as
   *         <code>+=</code>, or null
   */
  public static BinaryOperator augmentedOperator(TokenKind token) {
    return AUGMENTED.get(token);
  }

  /**
   * @return operator for a unary prefix token, or null
   */
  public static UnaryOperator unaryOperator(TokenKind token) {
    return UNARY.get(token);
  }

  /**
   * @return operator for a symbolic comparison token, or null.
   *    Keyword comparisons ("in", "is") are NAME leaves.
   */
  public static CompareOperator compareOperator(TokenKind token) {
    return COMPARE.get(token);
  }

  /**
   * @return comparison spelled by a keyword, or null
   */
  public static CompareOperator compareKeyword(String keyword) {
    if (keyword.equals("in")) {
      return CompareOperator.IN;
    } else if (keyword.equals("is")) {
      return CompareOperator.IS;
    }
    return null;
  }
}

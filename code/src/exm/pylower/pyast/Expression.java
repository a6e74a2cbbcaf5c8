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

import exm.pylower.ast.SourceRange;

/**
 * An expression node.  The concrete variants are in {@link Expressions};
 * {@link #kind()} identifies the variant for switch statements.
 */
public abstract class Expression extends PyNode {

  public static enum Kind {
    BOOL_OP("BoolOp"),
    NAMED_EXPR("NamedExpr"),
    BIN_OP("BinOp"),
    UNARY_OP("UnaryOp"),
    LAMBDA("Lambda"),
    IF_EXP("IfExp"),
    DICT("Dict"),
    SET("Set"),
    LIST_COMP("ListComp"),
    SET_COMP("SetComp"),
    DICT_COMP("DictComp"),
    GENERATOR_EXP("GeneratorExp"),
    AWAIT("Await"),
    COMPARE("Compare"),
    CALL("Call"),
    CONSTANT("Constant"),
    ATTRIBUTE("Attribute"),
    SUBSCRIPT("Subscript"),
    STARRED("Starred"),
    NAME("Name"),
    LIST("List"),
    TUPLE("Tuple"),
    SLICE("Slice");

    private final String typeName;

    private Kind(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }
  }

  protected Expression(SourceRange range) {
    super(range);
    assert(range != null);
  }

  public abstract Kind kind();

  @Override
  public String typeName() {
    return kind().typeName();
  }
}

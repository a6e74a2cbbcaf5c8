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

import java.util.Locale;

/**
 * Grammar productions that can appear as interior parse tree nodes.
 * A production that matched exactly one child never appears: the child
 * takes its place.
 */
public enum Symbol {
  FILE_INPUT,
  SIMPLE_STMT,
  EXPR_STMT,
  ANNASSIGN,
  DEL_STMT,
  TYPE_STMT,
  TYPEPARAMS,
  TYPEVAR,
  PARAMSPEC,
  TYPEVARTUPLE,
  TESTLIST_STAR_EXPR,
  TESTLIST,
  TESTLIST1,
  EXPRLIST,
  NAMEDEXPR_TEST,
  TEST,
  LAMBDEF,
  VARARGSLIST,
  OR_TEST,
  AND_TEST,
  NOT_TEST,
  COMPARISON,
  COMP_OP,
  STAR_EXPR,
  EXPR,
  XOR_EXPR,
  AND_EXPR,
  SHIFT_EXPR,
  ARITH_EXPR,
  TERM,
  FACTOR,
  POWER,
  TRAILER,
  ATOM,
  TESTLIST_GEXP,
  LISTMAKER,
  DICTSETMAKER,
  SUBSCRIPTLIST,
  SUBSCRIPT,
  SLICEOP,
  ARGLIST,
  ARGUMENT,
  COMP_FOR,
  COMP_IF,
  OLD_COMP_FOR,
  OLD_COMP_IF;

  /** First symbol number; everything below is a token */
  public static final int NT_OFFSET = 256;

  private final String grammarName;

  private Symbol() {
    this.grammarName = name().toLowerCase(Locale.ROOT);
  }

  public int type() {
    return NT_OFFSET + ordinal();
  }

  /**
   * @return production name as written in the grammar, e.g. "arith_expr"
   */
  public String grammarName() {
    return grammarName;
  }
}

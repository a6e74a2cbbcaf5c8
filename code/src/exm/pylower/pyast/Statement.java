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
 * A statement node; variants are in {@link Statements}
 */
public abstract class Statement extends PyNode {

  public static enum Kind {
    EXPR("Expr"),
    ASSIGN("Assign"),
    AUG_ASSIGN("AugAssign"),
    ANN_ASSIGN("AnnAssign"),
    DELETE("Delete"),
    PASS("Pass"),
    TYPE_ALIAS("TypeAlias");

    private final String typeName;

    private Kind(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }
  }

  protected Statement(SourceRange range) {
    super(range);
    assert(range != null);
  }

  public abstract Kind kind();

  @Override
  public String typeName() {
    return kind().typeName();
  }
}

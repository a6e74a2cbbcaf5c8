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

package exm.pylower.common.exceptions;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;

/**
 * A child the grammar guarantees is missing or has the wrong kind.
 * Means the parser and the lowering have drifted apart.
 */
public class MalformedTreeException extends PyLowerRuntimeError {

  public MalformedTreeException(String msg) {
    super(msg);
  }

  public MalformedTreeException(Cst at, String msg) {
    super(describe(at) + ": " + msg);
  }

  private static String describe(Cst at) {
    CstLeaf leaf = at.firstLeaf();
    if (leaf == null) {
      return at.kindName();
    }
    return at.kindName() + " at " + leaf.line() + ":" + leaf.column();
  }

  private static final long serialVersionUID = -7529035236021564904L;
}

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
import exm.pylower.frontend.LoweringContext;

/**
 * Syntax that the grammar accepts but that cannot be expressed for the
 * requested target version, or that is never allowed in that position.
 */
public class UnsupportedSyntaxException extends UserException {

  private final String construct;

  public UnsupportedSyntaxException(LoweringContext context, Cst at,
                                    String construct, String message) {
    super(context, at, message);
    this.construct = construct;
  }

  /**
   * Shorthand where the construct name is the whole message
   */
  public UnsupportedSyntaxException(LoweringContext context, Cst at,
                                    String construct) {
    this(context, at, construct, construct);
  }

  /**
   * @return short name of the rejected construct, e.g. "TypeVar default"
   */
  public String construct() {
    return construct;
  }

  private static final long serialVersionUID = 6032178837916043713L;
}

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

package exm.pylower.common.lang;

/**
 * Version-sensitive syntax, each with the release that introduced it.
 * This is the whole policy table: lowering code only names a feature
 * and asks {@link VersionGate}.
 */
public enum Feature {
  MATRIX_MULTIPLICATION(5, "matrix multiplication"),
  AWAIT_EXPRESSION(5, "await expression"),
  DISPLAY_UNPACKING(5, "unpacking in displays"),
  ASYNC_COMPREHENSION(6, "asynchronous comprehension"),
  /** Earlier releases accept "async" and "await" as names */
  ASYNC_KEYWORDS(7, "async and await keywords"),
  ANNOTATED_ASSIGNMENT(6, "annotated assignment"),
  NUMERIC_UNDERSCORES(6, "underscores in numeric literals"),
  NAMED_EXPRESSION(8, "assignment expression"),
  POSITIONAL_ONLY_PARAMETERS(8, "positional-only parameters"),
  UNPARENTHESIZED_SUBSCRIPT_NAMED_EXPRESSION(10,
                    "unparenthesized assignment expression in subscript"),
  STARRED_SUBSCRIPT(11, "star expression in subscript"),
  TYPE_VAR(12, "TypeVar"),
  PARAM_SPEC(12, "ParamSpec"),
  TYPE_VAR_TUPLE(12, "TypeVarTuple"),
  TYPE_ALIAS(12, "type alias"),
  TYPE_VAR_DEFAULT(13, "TypeVar default"),
  PARAM_SPEC_DEFAULT(13, "ParamSpec default"),
  TYPE_VAR_TUPLE_DEFAULT(13, "TypeVarTuple default");

  private final TargetVersion minimum;
  private final String displayName;

  private Feature(int minMinor, String displayName) {
    this.minimum = TargetVersion.of(TargetVersion.MAJOR, minMinor);
    this.displayName = displayName;
  }

  public TargetVersion minimum() {
    return minimum;
  }

  /**
   * Name used in diagnostics
   */
  public String displayName() {
    return displayName;
  }
}

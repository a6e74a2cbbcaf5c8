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

package exm.pylower.frontend;

import exm.pylower.common.lang.TargetVersion;
import exm.pylower.pyast.ExprContext;

/**
 * Settings in effect while lowering one subtree: the file being lowered,
 * the target version and the expression context that names and other
 * targets receive.
 *
 * Immutable: lowering a subtree under a different expression context
 * passes a derived context down, so the caller's context is unaffected
 * however the subtree's lowering ends.
 */
public class LoweringContext {

  private final String inputFile;
  private final TargetVersion targetVersion;
  private final ExprContext exprContext;

  public LoweringContext(String inputFile, TargetVersion targetVersion) {
    this(inputFile, targetVersion, ExprContext.LOAD);
  }

  private LoweringContext(String inputFile, TargetVersion targetVersion,
                          ExprContext exprContext) {
    assert(inputFile != null);
    assert(targetVersion != null);
    assert(exprContext != null);
    this.inputFile = inputFile;
    this.targetVersion = targetVersion;
    this.exprContext = exprContext;
  }

  public String getInputFile() {
    return inputFile;
  }

  public TargetVersion getTargetVersion() {
    return targetVersion;
  }

  public ExprContext getExprContext() {
    return exprContext;
  }

  public LoweringContext withExprContext(ExprContext newContext) {
    if (newContext == exprContext) {
      return this;
    }
    return new LoweringContext(inputFile, targetVersion, newContext);
  }

  /**
   * Shorthand for a context in which expressions are read
   */
  public LoweringContext load() {
    return withExprContext(ExprContext.LOAD);
  }

  @Override
  public String toString() {
    return inputFile + " (Python " + targetVersion + ", " +
           exprContext.astName() + ")";
  }
}

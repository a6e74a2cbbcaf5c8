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

import exm.pylower.ast.Cst;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.frontend.LoweringContext;

/**
 * Decides whether version-sensitive syntax is legal for a target version.
 */
public class VersionGate {

  public static boolean isSupported(Feature feature, TargetVersion version) {
    return version.atLeast(feature.minimum());
  }

  /**
   * Fail lowering if the context's target version predates the feature.
   * @param at tree the feature was found in, for the error location
   */
  public static void require(LoweringContext context, Cst at,
                             Feature feature)
                                throws UnsupportedSyntaxException {
    TargetVersion target = context.getTargetVersion();
    if (!isSupported(feature, target)) {
      throw new UnsupportedSyntaxException(context, at, feature.displayName(),
          feature.displayName() + " requires Python " + feature.minimum() +
          " or newer (target version is " + target + ")");
    }
  }
}

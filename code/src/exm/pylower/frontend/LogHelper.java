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

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;
import exm.pylower.common.Logging;

/**
 * Logging helpers that prefix messages with the source location
 */
public class LogHelper {

  private static final Logger logger = Logging.getPyLowerLogger();

  /**
   * @return "file:line:col" of the first token of the tree
   */
  public static String location(LoweringContext context, Cst tree) {
    CstLeaf leaf = tree.firstLeaf();
    if (leaf == null) {
      return context.getInputFile();
    }
    return context.getInputFile() + ":" + leaf.line() + ":" +
           (leaf.column() + 1);
  }

  public static void trace(LoweringContext context, Cst tree, String msg) {
    log(Level.TRACE, location(context, tree), msg);
  }

  /**
   * WARN-level, each distinct message logged once, at the location where
   * it first occurred
   */
  public static void uniqueWarn(LoweringContext context, Cst tree,
                                String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      log(Level.WARN, location(context, tree), msg);
    }
  }

  public static void log(Level level, String location, String msg) {
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    sb.append(": ");
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}

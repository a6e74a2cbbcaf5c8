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

import exm.pylower.common.exceptions.MalformedTreeException;

/**
 * Computes source ranges of parse trees from their leaves.
 * Ranges are recomputed on every call.
 *
 * Columns count characters (UTF-16 code units) from the start of the
 * line, not UTF-8 bytes: in <code>'é' + a</code> the name starts at
 * column 6, where the reference parser reports byte offset 7.  The two
 * agree on ASCII lines.
 */
public class PositionTracker {

  /**
   * A leaf ends after its text.  Text spanning lines (triple-quoted
   * strings) ends on a later line, at the column after the last
   * line break.
   */
  public static SourceRange rangeOf(CstLeaf leaf) {
    String text = leaf.text();
    int newlines = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        newlines++;
      }
    }
    int endCol;
    if (newlines == 0) {
      endCol = leaf.column() + text.length();
    } else {
      endCol = text.length() - text.lastIndexOf('\n') - 1;
    }
    return new SourceRange(leaf.line(), leaf.column(),
                           leaf.line() + newlines, endCol);
  }

  /**
   * A node spans from the start of its first child to the end of its
   * last child.
   */
  public static SourceRange rangeOf(Cst tree) {
    if (tree.isLeaf()) {
      return rangeOf(tree.asLeaf());
    }
    if (tree.childCount() == 0) {
      throw new MalformedTreeException(tree, "production without children");
    }
    return unify(tree.child(0), tree.lastChild());
  }

  /**
   * @return range from the start of begin to the end of end
   */
  public static SourceRange unify(Cst begin, Cst end) {
    return SourceRange.unify(rangeOf(begin), rangeOf(end));
  }
}

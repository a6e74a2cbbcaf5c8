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

/**
 * Start and end of a span of source text.
 * Lines start at 1, columns at 0; the end column is exclusive.
 */
public final class SourceRange {
  public final int lineno;
  public final int colOffset;
  public final int endLineno;
  public final int endColOffset;

  public SourceRange(int lineno, int colOffset,
                     int endLineno, int endColOffset) {
    this.lineno = lineno;
    this.colOffset = colOffset;
    this.endLineno = endLineno;
    this.endColOffset = endColOffset;
  }

  /**
   * @return range from the start of begin to the end of end
   */
  public static SourceRange unify(SourceRange begin, SourceRange end) {
    return new SourceRange(begin.lineno, begin.colOffset,
                           end.endLineno, end.endColOffset);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + lineno;
    result = prime * result + colOffset;
    result = prime * result + endLineno;
    result = prime * result + endColOffset;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceRange))
      return false;
    SourceRange other = (SourceRange) obj;
    return lineno == other.lineno && colOffset == other.colOffset &&
           endLineno == other.endLineno && endColOffset == other.endColOffset;
  }

  @Override
  public String toString() {
    return lineno + ":" + colOffset + "-" + endLineno + ":" + endColOffset;
  }
}

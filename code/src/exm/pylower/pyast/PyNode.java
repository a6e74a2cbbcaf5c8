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

import java.util.List;

import exm.pylower.ast.SourceRange;

/**
 * Base of all abstract syntax tree nodes.
 *
 * Nodes are immutable.  Most carry the source range they were lowered
 * from; the few that the reference schema gives no position attributes
 * (module, comprehension, arguments, type ignore) have a null range.
 */
public abstract class PyNode {

  private final SourceRange range;

  protected PyNode(SourceRange range) {
    this.range = range;
  }

  /**
   * @return source range, or null if this kind of node has no position
   */
  public SourceRange range() {
    return range;
  }

  public boolean hasAttributes() {
    return range != null;
  }

  /**
   * @return node type name in the reference schema, e.g. "BinOp"
   */
  public abstract String typeName();

  /**
   * @return named fields in schema order.  Values are nodes, lists,
   *    {@link AstEnum} members, constant values or null.
   */
  public abstract List<Field> fields();

  protected static Field field(String name, Object value) {
    return new Field(name, value);
  }

  @Override
  public String toString() {
    return new AstDump(false, true).dump(this);
  }
}

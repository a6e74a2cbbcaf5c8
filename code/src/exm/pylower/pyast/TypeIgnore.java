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

import com.google.common.collect.ImmutableList;

/**
 * A <code># type: ignore</code> comment.  The tag is the text after
 * "ignore", e.g. "[attr]", or empty.
 */
public final class TypeIgnore extends PyNode {
  public final int lineno;
  public final String tag;

  public TypeIgnore(int lineno, String tag) {
    super(null);
    this.lineno = lineno;
    this.tag = tag;
  }

  @Override
  public String typeName() {
    return "TypeIgnore";
  }

  @Override
  public List<Field> fields() {
    return ImmutableList.of(field("lineno", lineno), field("tag", tag));
  }
}

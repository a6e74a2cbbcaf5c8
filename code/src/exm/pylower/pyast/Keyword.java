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

import exm.pylower.ast.SourceRange;

/**
 * Keyword argument of a call: <code>name=value</code>, or
 * <code>**value</code> when the name is null
 */
public final class Keyword extends PyNode {
  public final String arg;
  public final Expression value;

  public Keyword(SourceRange range, String arg, Expression value) {
    super(range);
    this.arg = arg;
    this.value = value;
  }

  @Override
  public String typeName() {
    return "keyword";
  }

  @Override
  public List<Field> fields() {
    return ImmutableList.of(field("arg", arg), field("value", value));
  }
}

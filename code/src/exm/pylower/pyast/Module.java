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
 * Root of a lowered file.  Has no position.
 */
public final class Module extends PyNode {
  public final ImmutableList<Statement> body;
  public final ImmutableList<TypeIgnore> typeIgnores;

  public Module(List<? extends Statement> body,
                List<TypeIgnore> typeIgnores) {
    super(null);
    this.body = ImmutableList.copyOf(body);
    this.typeIgnores = ImmutableList.copyOf(typeIgnores);
  }

  /**
   * @return copy of this module with the given type ignores
   */
  public Module withTypeIgnores(List<TypeIgnore> ignores) {
    return new Module(body, ignores);
  }

  @Override
  public String typeName() {
    return "Module";
  }

  @Override
  public List<Field> fields() {
    return ImmutableList.of(field("body", body),
                            field("type_ignores", typeIgnores));
  }
}

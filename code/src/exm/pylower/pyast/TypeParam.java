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
 * Type parameter of a type alias: <code>T</code>, <code>**P</code> or
 * <code>*Ts</code>.  Bound and default are null when absent.
 */
public abstract class TypeParam extends PyNode {
  public final String name;
  public final Expression defaultValue;

  protected TypeParam(SourceRange range, String name,
                      Expression defaultValue) {
    super(range);
    this.name = name;
    this.defaultValue = defaultValue;
  }

  public static final class TypeVar extends TypeParam {
    public final Expression bound;

    public TypeVar(SourceRange range, String name, Expression bound,
                   Expression defaultValue) {
      super(range, name, defaultValue);
      this.bound = bound;
    }

    @Override
    public String typeName() {
      return "TypeVar";
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("name", name), field("bound", bound),
                              field("default_value", defaultValue));
    }
  }

  public static final class ParamSpec extends TypeParam {
    public ParamSpec(SourceRange range, String name,
                     Expression defaultValue) {
      super(range, name, defaultValue);
    }

    @Override
    public String typeName() {
      return "ParamSpec";
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("name", name),
                              field("default_value", defaultValue));
    }
  }

  public static final class TypeVarTuple extends TypeParam {
    public TypeVarTuple(SourceRange range, String name,
                        Expression defaultValue) {
      super(range, name, defaultValue);
    }

    @Override
    public String typeName() {
      return "TypeVarTuple";
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("name", name),
                              field("default_value", defaultValue));
    }
  }
}

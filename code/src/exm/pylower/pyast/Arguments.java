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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Parameter list of a lambda.  Has no position.
 */
public final class Arguments extends PyNode {
  public final ImmutableList<Arg> posonlyargs;
  public final ImmutableList<Arg> args;
  public final Arg vararg;
  public final ImmutableList<Arg> kwonlyargs;
  /** One entry per keyword-only parameter, null where it has no default */
  public final List<Expression> kwDefaults;
  public final Arg kwarg;
  /** Defaults of the last positional parameters */
  public final ImmutableList<Expression> defaults;

  public Arguments(List<Arg> posonlyargs, List<Arg> args, Arg vararg,
                   List<Arg> kwonlyargs, List<Expression> kwDefaults,
                   Arg kwarg, List<Expression> defaults) {
    super(null);
    assert(kwonlyargs.size() == kwDefaults.size());
    this.posonlyargs = ImmutableList.copyOf(posonlyargs);
    this.args = ImmutableList.copyOf(args);
    this.vararg = vararg;
    this.kwonlyargs = ImmutableList.copyOf(kwonlyargs);
    this.kwDefaults = Collections.unmodifiableList(
                              new ArrayList<Expression>(kwDefaults));
    this.kwarg = kwarg;
    this.defaults = ImmutableList.copyOf(defaults);
  }

  /**
   * No parameters at all, as in <code>lambda: 0</code>
   */
  public static Arguments empty() {
    List<Arg> none = Collections.emptyList();
    List<Expression> noExprs = Collections.emptyList();
    return new Arguments(none, none, null, none, noExprs, null, noExprs);
  }

  @Override
  public String typeName() {
    return "arguments";
  }

  @Override
  public List<Field> fields() {
    return ImmutableList.of(field("posonlyargs", posonlyargs),
        field("args", args), field("vararg", vararg),
        field("kwonlyargs", kwonlyargs), field("kw_defaults", kwDefaults),
        field("kwarg", kwarg), field("defaults", defaults));
  }
}

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
 * One <code>for target in iter if ...</code> clause.  Has no position.
 */
public final class Comprehension extends PyNode {
  public final Expression target;
  public final Expression iter;
  public final ImmutableList<Expression> ifs;
  public final boolean isAsync;

  public Comprehension(Expression target, Expression iter,
                       List<? extends Expression> ifs, boolean isAsync) {
    super(null);
    this.target = target;
    this.iter = iter;
    this.ifs = ImmutableList.copyOf(ifs);
    this.isAsync = isAsync;
  }

  @Override
  public String typeName() {
    return "comprehension";
  }

  @Override
  public List<Field> fields() {
    return ImmutableList.of(field("target", target), field("iter", iter),
                            field("ifs", ifs),
                            field("is_async", isAsync ? 1 : 0));
  }
}

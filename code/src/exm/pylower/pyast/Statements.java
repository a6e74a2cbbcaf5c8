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
import exm.pylower.pyast.Expressions.Name;
import exm.pylower.pyast.Operators.BinaryOperator;

/**
 * Concrete statement variants
 */
public class Statements {

  /**
   * Expression evaluated for its effect
   */
  public static final class ExprStmt extends Statement {
    public final Expression value;

    public ExprStmt(SourceRange range, Expression value) {
      super(range);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.EXPR;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value));
    }
  }

  /**
   * <code>a = b = value</code>: one target per <code>=</code>
   */
  public static final class Assign extends Statement {
    public final ImmutableList<Expression> targets;
    public final Expression value;

    public Assign(SourceRange range, List<? extends Expression> targets,
                  Expression value) {
      super(range);
      assert(!targets.isEmpty());
      this.targets = ImmutableList.copyOf(targets);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("targets", targets),
                              field("value", value),
                              field("type_comment", null));
    }
  }

  public static final class AugAssign extends Statement {
    public final Expression target;
    public final BinaryOperator op;
    public final Expression value;

    public AugAssign(SourceRange range, Expression target, BinaryOperator op,
                     Expression value) {
      super(range);
      this.target = target;
      this.op = op;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.AUG_ASSIGN;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("target", target), field("op", op),
                              field("value", value));
    }
  }

  /**
   * <code>target: annotation [= value]</code>
   */
  public static final class AnnAssign extends Statement {
    public final Expression target;
    public final Expression annotation;
    /** Null when nothing is assigned */
    public final Expression value;
    /** Target is a plain, unparenthesized name */
    public final boolean simple;

    public AnnAssign(SourceRange range, Expression target,
                     Expression annotation, Expression value,
                     boolean simple) {
      super(range);
      this.target = target;
      this.annotation = annotation;
      this.value = value;
      this.simple = simple;
    }

    @Override
    public Kind kind() {
      return Kind.ANN_ASSIGN;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("target", target),
                              field("annotation", annotation),
                              field("value", value),
                              field("simple", simple ? 1 : 0));
    }
  }

  public static final class Delete extends Statement {
    public final ImmutableList<Expression> targets;

    public Delete(SourceRange range, List<? extends Expression> targets) {
      super(range);
      this.targets = ImmutableList.copyOf(targets);
    }

    @Override
    public Kind kind() {
      return Kind.DELETE;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("targets", targets));
    }
  }

  public static final class Pass extends Statement {
    public Pass(SourceRange range) {
      super(range);
    }

    @Override
    public Kind kind() {
      return Kind.PASS;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of();
    }
  }

  /**
   * <code>type Name[params] = value</code>
   */
  public static final class TypeAlias extends Statement {
    public final Name name;
    public final ImmutableList<TypeParam> typeParams;
    public final Expression value;

    public TypeAlias(SourceRange range, Name name,
                     List<? extends TypeParam> typeParams, Expression value) {
      super(range);
      this.name = name;
      this.typeParams = ImmutableList.copyOf(typeParams);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.TYPE_ALIAS;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("name", name),
                              field("type_params", typeParams),
                              field("value", value));
    }
  }
}

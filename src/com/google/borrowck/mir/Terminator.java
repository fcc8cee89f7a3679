/*
 * Copyright 2018 The Closure Compiler Authors.
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
 * limitations under the License.
 */
package com.google.borrowck.mir;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** The statement that ends a basic block and transfers control. */
public interface Terminator {

  SourceSpan span();

  /** Indices of the blocks control may continue in. */
  ImmutableList<Integer> successors();

  /** {@code goto target} */
  record Goto(int target, SourceSpan span) implements Terminator {
    @Override
    public ImmutableList<Integer> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "goto -> bb" + target;
    }
  }

  /** Returns from the function; the return place holds the result. */
  record Return(SourceSpan span) implements Terminator {
    @Override
    public ImmutableList<Integer> successors() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "return";
    }
  }

  /** Control never reaches the end of this block. */
  record Unreachable(SourceSpan span) implements Terminator {
    @Override
    public ImmutableList<Integer> successors() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "unreachable";
    }
  }

  /**
   * {@code destination = func(args) -> target}. A diverging call has neither destination nor
   * target.
   */
  record Call(
      Operand func,
      ImmutableList<Operand> args,
      @Nullable Place destination,
      @Nullable Integer target,
      SourceSpan span)
      implements Terminator {
    public Call {
      requireNonNull(func, "func");
      requireNonNull(args, "args");
      requireNonNull(span, "span");
    }

    @Override
    public ImmutableList<Integer> successors() {
      return target == null ? ImmutableList.of() : ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return (destination == null ? "" : destination + " = ")
          + func
          + "("
          + Joiner.on(", ").join(args)
          + ")";
    }
  }

  /** Runs the drop glue of {@code place}, then continues at {@code target}. */
  record Drop(Place place, int target, SourceSpan span) implements Terminator {
    public Drop {
      requireNonNull(place, "place");
      requireNonNull(span, "span");
    }

    @Override
    public ImmutableList<Integer> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "drop(" + place + ") -> bb" + target;
    }
  }

  /** Drops the old value of {@code place} and stores {@code value} in it. */
  record DropAndReplace(Place place, Operand value, int target, SourceSpan span)
      implements Terminator {
    public DropAndReplace {
      requireNonNull(place, "place");
      requireNonNull(value, "value");
      requireNonNull(span, "span");
    }

    @Override
    public ImmutableList<Integer> successors() {
      return ImmutableList.of(target);
    }

    @Override
    public String toString() {
      return "replace(" + place + " <- " + value + ") -> bb" + target;
    }
  }

  /** Branches on the value of {@code discriminant}. */
  record SwitchInt(Operand discriminant, ImmutableList<Integer> targets, SourceSpan span)
      implements Terminator {
    public SwitchInt {
      requireNonNull(discriminant, "discriminant");
      requireNonNull(targets, "targets");
      requireNonNull(span, "span");
    }

    @Override
    public ImmutableList<Integer> successors() {
      return targets;
    }

    @Override
    public String toString() {
      return "switchInt(" + discriminant + ") -> " + targets;
    }
  }
}

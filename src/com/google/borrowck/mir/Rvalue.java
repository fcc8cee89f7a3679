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

import com.google.borrowck.ty.Mutability;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.Ty;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** The right-hand side of an assignment. */
public interface Rvalue {

  /** Computes the type of the value produced. */
  Ty ty(Body body);

  /** The operands read by this rvalue, in evaluation order. */
  ImmutableList<Operand> operands();

  /** {@code operand} */
  record Use(Operand operand) implements Rvalue {
    public Use {
      requireNonNull(operand, "operand");
    }

    @Override
    public Ty ty(Body body) {
      return operand.ty(body);
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(operand);
    }

    @Override
    public String toString() {
      return operand.toString();
    }
  }

  /** {@code &'region place} or {@code &'region mut place}. */
  record Ref(Region region, Mutability mutability, Place place) implements Rvalue {
    public Ref {
      requireNonNull(region, "region");
      requireNonNull(mutability, "mutability");
      requireNonNull(place, "place");
    }

    @Override
    public Ty ty(Body body) {
      return new Ty.Ref(region, place.ty(body), mutability);
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "&" + region + " " + mutability.prefix() + place;
    }
  }

  /** {@code operand as targetTy}. */
  record Cast(Operand operand, Ty targetTy) implements Rvalue {
    public Cast {
      requireNonNull(operand, "operand");
      requireNonNull(targetTy, "targetTy");
    }

    @Override
    public Ty ty(Body body) {
      return targetTy;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(operand);
    }

    @Override
    public String toString() {
      return operand + " as " + targetTy;
    }
  }

  /**
   * Builds a tuple or ADT value from its fields. {@code resultTy} must be a {@link Ty.Tuple} or a
   * {@link Ty.Adt} whose fields line up with {@code fields}.
   */
  record Aggregate(Ty resultTy, ImmutableList<Operand> fields) implements Rvalue {
    public Aggregate {
      requireNonNull(resultTy, "resultTy");
      requireNonNull(fields, "fields");
    }

    @Override
    public Ty ty(Body body) {
      return resultTy;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return fields;
    }

    @Override
    public String toString() {
      return resultTy + " { " + Joiner.on(", ").join(fields) + " }";
    }
  }

  /** An arithmetic or comparison operator producing a scalar. */
  record BinaryOp(String operator, Operand left, Operand right, Ty resultTy) implements Rvalue {
    public BinaryOp {
      requireNonNull(operator, "operator");
      requireNonNull(left, "left");
      requireNonNull(right, "right");
      requireNonNull(resultTy, "resultTy");
    }

    @Override
    public Ty ty(Body body) {
      return resultTy;
    }

    @Override
    public ImmutableList<Operand> operands() {
      return ImmutableList.of(left, right);
    }

    @Override
    public String toString() {
      return left + " " + operator + " " + right;
    }
  }
}

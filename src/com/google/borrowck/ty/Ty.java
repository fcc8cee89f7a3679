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
package com.google.borrowck.ty;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A type of the analyzed language. Types are immutable values with structural equality, so they
 * can be used as cache keys.
 */
public interface Ty extends GenericArg {

  Ty BOOL = new Scalar("bool");
  Ty I32 = new Scalar("i32");
  Ty U32 = new Scalar("u32");
  Ty UNIT = new Tuple(ImmutableList.of());

  static Ty scalar(String name) {
    return new Scalar(name);
  }

  static Ty ref(Region region, Ty pointee) {
    return new Ref(region, pointee, Mutability.NOT);
  }

  static Ty refMut(Region region, Ty pointee) {
    return new Ref(region, pointee, Mutability.MUT);
  }

  static Ty adt(AdtDef def, GenericArg... args) {
    return new Adt(def, ImmutableList.copyOf(args));
  }

  static Ty tuple(Ty... elements) {
    return new Tuple(ImmutableList.copyOf(elements));
  }

  static Ty fnPtr(Binder<FnSig> sig) {
    return new FnPtr(sig);
  }

  /** A function pointer type without bound regions, {@code fn(inputs) -> output}. */
  static Ty fnPtr(Ty output, Ty... inputs) {
    return new FnPtr(Binder.dummy(new FnSig(ImmutableList.copyOf(inputs), output)));
  }

  static Ty param(int index, String name) {
    return new Param(index, name);
  }

  static Ty canonical(int var) {
    return new CanonicalVar(var);
  }

  /** A primitive type such as {@code u32} or {@code bool}. */
  record Scalar(String name) implements Ty {
    public Scalar {
      requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code &'r T} or {@code &'r mut T}. */
  record Ref(Region region, Ty pointee, Mutability mutability) implements Ty {
    public Ref {
      requireNonNull(region, "region");
      requireNonNull(pointee, "pointee");
      requireNonNull(mutability, "mutability");
    }

    @Override
    public String toString() {
      return "&" + region + " " + mutability.prefix() + pointee;
    }
  }

  /** A struct or enum applied to generic arguments. */
  record Adt(AdtDef def, ImmutableList<GenericArg> args) implements Ty {
    public Adt {
      requireNonNull(def, "def");
      checkArgument(
          args.size() == def.getParams().size(),
          "%s expects %s generic arguments, got %s",
          def.getName(),
          def.getParams().size(),
          args.size());
    }

    @Override
    public String toString() {
      return args.isEmpty()
          ? def.getName()
          : def.getName() + "<" + Joiner.on(", ").join(args) + ">";
    }
  }

  /** A tuple; the empty tuple is the unit type. */
  record Tuple(ImmutableList<Ty> elements) implements Ty {
    public Tuple {
      requireNonNull(elements, "elements");
    }

    @Override
    public String toString() {
      return elements.size() == 1
          ? "(" + elements.get(0) + ",)"
          : "(" + Joiner.on(", ").join(elements) + ")";
    }
  }

  /** A function pointer, possibly quantified over regions: {@code for<'a> fn(&'a u32)}. */
  record FnPtr(Binder<FnSig> sig) implements Ty {
    public FnPtr {
      requireNonNull(sig, "sig");
    }

    @Override
    public String toString() {
      return sig.toString();
    }
  }

  /** A type parameter of the enclosing item, or of an {@link AdtDef} before substitution. */
  record Param(int index, String name) implements Ty {
    @Override
    public String toString() {
      return name;
    }
  }

  /** A type variable of a canonical query value, bound at most once per relation. */
  record CanonicalVar(int var) implements Ty {
    @Override
    public String toString() {
      return "?" + var;
    }
  }
}

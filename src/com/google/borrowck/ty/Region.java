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

import static java.util.Objects.requireNonNull;

/**
 * A region (lifetime) as it appears in a type.
 *
 * <p>By the time a body reaches region inference every free region has been replaced by a
 * {@link Var}. The other shapes only occur in specific contexts: {@link LateBound} inside a
 * {@link Binder}, {@link EarlyBound} inside an {@link AdtDef} field before substitution, and
 * {@link Canonical} in the left-hand side of a canonical type annotation.
 */
public interface Region extends GenericArg {

  Region STATIC = new Static();

  static Region var(RegionVid vid) {
    return new Var(vid);
  }

  static Region var(int index) {
    return new Var(RegionVid.of(index));
  }

  static Region lateBound(DebruijnIndex debruijn, BoundRegion br) {
    return new LateBound(debruijn, br);
  }

  static Region lateBound(int debruijn, String name) {
    return new LateBound(DebruijnIndex.of(debruijn), BoundRegion.named(name));
  }

  static Region earlyBound(int index, String name) {
    return new EarlyBound(index, name);
  }

  static Region canonical(int var) {
    return new Canonical(var);
  }

  /** A region inference variable. */
  record Var(RegionVid vid) implements Region {
    public Var {
      requireNonNull(vid, "vid");
    }

    @Override
    public String toString() {
      return vid.toString();
    }
  }

  /** A region bound by an enclosing {@code for<..>} binder. */
  record LateBound(DebruijnIndex debruijn, BoundRegion br) implements Region {
    public LateBound {
      requireNonNull(debruijn, "debruijn");
      requireNonNull(br, "br");
    }

    @Override
    public String toString() {
      return "'" + br + debruijn;
    }
  }

  /** The {@code index}-th generic parameter of an ADT definition. */
  record EarlyBound(int index, String name) implements Region {
    @Override
    public String toString() {
      return name;
    }
  }

  /** A region variable of a canonical query value. */
  record Canonical(int var) implements Region {
    @Override
    public String toString() {
      return "'?" + var;
    }
  }

  /** The {@code 'static} region. */
  record Static() implements Region {
    @Override
    public String toString() {
      return "'static";
    }
  }
}

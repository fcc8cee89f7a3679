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

/**
 * How subtyping of a container relates to subtyping of one of its components.
 *
 * <ul>
 *   <li>covariant: {@code a <: b}
 *   <li>contravariant: {@code b <: a}
 *   <li>invariant: {@code a == b}
 *   <li>bivariant: the relation does not matter
 * </ul>
 *
 * <p>Regions are ordered by inclusion, so {@code 'a <: 'b} means {@code 'b: 'a}. A reference
 * {@code &'a T} is therefore contravariant in {@code 'a}, and so is a region parameter that only
 * appears as the region of references.
 */
public enum Variance {
  COVARIANT,
  INVARIANT,
  CONTRAVARIANT,
  BIVARIANT;

  /**
   * Composes this ambient variance with the variance {@code v} of a component being entered.
   *
   * <p>For example, entering the argument of a function (contravariant) while relating covariantly
   * yields contravariance, and entering it again flips back to covariance.
   */
  public Variance xform(Variance v) {
    switch (this) {
      case COVARIANT:
        return v;
      case INVARIANT:
        return INVARIANT;
      case CONTRAVARIANT:
        switch (v) {
          case COVARIANT:
            return CONTRAVARIANT;
          case CONTRAVARIANT:
            return COVARIANT;
          default:
            return v;
        }
      case BIVARIANT:
        return BIVARIANT;
    }
    throw new IllegalStateException("unexpected variance " + this);
  }
}

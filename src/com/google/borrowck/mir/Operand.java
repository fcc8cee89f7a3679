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

import com.google.borrowck.ty.Ty;
import org.jspecify.annotations.Nullable;

/** An argument of an rvalue or a call. */
public interface Operand {

  static Operand copy(Place place) {
    return new Copy(place);
  }

  static Operand move(Place place) {
    return new Move(place);
  }

  static Operand constant(Ty ty, String literal) {
    return new Constant(ty, literal);
  }

  /** The place read by this operand, or null for a constant. */
  @Nullable Place place();

  /** Computes the type of this operand in {@code body}. */
  Ty ty(Body body);

  /** Reads a place, leaving it initialized. */
  record Copy(Place place) implements Operand {
    public Copy {
      requireNonNull(place, "place");
    }

    @Override
    public Ty ty(Body body) {
      return place.ty(body);
    }

    @Override
    public String toString() {
      return place.toString();
    }
  }

  /** Reads a place and deinitializes it. */
  record Move(Place place) implements Operand {
    public Move {
      requireNonNull(place, "place");
    }

    @Override
    public Ty ty(Body body) {
      return place.ty(body);
    }

    @Override
    public String toString() {
      return "move " + place;
    }
  }

  /** A literal value. */
  record Constant(Ty ty, String literal) implements Operand {
    public Constant {
      requireNonNull(ty, "ty");
      requireNonNull(literal, "literal");
    }

    @Override
    public @Nullable Place place() {
      return null;
    }

    @Override
    public Ty ty(Body body) {
      return ty;
    }

    @Override
    public String toString() {
      return "const " + literal;
    }
  }
}

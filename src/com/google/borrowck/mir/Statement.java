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

/** A non-branching MIR statement. */
public interface Statement {

  SourceSpan span();

  /** {@code place = rvalue} */
  record Assign(Place place, Rvalue rvalue, SourceSpan span) implements Statement {
    public Assign {
      requireNonNull(place, "place");
      requireNonNull(rvalue, "rvalue");
      requireNonNull(span, "span");
    }

    @Override
    public String toString() {
      return place + " = " + rvalue;
    }
  }

  /** Start of the storage of a local. */
  record StorageLive(Local local, SourceSpan span) implements Statement {
    public StorageLive {
      requireNonNull(local, "local");
      requireNonNull(span, "span");
    }

    @Override
    public String toString() {
      return "StorageLive(" + local + ")";
    }
  }

  /** End of the storage of a local; its value is gone afterwards. */
  record StorageDead(Local local, SourceSpan span) implements Statement {
    public StorageDead {
      requireNonNull(local, "local");
      requireNonNull(span, "span");
    }

    @Override
    public String toString() {
      return "StorageDead(" + local + ")";
    }
  }

  /** No operation. */
  record Nop(SourceSpan span) implements Statement {
    @Override
    public String toString() {
      return "nop";
    }
  }
}

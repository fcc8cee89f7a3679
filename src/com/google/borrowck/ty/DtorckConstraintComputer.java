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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Computes {@code dropck_outlives} from ADT definitions.
 *
 * <p>For each value that is dropped, we explore all the data that will be dropped transitively.
 * For each type with a destructor, all of its generic arguments must be assumed live while the
 * destructor runs, unless the parameter is marked {@code #[may_dangle]}. References, scalars and
 * function pointers have no drop glue. Type parameters are opaque, so they themselves must
 * outlive the drop.
 *
 * <p>A type reached again while it is being expanded contributes nothing new. A type that keeps
 * growing (polymorphic recursion) is cut off at the recursion limit and recorded as an overflow.
 */
public final class DtorckConstraintComputer implements TypeQueries {

  private static final Logger logger = Logger.getLogger(DtorckConstraintComputer.class.getName());

  public static final int DEFAULT_RECURSION_LIMIT = 64;

  private final int recursionLimit;

  public DtorckConstraintComputer() {
    this(DEFAULT_RECURSION_LIMIT);
  }

  public DtorckConstraintComputer(int recursionLimit) {
    checkArgument(recursionLimit > 0, "recursion limit must be positive");
    this.recursionLimit = recursionLimit;
  }

  @Override
  public TypeOpOutput<DropckOutlivesResult> dropckOutlives(Ty ty) {
    Computation computation = new Computation();
    computation.visit(ty, 0);
    DropckOutlivesResult result =
        new DropckOutlivesResult(
            ImmutableList.copyOf(computation.kinds), ImmutableList.copyOf(computation.overflows));
    logger.fine("dropck_outlives(" + ty + ") = " + result);
    return TypeOpOutput.of(result);
  }

  private final class Computation {
    final Set<GenericArg> kinds = new LinkedHashSet<>();
    final Set<Ty> overflows = new LinkedHashSet<>();
    final Set<Ty> inProgress = new HashSet<>();

    void visit(Ty ty, int depth) {
      if (depth > recursionLimit) {
        overflows.add(ty);
        return;
      }
      if (ty instanceof Ty.Scalar || ty instanceof Ty.Ref || ty instanceof Ty.FnPtr) {
        return;
      }
      if (ty instanceof Ty.Param || ty instanceof Ty.CanonicalVar) {
        kinds.add(ty);
        return;
      }
      if (ty instanceof Ty.Tuple tuple) {
        for (Ty element : tuple.elements()) {
          visit(element, depth + 1);
        }
        return;
      }
      Ty.Adt adt = (Ty.Adt) ty;
      if (!inProgress.add(adt)) {
        return;
      }
      try {
        visitAdt(adt, depth);
      } finally {
        inProgress.remove(adt);
      }
    }

    private void visitAdt(Ty.Adt adt, int depth) {
      AdtDef def = adt.def();
      if (def.isPhantomData()) {
        kinds.add(adt.args().get(0));
        return;
      }
      for (Ty field : def.getFields()) {
        visit(Types.substitute(field, adt.args()), depth + 1);
      }
      if (def.hasDestructor()) {
        for (int i = 0; i < def.getParams().size(); i++) {
          if (!def.getParams().get(i).mayDangle()) {
            kinds.add(adt.args().get(i));
          }
        }
      }
    }
  }
}

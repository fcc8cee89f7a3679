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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.Types;
import com.google.common.collect.ImmutableList;

/** A memory location: a local followed by a chain of derefs and field projections. */
public record Place(Local local, ImmutableList<Place.Projection> projections) {

  /** One step of a place: {@code *p} or {@code p.N}. */
  public record Projection(boolean isDeref, int field) {
    public static final Projection DEREF = new Projection(true, -1);

    public static Projection field(int index) {
      checkArgument(index >= 0, "negative field index %s", index);
      return new Projection(false, index);
    }

    @Override
    public String toString() {
      return isDeref ? "*" : "." + field;
    }
  }

  public static final Place RETURN_PLACE = new Place(Local.RETURN_PLACE, ImmutableList.of());

  public Place {
    requireNonNull(local, "local");
    requireNonNull(projections, "projections");
  }

  public static Place of(Local local) {
    return new Place(local, ImmutableList.of());
  }

  public Place deref() {
    return project(Projection.DEREF);
  }

  public Place field(int index) {
    return project(Projection.field(index));
  }

  private Place project(Projection projection) {
    return new Place(
        local, ImmutableList.<Projection>builder().addAll(projections).add(projection).build());
  }

  /** Whether this place is a bare local, with no projections. */
  public boolean isLocal() {
    return projections.isEmpty();
  }

  public boolean isReturnPlace() {
    return isLocal() && local.isReturnPlace();
  }

  /** The place with the last projection removed. Must not be called on a bare local. */
  public Place parent() {
    checkState(!projections.isEmpty(), "%s has no parent", this);
    return new Place(local, projections.subList(0, projections.size() - 1));
  }

  /** Computes the type of this place in {@code body}. */
  public Ty ty(Body body) {
    Ty ty = body.localDecl(local).ty();
    for (Projection projection : projections) {
      ty = project(ty, projection);
    }
    return ty;
  }

  private static Ty project(Ty base, Projection projection) {
    if (projection.isDeref()) {
      checkArgument(base instanceof Ty.Ref, "cannot deref %s", base);
      return ((Ty.Ref) base).pointee();
    }
    if (base instanceof Ty.Tuple tuple) {
      return tuple.elements().get(projection.field());
    }
    checkArgument(base instanceof Ty.Adt, "cannot project field %s of %s", projection, base);
    Ty.Adt adt = (Ty.Adt) base;
    return Types.substitute(adt.def().getFields().get(projection.field()), adt.args());
  }

  @Override
  public String toString() {
    String result = local.toString();
    for (Projection projection : projections) {
      result = projection.isDeref() ? "(*" + result + ")" : result + projection;
    }
    return result;
  }
}

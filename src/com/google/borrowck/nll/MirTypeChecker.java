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
package com.google.borrowck.nll;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.MirVisitor;
import com.google.borrowck.mir.Operand;
import com.google.borrowck.mir.Place;
import com.google.borrowck.mir.Rvalue;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.Statement;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.BoundRegion;
import com.google.borrowck.ty.FnSig;
import com.google.borrowck.ty.Mutability;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.Types;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Walks a body and relates the types at each statement and terminator, recording the outlives
 * constraints that make the body well typed.
 *
 * <p>The body is expected to be well typed apart from its regions. A type mismatch means the
 * body was built incorrectly, so it is reported as an {@link IllegalStateException} rather than
 * as a diagnostic.
 */
final class MirTypeChecker extends MirVisitor {
  private static final Logger logger = Logger.getLogger(MirTypeChecker.class.getName());

  private final BorrowCheckContext cx;
  private final Body body;

  private MirTypeChecker(BorrowCheckContext cx) {
    this.cx = cx;
    this.body = cx.body;
  }

  static void typeCheck(BorrowCheckContext cx) {
    new MirTypeChecker(cx).visitBody(cx.body);
    logger.fine(
        "type check of " + cx.body + ": " + cx.constraints.size() + " outlives constraints");
  }

  @Override
  public void visitStatement(Statement statement, Location location) {
    if (!(statement instanceof Statement.Assign assign)) {
      return;
    }
    Ty placeTy = assign.place().ty(body);
    Ty rvalueTy = assign.rvalue().ty(body);
    relate(rvalueTy, placeTy, Locations.interesting(location), assign.span());
    checkRvalue(assign.rvalue(), location, assign.span());
  }

  private void checkRvalue(Rvalue rvalue, Location location, SourceSpan span) {
    if (rvalue instanceof Rvalue.Ref ref) {
      addReborrowConstraint(location, ref.region(), ref.place());
    } else if (rvalue instanceof Rvalue.Cast cast) {
      Ty operandTy = cast.operand().ty(body);
      Ty targetTy = cast.targetTy();
      if ((operandTy instanceof Ty.Ref && targetTy instanceof Ty.Ref)
          || (operandTy instanceof Ty.FnPtr && targetTy instanceof Ty.FnPtr)) {
        relate(operandTy, targetTy, Locations.interesting(location), span);
      }
    } else if (rvalue instanceof Rvalue.Aggregate aggregate) {
      checkAggregate(aggregate, location, span);
    }
  }

  private void checkAggregate(Rvalue.Aggregate aggregate, Location location, SourceSpan span) {
    ImmutableList<Operand> fields = aggregate.fields();
    for (int i = 0; i < fields.size(); i++) {
      Ty fieldTy = aggregateFieldTy(aggregate.resultTy(), i);
      relate(fields.get(i).ty(body), fieldTy, Locations.interesting(location), span);
    }
  }

  private static Ty aggregateFieldTy(Ty resultTy, int index) {
    if (resultTy instanceof Ty.Tuple tuple) {
      return tuple.elements().get(index);
    }
    if (resultTy instanceof Ty.Adt adt) {
      return Types.substitute(adt.def().getFields().get(index), adt.args());
    }
    throw new IllegalStateException("aggregate of non-aggregate type " + resultTy);
  }

  /**
   * Adds the constraints a reborrow {@code &'borrow (*p).f} needs: each reference dereferenced on
   * the way to the borrowed place must outlive the borrow. The walk stops at the first shared
   * reference, since data behind it is reachable through that reference independently.
   */
  private void addReborrowConstraint(Location location, Region borrowRegion, Place borrowedPlace) {
    RegionVid borrowVid = cx.universalRegions.toRegionVid(borrowRegion);
    Place place = borrowedPlace;
    while (!place.isLocal()) {
      Place base = place.parent();
      if (place.projections().get(place.projections().size() - 1).isDeref()) {
        Ty baseTy = base.ty(body);
        if (baseTy instanceof Ty.Ref ref) {
          cx.pushOutlives(
              cx.universalRegions.toRegionVid(ref.region()),
              borrowVid,
              Locations.boring(location));
          if (ref.mutability() == Mutability.NOT) {
            // Shared data is reachable independently of the path.
            break;
          }
        }
      }
      place = base;
    }
  }

  @Override
  public void visitTerminator(Terminator terminator, Location location) {
    if (terminator instanceof Terminator.Call call) {
      checkCall(call, location);
    } else if (terminator instanceof Terminator.DropAndReplace replace) {
      relate(
          replace.value().ty(body),
          replace.place().ty(body),
          Locations.interesting(location),
          replace.span());
    }
  }

  private void checkCall(Terminator.Call call, Location location) {
    Ty funcTy = call.func().ty(body);
    if (!(funcTy instanceof Ty.FnPtr fnPtr)) {
      throw new IllegalStateException("broken MIR: call of non-function type " + funcTy);
    }
    FnSig sig = instantiateLateBoundRegions(fnPtr);
    if (sig.inputs().size() != call.args().size()) {
      throw new IllegalStateException(
          "broken MIR: " + call + " passes " + call.args().size() + " arguments to " + funcTy);
    }
    Locations locations = Locations.interesting(location);
    for (int i = 0; i < call.args().size(); i++) {
      relate(call.args().get(i).ty(body), sig.inputs().get(i), locations, call.span());
    }
    if (call.destination() != null) {
      relate(sig.output(), call.destination().ty(body), locations, call.span());
    }
  }

  /** Replaces the regions bound by the function pointer's own binder with fresh variables. */
  private FnSig instantiateLateBoundRegions(Ty.FnPtr fnPtr) {
    Map<BoundRegion, Region> replacements = new HashMap<>();
    Types.RegionFolder folder =
        (region, outerIndex) -> {
          if (region instanceof Region.LateBound lateBound
              && lateBound.debruijn().equals(outerIndex)) {
            return replacements.computeIfAbsent(
                lateBound.br(), br -> cx.variables().newVar());
          }
          return region;
        };
    FnSig sig = fnPtr.sig().skipBinder();
    ImmutableList.Builder<Ty> inputs = ImmutableList.builder();
    for (Ty input : sig.inputs()) {
      inputs.add(Types.foldRegions(input, folder));
    }
    return new FnSig(inputs.build(), Types.foldRegions(sig.output(), folder));
  }

  private void relate(Ty sub, Ty sup, Locations locations, SourceSpan span) {
    try {
      TypeRelating.subTypes(sub, sup, locations, span, cx.relatingContext());
    } catch (TypeRelationException e) {
      throw new IllegalStateException(
          "broken MIR in " + body + " at " + locations + ": " + sub + " is not a subtype of "
              + sup,
          e);
    }
  }
}

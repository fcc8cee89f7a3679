/*
 * Copyright 2004 The Closure Compiler Authors.
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

/**
 * Walks the places, operands and rvalues of a body. Subclasses override the hooks they care
 * about; every default implementation recurses into the components.
 */
public abstract class MirVisitor {

  public void visitBody(Body body) {
    for (int block = 0; block < body.blockCount(); block++) {
      visitBasicBlock(body, block);
    }
  }

  public void visitBasicBlock(Body body, int block) {
    BasicBlockData data = body.block(block);
    for (int i = 0; i < data.statements().size(); i++) {
      visitStatement(data.statements().get(i), Location.of(block, i));
    }
    visitTerminator(data.terminator(), body.terminatorLocation(block));
  }

  public void visitStatement(Statement statement, Location location) {
    if (statement instanceof Statement.Assign assign) {
      visitPlace(assign.place(), PlaceContext.STORE, location);
      visitRvalue(assign.rvalue(), location);
    } else if (statement instanceof Statement.StorageLive storageLive) {
      visitPlace(Place.of(storageLive.local()), PlaceContext.STORAGE_LIVE, location);
    } else if (statement instanceof Statement.StorageDead storageDead) {
      visitPlace(Place.of(storageDead.local()), PlaceContext.STORAGE_DEAD, location);
    }
  }

  public void visitTerminator(Terminator terminator, Location location) {
    if (terminator instanceof Terminator.Call call) {
      if (call.destination() != null) {
        visitPlace(call.destination(), PlaceContext.CALL, location);
      }
      visitOperand(call.func(), location);
      for (Operand arg : call.args()) {
        visitOperand(arg, location);
      }
    } else if (terminator instanceof Terminator.Drop drop) {
      visitPlace(drop.place(), PlaceContext.DROP, location);
    } else if (terminator instanceof Terminator.DropAndReplace replace) {
      visitPlace(replace.place(), PlaceContext.DROP, location);
      visitOperand(replace.value(), location);
    } else if (terminator instanceof Terminator.SwitchInt switchInt) {
      visitOperand(switchInt.discriminant(), location);
    } else if (terminator instanceof Terminator.Return) {
      visitPlace(Place.RETURN_PLACE, PlaceContext.MOVE, location);
    }
  }

  public void visitRvalue(Rvalue rvalue, Location location) {
    if (rvalue instanceof Rvalue.Ref ref) {
      visitPlace(ref.place(), PlaceContext.BORROW, location);
      return;
    }
    for (Operand operand : rvalue.operands()) {
      visitOperand(operand, location);
    }
  }

  public void visitOperand(Operand operand, Location location) {
    if (operand instanceof Operand.Copy copy) {
      visitPlace(copy.place(), PlaceContext.COPY, location);
    } else if (operand instanceof Operand.Move move) {
      visitPlace(move.place(), PlaceContext.MOVE, location);
    }
  }

  /**
   * Visits a place. The default implementation reports the base local, with {@link
   * PlaceContext#PROJECTION} when the place is projected.
   */
  public void visitPlace(Place place, PlaceContext context, Location location) {
    visitLocal(place.local(), place.isLocal() ? context : PlaceContext.PROJECTION, location);
  }

  public void visitLocal(Local local, PlaceContext context, Location location) {}
}

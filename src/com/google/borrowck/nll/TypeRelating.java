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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.ty.Binder;
import com.google.borrowck.ty.BoundRegion;
import com.google.borrowck.ty.Canonical;
import com.google.borrowck.ty.DebruijnIndex;
import com.google.borrowck.ty.FnSig;
import com.google.borrowck.ty.GenericArg;
import com.google.borrowck.ty.Mutability;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import com.google.borrowck.ty.Types;
import com.google.borrowck.ty.Variance;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Relates two types structurally and records the region relationships this requires as outlives
 * constraints, instead of unifying regions.
 *
 * <p>The ambient variance says how {@code a} must relate to {@code b}: covariant for {@code a <:
 * b}, contravariant for {@code b <: a}, invariant for equality. When the walk meets a pair of
 * regions it emits {@code b: a} under covariance, {@code a: b} under contravariance and both under
 * invariance.
 *
 * <p>To check {@code A <: B} where both may bind regions, the bound regions of {@code B} are
 * instantiated universally, with placeholders each in a new universe, and only then those of
 * {@code A} existentially, so that the existentials may name the placeholders. Under
 * contravariance the roles are swapped; under invariance both checks run. A stack of {@link
 * BoundRegionScope}s per side resolves a bound region through its De Bruijn index.
 *
 * <p>Canonical variables on the {@code a} side are bound the first time they are met and
 * related to whatever they meet afterwards.
 */
final class TypeRelating {
  private static final Logger logger = Logger.getLogger(TypeRelating.class.getName());

  /** The tables a relation writes into. */
  record Context(UniversalRegions universalRegions, ConstraintSet constraints) {
    Context {
      requireNonNull(universalRegions, "universalRegions");
      requireNonNull(constraints, "constraints");
    }
  }

  private final Context cx;
  private final Locations locations;
  private final SourceSpan span;
  private Variance ambientVariance;
  private List<BoundRegionScope> aScopes = new ArrayList<>();
  private final List<BoundRegionScope> bScopes = new ArrayList<>();
  private final @Nullable GenericArg[] canonicalVarValues;

  private TypeRelating(
      Context cx,
      Variance ambientVariance,
      Locations locations,
      SourceSpan span,
      int canonicalVarCount) {
    this.cx = cx;
    this.ambientVariance = ambientVariance;
    this.locations = locations;
    this.span = span;
    this.canonicalVarValues = new GenericArg[canonicalVarCount];
  }

  /** Requires {@code a <: b}. */
  static void subTypes(Ty a, Ty b, Locations locations, SourceSpan span, Context cx)
      throws TypeRelationException {
    logger.fine("sub_types(a=" + a + ", b=" + b + ", locations=" + locations + ")");
    new TypeRelating(cx, Variance.COVARIANT, locations, span, 0).relateRoot(a, b);
  }

  /** Requires {@code a == b}. */
  static void eqTypes(Ty a, Ty b, Locations locations, SourceSpan span, Context cx)
      throws TypeRelationException {
    logger.fine("eq_types(a=" + a + ", b=" + b + ", locations=" + locations + ")");
    new TypeRelating(cx, Variance.INVARIANT, locations, span, 0).relateRoot(a, b);
  }

  /**
   * Requires the value of a query answer to equal {@code b}, binding the canonical variables of
   * {@code a} along the way.
   */
  static void eqCanonicalTypeAndType(
      Canonical<Ty> a, Ty b, Locations locations, SourceSpan span, Context cx)
      throws TypeRelationException {
    logger.fine("eq_canonical_type_and_type(a=" + a + ", b=" + b + ")");
    new TypeRelating(cx, Variance.INVARIANT, locations, span, a.variableCount())
        .relateRoot(a.value(), b);
  }

  private void relateRoot(Ty a, Ty b) throws TypeRelationException {
    relate(a, b);
    checkState(
        aScopes.isEmpty() && bScopes.isEmpty(),
        "unbalanced bound region scopes: %s / %s",
        aScopes,
        bScopes);
  }

  private boolean ambientCovariance() {
    return ambientVariance == Variance.COVARIANT || ambientVariance == Variance.INVARIANT;
  }

  private boolean ambientContravariance() {
    return ambientVariance == Variance.CONTRAVARIANT || ambientVariance == Variance.INVARIANT;
  }

  void relate(GenericArg a, GenericArg b) throws TypeRelationException {
    if (a instanceof Region && b instanceof Region) {
      regions((Region) a, (Region) b);
    } else if (a instanceof Ty && b instanceof Ty) {
      tys((Ty) a, (Ty) b);
    } else {
      throw TypeRelationException.mismatch(a, b);
    }
  }

  private void relateWithVariance(Variance variance, GenericArg a, GenericArg b)
      throws TypeRelationException {
    Variance oldAmbientVariance = ambientVariance;
    ambientVariance = ambientVariance.xform(variance);
    try {
      relate(a, b);
    } finally {
      ambientVariance = oldAmbientVariance;
    }
  }

  private void tys(Ty a, Ty b) throws TypeRelationException {
    if (a instanceof Ty.CanonicalVar var) {
      equateVar(var.var(), b);
      return;
    }
    if (logger.isLoggable(Level.FINER)) {
      logger.finer("tys(a=" + a + ", b=" + b + ", variance=" + ambientVariance + ")");
    }
    if (a instanceof Ty.Scalar || a instanceof Ty.Param) {
      if (!a.equals(b)) {
        throw TypeRelationException.mismatch(a, b);
      }
    } else if (a instanceof Ty.Ref refA && b instanceof Ty.Ref refB) {
      if (refA.mutability() != refB.mutability()) {
        throw TypeRelationException.mismatch(a, b);
      }
      relateWithVariance(Variance.CONTRAVARIANT, refA.region(), refB.region());
      Variance pointeeVariance =
          refA.mutability() == Mutability.MUT ? Variance.INVARIANT : Variance.COVARIANT;
      relateWithVariance(pointeeVariance, refA.pointee(), refB.pointee());
    } else if (a instanceof Ty.Adt adtA && b instanceof Ty.Adt adtB) {
      if (adtA.def() != adtB.def()) {
        throw TypeRelationException.mismatch(a, b);
      }
      ImmutableList<Variance> variances = adtA.def().getVariances();
      for (int i = 0; i < variances.size(); i++) {
        relateWithVariance(variances.get(i), adtA.args().get(i), adtB.args().get(i));
      }
    } else if (a instanceof Ty.Tuple tupleA && b instanceof Ty.Tuple tupleB) {
      if (tupleA.elements().size() != tupleB.elements().size()) {
        throw TypeRelationException.mismatch(a, b);
      }
      for (int i = 0; i < tupleA.elements().size(); i++) {
        relate(tupleA.elements().get(i), tupleB.elements().get(i));
      }
    } else if (a instanceof Ty.FnPtr fnA && b instanceof Ty.FnPtr fnB) {
      binders(fnA.sig(), fnB.sig());
    } else {
      throw TypeRelationException.mismatch(a, b);
    }
  }

  private void fnSigs(FnSig a, FnSig b) throws TypeRelationException {
    if (a.inputs().size() != b.inputs().size()) {
      throw TypeRelationException.mismatch(Ty.fnPtr(Binder.dummy(a)), Ty.fnPtr(Binder.dummy(b)));
    }
    for (int i = 0; i < a.inputs().size(); i++) {
      relateWithVariance(Variance.CONTRAVARIANT, a.inputs().get(i), b.inputs().get(i));
    }
    relate(a.output(), b.output());
  }

  private void regions(Region a, Region b) throws TypeRelationException {
    if (a instanceof Region.Canonical canonical) {
      equateVar(canonical.var(), b);
      return;
    }
    RegionVid vA = replaceBoundRegion(a, DebruijnIndex.INNERMOST, aScopes);
    RegionVid vB = replaceBoundRegion(b, DebruijnIndex.INNERMOST, bScopes);
    if (logger.isLoggable(Level.FINER)) {
      logger.finer(
          "regions(a=" + a + " => " + vA + ", b=" + b + " => " + vB + ", variance="
              + ambientVariance + ")");
    }
    if (ambientCovariance()) {
      pushOutlives(vB, vA);
    }
    if (ambientContravariance()) {
      pushOutlives(vA, vB);
    }
  }

  private void binders(Binder<FnSig> a, Binder<FnSig> b) throws TypeRelationException {
    if (ambientCovariance()) {
      // Instantiate b universally first so that a's existentials live in a universe that can
      // name b's placeholders.
      BoundRegionScope bScope = createScope(b, true);
      BoundRegionScope aScope = createScope(a, false);
      logger.finer("binders: a_scope = " + aScope + " (existential)");
      logger.finer("binders: b_scope = " + bScope + " (universal)");
      relateInScopes(aScope, bScope, a, b);
    }
    if (ambientContravariance()) {
      BoundRegionScope aScope = createScope(a, true);
      BoundRegionScope bScope = createScope(b, false);
      logger.finer("binders: a_scope = " + aScope + " (universal)");
      logger.finer("binders: b_scope = " + bScope + " (existential)");
      relateInScopes(aScope, bScope, a, b);
    }
  }

  private void relateInScopes(
      BoundRegionScope aScope, BoundRegionScope bScope, Binder<FnSig> a, Binder<FnSig> b)
      throws TypeRelationException {
    int aDepth = aScopes.size();
    int bDepth = bScopes.size();
    bScopes.add(bScope);
    aScopes.add(aScope);
    try {
      fnSigs(a.skipBinder(), b.skipBinder());
    } finally {
      bScopes.remove(bScopes.size() - 1);
      aScopes.remove(aScopes.size() - 1);
    }
    checkState(
        aScopes.size() == aDepth && bScopes.size() == bDepth, "unbalanced bound region scopes");
  }

  /**
   * Instantiates the regions bound by {@code value}: with placeholders if {@code
   * universallyQuantified}, all in one fresh universe, and with fresh existential variables
   * otherwise. A binder that binds no region opens no universe.
   */
  private BoundRegionScope createScope(Binder<FnSig> value, boolean universallyQuantified) {
    Set<BoundRegion> boundRegions = new LinkedHashSet<>();
    Types.RegionVisitor collector =
        (region, outerIndex) -> {
          if (region instanceof Region.LateBound lateBound
              && lateBound.debruijn().equals(outerIndex)) {
            boundRegions.add(lateBound.br());
          }
          return false;
        };
    FnSig sig = value.skipBinder();
    for (Ty input : sig.inputs()) {
      Types.visitRegions(input, collector);
    }
    Types.visitRegions(sig.output(), collector);

    BoundRegionScope scope = new BoundRegionScope();
    if (boundRegions.isEmpty()) {
      return scope;
    }
    RegionVariables variables = cx.universalRegions().getVariables();
    @Nullable UniverseIndex universe = universallyQuantified ? variables.createSubUniverse() : null;
    for (BoundRegion br : boundRegions) {
      scope.put(
          br,
          universe != null ? variables.newPlaceholder(universe, br) : variables.newExistential());
    }
    return scope;
  }

  private static RegionVid lookupBoundRegion(
      Region.LateBound region, DebruijnIndex firstFreeIndex, List<BoundRegionScope> scopes) {
    int debruijnIndex = region.debruijn().index() - firstFreeIndex.index();
    checkState(
        debruijnIndex < scopes.size(), "%s escapes all %s binders", region, scopes.size());
    BoundRegionScope scope = scopes.get(scopes.size() - debruijnIndex - 1);
    RegionVid vid = scope.get(region.br());
    checkState(vid != null, "%s not instantiated in %s", region, scope);
    return vid;
  }

  private RegionVid replaceBoundRegion(
      Region region, DebruijnIndex firstFreeIndex, List<BoundRegionScope> scopes) {
    if (region instanceof Region.LateBound lateBound) {
      return lookupBoundRegion(lateBound, firstFreeIndex, scopes);
    }
    return cx.universalRegions().toRegionVid(region);
  }

  private void pushOutlives(RegionVid sup, RegionVid sub) {
    logger.finer("push_outlives(" + sup + ": " + sub + ")");
    cx.constraints().push(new OutlivesConstraint(sup, sub, locations, span));
  }

  /**
   * Equates canonical variable {@code var} with {@code bKind}. The first time, {@code bKind} is
   * recorded with the bound regions of the enclosing {@code b} binders replaced by their
   * variables; afterwards the recorded value is related to {@code bKind}.
   */
  private void equateVar(int var, GenericArg bKind) throws TypeRelationException {
    checkState(
        ambientVariance == Variance.INVARIANT,
        "canonical variable related under %s",
        ambientVariance);
    GenericArg aKind = canonicalVarValues[var];
    if (aKind != null) {
      logger.finer("equate_var: relating captured " + aKind + " to " + bKind);
      // The captured value is closed, so it must not see the a-side scopes.
      List<BoundRegionScope> oldAScopes = aScopes;
      aScopes = new ArrayList<>();
      try {
        relate(aKind, bKind);
      } finally {
        aScopes = oldAScopes;
      }
      return;
    }
    GenericArg closedKind = instantiateTraversedBinders(bScopes, bKind);
    canonicalVarValues[var] = closedKind;
    logger.finer("equate_var: capturing value " + closedKind);
  }

  private GenericArg instantiateTraversedBinders(List<BoundRegionScope> scopes, GenericArg kind) {
    GenericArg closed =
        Types.foldRegions(
            kind,
            (region, firstFreeIndex) -> {
              if (region instanceof Region.LateBound lateBound
                  && lateBound.debruijn().compareTo(firstFreeIndex) < 0) {
                return region;
              }
              return Region.var(replaceBoundRegion(region, firstFreeIndex, scopes));
            });
    checkState(!Types.hasEscapingBoundRegions(closed), "%s still has escaping regions", closed);
    return closed;
  }
}

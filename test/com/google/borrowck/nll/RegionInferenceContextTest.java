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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.Statement;
import com.google.borrowck.mir.Terminator;
import com.google.borrowck.ty.Binder;
import com.google.borrowck.ty.FnSig;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RegionInferenceContextTest {

  private static final SourceSpan SPAN = SourceSpan.of("test.rs", 7, 1, 1);

  private RegionVariables vars;
  private UniversalRegions.Builder universalRegionsBuilder;
  private ConstraintSet constraints;
  private LivenessConstraints liveness;
  private BorrowckOptions options;
  private final List<BorrowckError> errors = new ArrayList<>();

  @Before
  public void setUp() {
    vars = new RegionVariables();
    universalRegionsBuilder = UniversalRegions.builder(vars);
    constraints = new ConstraintSet();
    liveness = new LivenessConstraints();
    options = new BorrowckOptions();
  }

  /** One block with two statements: points bb0[0], bb0[1] and bb0[2]. */
  private static Body threePoints() {
    Body.Builder builder = Body.builder("f", Ty.UNIT);
    int bb0 = builder.newBlock();
    builder.push(bb0, new Statement.Nop(SPAN));
    builder.push(bb0, new Statement.Nop(SPAN));
    builder.terminate(bb0, new Terminator.Return(SPAN));
    return builder.build();
  }

  private void outlives(RegionVid sup, RegionVid sub) {
    constraints.push(new OutlivesConstraint(sup, sub, Locations.interesting(Location.START), SPAN));
  }

  private RegionInferenceContext solve(UniversalRegions universalRegions) {
    RegionInferenceContext regionCx =
        new RegionInferenceContext(threePoints(), universalRegions, constraints, liveness, options);
    regionCx.solve(errors);
    return regionCx;
  }

  @Test
  public void testLivenessPropagatesToOutlivingRegions() {
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    RegionVid r1 = vars.newExistential();
    RegionVid r2 = vars.newExistential();
    RegionVid r3 = vars.newExistential();
    RegionVid unrelated = vars.newExistential();
    Cause cause = new Cause.LiveVar(Local.of(1), Location.of(0, 0));
    liveness.addElement(r1, Location.of(0, 0), cause);
    liveness.addElement(r1, Location.of(0, 2), cause);
    outlives(r2, r1);
    outlives(r3, r2);

    RegionInferenceContext regionCx = solve(universalRegions);

    assertThat(regionCx.regionPoints(r3)).containsExactly(Location.of(0, 0), Location.of(0, 2));
    assertThat(regionCx.regionContainsPoint(r3, Location.of(0, 1))).isFalse();
    assertThat(regionCx.regionValueString(r3)).isEqualTo("{bb0[0], bb0[2]}");
    assertThat(regionCx.regionPoints(unrelated)).isEmpty();
    assertThat(regionCx.whyRegionContainsPoint(r3, Location.of(0, 0))).isEqualTo(cause);
    assertThat(errors).isEmpty();
  }

  @Test
  public void testUniversalRegionContainsEveryPointAndItself() {
    RegionVid a = universalRegionsBuilder.addLocal("'a");
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    RegionVid x = vars.newExistential();
    outlives(x, a);

    RegionInferenceContext regionCx = solve(universalRegions);

    assertThat(regionCx.regionValueString(a)).isEqualTo("{bb0[0..=2], '_#1r}");
    assertThat(regionCx.regionContainsFreeRegion(x, a)).isTrue();
    assertThat(regionCx.regionContainsPoint(x, Location.of(0, 1))).isTrue();
    assertThat(regionCx.whyRegionContainsPoint(x, Location.of(0, 1)))
        .isEqualTo(new Cause.UniversalRegion(a));
    assertThat(errors).isEmpty();
  }

  @Test
  public void testUniversalRegionForcedToOutliveAnother() {
    RegionVid a = universalRegionsBuilder.addLocal("'a");
    RegionVid b = universalRegionsBuilder.addLocal("'b");
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    RegionVid x = vars.newExistential();
    outlives(a, x);
    outlives(x, b);

    solve(universalRegions);

    assertThat(errors).hasSize(1);
    BorrowckError error = errors.get(0);
    assertThat(error.type()).isEqualTo(NllDiagnostics.NLL_UNSATISFIED_LIFETIME_CONSTRAINTS);
    assertThat(error.span()).isEqualTo(SPAN);
    assertThat(error.labelTexts())
        .containsExactly("free region requires that `'a` must outlive `'b`");
  }

  @Test
  public void testDeclaredRelationsAreTransitive() {
    RegionVid a = universalRegionsBuilder.addLocal("'a");
    RegionVid b = universalRegionsBuilder.addLocal("'b");
    RegionVid c = universalRegionsBuilder.addLocal("'c");
    UniversalRegions universalRegions =
        universalRegionsBuilder.addOutlives(a, b).addOutlives(b, c).build();
    outlives(a, c);
    outlives(universalRegions.getFnStatic(), a);

    solve(universalRegions);

    assertThat(errors).isEmpty();
  }

  @Test
  public void testNothingButStaticOutlivesStatic() {
    RegionVid a = universalRegionsBuilder.addLocal("'a");
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    outlives(a, universalRegions.getFnStatic());

    solve(universalRegions);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).labelTexts())
        .containsExactly("free region requires that `'a` must outlive `'static`");
  }

  @Test
  public void testErrorsPerRegionAreCapped() {
    RegionVid a = universalRegionsBuilder.addLocal("'a");
    RegionVid b = universalRegionsBuilder.addLocal("'b");
    RegionVid c = universalRegionsBuilder.addLocal("'c");
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    outlives(a, b);
    outlives(a, c);

    solve(universalRegions);
    assertThat(errors).hasSize(1);

    errors.clear();
    constraints = new ConstraintSet();
    outlives(a, b);
    outlives(a, c);
    options.setMaxErrorsPerRegion(2);
    solve(universalRegions);
    assertThat(errors).hasSize(2);
  }

  private static Ty identity(Region region) {
    return Ty.fnPtr(Ty.ref(region, Ty.U32), Ty.ref(region, Ty.U32));
  }

  private static Ty polymorphicIdentity() {
    Region bound = Region.lateBound(0, "b");
    return Ty.fnPtr(Binder.bind(FnSig.of(Ty.ref(bound, Ty.U32), Ty.ref(bound, Ty.U32))));
  }

  @Test
  public void testMonomorphicFunctionIsNotASubtypeOfPolymorphic() throws Exception {
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    Region a = vars.newVar();
    TypeRelating.subTypes(
        identity(a),
        polymorphicIdentity(),
        Locations.interesting(Location.START),
        SPAN,
        new TypeRelating.Context(universalRegions, constraints));

    solve(universalRegions);

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).type()).isEqualTo(NllDiagnostics.NLL_HIGHER_RANKED_SUBTYPE_ERROR);
    assertThat(errors.get(0).span()).isEqualTo(SPAN);
  }

  @Test
  public void testPolymorphicFunctionIsASubtypeOfMonomorphic() throws Exception {
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    Region a = vars.newVar();
    TypeRelating.subTypes(
        polymorphicIdentity(),
        identity(a),
        Locations.interesting(Location.START),
        SPAN,
        new TypeRelating.Context(universalRegions, constraints));

    solve(universalRegions);

    assertThat(errors).isEmpty();
  }

  @Test
  public void testPlaceholderMustNotContainPoints() throws Exception {
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    Region a = vars.newVar();
    TypeRelating.subTypes(
        identity(a),
        polymorphicIdentity(),
        Locations.interesting(Location.START),
        SPAN,
        new TypeRelating.Context(universalRegions, constraints));
    Location point = Location.of(0, 1);
    liveness.addElement(((Region.Var) a).vid(), point, new Cause.LiveVar(Local.of(1), point));

    solve(universalRegions);

    // Reported once, though the placeholder both holds a point and escapes its universe.
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).type()).isEqualTo(NllDiagnostics.NLL_HIGHER_RANKED_SUBTYPE_ERROR);
  }

  @Test
  public void testSolveOnlyOnce() {
    RegionInferenceContext regionCx = solve(universalRegionsBuilder.build());
    assertThat(regionCx.isSolved()).isTrue();
    assertThrows(IllegalStateException.class, () -> regionCx.solve(errors));
  }

  @Test
  public void testValuesUnavailableBeforeSolve() {
    RegionInferenceContext regionCx =
        new RegionInferenceContext(
            threePoints(), universalRegionsBuilder.build(), constraints, liveness, options);
    assertThrows(
        IllegalStateException.class,
        () -> regionCx.regionContainsPoint(RegionVid.of(0), Location.START));
  }

  @Test
  public void testWhyRequiresContainedPoint() {
    UniversalRegions universalRegions = universalRegionsBuilder.build();
    RegionVid r = vars.newExistential();
    RegionInferenceContext regionCx = solve(universalRegions);
    assertThrows(
        IllegalArgumentException.class,
        () -> regionCx.whyRegionContainsPoint(r, Location.of(0, 1)));
  }
}

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
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/** Static helpers to walk, fold and substitute the regions and types inside a type. */
public final class Types {

  /** Called for each region occurrence together with the number of binders entered so far. */
  @FunctionalInterface
  public interface RegionVisitor {
    /** Returns true to stop the walk. */
    boolean visit(Region region, DebruijnIndex outerIndex);
  }

  /** Replaces each region occurrence; see {@link RegionVisitor} for {@code outerIndex}. */
  @FunctionalInterface
  public interface RegionFolder {
    Region fold(Region region, DebruijnIndex outerIndex);
  }

  private Types() {}

  /**
   * Visits every region in {@code arg}, tracking how many binders enclose each occurrence.
   *
   * @return true if the visitor stopped the walk
   */
  public static boolean visitRegions(GenericArg arg, RegionVisitor visitor) {
    return visit(arg, DebruijnIndex.INNERMOST, visitor);
  }

  private static boolean visit(GenericArg arg, DebruijnIndex outer, RegionVisitor visitor) {
    if (arg instanceof Region) {
      return visitor.visit((Region) arg, outer);
    }
    Ty ty = (Ty) arg;
    if (ty instanceof Ty.Ref ref) {
      return visitor.visit(ref.region(), outer) || visit(ref.pointee(), outer, visitor);
    } else if (ty instanceof Ty.Adt adt) {
      for (GenericArg a : adt.args()) {
        if (visit(a, outer, visitor)) {
          return true;
        }
      }
    } else if (ty instanceof Ty.Tuple tuple) {
      for (Ty element : tuple.elements()) {
        if (visit(element, outer, visitor)) {
          return true;
        }
      }
    } else if (ty instanceof Ty.FnPtr fnPtr) {
      DebruijnIndex inner = outer.shiftedIn(1);
      FnSig sig = fnPtr.sig().skipBinder();
      for (Ty input : sig.inputs()) {
        if (visit(input, inner, visitor)) {
          return true;
        }
      }
      return visit(sig.output(), inner, visitor);
    }
    return false;
  }

  /**
   * Invokes {@code callback} on every region that appears free in {@code arg}, that is every
   * region not bound by a binder inside {@code arg}.
   */
  public static void forEachFreeRegion(GenericArg arg, Consumer<Region> callback) {
    visitRegions(
        arg,
        (region, outer) -> {
          if (!isBoundWithin(region, outer)) {
            callback.accept(region);
          }
          return false;
        });
  }

  /** Whether some free region of {@code arg} satisfies {@code test}. */
  public static boolean anyFreeRegion(GenericArg arg, Predicate<Region> test) {
    return visitRegions(arg, (region, outer) -> !isBoundWithin(region, outer) && test.test(region));
  }

  /** Whether {@code arg} mentions the inference variable {@code vid} as a free region. */
  public static boolean containsRegion(GenericArg arg, RegionVid vid) {
    return anyFreeRegion(arg, r -> r instanceof Region.Var var && var.vid().equals(vid));
  }

  /** Whether {@code arg} refers to a binder that encloses it. */
  public static boolean hasEscapingBoundRegions(GenericArg arg) {
    return visitRegions(
        arg,
        (region, outer) ->
            region instanceof Region.LateBound lateBound
                && lateBound.debruijn().compareTo(outer) >= 0);
  }

  private static boolean isBoundWithin(Region region, DebruijnIndex outer) {
    return region instanceof Region.LateBound lateBound
        && lateBound.debruijn().compareTo(outer) < 0;
  }

  /** Rebuilds {@code ty} with every region occurrence replaced by {@code folder}. */
  public static Ty foldRegions(Ty ty, RegionFolder folder) {
    return fold(ty, DebruijnIndex.INNERMOST, folder);
  }

  /** Like {@link #foldRegions(Ty, RegionFolder)} for any generic argument. */
  public static GenericArg foldRegions(GenericArg arg, RegionFolder folder) {
    if (arg instanceof Region) {
      return folder.fold((Region) arg, DebruijnIndex.INNERMOST);
    }
    return fold((Ty) arg, DebruijnIndex.INNERMOST, folder);
  }

  private static Ty fold(Ty ty, DebruijnIndex outer, RegionFolder folder) {
    if (ty instanceof Ty.Ref ref) {
      return new Ty.Ref(
          folder.fold(ref.region(), outer), fold(ref.pointee(), outer, folder), ref.mutability());
    } else if (ty instanceof Ty.Adt adt) {
      ImmutableList.Builder<GenericArg> args = ImmutableList.builder();
      for (GenericArg a : adt.args()) {
        args.add(
            a instanceof Region ? folder.fold((Region) a, outer) : fold((Ty) a, outer, folder));
      }
      return new Ty.Adt(adt.def(), args.build());
    } else if (ty instanceof Ty.Tuple tuple) {
      ImmutableList.Builder<Ty> elements = ImmutableList.builder();
      for (Ty element : tuple.elements()) {
        elements.add(fold(element, outer, folder));
      }
      return new Ty.Tuple(elements.build());
    } else if (ty instanceof Ty.FnPtr fnPtr) {
      DebruijnIndex inner = outer.shiftedIn(1);
      FnSig sig = fnPtr.sig().skipBinder();
      ImmutableList.Builder<Ty> inputs = ImmutableList.builder();
      for (Ty input : sig.inputs()) {
        inputs.add(fold(input, inner, folder));
      }
      return new Ty.FnPtr(
          Binder.bind(new FnSig(inputs.build(), fold(sig.output(), inner, folder))));
    }
    return ty;
  }

  /**
   * Replaces the generic parameters of an ADT definition occurring in {@code ty} by {@code args}.
   * The arguments must not contain escaping bound regions.
   */
  public static Ty substitute(Ty ty, List<GenericArg> args) {
    if (args.isEmpty()) {
      return ty;
    }
    if (ty instanceof Ty.Param param) {
      checkArgument(param.index() < args.size(), "no argument for %s", param);
      GenericArg arg = args.get(param.index());
      checkArgument(arg instanceof Ty, "type parameter %s substituted by region %s", param, arg);
      return (Ty) arg;
    } else if (ty instanceof Ty.Ref ref) {
      return new Ty.Ref(
          substitute(ref.region(), args), substitute(ref.pointee(), args), ref.mutability());
    } else if (ty instanceof Ty.Adt adt) {
      ImmutableList.Builder<GenericArg> newArgs = ImmutableList.builder();
      for (GenericArg a : adt.args()) {
        newArgs.add(a instanceof Region ? substitute((Region) a, args) : substitute((Ty) a, args));
      }
      return new Ty.Adt(adt.def(), newArgs.build());
    } else if (ty instanceof Ty.Tuple tuple) {
      ImmutableList.Builder<Ty> elements = ImmutableList.builder();
      for (Ty element : tuple.elements()) {
        elements.add(substitute(element, args));
      }
      return new Ty.Tuple(elements.build());
    } else if (ty instanceof Ty.FnPtr fnPtr) {
      FnSig sig = fnPtr.sig().skipBinder();
      ImmutableList.Builder<Ty> inputs = ImmutableList.builder();
      for (Ty input : sig.inputs()) {
        inputs.add(substitute(input, args));
      }
      return new Ty.FnPtr(Binder.bind(new FnSig(inputs.build(), substitute(sig.output(), args))));
    }
    return ty;
  }

  private static Region substitute(Region region, List<GenericArg> args) {
    if (region instanceof Region.EarlyBound early) {
      checkArgument(early.index() < args.size(), "no argument for %s", early);
      GenericArg arg = args.get(early.index());
      checkArgument(
          arg instanceof Region, "region parameter %s substituted by type %s", early, arg);
      return (Region) arg;
    }
    return region;
  }
}

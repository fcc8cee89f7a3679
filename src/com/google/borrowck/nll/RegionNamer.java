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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.LocalDecl;
import com.google.borrowck.mir.UpvarDecl;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Ty;
import org.jspecify.annotations.Nullable;

/**
 * Gives universal regions names the user can recognize in a diagnostic.
 *
 * <p>A region with a name in the source keeps it. Any other region gets a synthetic name,
 * {@code '1}, {@code '2} and so on in the order regions are named, and a label on the diagnostic
 * that ties the name to the argument, captured variable or return type mentioning the region.
 * Use one namer per diagnostic.
 */
final class RegionNamer {
  private final Body body;
  private final UniversalRegions universalRegions;
  private int counter = 1;

  RegionNamer(Body body, UniversalRegions universalRegions) {
    this.body = body;
    this.universalRegions = universalRegions;
  }

  /** Names {@code fr}, adding an explanatory label to {@code diag} for synthetic names. */
  String giveRegionAName(RegionVid fr, BorrowckError.Builder diag) {
    checkArgument(universalRegions.isUniversalRegion(fr), "%s is not universal", fr);
    String explicit = universalRegions.name(fr);
    if (explicit != null) {
      return explicit;
    }
    String name = "'" + counter++;
    if (!labelArgument(fr, name, diag) && !labelUpvar(fr, name, diag)) {
      labelReturnType(fr, name, diag);
    }
    return name;
  }

  private boolean labelArgument(RegionVid fr, String name, BorrowckError.Builder diag) {
    Local arg = RegionVarNames.argumentForRegion(body, universalRegions, fr);
    if (arg == null) {
      return false;
    }
    LocalDecl decl = body.localDecl(arg);
    if (decl.ty() instanceof Ty.Ref ref
        && universalRegions.toRegionVid(ref.region()).equals(fr)) {
      diag.addSpanLabel(decl.span(), "let's call the lifetime of this reference `" + name + "`");
    } else {
      diag.addSpanLabel(decl.span(), "lifetime `" + name + "` appears in " + describe(decl));
    }
    return true;
  }

  private static String describe(LocalDecl decl) {
    @Nullable String argName = decl.name();
    return argName == null ? "this argument's type" : "the type of `" + argName + "`";
  }

  private boolean labelUpvar(RegionVid fr, String name, BorrowckError.Builder diag) {
    UpvarDecl upvar = RegionVarNames.upvarForRegion(body, universalRegions, fr);
    if (upvar == null) {
      return false;
    }
    diag.addSpanLabel(
        upvar.span(), "lifetime `" + name + "` appears in the type of `" + upvar.name() + "`");
    return true;
  }

  private void labelReturnType(RegionVid fr, String name, BorrowckError.Builder diag) {
    if (RegionVarNames.mentions(body.returnTy(), universalRegions, fr)) {
      diag.addSpanLabel(body.getSpan(), "lifetime `" + name + "` appears in return type");
    }
  }
}

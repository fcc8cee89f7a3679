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
import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.mir.UpvarDecl;
import com.google.borrowck.ty.GenericArg;
import com.google.borrowck.ty.RegionVid;
import com.google.borrowck.ty.Types;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Finds the variables whose types mention a universal region. */
final class RegionVarNames {

  /** A variable to point at: its name, if it has one, and where it is declared. */
  record VarNameAndSpan(@Nullable String name, SourceSpan span) {}

  private RegionVarNames() {}

  /**
   * Finds the captured variable, or failing that the argument, whose type mentions {@code fr}.
   * Returns null if neither does.
   */
  static @Nullable VarNameAndSpan forRegion(
      Body body, UniversalRegions universalRegions, RegionVid fr) {
    checkArgument(universalRegions.isUniversalRegion(fr), "%s is not universal", fr);
    UpvarDecl upvar = upvarForRegion(body, universalRegions, fr);
    if (upvar != null) {
      return new VarNameAndSpan(upvar.name(), upvar.span());
    }
    Local arg = argumentForRegion(body, universalRegions, fr);
    if (arg != null) {
      LocalDecl decl = body.localDecl(arg);
      return new VarNameAndSpan(decl.name(), decl.span());
    }
    return null;
  }

  static @Nullable UpvarDecl upvarForRegion(
      Body body, UniversalRegions universalRegions, RegionVid fr) {
    for (UpvarDecl upvar : body.getUpvars()) {
      if (mentions(upvar.ty(), universalRegions, fr)) {
        return upvar;
      }
    }
    return null;
  }

  /** The first argument written by the user whose type mentions {@code fr}. */
  static @Nullable Local argumentForRegion(
      Body body, UniversalRegions universalRegions, RegionVid fr) {
    for (Local arg : userArguments(body)) {
      if (mentions(body.localDecl(arg).ty(), universalRegions, fr)) {
        return arg;
      }
    }
    return null;
  }

  /** The arguments of {@code body} minus the environment of a closure. */
  static ImmutableList<Local> userArguments(Body body) {
    ImmutableList<Local> args = body.args();
    return body.isClosure() && !args.isEmpty() ? args.subList(1, args.size()) : args;
  }

  static boolean mentions(GenericArg ty, UniversalRegions universalRegions, RegionVid fr) {
    return Types.anyFreeRegion(ty, r -> universalRegions.toRegionVid(r).equals(fr));
  }
}

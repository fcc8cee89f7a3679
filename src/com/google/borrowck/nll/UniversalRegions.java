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
import static com.google.common.base.Preconditions.checkState;

import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The free regions of a body's signature.
 *
 * <p>{@code 'static} always comes first. Regions declared by the body itself are <em>local</em>;
 * regions a closure inherits from its enclosing function are <em>external</em>. The relations
 * between them are those declared by the signature, closed transitively, plus {@code 'static}
 * outliving everything.
 */
public final class UniversalRegions {

  private final RegionVariables variables;
  private final RegionVid fnStatic;
  private final ImmutableList<RegionVid> universalRegions;
  private final ImmutableSet<RegionVid> localRegions;
  private final Map<RegionVid, String> names;
  private final ImmutableSetMultimap<RegionVid, RegionVid> declaredOutlives;

  private UniversalRegions(Builder builder) {
    this.variables = builder.variables;
    this.fnStatic = builder.fnStatic;
    this.universalRegions = ImmutableList.copyOf(builder.universalRegions);
    this.localRegions = ImmutableSet.copyOf(builder.localRegions);
    this.names = new HashMap<>(builder.names);
    this.declaredOutlives = ImmutableSetMultimap.copyOf(builder.outlives);
  }

  /** Starts the universal regions of a body; creates {@code 'static} in {@code variables}. */
  public static Builder builder(RegionVariables variables) {
    return new Builder(variables);
  }

  public RegionVariables getVariables() {
    return variables;
  }

  public RegionVid getFnStatic() {
    return fnStatic;
  }

  /** All universal regions, {@code 'static} first. */
  public ImmutableList<RegionVid> universalRegions() {
    return universalRegions;
  }

  public boolean isUniversalRegion(RegionVid vid) {
    return universalRegions.contains(vid);
  }

  public boolean isLocalFreeRegion(RegionVid vid) {
    return localRegions.contains(vid);
  }

  /** The name of a universal region as written in the source, or null. */
  public @Nullable String name(RegionVid vid) {
    return names.get(vid);
  }

  /** Whether {@code longer: shorter} is known to hold for two universal regions. */
  public boolean outlives(RegionVid longer, RegionVid shorter) {
    if (longer.equals(shorter) || longer.equals(fnStatic)) {
      return true;
    }
    Set<RegionVid> seen = new HashSet<>();
    Deque<RegionVid> stack = new ArrayDeque<>();
    stack.push(longer);
    while (!stack.isEmpty()) {
      for (RegionVid next : declaredOutlives.get(stack.pop())) {
        if (next.equals(shorter)) {
          return true;
        }
        if (seen.add(next)) {
          stack.push(next);
        }
      }
    }
    return false;
  }

  /**
   * Maps a region appearing free in the body to its variable. Only {@code 'static} and region
   * variables can appear there.
   */
  public RegionVid toRegionVid(Region region) {
    if (region instanceof Region.Var var) {
      return var.vid();
    }
    checkArgument(region instanceof Region.Static, "unexpected free region %s", region);
    return fnStatic;
  }

  /** Builder for {@link UniversalRegions}. */
  public static final class Builder {
    private final RegionVariables variables;
    private final RegionVid fnStatic;
    private final Set<RegionVid> universalRegions = new LinkedHashSet<>();
    private final Set<RegionVid> localRegions = new HashSet<>();
    private final Map<RegionVid, String> names = new HashMap<>();
    private final SetMultimap<RegionVid, RegionVid> outlives = HashMultimap.create();

    private Builder(RegionVariables variables) {
      checkState(variables.size() == 0, "universal regions must be created first");
      this.variables = variables;
      this.fnStatic = variables.newFreeRegion();
      universalRegions.add(fnStatic);
      names.put(fnStatic, "'static");
    }

    /** Adds a free region declared by the body itself. */
    public RegionVid addLocal(@Nullable String name) {
      RegionVid vid = add(name);
      localRegions.add(vid);
      return vid;
    }

    /** Adds a free region inherited from the function enclosing a closure. */
    public RegionVid addExternal(@Nullable String name) {
      return add(name);
    }

    private RegionVid add(@Nullable String name) {
      RegionVid vid = variables.newFreeRegion();
      universalRegions.add(vid);
      if (name != null) {
        names.put(vid, name);
      }
      return vid;
    }

    /** Declares {@code longer: shorter}, as a where-clause does. */
    @CanIgnoreReturnValue
    public Builder addOutlives(RegionVid longer, RegionVid shorter) {
      checkArgument(universalRegions.contains(longer), "%s is not universal", longer);
      checkArgument(universalRegions.contains(shorter), "%s is not universal", shorter);
      outlives.put(longer, shorter);
      return this;
    }

    public UniversalRegions build() {
      return new UniversalRegions(this);
    }
  }
}

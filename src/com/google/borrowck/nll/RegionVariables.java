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

import static java.util.Objects.requireNonNull;

import com.google.borrowck.ty.BoundRegion;
import com.google.borrowck.ty.Region;
import com.google.borrowck.ty.RegionVid;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The region variables of one body, numbered densely in creation order, each with its origin
 * and universe.
 */
public final class RegionVariables {
  private static final Logger logger = Logger.getLogger(RegionVariables.class.getName());

  /** Why a region variable was created. */
  public enum Origin {
    /** A universal region of the signature, such as {@code 'static} or a named lifetime. */
    FREE_REGION,
    /** A bound region of a binder instantiated universally. */
    PLACEHOLDER,
    /** An inference variable. */
    EXISTENTIAL
  }

  /**
   * What is known about a region variable when it is created.
   *
   * @param boundRegion the bound region a placeholder stands for, or null
   */
  public record RegionDefinition(
      Origin origin, UniverseIndex universe, @Nullable BoundRegion boundRegion) {
    public RegionDefinition {
      requireNonNull(origin, "origin");
      requireNonNull(universe, "universe");
    }

    public boolean isUniversal() {
      return origin != Origin.EXISTENTIAL;
    }
  }

  private final List<RegionDefinition> definitions = new ArrayList<>();
  private UniverseIndex currentUniverse = UniverseIndex.ROOT;

  public RegionVid newFreeRegion() {
    return add(new RegionDefinition(Origin.FREE_REGION, UniverseIndex.ROOT, null));
  }

  /** Creates an inference variable in the current universe. */
  public RegionVid newExistential() {
    return add(new RegionDefinition(Origin.EXISTENTIAL, currentUniverse, null));
  }

  /** Shorthand for a fresh inference variable as a {@link Region}. */
  public Region newVar() {
    return Region.var(newExistential());
  }

  RegionVid newPlaceholder(UniverseIndex universe, BoundRegion boundRegion) {
    return add(new RegionDefinition(Origin.PLACEHOLDER, universe, requireNonNull(boundRegion)));
  }

  /**
   * Opens a universe nested in the current one and makes it current. Variables created afterwards
   * may name the placeholders of the new universe.
   */
  UniverseIndex createSubUniverse() {
    currentUniverse = currentUniverse.next();
    logger.finer("created universe " + currentUniverse);
    return currentUniverse;
  }

  private RegionVid add(RegionDefinition definition) {
    definitions.add(definition);
    return RegionVid.of(definitions.size() - 1);
  }

  public RegionDefinition definition(RegionVid vid) {
    return definitions.get(vid.index());
  }

  public int size() {
    return definitions.size();
  }

  public ImmutableList<RegionVid> all() {
    ImmutableList.Builder<RegionVid> vids = ImmutableList.builder();
    for (int i = 0; i < definitions.size(); i++) {
      vids.add(RegionVid.of(i));
    }
    return vids.build();
  }
}

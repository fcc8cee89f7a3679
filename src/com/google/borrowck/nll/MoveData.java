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

import com.google.borrowck.mir.Body;
import com.google.borrowck.mir.Local;
import com.google.borrowck.mir.Location;
import com.google.borrowck.mir.MirVisitor;
import com.google.borrowck.mir.Place;
import com.google.borrowck.mir.PlaceContext;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;

/**
 * The move paths of a body: every local, and every field projection of a local that the body
 * mentions, arranged as a tree per local. Places behind a dereference have no move path of their
 * own; they belong to the path of the reference.
 */
final class MoveData {

  /** A node of the move path tree. {@code parent} is -1 for a local. */
  record MovePath(int index, Place place, int parent) {
    @Override
    public String toString() {
      return "mp" + index + "@" + place;
    }
  }

  private final List<MovePath> paths = new ArrayList<>();
  private final ListMultimap<Integer, Integer> children = ArrayListMultimap.create();
  private final Map<Place, Integer> lookup = new HashMap<>();

  private MoveData() {}

  static MoveData gather(Body body) {
    MoveData data = new MoveData();
    for (int i = 0; i < body.localCount(); i++) {
      data.addPath(Place.of(Local.of(i)), -1);
    }
    new MirVisitor() {
      @Override
      public void visitPlace(Place place, PlaceContext context, Location location) {
        data.movePathFor(place);
      }
    }.visitBody(body);
    return data;
  }

  private int addPath(Place place, int parent) {
    int index = paths.size();
    paths.add(new MovePath(index, place, parent));
    lookup.put(place, index);
    if (parent >= 0) {
      children.put(parent, index);
    }
    return index;
  }

  /** Creates the paths for the field projections of {@code place} up to its first deref. */
  private void movePathFor(Place place) {
    int current = findLocal(place.local());
    Place prefix = Place.of(place.local());
    for (Place.Projection projection : place.projections()) {
      if (projection.isDeref()) {
        return;
      }
      prefix = prefix.field(projection.field());
      Integer existing = lookup.get(prefix);
      current = existing != null ? existing : addPath(prefix, current);
    }
  }

  int findLocal(Local local) {
    Integer index = lookup.get(Place.of(local));
    checkState(index != null, "no move path for %s", local);
    return index;
  }

  /** The move path of exactly {@code place}, or -1 if it has none. */
  int lookupExact(Place place) {
    Integer index = lookup.get(place);
    return index == null ? -1 : index;
  }

  MovePath get(int index) {
    return paths.get(index);
  }

  int size() {
    return paths.size();
  }

  ImmutableList<Integer> children(int index) {
    return ImmutableList.copyOf(children.get(index));
  }

  /** Invokes {@code op} on {@code root} and all of its descendants. */
  void forEachInSubtree(int root, IntConsumer op) {
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      int index = stack.pop();
      op.accept(index);
      for (int child : children.get(index)) {
        stack.push(child);
      }
    }
  }
}

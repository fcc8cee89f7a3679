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

import com.google.borrowck.ty.BoundRegion;
import com.google.borrowck.ty.RegionVid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** The region variables instantiated for the bound regions of one binder. */
final class BoundRegionScope {
  private final Map<BoundRegion, RegionVid> map = new LinkedHashMap<>();

  @Nullable RegionVid get(BoundRegion br) {
    return map.get(br);
  }

  void put(BoundRegion br, RegionVid vid) {
    map.put(br, vid);
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

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
package com.google.borrowck.mir;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A local slot of a MIR body. Local {@code _0} is the return place, locals {@code _1} through
 * {@code _argCount} are the arguments.
 */
public record Local(int index) implements Comparable<Local> {

  public static final Local RETURN_PLACE = new Local(0);

  public Local {
    checkArgument(index >= 0, "negative local index %s", index);
  }

  public static Local of(int index) {
    return index == 0 ? RETURN_PLACE : new Local(index);
  }

  public boolean isReturnPlace() {
    return index == 0;
  }

  @Override
  public int compareTo(Local other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public String toString() {
    return "_" + index;
  }
}

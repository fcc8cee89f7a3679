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

import static java.util.Objects.requireNonNull;

import com.google.borrowck.ty.Ty;
import org.jspecify.annotations.Nullable;

/**
 * Declaration of a local.
 *
 * @param name the user-visible name, or null for a compiler temporary
 */
public record LocalDecl(Ty ty, @Nullable String name, SourceSpan span) {

  public LocalDecl {
    requireNonNull(ty, "ty");
    requireNonNull(span, "span");
  }

  public boolean isUserVariable() {
    return name != null;
  }
}

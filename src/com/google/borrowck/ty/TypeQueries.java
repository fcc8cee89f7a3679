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

/**
 * The narrow query interface through which region inference consults the type checker. Answers
 * must be referentially transparent for a fixed type, so that callers may cache them.
 */
public interface TypeQueries {

  /** Computes which types and regions must outlive the drop of a value of type {@code ty}. */
  TypeOpOutput<DropckOutlivesResult> dropckOutlives(Ty ty);

  /** Normalizes projections in {@code ty}. The default assumes there are none. */
  default Ty normalize(Ty ty) {
    return ty;
  }
}

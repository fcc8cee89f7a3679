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

import java.io.Serializable;

/**
 * A region of source text that a MIR element was lowered from.
 *
 * @param sourceName Name of the source
 * @param lineno One-indexed line number, or -1 if unknown.
 * @param charno Zero-indexed character number, or -1 if unknown.
 * @param length Length of the region.
 */
public record SourceSpan(String sourceName, int lineno, int charno, int length)
    implements Serializable {

  /** A span for synthesized code that has no source position. */
  public static final SourceSpan UNKNOWN = new SourceSpan("", -1, -1, 0);

  public SourceSpan {
    requireNonNull(sourceName, "sourceName");
  }

  public static SourceSpan of(String sourceName, int lineno, int charno, int length) {
    return new SourceSpan(sourceName, lineno, charno, length);
  }

  public boolean isUnknown() {
    return lineno < 0 && charno < 0;
  }

  @Override
  public String toString() {
    return isUnknown() ? "<unknown>" : sourceName + ":" + lineno + ":" + charno;
  }
}

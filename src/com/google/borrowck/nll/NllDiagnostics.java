/*
 * Copyright 2008 The Closure Compiler Authors.
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

/** Diagnostics raised by non-lexical lifetime region checking. */
public final class NllDiagnostics {

  public static final DiagnosticType NLL_UNSATISFIED_LIFETIME_CONSTRAINTS =
      DiagnosticType.error(
          "NLL_UNSATISFIED_LIFETIME_CONSTRAINTS", "unsatisfied lifetime constraints");

  public static final DiagnosticType NLL_BORROWED_DATA_ESCAPES_CLOSURE =
      DiagnosticType.error(
          "NLL_BORROWED_DATA_ESCAPES_CLOSURE", "borrowed data escapes outside of closure");

  public static final DiagnosticType NLL_HIGHER_RANKED_SUBTYPE_ERROR =
      DiagnosticType.error("NLL_HIGHER_RANKED_SUBTYPE_ERROR", "higher-ranked subtype error");

  public static final DiagnosticType NLL_DROPCK_OVERFLOW =
      DiagnosticType.error(
          "NLL_DROPCK_OVERFLOW", "E0320", "overflow while adding drop-check rules for {0}");

  private NllDiagnostics() {}
}

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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import java.text.MessageFormat;
import org.jspecify.annotations.Nullable;

/** The kind of a borrow-check diagnostic. */
public final class DiagnosticType implements Comparable<DiagnosticType>, Serializable {
  private static final long serialVersionUID = 1;

  /** Unique identifier of the diagnostic, such as {@code NLL_DROPCK_OVERFLOW}. */
  public final String key;

  /** The user-facing error code, such as {@code E0320}, or null if there is none. */
  public final @Nullable String code;

  /** The message pattern, in {@link MessageFormat} style. */
  public final String format;

  /** The default reporting level. */
  public final CheckLevel level;

  public static DiagnosticType error(String name, String descriptionFormat) {
    return make(name, null, CheckLevel.ERROR, descriptionFormat);
  }

  public static DiagnosticType error(String name, String code, String descriptionFormat) {
    return make(name, code, CheckLevel.ERROR, descriptionFormat);
  }

  public static DiagnosticType warning(String name, String descriptionFormat) {
    return make(name, null, CheckLevel.WARNING, descriptionFormat);
  }

  /**
   * Create a DiagnosticType at a given CheckLevel.
   *
   * @param name An identifier
   * @param code The error code shown to users, or null
   * @param level Either CheckLevel.ERROR or CheckLevel.WARNING
   * @param descriptionFormat A format string
   */
  public static DiagnosticType make(
      String name, @Nullable String code, CheckLevel level, String descriptionFormat) {
    return new DiagnosticType(name, code, level, descriptionFormat);
  }

  private DiagnosticType(String key, @Nullable String code, CheckLevel level, String format) {
    this.key = requireNonNull(key);
    this.code = code;
    this.level = requireNonNull(level);
    this.format = requireNonNull(format);
  }

  String format(Object... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  @Override
  public boolean equals(@Nullable Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType diagnosticType) {
    return key.compareTo(diagnosticType.key);
  }

  @Override
  public String toString() {
    return code == null ? key + ": " + format : key + "[" + code + "]: " + format;
  }
}

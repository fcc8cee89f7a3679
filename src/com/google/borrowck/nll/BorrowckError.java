/*
 * Copyright 2004 The Closure Compiler Authors.
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

import com.google.borrowck.mir.SourceSpan;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.List;

/**
 * A borrow-check diagnostic.
 *
 * @param type the kind of the diagnostic
 * @param description the formatted primary message
 * @param span where the diagnostic points
 * @param labels secondary messages attached to spans, in the order they were added
 * @param notes free-standing notes printed after the labels
 * @param level the level the diagnostic is reported at
 */
public record BorrowckError(
    DiagnosticType type,
    String description,
    SourceSpan span,
    ImmutableList<SpanLabel> labels,
    ImmutableList<String> notes,
    CheckLevel level)
    implements Serializable {

  /** A message attached to a span. */
  public record SpanLabel(SourceSpan span, String label) implements Serializable {
    public SpanLabel {
      requireNonNull(span, "span");
      requireNonNull(label, "label");
    }

    @Override
    public String toString() {
      return span + ": " + label;
    }
  }

  public BorrowckError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(span, "span");
    requireNonNull(labels, "labels");
    requireNonNull(notes, "notes");
    requireNonNull(level, "level");
  }

  /**
   * Starts a diagnostic of the given type pointing at {@code span}.
   *
   * @param arguments Arguments to be incorporated into the message
   */
  public static Builder builder(DiagnosticType type, SourceSpan span, Object... arguments) {
    return new Builder(type, span, type.format(arguments));
  }

  /** The label texts, without their spans. */
  public ImmutableList<String> labelTexts() {
    ImmutableList.Builder<String> texts = ImmutableList.builder();
    for (SpanLabel label : labels) {
      texts.add(label.label());
    }
    return texts.build();
  }

  /** Renders the diagnostic on multiple lines: the headline, then labels and notes. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    if (!span.isUnknown()) {
      sb.append(span).append(": ");
    }
    sb.append(level).append(" - [").append(type.key).append("] ").append(description);
    for (SpanLabel label : labels) {
      sb.append("\n  ").append(label);
    }
    for (String note : notes) {
      sb.append("\n  = note: ").append(note);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return type.key + ". " + description + " at " + span;
  }

  /** Builder for {@link BorrowckError}. */
  public static final class Builder {
    private final DiagnosticType type;
    private final SourceSpan span;
    private final String description;
    private final ImmutableList.Builder<SpanLabel> labels = ImmutableList.builder();
    private final ImmutableList.Builder<String> notes = ImmutableList.builder();
    private CheckLevel level;

    private Builder(DiagnosticType type, SourceSpan span, String description) {
      this.type = type;
      this.span = requireNonNull(span);
      this.description = description;
      this.level = type.level;
    }

    @CanIgnoreReturnValue
    public Builder addSpanLabel(SourceSpan labelSpan, String label) {
      labels.add(new SpanLabel(labelSpan, label));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addNote(String note) {
      notes.add(requireNonNull(note));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLevel(CheckLevel level) {
      this.level = requireNonNull(level);
      return this;
    }

    public BorrowckError build() {
      return new BorrowckError(type, description, span, labels.build(), notes.build(), level);
    }

    /** Builds the diagnostic and appends it to {@code buffer} unless its level is OFF. */
    public void buffer(List<BorrowckError> buffer) {
      if (level.isOn()) {
        buffer.add(build());
      }
    }
  }
}

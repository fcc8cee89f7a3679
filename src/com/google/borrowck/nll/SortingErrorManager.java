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

import com.google.borrowck.mir.SourceSpan;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * An error manager that sorts and deduplicates all diagnostics reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, BorrowckError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<BorrowckError> getErrors() {
    return collect(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<BorrowckError> getWarnings() {
    return collect(CheckLevel.WARNING);
  }

  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<BorrowckError> collect(CheckLevel level) {
    ImmutableList.Builder<BorrowckError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level == level) {
        errors.add(p.error);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by level (errors first), then by source name, line, column and
   * description. Diagnostics with an unknown span sort before located ones.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<SourceSpan> SPAN_ORDER =
        Comparator.comparing(SourceSpan::sourceName)
            .thenComparingInt(SourceSpan::lineno)
            .thenComparingInt(SourceSpan::charno);

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }
      int spanCompare = SPAN_ORDER.compare(p1.error.span(), p2.error.span());
      if (spanCompare != 0) {
        return spanCompare;
      }
      int keyCompare = p1.error.type().compareTo(p2.error.type());
      if (keyCompare != 0) {
        return keyCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final BorrowckError error;
    final CheckLevel level;

    ErrorWithLevel(BorrowckError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.type(), error.description(), error.span());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level
          && error.type().equals(e.error.type())
          && error.description().equals(e.error.description())
          && error.span().equals(e.error.span());
    }
  }
}

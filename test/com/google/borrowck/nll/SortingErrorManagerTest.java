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

import static com.google.common.truth.Truth.assertThat;

import com.google.borrowck.mir.SourceSpan;
import com.google.borrowck.nll.SortingErrorManager.ErrorWithLevel;
import com.google.borrowck.nll.SortingErrorManager.LeveledErrorComparator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link SortingErrorManager}. */
@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");
  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo");

  private final LeveledErrorComparator comparator = new LeveledErrorComparator();

  private static BorrowckError make(
      DiagnosticType type, String sourceName, int lineno, int charno) {
    return BorrowckError.builder(type, SourceSpan.of(sourceName, lineno, charno, 1)).build();
  }

  private static ErrorWithLevel error(BorrowckError e) {
    return new ErrorWithLevel(e, CheckLevel.ERROR);
  }

  private static ErrorWithLevel warning(BorrowckError e) {
    return new ErrorWithLevel(e, CheckLevel.WARNING);
  }

  private void assertSmaller(ErrorWithLevel p1, ErrorWithLevel p2) {
    assertThat(comparator.compare(p1, p2)).isLessThan(0);
    assertThat(comparator.compare(p2, p1)).isGreaterThan(0);
  }

  @Test
  public void testOrderingSourceName() {
    assertSmaller(error(make(FOO_TYPE, "a", 5, 0)), error(make(FOO_TYPE, "b", 1, 0)));
  }

  @Test
  public void testOrderingUnknownSpanFirst() {
    BorrowckError unknown = BorrowckError.builder(FOO_TYPE, SourceSpan.UNKNOWN).build();
    assertSmaller(error(unknown), error(make(FOO_TYPE, "a", 1, 0)));
  }

  @Test
  public void testOrderingLinenoThenCharno() {
    assertSmaller(error(make(FOO_TYPE, "a", 8, 9)), error(make(FOO_TYPE, "a", 56, 1)));
    assertSmaller(error(make(FOO_TYPE, "a", 8, 1)), error(make(FOO_TYPE, "a", 8, 2)));
  }

  @Test
  public void testOrderingErrorsBeforeWarnings() {
    assertSmaller(error(make(FOO_TYPE, "b", 9, 0)), warning(make(FOO_TYPE, "a", 1, 0)));
  }

  @Test
  public void testOrderingType() {
    assertSmaller(error(make(FOO_TYPE, "a", 1, 0)), error(make(JOO_TYPE, "a", 1, 0)));
    ErrorWithLevel same = error(make(FOO_TYPE, "a", 1, 0));
    assertThat(comparator.compare(same, error(make(FOO_TYPE, "a", 1, 0)))).isEqualTo(0);
  }

  @Test
  public void testDuplicatesAreCountedOnce() {
    SortingErrorManager manager = new SortingErrorManager(ImmutableSet.of());
    manager.report(CheckLevel.ERROR, make(FOO_TYPE, "a", 1, 0));
    manager.report(CheckLevel.ERROR, make(FOO_TYPE, "a", 1, 0));
    manager.report(CheckLevel.WARNING, make(FOO_TYPE, "a", 1, 0));
    manager.report(CheckLevel.OFF, make(JOO_TYPE, "a", 1, 0));

    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.getErrors()).containsExactly(make(FOO_TYPE, "a", 1, 0));
    assertThat(manager.getWarnings()).containsExactly(make(FOO_TYPE, "a", 1, 0));
  }

  @Test
  public void testReportAllUsesEachLevel() {
    SortingErrorManager manager = new SortingErrorManager(ImmutableSet.of());
    BorrowckError warning =
        BorrowckError.builder(JOO_TYPE, SourceSpan.of("a", 1, 0, 1))
            .setLevel(CheckLevel.WARNING)
            .build();
    BorrowckError off =
        BorrowckError.builder(JOO_TYPE, SourceSpan.of("a", 2, 0, 1))
            .setLevel(CheckLevel.OFF)
            .build();
    BorrowckError later = make(FOO_TYPE, "b", 1, 0);
    BorrowckError earlier = make(FOO_TYPE, "a", 3, 0);

    manager.reportAll(ImmutableList.of(later, warning, off, earlier));

    assertThat(manager.getErrors()).containsExactly(earlier, later).inOrder();
    assertThat(manager.getWarnings()).containsExactly(warning);
  }

  @Test
  public void testGenerateReportRunsEveryGenerator() {
    List<Integer> counts = new ArrayList<>();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.<SortingErrorManager.ErrorReportGenerator>of(
                m -> counts.add(m.getErrorCount())));
    manager.report(CheckLevel.ERROR, make(FOO_TYPE, "a", 1, 0));

    manager.generateReport();

    assertThat(counts).containsExactly(1);
  }
}

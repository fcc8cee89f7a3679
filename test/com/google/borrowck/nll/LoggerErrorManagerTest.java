/*
 * Copyright 2007 The Closure Compiler Authors.
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
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");

  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };
  private Logger logger;

  @Before
  public void setUp() {
    logger = Logger.getLogger(LoggerErrorManagerTest.class.getName());
    logger.setUseParentHandlers(false);
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
  }

  private static String message(LogRecord record) {
    return record.getParameters() == null
        ? record.getMessage()
        : MessageFormat.format(record.getMessage(), record.getParameters());
  }

  @Test
  public void testErrorsAndWarningsAreLoggedInOrder() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    BorrowckError warning =
        BorrowckError.builder(FOO_TYPE, SourceSpan.of("a.rs", 1, 1, 1), "w")
            .setLevel(CheckLevel.WARNING)
            .build();
    BorrowckError error =
        BorrowckError.builder(FOO_TYPE, SourceSpan.of("a.rs", 2, 1, 1), "e")
            .addNote("a note")
            .build();
    manager.report(CheckLevel.WARNING, warning);
    manager.report(CheckLevel.ERROR, error);

    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(message(records.get(0))).isEqualTo(error.format());
    assertThat(message(records.get(0))).endsWith("Foo e\n  = note: a note");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(message(records.get(1))).isEqualTo(warning.format());
    assertThat(records.get(2).getLevel()).isEqualTo(Level.WARNING);
    assertThat(message(records.get(2))).isEqualTo("1 error(s), 1 warning(s)");
  }

  @Test
  public void testEmptyReportIsInfo() {
    new LoggerErrorManager(logger).generateReport();

    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
    assertThat(message(records.get(0))).isEqualTo("0 error(s), 0 warning(s)");
  }
}

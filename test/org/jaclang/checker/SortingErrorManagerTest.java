/*
 * Copyright 2026 The Jac Checker Authors.
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

package org.jaclang.checker;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.jaclang.tree.IR;
import org.jaclang.tree.Node;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {

  private static final DiagnosticType WARN =
      DiagnosticType.warning("JAC_TEST_WARNING", "warn {0}");
  private static final DiagnosticType ERR = DiagnosticType.error("JAC_TEST_ERROR", "err {0}");

  private static JacError at(String source, int line, int column, DiagnosticType type, String arg) {
    Node n = IR.name("x").setLinenoCharno(line, column);
    IR.script(IR.exprResult(n)).setSourceFileName(source);
    return JacError.make(n, type, arg);
  }

  @Test
  public void testOrderedByPosition() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.WARNING, at("b.jac", 1, 0, WARN, "1"));
    manager.report(CheckLevel.WARNING, at("a.jac", 9, 0, WARN, "2"));
    manager.report(CheckLevel.ERROR, at("a.jac", 2, 5, ERR, "3"));
    manager.report(CheckLevel.WARNING, at("a.jac", 2, 1, WARN, "4"));

    List<String> descriptions = new ArrayList<>();
    for (SortingErrorManager.ErrorWithLevel message : manager.getSortedDiagnostics()) {
      descriptions.add(message.error().description());
    }
    // Same line: errors before warnings.
    assertThat(descriptions).containsExactly("err 3", "warn 4", "warn 2", "warn 1").inOrder();
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getWarningCount()).isEqualTo(3);
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testOffIsIgnored() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.OFF, at("a.jac", 1, 0, WARN, "1"));
    assertThat(manager.getSortedDiagnostics()).isEmpty();
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testDuplicatesAreDropped() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.WARNING, at("a.jac", 1, 0, WARN, "1"));
    manager.report(CheckLevel.WARNING, at("a.jac", 1, 0, WARN, "1"));
    assertThat(manager.getWarningCount()).isEqualTo(1);
  }

  @Test
  public void testLevelOverridesDefault() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(CheckLevel.ERROR, at("a.jac", 1, 0, WARN, "1"));
    assertThat(manager.getErrors()).hasSize(1);
    assertThat(manager.getWarnings()).isEmpty();
  }

  @Test
  public void testErrorWithoutPosition() {
    JacError error = JacError.make(ERR, "boom");
    assertThat(error.format(CheckLevel.ERROR)).isEqualTo("ERROR - [JAC_TEST_ERROR] err boom");
    assertThat(error.toString())
        .isEqualTo(
            "JAC_TEST_ERROR. err boom at (unknown source) line (unknown line) : (unknown column)");
  }

  @Test
  public void testLoggerErrorManager() {
    Logger logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    List<LogRecord> records = new ArrayList<>();
    logger.addHandler(
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        });

    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(CheckLevel.WARNING, at("a.jac", 3, 0, WARN, "later"));
    manager.report(CheckLevel.ERROR, at("a.jac", 1, 0, ERR, "first"));
    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage())
        .isEqualTo("a.jac:1:0: ERROR - [JAC_TEST_ERROR] err first");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testJsonReport() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, UTF_8);
    SortingErrorManager manager =
        new SortingErrorManager(ImmutableSet.of(new JsonErrorReportGenerator(out)));
    manager.report(CheckLevel.WARNING, at("a.jac", 4, 2, WARN, "json"));
    manager.generateReport();

    JsonArray report = JsonParser.parseString(bytes.toString(UTF_8)).getAsJsonArray();
    assertThat(report.size()).isEqualTo(1);
    JsonObject entry = report.get(0).getAsJsonObject();
    assertThat(entry.get("level").getAsString()).isEqualTo("warning");
    assertThat(entry.get("key").getAsString()).isEqualTo("JAC_TEST_WARNING");
    assertThat(entry.get("description").getAsString()).isEqualTo("warn json");
    assertThat(entry.get("source").getAsString()).isEqualTo("a.jac");
    assertThat(entry.get("line").getAsInt()).isEqualTo(4);
    assertThat(entry.get("column").getAsInt()).isEqualTo(2);
  }
}

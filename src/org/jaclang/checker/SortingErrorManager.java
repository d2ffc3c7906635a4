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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Ordering;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * A customizable error manager that sorts all errors and warnings reported to it, and has
 * customizable output through the {@link ErrorReportGenerator} interface.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledJacErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  /** Responsible for generating the report of the errors at the end of analysis */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(CheckLevel level, JacError error) {
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
  public ImmutableList<JacError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<JacError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  /** Returns every diagnostic with the level it was reported at, sorted by position. */
  public ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<JacError> toList(CheckLevel level) {
    ImmutableList.Builder<JacError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : messages) {
      if (p.level() == level) {
        errors.add(p.error());
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

  /** A diagnostic together with the level it was reported at. */
  public record ErrorWithLevel(JacError error, CheckLevel level) {}

  /**
   * Comparator of {@link JacError} with an associated {@link CheckLevel}. The ordering is the
   * standard lexical ordering on the quintuple (file name, line number, {@link CheckLevel},
   * character number, description).
   */
  static final class LeveledJacErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Ordering<String> SOURCE_ORDER = Ordering.<String>natural().nullsFirst();

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      return ComparisonChain.start()
          .compare(p1.error().sourceName(), p2.error().sourceName(), SOURCE_ORDER)
          .compare(p1.error().lineno(), p2.error().lineno())
          .compare(p1.level(), p2.level())
          .compare(p1.error().charno(), p2.error().charno())
          .compare(p1.error().description(), p2.error().description())
          .compare(p1.error().type(), p2.error().type())
          .result();
    }
  }
}

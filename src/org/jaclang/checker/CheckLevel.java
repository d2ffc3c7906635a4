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

/**
 * The level a narrowing diagnostic is reported at. {@link NarrowingOptions} picks the level of
 * {@code JAC_UNREACHABLE_BRANCH}; internal errors are always {@link #ERROR}. Any error makes the
 * command line runner exit with a failure status.
 */
public enum CheckLevel {
  ERROR("error"),
  WARNING("warning"),
  /** Not reported at all. */
  OFF("off");

  private final String reportName;

  CheckLevel(String reportName) {
    this.reportName = reportName;
  }

  boolean isOn() {
    return this != OFF;
  }

  /** The lower-case name used for the {@code level} field of JSON reports. */
  String getReportName() {
    return reportName;
  }
}

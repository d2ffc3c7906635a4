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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options for the narrowing pass. */
public class NarrowingOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The level at which branches made unreachable by exhaustive narrowing are reported. */
  private CheckLevel unreachableBranchLevel = CheckLevel.WARNING;

  /**
   * Whether the false types of a guard whose branches all return or raise stay in effect for the
   * rest of the enclosing block.
   */
  private boolean earlyExitPropagation = true;

  /** Number of threads analyzing bodies; 1 analyzes them one after the other. */
  private int numThreads = 1;

  public NarrowingOptions() {}

  public CheckLevel getUnreachableBranchLevel() {
    return unreachableBranchLevel;
  }

  public void setUnreachableBranchLevel(CheckLevel level) {
    this.unreachableBranchLevel = level;
  }

  public boolean isEarlyExitPropagation() {
    return earlyExitPropagation;
  }

  public void setEarlyExitPropagation(boolean earlyExitPropagation) {
    this.earlyExitPropagation = earlyExitPropagation;
  }

  public int getNumThreads() {
    return numThreads;
  }

  public void setNumThreads(int numThreads) {
    checkArgument(numThreads > 0, "numThreads must be positive: %s", numThreads);
    this.numThreads = numThreads;
  }

  @Override
  public String toString() {
    return "NarrowingOptions{unreachableBranchLevel="
        + unreachableBranchLevel
        + ", earlyExitPropagation="
        + earlyExitPropagation
        + ", numThreads="
        + numThreads
        + "}";
  }
}

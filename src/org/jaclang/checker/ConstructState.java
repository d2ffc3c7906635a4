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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * The narrowing bookkeeping of one conditional construct while the traversal is inside it: which
 * clause is active, the frame that clause pushed, and what the guards of the clauses seen so far
 * tell when they all failed.
 */
final class ConstructState {

  enum State {
    BEFORE,
    IN_TRUE_BRANCH,
    IN_ELSEIF_BRANCH,
    IN_ELSE_BRANCH,
    AFTER
  }

  private final Node construct;
  private State state = State.BEFORE;
  private int elseIfIndex = 0;
  private @Nullable NarrowingFrame activeFrame;

  /** For each symbol a guard tested so far, its type where every guard so far failed. */
  private final Map<String, JacType> cumulativeFalseTypes = new LinkedHashMap<>();

  private boolean hasElse = false;
  private boolean everyClauseExits = true;

  ConstructState(Node construct) {
    this.construct = construct;
  }

  Node getConstruct() {
    return construct;
  }

  /** Moves to {@code next}, which must be reachable from the current state. */
  void transition(State next) {
    if (!isLegalTransition(state, next)) {
      throw new NarrowingBookkeepingException(
          "Illegal conditional state change " + describeState() + " -> " + next, construct);
    }
    if (next == State.IN_ELSEIF_BRANCH) {
      elseIfIndex++;
    } else if (next == State.IN_ELSE_BRANCH) {
      hasElse = true;
    }
    state = next;
  }

  private static boolean isLegalTransition(State from, State to) {
    switch (from) {
      case BEFORE:
        return to == State.IN_TRUE_BRANCH;
      case IN_TRUE_BRANCH:
      case IN_ELSEIF_BRANCH:
        return to == State.IN_ELSEIF_BRANCH || to == State.IN_ELSE_BRANCH || to == State.AFTER;
      case IN_ELSE_BRANCH:
        return to == State.AFTER;
      case AFTER:
        return false;
    }
    throw new AssertionError(from);
  }

  /** Records the frame the active clause pushed. */
  void setActiveFrame(NarrowingFrame frame) {
    if (activeFrame != null) {
      throw new NarrowingBookkeepingException(
          "Frame " + activeFrame + " still active when pushing " + frame, construct);
    }
    activeFrame = frame;
  }

  /** Returns the frame the active clause pushed and forgets it. */
  NarrowingFrame takeActiveFrame() {
    NarrowingFrame frame = activeFrame;
    if (frame == null) {
      throw new NarrowingBookkeepingException("No active narrowing frame", construct);
    }
    activeFrame = null;
    return frame;
  }

  /**
   * Records the predicates of a guarded clause. Their false types become the cumulative false
   * types of the symbols they test.
   */
  void addClausePredicates(List<NarrowingPredicate> clausePredicates) {
    for (NarrowingPredicate p : clausePredicates) {
      cumulativeFalseTypes.put(p.name(), p.falseType());
    }
  }

  ImmutableMap<String, JacType> getCumulativeFalseTypes() {
    return ImmutableMap.copyOf(cumulativeFalseTypes);
  }

  /** Notes that the body of the clause just left can complete normally. */
  void markFallsThrough() {
    everyClauseExits = false;
  }

  boolean hasElse() {
    return hasElse;
  }

  /** Whether every clause body seen so far ends in a {@code return} or {@code raise}. */
  boolean everyClauseExits() {
    return everyClauseExits;
  }

  @Override
  public String toString() {
    return "ConstructState{"
        + NarrowingBookkeepingException.describe(construct)
        + ", "
        + describeState()
        + "}";
  }

  /** The state, with the 1-based index of the active {@code elif}. */
  private String describeState() {
    return state == State.IN_ELSEIF_BRANCH ? state + "(" + elseIfIndex + ")" : state.toString();
  }
}

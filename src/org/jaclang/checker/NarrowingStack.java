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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import org.jaclang.tree.types.JacType;

/**
 * The narrowing frames active at the current point of a traversal, innermost branch on top.
 *
 * <p>A stack belongs to the traversal of exactly one function or method body; it is not shared and
 * not thread-safe.
 */
final class NarrowingStack {

  private final Deque<NarrowingFrame> frames = new ArrayDeque<>();
  private int pushCount = 0;
  private int popCount = 0;
  private int maxDepth = 0;

  void push(NarrowingFrame frame) {
    frames.push(frame);
    pushCount++;
    maxDepth = Math.max(maxDepth, frames.size());
  }

  /**
   * Pops the top frame, which must be {@code expected}.
   *
   * @throws NarrowingBookkeepingException if the stack is empty or another frame is on top
   */
  void pop(NarrowingFrame expected) {
    NarrowingFrame top = frames.peek();
    if (top == null) {
      throw new NarrowingBookkeepingException(
          "Narrowing stack underflow popping " + expected.getKind() + " frame",
          expected.getClause());
    }
    if (top != expected) {
      throw new NarrowingBookkeepingException(
          "Unbalanced narrowing stack: expected " + expected + " on top but found " + top,
          expected.getClause());
    }
    frames.pop();
    popCount++;
  }

  /**
   * Returns the type of the topmost frame that maps {@code name}, or empty if no active frame
   * narrows it.
   */
  Optional<JacType> lookup(String name) {
    for (NarrowingFrame frame : frames) {
      JacType type = frame.get(name);
      if (type != null) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  boolean isEmpty() {
    return frames.isEmpty();
  }

  int depth() {
    return frames.size();
  }

  int getPushCount() {
    return pushCount;
  }

  int getPopCount() {
    return popCount;
  }

  int getMaxDepth() {
    return maxDepth;
  }
}

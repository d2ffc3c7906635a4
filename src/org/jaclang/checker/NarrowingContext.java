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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.TypeRegistry;

/**
 * Everything the narrowing of one function or method body (or of a script's module-level code)
 * needs while it runs. A context is created fresh for each body and used by a single thread.
 */
final class NarrowingContext {

  private final TypedScope scope;
  private final NarrowingStack stack = new NarrowingStack();
  private final TypeResolver resolver;
  private final PredicateExtractor extractor;
  private final NarrowingOptions options;

  private final Map<Node, ConstructState> constructStates = new IdentityHashMap<>();

  /** Outstanding early-exit frames, most recent first, with the block each is scoped to. */
  private final Deque<ResidualFrame> residualFrames = new ArrayDeque<>();

  private final Map<Node, JacType> resolvedTypes = new LinkedHashMap<>();

  private record ResidualFrame(Node owner, NarrowingFrame frame) {}

  NarrowingContext(
      TypedScope scope,
      TypeRegistry typeRegistry,
      PredicateExtractor extractor,
      NarrowingOptions options) {
    this.scope = scope;
    this.resolver = new TypeResolver(stack, scope, typeRegistry);
    this.extractor = extractor;
    this.options = options;
  }

  TypedScope getScope() {
    return scope;
  }

  NarrowingStack getStack() {
    return stack;
  }

  TypeResolver getResolver() {
    return resolver;
  }

  PredicateExtractor getExtractor() {
    return extractor;
  }

  NarrowingOptions getOptions() {
    return options;
  }

  /** Starts tracking {@code construct}. */
  ConstructState enterConstruct(Node construct) {
    ConstructState state = new ConstructState(construct);
    if (constructStates.putIfAbsent(construct, state) != null) {
      throw new NarrowingBookkeepingException("Construct entered twice", construct);
    }
    return state;
  }

  ConstructState getConstructState(Node construct) {
    ConstructState state = constructStates.get(construct);
    if (state == null) {
      throw new NarrowingBookkeepingException("Construct was never entered", construct);
    }
    return state;
  }

  /** Stops tracking {@code construct}. */
  void exitConstruct(Node construct) {
    constructStates.remove(getConstructState(construct).getConstruct());
  }

  /**
   * Pushes an early-exit frame that stays in effect until the traversal leaves {@code owner}, the
   * block holding the construct whose branches all exit.
   */
  void pushResidual(Node owner, NarrowingFrame frame) {
    stack.push(frame);
    residualFrames.push(new ResidualFrame(owner, frame));
  }

  /** Pops the early-exit frames scoped to {@code owner}. */
  void dischargeResiduals(Node owner) {
    while (!residualFrames.isEmpty() && residualFrames.peek().owner() == owner) {
      stack.pop(residualFrames.pop().frame());
    }
  }

  int getOutstandingResidualCount() {
    return residualFrames.size();
  }

  void recordType(Node reference, JacType type) {
    resolvedTypes.put(reference, type);
  }

  ImmutableMap<Node, JacType> getResolvedTypes() {
    return ImmutableMap.copyOf(resolvedTypes);
  }

  /**
   * Ends the body: pops the early-exit frames still outstanding and checks that nothing else is
   * left on the stack.
   */
  void finish() {
    while (!residualFrames.isEmpty()) {
      stack.pop(residualFrames.pop().frame());
    }
    if (!stack.isEmpty()) {
      throw new NarrowingBookkeepingException(
          "Narrowing stack not empty at end of body, depth " + stack.depth(), scope.getRootNode());
    }
    if (!constructStates.isEmpty()) {
      throw new NarrowingBookkeepingException(
          constructStates.size() + " conditional construct(s) never exited", scope.getRootNode());
    }
  }

  NarrowingResult.BodyStats getStats() {
    return new NarrowingResult.BodyStats(
        scope.getRootNode(), stack.getPushCount(), stack.getPopCount(), stack.getMaxDepth());
  }
}

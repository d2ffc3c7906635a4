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
import java.util.Map;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * One stack-resident mapping from symbol names to narrowed types, scoped to one branch of one
 * conditional construct. Frames are compared by identity.
 */
final class NarrowingFrame {

  /** Why a frame was pushed. */
  enum Kind {
    /** The body of an {@code if} or {@code elif}: the clause's guard holds. */
    TRUE_BRANCH,
    /** The condition of an {@code elif}: every earlier guard failed. */
    ELIF_CONDITION,
    /** The body of an {@code else}: every guard failed. */
    ELSE_BRANCH,
    /** The rest of a block after a construct whose guarded branches all exit. */
    RESIDUAL
  }

  private final Kind kind;
  private final Node clause;
  private final ImmutableMap<String, JacType> types;

  NarrowingFrame(Kind kind, Node clause, Map<String, JacType> types) {
    this.kind = kind;
    this.clause = clause;
    this.types = ImmutableMap.copyOf(types);
  }

  static NarrowingFrame ofTrueTypes(Node clause, Iterable<NarrowingPredicate> predicates) {
    return ofTrueTypes(clause, ImmutableMap.of(), predicates);
  }

  /**
   * Creates the frame of a guarded clause body: {@code priorTypes}, the types known before the
   * guard was evaluated, overridden by the true types of the guard's predicates.
   */
  static NarrowingFrame ofTrueTypes(
      Node clause, Map<String, JacType> priorTypes, Iterable<NarrowingPredicate> predicates) {
    ImmutableMap.Builder<String, JacType> types = ImmutableMap.builder();
    types.putAll(priorTypes);
    for (NarrowingPredicate p : predicates) {
      types.put(p.name(), p.trueType());
    }
    return new NarrowingFrame(Kind.TRUE_BRANCH, clause, types.buildKeepingLast());
  }

  Kind getKind() {
    return kind;
  }

  /** The IF, ELIF or ELSE node whose clause pushed this frame. */
  Node getClause() {
    return clause;
  }

  @Nullable JacType get(String name) {
    return types.get(name);
  }

  ImmutableMap<String, JacType> getTypes() {
    return types;
  }

  @Override
  public String toString() {
    return kind + "@" + clause.getToken() + ":" + clause.getLineno() + types;
  }
}

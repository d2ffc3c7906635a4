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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * What the narrowing pass computed: the type of every declared name reference it resolved, in
 * traversal order, and the diagnostics it reported.
 */
public final class NarrowingResult {

  /**
   * Stack activity of one body.
   *
   * @param root the FUNCTION or SCRIPT node of the body
   * @param pushCount frames pushed
   * @param popCount frames popped
   * @param maxDepth the deepest the stack got
   */
  public record BodyStats(Node root, int pushCount, int popCount, int maxDepth) {}

  private final ImmutableMap<Node, JacType> resolvedTypes;
  private final ImmutableList<BodyStats> bodyStats;
  private final ImmutableList<JacError> errors;
  private final ImmutableList<JacError> warnings;
  private final boolean aborted;

  private NarrowingResult(Builder builder) {
    this.resolvedTypes = builder.resolvedTypes.buildKeepingLast();
    this.bodyStats = builder.bodyStats.build();
    this.errors = builder.errors;
    this.warnings = builder.warnings;
    this.aborted = builder.aborted;
  }

  /** Returns the type resolved for the NAME node {@code reference}, or null if none was. */
  public @Nullable JacType getTypeAt(Node reference) {
    return resolvedTypes.get(reference);
  }

  /** The resolved reference nodes and their types, in traversal order. */
  public ImmutableMap<Node, JacType> getResolvedTypes() {
    return resolvedTypes;
  }

  /** The types resolved for the references to {@code name}, in traversal order. */
  public ImmutableList<JacType> getReferencedTypes(String name) {
    ImmutableList.Builder<JacType> types = ImmutableList.builder();
    for (Map.Entry<Node, JacType> entry : resolvedTypes.entrySet()) {
      if (entry.getKey().getString().equals(name)) {
        types.add(entry.getValue());
      }
    }
    return types.build();
  }

  public ImmutableList<BodyStats> getBodyStats() {
    return bodyStats;
  }

  public ImmutableList<JacError> getErrors() {
    return errors;
  }

  public ImmutableList<JacError> getWarnings() {
    return warnings;
  }

  /** Whether an internal error stopped the pass before every body was analyzed. */
  public boolean isAborted() {
    return aborted;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final ImmutableMap.Builder<Node, JacType> resolvedTypes = ImmutableMap.builder();
    private final ImmutableList.Builder<BodyStats> bodyStats = ImmutableList.builder();
    private ImmutableList<JacError> errors = ImmutableList.of();
    private ImmutableList<JacError> warnings = ImmutableList.of();
    private boolean aborted = false;

    private Builder() {}

    @CanIgnoreReturnValue
    Builder addBody(NarrowingContext context) {
      resolvedTypes.putAll(context.getResolvedTypes());
      bodyStats.add(context.getStats());
      return this;
    }

    @CanIgnoreReturnValue
    Builder setDiagnostics(ErrorManager errorManager) {
      this.errors = errorManager.getErrors();
      this.warnings = errorManager.getWarnings();
      return this;
    }

    @CanIgnoreReturnValue
    Builder setAborted(boolean aborted) {
      this.aborted = aborted;
      return this;
    }

    NarrowingResult build() {
      return new NarrowingResult(this);
    }
  }
}

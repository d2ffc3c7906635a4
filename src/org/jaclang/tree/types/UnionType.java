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

package org.jaclang.tree.types;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;

/**
 * A type that is one of several alternates. Unions are built by {@link
 * TypeRegistry#createUnionType}, which guarantees they are flat, free of duplicates and have at
 * least two alternates. Alternates keep insertion order for display; equality ignores order.
 */
public final class UnionType extends JacType {
  private static final long serialVersionUID = 1L;

  private final ImmutableSet<JacType> alternates;

  UnionType(ImmutableSet<JacType> alternates) {
    checkArgument(alternates.size() > 1, "A union needs at least two alternates: %s", alternates);
    this.alternates = alternates;
  }

  /** Gets the alternate types of this union type, in insertion order. */
  public ImmutableSet<JacType> getAlternates() {
    return alternates;
  }

  /** Whether some alternate of this union is equal to {@code type}. */
  public boolean contains(JacType type) {
    return alternates.contains(type);
  }

  @Override
  public boolean isUnionType() {
    return true;
  }

  @Override
  public UnionType toMaybeUnionType() {
    return this;
  }

  @Override
  public boolean isNullable() {
    for (JacType alternate : alternates) {
      if (alternate.isNullType()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseUnionType(this);
  }

  @Override
  public String getDisplayName() {
    return Joiner.on(" | ").join(alternates);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    // ImmutableSet equality is order-insensitive.
    return other instanceof UnionType && ((UnionType) other).alternates.equals(alternates);
  }

  @Override
  public int hashCode() {
    return alternates.hashCode();
  }
}

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

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Represents a Jac type. Types are immutable; class types compare by name, unions compare by their
 * set of alternates.
 *
 * <p>The kinds form a closed family: {@link ClassType}, {@link UnionType}, the null type, the
 * unknown type and the empty type. Instances are obtained from a {@link TypeRegistry}.
 */
public abstract class JacType implements Serializable {
  private static final long serialVersionUID = 1L;

  JacType() {}

  public boolean isClassType() {
    return false;
  }

  public boolean isUnionType() {
    return false;
  }

  public boolean isNullType() {
    return false;
  }

  public boolean isUnknownType() {
    return false;
  }

  /** Whether this is the empty type, which only unreachable code can observe. */
  public boolean isNoType() {
    return false;
  }

  public @Nullable ClassType toMaybeClassType() {
    return null;
  }

  public @Nullable UnionType toMaybeUnionType() {
    return null;
  }

  /** Whether {@code None} is a possible value of this type. */
  public boolean isNullable() {
    return false;
  }

  /**
   * Visit this type with the given visitor.
   *
   * @see Visitor
   * @return the value returned by the visitor
   */
  public abstract <T> T visit(Visitor<T> visitor);

  /** The name of this type as written in Jac source, e.g. {@code str | None}. */
  public abstract String getDisplayName();

  @Override
  public abstract boolean equals(@Nullable Object other);

  @Override
  public abstract int hashCode();

  @Override
  public final String toString() {
    return getDisplayName();
  }
}

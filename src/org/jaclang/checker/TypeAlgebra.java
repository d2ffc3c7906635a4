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
import org.jaclang.tree.types.ClassType;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;
import org.jaclang.tree.types.UnionType;
import org.jaclang.tree.types.Visitor;

/**
 * Pure functions over types that narrowing needs: removing alternates from a union and collapsing
 * what is left.
 *
 * <p>Excluding every alternate of a union yields the empty type ({@link JacTypeNative#NO_TYPE});
 * this class never reports anything about it, callers decide whether that is worth a diagnostic.
 */
public final class TypeAlgebra {

  private final TypeRegistry typeRegistry;

  public TypeAlgebra(TypeRegistry typeRegistry) {
    this.typeRegistry = typeRegistry;
  }

  /**
   * Returns {@code original} with every alternate structurally equal to {@code target} removed.
   * A union left with one alternate collapses to it; a union left with none, or a non-union equal
   * to {@code target}, becomes the empty type. The unknown type is returned unchanged. A union
   * {@code target} excludes each of its alternates.
   */
  public JacType exclude(JacType original, JacType target) {
    UnionType targetUnion = target.toMaybeUnionType();
    if (targetUnion != null) {
      return excludeAll(original, targetUnion.getAlternates());
    }
    return original.visit(new RestrictByExclusionVisitor(target));
  }

  /** Excludes each of {@code targets} from {@code original}, in order. */
  public JacType excludeAll(JacType original, Iterable<? extends JacType> targets) {
    JacType result = original;
    for (JacType target : targets) {
      result = exclude(result, target);
    }
    return result;
  }

  /** Returns a version of {@code type} where None is not present. */
  public JacType excludeNull(JacType type) {
    return exclude(type, getNativeType(JacTypeNative.NULL_TYPE));
  }

  /**
   * Returns what remains of {@code original} for a value known to be a {@code target}: {@code
   * target} when {@code original} is unknown, is {@code target} or is a union holding it, the empty
   * type otherwise.
   */
  public JacType restrictTo(JacType original, ClassType target) {
    if (original.isUnknownType() || original.equals(target)) {
      return target;
    }
    UnionType union = original.toMaybeUnionType();
    return union != null && union.getAlternates().contains(target)
        ? target
        : getNativeType(JacTypeNative.NO_TYPE);
  }

  /** Whether narrowing {@code narrowed} from {@code ambient} only removed possibilities. */
  public boolean isNarrowingOf(JacType narrowed, JacType ambient) {
    if (narrowed.isNoType() || narrowed.equals(ambient) || ambient.isUnknownType()) {
      return true;
    }
    UnionType ambientUnion = ambient.toMaybeUnionType();
    if (ambientUnion == null) {
      return false;
    }
    UnionType narrowedUnion = narrowed.toMaybeUnionType();
    ImmutableList<JacType> alternates =
        narrowedUnion != null ? narrowedUnion.getAlternates().asList() : ImmutableList.of(narrowed);
    return ambientUnion.getAlternates().containsAll(alternates);
  }

  JacType getNativeType(JacTypeNative typeId) {
    return typeRegistry.getNativeType(typeId);
  }

  /**
   * Removes one non-union type. Never returns null: what cannot remain is the empty type.
   */
  private final class RestrictByExclusionVisitor implements Visitor<JacType> {
    private final JacType target;

    RestrictByExclusionVisitor(JacType target) {
      this.target = target;
    }

    @Override
    public JacType caseClassType(ClassType type) {
      return type.equals(target) ? getNativeType(JacTypeNative.NO_TYPE) : type;
    }

    @Override
    public JacType caseUnionType(UnionType type) {
      ImmutableList.Builder<JacType> restricted = ImmutableList.builder();
      for (JacType alternate : type.getAlternates()) {
        if (!alternate.equals(target)) {
          restricted.add(alternate);
        }
      }
      return typeRegistry.createUnionType(restricted.build());
    }

    @Override
    public JacType caseNullType() {
      return target.isNullType()
          ? getNativeType(JacTypeNative.NO_TYPE)
          : getNativeType(JacTypeNative.NULL_TYPE);
    }

    @Override
    public JacType caseUnknownType() {
      return getNativeType(JacTypeNative.UNKNOWN_TYPE);
    }

    @Override
    public JacType caseNoType() {
      return getNativeType(JacTypeNative.NO_TYPE);
    }
  }
}

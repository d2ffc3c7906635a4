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
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;

/**
 * Recognizes identity comparisons against {@code None} ({@code x is None}, {@code x is not None},
 * either operand order) and the negation {@code not G} of any guard the chain recognizes.
 *
 * <p>Equality comparisons ({@code ==}, {@code !=}) are not guards: they dispatch to a user-defined
 * equality method whose answer proves nothing about the type.
 */
class NullGuardPredicateExtractor extends ChainablePredicateExtractor {

  NullGuardPredicateExtractor(TypeRegistry typeRegistry) {
    super(typeRegistry);
  }

  @Override
  public ImmutableList<NarrowingPredicate> extractPredicates(Node condition, TypeLookup lookup) {
    switch (condition.getToken()) {
      case IS:
        return caseIdentityWithNull(condition, lookup, true);

      case ISNOT:
        return caseIdentityWithNull(condition, lookup, false);

      case NOT:
        ImmutableList.Builder<NarrowingPredicate> negated = ImmutableList.builder();
        for (NarrowingPredicate p : firstPredicates(condition.getOnlyChild(), lookup)) {
          negated.add(p.negate());
        }
        return negated.build();

      default:
        return nextPredicates(condition, lookup);
    }
  }

  /**
   * @param condition an IS or ISNOT node
   * @param isIdentity whether the operator is {@code is} rather than {@code is not}
   */
  private ImmutableList<NarrowingPredicate> caseIdentityWithNull(
      Node condition, TypeLookup lookup, boolean isIdentity) {
    Node left = condition.getFirstChild();
    Node right = condition.getLastChild();
    Node subject;
    if (right.isNull()) {
      subject = left;
    } else if (left.isNull()) {
      subject = right;
    } else {
      return nextPredicates(condition, lookup);
    }
    JacType subjectType = getTypeIfRefinable(subject, lookup);
    if (subjectType == null) {
      return nextPredicates(condition, lookup);
    }
    // A subject that cannot be None is never None, even where the test says so.
    JacType onlyNull =
        subjectType.isNullable()
            ? getNativeType(JacTypeNative.NULL_TYPE)
            : getNativeType(JacTypeNative.NO_TYPE);
    JacType withoutNull = typeAlgebra.excludeNull(subjectType);
    NarrowingPredicate isNull =
        new NarrowingPredicate(subject.getString(), subject, onlyNull, withoutNull);
    return ImmutableList.of(isIdentity ? isNull : isNull.negate());
  }
}

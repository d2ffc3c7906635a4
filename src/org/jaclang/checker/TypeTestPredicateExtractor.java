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
import org.jaclang.tree.types.ClassType;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Recognizes the runtime type test {@code isinstance(x, T)}: where it holds {@code x} has type
 * {@code T}, elsewhere {@code x} has its visible type without {@code T}. Classes are only equal to
 * themselves, so a visible type that cannot be a {@code T} leaves nothing where the test holds.
 */
class TypeTestPredicateExtractor extends ChainablePredicateExtractor {

  static final String TYPE_TEST_FUNCTION = "isinstance";

  TypeTestPredicateExtractor(TypeRegistry typeRegistry) {
    super(typeRegistry);
  }

  @Override
  public ImmutableList<NarrowingPredicate> extractPredicates(Node condition, TypeLookup lookup) {
    if (isTypeTest(condition, lookup)) {
      Node subject = condition.getSecondChild();
      JacType subjectType = getTypeIfRefinable(subject, lookup);
      ClassType testedType = getTestedType(subject.getNext(), lookup);
      if (subjectType != null && testedType != null) {
        return ImmutableList.of(
            new NarrowingPredicate(
                subject.getString(),
                subject,
                typeAlgebra.restrictTo(subjectType, testedType),
                typeAlgebra.exclude(subjectType, testedType)));
      }
    }
    return nextPredicates(condition, lookup);
  }

  /** Whether {@code n} calls the builtin type test with exactly two arguments. */
  private static boolean isTypeTest(Node n, TypeLookup lookup) {
    if (!n.isCall() || n.getChildCount() != 3) {
      return false;
    }
    Node callee = n.getFirstChild();
    // A local binding named like the builtin shadows it.
    return callee.isName()
        && callee.getString().equals(TYPE_TEST_FUNCTION)
        && lookup.getVisibleType(TYPE_TEST_FUNCTION) == null;
  }

  /** Returns the class a type argument names, or null if it does not name a known class. */
  private @Nullable ClassType getTestedType(Node typeArgument, TypeLookup lookup) {
    if (!typeArgument.isName() || lookup.getVisibleType(typeArgument.getString()) != null) {
      return null;
    }
    return typeRegistry.getType(typeArgument.getString());
  }
}

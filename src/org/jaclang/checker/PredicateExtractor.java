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
import org.jspecify.annotations.Nullable;

/**
 * Reads a branch condition and tells what each recognized guard in it means for the types of the
 * symbols it tests.
 *
 * <p>An extractor knows the outcome-independent shape of a guard; the same predicate serves the
 * branch where the condition is true and the one where it is false. Conditions it does not
 * recognize yield no predicates, which means no narrowing and is never an error.
 */
interface PredicateExtractor {

  /**
   * Computes the narrowing predicates of a condition.
   *
   * @param condition the condition's expression
   * @param lookup the types visible where the condition is evaluated
   * @return the predicates, empty if the condition shape is not recognized
   */
  ImmutableList<NarrowingPredicate> extractPredicates(Node condition, TypeLookup lookup);

  /** Types visible at the point a condition is evaluated. */
  @FunctionalInterface
  interface TypeLookup {
    /**
     * Returns the type currently visible for the symbol {@code name}, narrowed or ambient, or null
     * if {@code name} is not a declared symbol and cannot be refined.
     */
    @Nullable JacType getVisibleType(String name);
  }
}

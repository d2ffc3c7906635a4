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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Chainable predicate extractor providing basic functionality. Each link recognizes some guard
 * shapes and hands everything else to the next link; the last link answers with no predicates.
 */
abstract class ChainablePredicateExtractor implements PredicateExtractor {
  final TypeRegistry typeRegistry;
  final TypeAlgebra typeAlgebra;
  private ChainablePredicateExtractor firstLink;
  private @Nullable ChainablePredicateExtractor nextLink;

  /**
   * Constructs an extractor, which is the only link in a chain. Extractors can be appended using
   * {@link #append}.
   */
  ChainablePredicateExtractor(TypeRegistry typeRegistry) {
    this.typeRegistry = Preconditions.checkNotNull(typeRegistry);
    this.typeAlgebra = new TypeAlgebra(typeRegistry);
    firstLink = this;
    nextLink = null;
  }

  /**
   * Appends a link to {@code this}, returning the updated last link.
   *
   * <p>The pattern {@code new X().append(new Y())...append(new Z())} forms a chain starting with X,
   * then Y, then ... Z.
   *
   * @param lastLink a chainable extractor, with no next link
   * @return the updated last link
   */
  ChainablePredicateExtractor append(ChainablePredicateExtractor lastLink) {
    Preconditions.checkArgument(lastLink.nextLink == null);
    this.nextLink = lastLink;
    lastLink.firstLink = this.firstLink;
    return lastLink;
  }

  /** Gets the first link of this chain. */
  ChainablePredicateExtractor getFirst() {
    return firstLink;
  }

  /** Extracts the predicates of a sub-condition starting with the first link. */
  protected ImmutableList<NarrowingPredicate> firstPredicates(Node condition, TypeLookup lookup) {
    return firstLink.extractPredicates(condition, lookup);
  }

  /**
   * Delegates the extraction to the next link. If there is no next link, the condition is not
   * recognized and there are no predicates.
   */
  protected ImmutableList<NarrowingPredicate> nextPredicates(Node condition, TypeLookup lookup) {
    return nextLink != null ? nextLink.extractPredicates(condition, lookup) : ImmutableList.of();
  }

  /**
   * Returns the type of a node if the node is a name whose type is capable of being refined.
   *
   * @return The currently visible type of the node if it can be refined, null otherwise.
   */
  @Nullable JacType getTypeIfRefinable(Node node, TypeLookup lookup) {
    if (node.isName()) {
      return lookup.getVisibleType(node.getString());
    }
    return null;
  }

  JacType getNativeType(JacTypeNative typeId) {
    return typeRegistry.getNativeType(typeId);
  }
}

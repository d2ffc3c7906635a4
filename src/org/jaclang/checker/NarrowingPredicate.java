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

import static java.util.Objects.requireNonNull;

import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;

/**
 * What a guard tells about one symbol: its type when the guard is true, and when it is false.
 *
 * @param name the symbol name
 * @param nameNode the reference to the symbol inside the guard
 * @param trueType the type visible for {@code name} where the guard holds
 * @param falseType the type visible for {@code name} where the guard does not hold
 */
public record NarrowingPredicate(String name, Node nameNode, JacType trueType, JacType falseType) {
  public NarrowingPredicate {
    requireNonNull(name, "name");
    requireNonNull(nameNode, "nameNode");
    requireNonNull(trueType, "trueType");
    requireNonNull(falseType, "falseType");
  }

  /** The predicate of the negated guard. */
  public NarrowingPredicate negate() {
    return new NarrowingPredicate(name, nameNode, falseType, trueType);
  }

  @Override
  public String toString() {
    return name + ": " + trueType + " / " + falseType;
  }
}

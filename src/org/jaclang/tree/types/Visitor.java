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

/**
 * A type visitor. Every kind of {@link JacType} has a case here, so adding a kind is a compile
 * error in every visitor until it is handled.
 */
public interface Visitor<T> {

  /** Named class or primitive type. */
  T caseClassType(ClassType type);

  T caseUnionType(UnionType type);

  /** The type of {@code None}. */
  T caseNullType();

  /** Unresolved or unannotated type. */
  T caseUnknownType();

  /** The empty type; no value has it. */
  T caseNoType();
}

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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Optional;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Resolves the type of a name reference: the type of the innermost active narrowing frame that
 * maps the name, otherwise the ambient type of the symbol.
 *
 * <p>Ambient types are cached on the reference node. Narrowed types are not: they depend on the
 * branch the traversal is in, and a later traversal of the same node may see different frames.
 */
final class TypeResolver implements PredicateExtractor.TypeLookup {

  private final NarrowingStack stack;
  private final TypedScope scope;
  private final TypeRegistry typeRegistry;

  TypeResolver(NarrowingStack stack, TypedScope scope, TypeRegistry typeRegistry) {
    this.stack = stack;
    this.scope = scope;
    this.typeRegistry = typeRegistry;
  }

  /** Resolves the type of the NAME node {@code name}. Undeclared names are unknown. */
  JacType resolve(Node name) {
    checkArgument(name.isName(), name);
    if (!stack.isEmpty()) {
      Optional<JacType> narrowed = stack.lookup(name.getString());
      if (narrowed.isPresent()) {
        return narrowed.get();
      }
    }
    JacType cached = name.getJacType();
    if (cached != null) {
      return cached;
    }
    JacType ambient = getAmbientType(name.getString());
    JacType type =
        ambient != null ? ambient : typeRegistry.getNativeType(JacTypeNative.UNKNOWN_TYPE);
    name.setJacType(type);
    return type;
  }

  @Override
  public @Nullable JacType getVisibleType(String name) {
    JacType ambient = getAmbientType(name);
    if (ambient == null) {
      return null;
    }
    return stack.isEmpty() ? ambient : stack.lookup(name).orElse(ambient);
  }

  /** Returns the declared type of the symbol {@code name}, or null if it is not declared. */
  @Nullable JacType getAmbientType(String name) {
    TypedVar var = scope.getVar(name);
    return var != null ? var.getType() : null;
  }

  /** Whether {@code name} is bound in the scope this resolver reads from. */
  boolean isDeclared(String name) {
    return scope.getVar(name) != null;
  }
}

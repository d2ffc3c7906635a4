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

import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Creates the scopes the narrowing pass reads ambient types from. A script scope holds the
 * module-level variables; a function scope holds the parameters and every variable declared in the
 * function body, nested blocks included (Jac variables are function scoped). Nested functions and
 * class bodies get no variables of the enclosing body.
 */
public class TypedScopeCreator {

  private final TypeRegistry typeRegistry;

  public TypedScopeCreator(TypeRegistry typeRegistry) {
    this.typeRegistry = typeRegistry;
  }

  /**
   * Creates a scope for {@code root}, which must be a SCRIPT (with a null parent) or a FUNCTION.
   */
  public TypedScope createScope(Node root, @Nullable TypedScope parent) {
    TypedScope scope;
    if (parent == null) {
      scope = TypedScope.createGlobalScope(root);
      declareVars(scope, root);
    } else {
      scope = TypedScope.createFunctionScope(parent, root);
      Node params = root.getSecondChild();
      for (Node param : params.children()) {
        scope.declare(param.getString(), param, declaredTypeOf(param));
      }
      declareVars(scope, root.getLastChild());
    }
    return scope;
  }

  private void declareVars(TypedScope scope, Node n) {
    for (Node child : n.children()) {
      switch (child.getToken()) {
        case FUNCTION:
        case CLASS:
          // Has its own scope.
          break;
        case VAR:
          Node name = child.getFirstChild();
          scope.declare(name.getString(), name, declaredTypeOf(name));
          break;
        default:
          declareVars(scope, child);
      }
    }
  }

  private JacType declaredTypeOf(Node name) {
    JacType type = name.getDeclaredType();
    return type != null ? type : typeRegistry.getNativeType(JacTypeNative.UNKNOWN_TYPE);
  }
}

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

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * TypedScope contains information about variables and their declared types. Scopes can be nested;
 * a scope points back to its parent scope.
 *
 * <p>Scopes are built once, before narrowing starts, and are only read afterwards, so one scope
 * tree can be shared by tasks analyzing different bodies in parallel.
 */
public class TypedScope {

  private final @Nullable TypedScope parent;
  private final Node rootNode;
  private final int depth;
  private final Map<String, TypedVar> vars = new LinkedHashMap<>();

  private TypedScope(@Nullable TypedScope parent, Node rootNode) {
    this.parent = parent;
    this.rootNode = rootNode;
    this.depth = parent == null ? 0 : parent.depth + 1;
  }

  /** Creates the scope of a script. */
  static TypedScope createGlobalScope(Node rootNode) {
    checkArgument(rootNode.isScript(), rootNode);
    return new TypedScope(null, rootNode);
  }

  /** Creates the scope of a function nested in {@code parent}. */
  static TypedScope createFunctionScope(TypedScope parent, Node functionNode) {
    checkArgument(functionNode.isFunction(), functionNode);
    return new TypedScope(parent, functionNode);
  }

  /**
   * Declares a variable. A second declaration of the same name in the same scope keeps the first
   * one, as the ambient type of a symbol does not change during analysis.
   */
  TypedVar declare(String name, Node nameNode, JacType type) {
    TypedVar existing = vars.get(name);
    if (existing != null) {
      return existing;
    }
    TypedVar var = new TypedVar(name, nameNode, type, this, vars.size());
    vars.put(name, var);
    return var;
  }

  /** Returns the variable declared under {@code name} here or in an enclosing scope. */
  public @Nullable TypedVar getVar(String name) {
    for (TypedScope s = this; s != null; s = s.parent) {
      TypedVar var = s.vars.get(name);
      if (var != null) {
        return var;
      }
    }
    return null;
  }

  /** Returns the variable declared under {@code name} in this very scope. */
  public @Nullable TypedVar getOwnSlot(String name) {
    return vars.get(name);
  }

  public ImmutableList<TypedVar> getVars() {
    return ImmutableList.copyOf(vars.values());
  }

  public @Nullable TypedScope getParent() {
    return parent;
  }

  public Node getRootNode() {
    return rootNode;
  }

  public int getDepth() {
    return depth;
  }

  public boolean isGlobal() {
    return parent == null;
  }
}

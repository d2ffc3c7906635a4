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

import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;

/**
 * A variable binding in a {@link TypedScope}. Its type is the ambient type of the symbol: the
 * declared annotation, or the unknown type. Flow-sensitive refinements never change it.
 */
public final class TypedVar {

  private final String name;
  private final Node nameNode;
  private final JacType type;
  private final TypedScope scope;
  private final int index;

  TypedVar(String name, Node nameNode, JacType type, TypedScope scope, int index) {
    checkArgument(nameNode.isName(), "Invalid name node token %s", nameNode.getToken());
    this.name = name;
    this.nameNode = nameNode;
    this.type = type;
    this.scope = scope;
    this.index = index;
  }

  public String getName() {
    return name;
  }

  /** The NAME node that declares this variable. */
  public Node getNameNode() {
    return nameNode;
  }

  /** The ambient type of the variable. */
  public JacType getType() {
    return type;
  }

  public TypedScope getScope() {
    return scope;
  }

  /** The order in which this variable was declared in its scope. */
  int getIndex() {
    return index;
  }

  @Override
  public String toString() {
    return "TypedVar " + name + "{" + type + "}";
  }
}

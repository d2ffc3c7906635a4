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
import org.jaclang.tree.Token;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * Whether control never falls off the end of {@code block}: its last statement is a {@code
   * return} or a {@code raise}.
   */
  static boolean endsWithAbnormalExit(Node block) {
    Node last = block.getLastChild();
    return last != null && isAbnormalExit(last);
  }

  static boolean isAbnormalExit(Node n) {
    return n.isReturn() || n.isRaise();
  }

  /**
   * Whether the NAME node {@code n} introduces a binding rather than reading one: a parameter, the
   * name of a function, or the target of a variable declaration.
   */
  static boolean isNameDeclaration(Node n) {
    Node parent = n.getParent();
    if (!n.isName() || parent == null) {
      return false;
    }
    switch (parent.getToken()) {
      case PARAM_LIST:
      case VAR:
        return true;
      case FUNCTION:
        return parent.getFirstChild() == n;
      default:
        return false;
    }
  }

  /** Whether {@code n} is the target of an assignment. */
  static boolean isLhsOfAssign(Node n) {
    Node parent = n.getParent();
    return parent != null && parent.getToken() == Token.ASSIGN && parent.getFirstChild() == n;
  }

  /** Whether the NAME node {@code n} reads the value of a symbol. */
  static boolean isReferenceName(Node n) {
    return n.isName() && !isNameDeclaration(n) && !isLhsOfAssign(n);
  }
}

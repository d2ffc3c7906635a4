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

package org.jaclang.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * A node of the syntax tree. Children are kept in a doubly linked list; the first child's {@code
 * previous} pointer refers to the last child so that appending is O(1).
 */
public class Node {

  private Token token;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  /** Identifier, string literal value or class name, depending on the token. */
  private @Nullable String string;

  private double number;

  private @Nullable String sourceFileName;
  private int lineno = -1;
  private int charno = -1;
  private int length = 0;

  /** Type annotation written in the source (parameters and variables). */
  private @Nullable JacType declaredType;

  /** Cache for the ambient type of a name reference; never holds a narrowed type. */
  private volatile @Nullable JacType jacType;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = str;
    return n;
  }

  public static Node newString(String str) {
    return newString(Token.STRINGLIT, str);
  }

  public static Node newNumber(double number) {
    Node n = new Node(Token.NUMBER);
    n.number = number;
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected exactly one child of %s", token);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      checkArgument(n != null, "Child index out of bounds");
      n = n.next;
      i--;
    }
    checkArgument(n != null, "Child index out of bounds");
    return n;
  }

  public final void addChildToBack(Node child) {
    checkArgument(child.parent == null, "Child is already attached: %s", child);
    checkArgument(child.next == null && child.previous == null);
    child.parent = this;
    if (first == null) {
      first = child;
      child.previous = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
  }

  /** Iterates over the direct children, left to right. */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node result = current;
            current = current.next;
            return result;
          }
        };
  }

  public final String getString() {
    checkState(string != null, "%s has no string value", token);
    return string;
  }

  public final boolean hasStringValue() {
    return string != null;
  }

  public final double getDouble() {
    checkState(token == Token.NUMBER, "%s is not a number", token);
    return number;
  }

  public final @Nullable JacType getDeclaredType() {
    return declaredType;
  }

  @CanIgnoreReturnValue
  public final Node setDeclaredType(@Nullable JacType type) {
    this.declaredType = type;
    return this;
  }

  /** Returns the cached ambient type of this node, or null if none has been resolved yet. */
  public final @Nullable JacType getJacType() {
    return jacType;
  }

  public final void setJacType(@Nullable JacType type) {
    this.jacType = type;
  }

  // Source position

  @CanIgnoreReturnValue
  public final Node setSourceFileName(@Nullable String name) {
    this.sourceFileName = name;
    return this;
  }

  /** Returns the source file name, inherited from the closest ancestor that knows it. */
  public @Nullable String getSourceFileName() {
    for (Node n = this; n != null; n = n.parent) {
      if (n.sourceFileName != null) {
        return n.sourceFileName;
      }
    }
    return null;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    this.lineno = lineno;
    this.charno = charno;
    return this;
  }

  public final int getLineno() {
    return lineno;
  }

  public final int getCharno() {
    return charno;
  }

  public final void setLength(int length) {
    this.length = length;
  }

  public final int getLength() {
    return length;
  }

  // Token predicates

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isClass() {
    return token == Token.CLASS;
  }

  public final boolean isFunction() {
    return token == Token.FUNCTION;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isVar() {
    return token == Token.VAR;
  }

  public final boolean isIf() {
    return token == Token.IF;
  }

  public final boolean isElif() {
    return token == Token.ELIF;
  }

  public final boolean isElse() {
    return token == Token.ELSE;
  }

  public final boolean isReturn() {
    return token == Token.RETURN;
  }

  public final boolean isRaise() {
    return token == Token.RAISE;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isNull() {
    return token == Token.NULL;
  }

  public final boolean isNot() {
    return token == Token.NOT;
  }

  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    toString(sb);
    return sb.toString();
  }

  private void toString(StringBuilder sb) {
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    } else if (token == Token.NUMBER) {
      sb.append(' ').append(number);
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    if (declaredType != null) {
      sb.append(" : ").append(declaredType);
    }
  }

  /** Prints the tree rooted at this node, one node per line, children indented. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    toString(sb);
    sb.append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }
}

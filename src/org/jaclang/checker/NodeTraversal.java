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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jaclang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal allows an iteration through the nodes of one function or method body (or of a
 * script's module-level code), reporting conditional constructs clause by clause.
 */
public class NodeTraversal {
  private final Callback callback;
  private final @Nullable ConditionalCallback conditionalCallback;
  private final @Nullable ScopedCallback scopeCallback;
  private final TypedScope scope;
  private final @Nullable ErrorManager errorManager;

  /** Contains the current node */
  private @Nullable Node currentNode;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns false, the node will not be visited by {@link #visit} and its
     * children will not be visited at all.
     *
     * <p>Siblings are always visited left-to-right.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse} returned true for it.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Callback that also knows about scope changes */
  public interface ScopedCallback extends Callback {

    /** Called before the traversal enters the root of the traversed scope. */
    void enterScope(NodeTraversal t);

    /** Called after the traversal leaves the root of the traversed scope. */
    void exitScope(NodeTraversal t);
  }

  /**
   * Callback that follows conditional constructs clause by clause. For each clause, in source
   * order, the traversal calls {@link #enterClause}, traverses the condition (if any), calls
   * {@link #enterClauseBody}, traverses the body, calls {@link #exitClauseBody} and then moves to
   * the next clause. {@link #exitConstruct} follows the last clause, before the IF node is visited
   * in postorder.
   *
   * <p>The clause hooks are only called for constructs whose IF node {@link #shouldTraverse}
   * accepted.
   */
  public interface ConditionalCallback extends Callback {
    void enterClause(NodeTraversal t, ConditionalClause clause);

    void enterClauseBody(NodeTraversal t, ConditionalClause clause);

    void exitClauseBody(NodeTraversal t, ConditionalClause clause);

    void exitConstruct(NodeTraversal t, Node construct);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal nodeTraversal, Node n, Node parent) {
      return true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Configures and runs a traversal. */
  public static final class Builder {
    private @Nullable Callback callback;
    private @Nullable TypedScope scope;
    private @Nullable ErrorManager errorManager;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCallback(Callback x) {
      this.callback = x;
      return this;
    }

    /** Sets the scope of the traversed body. */
    @CanIgnoreReturnValue
    public Builder setScope(TypedScope x) {
      this.scope = x;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setErrorManager(ErrorManager x) {
      this.errorManager = x;
      return this;
    }

    public NodeTraversal build() {
      return new NodeTraversal(this);
    }

    public void traverse(Node root) {
      build().traverse(root);
    }
  }

  private NodeTraversal(Builder builder) {
    this.callback = checkNotNull(builder.callback, "callback");
    this.scope = checkNotNull(builder.scope, "scope");
    this.errorManager = builder.errorManager;
    this.conditionalCallback =
        callback instanceof ConditionalCallback ? (ConditionalCallback) callback : null;
    this.scopeCallback = callback instanceof ScopedCallback ? (ScopedCallback) callback : null;
  }

  /** Traverses a parse tree recursively. */
  public void traverse(Node root) {
    currentNode = root;
    if (scopeCallback != null) {
      scopeCallback.enterScope(this);
    }
    traverseBranch(root, null);
    currentNode = root;
    if (scopeCallback != null) {
      scopeCallback.exitScope(this);
    }
  }

  /** Traverses a branch. */
  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    if (n.isIf() && conditionalCallback != null) {
      traverseClause(n, n, 0);
      currentNode = n;
      conditionalCallback.exitConstruct(this, n);
    } else {
      traverseChildren(n);
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void traverseChildren(Node n) {
    for (Node child = n.getFirstChild(); child != null; ) {
      // child could be replaced, in which case our child node would no longer point to the true
      // next
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
  }

  /**
   * Traverses one clause of the construct rooted at {@code construct}, then the clauses after it.
   * The next clause is a child of this one, so it is visited in postorder before this one.
   */
  private void traverseClause(Node construct, Node clauseNode, int index) {
    ConditionalClause clause = ConditionalClause.create(construct, clauseNode, index);

    currentNode = clauseNode;
    conditionalCallback.enterClause(this, clause);
    Node condition = clause.getCondition();
    if (condition != null) {
      traverseBranch(condition, clauseNode);
    }

    currentNode = clauseNode;
    conditionalCallback.enterClauseBody(this, clause);
    traverseBranch(clause.getBody(), clauseNode);

    currentNode = clauseNode;
    conditionalCallback.exitClauseBody(this, clause);

    Node next = clause.getNextClause();
    if (next != null) {
      currentNode = next;
      if (callback.shouldTraverse(this, next, clauseNode)) {
        traverseClause(construct, next, index + 1);
        currentNode = next;
        callback.visit(this, next, clauseNode);
      }
    }
  }

  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /** Gets the scope of the traversed body. */
  public TypedScope getScope() {
    return scope;
  }

  /** The root of the traversed scope: a FUNCTION or SCRIPT node. */
  public Node getScopeRoot() {
    return scope.getRootNode();
  }

  public @Nullable String getSourceName() {
    return currentNode != null ? currentNode.getSourceFileName() : null;
  }

  /**
   * Reports a diagnostic (error or warning) at its default level.
   *
   * @param n Determines the position of the diagnostic
   * @param diagnosticType The diagnostic type
   * @param arguments The diagnostic arguments
   */
  public void report(Node n, DiagnosticType diagnosticType, String... arguments) {
    report(diagnosticType.level, n, diagnosticType, arguments);
  }

  /** Reports a diagnostic at {@code level}, which overrides the diagnostic's default level. */
  public void report(CheckLevel level, Node n, DiagnosticType diagnosticType, String... arguments) {
    checkState(errorManager != null, "Traversal has no error manager");
    if (level.isOn()) {
      errorManager.report(
          level, JacError.builder(diagnosticType, arguments).setNode(n).setLevel(level).build());
    }
  }
}

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

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.jaclang.tree.Node;
import org.jaclang.tree.Token;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Flow-sensitive type narrowing. Analyzes the module-level code of each script and every function
 * and method body, each body separately, and resolves every declared name reference to the type
 * visible at that point: its declared type, refined by the {@code isinstance} and {@code None}
 * tests of the conditionals around it.
 */
public final class NarrowingPass implements CompilerPass {

  private static final Logger logger = Logger.getLogger(NarrowingPass.class.getName());

  static final DiagnosticType JAC_UNREACHABLE_BRANCH =
      ConditionalNarrowingCallback.JAC_UNREACHABLE_BRANCH;

  static final DiagnosticType JAC_NARROWING_INTERNAL_ERROR =
      DiagnosticType.error("JAC_NARROWING_INTERNAL_ERROR", "Internal narrowing error: {0}");

  private final TypeRegistry typeRegistry;
  private final NarrowingOptions options;
  private final ErrorManager errorManager;
  private final PredicateExtractor extractor;
  private final TypedScopeCreator scopeCreator;

  private @Nullable NarrowingResult lastResult;

  /** A body to analyze with the scope it reads ambient types from. */
  private record Body(Node root, TypedScope scope) {}

  public NarrowingPass(
      TypeRegistry typeRegistry, NarrowingOptions options, ErrorManager errorManager) {
    this(typeRegistry, options, errorManager, createDefaultExtractor(typeRegistry));
  }

  NarrowingPass(
      TypeRegistry typeRegistry,
      NarrowingOptions options,
      ErrorManager errorManager,
      PredicateExtractor extractor) {
    this.typeRegistry = typeRegistry;
    this.options = options;
    this.errorManager = errorManager;
    this.extractor = extractor;
    this.scopeCreator = new TypedScopeCreator(typeRegistry);
  }

  /** The guard shapes narrowing understands: type tests, then {@code None} tests. */
  static PredicateExtractor createDefaultExtractor(TypeRegistry typeRegistry) {
    return new TypeTestPredicateExtractor(typeRegistry)
        .append(new NullGuardPredicateExtractor(typeRegistry))
        .getFirst();
  }

  @Override
  public void process(Node root) {
    lastResult = analyze(root);
  }

  /** The result of the last {@link #process} call, or null if it was never called. */
  public @Nullable NarrowingResult getLastResult() {
    return lastResult;
  }

  /**
   * Analyzes every body under {@code root}.
   *
   * @param root a SCRIPT, or a ROOT whose children are SCRIPTs
   */
  public NarrowingResult analyze(Node root) {
    List<Body> bodies = new ArrayList<>();
    if (root.isScript()) {
      collectScript(root, bodies);
    } else {
      checkArgument(root.getToken() == Token.ROOT, "Unexpected root %s", root);
      for (Node script : root.children()) {
        collectScript(script, bodies);
      }
    }
    logger.fine("Narrowing " + bodies.size() + " bodies with " + options);

    NarrowingResult.Builder result = NarrowingResult.builder();
    boolean aborted =
        options.getNumThreads() > 1 && bodies.size() > 1
            ? analyzeInParallel(bodies, result)
            : analyzeSequentially(bodies, result);
    return result.setAborted(aborted).setDiagnostics(errorManager).build();
  }

  private boolean analyzeSequentially(List<Body> bodies, NarrowingResult.Builder result) {
    for (Body body : bodies) {
      try {
        result.addBody(analyzeBody(body, errorManager));
      } catch (NarrowingBookkeepingException e) {
        reportInternalError(e);
        return true;
      }
    }
    return false;
  }

  /**
   * Analyzes the bodies on a thread pool. Each body reports into its own buffer; the buffers are
   * replayed into the error manager in body order, up to and including the first body that aborts,
   * so the diagnostics are those of a sequential run.
   */
  private boolean analyzeInParallel(List<Body> bodies, NarrowingResult.Builder result) {
    ThreadFactory threadFactory =
        r -> {
          Thread t = new Thread(r, "jac-narrowing");
          t.setDaemon(true); // Do not prevent the JVM from exiting.
          return t;
        };
    int numThreads = Math.min(options.getNumThreads(), bodies.size());
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numThreads,
            numThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<SortingErrorManager> bodyErrorManagers = new ArrayList<>(bodies.size());
    List<ListenableFuture<NarrowingContext>> futures = new ArrayList<>(bodies.size());
    for (Body body : bodies) {
      SortingErrorManager bodyErrorManager = new SortingErrorManager();
      bodyErrorManagers.add(bodyErrorManager);
      futures.add(executorService.submit(() -> analyzeBody(body, bodyErrorManager)));
    }
    poolExecutor.shutdown();

    try {
      for (int i = 0; i < futures.size(); i++) {
        try {
          NarrowingContext context = futures.get(i).get();
          replay(bodyErrorManagers.get(i));
          result.addBody(context);
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (!(cause instanceof NarrowingBookkeepingException)) {
            Throwables.throwIfUnchecked(cause);
            throw new RuntimeException(cause);
          }
          replay(bodyErrorManagers.get(i));
          reportInternalError((NarrowingBookkeepingException) cause);
          return true;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } finally {
      poolExecutor.shutdownNow();
    }
    return false;
  }

  private void replay(SortingErrorManager bodyErrorManager) {
    for (SortingErrorManager.ErrorWithLevel diagnostic : bodyErrorManager.getSortedDiagnostics()) {
      errorManager.report(diagnostic.level(), diagnostic.error());
    }
  }

  private NarrowingContext analyzeBody(Body body, ErrorManager bodyErrorManager) {
    NarrowingContext context = new NarrowingContext(body.scope(), typeRegistry, extractor, options);
    NodeTraversal.builder()
        .setCallback(new ConditionalNarrowingCallback(context))
        .setScope(body.scope())
        .setErrorManager(bodyErrorManager)
        .traverse(body.root());
    return context;
  }

  private void reportInternalError(NarrowingBookkeepingException e) {
    errorManager.report(CheckLevel.ERROR, internalError(e));
  }

  private static JacError internalError(NarrowingBookkeepingException e) {
    logger.severe("Narrowing aborted: " + e.getMessage());
    Node construct = e.getConstruct();
    return construct != null
        ? JacError.make(construct, JAC_NARROWING_INTERNAL_ERROR, e.getMessage())
        : JacError.make(JAC_NARROWING_INTERNAL_ERROR, e.getMessage());
  }

  private void collectScript(Node script, List<Body> bodies) {
    checkArgument(script.isScript(), "Expected a SCRIPT, found %s", script);
    TypedScope globalScope = scopeCreator.createScope(script, null);
    bodies.add(new Body(script, globalScope));
    collectFunctions(script, globalScope, bodies);
  }

  /**
   * Adds the bodies of the functions under {@code n}, including methods and nested functions, in
   * source order. A method's enclosing scope is the one enclosing its class.
   */
  private void collectFunctions(Node n, TypedScope enclosingScope, List<Body> bodies) {
    for (Node child : n.children()) {
      if (child.isFunction()) {
        TypedScope functionScope = scopeCreator.createScope(child, enclosingScope);
        bodies.add(new Body(child, functionScope));
        collectFunctions(child.getLastChild(), functionScope, bodies);
      } else {
        collectFunctions(child, enclosingScope, bodies);
      }
    }
  }
}

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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jaclang.tree.JsonTreeReader;
import org.jaclang.tree.Node;
import org.jaclang.tree.Token;
import org.jaclang.tree.TreeParseException;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.TypeRegistry;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line entry point: reads syntax trees serialized by the Jac parser, runs narrowing over
 * them, and prints the type resolved for every declared name reference followed by a summary. The
 * diagnostics go to the log, or to the output as a JSON array with {@code --json}.
 *
 * <p>Exits with 0 when no error was reported, 1 when one was, and 2 when the input could not be
 * read.
 */
public final class NarrowingRunner {
  private static final Logger logger = Logger.getLogger(NarrowingRunner.class.getName());

  static final int EXIT_OK = 0;
  static final int EXIT_ERRORS = 1;
  static final int EXIT_BAD_INPUT = 2;

  @Option(
      name = "--unreachable_branch_level",
      usage = "Level of the diagnostic for branches left with no possible type")
  private CheckLevel unreachableBranchLevel = CheckLevel.WARNING;

  @Option(name = "--threads", usage = "Number of threads analyzing function bodies")
  private int threads = 1;

  @Option(
      name = "--no_early_exit",
      usage = "Do not keep the failed-guard types after an if whose branches all return or raise")
  private boolean noEarlyExit = false;

  @Option(name = "--json", usage = "Print the diagnostics as a JSON array instead of the types")
  private boolean json = false;

  @Option(name = "--help", help = true, usage = "Displays this message")
  private boolean help = false;

  @Argument(metaVar = "FILE", usage = "JSON syntax trees to analyze")
  private List<String> files = new ArrayList<>();

  public static void main(String[] args) {
    System.exit(new NarrowingRunner().run(args, System.out, System.err));
  }

  int run(String[] args, PrintStream out, PrintStream err) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
      if (!help && files.isEmpty()) {
        throw new CmdLineException(parser, "No input files");
      }
      if (threads < 1) {
        throw new CmdLineException(parser, "--threads must be positive");
      }
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_BAD_INPUT;
    }
    if (help) {
      parser.printUsage(out);
      return EXIT_OK;
    }

    TypeRegistry typeRegistry = new TypeRegistry();
    Node root;
    try {
      root = readTrees(typeRegistry);
    } catch (IOException | TreeParseException e) {
      err.println("Cannot read input: " + e.getMessage());
      return EXIT_BAD_INPUT;
    }

    SortingErrorManager errorManager =
        json
            ? new SortingErrorManager(ImmutableSet.of(new JsonErrorReportGenerator(out)))
            : new LoggerErrorManager(logger);
    NarrowingResult result =
        new NarrowingPass(typeRegistry, createOptions(), errorManager).analyze(root);

    if (!json) {
      printTypes(result, out);
    }
    errorManager.generateReport();
    if (!json) {
      out.println(
          errorManager.getErrorCount()
              + " error(s), "
              + errorManager.getWarningCount()
              + " warning(s)");
    }
    return errorManager.getErrorCount() > 0 ? EXIT_ERRORS : EXIT_OK;
  }

  private NarrowingOptions createOptions() {
    NarrowingOptions options = new NarrowingOptions();
    options.setUnreachableBranchLevel(unreachableBranchLevel);
    options.setEarlyExitPropagation(!noEarlyExit);
    options.setNumThreads(threads);
    return options;
  }

  private Node readTrees(TypeRegistry typeRegistry) throws IOException, TreeParseException {
    JsonTreeReader reader = new JsonTreeReader(typeRegistry);
    Node root = new Node(Token.ROOT);
    for (String filename : files) {
      Node script = reader.parse(Files.asCharSource(new File(filename), UTF_8).read(), filename);
      if (!script.isScript()) {
        throw new TreeParseException(filename + ": the root node must be a SCRIPT");
      }
      root.addChildToBack(script);
    }
    return root;
  }

  private static void printTypes(NarrowingResult result, PrintStream out) {
    for (Map.Entry<Node, JacType> entry : result.getResolvedTypes().entrySet()) {
      Node reference = entry.getKey();
      out.println(
          reference.getSourceFileName()
              + ":"
              + reference.getLineno()
              + ":"
              + reference.getCharno()
              + " "
              + reference.getString()
              + ": "
              + entry.getValue());
    }
  }
}

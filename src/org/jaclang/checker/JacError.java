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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import org.jaclang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param node Node where the warning occurred.
 * @param defaultLevel The level before any option overrides it.
 */
public record JacError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    @Nullable Node node,
    CheckLevel defaultLevel)
    implements Serializable {
  public JacError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /**
   * Creates a JacError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JacError make(DiagnosticType type, String... arguments) {
    return builder(type, arguments).build();
  }

  /**
   * Creates a JacError from a file and Node position.
   *
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JacError make(Node n, DiagnosticType type, String... arguments) {
    return builder(type, arguments).setNode(n).build();
  }

  static final class Builder {
    private final DiagnosticType type;
    private final String[] args;

    private CheckLevel level;
    private @Nullable Node n = null;
    private @Nullable String sourceName = null;
    private int lineno = DEFAULT_LINENO;
    private int charno = DEFAULT_CHARNO;

    private Builder(DiagnosticType type, String... args) {
      this.type = type;
      this.args = args;
      this.level = type.level; // may be overwritten later
    }

    /** Sets the location where this error occurred. */
    @CanIgnoreReturnValue
    Builder setNode(Node n) {
      this.n = n;
      this.sourceName = n.getSourceFileName();
      this.lineno = n.getLineno();
      this.charno = n.getCharno();
      return this;
    }

    /**
     * Sets the default level of this JacError, overwriting the default level of the
     * DiagnosticType.
     */
    @CanIgnoreReturnValue
    Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    JacError build() {
      return new JacError(type, type.format((Object[]) args), sourceName, lineno, charno, n, level);
    }
  }

  /**
   * Creates a new builder.
   *
   * @param type the associated DiagnosticType
   * @param arguments formatting arguments used to format the DiagnosticType's description
   */
  static Builder builder(DiagnosticType type, String... arguments) {
    return new Builder(type, arguments);
  }

  /** Formats this error for the console, e.g. {@code a.jac:3: WARNING - ...}. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (emptyToNull(sourceName) != null) {
      b.append(sourceName);
      if (lineno != DEFAULT_LINENO) {
        b.append(':').append(lineno);
        if (charno != DEFAULT_CHARNO) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
    b.append(level).append(" - [").append(type.key).append("] ").append(description);
    return b.toString();
  }

  /** @return the default rendering of an error as text. */
  @Override
  public String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String charno =
        this.charno() != DEFAULT_CHARNO ? String.valueOf(this.charno()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + charno;
  }
}

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

import com.google.gson.stream.JsonWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import org.jaclang.checker.SortingErrorManager.ErrorReportGenerator;
import org.jaclang.checker.SortingErrorManager.ErrorWithLevel;

/**
 * An error report generator that prints error and warning data to the print stream as an array of
 * JSON objects.
 */
public class JsonErrorReportGenerator implements ErrorReportGenerator {
  private final PrintStream stream;

  /**
   * Creates a report generator.
   *
   * @param stream the stream on which the errors and warnings should be printed. This class does
   *     not close the stream
   */
  public JsonErrorReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    ByteArrayOutputStream bufferedStream = new ByteArrayOutputStream();
    try (JsonWriter jsonWriter = new JsonWriter(new OutputStreamWriter(bufferedStream, UTF_8))) {
      jsonWriter.beginArray();
      for (ErrorWithLevel message : manager.getSortedDiagnostics()) {
        JacError error = message.error();
        jsonWriter.beginObject();
        jsonWriter.name("level").value(message.level().getReportName());
        jsonWriter.name("description").value(error.description());
        jsonWriter.name("key").value(error.type().key);
        jsonWriter.name("source").value(error.sourceName());
        jsonWriter.name("line").value(error.lineno());
        jsonWriter.name("column").value(error.charno());
        jsonWriter.endObject();
      }
      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    stream.println(bufferedStream.toString(UTF_8));
    stream.flush();
  }
}

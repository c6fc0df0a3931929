// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.wmibo.format;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.wmibo.model.FormatWarning;
import org.wmibo.model.Instance;

/**
 * Loads a WMIBO v1.0 instance from text.
 *
 * <p>Lines are read in order and routed to an {@link InstanceBuilder}; cross references are
 * resolved once the input is exhausted. The first error aborts the load with a {@link
 * WmiboFormatException}. Header counter mismatches are logged and kept as warnings on the
 * instance.
 */
public final class WmiboLoader {
  private static final Logger logger = Logger.getLogger(WmiboLoader.class.getName());

  private WmiboLoader() {}

  /** Loads an instance from reader. The caller keeps ownership of the reader. */
  public static Instance load(Reader reader) {
    return load(reader, Collections.emptyMap());
  }

  /**
   * Loads an instance from reader, then applies overrides on top of the {@code opt} lines.
   *
   * @throws WmiboFormatException on the first format error
   * @throws UncheckedIOException if reading fails
   */
  public static Instance load(Reader reader, Map<String, String> overrides) {
    BufferedReader lines =
        reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    InstanceBuilder builder = new InstanceBuilder();
    int lineNumber = 0;
    try {
      String line;
      while ((line = lines.readLine()) != null) {
        lineNumber++;
        List<String> tokens = Tokenizer.tokenize(line);
        if (tokens.isEmpty()) {
          continue;
        }
        builder.accept(DirectiveParser.parse(tokens, lineNumber));
      }
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read WMIBO input at line " + (lineNumber + 1), e);
    }
    Instance instance = builder.build(lineNumber, overrides);
    for (FormatWarning warning : instance.getWarnings()) {
      logger.warning(warning.toString());
    }
    if (instance.hasEmptyHardClause()) {
      logger.info("instance contains an empty hard clause and is infeasible");
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("loaded " + instance);
    }
    return instance;
  }

  /** Loads an instance from a string. */
  public static Instance parse(String text) {
    return load(new StringReader(text));
  }
}

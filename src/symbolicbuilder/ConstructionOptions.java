/*
 * Copyright 2010 Google Inc.
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

package symbolicbuilder;

import com.google.common.base.Preconditions;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.util.Properties;

/**
 * Options controlling how a {@link Context} builds expressions. Set the fields
 * directly, or load them from a properties file.
 */
public class ConstructionOptions {
  private static final Logger log = LogManager.getLogger(ConstructionOptions.class);

  /** The options file shipped with the library, relative to its root */
  public static final String DEFAULT_OPTIONS_FILE = "data/symbolic-builder.properties";

  static final String GUARD_OUT_OF_BOUNDS_KEY = "witness.guardOutOfBounds";
  static final String INTERNAL_PREFIX_KEY = "variables.internalPrefix";
  static final String INPUT_PREFIX_KEY = "variables.inputPrefix";

  /**
   * If true, the assertion that pins an extracted element only applies when
   * the index is within the string, so an out-of-bounds index leaves the
   * element unconstrained. If false, the bare equality is asserted.
   */
  public boolean guardOutOfBoundsWitnesses = false;

  /** Prefix for the names of fresh witness variables */
  public String internalVariablePrefix = "w";

  /** Prefix for the names of inputs declared without a name */
  public String inputVariablePrefix = "s";

  /**
   * Reads options from a properties file. Keys that are absent keep their
   * defaults and unknown keys are ignored.
   *
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if a boolean option is not "true" or
   *         "false"
   */
  public static ConstructionOptions load(FileLoader loader, String filename)
      throws IOException {
    Properties properties = new Properties();
    properties.load(new StringReader(loader.toString(filename)));
    ConstructionOptions options = fromProperties(properties);
    log.debug("Loaded options from {}: {}", filename, options);
    return options;
  }

  public static ConstructionOptions fromProperties(Properties properties) {
    ConstructionOptions options = new ConstructionOptions();
    String guard = properties.getProperty(GUARD_OUT_OF_BOUNDS_KEY);
    if (guard != null) {
      options.guardOutOfBoundsWitnesses = parseBoolean(GUARD_OUT_OF_BOUNDS_KEY, guard);
    }
    options.internalVariablePrefix = properties.getProperty(
        INTERNAL_PREFIX_KEY, options.internalVariablePrefix).trim();
    options.inputVariablePrefix = properties.getProperty(
        INPUT_PREFIX_KEY, options.inputVariablePrefix).trim();
    Preconditions.checkArgument(!options.internalVariablePrefix.isEmpty()
        && !options.inputVariablePrefix.isEmpty(), "Empty variable prefix");
    return options;
  }

  private static boolean parseBoolean(String key, String value) {
    String trimmed = value.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    } else if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(
        String.format("%s must be true or false, not '%s'", key, value));
  }

  @Override
  public String toString() {
    return String.format("{guardOutOfBounds=%s, internalPrefix=%s, inputPrefix=%s}",
        guardOutOfBoundsWitnesses, internalVariablePrefix, inputVariablePrefix);
  }
}

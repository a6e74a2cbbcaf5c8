/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.pylower.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.pylower.common.exceptions.InvalidOptionException;
import exm.pylower.common.lang.TargetVersion;

/**
 * General pylower settings.
 *
 * Each setting has a default here and may be overridden with a Java
 * system property of the same name, e.g.
 * <code>-Dpylower.target-version=3.11</code>.
 * These only supply defaults for the command line: lowering itself
 * always receives its target version as an argument.
 * */
public class Settings
{
  public static final String TARGET_VERSION = "pylower.target-version";

  /** Collect "# type: ignore" comments into Module.type_ignores */
  public static final String TYPE_COMMENTS = "pylower.type-comments";

  /** Append source positions when dumping */
  public static final String INCLUDE_ATTRIBUTES = "pylower.include-attributes";
  /** Print empty list fields when dumping */
  public static final String SHOW_EMPTY = "pylower.show-empty";

  public static final String INPUT_FILENAME = "pylower.input_filename";
  public static final String OUTPUT_FILENAME = "pylower.output_filename";

  public static final String LOG_FILE = "pylower.log.file";
  public static final String LOG_TRACE = "pylower.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(TARGET_VERSION, TargetVersion.LATEST.toString());
    defaults.setProperty(TYPE_COMMENTS, "false");
    defaults.setProperty(INCLUDE_ATTRIBUTES, "true");
    defaults.setProperty(SHOW_EMPTY, "true");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initSettings() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(TYPE_COMMENTS);
    getBoolean(INCLUDE_ATTRIBUTES);
    getBoolean(SHOW_EMPTY);
    getBoolean(LOG_TRACE);
    getTargetVersion();
  }

  public static TargetVersion getTargetVersion() throws InvalidOptionException {
    return TargetVersion.parse(get(TARGET_VERSION));
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for " + key +
                                       ": \"" + value + "\"");
    }
  }
}

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
package exm.opgen.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import exm.opgen.common.exceptions.InvalidOptionException;

/**
 * General generator settings.  Defaults are set here and can be
 * overridden with Java system properties of the same name.
 * */
public class Settings
{
  /** Column limit for wrapped lines of generated code */
  public static final String RIGHT_MARGIN = "opgen.right-margin";
  /** Indentation step of generated Python blocks */
  public static final String INDENT_WIDTH = "opgen.indent-width";

  /** Comma-separated op names to generate as hidden */
  public static final String HIDDEN_OPS = "opgen.hidden-ops";
  /** Comma-separated op names to generate with type annotations */
  public static final String TYPE_ANNOTATE_OPS = "opgen.type-annotate-ops";
  /** Comma-separated source file names mentioned in the header */
  public static final String SOURCE_FILES = "opgen.source-files";

  public static final String INPUT_FILENAME = "opgen.input_filename";
  public static final String OUTPUT_FILENAME = "opgen.output_filename";

  public static final String LOG_FILE = "opgen.log.file";
  public static final String LOG_TRACE = "opgen.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(RIGHT_MARGIN, "78");
    defaults.setProperty(INDENT_WIDTH, "2");
    defaults.setProperty(HIDDEN_OPS, "");
    defaults.setProperty(TYPE_ANNOTATE_OPS, "");
    defaults.setProperty(SOURCE_FILES, "");
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
  public static void initProperties() throws InvalidOptionException {
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

  public static String get(String key)
  {
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
    getBoolean(LOG_TRACE);
    if (getInt(RIGHT_MARGIN) < 20) {
      throw new InvalidOptionException(RIGHT_MARGIN +
          " must be at least 20, but was " + get(RIGHT_MARGIN));
    }
    int indent = getInt(INDENT_WIDTH);
    if (indent < 1 || indent > 8) {
      throw new InvalidOptionException(INDENT_WIDTH +
          " must be between 1 and 8, but was " + indent);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  /**
   * Comma-separated list value, with blanks dropped
   * @return possibly empty list
   */
  public static List<String> getList(String key) {
    String strVal = properties.getProperty(key);
    List<String> result = new ArrayList<String>();
    if (strVal == null) {
      return result;
    }
    for (String item: StringUtils.split(strVal, ',')) {
      String trimmed = item.trim();
      if (trimmed.length() > 0) {
        result.add(trimmed);
      }
    }
    return result;
  }

  /**
   * Add to a comma-separated list value
   */
  public static void addToList(String key, List<String> values) {
    List<String> current = getList(key);
    current.addAll(values);
    properties.setProperty(key, StringUtils.join(current, ','));
  }
}

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

package exm.thorc.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.thorc.common.exceptions.InvalidOptionException;

/**
 * General thorc settings.
 *
 * Defaults are overridden by Java system properties with the same key,
 * e.g. -Dthorc.log.trace=true
 * */
public class Settings
{
  public static final String LOG_FILE = "thorc.log.file";
  public static final String LOG_TRACE = "thorc.log.trace";

  /** Library directory searched after the -I directories */
  public static final String LIB_DIR = "thorc.lib.dir";

  /** Either "referenced" or "always" */
  public static final String CODEGEN_RUNTIME = "thorc.codegen.runtime";
  public static final String RUNTIME_REFERENCED = "referenced";
  public static final String RUNTIME_ALWAYS = "always";

  public static final String AST_OUTPUT_FILE = "thorc.ast.output-file";

  public static final String INPUT_FILENAME = "thorc.input_filename";
  public static final String OUTPUT_FILENAME = "thorc.output_filename";

  private static final Properties properties;

  private static final List<String> modulePath = new ArrayList<String>();

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(LIB_DIR, "lib");
    defaults.setProperty(CODEGEN_RUNTIME, RUNTIME_REFERENCED);
    defaults.setProperty(AST_OUTPUT_FILE, "");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initThorProperties() throws InvalidOptionException {
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

  public static void addModulePath(String dir) {
    modulePath.add(dir);
  }

  /**
   * @return list of directory paths to search, from first to last
   */
  public static List<String> getModulePath() {
    return Collections.unmodifiableList(modulePath);
  }

  public static void clearModulePath() {
    modulePath.clear();
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * @return true if the runtime support section should only contain
   *        helpers the program references
   * @throws InvalidOptionException
   */
  public static boolean pruneRuntime() throws InvalidOptionException {
    checkOneOf(CODEGEN_RUNTIME,
               Arrays.asList(RUNTIME_REFERENCED, RUNTIME_ALWAYS));
    return get(CODEGEN_RUNTIME).equalsIgnoreCase(RUNTIME_REFERENCED);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    checkOneOf(CODEGEN_RUNTIME,
               Arrays.asList(RUNTIME_REFERENCED, RUNTIME_ALWAYS));
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
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
}

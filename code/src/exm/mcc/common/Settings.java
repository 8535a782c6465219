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

package exm.mcc.common;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Joiner;

import exm.mcc.common.exceptions.InvalidOptionException;

/**
 * General MCC settings.  Defaults are set here and may be overridden
 * by Java system properties with the same key, e.g. -Dmcc.log.trace=true
 * */
public class Settings
{
  public static final String SOURCE_ENCODING = "mcc.source.encoding";

  public static final String LOG_FILE = "mcc.log.file";
  public static final String LOG_TRACE = "mcc.log.trace";

  /** Print token stream after lexing */
  public static final String DUMP_TOKENS = "mcc.dump.tokens";
  /** Print tree after successful analysis */
  public static final String DUMP_AST = "mcc.dump.ast";

  private static final Properties defaults;
  private static Properties properties;

  static {
    defaults = new Properties();
    // Set defaults here
    defaults.setProperty(SOURCE_ENCODING, "UTF-8");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(DUMP_TOKENS, "false");
    defaults.setProperty(DUMP_AST, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initMCCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Drop all values set since startup, keeping defaults
   */
  public static void reset() {
    properties = new Properties(defaults);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
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
    getBoolean(DUMP_TOKENS);
    getBoolean(DUMP_AST);
    getCharset(SOURCE_ENCODING);
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
  static void checkOneOf(String key, List<String> validVals)
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

    throw new InvalidOptionException("Invalid value \"" + val + "\" for "
        + key + ": expected one of " + Joiner.on(", ").join(validVals));
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    checkOneOf(key, Arrays.asList("true", "false"));
    return Boolean.parseBoolean(properties.getProperty(key));
  }

  public static Charset getCharset(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    try {
      if (val == null || !Charset.isSupported(val)) {
        throw new InvalidOptionException("Unsupported encoding \"" + val
                                        + "\" for " + key);
      }
    } catch (IllegalCharsetNameException e) {
      throw new InvalidOptionException("Illegal encoding name \"" + val
                                        + "\" for " + key);
    }
    return Charset.forName(val);
  }
}

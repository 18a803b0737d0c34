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
package exm.sfc.common;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import exm.sfc.common.exceptions.InvalidOptionException;

/**
 * Compiler settings.  Each compilation gets its own instance, layered
 * as: built-in defaults, then a JSON configuration file, then Java
 * system properties, then explicit definitions from the command line.
 *
 * List of Java properties not processed here:
 * sfc.log.file, sfc.log.verbose: used to set up logging in Main
 * */
public class Settings
{
  public static final String REGION = "sfc.region";
  public static final String ACCOUNT_ID = "sfc.account-id";

  /** Route every function unit through one dispatching function */
  public static final String USE_ROUTER_FUNC = "sfc.use-router-func";

  /** Module name marking calls to remote services */
  public static final String SERVICE_PREFIX = "sfc.service-prefix";

  /** Comma-separated names of external functions treated as remote */
  public static final String REMOTE_FUNCTIONS = "sfc.remote-functions";

  /** Comma-separated names of module functions kept as local helpers */
  public static final String LOCAL_FUNCTIONS = "sfc.local-functions";

  public static final String INPUT_FILENAME = "sfc.input_filename";
  public static final String OUTPUT_DIR = "sfc.output-dir";

  public static final String LOG_FILE = "sfc.log.file";
  public static final String LOG_VERBOSE = "sfc.log.verbose";

  /** Placeholder left in resource names until deployment fills it in */
  public static final String ACCOUNT_PLACEHOLDER = "set_account_id_in_config";

  /** Keys accepted in a JSON configuration file */
  private static final Map<String, String> CONFIG_FILE_KEYS;

  private static final Properties defaults;

  static {
    defaults = new Properties();
    defaults.setProperty(REGION, "us-east-1");
    defaults.setProperty(ACCOUNT_ID, ACCOUNT_PLACEHOLDER);
    defaults.setProperty(USE_ROUTER_FUNC, "false");
    defaults.setProperty(SERVICE_PREFIX, "cohesion");
    defaults.setProperty(REMOTE_FUNCTIONS, "");
    defaults.setProperty(LOCAL_FUNCTIONS, "");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_DIR, "build");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_VERBOSE, "false");

    CONFIG_FILE_KEYS = new LinkedHashMap<String, String>();
    CONFIG_FILE_KEYS.put("region", REGION);
    CONFIG_FILE_KEYS.put("account_id", ACCOUNT_ID);
    CONFIG_FILE_KEYS.put("use_router_func", USE_ROUTER_FUNC);
    CONFIG_FILE_KEYS.put("service_prefix", SERVICE_PREFIX);
    CONFIG_FILE_KEYS.put("remote_functions", REMOTE_FUNCTIONS);
    CONFIG_FILE_KEYS.put("local_functions", LOCAL_FUNCTIONS);
  }

  private final Properties properties;

  public Settings() {
    this.properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public void initFromSystemProperties() throws InvalidOptionException {
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validate();
  }

  /**
   * Load settings from JSON configuration file of the form
   * {"region": "...", "account_id": "...", "use_router_func": false}.
   * @param configFile
   * @throws InvalidOptionException if file is unreadable or has bad values
   */
  public void loadConfigFile(File configFile) throws InvalidOptionException {
    JsonNode root;
    try {
      root = new ObjectMapper().readTree(configFile);
    } catch (JsonProcessingException e) {
      throw new InvalidOptionException("Malformed configuration file " +
                            configFile + ": " + e.getOriginalMessage());
    } catch (IOException e) {
      throw new InvalidOptionException("Could not read configuration file " +
                                        configFile + ": " + e.getMessage());
    }
    if (root == null || !root.isObject()) {
      throw new InvalidOptionException("Configuration file " + configFile +
                                       " must contain a JSON object");
    }

    Iterator<Entry<String, JsonNode>> it = root.fields();
    while (it.hasNext()) {
      Entry<String, JsonNode> field = it.next();
      String key = CONFIG_FILE_KEYS.get(field.getKey());
      if (key == null) {
        Logging.uniqueWarn("Ignoring unknown configuration key \"" +
                           field.getKey() + "\" in " + configFile);
        continue;
      }
      properties.setProperty(key, configValue(field.getKey(),
                                              field.getValue()));
    }
    validate();
  }

  private static String configValue(String name, JsonNode val)
                                          throws InvalidOptionException {
    if (val.isArray()) {
      List<String> elems = new ArrayList<String>();
      for (JsonNode elem: val) {
        if (!elem.isTextual()) {
          throw new InvalidOptionException("Expected list of strings for " +
                            "configuration key \"" + name + "\"");
        }
        elems.add(elem.asText());
      }
      return StringUtils.join(elems, ',');
    } else if (val.isValueNode() && !val.isNull()) {
      return val.asText();
    } else {
      throw new InvalidOptionException("Invalid value for configuration key \""
                                        + name + "\": " + val);
    }
  }

  public void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Set from string of form key=value
   * @param definition
   * @throws InvalidOptionException
   */
  public void define(String definition) throws InvalidOptionException {
    int eq = definition.indexOf('=');
    if (eq <= 0) {
      throw new InvalidOptionException("Expected key=value but got: " +
                                        definition);
    }
    String key = definition.substring(0, eq).trim();
    if (!key.startsWith("sfc.")) {
      key = "sfc." + key;
    }
    if (defaults.getProperty(key) == null) {
      throw new InvalidOptionException("Unknown setting: " + key);
    }
    properties.setProperty(key, definition.substring(eq + 1).trim());
    validate();
  }

  public String get(String key)
  {
    return properties.getProperty(key);
  }

  public boolean getBoolean(String key) throws InvalidOptionException {
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
   * @param key
   * @return comma-separated list value, empty entries dropped
   */
  public List<String> getList(String key) {
    String strVal = properties.getProperty(key);
    if (strVal == null || strVal.trim().isEmpty()) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<String>();
    for (String elem: strVal.split(",")) {
      if (!elem.trim().isEmpty()) {
        result.add(elem.trim());
      }
    }
    return result;
  }

  public List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private void validate() throws InvalidOptionException {
    getBoolean(USE_ROUTER_FUNC);
    getBoolean(LOG_VERBOSE);
    checkIdentifier(SERVICE_PREFIX);
    checkNotEmpty(REGION);
    checkNotEmpty(ACCOUNT_ID);
    for (String name: getList(REMOTE_FUNCTIONS)) {
      checkIdentifier(REMOTE_FUNCTIONS, name);
    }
    for (String name: getList(LOCAL_FUNCTIONS)) {
      checkIdentifier(LOCAL_FUNCTIONS, name);
    }
  }

  private void checkNotEmpty(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.trim().isEmpty()) {
      throw new InvalidOptionException("Expected non-empty value for " + key);
    }
  }

  private void checkIdentifier(String key) throws InvalidOptionException {
    checkIdentifier(key, properties.getProperty(key));
  }

  private static void checkIdentifier(String key, String val)
                                      throws InvalidOptionException {
    if (val == null || !val.matches("[A-Za-z_][A-Za-z0-9_]*")) {
      throw new InvalidOptionException("Expected identifier for " + key +
                                       " but was '" + val + "'");
    }
  }
}

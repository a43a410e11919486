/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.json;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Typed getters over json-simple's raw maps.
 */
public class JsonUtils {

  private JsonUtils() {  }
  
  
  public static String getString(JSONObject jObj, String name, boolean require) throws JsonParsingException {
    Object value = jObj.get(name);
    if (value == null) {
      if (require)
        throw new JsonParsingException("expected '" + name + "' missing");
      return null;
    }
    if (!(value instanceof String))
      throw new JsonParsingException("'" + name + "' expects a simple string: " + value);
    return value.toString();
  }
  
  
  /**
   * Returns the first string value found under the given names, in order.
   * Used to read a field that has gone by more than one name.
   */
  public static String getString(JSONObject jObj, boolean require, String... names) throws JsonParsingException {
    for (var name : names) {
      String value = getString(jObj, name, false);
      if (value != null)
        return value;
    }
    if (require)
      throw new JsonParsingException("expected '" + names[0] + "' missing");
    return null;
  }
  
  
  public static JSONObject asJsonObject(Object value) throws JsonParsingException {
    if (value instanceof JSONObject jObj)
      return jObj;
    throw new JsonParsingException("expected a JSON object: " + value);
  }
  
  
  public static JSONArray asJsonArray(Object value) throws JsonParsingException {
    if (value instanceof JSONArray jArray)
      return jArray;
    throw new JsonParsingException("expected a JSON array: " + value);
  }

}

/*
 * Copyright 2025 Babak Farhang
 */
package io.refkey.json;


import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Two-way mapping between an entity type and its JSON object form.
 * Implementations supply {@linkplain #injectEntity(Object, JSONObject)} and
 * {@linkplain #toEntity(JSONObject)}; the rest follows.
 * 
 * @param <T> the entity type
 */
public interface JsonEntityParser<T> {
  
  
  /**
   * Writes the entity's fields into the given JSON object.
   * 
   * @return {@code jObj}
   */
  JSONObject injectEntity(T entity, JSONObject jObj);
  
  
  /**
   * Reads an entity from its JSON object form.
   */
  T toEntity(JSONObject jObj) throws JsonParsingException;
  
  
  default JSONObject toJsonObject(T entity) {
    return injectEntity(entity, new JSONObject());
  }
  
  
  default List<T> toEntityList(JSONArray jArray) throws JsonParsingException {
    var entities = new ArrayList<T>(jArray.size());
    for (int index = 0; index < jArray.size(); ++index) {
      try {
        entities.add(toEntity(JsonUtils.asJsonObject(jArray.get(index))));
      } catch (RuntimeException rx) {
        throw new JsonParsingException("at array index " + index + ": " + rx.getMessage(), rx);
      }
    }
    return entities;
  }
  
  
  default T toEntity(String json) throws JsonParsingException {
    Object parsed;
    try {
      parsed = parse(new StringReader(json));
    } catch (IOException iox) {
      throw new JsonParsingException("on reading json string: " + iox.getMessage(), iox);
    }
    return toEntity(JsonUtils.asJsonObject(parsed));
  }
  
  
  /**
   * Reads a JSON array of entities.
   * 
   * @throws IOException on read failure
   * @throws JsonParsingException if the contents are not an array of this
   *         parser's objects
   */
  default List<T> toEntityList(Reader reader) throws IOException, JsonParsingException {
    return toEntityList(JsonUtils.asJsonArray(parse(reader)));
  }
  
  
  /**
   * Parses JSON text. Besides {@code ParseException}, json-simple signals some
   * malformed input with unchecked exceptions (a {@code NumberFormatException}
   * on an integer that overflows {@code long}) and its scanner's {@code Error};
   * these are also reported as {@linkplain JsonParsingException}s.
   */
  private static Object parse(Reader reader) throws IOException, JsonParsingException {
    try {
      return new JSONParser().parse(reader);
    } catch (ParseException | RuntimeException x) {
      throw new JsonParsingException("malformed json: " + x, x);
    } catch (VirtualMachineError vmx) {
      throw vmx;
    } catch (Error scanError) {
      throw new JsonParsingException("malformed json: " + scanError, scanError);
    }
  }
  
  
  /**
   * Returns the entities as a JSON array, one object per line.
   */
  default String toJsonText(List<T> entities) {
    var s = new StringBuilder(64 + entities.size() * 192);
    s.append('[');
    for (int index = 0; index < entities.size(); ++index) {
      if (index != 0)
        s.append(',');
      s.append(System.lineSeparator()).append("  ")
       .append(toJsonObject(entities.get(index)).toJSONString());
    }
    if (!entities.isEmpty())
      s.append(System.lineSeparator());
    return s.append(']').append(System.lineSeparator()).toString();
  }

}

package org.threadly.graph;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.threadly.util.ArgumentVerifier;

/**
 * Immutable Cypher statement with its parameters and an optional tag.
 */
public final class Statement {
  /**
   * Construct a new statement without parameters or tag.
   * 
   * @param text Cypher statement text
   * @return A new statement
   */
  public static Statement create(String text) {
    return create(text, null, null);
  }

  /**
   * Construct a new statement.
   * 
   * @param text Cypher statement text
   * @param parameters Parameters, {@code null} is treated as empty
   * @param tag Tag to identify the statement result, may be {@code null}
   * @return A new statement
   */
  public static Statement create(String text, Map<String, Object> parameters, String tag) {
    return new Statement(text, parameters, tag);
  }

  private final String text;
  private final Map<String, Object> parameters;
  private final String tag;

  private Statement(String text, Map<String, Object> parameters, String tag) {
    ArgumentVerifier.assertNotNull(text, "text");
    
    this.text = text;
    if (parameters == null || parameters.isEmpty()) {
      this.parameters = Collections.emptyMap();
    } else {
      this.parameters = Collections.unmodifiableMap(new HashMap<>(parameters));
    }
    this.tag = tag;
  }

  public String text() {
    return text;
  }

  public Map<String, Object> parameters() {
    return parameters;
  }

  public String getTag() {
    return tag;
  }

  @Override
  public String toString() {
    return text;
  }
}

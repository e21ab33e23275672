package org.threadly.graph.driver;

import java.util.List;

/**
 * Single row within a {@link Result}.
 */
public interface GraphRecord {
  List<String> keys();

  List<Object> values();

  Object value(int index);
}

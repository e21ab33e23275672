package org.threadly.graph.driver;

import java.util.Map;

/**
 * Explicit transaction acquired from a {@link GraphSession}.
 */
public interface Transaction {
  Result run(String statement, Map<String, Object> parameters, String tag);

  void commit();

  void rollback();

  boolean isOpen();
}

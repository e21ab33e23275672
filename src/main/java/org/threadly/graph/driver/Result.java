package org.threadly.graph.driver;

import java.util.List;

/**
 * Materialized result of a single statement.
 */
public interface Result {
  /**
   * Records in the order the server returned them.
   * 
   * @return List of records, empty if the statement produced none
   */
  List<GraphRecord> records();
}

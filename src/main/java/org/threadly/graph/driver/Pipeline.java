package org.threadly.graph.driver;

import java.util.Map;

/**
 * Batch of statements which are sent and executed as one unit.
 */
public interface Pipeline {
  /**
   * Queue a statement into the pipeline.
   * 
   * @param text Cypher statement text
   * @param parameters Statement parameters, never {@code null}
   * @param tag Optional tag, may be {@code null}
   */
  void push(String text, Map<String, Object> parameters, String tag);

  /**
   * Execute all queued statements.
   * 
   * @return Results in the order the statements were pushed
   * @throws MessageFailureException Thrown if the server reports a failure
   */
  ResultCollection run();
}

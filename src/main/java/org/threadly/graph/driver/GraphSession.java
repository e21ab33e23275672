package org.threadly.graph.driver;

import java.util.Map;

/**
 * Logical connection context through which statements, pipelines and transactions execute.
 */
public interface GraphSession {
  /**
   * Execute a single statement and block till its result is available.
   * 
   * @param statement Cypher statement text
   * @param parameters Statement parameters, never {@code null}
   * @param tag Optional tag to associate with the result, may be {@code null}
   * @return Result of the statement
   * @throws MessageFailureException Thrown if the server reports a failure
   */
  Result run(String statement, Map<String, Object> parameters, String tag);

  /**
   * Create a pipeline, optionally already containing a first statement.
   * 
   * @param query First statement to push, or {@code null} for an empty pipeline
   * @param parameters Parameters for the first statement, never {@code null}
   * @param tag Optional tag for the first statement
   * @return A new pipeline bound to this session
   */
  Pipeline createPipeline(String query, Map<String, Object> parameters, String tag);

  /**
   * Acquire a transaction from this session.
   * 
   * @return Transaction bound to this session
   */
  Transaction transaction();

  /**
   * Close the session.
   */
  void close();
}

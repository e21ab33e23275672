package org.threadly.graph.driver;

/**
 * Handle to a driver bound to a single database endpoint.
 */
public interface GraphDriver {
  /**
   * Open a new session against the endpoint this driver was built for.
   * 
   * @return A new session
   * @throws MessageFailureException Thrown if the session could not be established
   */
  GraphSession session();

  /**
   * Release any resources held by this driver.
   */
  void close();
}

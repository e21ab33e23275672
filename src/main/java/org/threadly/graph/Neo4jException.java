package org.threadly.graph;

/**
 * Exception raised when a statement, or the routing around it, can not be completed.  When the 
 * failure originated from the server the status code it reported is preserved and available from 
 * {@link #getStatusCode()}.
 */
public class Neo4jException extends Exception {
  private static final long serialVersionUID = -3216437219458361925L;

  private final String statusCode;

  /**
   * Construct a new {@link Neo4jException} without a status code.
   * 
   * @param msg Failure message
   */
  public Neo4jException(String msg) {
    this(null, msg, null);
  }

  /**
   * Construct a new {@link Neo4jException}.
   * 
   * @param statusCode Server status code, or {@code null} if failure was not reported by a server
   * @param msg Failure message
   * @param cause Underlying failure, may be {@code null}
   */
  public Neo4jException(String statusCode, String msg, Throwable cause) {
    super(msg, cause);
    
    this.statusCode = statusCode;
  }

  /**
   * Getter for the status code reported by the server.
   * 
   * @return The Neo4j status code or {@code null} if none is available
   */
  public String getStatusCode() {
    return statusCode;
  }
}

package org.threadly.graph.driver;

/**
 * Exception raised by driver implementations when the server responds to a request with a failure 
 * message.
 */
public class MessageFailureException extends RuntimeException {
  private static final long serialVersionUID = 2318540651327044571L;

  private final String statusCode;

  /**
   * Construct a new {@link MessageFailureException}.
   * 
   * @param statusCode Status code reported by the server, may be {@code null}
   * @param message Failure message
   */
  public MessageFailureException(String statusCode, String message) {
    super(message);
    
    this.statusCode = statusCode;
  }

  /**
   * Getter for the status code the server reported with the failure.
   * 
   * @return Status code such as {@code Neo.ClientError.Statement.SyntaxError}, or {@code null}
   */
  public String getStatusCode() {
    return statusCode;
  }
}

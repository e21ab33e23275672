package org.threadly.graph.connection.routing;

import org.threadly.graph.Neo4jException;

/**
 * Exception thrown when the cluster routing table could not be fetched, or was returned in a shape 
 * that could not be understood.  A connection can not be used in routed mode after this failure.
 */
public class RoutingDiscoveryException extends Neo4jException {
  private static final long serialVersionUID = -1867440123981287513L;

  public RoutingDiscoveryException(String msg) {
    super(msg);
  }

  public RoutingDiscoveryException(String statusCode, String msg, Throwable cause) {
    super(statusCode, msg, cause);
  }
}

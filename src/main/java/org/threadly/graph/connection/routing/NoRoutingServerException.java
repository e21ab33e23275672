package org.threadly.graph.connection.routing;

import org.threadly.graph.Neo4jException;

/**
 * Exception thrown when a connection needs to switch to a class of server, but the routing table 
 * holds no server of that class.  This indicates the routing table discovered at construction was 
 * incomplete or stale.
 */
public class NoRoutingServerException extends Neo4jException {
  private static final long serialVersionUID = 6917220457712369384L;

  public NoRoutingServerException(String msg) {
    super(msg);
  }
}

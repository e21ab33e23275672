package org.threadly.graph.connection.routing;

/**
 * Class of cluster member a connection is currently routed to.
 */
public enum RoutingMode {
  /**
   * No statement has been routed yet.
   */
  UNSET,
  /**
   * Routed to a read replica.
   */
  READ,
  /**
   * Routed to a server which accepts writes.
   */
  WRITE
}

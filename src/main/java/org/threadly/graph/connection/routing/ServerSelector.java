package org.threadly.graph.connection.routing;

/**
 * Strategy for choosing which member of a server pool a connection should be routed to.
 */
public interface ServerSelector {
  /**
   * Choose an index within a pool of servers.
   * 
   * @param serverCount Size of the pool, always greater than zero
   * @return Index in the range {@code [0, serverCount)}
   */
  int selectIndex(int serverCount);
}

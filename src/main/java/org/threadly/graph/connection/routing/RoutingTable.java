package org.threadly.graph.connection.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.threadly.util.ArgumentVerifier;

/**
 * Servers discovered from the cluster for a single connection.  Holds the write and read servers 
 * and the configuration used to build drivers against them.  Instances are immutable, the class 
 * of server a connection is currently routed to is tracked by the router using the table.
 * <p>
 * The server lists are fixed once discovered, there is no periodic refresh.
 */
public class RoutingTable {
  private static final RoutingTable DISABLED = 
      new RoutingTable(false, Collections.emptyList(), Collections.emptyList(), null);

  /**
   * Routing table for connections which are not routing across a cluster.
   * 
   * @return A disabled routing table
   */
  public static RoutingTable disabled() {
    return DISABLED;
  }

  private final boolean enabled;
  private final List<GraphServer> writeServers;
  private final List<GraphServer> readServers;
  private final Properties routingConfig;

  /**
   * Construct a new enabled routing table.
   * 
   * @param writeServers Servers which accept writes, in the order they were reported
   * @param readServers Read replicas, in the order they were reported
   * @param routingConfig Configuration to use when building drivers for these servers
   */
  public RoutingTable(List<GraphServer> writeServers, List<GraphServer> readServers, 
                      Properties routingConfig) {
    this(true, writeServers, readServers, routingConfig);
  }

  private RoutingTable(boolean enabled, List<GraphServer> writeServers, 
                       List<GraphServer> readServers, Properties routingConfig) {
    ArgumentVerifier.assertNotNull(writeServers, "writeServers");
    ArgumentVerifier.assertNotNull(readServers, "readServers");
    
    this.enabled = enabled;
    this.writeServers = Collections.unmodifiableList(new ArrayList<>(writeServers));
    this.readServers = Collections.unmodifiableList(new ArrayList<>(readServers));
    this.routingConfig = routingConfig;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public List<GraphServer> getWriteServers() {
    return writeServers;
  }

  public List<GraphServer> getReadServers() {
    return readServers;
  }

  /**
   * Get the server pool for a given mode.
   * 
   * @param mode Either {@link RoutingMode#READ} or {@link RoutingMode#WRITE}
   * @return Pool of servers for that mode
   */
  public List<GraphServer> getServers(RoutingMode mode) {
    switch (mode) {
      case WRITE:
        return writeServers;
      case READ:
        return readServers;
      default:
        throw new IllegalArgumentException("No servers for mode: " + mode);
    }
  }

  public Properties getRoutingConfig() {
    return routingConfig;
  }

  @Override
  public String toString() {
    if (! enabled) {
      return RoutingTable.class.getSimpleName() + ":disabled";
    }
    return RoutingTable.class.getSimpleName() + ":write=" + writeServers + 
             ",read=" + readServers;
  }
}

package org.threadly.graph.connection.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import org.threadly.graph.driver.GraphRecord;
import org.threadly.graph.driver.GraphSession;
import org.threadly.graph.driver.MessageFailureException;
import org.threadly.graph.driver.Result;

/**
 * Fetches the routing table from a cluster member.  The procedure returns a single record whose 
 * second value lists the servers, each as a map with a {@code role} and its {@code addresses}.
 */
public class RoutingTableDiscovery {
  protected static final Logger LOG = Logger.getLogger(RoutingTableDiscovery.class.getSimpleName());
  /**
   * Statement used to request the routing table from the cluster.
   */
  public static final String ROUTING_TABLE_QUERY = "CALL dbms.routing.getRoutingTable({})";
  public static final String ROLE_KEY = "role";
  public static final String ADDRESSES_KEY = "addresses";
  public static final String ROLE_WRITE = "WRITE";
  public static final String ROLE_READ = "READ";

  private RoutingTableDiscovery() {
    // static utilities only
  }

  /**
   * Run the routing procedure on the provided session and build an enabled routing table from its 
   * response.
   * 
   * @param session Session against a member of the cluster
   * @param routingConfig Configuration to store for building drivers against discovered servers
   * @param defaultPort Port to use for addresses reported without one
   * @return A newly discovered and enabled routing table
   * @throws RoutingDiscoveryException Thrown if the procedure failed or returned an unexpected shape
   */
  public static RoutingTable discover(GraphSession session, Properties routingConfig, 
                                      int defaultPort) throws RoutingDiscoveryException {
    Result result;
    try {
      result = session.run(ROUTING_TABLE_QUERY, Collections.emptyMap(), null);
    } catch (MessageFailureException e) {
      throw new RoutingDiscoveryException(e.getStatusCode(), 
                                          "Failed to fetch routing table: " + e.getMessage(), e);
    }
    if (result == null || result.records() == null || result.records().isEmpty()) {
      throw new RoutingDiscoveryException("No record returned from routing table procedure");
    }
    GraphRecord record = result.records().get(0);
    List<Object> values = record.values();
    if (values == null || values.size() < 2) {
      throw new RoutingDiscoveryException("Routing table record missing servers: " + values);
    }
    Object servers = values.get(1);
    if (! (servers instanceof List)) {
      throw new RoutingDiscoveryException("Unexpected routing table servers value: " + servers);
    }

    List<GraphServer> writeServers = new ArrayList<>();
    List<GraphServer> readServers = new ArrayList<>();
    for (Object server : (List<?>)servers) {
      if (! (server instanceof Map)) {
        throw new RoutingDiscoveryException("Unexpected routing table server entry: " + server);
      }
      Map<?, ?> serverMap = (Map<?, ?>)server;
      Object role = serverMap.get(ROLE_KEY);
      List<GraphServer> destination;
      if (ROLE_WRITE.equals(role)) {
        destination = writeServers;
      } else if (ROLE_READ.equals(role)) {
        destination = readServers;
      } else {
        continue; // router and unknown roles are not used
      }
      Object addresses = serverMap.get(ADDRESSES_KEY);
      if (! (addresses instanceof List)) {
        throw new RoutingDiscoveryException("Unexpected addresses for role " + role + ": " + addresses);
      }
      for (Object address : (List<?>)addresses) {
        if (! (address instanceof String)) {
          throw new RoutingDiscoveryException("Unexpected server address: " + address);
        }
        try {
          destination.add(GraphServer.parse((String)address, defaultPort));
        } catch (IllegalArgumentException e) {
          throw new RoutingDiscoveryException(null, e.getMessage(), e);
        }
      }
    }

    RoutingTable routingTable = new RoutingTable(writeServers, readServers, routingConfig);
    LOG.info("Discovered routing table, write servers: " + writeServers + 
               ", read servers: " + readServers);
    return routingTable;
  }
}

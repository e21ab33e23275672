package org.threadly.graph.connection;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import org.threadly.graph.Neo4jException;
import org.threadly.graph.connection.routing.GraphServer;
import org.threadly.graph.connection.routing.NoRoutingServerException;
import org.threadly.graph.connection.routing.RoutingMode;
import org.threadly.graph.connection.routing.RoutingTable;
import org.threadly.graph.connection.routing.ServerSelector;
import org.threadly.graph.connection.routing.StatementClassifier;
import org.threadly.graph.driver.GraphDriver;
import org.threadly.util.ArgumentVerifier;

/**
 * Decides which class of cluster member a statement should be executed on, and when that differs 
 * from where the connection currently points, builds a driver against a server of that class and 
 * swaps it into the {@link DriverSessionState}.
 * <p>
 * One driver is kept per server, so routing back to a server reuses the driver built the first 
 * time it was chosen.  Those drivers stay open until the {@link DriverSessionState} is closed.  
 * The driver the connection started on (used for routing discovery) is closed once the first 
 * server is routed to.
 * <p>
 * When the {@link RoutingTable} is disabled every check is a no-op.
 */
public class ClusterRouter {
  protected static final Logger LOG = Logger.getLogger(ClusterRouter.class.getSimpleName());

  /**
   * Builds a driver connected directly to a single cluster member.
   */
  @FunctionalInterface
  public interface ServerDriverBuilder {
    /**
     * Build a driver for the provided server.
     * 
     * @param server Cluster member to connect to
     * @param routingConfig Configuration stored in the routing table
     * @return A new driver
     * @throws Neo4jException Thrown if the driver could not be built
     */
    GraphDriver build(GraphServer server, Properties routingConfig) throws Neo4jException;
  }

  protected final RoutingTable routingTable;
  protected final ServerSelector serverSelector;
  private final DriverSessionState driverState;
  private final ServerDriverBuilder driverBuilder;
  private final Map<GraphServer, GraphDriver> serverDrivers;
  private volatile RoutingMode lastMode;

  public ClusterRouter(RoutingTable routingTable, ServerSelector serverSelector, 
                       DriverSessionState driverState, ServerDriverBuilder driverBuilder) {
    ArgumentVerifier.assertNotNull(routingTable, "routingTable");
    ArgumentVerifier.assertNotNull(serverSelector, "serverSelector");
    ArgumentVerifier.assertNotNull(driverState, "driverState");
    ArgumentVerifier.assertNotNull(driverBuilder, "driverBuilder");
    
    this.routingTable = routingTable;
    this.serverSelector = serverSelector;
    this.driverState = driverState;
    this.driverBuilder = driverBuilder;
    this.serverDrivers = new HashMap<>();
    this.lastMode = RoutingMode.UNSET;
  }

  public RoutingTable getRoutingTable() {
    return routingTable;
  }

  /**
   * Getter for the class of server the connection is currently routed to.  This is 
   * {@link RoutingMode#UNSET} until the first switch, and stays that way when routing is disabled.
   * 
   * @return Current routing mode
   */
  public RoutingMode getLastMode() {
    return lastMode;
  }

  /**
   * Check if the server needs to be switched for the provided statement or forced mode.  If the 
   * connection is already routed to the needed class of server nothing changes.
   * 
   * @param statement Statement about to be executed, or {@code null} if only forcing a mode
   * @param forceMode Mode to route to regardless of the statement, or {@code null}
   * @return {@code true} if the driver was replaced
   * @throws NoRoutingServerException Thrown if no server of the needed class is known
   * @throws Neo4jException Thrown if the driver for the chosen server could not be built
   */
  public boolean checkUpdateServerRouting(String statement, 
                                          RoutingMode forceMode) throws Neo4jException {
    if (! routingTable.isEnabled()) {
      return false;
    }
    RoutingMode mode;
    if (statement == null && forceMode != null) {
      mode = null;
    } else {
      mode = StatementClassifier.classify(statement);
    }
    if (lastMode != RoutingMode.WRITE && 
        (mode == RoutingMode.WRITE || forceMode == RoutingMode.WRITE)) {
      switchServer(RoutingMode.WRITE);
      return true;
    } else if (lastMode != RoutingMode.READ && 
               (mode == RoutingMode.READ || forceMode == RoutingMode.READ)) {
      switchServer(RoutingMode.READ);
      return true;
    } else {
      return false;
    }
  }

  /**
   * Choose a server from the pool for the provided mode.
   * 
   * @param mode {@link RoutingMode#READ} or {@link RoutingMode#WRITE}
   * @return Server chosen by the {@link ServerSelector}
   * @throws NoRoutingServerException Thrown if the pool is empty
   */
  protected GraphServer selectServer(RoutingMode mode) throws NoRoutingServerException {
    List<GraphServer> servers = routingTable.getServers(mode);
    if (servers.isEmpty()) {
      throw new NoRoutingServerException("No " + mode + " servers in routing table");
    }
    int index = serverSelector.selectIndex(servers.size());
    if (index < 0 || index >= servers.size()) {
      throw new IllegalStateException("Selector provided index " + index + 
                                        " for " + servers.size() + " servers");
    }
    return servers.get(index);
  }

  private void switchServer(RoutingMode mode) throws Neo4jException {
    GraphServer server = selectServer(mode);
    GraphDriver driver = serverDrivers.get(server);
    if (driver == null) {
      driver = driverBuilder.build(server, routingTable.getRoutingConfig());
      serverDrivers.put(server, driver);
    }
    // until the first switch the connection is on the discovery driver, which is not kept
    driverState.replaceDriver(driver, lastMode == RoutingMode.UNSET);
    lastMode = mode;
    LOG.fine(() -> "Routed to " + mode + " server " + server);
  }
}

package org.threadly.graph.connection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.threadly.graph.Neo4jException;
import org.threadly.graph.connection.routing.RandomServerSelector;
import org.threadly.graph.connection.routing.ServerSelector;
import org.threadly.util.ArgumentVerifier;

/**
 * Registry of {@link GraphConnection}'s keyed by their alias.  The first registered connection is
 * the master connection, returned when no alias is requested, unless changed with
 * {@link #setMaster(String)}.
 */
public class ConnectionManager implements AutoCloseable {
  private final DriverFactory driverFactory;
  private final ServerSelector serverSelector;
  private final Map<String, GraphConnection> connections;
  private volatile GraphConnection master;

  /**
   * Construct a new manager using the {@link org.threadly.graph.driver.GraphDriverConnector}
   * implementations available on the classpath.
   */
  public ConnectionManager() {
    this(DriverFactory.loadDefault(), RandomServerSelector.instance());
  }

  public ConnectionManager(DriverFactory driverFactory, ServerSelector serverSelector) {
    ArgumentVerifier.assertNotNull(driverFactory, "driverFactory");
    ArgumentVerifier.assertNotNull(serverSelector, "serverSelector");

    this.driverFactory = driverFactory;
    this.serverSelector = serverSelector;
    this.connections = new LinkedHashMap<>();
    this.master = null;
  }

  /**
   * Construct and register a new connection.
   *
   * @param alias Alias for the connection, must not already be registered
   * @param uri Uri to connect to
   * @param config Driver specific configuration, may be {@code null}
   * @return The newly registered connection
   * @throws Neo4jException Thrown if the connection could not be constructed
   */
  public synchronized GraphConnection registerConnection(String alias, String uri,
                                                         Properties config) throws Neo4jException {
    ArgumentVerifier.assertNotNull(alias, "alias");
    if (connections.containsKey(alias)) {
      throw new IllegalArgumentException("Connection alias already registered: " + alias);
    }

    GraphConnection connection =
        new GraphConnection(alias, uri, config, driverFactory, serverSelector);
    connections.put(alias, connection);
    if (master == null) {
      master = connection;
    }
    return connection;
  }

  /**
   * Set which registered connection is returned when no alias is requested.
   *
   * @param alias Alias of a registered connection
   */
  public synchronized void setMaster(String alias) {
    master = getRegistered(alias);
  }

  /**
   * Get a connection by its alias.
   *
   * @param alias Alias of a registered connection, or {@code null} for the master connection
   * @return The requested connection
   * @throws IllegalArgumentException Thrown if the alias is not registered
   */
  public synchronized GraphConnection getConnection(String alias) {
    if (alias == null) {
      return getMasterConnection();
    }
    return getRegistered(alias);
  }

  /**
   * Get the master connection.
   *
   * @return The master connection
   * @throws IllegalStateException Thrown if no connection has been registered
   */
  public GraphConnection getMasterConnection() {
    GraphConnection result = master;
    if (result == null) {
      throw new IllegalStateException("No connections registered");
    }
    return result;
  }

  /**
   * Get all registered connections.
   *
   * @return Connections in the order they were registered
   */
  public synchronized List<GraphConnection> getConnections() {
    return new ArrayList<>(connections.values());
  }

  private GraphConnection getRegistered(String alias) {
    GraphConnection result = connections.get(alias);
    if (result == null) {
      throw new IllegalArgumentException("No connection registered with alias: " + alias);
    }
    return result;
  }

  /**
   * Close every registered connection.  All are attempted, the first failure is thrown after.
   */
  @Override
  public synchronized void close() {
    RuntimeException error = null;
    for (GraphConnection connection : connections.values()) {
      try {
        connection.close();
      } catch (RuntimeException e) {
        if (error == null) {
          error = e;
        } else {
          error.addSuppressed(e);
        }
      }
    }
    if (error != null) {
      throw error;
    }
  }
}

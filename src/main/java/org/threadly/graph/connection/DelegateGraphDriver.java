package org.threadly.graph.connection;

import java.util.Properties;

import org.threadly.graph.connection.routing.GraphServer;
import org.threadly.graph.driver.GraphDriver;
import org.threadly.graph.driver.GraphDriverConnector;
import org.threadly.graph.driver.Protocol;
import org.threadly.util.ArgumentVerifier;

/**
 * Builds drivers for one protocol family.  This ultimately deals with creating a uri and 
 * configuration suited for the underlying {@link GraphDriverConnector} and then using them to 
 * establish the driver.
 */
public abstract class DelegateGraphDriver {
  protected final Protocol protocol;
  protected final GraphDriverConnector connector;

  protected DelegateGraphDriver(Protocol protocol, GraphDriverConnector connector) {
    ArgumentVerifier.assertNotNull(connector, "connector");
    if (connector.getProtocol() != protocol) {
      throw new IllegalArgumentException("Connector provides " + connector.getProtocol() + 
                                           " drivers, expected " + protocol);
    }
    
    this.protocol = protocol;
    this.connector = connector;
  }

  public Protocol getProtocol() {
    return protocol;
  }

  /**
   * Get the connector drivers are ultimately built from.
   * 
   * @return Connector this delegate wraps
   */
  public GraphDriverConnector getConnector() {
    return connector;
  }

  /**
   * Get the name for this driver.
   * 
   * @return The name for the driver
   */
  public abstract String getDriverName();

  /**
   * Produce the uri the initial driver for a connection should be built against.
   * 
   * @param uri Parsed connection uri
   * @return Uri to provide to the connector
   */
  public abstract String makeDriverUri(GraphUri uri);

  /**
   * Produce the configuration drivers for this connection should be built with.  The provided 
   * configuration must not be modified.
   * 
   * @param uri Parsed connection uri
   * @param config Configuration provided by the caller, may be {@code null}
   * @return Configuration to provide to the connector
   */
  public abstract Properties makeDriverConfig(GraphUri uri, Properties config);

  /**
   * Produce the uri to connect directly to a single cluster member discovered from the routing 
   * table.  By default routing is not supported.
   * 
   * @param uri Parsed connection uri
   * @param server Cluster member to connect to
   * @return Uri to provide to the connector
   */
  public String makeServerUri(GraphUri uri, GraphServer server) {
    throw new UnsupportedOperationException(getDriverName() + " does not support routing");
  }

  /**
   * Connect using the delegate connector.
   * 
   * @param driverUri Uri produced by this delegate
   * @param driverConfig Configuration produced by this delegate
   * @return A new driver
   */
  public GraphDriver connect(String driverUri, Properties driverConfig) {
    return connector.connect(driverUri, driverConfig);
  }
}

package org.threadly.graph.connection;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.ServiceLoader;

import org.threadly.graph.connection.bolt.BoltDelegateDriver;
import org.threadly.graph.connection.http.HttpDelegateDriver;
import org.threadly.graph.driver.GraphDriverConnector;
import org.threadly.graph.driver.Protocol;

/**
 * Selects the {@link DelegateGraphDriver} able to serve a given uri.  Holds at most one delegate 
 * per {@link Protocol}, the first connector provided for a protocol is the one used.
 */
public class DriverFactory {
  /**
   * Construct a factory from the {@link GraphDriverConnector} implementations registered as 
   * services on the classpath.
   * 
   * @return A new factory, possibly without any delegates
   */
  public static DriverFactory loadDefault() {
    return new DriverFactory(ServiceLoader.load(GraphDriverConnector.class));
  }

  private final Map<Protocol, DelegateGraphDriver> delegates;

  /**
   * Construct a new factory for the provided connectors.
   * 
   * @param connectors Connectors to build drivers from
   */
  public DriverFactory(GraphDriverConnector ... connectors) {
    this(Arrays.asList(connectors));
  }

  /**
   * Construct a new factory for the provided connectors.
   * 
   * @param connectors Connectors to build drivers from
   */
  public DriverFactory(Iterable<GraphDriverConnector> connectors) {
    delegates = new EnumMap<>(Protocol.class);
    for (GraphDriverConnector connector : connectors) {
      if (! delegates.containsKey(connector.getProtocol())) {
        delegates.put(connector.getProtocol(), makeDelegate(connector));
      }
    }
  }

  protected DelegateGraphDriver makeDelegate(GraphDriverConnector connector) {
    switch (connector.getProtocol()) {
      case BOLT:
        return new BoltDelegateDriver(connector);
      case HTTP:
        return new HttpDelegateDriver(connector);
      default:
        throw new IllegalArgumentException("Unsupported protocol: " + connector.getProtocol());
    }
  }

  /**
   * Check if a driver is available for a given protocol.
   * 
   * @param protocol Protocol family to check
   * @return {@code true} if a connector for the protocol was provided
   */
  public boolean acceptsProtocol(Protocol protocol) {
    return delegates.containsKey(protocol);
  }

  /**
   * Get the delegate which will build drivers for the provided uri.
   * 
   * @param uri Parsed connection uri
   * @return Delegate for the uri's protocol family
   * @throws IllegalStateException Thrown if no connector for the protocol was provided
   */
  public DelegateGraphDriver driverFor(GraphUri uri) {
    DelegateGraphDriver result = delegates.get(uri.getProtocol());
    if (result == null) {
      throw new IllegalStateException("No " + uri.getProtocol() + " driver available for: " + uri);
    }
    return result;
  }
}

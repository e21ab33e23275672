package org.threadly.graph.connection.http;

import java.util.Properties;

import org.threadly.graph.connection.DelegateGraphDriver;
import org.threadly.graph.connection.GraphUri;
import org.threadly.graph.driver.GraphDriverConnector;
import org.threadly.graph.driver.Protocol;

/**
 * Delegate for http drivers.  The original uri and configuration are passed through unchanged, 
 * the http driver handles credentials and transport itself.
 */
public class HttpDelegateDriver extends DelegateGraphDriver {
  public HttpDelegateDriver(GraphDriverConnector connector) {
    super(Protocol.HTTP, connector);
  }

  @Override
  public String getDriverName() {
    return "http";
  }

  @Override
  public String makeDriverUri(GraphUri uri) {
    return uri.getUri();
  }

  @Override
  public Properties makeDriverConfig(GraphUri uri, Properties config) {
    return config;
  }
}

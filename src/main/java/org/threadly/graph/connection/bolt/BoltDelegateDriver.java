package org.threadly.graph.connection.bolt;

import java.util.Properties;

import org.threadly.graph.connection.DelegateGraphDriver;
import org.threadly.graph.connection.GraphUri;
import org.threadly.graph.connection.routing.GraphServer;
import org.threadly.graph.driver.GraphDriverConnector;
import org.threadly.graph.driver.Protocol;

/**
 * Delegate for bolt family drivers.  Drivers connect to {@code scheme://host:port}, with 
 * credentials taken from the uri.  When the uri carries credentials encrypted transport is 
 * required, otherwise a placeholder credential pair is used so servers without auth still accept 
 * the connection.
 */
public class BoltDelegateDriver extends DelegateGraphDriver {
  public static final String PROPERTY_USER = "user";
  public static final String PROPERTY_PASSWORD = "password";
  public static final String PROPERTY_TLS_MODE = "tlsMode";
  public static final String TLS_MODE_REQUIRED = "REQUIRED";
  public static final String PLACEHOLDER_CREDENTIAL = "null";

  public BoltDelegateDriver(GraphDriverConnector connector) {
    super(Protocol.BOLT, connector);
  }

  @Override
  public String getDriverName() {
    return "bolt";
  }

  @Override
  public String makeDriverUri(GraphUri uri) {
    return uri.getScheme() + "://" + new GraphServer(uri.getHost(), uri.getPort()).hostAndPortString();
  }

  @Override
  public Properties makeDriverConfig(GraphUri uri, Properties config) {
    Properties result = new Properties();
    if (config != null) {
      result.putAll(config);
    }
    if (uri.hasCredentials()) {
      result.setProperty(PROPERTY_USER, uri.getUser());
      result.setProperty(PROPERTY_PASSWORD, uri.getPassword());
      result.setProperty(PROPERTY_TLS_MODE, TLS_MODE_REQUIRED);
    } else {
      result.setProperty(PROPERTY_USER, PLACEHOLDER_CREDENTIAL);
      result.setProperty(PROPERTY_PASSWORD, PLACEHOLDER_CREDENTIAL);
    }
    return result;
  }

  @Override
  public String makeServerUri(GraphUri uri, GraphServer server) {
    return uri.getDirectScheme() + "://" + server.hostAndPortString();
  }
}

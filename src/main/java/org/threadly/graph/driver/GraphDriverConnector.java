package org.threadly.graph.driver;

import java.util.Properties;

/**
 * Service provider interface for the protocol implementations that actually talk to the database. 
 * Implementations are discovered with {@link java.util.ServiceLoader}, or can be provided directly 
 * to {@link org.threadly.graph.connection.DriverFactory}.
 */
public interface GraphDriverConnector {
  /**
   * Getter for the protocol family this connector implements.
   * 
   * @return Protocol family, never {@code null}
   */
  Protocol getProtocol();

  /**
   * Build a new driver for the provided uri.
   * 
   * @param uri Fully formed uri to connect against
   * @param config Driver specific configuration, may be {@code null}
   * @return A new driver instance
   * @throws MessageFailureException Thrown if the driver could not be constructed
   */
  GraphDriver connect(String uri, Properties config);
}

package org.threadly.graph.driver;

/**
 * Family of wire protocols a {@link GraphDriverConnector} can provide drivers for.
 */
public enum Protocol {
  /**
   * Binary bolt protocol, including the routing marked variants.
   */
  BOLT,
  /**
   * Transactional HTTP endpoint, plain or secure.
   */
  HTTP
}

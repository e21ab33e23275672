package org.threadly.graph.connection.routing;

import org.threadly.util.ArgumentVerifier;

/**
 * Address of a cluster member as reported in the routing table.
 */
public class GraphServer implements Comparable<GraphServer> {
  /**
   * Parse a {@link GraphServer} from a given {@code host:port} string.  IPv6 hosts must be 
   * enclosed in brackets when a port is included.
   * 
   * @param address Host and optional port within a single string
   * @param defaultPort Port to use if the address does not include one
   * @return Server for the provided address
   * @throws IllegalArgumentException Thrown if the address is empty or its port is not a number
   */
  public static GraphServer parse(String address, int defaultPort) {
    String host;
    int port;
    int delim = address.lastIndexOf(':');
    if (address.startsWith("[")) {
      int bracketEnd = address.indexOf(']');
      if (bracketEnd < 0) {
        throw new IllegalArgumentException("Invalid server address: " + address);
      }
      host = address.substring(1, bracketEnd);
      if (delim > bracketEnd) {
        port = parsePort(address, address.substring(delim + 1));
      } else {
        port = defaultPort;
      }
    } else if (delim > 0 && address.indexOf(':') == delim) {
      host = address.substring(0, delim);
      port = parsePort(address, address.substring(delim + 1));
    } else {
      host = address;
      port = defaultPort;
    }
    if (host.isEmpty()) {
      throw new IllegalArgumentException("Invalid server address: " + address);
    }
    return new GraphServer(host, port);
  }

  private final String host;
  private final int port;
  private final int hashCode;

  /**
   * Construct a new {@link GraphServer} with the host and port broken into individual components.
   * 
   * @param host Server host / dns
   * @param port Port to connect to
   */
  public GraphServer(String host, int port) {
    ArgumentVerifier.assertNotNull(host, "host");
    
    this.host = host;
    this.port = port;

    hashCode = this.host.hashCode() ^ port;
  }

  private static int parsePort(String address, String portStr) {
    try {
      return Integer.parseInt(portStr);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid port in server address: " + address, e);
    }
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  /**
   * Check if the host and port matches to this server.
   * 
   * @param host Network host which must match exactly
   * @param port Server port used on host
   * @return {@code true} if both host and port match exactly
   */
  public boolean matchHost(String host, int port) {
    return this.host.equals(host) && this.port == port;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (o instanceof GraphServer) {
      GraphServer gs = (GraphServer)o;
      return matchHost(gs.host, gs.port);
    } else {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public int compareTo(GraphServer gs) {
    int hostCompare = host.compareTo(gs.host);
    if (hostCompare == 0) {
      return port - gs.port;
    } else {
      return hostCompare;
    }
  }

  /**
   * Produce a {@code host:port} representation of the server, suitable to be appended to a scheme.
   * 
   * @return The destination host and port represented in a single string
   */
  public String hostAndPortString() {
    if (host.indexOf(':') >= 0) {
      return '[' + host + "]:" + port;
    } else {
      return host + ":" + port;
    }
  }

  @Override
  public String toString() {
    return hostAndPortString();
  }
}

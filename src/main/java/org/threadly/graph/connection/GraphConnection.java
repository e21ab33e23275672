package org.threadly.graph.connection;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import org.threadly.graph.Neo4jException;
import org.threadly.graph.Statement;
import org.threadly.graph.StatementStack;
import org.threadly.graph.connection.routing.GraphServer;
import org.threadly.graph.connection.routing.RandomServerSelector;
import org.threadly.graph.connection.routing.RoutingDiscoveryException;
import org.threadly.graph.connection.routing.RoutingMode;
import org.threadly.graph.connection.routing.RoutingTable;
import org.threadly.graph.connection.routing.RoutingTableDiscovery;
import org.threadly.graph.connection.routing.ServerSelector;
import org.threadly.graph.driver.GraphDriver;
import org.threadly.graph.driver.GraphSession;
import org.threadly.graph.driver.MessageFailureException;
import org.threadly.graph.driver.Pipeline;
import org.threadly.graph.driver.Result;
import org.threadly.graph.driver.ResultCollection;
import org.threadly.graph.driver.Transaction;
import org.threadly.util.ArgumentVerifier;
import org.threadly.util.StringUtils;

/**
 * Connection to a graph database identified by an alias.  Under the hood this delegates to a
 * single driver and a lazily opened session on it.
 * <p>
 * When the uri scheme is routing marked (for example {@code bolt+routing://}) the cluster routing
 * table is discovered at construction.  From then on each statement is classified as a read or a
 * write, and when that differs from the class of server the connection currently points at the
 * driver is rebuilt against a random server of the needed class.  After every successful statement
 * the connection returns to a write server, unless {@link #PROPERTY_ROUTING_RESET_TO_WRITE} is
 * set to {@code false} in the uri arguments.
 * <p>
 * Instances are not safe for concurrent use, they should be used by one caller at a time.
 */
public class GraphConnection implements AutoCloseable {
  /**
   * Uri argument which controls if a routed connection goes back to a write server after every
   * successful statement.  Defaults to {@code true}.
   */
  public static final String PROPERTY_ROUTING_RESET_TO_WRITE = "routingResetToWrite";

  protected static final Logger LOG = Logger.getLogger(GraphConnection.class.getSimpleName());

  private final String alias;
  private final Properties config;
  private final GraphUri graphUri;
  private final DelegateGraphDriver delegateDriver;
  private final boolean resetToWriteAfterRun;
  private final AtomicBoolean closed;
  protected final DriverSessionState driverState;
  protected final ClusterRouter router;

  /**
   * Construct a new connection using the {@link org.threadly.graph.driver.GraphDriverConnector}
   * implementations available on the classpath.
   *
   * @param alias Name identifying this connection
   * @param uri Uri to connect to
   * @throws Neo4jException Thrown if the driver could not be built, or routing discovery failed
   */
  public GraphConnection(String alias, String uri) throws Neo4jException {
    this(alias, uri, null);
  }

  /**
   * Construct a new connection using the {@link org.threadly.graph.driver.GraphDriverConnector}
   * implementations available on the classpath.
   *
   * @param alias Name identifying this connection
   * @param uri Uri to connect to
   * @param config Driver specific configuration, may be {@code null}
   * @throws Neo4jException Thrown if the driver could not be built, or routing discovery failed
   */
  public GraphConnection(String alias, String uri, Properties config) throws Neo4jException {
    this(alias, uri, config, DriverFactory.loadDefault(), RandomServerSelector.instance());
  }

  /**
   * Construct a new connection.
   *
   * @param alias Name identifying this connection
   * @param uri Uri to connect to
   * @param config Driver specific configuration, may be {@code null}
   * @param driverFactory Factory to provide the delegate for the uri's protocol
   * @param serverSelector Selector used to choose among routed servers
   * @throws IllegalArgumentException Thrown if the uri is invalid or has an unsupported scheme
   * @throws IllegalStateException Thrown if no driver for the uri's protocol is available
   * @throws RoutingDiscoveryException Thrown if the routing table could not be discovered
   * @throws Neo4jException Thrown if the driver could not be built
   */
  public GraphConnection(String alias, String uri, Properties config,
                         DriverFactory driverFactory,
                         ServerSelector serverSelector) throws Neo4jException {
    ArgumentVerifier.assertNotNull(alias, "alias");
    ArgumentVerifier.assertNotNull(driverFactory, "driverFactory");
    ArgumentVerifier.assertNotNull(serverSelector, "serverSelector");

    this.alias = alias;
    this.config = config;
    this.graphUri = GraphUri.parse(uri);
    this.delegateDriver = driverFactory.driverFor(graphUri);
    this.resetToWriteAfterRun =
        ! "false".equalsIgnoreCase(graphUri.getArgument(PROPERTY_ROUTING_RESET_TO_WRITE));
    this.closed = new AtomicBoolean();

    Properties driverConfig = delegateDriver.makeDriverConfig(graphUri, config);
    driverState = new DriverSessionState(connect(delegateDriver.makeDriverUri(graphUri), driverConfig));
    try {
      RoutingTable routingTable;
      if (graphUri.isRoutingScheme()) {
        routingTable = discoverRoutingTable(driverConfig);
      } else {
        routingTable = RoutingTable.disabled();
      }
      router = new ClusterRouter(routingTable, serverSelector, driverState, this::connectServer);
      // move off the discovery driver and onto a write server
      router.checkUpdateServerRouting(null, RoutingMode.WRITE);
    } catch (Neo4jException | RuntimeException e) {
      try {
        driverState.close();
      } catch (RuntimeException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
  }

  private RoutingTable discoverRoutingTable(Properties driverConfig) throws RoutingDiscoveryException {
    GraphSession session;
    try {
      session = driverState.ensureSession();
    } catch (MessageFailureException e) {
      throw new RoutingDiscoveryException(e.getStatusCode(),
                                          "Unable to open session for routing discovery: " +
                                            e.getMessage(), e);
    }
    return RoutingTableDiscovery.discover(session, driverConfig, GraphUri.DEFAULT_BOLT_PORT);
  }

  private GraphDriver connectServer(GraphServer server, Properties routingConfig) throws Neo4jException {
    return connect(delegateDriver.makeServerUri(graphUri, server), routingConfig);
  }

  private GraphDriver connect(String driverUri, Properties driverConfig) throws Neo4jException {
    try {
      return delegateDriver.connect(driverUri, driverConfig);
    } catch (MessageFailureException e) {
      throw new Neo4jException(e.getStatusCode(),
                               "Unable to build " + delegateDriver.getDriverName() +
                                 " driver: " + e.getMessage(), e);
    }
  }

  private static Neo4jException translate(MessageFailureException e) {
    return new Neo4jException(e.getStatusCode(), e.getMessage(), e);
  }

  private static Map<String, Object> normalizeParameters(Map<String, Object> parameters) {
    return parameters == null ? Collections.<String, Object>emptyMap() : parameters;
  }

  private void verifyOpen() {
    if (closed.get()) {
      throw new IllegalStateException("Connection closed: " + alias);
    }
  }

  private GraphSession session() throws Neo4jException {
    verifyOpen();
    try {
      return driverState.ensureSession();
    } catch (MessageFailureException e) {
      throw translate(e);
    }
  }

  public String getAlias() {
    return alias;
  }

  /**
   * Getter for the uri exactly as provided at construction.
   *
   * @return Connection uri
   */
  public String getUri() {
    return graphUri.getUri();
  }

  public Properties getConfig() {
    return config;
  }

  /**
   * Getter for the driver statements are currently delegated to.  For routed connections this
   * changes as statements are routed.
   *
   * @return Current driver
   */
  public GraphDriver getDriver() {
    return driverState.getDriver();
  }

  /**
   * Get the session statements are executed on, opening one if needed.
   *
   * @return Session bound to the current driver
   * @throws Neo4jException Thrown if the session could not be opened
   */
  public GraphSession getSession() throws Neo4jException {
    return session();
  }

  /**
   * Getter for the servers discovered for this connection.  The table is immutable, for direct 
   * connections it is {@link RoutingTable#disabled()}.
   * 
   * @return Routing table of this connection
   */
  public RoutingTable getRoutingTable() {
    return router.getRoutingTable();
  }

  /**
   * Getter for the class of server statements are currently routed to.
   * 
   * @return Current mode, {@link RoutingMode#UNSET} when routing is disabled
   */
  public RoutingMode getRoutingMode() {
    return router.getLastMode();
  }

  public boolean isRoutingEnabled() {
    return router.getRoutingTable().isEnabled();
  }

  /**
   * Create a new empty pipeline on the current session.
   *
   * @return A new pipeline
   * @throws Neo4jException Thrown if the session or pipeline could not be created
   */
  public Pipeline createPipeline() throws Neo4jException {
    return createPipeline(null, null, null);
  }

  /**
   * Create a new pipeline on the current session.  Creating a pipeline does not route, the
   * pipeline runs against whichever server the connection currently points at.
   *
   * @param query First statement of the pipeline, or {@code null}
   * @param parameters Parameters of the first statement, {@code null} is treated as empty
   * @param tag Tag of the first statement, may be {@code null}
   * @return A new pipeline
   * @throws Neo4jException Thrown if the session or pipeline could not be created
   */
  public Pipeline createPipeline(String query, Map<String, Object> parameters,
                                 String tag) throws Neo4jException {
    GraphSession session = session();
    try {
      return session.createPipeline(query, normalizeParameters(parameters), tag);
    } catch (MessageFailureException e) {
      throw translate(e);
    }
  }

  public Result run(String statement) throws Neo4jException {
    return run(statement, null, null);
  }

  public Result run(String statement, Map<String, Object> parameters) throws Neo4jException {
    return run(statement, parameters, null);
  }

  /**
   * Run a single statement.  For routed connections the statement is first routed to a read or
   * write server based off its content.  Failures are never retried.
   *
   * @param statement Cypher statement, must not be empty
   * @param parameters Statement parameters, {@code null} is treated as empty
   * @param tag Tag to associate with the result, may be {@code null}
   * @return Result of the statement
   * @throws IllegalArgumentException Thrown if the statement is {@code null} or empty
   * @throws IllegalStateException Thrown if the connection was closed
   * @throws Neo4jException Thrown if routing failed or the server reported a failure
   */
  public Result run(String statement, Map<String, Object> parameters,
                    String tag) throws Neo4jException {
    if (StringUtils.isNullOrEmpty(statement)) {
      throw new IllegalArgumentException("Expected a non-empty Cypher statement, got \"" +
                                           statement + "\"");
    }
    verifyOpen();
    router.checkUpdateServerRouting(statement, null);
    GraphSession session = session();

    Result result;
    try {
      result = session.run(statement, normalizeParameters(parameters), tag);
    } catch (MessageFailureException e) {
      throw translate(e);
    }
    if (resetToWriteAfterRun) {
      router.checkUpdateServerRouting(statement, RoutingMode.WRITE);
    }
    return result;
  }

  /**
   * Run a mix of {@link StatementStack}'s and {@link Statement}'s in a single pipeline.  Stacks
   * have each of their statements pushed in order.  Entries of any other type are ignored.
   *
   * @param queue Stacks and statements to run
   * @return Results in the order statements were pushed
   * @throws Neo4jException Thrown if the server reported a failure
   */
  public ResultCollection runMixed(List<?> queue) throws Neo4jException {
    Pipeline pipeline = createPipeline();

    try {
      for (Object element : queue) {
        if (element instanceof StatementStack) {
          for (Statement statement : ((StatementStack)element).statements()) {
            pipeline.push(statement.text(), statement.parameters(), statement.getTag());
          }
        } else if (element instanceof Statement) {
          Statement statement = (Statement)element;
          pipeline.push(statement.text(), statement.parameters(), statement.getTag());
        } else {
          LOG.fine(() -> "Skipping unsupported queue entry: " + element);
        }
      }

      return pipeline.run();
    } catch (MessageFailureException e) {
      throw translate(e);
    }
  }

  /**
   * Acquire a transaction from the current session.
   *
   * @return Transaction bound to the current session
   * @throws Neo4jException Thrown if the session or transaction could not be acquired
   */
  public Transaction getTransaction() throws Neo4jException {
    GraphSession session = session();
    try {
      return session.transaction();
    } catch (MessageFailureException e) {
      throw translate(e);
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      driverState.close();
    }
  }

  @Override
  public String toString() {
    return GraphConnection.class.getSimpleName() + ":" + alias + ":" + graphUri;
  }
}

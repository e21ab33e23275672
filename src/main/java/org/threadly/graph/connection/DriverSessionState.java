package org.threadly.graph.connection;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.threadly.graph.driver.GraphDriver;
import org.threadly.graph.driver.GraphSession;
import org.threadly.util.ArgumentVerifier;

/**
 * Holds the driver a connection currently delegates to, and the session lazily opened from it.  
 * The driver is only replaced through {@link #replaceDriver(GraphDriver, boolean)} (by the 
 * {@link ClusterRouter}), which always closes and drops the session.  The session is only 
 * populated through {@link #ensureSession()}.
 * <p>
 * Every driver provided to this state is closed by {@link #close()}, unless it was already 
 * closed when it was replaced.
 */
public class DriverSessionState {
  protected static final Logger LOG = Logger.getLogger(DriverSessionState.class.getSimpleName());

  private final Set<GraphDriver> openDrivers;
  private GraphDriver driver;
  private GraphSession session;
  private boolean closed;

  protected DriverSessionState(GraphDriver driver) {
    ArgumentVerifier.assertNotNull(driver, "driver");
    
    this.openDrivers = Collections.newSetFromMap(new IdentityHashMap<>());
    this.openDrivers.add(driver);
    this.driver = driver;
    this.session = null;
    this.closed = false;
  }

  public GraphDriver getDriver() {
    return driver;
  }

  /**
   * Check if a session is currently held.
   * 
   * @return {@code true} if a session was opened from the current driver
   */
  public boolean hasSession() {
    return session != null;
  }

  /**
   * Return the held session, opening one from the current driver if none is held.
   * 
   * @return Session bound to the current driver
   */
  public GraphSession ensureSession() {
    if (closed) {
      throw new IllegalStateException("Connection closed");
    }
    if (session == null) {
      session = driver.session();
    }
    return session;
  }

  /**
   * Swap in a new current driver.  The held session is closed, the next 
   * {@link #ensureSession()} opens a fresh one from the new driver.  The previous driver is kept 
   * open for reuse unless {@code closePrevious} is set.  Failures closing the previous session or 
   * driver are logged, the swap has already happened at that point.
   * 
   * @param newDriver Driver to delegate to from now on, may be one previously provided
   * @param closePrevious {@code true} to close the driver being replaced
   */
  void replaceDriver(GraphDriver newDriver, boolean closePrevious) {
    ArgumentVerifier.assertNotNull(newDriver, "newDriver");
    if (closed) {
      throw new IllegalStateException("Connection closed");
    }
    
    LOG.fine(() -> "Replacing driver " + driver + " with " + newDriver);
    GraphDriver previousDriver = driver;
    GraphSession previousSession = session;
    driver = newDriver;
    session = null;
    openDrivers.add(newDriver);

    if (previousSession != null) {
      try {
        previousSession.close();
      } catch (RuntimeException e) {
        LOG.log(Level.WARNING, "Error closing session of replaced driver: " + previousDriver, e);
      }
    }
    if (closePrevious && previousDriver != newDriver) {
      openDrivers.remove(previousDriver);
      try {
        previousDriver.close();
      } catch (RuntimeException e) {
        LOG.log(Level.WARNING, "Error closing replaced driver: " + previousDriver, e);
      }
    }
  }

  /**
   * Get the count of drivers this state will close on {@link #close()}.
   * 
   * @return Number of drivers still open
   */
  public int getOpenDriverCount() {
    return openDrivers.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Close the held session and every driver still open, including drivers which were replaced.  
   * All are attempted, if any fail the first failure is thrown once all were attempted.
   */
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    RuntimeException error = null;
    if (session != null) {
      try {
        session.close();
      } catch (RuntimeException e) {
        error = e;
      }
      session = null;
    }
    for (GraphDriver openDriver : openDrivers) {
      try {
        openDriver.close();
      } catch (RuntimeException e) {
        if (error == null) {
          error = e;
        } else {
          error.addSuppressed(e);
        }
      }
    }
    openDrivers.clear();
    if (error != null) {
      throw error;
    }
  }
}

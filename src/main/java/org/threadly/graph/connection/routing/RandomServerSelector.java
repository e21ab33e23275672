package org.threadly.graph.connection.routing;

import java.util.concurrent.ThreadLocalRandom;

import org.threadly.util.ArgumentVerifier;

/**
 * {@link ServerSelector} which picks uniformly at random.
 */
public class RandomServerSelector implements ServerSelector {
  private static final RandomServerSelector INSTANCE = new RandomServerSelector();

  /**
   * Getter for the shared instance, this selector holds no state.
   * 
   * @return Random selector instance
   */
  public static RandomServerSelector instance() {
    return INSTANCE;
  }

  @Override
  public int selectIndex(int serverCount) {
    ArgumentVerifier.assertGreaterThanZero(serverCount, "serverCount");
    
    if (serverCount == 1) {
      return 0;
    }
    return ThreadLocalRandom.current().nextInt(serverCount);
  }
}

package org.threadly.graph.connection.routing;

import java.util.regex.Pattern;

/**
 * Decides if a Cypher statement needs a server which accepts writes.  A statement is considered 
 * a write if it contains one of the updating clause keywords as a whole uppercase word.
 */
public class StatementClassifier {
  private static final Pattern WRITE_KEYWORDS = Pattern.compile("\\b(CREATE|SET|MERGE|DELETE)\\b");

  private StatementClassifier() {
    // static utilities only
  }

  /**
   * Classify the provided statement.
   * 
   * @param statement Cypher statement text, {@code null} is classified as a read
   * @return {@link RoutingMode#WRITE} or {@link RoutingMode#READ}, never {@link RoutingMode#UNSET}
   */
  public static RoutingMode classify(String statement) {
    if (statement != null && WRITE_KEYWORDS.matcher(statement).find()) {
      return RoutingMode.WRITE;
    } else {
      return RoutingMode.READ;
    }
  }
}

package org.threadly.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Ordered batch of statements which are sent together, for example through 
 * {@link org.threadly.graph.connection.GraphConnection#runMixed(List)}.
 */
public class StatementStack {
  /**
   * Construct a new stack without a tag.
   * 
   * @return A new empty stack
   */
  public static StatementStack create() {
    return create(null);
  }

  /**
   * Construct a new stack.
   * 
   * @param tag Tag of the stack, may be {@code null}
   * @return A new empty stack
   */
  public static StatementStack create(String tag) {
    return new StatementStack(tag);
  }

  private final String tag;
  private final List<Statement> statements;

  protected StatementStack(String tag) {
    this.tag = tag;
    this.statements = new ArrayList<>();
  }

  /**
   * Push a new statement to the end of this stack.
   * 
   * @param query Cypher statement text
   * @param parameters Parameters, may be {@code null}
   * @param tag Tag for the statement, may be {@code null}
   * @return This stack so calls can be chained
   */
  public StatementStack push(String query, Map<String, Object> parameters, String tag) {
    return push(Statement.create(query, parameters, tag));
  }

  /**
   * Push an existing statement to the end of this stack.
   * 
   * @param statement Statement to add
   * @return This stack so calls can be chained
   */
  public StatementStack push(Statement statement) {
    statements.add(statement);
    return this;
  }

  public List<Statement> statements() {
    return Collections.unmodifiableList(statements);
  }

  public String getTag() {
    return tag;
  }

  public int size() {
    return statements.size();
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }
}

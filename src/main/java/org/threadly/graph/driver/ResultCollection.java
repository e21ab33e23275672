package org.threadly.graph.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered collection of results, produced when a {@link Pipeline} is run.
 */
public class ResultCollection implements Iterable<Result> {
  private final List<Result> results;
  private final String tag;

  /**
   * Construct a new empty collection without a tag.
   */
  public ResultCollection() {
    this(null);
  }

  /**
   * Construct a new empty collection.
   * 
   * @param tag Tag of the batch that produced this collection, may be {@code null}
   */
  public ResultCollection(String tag) {
    this.results = new ArrayList<>();
    this.tag = tag;
  }

  public void add(Result result) {
    results.add(result);
  }

  public Result get(int index) {
    return results.get(index);
  }

  public int size() {
    return results.size();
  }

  public List<Result> getResults() {
    return Collections.unmodifiableList(results);
  }

  public String getTag() {
    return tag;
  }

  @Override
  public Iterator<Result> iterator() {
    return getResults().iterator();
  }
}

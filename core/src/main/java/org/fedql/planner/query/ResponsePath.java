/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Ordered sequence of response keys from the query root. Attach paths additionally carry {@link
 * #LIST_MARKER} after a list valued field, telling the executor to flatten over the list elements
 * before splicing a result.
 */
@EqualsAndHashCode
public final class ResponsePath {

  public static final String LIST_MARKER = "@";

  public static final ResponsePath ROOT = new ResponsePath(ImmutableList.of());

  private final ImmutableList<String> segments;

  private ResponsePath(ImmutableList<String> segments) {
    this.segments = segments;
  }

  public static ResponsePath of(String... segments) {
    return of(List.of(segments));
  }

  public static ResponsePath of(List<String> segments) {
    return segments.isEmpty() ? ROOT : new ResponsePath(ImmutableList.copyOf(segments));
  }

  /** Returns a new path with the given response key appended. */
  public ResponsePath append(String segment) {
    Preconditions.checkArgument(
        segment != null && !segment.isEmpty(), "path segment must not be empty");
    return new ResponsePath(
        ImmutableList.<String>builder().addAll(segments).add(segment).build());
  }

  public ResponsePath appendListMarker() {
    return append(LIST_MARKER);
  }

  @JsonValue
  public List<String> getSegments() {
    return segments;
  }

  public int size() {
    return segments.size();
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  /** Returns the response keys of this path, dropping list markers. */
  public ResponsePath withoutListMarkers() {
    return of(
        segments.stream()
            .filter(segment -> !LIST_MARKER.equals(segment))
            .collect(ImmutableList.toImmutableList()));
  }

  /** Returns true if this path starts with every segment of {@code prefix}. */
  public boolean startsWith(ResponsePath prefix) {
    return prefix.size() <= size() && segments.subList(0, prefix.size()).equals(prefix.segments);
  }

  @Override
  public String toString() {
    return isRoot() ? "<root>" : String.join(".", segments);
  }
}

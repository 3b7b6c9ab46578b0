/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import lombok.Value;

/** Indexed re-entry point of one source for one entity type. */
@Value
public class Reentry {
  String sourceId;

  /** Field the executor calls on the source to re-enter the entity, null when not declared. */
  String field;

  /** Key field to argument name overrides. Empty means every field keeps its own name. */
  ImmutableMap<String, String> arguments;

  /** Returns the argument {@code keyField} is passed as, empty if the overrides omit it. */
  public Optional<String> argumentFor(String keyField) {
    if (arguments.isEmpty()) {
      return Optional.of(keyField);
    }
    return Optional.ofNullable(arguments.get(keyField));
  }
}

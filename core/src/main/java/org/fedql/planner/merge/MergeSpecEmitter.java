/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.merge;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.decompose.FetchFragment;
import org.fedql.planner.exception.KeyForwardingException;
import org.fedql.planner.schema.Reentry;
import org.fedql.planner.schema.SchemaIndex;

/**
 * Emits the {@link MergeSpec} of a fetch. Fetches that re-enter an entity forward every required
 * key, in order, under the argument name the child source's re-entry point declares for it. A
 * source without a declared re-entry point receives same-named arguments unless implicit re-entry
 * is disabled.
 */
@RequiredArgsConstructor
public class MergeSpecEmitter {

  private final SchemaIndex schemaIndex;
  private final PlannerSettings settings;

  public MergeSpec emit(FetchFragment fragment) {
    if (!fragment.isEntityFetch()) {
      return MergeSpec.root(fragment.getProvidedPath());
    }

    Optional<Reentry> reentry =
        schemaIndex.reentryOf(fragment.getTypeName(), fragment.getSourceId());
    if (reentry.isEmpty() && !settings.isImplicitEntityReentry()) {
      throw new KeyForwardingException(
          String.format(
              "Source %s declares no re-entry point for type %s",
              fragment.getSourceId(), fragment.getTypeName()),
          fragment.getTypeName(),
          fragment.getSourceId(),
          fragment.getProvidedPath());
    }

    ImmutableList.Builder<KeyForwarding> forwarding = ImmutableList.builder();
    for (String keyField : fragment.getRequiredKeys()) {
      String argument =
          reentry
              .map(point -> point.argumentFor(keyField))
              .orElse(Optional.of(keyField))
              .orElseThrow(
                  () ->
                      new KeyForwardingException(
                          String.format(
                              "Re-entry point of %s for type %s does not map key field %s to an"
                                  + " argument",
                              fragment.getSourceId(), fragment.getTypeName(), keyField),
                          fragment.getTypeName(),
                          fragment.getSourceId(),
                          fragment.getProvidedPath()));
      forwarding.add(new KeyForwarding(keyField, argument));
    }
    return new MergeSpec(
        fragment.getProvidedPath(),
        forwarding.build(),
        reentry.map(Reentry::getField).orElse(null));
  }
}

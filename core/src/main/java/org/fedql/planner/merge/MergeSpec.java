/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.merge;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import org.fedql.planner.query.ResponsePath;

/** Where a node's result is spliced into the response and which parent values it consumes. */
@Value
public class MergeSpec {

  ResponsePath attachPath;

  /** Parent result fields forwarded as arguments, in entity key order. */
  ImmutableList<KeyForwarding> keyForwarding;

  /** Re-entry field to call on the child source, null for root fetches or when undeclared. */
  String reentryField;

  public static MergeSpec root(ResponsePath attachPath) {
    return new MergeSpec(attachPath, ImmutableList.of(), null);
  }
}

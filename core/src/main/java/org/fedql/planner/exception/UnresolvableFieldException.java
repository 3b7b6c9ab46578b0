/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.exception;

import lombok.Getter;
import org.fedql.planner.query.ResponsePath;

/** A selected field has no owning source. */
@Getter
public class UnresolvableFieldException extends QueryPlanningException {

  private final String fieldName;

  public UnresolvableFieldException(String typeName, String fieldName, ResponsePath path) {
    super(
        String.format(
            "Couldn't find owning source for field %s.%s at path %s", typeName, fieldName, path),
        typeName,
        path);
    this.fieldName = fieldName;
  }
}

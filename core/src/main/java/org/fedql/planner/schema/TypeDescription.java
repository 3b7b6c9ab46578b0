/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.Singular;

/** Declaration of one type: the sources declaring it, its entity key and its fields. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypeDescription {

  @JsonProperty(required = true)
  private String name;

  /** Sources declaring the type. Derived from field owners when left empty. */
  @Singular
  private List<String> sources;

  /** Entity key fields, in forwarding order. Empty for value types. */
  @Singular
  private List<String> keys;

  /** Source that originally defines the entity. Defaults to the first declaring source. */
  private String baseSource;

  @Singular
  private List<FieldDescription> fields;

  /** Re-entry points by source id. */
  @Singular
  private Map<String, ReentryDescription> reentryPoints;
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.Singular;

/** Declared ownership of one field. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDescription {

  @JsonProperty(required = true)
  private String name;

  /** Sources able to resolve the field, most preferred first. */
  @Singular
  private List<String> owners;

  /** Fields of the same type the owning source needs handed over to resolve this field. */
  @Singular("require")
  private List<String> requires;

  /**
   * Fields of the returned type that the owners of this field resolve along with it, so no other
   * source has to be asked for them below this field.
   */
  @Singular("provide")
  private List<String> provides;

  public static FieldDescription of(String name, String... owners) {
    return FieldDescription.builder().name(name).owners(List.of(owners)).build();
  }
}

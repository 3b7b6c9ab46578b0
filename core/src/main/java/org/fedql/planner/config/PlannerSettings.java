/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.config;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Planner policy knobs. Read once at bootstrap, never changed while planning. */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlannerSettings {

  private static final Logger LOG = LogManager.getLogger();

  @Builder.Default
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_CASE_INSENSITIVE_VALUES)
  private OwnerSelectionPolicy ownerSelectionPolicy = OwnerSelectionPolicy.DECLARATION_ORDER;

  /**
   * Reject, while indexing, types whose fields are split across sources without an entity key.
   * When off the problem surfaces only for queries that cross such a type.
   */
  @Builder.Default
  private boolean requireEntityKeys = true;

  /** Pass key fields as same-named arguments to sources that declare no re-entry point. */
  @Builder.Default
  private boolean implicitEntityReentry = true;

  public static PlannerSettings defaults() {
    return PlannerSettings.builder().build();
  }

  /**
   * Reads settings from JSON. Absent properties keep their defaults.
   *
   * @param inputStream JSON document.
   * @return planner settings.
   */
  public static PlannerSettings fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, PlannerSettings.class);
    } catch (IOException e) {
      LOG.error("Planner settings file is malformed. Verify and reload.");
      throw new IllegalArgumentException("Malformed planner settings json: " + e.getMessage());
    }
  }
}

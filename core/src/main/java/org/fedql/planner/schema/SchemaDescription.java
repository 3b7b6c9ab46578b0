/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.Singular;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fedql.planner.exception.SchemaException;

/**
 * Ownership annotated schema as delivered by a schema registry. Only the logical shape matters to
 * the planner; {@link SchemaIndex} turns it into the structure planning reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaDescription {

  private static final Logger LOG = LogManager.getLogger();

  /** Operation root types. {@code Query}, {@code Mutation} and {@code Subscription} when empty. */
  @Singular
  private List<String> rootTypes;

  @Singular
  private List<TypeDescription> types;

  /**
   * Reads a schema description from its JSON form.
   *
   * @param inputStream JSON document.
   * @return schema description.
   */
  public static SchemaDescription fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, SchemaDescription.class);
    } catch (IOException e) {
      LOG.error("Schema description is malformed and cannot be indexed.");
      throw new SchemaException("Malformed schema description json: " + e.getMessage());
    }
  }
}

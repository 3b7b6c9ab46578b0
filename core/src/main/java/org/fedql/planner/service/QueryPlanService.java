/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.service;

import com.google.common.base.Preconditions;
import java.io.InputStream;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.log4j.Log4j2;
import org.fedql.planner.QueryPlanner;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.plan.Plan;
import org.fedql.planner.query.QueryDocument;
import org.fedql.planner.schema.SchemaDescription;
import org.fedql.planner.schema.SchemaIndex;

/**
 * Plans queries against the schema currently live. It is a per-jvm single instance.
 *
 * <p>The live {@link SchemaIndex} is replaced as a whole when a new schema is loaded. A planning
 * call reads the reference once, so it sees either the old or the new schema, never a mix.
 */
@Log4j2
public class QueryPlanService {

  private final QueryPlanner queryPlanner;

  private final PlannerSettings settings;

  private final AtomicReference<SchemaIndex> schemaIndex = new AtomicReference<>();

  public QueryPlanService(QueryPlanner queryPlanner, PlannerSettings settings) {
    this.queryPlanner = Preconditions.checkNotNull(queryPlanner, "queryPlanner");
    this.settings = Preconditions.checkNotNull(settings, "settings");
  }

  /**
   * Indexes a schema and makes it live. The current schema stays live if indexing fails.
   *
   * @param description schema description.
   * @return the new index.
   */
  public SchemaIndex loadSchema(SchemaDescription description) {
    Preconditions.checkNotNull(description, "schema description");
    SchemaIndex index = SchemaIndex.build(description, settings);
    SchemaIndex previous = schemaIndex.getAndSet(index);
    if (previous == null) {
      log.info("Loaded schema with {} types", index.getTypeNames().size());
    } else {
      log.info(
          "Replaced schema of {} types with schema of {} types",
          previous.getTypeNames().size(),
          index.getTypeNames().size());
    }
    return index;
  }

  /** Reads a schema description in JSON form and makes it live. */
  public SchemaIndex loadSchema(InputStream inputStream) {
    return loadSchema(SchemaDescription.fromInputStream(inputStream));
  }

  public Optional<SchemaIndex> currentSchema() {
    return Optional.ofNullable(schemaIndex.get());
  }

  /**
   * Plans a query against the live schema.
   *
   * @param document validated query.
   * @return plan.
   * @throws IllegalStateException if no schema has been loaded.
   */
  public Plan plan(QueryDocument document) {
    SchemaIndex index = schemaIndex.get();
    if (index == null) {
      throw new IllegalStateException("No schema loaded, cannot plan " + document.getRootType());
    }
    return queryPlanner.plan(document, index);
  }
}

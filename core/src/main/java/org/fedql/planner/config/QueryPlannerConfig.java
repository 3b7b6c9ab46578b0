/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.fedql.planner.FederatedQueryPlanner;
import org.fedql.planner.QueryPlanner;
import org.fedql.planner.service.QueryPlanService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryPlannerConfig {

  private static final Logger LOG = LogManager.getLogger();

  /** Classpath resource holding {@link PlannerSettings} in JSON form. */
  public static final String SETTINGS_RESOURCE = "fedql-planner.json";

  /**
   * PlannerSettings Bean. Read from {@link #SETTINGS_RESOURCE} when it is on the classpath.
   *
   * @return PlannerSettings.
   */
  @Bean
  public PlannerSettings plannerSettings() {
    try (InputStream inputStream =
        QueryPlannerConfig.class.getClassLoader().getResourceAsStream(SETTINGS_RESOURCE)) {
      if (inputStream == null) {
        LOG.info("No {} on the classpath, using default planner settings", SETTINGS_RESOURCE);
        return PlannerSettings.defaults();
      }
      PlannerSettings settings = PlannerSettings.fromInputStream(inputStream);
      LOG.info("Loaded planner settings {}", settings);
      return settings;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + SETTINGS_RESOURCE, e);
    }
  }

  @Bean
  public QueryPlanner queryPlanner(PlannerSettings plannerSettings) {
    return new FederatedQueryPlanner(plannerSettings);
  }

  @Bean
  public QueryPlanService queryPlanService(
      QueryPlanner queryPlanner, PlannerSettings plannerSettings) {
    return new QueryPlanService(queryPlanner, plannerSettings);
  }
}

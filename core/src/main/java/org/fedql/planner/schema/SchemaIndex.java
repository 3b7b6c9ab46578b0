/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.schema;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.exception.SchemaException;

/**
 * Read-only index of an ownership annotated schema. Maps every (type, field) pair to the sources
 * able to resolve it, in preference order, and every type to the entity key used to re-enter it
 * from another source.
 *
 * <p>An index is never mutated after {@link #build}. A schema reload builds a new index and swaps
 * the reference, see {@code QueryPlanService}.
 */
@Log4j2
public final class SchemaIndex {

  private static final ImmutableSet<String> DEFAULT_ROOT_TYPES =
      ImmutableSet.of("Query", "Mutation", "Subscription");

  private final ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldOwners;
  private final ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldRequires;
  private final ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldProvides;
  private final ImmutableMap<String, ImmutableList<String>> entityKeys;
  private final ImmutableMap<String, String> baseSources;
  private final ImmutableMap<String, ImmutableSet<String>> typeSources;
  private final ImmutableMap<String, ImmutableMap<String, Reentry>> reentryPoints;
  private final ImmutableSet<String> valueTypes;
  private final ImmutableSet<String> rootTypes;

  private SchemaIndex(
      ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldOwners,
      ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldRequires,
      ImmutableMap<FieldCoordinate, ImmutableList<String>> fieldProvides,
      ImmutableMap<String, ImmutableList<String>> entityKeys,
      ImmutableMap<String, String> baseSources,
      ImmutableMap<String, ImmutableSet<String>> typeSources,
      ImmutableMap<String, ImmutableMap<String, Reentry>> reentryPoints,
      ImmutableSet<String> valueTypes,
      ImmutableSet<String> rootTypes) {
    this.fieldOwners = fieldOwners;
    this.fieldRequires = fieldRequires;
    this.fieldProvides = fieldProvides;
    this.entityKeys = entityKeys;
    this.baseSources = baseSources;
    this.typeSources = typeSources;
    this.reentryPoints = reentryPoints;
    this.valueTypes = valueTypes;
    this.rootTypes = rootTypes;
  }

  public static SchemaIndex build(SchemaDescription description) {
    return build(description, PlannerSettings.defaults());
  }

  /**
   * Validates and indexes a schema description.
   *
   * @param description schema description.
   * @param settings planner settings, decides whether missing entity keys fail here.
   * @return schema index.
   * @throws SchemaException if the declarations are inconsistent.
   */
  public static SchemaIndex build(SchemaDescription description, PlannerSettings settings) {
    ImmutableMap.Builder<FieldCoordinate, ImmutableList<String>> owners = ImmutableMap.builder();
    ImmutableMap.Builder<FieldCoordinate, ImmutableList<String>> requires =
        ImmutableMap.builder();
    ImmutableMap.Builder<FieldCoordinate, ImmutableList<String>> provides =
        ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableList<String>> keys = ImmutableMap.builder();
    ImmutableMap.Builder<String, String> baseSources = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableSet<String>> sources = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableMap<String, Reentry>> reentries =
        ImmutableMap.builder();
    ImmutableSet.Builder<String> valueTypes = ImmutableSet.builder();

    Set<String> seenTypes = new LinkedHashSet<>();
    ImmutableSet<String> rootTypes =
        nullToEmpty(description.getRootTypes()).isEmpty()
            ? DEFAULT_ROOT_TYPES
            : ImmutableSet.copyOf(description.getRootTypes());
    for (TypeDescription type : nullToEmpty(description.getTypes())) {
      String typeName = type.getName();
      if (Strings.isNullOrEmpty(typeName)) {
        throw new SchemaException("Type name must not be empty");
      }
      if (!seenTypes.add(typeName)) {
        throw new SchemaException("Type " + typeName + " is declared more than once", typeName);
      }

      Map<String, ImmutableList<String>> fieldOwnerLists = indexFields(type);
      ImmutableSet<String> declaringSources = declaringSources(type, fieldOwnerLists);
      fieldOwnerLists.forEach(
          (field, fieldOwnerList) -> {
            for (String owner : fieldOwnerList) {
              if (!declaringSources.contains(owner)) {
                throw new SchemaException(
                    String.format(
                        "Field %s.%s claims owner %s which does not declare type %s",
                        typeName, field, owner, typeName),
                    typeName);
              }
            }
            owners.put(FieldCoordinate.of(typeName, field), fieldOwnerList);
          });

      ImmutableList<String> entityKey = ImmutableList.copyOf(nullToEmpty(type.getKeys()));
      for (String keyField : entityKey) {
        if (!fieldOwnerLists.containsKey(keyField)) {
          throw new SchemaException(
              String.format("Entity key field %s is not a field of type %s", keyField, typeName),
              typeName);
        }
      }

      Set<String> forwardable = new LinkedHashSet<>(entityKey);
      for (FieldDescription field : nullToEmpty(type.getFields())) {
        ImmutableList<String> fieldRequirements =
            ImmutableList.copyOf(nullToEmpty(field.getRequires()));
        for (String required : fieldRequirements) {
          if (!fieldOwnerLists.containsKey(required)) {
            throw new SchemaException(
                String.format(
                    "Field %s.%s requires %s which is not a field of the type",
                    typeName, field.getName(), required),
                typeName);
          }
        }
        if (!fieldRequirements.isEmpty()) {
          requires.put(FieldCoordinate.of(typeName, field.getName()), fieldRequirements);
          forwardable.addAll(fieldRequirements);
        }
        ImmutableList<String> provided = ImmutableList.copyOf(nullToEmpty(field.getProvides()));
        if (provided.stream().anyMatch(Strings::isNullOrEmpty)) {
          throw new SchemaException(
              String.format("Field %s.%s provides a field without name", typeName, field.getName()),
              typeName);
        }
        if (!provided.isEmpty()) {
          provides.put(FieldCoordinate.of(typeName, field.getName()), provided);
        }
      }

      boolean valueType =
          entityKey.isEmpty()
              && declaringSources.size() > 1
              && fieldOwnerLists.values().stream()
                  .allMatch(fieldOwnerList -> fieldOwnerList.containsAll(declaringSources));
      if (valueType) {
        valueTypes.add(typeName);
      } else if (settings.isRequireEntityKeys()
          && !rootTypes.contains(typeName)
          && entityKey.isEmpty()
          && declaringSources.size() > 1) {
        throw new SchemaException(
            String.format(
                "Type %s is split across sources %s but declares no entity key",
                typeName, declaringSources),
            typeName);
      }

      String baseSource = type.getBaseSource();
      if (baseSource != null && !declaringSources.contains(baseSource)) {
        throw new SchemaException(
            String.format(
                "Base source %s of type %s does not declare the type", baseSource, typeName),
            typeName);
      }
      if (baseSource == null && !declaringSources.isEmpty()) {
        baseSource = declaringSources.iterator().next();
      }
      if (baseSource != null) {
        baseSources.put(typeName, baseSource);
      }

      sources.put(typeName, declaringSources);
      keys.put(typeName, entityKey);
      reentries.put(typeName, indexReentryPoints(type, declaringSources, forwardable));
    }

    SchemaIndex index =
        new SchemaIndex(
            owners.build(),
            requires.build(),
            provides.build(),
            keys.build(),
            baseSources.build(),
            sources.build(),
            reentries.build(),
            valueTypes.build(),
            rootTypes);
    log.info(
        "Indexed schema with {} types and {} fields", seenTypes.size(), index.fieldOwners.size());
    return index;
  }

  /** Returns the sources able to resolve the field, most preferred first. */
  public List<String> ownersOf(String typeName, String fieldName) {
    return fieldOwners.getOrDefault(FieldCoordinate.of(typeName, fieldName), ImmutableList.of());
  }

  /** Returns the entity key of the type in forwarding order, empty if it has none. */
  public List<String> entityKeyOf(String typeName) {
    return entityKeys.getOrDefault(typeName, ImmutableList.of());
  }

  /** Returns the fields the owner of {@code fieldName} needs to be handed over. */
  public List<String> requiresOf(String typeName, String fieldName) {
    return fieldRequires.getOrDefault(FieldCoordinate.of(typeName, fieldName), ImmutableList.of());
  }

  /** Returns the fields of the returned type the owners of {@code fieldName} resolve with it. */
  public List<String> providesOf(String typeName, String fieldName) {
    return fieldProvides.getOrDefault(FieldCoordinate.of(typeName, fieldName), ImmutableList.of());
  }

  /** Returns the source that originally defines the type, used to reach its other sources. */
  public Optional<String> baseSourceOf(String typeName) {
    return Optional.ofNullable(baseSources.get(typeName));
  }

  public Set<String> sourcesOf(String typeName) {
    return typeSources.getOrDefault(typeName, ImmutableSet.of());
  }

  /** Returns the declared re-entry point of {@code sourceId} for the type. */
  public Optional<Reentry> reentryOf(String typeName, String sourceId) {
    return Optional.ofNullable(
        reentryPoints.getOrDefault(typeName, ImmutableMap.of()).get(sourceId));
  }

  /** True for keyless types every declaring source can fully resolve. */
  public boolean isValueType(String typeName) {
    return valueTypes.contains(typeName);
  }

  /** True for operation root types, which are split by field and never re-entered. */
  public boolean isRootType(String typeName) {
    return rootTypes.contains(typeName);
  }

  public boolean hasType(String typeName) {
    return typeSources.containsKey(typeName);
  }

  public Set<String> getTypeNames() {
    return typeSources.keySet();
  }

  private static Map<String, ImmutableList<String>> indexFields(TypeDescription type) {
    Map<String, ImmutableList<String>> fieldOwnerLists = new LinkedHashMap<>();
    for (FieldDescription field : nullToEmpty(type.getFields())) {
      if (Strings.isNullOrEmpty(field.getName())) {
        throw new SchemaException(
            "Type " + type.getName() + " declares a field without name", type.getName());
      }
      ImmutableList<String> fieldOwnerList =
          ImmutableSet.copyOf(nullToEmpty(field.getOwners())).asList();
      if (fieldOwnerLists.put(field.getName(), fieldOwnerList) != null) {
        throw new SchemaException(
            String.format(
                "Field %s.%s is declared more than once", type.getName(), field.getName()),
            type.getName());
      }
    }
    return fieldOwnerLists;
  }

  private static ImmutableSet<String> declaringSources(
      TypeDescription type, Map<String, ImmutableList<String>> fieldOwnerLists) {
    List<String> declared = nullToEmpty(type.getSources());
    if (!declared.isEmpty()) {
      return ImmutableSet.copyOf(declared);
    }
    ImmutableSet.Builder<String> derived = ImmutableSet.builder();
    fieldOwnerLists.values().forEach(derived::addAll);
    return derived.build();
  }

  private static ImmutableMap<String, Reentry> indexReentryPoints(
      TypeDescription type, Set<String> declaringSources, Set<String> forwardable) {
    ImmutableMap.Builder<String, Reentry> builder = ImmutableMap.builder();
    Map<String, ReentryDescription> declared =
        type.getReentryPoints() == null ? Map.of() : type.getReentryPoints();
    declared.forEach(
        (sourceId, reentry) -> {
          if (reentry == null) {
            throw new SchemaException(
                String.format(
                    "Re-entry point of %s for type %s is empty", sourceId, type.getName()),
                type.getName());
          }
          if (!declaringSources.contains(sourceId)) {
            throw new SchemaException(
                String.format(
                    "Re-entry point of %s for type %s: source does not declare the type",
                    sourceId, type.getName()),
                type.getName());
          }
          Map<String, String> arguments =
              reentry.getArguments() == null ? Map.of() : reentry.getArguments();
          for (String field : arguments.keySet()) {
            if (!forwardable.contains(field)) {
              throw new SchemaException(
                  String.format(
                      "Re-entry point of %s for type %s maps %s which is never forwarded",
                      sourceId, type.getName(), field),
                  type.getName());
            }
          }
          builder.put(
              sourceId, new Reentry(sourceId, reentry.getField(), ImmutableMap.copyOf(arguments)));
        });
    return builder.build();
  }

  private static <T> List<T> nullToEmpty(List<T> list) {
    return list == null ? List.of() : list;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.fedql.planner.decompose;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.fedql.planner.config.OwnerSelectionPolicy;
import org.fedql.planner.config.PlannerSettings;
import org.fedql.planner.exception.UngroupableSelectionException;
import org.fedql.planner.exception.UnresolvableFieldException;
import org.fedql.planner.exception.UnsupportedOperationTypeException;
import org.fedql.planner.query.OperationType;
import org.fedql.planner.query.QueryDocument;
import org.fedql.planner.query.ResponsePath;
import org.fedql.planner.query.SelectionNode;
import org.fedql.planner.query.VariableReference;
import org.fedql.planner.schema.SchemaIndex;

/**
 * Splits a validated query into per-source {@link FetchFragment}s.
 *
 * <p>The decomposer descends the selection tree once, carrying the fragment that owns the
 * enclosing field as context. At every selection set it picks a source per field; fields handed
 * to another source go to a dependent fragment, and the owning fragment is made to select the
 * entity key of the type so the dependent fetch can re-enter it:
 *
 * <pre>
 * query { me { id reviews { body } } }        accounts owns Query.me, User.id
 *                                             reviews owns User.reviews, keyed by User.id
 * fragment 0 (accounts, at root):     me { id }
 * fragment 1 (reviews,  at me):       reviews { body }     requires [id], depends on 0
 * </pre>
 *
 * <p>Fragments created in different selection sets are never merged even when they target the
 * same source. Instances are stateless; every call works on its own drafts.
 */
@Log4j2
@RequiredArgsConstructor
public class QueryDecomposer {

  private final SchemaIndex schemaIndex;
  private final PlannerSettings settings;

  /**
   * Decomposes a query document.
   *
   * @param document validated query.
   * @return fragments and their dependencies, in topological order.
   */
  public Decomposition decompose(QueryDocument document) {
    if (document.getOperationType() == OperationType.SUBSCRIPTION) {
      throw new UnsupportedOperationTypeException(
          document.getOperationType(), document.getRootType());
    }
    Decomposition decomposition = new Run(document).decompose();
    log.debug(
        "Decomposed {} on {} into {} fragments",
        document.getOperationType(),
        document.getRootType(),
        decomposition.size());
    return decomposition;
  }

  /** Working state of one decomposition. */
  private class Run {
    private final QueryDocument document;
    private final List<FragmentDraft> drafts = new ArrayList<>();

    Run(QueryDocument document) {
      this.document = document;
    }

    Decomposition decompose() {
      List<SelectionNode> rootFields = new ArrayList<>();
      for (SelectionNode field : document.getSelections()) {
        // __typename of a root type is answered without a fetch
        if (!field.isTypename()) {
          rootFields.add(field);
        }
      }
      List<String> sources = assignSources(rootFields, null, Set.of());

      if (document.getOperationType() == OperationType.MUTATION) {
        splitRootFieldsSerially(rootFields, sources);
      } else {
        splitRootFields(rootFields, sources);
      }

      ImmutableList.Builder<FetchFragment> fragments = ImmutableList.builder();
      ImmutableList.Builder<ImmutableSortedSet<Integer>> dependencies = ImmutableList.builder();
      for (FragmentDraft draft : drafts) {
        fragments.add(draft.toFragment());
        dependencies.add(ImmutableSortedSet.copyOf(draft.dependsOn));
      }
      return new Decomposition(
          document.getOperationType(), fragments.build(), dependencies.build());
    }

    /** One root fragment per source; root fetches are independent of each other. */
    private void splitRootFields(List<SelectionNode> rootFields, List<String> sources) {
      Map<String, FragmentDraft> bySource = new LinkedHashMap<>();
      for (int i = 0; i < rootFields.size(); i++) {
        FragmentDraft draft =
            bySource.computeIfAbsent(
                sources.get(i),
                source -> newDraft(source, document.getRootType(), ResponsePath.ROOT));
        addField(draft, draft.selection, rootFields.get(i), ResponsePath.ROOT);
      }
    }

    /**
     * Mutation root fields keep their declared order. Consecutive fields of one source share a
     * fetch, and every fetch waits for the previous one and for all fetches that resolve its
     * result:
     *
     * <pre>
     * mutation { createReview updateReview login deleteReview }
     * reviews(createReview, updateReview) -&gt; accounts(login) -&gt; reviews(deleteReview)
     * </pre>
     */
    private void splitRootFieldsSerially(List<SelectionNode> rootFields, List<String> sources) {
      FragmentDraft current = null;
      for (int i = 0; i < rootFields.size(); i++) {
        String source = sources.get(i);
        if (current == null || !current.sourceId.equals(source)) {
          int previousRunStart = current == null ? drafts.size() : current.index;
          int previousRunEnd = drafts.size();
          current = newDraft(source, document.getRootType(), ResponsePath.ROOT);
          for (int index = previousRunStart; index < previousRunEnd; index++) {
            current.dependsOn.add(index);
          }
        }
        addField(current, current.selection, rootFields.get(i), ResponsePath.ROOT);
      }
    }

    /**
     * Adds a field to a fragment and splits its selection set. {@code enclosingAttachPath} is the
     * attach path of the enclosing selection set, with a list marker after every list ancestor.
     */
    private void addField(
        FragmentDraft owner,
        SelectionDraft into,
        SelectionNode field,
        ResponsePath enclosingAttachPath) {
      FieldDraft fieldDraft = into.addQueryField(field);
      if (field.isComposite()) {
        ResponsePath attachPath = enclosingAttachPath.append(field.getResponseKey());
        splitSelectionSet(
            owner,
            fieldDraft.children,
            field,
            field.isList() ? attachPath.appendListMarker() : attachPath,
            providedBy(owner, field));
      }
    }

    /** Fields of the nested type the owner's source resolves because it resolved {@code field}. */
    private Set<String> providedBy(FragmentDraft owner, SelectionNode field) {
      if (!schemaIndex.ownersOf(field.getOnType(), field.getFieldName()).contains(owner.sourceId)) {
        return Set.of();
      }
      return ImmutableSet.copyOf(schemaIndex.providesOf(field.getOnType(), field.getFieldName()));
    }

    /**
     * Distributes the children of {@code enclosing} between its owner and dependent fetches. A
     * field whose owner needs values the parent cannot select is reached through the base source
     * of the type: parent, then base source, then owner.
     */
    private void splitSelectionSet(
        FragmentDraft parent,
        SelectionDraft into,
        SelectionNode enclosing,
        ResponsePath attachPath,
        Set<String> provided) {
      List<SelectionNode> children = enclosing.getChildren();
      List<String> sources = assignSources(children, parent.sourceId, provided);
      Map<DependentKey, FragmentDraft> dependents = new LinkedHashMap<>();

      for (int i = 0; i < children.size(); i++) {
        SelectionNode child = children.get(i);
        String source = sources.get(i);
        if (source.equals(parent.sourceId)) {
          addField(parent, into, child, attachPath);
          continue;
        }
        String typeName = child.getOnType();
        List<String> requires = schemaIndex.requiresOf(typeName, child.getFieldName());
        boolean direct = canResolveAll(parent, typeName, requires, provided);
        DependentKey key = new DependentKey(source, typeName, !direct);
        FragmentDraft dependent = dependents.get(key);
        if (dependent == null) {
          if (direct) {
            dependent =
                newDependent(parent, into, enclosing, attachPath, source, typeName, provided);
          } else {
            FragmentDraft base =
                baseFragment(parent, into, enclosing, attachPath, key, dependents, provided);
            dependent =
                newDependent(
                    base, base.selection, enclosing, attachPath, source, typeName, Set.of());
          }
          dependents.put(key, dependent);
        }
        FragmentDraft requiresFrom = direct ? parent : drafts.get(dependent.dependsOn.first());
        SelectionDraft requiresInto = direct ? into : requiresFrom.selection;
        for (String required : requires) {
          inject(
              requiresFrom,
              requiresInto,
              enclosing,
              typeName,
              required,
              direct ? provided : Set.of());
          dependent.requiredKeys.add(required);
        }
        addField(dependent, dependent.selection, child, attachPath);
      }
    }

    /** The fetch from the base source of the type that a hopped dependent re-enters through. */
    private FragmentDraft baseFragment(
        FragmentDraft parent,
        SelectionDraft into,
        SelectionNode enclosing,
        ResponsePath attachPath,
        DependentKey hopped,
        Map<DependentKey, FragmentDraft> dependents,
        Set<String> provided) {
      String baseSource = schemaIndex.baseSourceOf(hopped.typeName).orElse(null);
      if (baseSource == null
          || baseSource.equals(parent.sourceId)
          || baseSource.equals(hopped.sourceId)) {
        throw new UngroupableSelectionException(
            String.format(
                "Source %s cannot provide the fields %s needs on %s at %s",
                parent.sourceId,
                hopped.sourceId,
                hopped.typeName,
                enclosing.getResponsePath()),
            hopped.typeName,
            enclosing.getResponsePath());
      }
      DependentKey key = new DependentKey(baseSource, hopped.typeName, false);
      FragmentDraft base = dependents.get(key);
      if (base == null) {
        base =
            newDependent(
                parent, into, enclosing, attachPath, baseSource, hopped.typeName, provided);
        dependents.put(key, base);
      }
      return base;
    }

    private FragmentDraft newDependent(
        FragmentDraft from,
        SelectionDraft fromSelection,
        SelectionNode enclosing,
        ResponsePath attachPath,
        String sourceId,
        String typeName,
        Set<String> provided) {
      List<String> entityKey = schemaIndex.entityKeyOf(typeName);
      if (entityKey.isEmpty()) {
        throw new UngroupableSelectionException(
            String.format(
                "Selection on type %s at %s spans sources %s and %s but the type declares no"
                    + " entity key",
                typeName,
                enclosing.getResponsePath(),
                from.sourceId,
                sourceId),
            typeName,
            enclosing.getResponsePath());
      }
      FragmentDraft dependent = newDraft(sourceId, typeName, attachPath);
      dependent.dependsOn.add(from.index);
      for (String keyField : entityKey) {
        inject(from, fromSelection, enclosing, typeName, keyField, provided);
        dependent.requiredKeys.add(keyField);
      }
      return dependent;
    }

    /** Makes the {@code from} fetch select {@code fieldName} so it can be forwarded. */
    private void inject(
        FragmentDraft from,
        SelectionDraft into,
        SelectionNode enclosing,
        String typeName,
        String fieldName,
        Set<String> provided) {
      if (!canResolve(from, typeName, fieldName, provided)) {
        throw new UngroupableSelectionException(
            String.format(
                "Source %s cannot provide %s.%s needed to leave it at %s",
                from.sourceId, typeName, fieldName, enclosing.getResponsePath()),
            typeName,
            enclosing.getResponsePath());
      }
      into.addInjectedField(
          SelectionNode.builder()
              .fieldName(fieldName)
              .responsePath(enclosing.getResponsePath().append(fieldName))
              .onType(typeName)
              .build());
    }

    private boolean canResolve(
        FragmentDraft fragment, String typeName, String fieldName, Set<String> provided) {
      return provided.contains(fieldName)
          || schemaIndex.ownersOf(typeName, fieldName).contains(fragment.sourceId);
    }

    /** True when the fragment can select the entity key and every required field. */
    private boolean canResolveAll(
        FragmentDraft fragment, String typeName, List<String> requires, Set<String> provided) {
      for (String field : Iterables.concat(schemaIndex.entityKeyOf(typeName), requires)) {
        if (!canResolve(fragment, typeName, field, provided)) {
          return false;
        }
      }
      return true;
    }

    /**
     * Picks a source for every field of a selection set. {@code parentSource} is null at the
     * root.
     */
    private List<String> assignSources(
        List<SelectionNode> fields, String parentSource, Set<String> provided) {
      String[] assigned = new String[fields.size()];
      List<Integer> remaining = new ArrayList<>();
      List<List<String>> owners = new ArrayList<>();

      for (int i = 0; i < fields.size(); i++) {
        SelectionNode field = fields.get(i);
        if (field.isTypename() && parentSource != null) {
          assigned[i] = parentSource;
          owners.add(List.of(parentSource));
          continue;
        }
        if (parentSource != null
            && (schemaIndex.isValueType(field.getOnType())
                || provided.contains(field.getFieldName()))) {
          assigned[i] = parentSource;
          owners.add(List.of(parentSource));
          continue;
        }
        List<String> fieldOwners = schemaIndex.ownersOf(field.getOnType(), field.getFieldName());
        if (fieldOwners.isEmpty()) {
          throw new UnresolvableFieldException(
              field.getOnType(), field.getFieldName(), field.getResponsePath());
        }
        owners.add(fieldOwners);
        if (parentSource != null && staysInParent(field, fieldOwners, parentSource)) {
          assigned[i] = parentSource;
        } else {
          remaining.add(i);
        }
      }

      if (settings.getOwnerSelectionPolicy() == OwnerSelectionPolicy.PREFER_PARENT_SOURCE
          && !remaining.isEmpty()) {
        List<String> common = commonOwners(remaining, owners);
        if (!common.isEmpty()) {
          remaining.forEach(i -> assigned[i] = common.get(0));
          return List.of(assigned);
        }
      }
      remaining.forEach(i -> assigned[i] = owners.get(i).get(0));
      return List.of(assigned);
    }

    private boolean staysInParent(
        SelectionNode field, List<String> fieldOwners, String parentSource) {
      if (!fieldOwners.contains(parentSource)) {
        return false;
      }
      if (settings.getOwnerSelectionPolicy() == OwnerSelectionPolicy.PREFER_PARENT_SOURCE) {
        return true;
      }
      // key fields are fetched by the parent anyway when the set is split
      return fieldOwners.get(0).equals(parentSource)
          || schemaIndex.entityKeyOf(field.getOnType()).contains(field.getFieldName());
    }

    /** Owners shared by all remaining fields, ordered like the first remaining field's owners. */
    private List<String> commonOwners(List<Integer> remaining, List<List<String>> owners) {
      List<String> common = new ArrayList<>(owners.get(remaining.get(0)));
      for (int i : remaining) {
        common.retainAll(owners.get(i));
      }
      return common;
    }

    private FragmentDraft newDraft(String sourceId, String typeName, ResponsePath providedPath) {
      FragmentDraft draft = new FragmentDraft(drafts.size(), sourceId, typeName, providedPath);
      drafts.add(draft);
      return draft;
    }
  }

  @Value
  private static class DependentKey {
    String sourceId;
    String typeName;
    boolean throughBaseSource;
  }

  /** A fragment under construction. */
  private static final class FragmentDraft {
    private final int index;
    private final String sourceId;
    private final String typeName;
    private final ResponsePath providedPath;
    private final SelectionDraft selection = new SelectionDraft();
    private final LinkedHashSet<String> requiredKeys = new LinkedHashSet<>();
    private final TreeSet<Integer> dependsOn = new TreeSet<>();

    private FragmentDraft(int index, String sourceId, String typeName, ResponsePath providedPath) {
      this.index = index;
      this.sourceId = sourceId;
      this.typeName = typeName;
      this.providedPath = providedPath;
    }

    FetchFragment toFragment() {
      ImmutableList<SelectionNode> nodes = selection.build();
      SortedSet<String> variables = new TreeSet<>();
      collectVariables(nodes, variables);
      return new FetchFragment(
          sourceId,
          typeName,
          nodes,
          ImmutableList.copyOf(requiredKeys),
          providedPath,
          ImmutableList.copyOf(variables));
    }
  }

  /** A selection set under construction, keyed by response key. */
  private static final class SelectionDraft {
    private final Map<String, FieldDraft> fields = new LinkedHashMap<>();

    FieldDraft addQueryField(SelectionNode node) {
      FieldDraft existing = fields.get(node.getResponseKey());
      if (existing == null) {
        FieldDraft created = new FieldDraft(node);
        fields.put(node.getResponseKey(), created);
        return created;
      }
      // the query's own field replaces a key injected before it was reached
      checkSameField(existing.node, node);
      existing.node = node;
      return existing;
    }

    void addInjectedField(SelectionNode node) {
      FieldDraft existing = fields.get(node.getResponseKey());
      if (existing == null) {
        fields.put(node.getResponseKey(), new FieldDraft(node));
      } else {
        checkSameField(existing.node, node);
      }
    }

    private static void checkSameField(SelectionNode existing, SelectionNode added) {
      if (!existing.getFieldName().equals(added.getFieldName())) {
        throw new UngroupableSelectionException(
            String.format(
                "Response key %s is used by both %s and %s",
                added.getResponseKey(), existing.getFieldName(), added.getFieldName()),
            added.getOnType(),
            added.getResponsePath());
      }
    }

    ImmutableList<SelectionNode> build() {
      ImmutableList.Builder<SelectionNode> nodes = ImmutableList.builder();
      for (FieldDraft field : fields.values()) {
        nodes.add(
            field.node.isComposite()
                ? field.node.withChildren(field.children.build())
                : field.node);
      }
      return nodes.build();
    }
  }

  private static final class FieldDraft {
    private SelectionNode node;
    private final SelectionDraft children = new SelectionDraft();

    private FieldDraft(SelectionNode node) {
      this.node = node;
    }
  }

  private static void collectVariables(List<SelectionNode> nodes, SortedSet<String> variables) {
    for (SelectionNode node : nodes) {
      node.getArguments().values().forEach(value -> collectVariableUsages(value, variables));
      collectVariables(node.getChildren(), variables);
    }
  }

  private static void collectVariableUsages(Object value, SortedSet<String> variables) {
    if (value instanceof VariableReference) {
      variables.add(((VariableReference) value).getName());
    } else if (value instanceof Collection) {
      ((Collection<?>) value).forEach(element -> collectVariableUsages(element, variables));
    } else if (value instanceof Map) {
      ((Map<?, ?>) value).values().forEach(element -> collectVariableUsages(element, variables));
    }
  }
}

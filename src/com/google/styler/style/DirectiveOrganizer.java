/*
 * Copyright 2025 The Styler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.styler.style;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.styler.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Organizes the statements of one scope body. Works on detached copies and returns the new
 * statements; the caller writes them back, so a failure at any stage leaves the tree untouched.
 */
final class DirectiveOrganizer {

  private static final Logger logger = Logger.getLogger(DirectiveOrganizer.class.getName());

  /** The new statements of a body and how many of them lead it as directives. */
  @AutoValue
  abstract static class Result {
    static Result create(List<Node> statements, int directiveCount) {
      return new AutoValue_DirectiveOrganizer_Result(
          ImmutableList.copyOf(statements), directiveCount);
    }

    abstract ImmutableList<Node> getStatements();

    abstract int getDirectiveCount();
  }

  private final StyleOptions options;
  private final int scopeLineno;
  private final DirectiveSorter sorter;
  private final DirectiveClassifier classifier;
  private final AliasLifter lifter;

  DirectiveOrganizer(StyleOptions options, int scopeLineno) {
    this.options = options;
    this.scopeLineno = scopeLineno;
    this.sorter = new DirectiveSorter(options.getSortOrder());
    this.classifier = new DirectiveClassifier(options, sorter);
    this.lifter = new AliasLifter(options);
  }

  /**
   * Moves every directive to the top of the body, grouped by category in layout order and sorted
   * within each group, lifting frequently used names into new aliases on the way.
   */
  Result organize(List<Node> statements) {
    ImmutableList<Node> collected = stage(DirectiveStage.COLLECT, () -> cloneAll(statements));
    ImmutableList<Node> expanded =
        stage(DirectiveStage.EXPAND, () -> classifier.expandAll(collected));
    DirectiveBuckets classified =
        stage(DirectiveStage.CLASSIFY, () -> classifier.classify(expanded));
    DirectiveBuckets sorted = stage(DirectiveStage.SORT, () -> sort(classified));
    DirectiveBuckets lifted = stage(DirectiveStage.LIFT, () -> lift(sorted));
    ImmutableList<Node> directives = stage(DirectiveStage.RECONCILE, () -> reconcile(lifted));
    return stage(
        DirectiveStage.REASSEMBLE,
        () ->
            Result.create(
                ImmutableList.<Node>builder()
                    .addAll(directives)
                    .addAll(lifted.getOther())
                    .build(),
                directives.size()));
  }

  /**
   * Organizes the body without moving anything: grouped directives are expanded where they stand
   * and lifted aliases are inserted after the last alias, or after the last leading directive.
   */
  ImmutableList<Node> organizePreservingOrder(List<Node> statements) {
    ImmutableList<Node> collected = stage(DirectiveStage.COLLECT, () -> cloneAll(statements));
    ImmutableList<Node> expanded =
        stage(DirectiveStage.EXPAND, () -> expandInPlace(collected));
    Result lifted = stage(DirectiveStage.LIFT, () -> liftInPlace(expanded));
    return stage(
        DirectiveStage.RECONCILE,
        () -> {
          ImmutableList<Node> result = lifted.getStatements();
          int end = lifted.getDirectiveCount();
          LineNumberReconciler.reconcile(
              result.subList(0, end), end < result.size() ? result.get(end) : null);
          return result;
        });
  }

  private <T> T stage(DirectiveStage stage, Supplier<T> step) {
    try {
      return step.get();
    } catch (DirectiveStageException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DirectiveStageException(stage, scopeLineno, e);
    }
  }

  private static ImmutableList<Node> cloneAll(List<Node> statements) {
    ImmutableList.Builder<Node> clones = ImmutableList.builder();
    for (Node statement : statements) {
      clones.add(statement.cloneTree());
    }
    return clones.build();
  }

  private DirectiveBuckets sort(DirectiveBuckets buckets) {
    DirectiveBuckets result = buckets;
    for (DirectiveCategory category : DirectiveCategory.values()) {
      ImmutableList<Node> nodes = buckets.get(category);
      if (category.isSorted()) {
        nodes = sorter.sort(nodes);
      }
      NodeUtil.resetNewlines(nodes);
      result = result.with(category, nodes);
    }
    return result;
  }

  private DirectiveBuckets lift(DirectiveBuckets buckets) {
    if (!options.getLiftAlias()) {
      return buckets;
    }
    // The aliases were reordered, so the bindings are rebuilt from the sorted ones.
    AliasEnv env = AliasEnv.of(buckets.get(DirectiveCategory.ALIAS));
    List<DirectiveCategory> afterAlias = categoriesAfterAlias();
    List<Node> walked = new ArrayList<>();
    for (DirectiveCategory category : afterAlias) {
      walked.addAll(buckets.get(category));
    }
    walked.addAll(buckets.getOther());
    ImmutableSet<ImmutableList<String>> liftable = lifter.findLiftable(walked, env);
    if (liftable.isEmpty()) {
      return buckets;
    }
    logLifted(liftable);

    List<Node> aliases = new ArrayList<>(buckets.get(DirectiveCategory.ALIAS));
    for (ImmutableList<String> path : liftable) {
      aliases.add(AliasLifter.newAlias(path, env));
    }
    ImmutableList<Node> sortedAliases = sorter.sort(aliases);
    NodeUtil.resetNewlines(sortedAliases);
    DirectiveBuckets result = buckets.with(DirectiveCategory.ALIAS, sortedAliases);

    for (DirectiveCategory category : afterAlias) {
      switch (category) {
        case BEHAVIOUR:
          break;
        case USE:
          result = result.with(category, lifter.lift(buckets.get(category), liftable));
          break;
        default:
          ImmutableList<Node> nodes = sorter.sort(lifter.lift(buckets.get(category), liftable));
          NodeUtil.resetNewlines(nodes);
          result = result.with(category, nodes);
          break;
      }
    }
    return result.withOther(lifter.lift(buckets.getOther(), liftable));
  }

  private List<DirectiveCategory> categoriesAfterAlias() {
    List<DirectiveCategory> order = options.getLayoutOrder();
    return order.subList(order.indexOf(DirectiveCategory.ALIAS) + 1, order.size());
  }

  private ImmutableList<Node> reconcile(DirectiveBuckets buckets) {
    ImmutableList<Node> directives = buckets.directivesInOrder(options.getLayoutOrder());
    List<Node> other = buckets.getOther();
    LineNumberReconciler.reconcile(directives, other.isEmpty() ? null : other.get(0));
    return directives;
  }

  private ImmutableList<Node> expandInPlace(List<Node> statements) {
    if (!options.getRewriteMultiAlias()) {
      return ImmutableList.copyOf(statements);
    }
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node statement : statements) {
      if (statement.isDirective()) {
        result.addAll(DirectiveClassifier.expand(statement));
      } else {
        result.add(statement);
      }
    }
    return result.build();
  }

  /**
   * Lifts aliases without reordering. New aliases go after the last alias, else after the last
   * directive or attribute, else at the top of the body; only the statements that follow them are
   * counted and shortened. The returned count is the index just past the inserted aliases, or 0
   * when nothing was inserted.
   */
  private Result liftInPlace(List<Node> statements) {
    if (!options.getLiftAlias()) {
      return Result.create(statements, 0);
    }
    int index = -1;
    int lineHint = 0;
    boolean afterAlias = false;
    for (int i = statements.size() - 1; i >= 0; i--) {
      Node n = statements.get(i);
      if (n.isAlias()) {
        index = i + 1;
        lineHint = n.getLineno();
        afterAlias = true;
        break;
      }
      if (index == -1 && (n.isDirective() || n.isAttribute())) {
        index = i + 1;
        lineHint = n.getLineno();
      }
    }
    boolean hasHint = index != -1;
    if (!hasHint) {
      index = 0;
    }

    List<Node> existing = new ArrayList<>();
    for (Node statement : statements) {
      if (statement.isAlias()) {
        existing.add(statement);
      }
    }
    List<Node> following = statements.subList(index, statements.size());
    AliasEnv env = AliasEnv.of(existing);
    ImmutableSet<ImmutableList<String>> liftable = lifter.findLiftable(following, env);
    if (liftable.isEmpty()) {
      return Result.create(statements, 0);
    }
    logLifted(liftable);

    List<Node> transformed = new ArrayList<>(statements.subList(0, index));
    transformed.addAll(lifter.lift(following, liftable));

    List<Node> newAliases = new ArrayList<>();
    for (ImmutableList<String> path : liftable) {
      // An alias that already binds the path stays the only one.
      if (!path.equals(env.getPath(Iterables.getLast(path)))) {
        newAliases.add(AliasLifter.newAlias(path, env));
      }
    }
    if (newAliases.isEmpty()) {
      return Result.create(transformed, 0);
    }
    if (hasHint) {
      for (Node alias : newAliases) {
        NodeUtil.setLines(alias, lineHint);
      }
      NodeUtil.setNewlines(Iterables.getLast(newAliases), 2);
    }
    if (afterAlias) {
      NodeUtil.setNewlines(transformed.get(index - 1), 0);
    }
    transformed.addAll(index, newAliases);
    return Result.create(transformed, index + newAliases.size());
  }

  private static void logLifted(ImmutableSet<ImmutableList<String>> liftable) {
    if (logger.isLoggable(Level.FINE)) {
      List<String> names = new ArrayList<>();
      for (ImmutableList<String> path : liftable) {
        names.add(NodeUtil.join(path));
      }
      logger.fine("Lifting aliases: " + names);
    }
  }
}

package com.github.scxmljani;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.github.scxmljani.CompilerException.Code;

/**
 * Computes the effect of one microstep: the states left and entered, the resulting configuration
 * and the executable content run, in this order: onexit innermost to outermost, onentry
 * outermost to innermost (each default entry followed by its initial transition content, each
 * entered final state followed by its done events), then the content of the transitions taken.
 *
 * Content is executed symbolically. Every {@code <if>} splits the step into one branch per
 * alternative whose guard is the branch condition rewritten in terms of the pre-step values.
 */
final class MicrostepExecutor {
  static final String doneStatePrefix = "done.state.";

  private final Statechart statechart;
  private final Scope scope;
  private final Set<String> activeAfter;

  private MicrostepExecutor(final Statechart statechart, final Scope scope,
      final Set<String> activeAfter) {
    this.statechart = statechart;
    this.scope = scope;
    this.activeAfter = activeAfter;
  }

  /**
   * Takes the given (conflict free, document ordered) transitions in the configuration.
   */
  static Step execute(final Statechart statechart, final ActiveConfiguration configuration,
      final List<TransitionNode> transitions, final Scope scope) throws CompilerException {
    final StateNode root = statechart.getRoot();
    final Set<StateNode> exits = new TreeSet<>(ActiveConfiguration.documentOrder);
    final EntrySet entries = new EntrySet();
    for (TransitionNode transition : transitions) {
      exits.addAll(TransitionSelector.exitSet(transition, configuration, root));
      final StateNode domain = TransitionSelector.domain(transition, root);
      if (domain == null) {
        continue;
      }
      for (StateNode target : transition.getTargets()) {
        entries.addDescendants(target);
      }
      for (StateNode target : transition.getTargets()) {
        entries.addAncestors(target, domain);
      }
    }
    final List<StateNode> remaining = new ArrayList<>();
    for (StateNode state : configuration.getAtomicStates()) {
      if (!exits.contains(state)) {
        remaining.add(state);
      }
    }
    remaining.addAll(entries.states);
    final ActiveConfiguration after = new ActiveConfiguration(remaining);
    final MicrostepExecutor executor = new MicrostepExecutor(statechart, scope,
        after.getActiveIds());
    final List<ExecutableContent> content = new ArrayList<>();
    final List<StateNode> exitOrder = new ArrayList<>(exits);
    Collections.reverse(exitOrder);
    for (StateNode state : exitOrder) {
      content.addAll(state.getOnExit());
    }
    content.addAll(executor.entryContent(entries, after));
    for (TransitionNode transition : transitions) {
      content.addAll(transition.getContent());
    }
    return new Step(after, executor.run(content));
  }

  /**
   * Enters the statechart from scratch through the initial transition of the root.
   */
  static Step initialize(final Statechart statechart, final Scope scope)
      throws CompilerException {
    final StateNode root = statechart.getRoot();
    final EntrySet entries = new EntrySet();
    final TransitionNode initial = root.getInitialTransition();
    for (StateNode target : initial.getTargets()) {
      entries.addDescendants(target);
    }
    for (StateNode target : initial.getTargets()) {
      entries.addAncestors(target, root);
    }
    final ActiveConfiguration after = new ActiveConfiguration(entries.states);
    final MicrostepExecutor executor = new MicrostepExecutor(statechart, scope,
        after.getActiveIds());
    final List<ExecutableContent> content = new ArrayList<>(initial.getContent());
    content.addAll(executor.entryContent(entries, after));
    return new Step(after, executor.run(content));
  }

  private List<ExecutableContent> entryContent(final EntrySet entries,
      final ActiveConfiguration after) {
    final List<ExecutableContent> content = new ArrayList<>();
    for (StateNode state : entries.states) {
      content.addAll(state.getOnEntry());
      if (entries.defaultEntries.contains(state)) {
        content.addAll(state.getInitialTransition().getContent());
      }
      if (!state.isFinal()) {
        continue;
      }
      final StateNode parent = state.getParent();
      if (parent.getParent() == null) {
        // top-level final state: the automaton terminates
        continue;
      }
      content.add(new ExecutableContent.Raise(doneStatePrefix + parent.getId(), null));
      final StateNode grandparent = parent.getParent();
      if (grandparent.isParallel()) {
        boolean allFinal = true;
        for (StateNode region : grandparent.getChildren()) {
          allFinal &= isInFinalState(region, after);
        }
        if (allFinal) {
          content.add(new ExecutableContent.Raise(doneStatePrefix + grandparent.getId(), null));
        }
      }
    }
    return content;
  }

  private static boolean isInFinalState(final StateNode state,
      final ActiveConfiguration configuration) {
    if (state.isCompound()) {
      for (StateNode child : state.getChildren()) {
        if (child.isFinal() && configuration.contains(child)) {
          return true;
        }
      }
      return false;
    }
    if (state.isParallel()) {
      for (StateNode region : state.getChildren()) {
        if (!isInFinalState(region, configuration)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private List<Branch> run(final List<ExecutableContent> content) throws CompilerException {
    List<Branch> branches = new ArrayList<>();
    branches.add(new Branch(Expressions.TRUE, new SymbolicStore()));
    for (ExecutableContent item : content) {
      try {
        branches = apply(branches, item);
      } catch (CompilerException problem) {
        throw problem.locate(statechart.getDocumentId(),
            "automaton " + statechart.getName() + " " + item.getElementPath());
      }
    }
    return branches;
  }

  private List<Branch> apply(final List<Branch> branches, final ExecutableContent item)
      throws CompilerException {
    switch (item.getKind()) {
      case ASSIGN:
        final ExecutableContent.Assign assign = checkAssign((ExecutableContent.Assign) item);
        for (Branch branch : branches) {
          if (assign.getIndex() == null) {
            branch.store.assign(assign.getTarget(), assign.getValue(),
                scope.resolve(assign.getTarget()).getType().isArray());
          } else {
            branch.store.assignElement(assign.getTarget(), assign.getIndex(), assign.getValue());
          }
          branch.actions.add(assign);
        }
        return branches;
      case RAISE:
        for (Branch branch : branches) {
          branch.raised.add(((ExecutableContent.Raise) item).getEvent());
        }
        return branches;
      case SEND:
        final ExecutableContent.Send send = checkSend((ExecutableContent.Send) item);
        for (Branch branch : branches) {
          branch.actions.add(send);
        }
        return branches;
      default:
        return applyIf(branches, (ExecutableContent.If) item);
    }
  }

  private List<Branch> applyIf(final List<Branch> branches, final ExecutableContent.If block)
      throws CompilerException {
    final List<ExecutableContent.Branch> alternatives = new ArrayList<>(block.getBranches());
    if (!block.hasElse()) {
      alternatives.add(new ExecutableContent.Branch(null,
          Collections.<ExecutableContent>emptyList()));
    }
    final List<Expression> conditions = new ArrayList<>();
    for (ExecutableContent.Branch alternative : alternatives) {
      if (alternative.getCondition() == null) {
        conditions.add(null);
        continue;
      }
      ExpressionTypeChecker.checkCondition(alternative.getCondition(), scope);
      conditions.add(Expressions.foldIn(alternative.getCondition(), activeAfter));
    }
    final List<Branch> result = new ArrayList<>();
    for (Branch branch : branches) {
      Expression previousFailed = Expressions.TRUE;
      for (int i = 0; i < alternatives.size(); i++) {
        Expression condition = Expressions.TRUE;
        if (conditions.get(i) != null) {
          condition = Expressions.fold(branch.store.substitute(conditions.get(i)));
          if (Expressions.containsCall(condition, Operator.Function.RANDOM)) {
            throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT, "Unsupported expression "
                + "construct condition depending on Math.random(): " + conditions.get(i));
          }
        }
        final Expression guard =
            Expressions.fold(Expressions.and(branch.guard, Expressions.and(previousFailed,
                condition)));
        previousFailed = Expressions.and(previousFailed, Expressions.not(condition));
        if (Expressions.isFalse(guard)) {
          continue;
        }
        List<Branch> forked = new ArrayList<>();
        forked.add(branch.fork(guard));
        for (ExecutableContent nested : alternatives.get(i).getContent()) {
          forked = apply(forked, nested);
        }
        result.addAll(forked);
      }
    }
    return result;
  }

  private ExecutableContent.Assign checkAssign(final ExecutableContent.Assign assign)
      throws CompilerException {
    final String target = assign.getTarget();
    if (target.startsWith(Scope.eventDataPrefix)) {
      throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
          "Assignment to event data '" + target + "'");
    }
    if (!scope.isDeclared(target)) {
      if (target.endsWith(Scope.lengthSuffix)) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Assignment to array length '" + target + "'");
      }
      throw new CompilerException(Code.UNRESOLVED_REFERENCE,
          "Assignment to undeclared variable '" + target + "'");
    }
    final ExpressionType type = scope.resolve(target).getType();
    if (assign.getIndex() == null) {
      ExpressionTypeChecker.checkAssignable(type, assign.getValue(), scope);
    } else {
      if (!type.isArray()) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Type mismatch: element assignment to non-array '" + target + "'");
      }
      final ExpressionType index = ExpressionTypeChecker.check(assign.getIndex(), scope);
      if (index.getKind() != ExpressionType.Kind.INT) {
        throw new CompilerException(Code.UNSUPPORTED_CONSTRUCT,
            "Type mismatch: array index of '" + target + "' is " + index);
      }
      ExpressionTypeChecker.checkAssignable(type.getBase(), assign.getValue(), scope);
    }
    final Expression index =
        assign.getIndex() == null ? null : Expressions.foldIn(assign.getIndex(), activeAfter);
    return new ExecutableContent.Assign(target, index,
        Expressions.foldIn(assign.getValue(), activeAfter), assign.getElementPath());
  }

  private ExecutableContent.Send checkSend(final ExecutableContent.Send send)
      throws CompilerException {
    final Map<String, Expression> parameters = new LinkedHashMap<>();
    for (Map.Entry<String, Expression> parameter : send.getParameters().entrySet()) {
      ExpressionTypeChecker.check(parameter.getValue(), scope);
      parameters.put(parameter.getKey(), Expressions.foldIn(parameter.getValue(), activeAfter));
    }
    return new ExecutableContent.Send(send.getEvent(), parameters, send.getElementPath());
  }

  /**
   * States entered by a microstep, in document order, and those entered by default.
   */
  private static final class EntrySet {
    private final Set<StateNode> states = new TreeSet<>(ActiveConfiguration.documentOrder);
    private final Set<StateNode> defaultEntries = new LinkedHashSet<>();

    private void addDescendants(final StateNode state) {
      states.add(state);
      if (state.isCompound()) {
        defaultEntries.add(state);
        final TransitionNode initial = state.getInitialTransition();
        for (StateNode target : initial.getTargets()) {
          addDescendants(target);
        }
        for (StateNode target : initial.getTargets()) {
          addAncestors(target, state);
        }
      } else if (state.isParallel()) {
        for (StateNode region : state.getChildren()) {
          if (!containsDescendantOf(region)) {
            addDescendants(region);
          }
        }
      }
    }

    private void addAncestors(final StateNode state, final StateNode ancestor) {
      for (StateNode proper : state.getAncestors(ancestor)) {
        if (proper.getParent() == null) {
          break;
        }
        states.add(proper);
        if (proper.isParallel()) {
          for (StateNode region : proper.getChildren()) {
            if (!containsDescendantOf(region)) {
              addDescendants(region);
            }
          }
        }
      }
    }

    private boolean containsDescendantOf(final StateNode state) {
      for (StateNode entered : states) {
        if (entered == state || entered.isDescendantOf(state)) {
          return true;
        }
      }
      return false;
    }
  }

  /**
   * Outcome of the step's resolution, one branch per path through the {@code <if>} blocks.
   */
  static final class Step {
    private final ActiveConfiguration target;
    private final List<Branch> branches;

    private Step(final ActiveConfiguration target, final List<Branch> branches) {
      this.target = target;
      this.branches = branches;
    }

    ActiveConfiguration getTarget() {
      return target;
    }

    List<Branch> getBranches() {
      return branches;
    }
  }

  static final class Branch {
    private final Expression guard;
    private final SymbolicStore store;
    private final List<ExecutableContent> actions = new ArrayList<>();
    private final List<String> raised = new ArrayList<>();

    private Branch(final Expression guard, final SymbolicStore store) {
      this.guard = guard;
      this.store = store;
    }

    private Branch fork(final Expression forkGuard) {
      final Branch fork = new Branch(forkGuard, store.copy());
      fork.actions.addAll(actions);
      fork.raised.addAll(raised);
      return fork;
    }

    Expression getGuard() {
      return guard;
    }

    List<ExecutableContent> getActions() {
      return actions;
    }

    List<String> getRaised() {
      return raised;
    }

    boolean hasEffects() {
      return !actions.isEmpty() || !raised.isEmpty();
    }
  }
}

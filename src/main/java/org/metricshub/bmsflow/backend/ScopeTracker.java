package org.metricshub.bmsflow.backend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * BmsFlow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.backend.ScopeFrame.Kind;
import org.metricshub.bmsflow.backend.ScopeFrame.SwitchState;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.ast.BlockValue;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.util.BmsLogger;
import org.slf4j.Logger;

/**
 * Stack of nested random, branch and switch scopes, updated one directive at
 * a time.
 * <p>
 * Every operation takes the position of the directive it handles, used for
 * the diagnostics it reports. Misplaced directives are reported and then
 * ignored; nothing here throws on malformed input.
 * <p>
 * A tracker is meant for a single pass over a single chart.
 */
public class ScopeTracker {

	private static final Logger LOG = BmsLogger.getLogger(ScopeTracker.class);

	private final RandomSource randomSource;
	private final List<ScopeFrame> stack = new ArrayList<ScopeFrame>();
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

	/**
	 * @param randomSource where {@code #RANDOM} and {@code #SWITCH} values come from
	 */
	public ScopeTracker(RandomSource randomSource) {
		this.randomSource = randomSource;
		stack.add(ScopeFrame.root());
	}

	/**
	 * Opens a {@code #RANDOM} or {@code #SETRANDOM} scope.
	 *
	 * @param value the scope value
	 * @param position position of the directive
	 */
	public void openRandom(BlockValue value, SourcePosition position) {
		closeImplicitScopes(true, true);
		BigInteger generated = generate(value, WarningKind.RANDOM_VALUE_OUT_OF_RANGE, position);
		push(ScopeFrame.random(position, value, generated));
	}

	/**
	 * Starts a new {@code #IF} chain in the enclosing random scope. An
	 * {@code #IF} found inside a branch of that scope ends the branch first.
	 *
	 * @param cond the branch condition
	 * @param position position of the directive
	 */
	public void openIf(BigInteger cond, SourcePosition position) {
		closeImplicitScopes(false, true);
		if (top().getKind() == Kind.BRANCH) {
			pop();
		}
		ScopeFrame random = top();
		if (random.getKind() != Kind.RANDOM) {
			report(WarningKind.UNMATCHED_IF, position);
			return;
		}
		random.startChain();
		pushBranch(random, cond, position);
	}

	/**
	 * Ends the current {@code #IF} / {@code #ELSEIF} branch and opens another
	 * one in the same chain.
	 *
	 * @param cond the branch condition
	 * @param position position of the directive
	 */
	public void openElseIf(BigInteger cond, SourcePosition position) {
		ScopeFrame branch = top();
		if (branch.getKind() != Kind.BRANCH || branch.isElseBranch()) {
			report(WarningKind.UNMATCHED_ELSE_IF, position);
			return;
		}
		pop();
		pushBranch(top(), cond, position);
	}

	/**
	 * Ends the current {@code #IF} / {@code #ELSEIF} branch and opens the
	 * {@code #ELSE} branch of the chain, active when no other branch of the
	 * chain was.
	 *
	 * @param position position of the directive
	 */
	public void openElse(SourcePosition position) {
		ScopeFrame branch = top();
		if (branch.getKind() != Kind.BRANCH || branch.isElseBranch()) {
			report(WarningKind.UNMATCHED_ELSE, position);
			return;
		}
		pop();
		ScopeFrame random = top();
		boolean activated = !random.isChainMatched();
		if (activated) {
			random.setChainMatched();
		}
		push(ScopeFrame.branch(position, activated, true));
	}

	/**
	 * Closes the innermost {@code #IF} chain, and any random scope still open
	 * inside its current branch. An {@code #ENDIF} found in a switch nested in
	 * that branch is unmatched.
	 *
	 * @param position position of the directive
	 */
	public void closeIf(SourcePosition position) {
		if (top().getKind() == Kind.RANDOM || !popTo(closableIndex(Kind.BRANCH))) {
			report(WarningKind.UNMATCHED_END_IF, position);
		}
	}

	/**
	 * Closes the innermost random scope, and any branch or random scope still
	 * open inside it. An {@code #ENDRANDOM} found in a switch nested in that
	 * scope is unmatched.
	 *
	 * @param position position of the directive
	 */
	public void closeRandom(SourcePosition position) {
		if (!popTo(closableIndex(Kind.RANDOM))) {
			report(WarningKind.UNMATCHED_END_RANDOM, position);
		}
	}

	/**
	 * Opens a {@code #SWITCH} or {@code #SETSWITCH} scope.
	 *
	 * @param value the scope value
	 * @param position position of the directive
	 */
	public void openSwitch(BlockValue value, SourcePosition position) {
		closeImplicitScopes(true, true);
		BigInteger generated = generate(value, WarningKind.SWITCH_VALUE_OUT_OF_RANGE, position);
		push(ScopeFrame.switchScope(position, value, generated));
	}

	/**
	 * Opens a {@code #CASE} branch in the innermost switch. The switch becomes
	 * active when it is still searching and {@code cond} is its value; an
	 * already active switch stays active (fallthrough).
	 *
	 * @param cond the case value
	 * @param position position of the directive
	 */
	public void openCase(BigInteger cond, SourcePosition position) {
		ScopeFrame sw = enterSwitch(WarningKind.UNMATCHED_CASE, position);
		if (sw == null) {
			return;
		}
		WarningKind rejection = ConditionValidator.validateCase(sw.getBlockValue(), sw.getCaseValues(), cond);
		if (rejection != null) {
			report(rejection, position);
		} else if (sw.getSwitchState() == SwitchState.SEARCHING && cond.equals(sw.getGenerated())) {
			sw.setSwitchState(SwitchState.ACTIVE);
		}
		sw.openCase(rejection != null);
		trace("CASE " + cond, sw);
	}

	/**
	 * Opens the {@code #DEF} branch of the innermost switch, which activates
	 * the switch when it is still searching.
	 *
	 * @param position position of the directive
	 */
	public void openDef(SourcePosition position) {
		ScopeFrame sw = enterSwitch(WarningKind.UNMATCHED_DEF, position);
		if (sw == null) {
			return;
		}
		WarningKind rejection = ConditionValidator.validateDef(sw.isDefSeen());
		if (rejection != null) {
			report(rejection, position);
		} else {
			sw.setDefSeen();
			if (sw.getSwitchState() == SwitchState.SEARCHING) {
				sw.setSwitchState(SwitchState.ACTIVE);
			}
		}
		sw.openCase(rejection != null);
		trace("DEF", sw);
	}

	/**
	 * Handles {@code #SKIP}. Directly in a case, it ends the case and, when the
	 * switch was active, stops it for good. Nested in a branch inside a case,
	 * it stops the switch only when the {@code #SKIP} itself is active.
	 *
	 * @param position position of the directive
	 */
	public void skip(SourcePosition position) {
		int index = indexOf(Kind.SWITCH);
		if (index < 0) {
			report(WarningKind.UNMATCHED_SKIP, position);
			return;
		}
		while (stack.size() - 1 > index && top().getKind() == Kind.RANDOM) {
			pop();
		}
		ScopeFrame sw = stack.get(index);
		if (stack.size() - 1 == index) {
			if (!sw.isCaseOpen()) {
				report(WarningKind.UNMATCHED_SKIP, position);
				return;
			}
			if (!sw.isCaseRejected() && sw.getSwitchState() == SwitchState.ACTIVE) {
				sw.setSwitchState(SwitchState.SKIPPED);
			}
			sw.closeCase();
		} else if (isActive()) {
			sw.setSwitchState(SwitchState.SKIPPED);
		}
		trace("SKIP", sw);
	}

	/**
	 * Closes the innermost switch, and any scope still open inside it.
	 *
	 * @param position position of the directive
	 */
	public void closeSwitch(SourcePosition position) {
		if (!popTo(indexOf(Kind.SWITCH))) {
			report(WarningKind.UNMATCHED_END_SWITCH, position);
		}
	}

	/**
	 * Prepares the stack for a payload token: a random scope with no open
	 * branch cannot hold tokens and is closed.
	 *
	 * @return whether the payload token is kept
	 */
	public boolean acceptPayload() {
		while (top().getKind() == Kind.RANDOM) {
			pop();
		}
		return isActive();
	}

	/**
	 * @return {@code true} when every scope on the stack is activated
	 */
	public boolean isActive() {
		for (ScopeFrame frame : stack) {
			if (!frame.isActivated()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return number of open scopes, branches included, the root excluded
	 */
	public int depth() {
		return stack.size() - 1;
	}

	/**
	 * @return the innermost frame
	 */
	public ScopeFrame top() {
		return stack.get(stack.size() - 1);
	}

	/**
	 * @return the diagnostics reported so far, in order
	 */
	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList(diagnostics);
	}

	private void pushBranch(ScopeFrame random, BigInteger cond, SourcePosition position) {
		WarningKind rejection = ConditionValidator.validateIf(random.getBlockValue(), random.getChainValues(), cond);
		boolean activated = false;
		if (rejection != null) {
			report(rejection, position);
		} else if (!random.isChainMatched() && cond.equals(random.getGenerated())) {
			activated = true;
			random.setChainMatched();
		}
		push(ScopeFrame.branch(position, activated, false));
	}

	/**
	 * Finds the innermost switch for {@code #CASE} / {@code #DEF} and closes
	 * everything above it.
	 */
	private ScopeFrame enterSwitch(WarningKind unmatched, SourcePosition position) {
		int index = indexOf(Kind.SWITCH);
		if (index < 0) {
			report(unmatched, position);
			return null;
		}
		while (stack.size() - 1 > index) {
			pop();
		}
		return stack.get(index);
	}

	/**
	 * Closes the scopes a new header cannot live in: a random scope with no
	 * open branch, and a switch with no open case.
	 */
	private void closeImplicitScopes(boolean closeRandom, boolean closeSwitch) {
		while (true) {
			ScopeFrame frame = top();
			if (closeRandom && frame.getKind() == Kind.RANDOM) {
				pop();
			} else if (closeSwitch && frame.getKind() == Kind.SWITCH && !frame.isCaseOpen()) {
				pop();
			} else {
				return;
			}
		}
	}

	private BigInteger generate(BlockValue value, WarningKind outOfRange, SourcePosition position) {
		if (!value.isRandom()) {
			return value.getValue();
		}
		if (value.getValue().signum() == 0) {
			return BigInteger.ZERO;
		}
		BigInteger generated = randomSource.next(value.getValue());
		WarningKind rejection = ConditionValidator.validateGenerated(value, generated, outOfRange);
		if (rejection != null) {
			report(rejection, position);
		}
		return generated;
	}

	private int indexOf(Kind kind) {
		for (int i = stack.size() - 1; i > 0; i--) {
			if (stack.get(i).getKind() == kind) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * Finds the innermost frame of {@code kind} that an {@code #ENDIF} or
	 * {@code #ENDRANDOM} may close. A switch opened above it must be closed
	 * by its own {@code #ENDSW} first.
	 *
	 * @return the frame index, or {@code -1}
	 */
	private int closableIndex(Kind kind) {
		int index = indexOf(kind);
		if (index >= 0 && indexOf(Kind.SWITCH) > index) {
			return -1;
		}
		return index;
	}

	private boolean popTo(int index) {
		if (index < 0) {
			return false;
		}
		while (stack.size() > index) {
			pop();
		}
		return true;
	}

	private void push(ScopeFrame frame) {
		stack.add(frame);
		trace("open", frame);
	}

	private void pop() {
		ScopeFrame frame = stack.remove(stack.size() - 1);
		trace("close", frame);
	}

	private void report(WarningKind kind, SourcePosition position) {
		Diagnostic diagnostic = new Diagnostic(kind, position);
		LOG.debug("{}", diagnostic);
		diagnostics.add(diagnostic);
	}

	private void trace(String action, ScopeFrame frame) {
		if (LOG.isTraceEnabled()) {
			LOG.trace("{} {} at {} (depth {})", action, frame, frame.getPosition(), depth());
		}
	}
}

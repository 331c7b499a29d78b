package org.metricshub.bmsflow.frontend;

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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.bmsflow.backend.ConditionValidator;
import org.metricshub.bmsflow.backend.Diagnostic;
import org.metricshub.bmsflow.backend.WarningKind;
import org.metricshub.bmsflow.frontend.ast.BlockValue;
import org.metricshub.bmsflow.frontend.ast.CaseBranch;
import org.metricshub.bmsflow.frontend.ast.ControlFlowTree;
import org.metricshub.bmsflow.frontend.ast.IfBlock;
import org.metricshub.bmsflow.frontend.ast.IfBranch;
import org.metricshub.bmsflow.frontend.ast.RandomScopeUnit;
import org.metricshub.bmsflow.frontend.ast.SwitchScopeUnit;
import org.metricshub.bmsflow.frontend.ast.TokenUnit;
import org.metricshub.bmsflow.frontend.ast.Unit;
import org.metricshub.bmsflow.util.BmsLogger;
import org.slf4j.Logger;

/**
 * Builds the {@link Unit} tree of a token stream.
 * <p>
 * Scopes are opened and closed, implicitly or not, by the same rules as the
 * single-pass resolver, and the same structural warnings are reported
 * (misplaced directives, duplicate or out of range conditions). Branches
 * rejected by a warning are kept in the tree, flagged as rejected.
 * <p>
 * Instances are not thread safe.
 */
public class ControlFlowTreeBuilder {

	private static final Logger LOG = BmsLogger.getLogger(ControlFlowTreeBuilder.class);

	private enum Kind {
		ROOT,
		RANDOM,
		BRANCH,
		SWITCH
	}

	/** Builder state of one open scope. */
	private static final class Frame {
		private final Kind kind;
		private final List<Unit> rootUnits;
		private RandomScopeUnit random;
		private IfBlock block;
		private final Set<BigInteger> seen = new HashSet<BigInteger>();
		private IfBranch branch;
		private SwitchScopeUnit switchScope;
		private boolean defSeen;
		private CaseBranch openCase;

		private Frame(Kind kind, List<Unit> rootUnits) {
			this.kind = kind;
			this.rootUnits = rootUnits;
		}
	}

	private final List<Frame> stack = new ArrayList<Frame>();
	private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
	private Frame lastPopped;

	/**
	 * Builds the tree of {@code tokens}.
	 *
	 * @param tokens the chart tokens, in source order
	 * @return the tree and its structural warnings
	 */
	public ControlFlowTree build(Iterable<Token> tokens) {
		stack.clear();
		diagnostics.clear();
		List<Unit> units = new ArrayList<Unit>();
		stack.add(new Frame(Kind.ROOT, units));
		for (Token token : tokens) {
			if (token.isDirective()) {
				directive(token);
			} else {
				payload(token);
			}
		}
		ControlFlowTree tree = new ControlFlowTree(units, diagnostics);
		LOG.debug("Built control-flow tree: {} top-level units, {} warnings", units.size(), diagnostics.size());
		return tree;
	}

	private void payload(Token token) {
		while (top().kind == Kind.RANDOM) {
			pop();
		}
		append(new TokenUnit(token));
	}

	private void directive(Token token) {
		switch (token.getType()) {
		case RANDOM:
		case SETRANDOM:
			openRandom(token);
			break;
		case IF:
			openIf(token);
			break;
		case ELSEIF:
			openElseIf(token);
			break;
		case ELSE:
			openElse(token);
			break;
		case ENDIF:
			closeIf(token);
			break;
		case ENDRANDOM:
			if (popTo(closableIndex(Kind.RANDOM))) {
				lastPopped.random.setEnd(token);
			} else {
				report(WarningKind.UNMATCHED_END_RANDOM, token);
			}
			break;
		case SWITCH:
		case SETSWITCH:
			openSwitch(token);
			break;
		case CASE:
		case DEF:
			openCase(token);
			break;
		case SKIP:
			skip(token);
			break;
		case ENDSW:
			if (popTo(indexOf(Kind.SWITCH))) {
				lastPopped.switchScope.setEnd(token);
			} else {
				report(WarningKind.UNMATCHED_END_SWITCH, token);
			}
			break;
		default:
			throw new IllegalArgumentException(token + " is not a control-flow directive");
		}
	}

	private void openRandom(Token token) {
		closeImplicitScopes(true);
		BlockValue value = token.getType() == TokenType.RANDOM
				? BlockValue.random(token.getValue())
				: BlockValue.set(token.getValue());
		RandomScopeUnit unit = new RandomScopeUnit(token, value);
		append(unit);
		Frame frame = new Frame(Kind.RANDOM, null);
		frame.random = unit;
		stack.add(frame);
	}

	private void openIf(Token token) {
		closeImplicitScopes(false);
		if (top().kind == Kind.BRANCH) {
			pop();
		}
		Frame random = top();
		if (random.kind != Kind.RANDOM) {
			report(WarningKind.UNMATCHED_IF, token);
			return;
		}
		random.block = new IfBlock();
		random.seen.clear();
		random.random.addIfBlock(random.block);
		pushBranch(random, token);
	}

	private void openElseIf(Token token) {
		Frame branch = top();
		if (branch.kind != Kind.BRANCH || branch.branch.isElse()) {
			report(WarningKind.UNMATCHED_ELSE_IF, token);
			return;
		}
		pop();
		pushBranch(top(), token);
	}

	private void openElse(Token token) {
		Frame branch = top();
		if (branch.kind != Kind.BRANCH || branch.branch.isElse()) {
			report(WarningKind.UNMATCHED_ELSE, token);
			return;
		}
		pop();
		pushBranch(top(), token);
	}

	private void pushBranch(Frame random, Token token) {
		WarningKind rejection = null;
		if (token.getType() != TokenType.ELSE) {
			rejection = ConditionValidator.validateIf(random.random.getBlockValue(), random.seen, token.getValue());
			if (rejection != null) {
				report(rejection, token);
			}
		}
		IfBranch branch = new IfBranch(token, rejection != null);
		random.block.addBranch(branch);
		Frame frame = new Frame(Kind.BRANCH, null);
		frame.block = random.block;
		frame.branch = branch;
		stack.add(frame);
	}

	private void closeIf(Token token) {
		if (top().kind == Kind.RANDOM || !popTo(closableIndex(Kind.BRANCH))) {
			report(WarningKind.UNMATCHED_END_IF, token);
			return;
		}
		lastPopped.block.setEnd(token);
	}

	private void openSwitch(Token token) {
		closeImplicitScopes(true);
		BlockValue value = token.getType() == TokenType.SWITCH
				? BlockValue.random(token.getValue())
				: BlockValue.set(token.getValue());
		SwitchScopeUnit unit = new SwitchScopeUnit(token, value);
		append(unit);
		Frame frame = new Frame(Kind.SWITCH, null);
		frame.switchScope = unit;
		stack.add(frame);
	}

	private void openCase(Token token) {
		boolean def = token.getType() == TokenType.DEF;
		int index = indexOf(Kind.SWITCH);
		if (index < 0) {
			report(def ? WarningKind.UNMATCHED_DEF : WarningKind.UNMATCHED_CASE, token);
			return;
		}
		while (stack.size() - 1 > index) {
			pop();
		}
		Frame sw = top();
		WarningKind rejection;
		if (def) {
			rejection = ConditionValidator.validateDef(sw.defSeen);
			sw.defSeen = true;
		} else {
			rejection = ConditionValidator.validateCase(sw.switchScope.getBlockValue(), sw.seen, token.getValue());
		}
		if (rejection != null) {
			report(rejection, token);
		}
		sw.openCase = new CaseBranch(token, rejection != null);
		sw.switchScope.addCase(sw.openCase);
	}

	private void skip(Token token) {
		int index = indexOf(Kind.SWITCH);
		if (index < 0) {
			report(WarningKind.UNMATCHED_SKIP, token);
			return;
		}
		while (stack.size() - 1 > index && top().kind == Kind.RANDOM) {
			pop();
		}
		Frame sw = stack.get(index);
		if (stack.size() - 1 > index) {
			// conditional skip, evaluated when reached
			append(new TokenUnit(token));
		} else if (sw.openCase == null) {
			report(WarningKind.UNMATCHED_SKIP, token);
		} else {
			sw.openCase.setSkip(token);
			sw.openCase = null;
		}
	}

	private void closeImplicitScopes(boolean closeRandom) {
		while (true) {
			Frame frame = top();
			if (closeRandom && frame.kind == Kind.RANDOM) {
				pop();
			} else if (frame.kind == Kind.SWITCH && frame.openCase == null) {
				pop();
			} else {
				return;
			}
		}
	}

	/**
	 * Adds a unit to the innermost container. Units met in a switch with no
	 * open case belong to no branch and are dropped.
	 */
	private void append(Unit unit) {
		Frame frame = top();
		switch (frame.kind) {
		case ROOT:
			frame.rootUnits.add(unit);
			break;
		case BRANCH:
			frame.branch.append(unit);
			break;
		case SWITCH:
			if (frame.openCase != null) {
				frame.openCase.append(unit);
			} else {
				LOG.trace("Dropping {} found outside of any case", unit);
			}
			break;
		default:
			throw new IllegalStateException("Cannot append " + unit + " to a random scope");
		}
	}

	private Frame top() {
		return stack.get(stack.size() - 1);
	}

	private void pop() {
		lastPopped = stack.remove(stack.size() - 1);
	}

	private int indexOf(Kind kind) {
		for (int i = stack.size() - 1; i > 0; i--) {
			if (stack.get(i).kind == kind) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return the innermost frame of {@code kind} not hidden by a switch opened
	 *         above it, or {@code -1}
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

	private void report(WarningKind kind, Token token) {
		Diagnostic diagnostic = new Diagnostic(kind, token.getPosition());
		LOG.debug("{}", diagnostic);
		diagnostics.add(diagnostic);
	}
}

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
import java.util.List;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.frontend.ast.BlockValue;
import org.metricshub.bmsflow.frontend.ast.CaseBranch;
import org.metricshub.bmsflow.frontend.ast.ControlFlowTree;
import org.metricshub.bmsflow.frontend.ast.IfBlock;
import org.metricshub.bmsflow.frontend.ast.IfBranch;
import org.metricshub.bmsflow.frontend.ast.RandomScopeUnit;
import org.metricshub.bmsflow.frontend.ast.SwitchScopeUnit;
import org.metricshub.bmsflow.frontend.ast.TokenUnit;
import org.metricshub.bmsflow.frontend.ast.Unit;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.util.BmsLogger;
import org.slf4j.Logger;

/**
 * Evaluates a {@link ControlFlowTree} with isolated switch branches: only the
 * first matching {@code #CASE} of a switch is kept, or its {@code #DEF} when
 * no case matches, wherever the {@code #DEF} is. There is no fallthrough.
 * <p>
 * The whole tree is walked, dead branches included, so that a given
 * {@link RandomSource} is consumed in the same order as by the
 * {@link ControlFlowResolver}.
 */
public class TreeResolver {

	private static final Logger LOG = BmsLogger.getLogger(TreeResolver.class);

	private final RandomSource randomSource;

	public TreeResolver(RandomSource randomSource) {
		this.randomSource = randomSource;
	}

	/**
	 * @param tree the control-flow tree of a chart
	 * @return kept payload tokens, and the tree warnings followed by the
	 *         warnings about generated values
	 */
	public Resolution resolve(ControlFlowTree tree) {
		Pass pass = new Pass();
		pass.evaluate(tree.getUnits(), true);
		List<Diagnostic> diagnostics = new ArrayList<Diagnostic>(tree.getDiagnostics());
		diagnostics.addAll(pass.diagnostics);
		Resolution resolution = new Resolution(pass.kept, diagnostics);
		LOG.debug("Resolved control-flow tree: {}", resolution);
		return resolution;
	}

	/** State of one evaluation. */
	private final class Pass {

		private final List<Token> kept = new ArrayList<Token>();
		private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

		/**
		 * @return {@code true} when an active nested {@code #SKIP} was reached,
		 *         which ends the enclosing case
		 */
		private boolean evaluate(List<Unit> units, boolean emit) {
			boolean skipped = false;
			for (Unit unit : units) {
				boolean live = emit && !skipped;
				if (unit instanceof TokenUnit) {
					TokenUnit tokenUnit = (TokenUnit) unit;
					if (tokenUnit.isSkip()) {
						skipped |= live;
					} else if (live) {
						kept.add(tokenUnit.getToken());
					}
				} else if (unit instanceof RandomScopeUnit) {
					skipped |= evaluateRandom((RandomScopeUnit) unit, live);
				} else if (unit instanceof SwitchScopeUnit) {
					evaluateSwitch((SwitchScopeUnit) unit, live);
				}
			}
			return skipped;
		}

		private boolean evaluateRandom(RandomScopeUnit unit, boolean emit) {
			BigInteger value = generate(unit.getBlockValue(), WarningKind.RANDOM_VALUE_OUT_OF_RANGE, unit.getPosition());
			boolean skipped = false;
			for (IfBlock block : unit.getIfBlocks()) {
				IfBranch selected = select(block, value);
				for (IfBranch branch : block.getBranches()) {
					skipped |= evaluate(branch.getUnits(), emit && !skipped && branch == selected);
				}
			}
			return skipped;
		}

		private void evaluateSwitch(SwitchScopeUnit unit, boolean emit) {
			BigInteger value = generate(unit.getBlockValue(), WarningKind.SWITCH_VALUE_OUT_OF_RANGE, unit.getPosition());
			CaseBranch selected = select(unit, value);
			for (CaseBranch branch : unit.getCases()) {
				evaluate(branch.getUnits(), emit && branch == selected);
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
			if (ConditionValidator.validateGenerated(value, generated, outOfRange) != null) {
				diagnostics.add(new Diagnostic(outOfRange, position));
			}
			return generated;
		}
	}

	private static IfBranch select(IfBlock block, BigInteger value) {
		IfBranch elseBranch = null;
		for (IfBranch branch : block.getBranches()) {
			if (branch.isRejected()) {
				continue;
			}
			if (branch.isElse()) {
				if (elseBranch == null) {
					elseBranch = branch;
				}
			} else if (branch.getCondition().equals(value)) {
				return branch;
			}
		}
		return elseBranch;
	}

	private static CaseBranch select(SwitchScopeUnit unit, BigInteger value) {
		CaseBranch def = null;
		for (CaseBranch branch : unit.getCases()) {
			if (branch.isRejected()) {
				continue;
			}
			if (branch.isDefault()) {
				if (def == null) {
					def = branch;
				}
			} else if (branch.getCondition().equals(value)) {
				return branch;
			}
		}
		return def;
	}
}

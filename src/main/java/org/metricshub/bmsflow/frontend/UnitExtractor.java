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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.bmsflow.frontend.ast.CaseBranch;
import org.metricshub.bmsflow.frontend.ast.IfBlock;
import org.metricshub.bmsflow.frontend.ast.IfBranch;
import org.metricshub.bmsflow.frontend.ast.RandomScopeUnit;
import org.metricshub.bmsflow.frontend.ast.SwitchScopeUnit;
import org.metricshub.bmsflow.frontend.ast.TokenUnit;
import org.metricshub.bmsflow.frontend.ast.Unit;
import org.metricshub.bmsflow.frontend.ast.UnitVisitor;

/**
 * Flattens a control-flow tree back into tokens, every branch included,
 * directives included, in source order.
 * <p>
 * Tokens the tree builder discarded (misplaced directives, tokens outside of
 * any case) are not part of the tree and do not come back.
 */
public final class UnitExtractor implements UnitVisitor<Void> {

	private final List<Token> tokens = new ArrayList<Token>();

	private UnitExtractor() {}

	/**
	 * @param units units of a tree
	 * @return all their tokens
	 */
	public static List<Token> extract(List<Unit> units) {
		UnitExtractor extractor = new UnitExtractor();
		extractor.visitAll(units);
		return extractor.tokens;
	}

	private void visitAll(List<Unit> units) {
		for (Unit unit : units) {
			unit.accept(this);
		}
	}

	@Override
	public Void visitToken(TokenUnit unit) {
		tokens.add(unit.getToken());
		return null;
	}

	@Override
	public Void visitRandomScope(RandomScopeUnit unit) {
		tokens.add(unit.getHeader());
		for (IfBlock block : unit.getIfBlocks()) {
			for (IfBranch branch : block.getBranches()) {
				tokens.add(branch.getHeader());
				visitAll(branch.getUnits());
			}
			addIfPresent(block.getEnd());
		}
		addIfPresent(unit.getEnd());
		return null;
	}

	@Override
	public Void visitSwitchScope(SwitchScopeUnit unit) {
		tokens.add(unit.getHeader());
		for (CaseBranch branch : unit.getCases()) {
			tokens.add(branch.getHeader());
			visitAll(branch.getUnits());
			addIfPresent(branch.getSkip());
		}
		addIfPresent(unit.getEnd());
		return null;
	}

	private void addIfPresent(Token token) {
		if (token != null) {
			tokens.add(token);
		}
	}
}

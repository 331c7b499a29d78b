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

import java.io.PrintStream;
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
 * Prints a control-flow tree, one token per line, indented by nesting level.
 * Rejected branches are marked with {@code (rejected)}.
 */
public final class TreeDumper implements UnitVisitor<Void> {

	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int level;

	private TreeDumper() {}

	/**
	 * @param units units of a tree
	 * @return the indented dump, one line per token
	 */
	public static String dump(List<Unit> units) {
		TreeDumper dumper = new TreeDumper();
		dumper.visitAll(units);
		return dumper.out.toString();
	}

	public static void dump(List<Unit> units, PrintStream ps) {
		ps.print(dump(units));
		ps.flush();
	}

	private void visitAll(List<Unit> units) {
		for (Unit unit : units) {
			unit.accept(this);
		}
	}

	private void line(Object text) {
		for (int i = 0; i < level; i++) {
			out.append(INDENT);
		}
		out.append(text).append('\n');
	}

	private void lineIfPresent(Token token) {
		if (token != null) {
			line(token);
		}
	}

	@Override
	public Void visitToken(TokenUnit unit) {
		line(unit.getToken());
		return null;
	}

	@Override
	public Void visitRandomScope(RandomScopeUnit unit) {
		line(unit.getHeader());
		level++;
		for (IfBlock block : unit.getIfBlocks()) {
			for (IfBranch branch : block.getBranches()) {
				line(branch.isRejected() ? branch.getHeader() + " (rejected)" : branch.getHeader());
				level++;
				visitAll(branch.getUnits());
				level--;
			}
			lineIfPresent(block.getEnd());
		}
		level--;
		lineIfPresent(unit.getEnd());
		return null;
	}

	@Override
	public Void visitSwitchScope(SwitchScopeUnit unit) {
		line(unit.getHeader());
		level++;
		for (CaseBranch branch : unit.getCases()) {
			line(branch.isRejected() ? branch.getHeader() + " (rejected)" : branch.getHeader());
			level++;
			visitAll(branch.getUnits());
			lineIfPresent(branch.getSkip());
			level--;
		}
		level--;
		lineIfPresent(unit.getEnd());
		return null;
	}
}

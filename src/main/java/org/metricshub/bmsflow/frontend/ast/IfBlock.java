package org.metricshub.bmsflow.frontend.ast;

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
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.frontend.Token;

/**
 * One {@code #IF} chain of a random scope.
 */
public final class IfBlock {

	private final List<IfBranch> branches = new ArrayList<IfBranch>();
	private Token end;

	public List<IfBranch> getBranches() {
		return Collections.unmodifiableList(branches);
	}

	public void addBranch(IfBranch branch) {
		branches.add(branch);
	}

	public boolean hasElse() {
		for (IfBranch branch : branches) {
			if (branch.isElse()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the {@code #ENDIF} token, or {@code null} when the chain was closed
	 *         implicitly
	 */
	public Token getEnd() {
		return end;
	}

	public void setEnd(Token end) {
		this.end = end;
	}
}

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
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.Token;

/**
 * A {@code #SWITCH} / {@code #SETSWITCH} scope with its ordered case branches.
 */
public final class SwitchScopeUnit implements Unit {

	private final Token header;
	private final BlockValue blockValue;
	private final List<CaseBranch> cases = new ArrayList<CaseBranch>();
	private Token end;

	public SwitchScopeUnit(Token header, BlockValue blockValue) {
		this.header = header;
		this.blockValue = blockValue;
	}

	public Token getHeader() {
		return header;
	}

	public BlockValue getBlockValue() {
		return blockValue;
	}

	public List<CaseBranch> getCases() {
		return Collections.unmodifiableList(cases);
	}

	public void addCase(CaseBranch branch) {
		cases.add(branch);
	}

	/**
	 * @return the {@code #ENDSW} token, or {@code null} when closed implicitly
	 */
	public Token getEnd() {
		return end;
	}

	public void setEnd(Token end) {
		this.end = end;
	}

	@Override
	public SourcePosition getPosition() {
		return header.getPosition();
	}

	@Override
	public <R> R accept(UnitVisitor<R> visitor) {
		return visitor.visitSwitchScope(this);
	}

	@Override
	public String toString() {
		return header + " (" + cases.size() + " cases)";
	}
}

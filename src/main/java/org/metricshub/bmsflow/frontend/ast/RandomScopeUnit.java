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
 * A {@code #RANDOM} / {@code #SETRANDOM} scope and the {@code #IF} chains it
 * holds, up to {@code #ENDRANDOM} or an implicit close.
 * <p>
 * Payload tokens found directly in the scope, outside any chain, close it
 * implicitly and therefore never belong to it.
 */
public final class RandomScopeUnit implements Unit {

	private final Token header;
	private final BlockValue blockValue;
	private final List<IfBlock> ifBlocks = new ArrayList<IfBlock>();
	private Token end;

	public RandomScopeUnit(Token header, BlockValue blockValue) {
		this.header = header;
		this.blockValue = blockValue;
	}

	public Token getHeader() {
		return header;
	}

	public BlockValue getBlockValue() {
		return blockValue;
	}

	public List<IfBlock> getIfBlocks() {
		return Collections.unmodifiableList(ifBlocks);
	}

	public void addIfBlock(IfBlock block) {
		ifBlocks.add(block);
	}

	/**
	 * @return the {@code #ENDRANDOM} token, or {@code null} when closed implicitly
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
		return visitor.visitRandomScope(this);
	}

	@Override
	public String toString() {
		return header + " (" + ifBlocks.size() + " if blocks)";
	}
}

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
import java.util.HashSet;
import java.util.Set;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.ast.BlockValue;

/**
 * One entry of the {@link ScopeTracker} stack.
 * <p>
 * A random frame holds the state of its current {@code #IF} chain; the
 * branches of the chain are pushed on top of it as {@link Kind#BRANCH}
 * frames. A switch frame holds its case state directly.
 */
public final class ScopeFrame {

	/** Frame kinds. */
	public enum Kind {
		ROOT,
		RANDOM,
		BRANCH,
		SWITCH
	}

	/** States of a switch scope. */
	public enum SwitchState {
		/** No branch matched yet. */
		SEARCHING,
		/** A branch matched: tokens are kept until {@code #SKIP}. */
		ACTIVE,
		/** A {@code #SKIP} ended the matching branch; nothing else is kept. */
		SKIPPED
	}

	private final Kind kind;
	private final SourcePosition position;
	private final BlockValue blockValue;
	private final BigInteger generated;

	// RANDOM: current #IF chain
	private final Set<BigInteger> chainValues = new HashSet<BigInteger>();
	private boolean chainMatched;

	// BRANCH
	private boolean activated;
	private boolean elseBranch;

	// SWITCH
	private final Set<BigInteger> caseValues = new HashSet<BigInteger>();
	private boolean defSeen;
	private boolean caseOpen;
	private boolean caseRejected;
	private SwitchState switchState = SwitchState.SEARCHING;

	private ScopeFrame(Kind kind, SourcePosition position, BlockValue blockValue, BigInteger generated) {
		this.kind = kind;
		this.position = position;
		this.blockValue = blockValue;
		this.generated = generated;
	}

	static ScopeFrame root() {
		return new ScopeFrame(Kind.ROOT, SourcePosition.NONE, null, null);
	}

	static ScopeFrame random(SourcePosition position, BlockValue blockValue, BigInteger generated) {
		return new ScopeFrame(Kind.RANDOM, position, blockValue, generated);
	}

	static ScopeFrame branch(SourcePosition position, boolean activated, boolean elseBranch) {
		ScopeFrame frame = new ScopeFrame(Kind.BRANCH, position, null, null);
		frame.activated = activated;
		frame.elseBranch = elseBranch;
		return frame;
	}

	static ScopeFrame switchScope(SourcePosition position, BlockValue blockValue, BigInteger generated) {
		return new ScopeFrame(Kind.SWITCH, position, blockValue, generated);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return position of the directive that opened the frame
	 */
	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return how the value of a random or switch frame was obtained, {@code null} otherwise
	 */
	public BlockValue getBlockValue() {
		return blockValue;
	}

	/**
	 * @return the value a random or switch frame is bound to, {@code null} otherwise
	 */
	public BigInteger getGenerated() {
		return generated;
	}

	/**
	 * Whether the tokens directly inside this frame are kept. The root and
	 * random frames are transparent; a branch frame is activated when its
	 * condition matched; a switch frame when a branch is open, not rejected,
	 * and the switch is {@link SwitchState#ACTIVE}.
	 *
	 * @return {@code true} when this frame lets tokens through
	 */
	public boolean isActivated() {
		switch (kind) {
		case BRANCH:
			return activated;
		case SWITCH:
			return caseOpen && !caseRejected && switchState == SwitchState.ACTIVE;
		default:
			return true;
		}
	}

	public boolean isElseBranch() {
		return elseBranch;
	}

	void startChain() {
		chainValues.clear();
		chainMatched = false;
	}

	Set<BigInteger> getChainValues() {
		return chainValues;
	}

	boolean isChainMatched() {
		return chainMatched;
	}

	void setChainMatched() {
		chainMatched = true;
	}

	Set<BigInteger> getCaseValues() {
		return caseValues;
	}

	boolean isDefSeen() {
		return defSeen;
	}

	void setDefSeen() {
		defSeen = true;
	}

	public boolean isCaseOpen() {
		return caseOpen;
	}

	void openCase(boolean rejected) {
		caseOpen = true;
		caseRejected = rejected;
	}

	void closeCase() {
		caseOpen = false;
		caseRejected = false;
	}

	boolean isCaseRejected() {
		return caseRejected;
	}

	public SwitchState getSwitchState() {
		return switchState;
	}

	void setSwitchState(SwitchState switchState) {
		this.switchState = switchState;
	}

	@Override
	public String toString() {
		switch (kind) {
		case RANDOM:
			return "RANDOM " + blockValue + " = " + generated;
		case BRANCH:
			return (elseBranch ? "ELSE" : "IF") + (activated ? " (active)" : "");
		case SWITCH:
			return "SWITCH " + blockValue + " = " + generated + " " + switchState + (caseOpen ? " (case open)" : "");
		default:
			return "ROOT";
		}
	}
}

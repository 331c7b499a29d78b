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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.bmsflow.frontend.SourcePosition;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.frontend.ast.BlockValue;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.util.BmsLogger;
import org.slf4j.Logger;

/**
 * Flattens a token stream in a single pass: control-flow directives drive a
 * {@link ScopeTracker}, payload tokens are kept when every enclosing scope is
 * active.
 * <p>
 * Switch branches fall through: once a {@code #CASE} (or a {@code #DEF} met
 * while no case matched yet) activates a switch, the following branches are
 * kept too until a {@code #SKIP}.
 * <p>
 * The resolver keeps no state between calls to {@link #resolve(Iterable)};
 * it is thread safe when its {@link RandomSource} is.
 */
public class ControlFlowResolver {

	private static final Logger LOG = BmsLogger.getLogger(ControlFlowResolver.class);

	private final RandomSource randomSource;

	public ControlFlowResolver(RandomSource randomSource) {
		this.randomSource = randomSource;
	}

	/**
	 * Resolves the control flow of {@code tokens}.
	 *
	 * @param tokens the chart tokens, in source order
	 * @return kept payload tokens and diagnostics
	 */
	public Resolution resolve(Iterable<Token> tokens) {
		ScopeTracker tracker = new ScopeTracker(randomSource);
		List<Token> kept = new ArrayList<Token>();
		for (Token token : tokens) {
			if (token.isDirective()) {
				apply(tracker, token);
			} else if (tracker.acceptPayload()) {
				kept.add(token);
			}
		}
		if (tracker.depth() > 0) {
			LOG.trace("{} scopes still open at end of chart, closing them", tracker.depth());
		}
		Resolution resolution = new Resolution(kept, tracker.getDiagnostics());
		LOG.debug("Resolved control flow: {}", resolution);
		return resolution;
	}

	/**
	 * Routes one directive to the tracker.
	 *
	 * @param tracker the scope stack of the current pass
	 * @param token a control-flow directive
	 */
	static void apply(ScopeTracker tracker, Token token) {
		SourcePosition position = token.getPosition();
		switch (token.getType()) {
		case RANDOM:
			tracker.openRandom(BlockValue.random(token.getValue()), position);
			break;
		case SETRANDOM:
			tracker.openRandom(BlockValue.set(token.getValue()), position);
			break;
		case IF:
			tracker.openIf(token.getValue(), position);
			break;
		case ELSEIF:
			tracker.openElseIf(token.getValue(), position);
			break;
		case ELSE:
			tracker.openElse(position);
			break;
		case ENDIF:
			tracker.closeIf(position);
			break;
		case ENDRANDOM:
			tracker.closeRandom(position);
			break;
		case SWITCH:
			tracker.openSwitch(BlockValue.random(token.getValue()), position);
			break;
		case SETSWITCH:
			tracker.openSwitch(BlockValue.set(token.getValue()), position);
			break;
		case CASE:
			tracker.openCase(token.getValue(), position);
			break;
		case DEF:
			tracker.openDef(position);
			break;
		case SKIP:
			tracker.skip(position);
			break;
		case ENDSW:
			tracker.closeSwitch(position);
			break;
		default:
			throw new IllegalArgumentException(token + " is not a control-flow directive");
		}
	}
}

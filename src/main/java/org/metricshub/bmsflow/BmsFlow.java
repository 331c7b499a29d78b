package org.metricshub.bmsflow;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Collections;
import java.util.List;
import org.metricshub.bmsflow.backend.ControlFlowResolver;
import org.metricshub.bmsflow.backend.Resolution;
import org.metricshub.bmsflow.backend.TreeResolver;
import org.metricshub.bmsflow.frontend.BmsLexer;
import org.metricshub.bmsflow.frontend.ControlFlowTreeBuilder;
import org.metricshub.bmsflow.frontend.Token;
import org.metricshub.bmsflow.frontend.ast.ControlFlowTree;
import org.metricshub.bmsflow.jrt.RandomSource;
import org.metricshub.bmsflow.util.BmsLogger;
import org.metricshub.bmsflow.util.ChartSource;
import org.metricshub.bmsflow.util.ResolverSettings;
import org.slf4j.Logger;

/**
 * Entry point into the lexing and control-flow resolution of BMS charts.
 * <p>
 * A resolution goes through the following steps:
 * <ul>
 * <li>Read the chart sources, producing a list of {@link Token}s.
 * <li>Resolve the control flow of the tokens, in a single pass with switch
 * fallthrough ({@link ControlFlowResolver}), or by building the control-flow
 * tree and evaluating it with isolated switch branches ({@link TreeResolver}).
 * </ul>
 * The result is the list of payload tokens a chart model can be built from,
 * with the diagnostics found on the way.
 * <p>
 * This class keeps no state between resolutions: the same instance may
 * resolve several charts at once when its {@link RandomSource} is thread safe.
 */
public class BmsFlow {

	private static final Logger LOG = BmsLogger.getLogger(BmsFlow.class);

	private final ResolverSettings settings;

	/**
	 * Create a new instance with the default settings.
	 */
	public BmsFlow() {
		this(new ResolverSettings());
	}

	/**
	 * Create a new instance with the default settings and the given random source.
	 *
	 * @param randomSource where {@code #RANDOM} and {@code #SWITCH} values come from
	 */
	public BmsFlow(RandomSource randomSource) {
		this(settingsWith(randomSource));
	}

	/**
	 * @param settings settings of the resolutions
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public BmsFlow(ResolverSettings settings) {
		this.settings = settings;
	}

	private static ResolverSettings settingsWith(RandomSource randomSource) {
		ResolverSettings settings = new ResolverSettings();
		settings.setRandomSource(randomSource);
		return settings;
	}

	/**
	 * Reads the tokens of the given chart sources.
	 *
	 * @param sources chart sources, read in order
	 * @return the tokens
	 * @throws IOException upon an IO error or a malformed directive
	 */
	public List<Token> lex(List<ChartSource> sources) throws IOException {
		return new BmsLexer(settings.isRelaxed()).tokenize(sources);
	}

	/**
	 * Resolves the control flow of tokens in a single pass.
	 *
	 * @param tokens chart tokens
	 * @return kept payload tokens and diagnostics
	 */
	public Resolution resolve(List<Token> tokens) {
		return new ControlFlowResolver(settings.getRandomSource()).resolve(tokens);
	}

	/**
	 * Builds the control-flow tree of tokens.
	 *
	 * @param tokens chart tokens
	 * @return the tree and its structural warnings
	 */
	public ControlFlowTree buildTree(List<Token> tokens) {
		return new ControlFlowTreeBuilder().build(tokens);
	}

	/**
	 * Resolves the control flow of tokens through their tree, with isolated
	 * switch branches.
	 *
	 * @param tokens chart tokens
	 * @return kept payload tokens and diagnostics
	 */
	public Resolution resolveTree(List<Token> tokens) {
		return new TreeResolver(settings.getRandomSource()).resolve(buildTree(tokens));
	}

	/**
	 * Reads and resolves a chart held in memory, following the settings.
	 *
	 * @param chart the chart text
	 * @return kept payload tokens and diagnostics
	 * @throws IOException for a malformed directive
	 */
	public Resolution resolve(String chart) throws IOException {
		return resolve(Collections.singletonList(ChartSource.fromString(chart)), false);
	}

	/**
	 * Reads and resolves the given chart sources following the settings, then
	 * prints the text of the kept tokens to the output stream of the settings,
	 * one per line.
	 *
	 * @param sources chart sources, read in order
	 * @return kept payload tokens and diagnostics
	 * @throws IOException upon an IO error or a malformed directive
	 */
	public Resolution invoke(List<ChartSource> sources) throws IOException {
		return resolve(sources, true);
	}

	private Resolution resolve(List<ChartSource> sources, boolean print) throws IOException {
		if (LOG.isDebugEnabled()) {
			LOG.debug("Resolving {} with settings:\n{}", sources, settings.toDescriptionString());
		}
		List<Token> tokens = lex(sources);
		Resolution resolution = settings.isTreeMode() ? resolveTree(tokens) : resolve(tokens);
		if (print) {
			PrintStream out = settings.getOutputStream();
			for (Token token : resolution.getTokens()) {
				out.println(Resolution.requirePayload(token).getText());
			}
			out.flush();
		}
		return resolution;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ResolverSettings getSettings() {
		return settings;
	}
}

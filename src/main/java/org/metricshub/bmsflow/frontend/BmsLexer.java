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

import java.io.IOException;
import java.io.LineNumberReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.bmsflow.frontend.ast.LexerException;
import org.metricshub.bmsflow.util.BmsLogger;
import org.metricshub.bmsflow.util.ChartSource;
import org.slf4j.Logger;

/**
 * Turns the lines of BMS charts into {@link Token}s.
 * <p>
 * One line gives at most one token:
 * <ul>
 * <li>{@code #XXXYY:data} is a {@link TokenType#MESSAGE}
 * <li>{@code #NAME args} is a control-flow directive when {@code NAME} is one
 * of the directive keywords, a {@link TokenType#HEADER} otherwise
 * <li>any other line is {@link TokenType#TEXT}, except comment lines
 * (starting with {@code *} or {@code //}) and blank lines which are skipped
 * </ul>
 * In relaxed mode, a few mistakes commonly found in published charts are
 * accepted: full-width {@code ＃}, {@code #RONDAM}, {@code #IFEND},
 * {@code #END IF}, and numbers glued to {@code #RANDOM} or {@code #IF}.
 */
public class BmsLexer {

	private static final Logger LOG = BmsLogger.getLogger(BmsLexer.class);

	private static final char FULLWIDTH_HASH = '＃';

	private static final Pattern MESSAGE = Pattern.compile("#([0-9A-Za-z]{3})([0-9A-Za-z]{2}):(.*)");
	private static final Pattern GLUED_NUMBER = Pattern.compile("(RANDOM|IF)([0-9]+)");
	private static final Pattern NUMBER = Pattern.compile("[0-9]+");

	private final boolean relaxed;

	private ChartSource source;

	/**
	 * Creates a relaxed lexer.
	 */
	public BmsLexer() {
		this(true);
	}

	/**
	 * @param relaxed whether common typos of published charts are accepted
	 */
	public BmsLexer(boolean relaxed) {
		this.relaxed = relaxed;
	}

	public boolean isRelaxed() {
		return relaxed;
	}

	/**
	 * Reads all the tokens of the given sources, in order.
	 *
	 * @param sources chart sources
	 * @return the tokens
	 * @throws IOException upon an IO error, or a {@link LexerException} for a malformed directive
	 */
	public List<Token> tokenize(List<ChartSource> sources) throws IOException {
		if (sources == null || sources.isEmpty()) {
			throw new IOException("No chart sources supplied");
		}
		List<Token> tokens = new ArrayList<Token>();
		for (ChartSource chartSource : sources) {
			tokens.addAll(tokenize(chartSource));
		}
		return tokens;
	}

	/**
	 * Reads all the tokens of a chart source, and closes its reader.
	 *
	 * @param chartSource the chart
	 * @return the tokens
	 * @throws IOException upon an IO error, or a {@link LexerException} for a malformed directive
	 */
	public List<Token> tokenize(ChartSource chartSource) throws IOException {
		this.source = chartSource;
		List<Token> tokens = new ArrayList<Token>();
		try (LineNumberReader reader = new LineNumberReader(chartSource.getReader())) {
			String line;
			while ((line = reader.readLine()) != null) {
				Token token = lexLine(line, reader.getLineNumber());
				if (token != null) {
					tokens.add(token);
				}
			}
		}
		LOG.debug("Read {} tokens from {}", tokens.size(), chartSource.getDescription());
		return Collections.unmodifiableList(tokens);
	}

	/**
	 * Convenience method for charts held in memory.
	 *
	 * @param chart the chart text
	 * @return the tokens
	 * @throws LexerException for a malformed directive
	 */
	public List<Token> tokenize(String chart) throws LexerException {
		try {
			return tokenize(ChartSource.fromString(chart));
		} catch (LexerException e) {
			throw e;
		} catch (IOException e) {
			// StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	private Token lexLine(String raw, int lineNumber) throws LexerException {
		int start = 0;
		while (start < raw.length() && Character.isWhitespace(raw.charAt(start))) {
			start++;
		}
		String line = raw.substring(start).trim();
		if (line.isEmpty() || line.startsWith("*") || line.startsWith("//")) {
			return null;
		}
		SourcePosition position = new SourcePosition(lineNumber, start + 1);
		if (relaxed && line.charAt(0) == FULLWIDTH_HASH) {
			line = "#" + line.substring(1);
		}
		if (line.charAt(0) != '#') {
			return Token.text(line, position);
		}

		Matcher message = MESSAGE.matcher(line);
		if (message.matches()) {
			String channel = (message.group(1) + message.group(2)).toUpperCase(Locale.ROOT);
			return Token.message(channel, message.group(3).trim(), position, line);
		}

		String body = line.substring(1);
		int space = indexOfWhitespace(body);
		String name = (space < 0 ? body : body.substring(0, space)).toUpperCase(Locale.ROOT);
		String args = space < 0 ? "" : body.substring(space).trim();

		if (relaxed) {
			if ("RONDAM".equals(name)) {
				name = "RANDOM";
			} else if ("IFEND".equals(name)) {
				name = "ENDIF";
			} else if ("END".equals(name) && firstWord(args).equalsIgnoreCase("IF")) {
				name = "ENDIF";
				args = args.substring(2).trim();
			} else {
				Matcher glued = GLUED_NUMBER.matcher(name);
				if (glued.matches()) {
					name = glued.group(1);
					args = glued.group(2);
				}
			}
		}

		TokenType type = TokenType.forKeyword(name);
		if (type == null) {
			return Token.header(name, args, position, line);
		}
		BigInteger value = null;
		if (type.hasNumericArgument()) {
			value = parseNumber(type, firstWord(args), lineNumber);
		}
		return Token.directive(type, value, position, line);
	}

	private BigInteger parseNumber(TokenType type, String arg, int lineNumber) throws LexerException {
		if (arg.isEmpty()) {
			throw new LexerException("#" + type.getKeyword() + " requires a number", source.getDescription(), lineNumber);
		}
		if (!NUMBER.matcher(arg).matches()) {
			throw new LexerException(
					"#" + type.getKeyword() + " argument is not a non-negative integer: " + arg,
					source.getDescription(),
					lineNumber);
		}
		return new BigInteger(arg);
	}

	private static String firstWord(String args) {
		int space = indexOfWhitespace(args);
		return space < 0 ? args : args.substring(0, space);
	}

	private static int indexOfWhitespace(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (Character.isWhitespace(s.charAt(i))) {
				return i;
			}
		}
		return -1;
	}
}

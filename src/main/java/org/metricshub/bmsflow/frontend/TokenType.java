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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds produced by the {@link BmsLexer}.
 * <p>
 * The first thirteen constants are the control-flow directives. The others
 * are payload kinds: the resolver never looks inside them.
 */
public enum TokenType {
	RANDOM("RANDOM", true),
	SETRANDOM("SETRANDOM", true),
	IF("IF", true),
	ELSEIF("ELSEIF", true),
	ELSE("ELSE", false),
	ENDIF("ENDIF", false),
	ENDRANDOM("ENDRANDOM", false),
	SWITCH("SWITCH", true),
	SETSWITCH("SETSWITCH", true),
	CASE("CASE", true),
	DEF("DEF", false),
	SKIP("SKIP", false),
	ENDSW("ENDSW", false),

	/** {@code #NAME args} */
	HEADER(null, false),
	/** {@code #XXXYY:data} */
	MESSAGE(null, false),
	/** Any other non-empty line. */
	TEXT(null, false);

	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<String, TokenType>();
		for (TokenType type : values()) {
			if (type.keyword != null) {
				keywords.put(type.keyword, type);
			}
		}
		keywords.put("ENDSWITCH", ENDSW);
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final String keyword;
	private final boolean numeric;

	TokenType(String keyword, boolean numeric) {
		this.keyword = keyword;
		this.numeric = numeric;
	}

	/**
	 * @return the directive name without the leading {@code #}, or {@code null}
	 *         for payload kinds
	 */
	public String getKeyword() {
		return keyword;
	}

	/**
	 * @return {@code true} when this directive takes a number argument
	 */
	public boolean hasNumericArgument() {
		return numeric;
	}

	public boolean isDirective() {
		return keyword != null;
	}

	/**
	 * @return {@code true} for the directives that open a random or switch scope
	 */
	public boolean isScopeHeader() {
		return this == RANDOM || this == SETRANDOM || this == SWITCH || this == SETSWITCH;
	}

	/**
	 * Looks up a directive by its upper-case name.
	 *
	 * @param name command name, without the leading {@code #}
	 * @return the directive, or {@code null} when {@code name} is not a control-flow keyword
	 */
	public static TokenType forKeyword(String name) {
		return KEYWORDS.get(name);
	}
}

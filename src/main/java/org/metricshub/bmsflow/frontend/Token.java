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

import java.math.BigInteger;
import java.util.Objects;

/**
 * One positioned unit of a BMS chart, as produced by the {@link BmsLexer}.
 * <p>
 * A token is either a control-flow directive ({@link TokenType#isDirective()})
 * or a payload token ({@code HEADER}, {@code MESSAGE}, {@code TEXT}) whose
 * content is opaque to the control-flow resolution. Instances are immutable.
 */
public final class Token {

	private final TokenType type;
	private final String name;
	private final String args;
	private final BigInteger value;
	private final SourcePosition position;
	private final String text;

	private Token(TokenType type, String name, String args, BigInteger value, SourcePosition position, String text) {
		this.type = Objects.requireNonNull(type, "type");
		this.name = name;
		this.args = args == null ? "" : args;
		this.value = value;
		this.position = position == null ? SourcePosition.NONE : position;
		this.text = text == null ? render(type, name, this.args, value) : text;
	}

	/**
	 * Creates a directive without argument ({@code #ELSE}, {@code #ENDIF},
	 * {@code #SKIP}, ...).
	 *
	 * @param type a directive type
	 * @param position where the directive was read
	 * @return the new token
	 */
	public static Token directive(TokenType type, SourcePosition position) {
		return directive(type, null, position, null);
	}

	/**
	 * Creates a directive with its number argument.
	 *
	 * @param type a directive type
	 * @param value the argument, {@code null} for directives without argument
	 * @param position where the directive was read
	 * @return the new token
	 */
	public static Token directive(TokenType type, BigInteger value, SourcePosition position) {
		return directive(type, value, position, null);
	}

	static Token directive(TokenType type, BigInteger value, SourcePosition position, String text) {
		if (!type.isDirective()) {
			throw new IllegalArgumentException(type + " is not a control-flow directive");
		}
		if (type.hasNumericArgument()) {
			Objects.requireNonNull(value, "#" + type.getKeyword() + " requires a value");
			if (value.signum() < 0) {
				throw new IllegalArgumentException("#" + type.getKeyword() + " value must not be negative: " + value);
			}
		} else if (value != null) {
			throw new IllegalArgumentException("#" + type.getKeyword() + " takes no value");
		}
		return new Token(type, type.getKeyword(), value == null ? "" : value.toString(), value, position, text);
	}

	/**
	 * Creates a {@code #NAME args} payload token.
	 *
	 * @param name command name, without {@code #}
	 * @param args everything after the name, trimmed
	 * @param position where the command was read
	 * @return the new token
	 */
	public static Token header(String name, String args, SourcePosition position) {
		return header(name, args, position, null);
	}

	static Token header(String name, String args, SourcePosition position, String text) {
		return new Token(TokenType.HEADER, name, args, null, position, text);
	}

	/**
	 * Creates a {@code #XXXYY:data} payload token.
	 *
	 * @param trackAndChannel the five characters between {@code #} and {@code :}
	 * @param data the object sequence after {@code :}
	 * @param position where the message was read
	 * @return the new token
	 */
	public static Token message(String trackAndChannel, String data, SourcePosition position) {
		return message(trackAndChannel, data, position, null);
	}

	static Token message(String trackAndChannel, String data, SourcePosition position, String text) {
		return new Token(TokenType.MESSAGE, trackAndChannel, data, null, position, text);
	}

	/**
	 * Creates a payload token for a line that is not a command.
	 *
	 * @param line the line content, trimmed
	 * @param position where the line was read
	 * @return the new token
	 */
	public static Token text(String line, SourcePosition position) {
		return new Token(TokenType.TEXT, null, line, null, position, line);
	}

	public TokenType getType() {
		return type;
	}

	public boolean isDirective() {
		return type.isDirective();
	}

	/**
	 * @return the upper-case command name (directive keyword, header name, or
	 *         {@code XXXYY} of a message); {@code null} for {@code TEXT}
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the arguments of the command, or the whole line for {@code TEXT}
	 */
	public String getArgs() {
		return args;
	}

	/**
	 * @return the number argument of {@code #RANDOM}, {@code #IF}, {@code #CASE}...
	 *         or {@code null}
	 */
	public BigInteger getValue() {
		return value;
	}

	public SourcePosition getPosition() {
		return position;
	}

	/**
	 * @return the source text this token was read from, or a canonical rendering
	 *         for tokens built programmatically
	 */
	public String getText() {
		return text;
	}

	private static String render(TokenType type, String name, String args, BigInteger value) {
		switch (type) {
		case TEXT:
			return args;
		case MESSAGE:
			return "#" + name + ":" + args;
		default:
			if (value != null) {
				return "#" + name + " " + value;
			}
			return args.isEmpty() ? "#" + name : "#" + name + " " + args;
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Token)) {
			return false;
		}
		Token other = (Token) obj;
		return type == other.type
				&& Objects.equals(name, other.name)
				&& args.equals(other.args)
				&& Objects.equals(value, other.value)
				&& position.equals(other.position);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, name, args, value, position);
	}

	@Override
	public String toString() {
		return render(type, name, args, value);
	}
}

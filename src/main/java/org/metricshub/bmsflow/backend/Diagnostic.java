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

import java.util.Objects;
import org.metricshub.bmsflow.frontend.SourcePosition;

/**
 * A non-fatal problem found at a given position of the chart.
 */
public final class Diagnostic {

	private final WarningKind kind;
	private final SourcePosition position;

	public Diagnostic(WarningKind kind, SourcePosition position) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.position = position == null ? SourcePosition.NONE : position;
	}

	public WarningKind getKind() {
		return kind;
	}

	public SourcePosition getPosition() {
		return position;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Diagnostic)) {
			return false;
		}
		Diagnostic other = (Diagnostic) obj;
		return kind == other.kind && position.equals(other.position);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, position);
	}

	@Override
	public String toString() {
		return position + ": " + kind.getMessage() + " [" + kind + "]";
	}
}

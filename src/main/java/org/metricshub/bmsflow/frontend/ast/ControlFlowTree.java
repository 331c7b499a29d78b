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
import org.metricshub.bmsflow.backend.Diagnostic;

/**
 * The control-flow tree of a chart, as built by
 * {@link org.metricshub.bmsflow.frontend.ControlFlowTreeBuilder}, with the
 * structural problems found while building it.
 */
public final class ControlFlowTree {

	private final List<Unit> units;
	private final List<Diagnostic> diagnostics;

	public ControlFlowTree(List<Unit> units, List<Diagnostic> diagnostics) {
		this.units = Collections.unmodifiableList(new ArrayList<Unit>(units));
		this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
	}

	/**
	 * @return top-level units, in source order
	 */
	public List<Unit> getUnits() {
		return units;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}
}

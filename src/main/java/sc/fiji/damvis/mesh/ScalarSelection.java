/*
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.damvis.mesh;

import java.util.Objects;

/**
 * The scalar array chosen for display: a name tagged with the granularity
 * (point or cell data) it is defined at.
 */
public final class ScalarSelection {

	public enum Association {
		POINT, CELL
	}

	private final String name;
	private final Association association;

	private ScalarSelection(final String name, final Association association) {
		if (name == null || name.isBlank()) throw new IllegalArgumentException("Scalar name cannot be empty");
		this.name = name;
		this.association = Objects.requireNonNull(association);
	}

	public static ScalarSelection point(final String name) {
		return new ScalarSelection(name, Association.POINT);
	}

	public static ScalarSelection cell(final String name) {
		return new ScalarSelection(name, Association.CELL);
	}

	public static ScalarSelection of(final String name, final boolean cellData) {
		return (cellData) ? cell(name) : point(name);
	}

	public String getName() {
		return name;
	}

	public Association getAssociation() {
		return association;
	}

	public boolean isCellData() {
		return association == Association.CELL;
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof ScalarSelection)) return false;
		final ScalarSelection other = (ScalarSelection) o;
		return name.equals(other.name) && association == other.association;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, association);
	}

	@Override
	public String toString() {
		return name + " (" + association.name().toLowerCase() + " data)";
	}

}

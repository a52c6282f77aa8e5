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

package sc.fiji.damvis.render;

import org.scijava.util.ColorRGB;

/**
 * A control point of a {@link ColorTransferFunction}: a scalar value and a
 * color with channels in [0, 1].
 */
public record ColorPoint(double value, double red, double green, double blue) {

	/** @return the 8-bit representation of this point's color */
	public ColorRGB toColorRGB() {
		return new ColorRGB(to8bit(red), to8bit(green), to8bit(blue));
	}

	static int to8bit(final double channel) {
		return (int) Math.round(Math.max(0, Math.min(1, channel)) * 255);
	}

}

/*-
 * #%L
 * Software for the reconstruction of digital surface models
 * from multiple stereo acquisitions.
 * %%
 * Copyright (C) 2012 - 2025 Multiview Reconstruction developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.mvdsm.data;

import java.io.Serializable;

public class DisparityRange implements Serializable
{
	private static final long serialVersionUID = 2979036046546785425L;

	final double min, max;

	public DisparityRange( final double min, final double max )
	{
		this.min = min;
		this.max = max;
	}

	public double getMin() { return min; }
	public double getMax() { return max; }
	public double size() { return max - min; }

	@Override
	public String toString() { return String.format( "[%.3f pix., %.3f pix.]", min, max ); }
}

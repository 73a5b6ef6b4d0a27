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
package net.preibisch.mvdsm.process.boundingbox;

import org.locationtech.jts.geom.Geometry;

import net.preibisch.mvdsm.data.Extent;

/**
 * Terrain-space footprint of one pair in the output crs.
 */
public class PairFootprint
{
	final int pairIndex;
	final Extent envelope; // epipolar corners projected at both disparity bounds
	final Geometry footprint; // envelopes intersection in the output crs
	final Extent box; // envelope intersected with the footprint, snapped to the resolution

	public PairFootprint( final int pairIndex, final Extent envelope, final Geometry footprint, final Extent box )
	{
		this.pairIndex = pairIndex;
		this.envelope = envelope;
		this.footprint = footprint;
		this.box = box;
	}

	public int getPairIndex() { return pairIndex; }
	public Extent getEnvelope() { return envelope; }
	public Geometry getFootprint() { return footprint; }
	public Extent getBox() { return box; }

	/**
	 * @return area of the envelope, before it is cut by the footprint
	 */
	public double getTerrainArea() { return envelope.area(); }
}

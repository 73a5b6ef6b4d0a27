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
package net.preibisch.mvdsm.geometry;

import java.io.Serializable;

import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TriangulatedPoints;

/**
 * Epipolar geometry, dense correlation and triangulation of a stereo pair. Implementations
 * are shipped to workers and must therefore be serializable.
 *
 * @author Stephan Preibisch
 */
public interface StereoGeometry extends Serializable
{
	/**
	 * Projects epipolar image positions observed at a constant disparity to terrain coordinates.
	 *
	 * @param pair - the stereo pair
	 * @param epipolarPositions - positions in the epipolar image, [n][2] as (x, y)
	 * @param disparity - disparity in pixels
	 * @param crs - target coordinate reference system, e.g. "EPSG:32631"
	 * @return the terrain positions, [n][2] as (x, y)
	 */
	public double[][] project( PairConfiguration pair, double[][] epipolarPositions, double disparity, String crs );

	/**
	 * Correlates and triangulates one epipolar tile.
	 *
	 * @param pair - the stereo pair
	 * @param epipolarTile - region of the epipolar image
	 * @param dispMin - lower disparity bound of the search
	 * @param dispMax - upper disparity bound of the search
	 * @param options - output crs, altitude reference and processing flags
	 * @return point cloud(s) of the tile
	 */
	public TriangulatedPoints generatePoints( PairConfiguration pair, Tile epipolarTile, double dispMin, double dispMax, PointGenerationOptions options );
}

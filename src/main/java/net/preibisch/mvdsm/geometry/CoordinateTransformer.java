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

import org.locationtech.jts.geom.Geometry;

/**
 * Reprojection between named coordinate reference systems ("EPSG:nnnn").
 */
public interface CoordinateTransformer
{
	public double[] transform( double x, double y, String sourceCrs, String targetCrs );

	/**
	 * @return a reprojected copy of the geometry (vertices only, edges are not densified)
	 */
	public Geometry transform( Geometry geometry, String sourceCrs, String targetCrs );
}

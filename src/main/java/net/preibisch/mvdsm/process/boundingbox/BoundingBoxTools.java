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

import java.util.Collection;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import net.preibisch.mvdsm.data.Extent;

public class BoundingBoxTools
{
	public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

	// tolerance (in pixels) for values that are already on the grid
	public static double snapTolerance = 1e-6;

	/**
	 * Snaps an extent outwards to multiples of the resolution, so pixel edges of different pairs align.
	 *
	 * @param extent - the extent
	 * @param resolution - grid spacing
	 * @return the snapped extent
	 */
	public static Extent snapToGrid( final Extent extent, final double resolution )
	{
		return new Extent(
				Math.floor( extent.getXMin() / resolution + snapTolerance ) * resolution,
				Math.floor( extent.getYMin() / resolution + snapTolerance ) * resolution,
				Math.ceil( extent.getXMax() / resolution - snapTolerance ) * resolution,
				Math.ceil( extent.getYMax() / resolution - snapTolerance ) * resolution,
				extent.getCrs() );
	}

	public static Extent union( final Collection< Extent > extents )
	{
		Extent union = null;

		for ( final Extent e : extents )
			union = ( union == null ) ? e : union.union( e );

		return union;
	}

	/**
	 * @param positions - [n][2] points
	 * @param crs - their crs
	 * @return the envelope of all points
	 */
	public static Extent envelope( final double[][] positions, final String crs )
	{
		double xmin = Double.MAX_VALUE, ymin = Double.MAX_VALUE;
		double xmax = -Double.MAX_VALUE, ymax = -Double.MAX_VALUE;

		for ( final double[] p : positions )
		{
			xmin = Math.min( xmin, p[ 0 ] );
			ymin = Math.min( ymin, p[ 1 ] );
			xmax = Math.max( xmax, p[ 0 ] );
			ymax = Math.max( ymax, p[ 1 ] );
		}

		return new Extent( xmin, ymin, xmax, ymax, crs );
	}

	public static Polygon toPolygon( final Extent extent )
	{
		return GEOMETRY_FACTORY.createPolygon( new Coordinate[] {
				new Coordinate( extent.getXMin(), extent.getYMin() ),
				new Coordinate( extent.getXMax(), extent.getYMin() ),
				new Coordinate( extent.getXMax(), extent.getYMax() ),
				new Coordinate( extent.getXMin(), extent.getYMax() ),
				new Coordinate( extent.getXMin(), extent.getYMin() ) } );
	}

	/**
	 * @param geometry - a polygon
	 * @param crs - its crs
	 * @return the envelope, or null if the geometry is empty or degenerate
	 */
	public static Extent toExtent( final Geometry geometry, final String crs )
	{
		if ( geometry == null || geometry.isEmpty() )
			return null;

		final Envelope e = geometry.getEnvelopeInternal();

		if ( !( e.getMinX() < e.getMaxX() ) || !( e.getMinY() < e.getMaxY() ) )
			return null;

		return new Extent( e.getMinX(), e.getMinY(), e.getMaxX(), e.getMaxY(), crs );
	}

	/**
	 * @param extent - the extent
	 * @param resolution - pixel size
	 * @return size in pixels as { width, height }
	 */
	public static long[] pixelSize( final Extent extent, final double resolution )
	{
		return new long[] {
				Math.round( extent.width() / resolution ),
				Math.round( extent.height() / resolution ) };
	}

	public static String printExtent( final Extent extent )
	{
		return String.format( "[%.3f, %.3f] x [%.3f, %.3f] (%.3f x %.3f)%s",
				extent.getXMin(), extent.getXMax(), extent.getYMin(), extent.getYMax(),
				extent.width(), extent.height(), extent.getCrs() == null ? "" : " " + extent.getCrs() );
	}
}

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
import java.util.Objects;

import net.imglib2.RealInterval;
import net.imglib2.RealPositionable;

/**
 * Axis-aligned rectangle (xmin, ymin, xmax, ymax) in a named coordinate
 * reference system. The crs may be null if it is not resolved yet.
 *
 * @author Stephan Preibisch
 */
public class Extent implements RealInterval, Serializable
{
	private static final long serialVersionUID = -2212393851634541036L;

	protected final double xmin, ymin, xmax, ymax;
	protected final String crs;

	public Extent( final double xmin, final double ymin, final double xmax, final double ymax, final String crs )
	{
		if ( !( xmin < xmax ) || !( ymin < ymax ) )
			throw new IllegalArgumentException(
					"Invalid extent [" + xmin + ", " + xmax + "] x [" + ymin + ", " + ymax + "], min must be smaller than max." );

		this.xmin = xmin;
		this.ymin = ymin;
		this.xmax = xmax;
		this.ymax = ymax;
		this.crs = crs;
	}

	public Extent( final double xmin, final double ymin, final double xmax, final double ymax )
	{
		this( xmin, ymin, xmax, ymax, null );
	}

	public double getXMin() { return xmin; }
	public double getYMin() { return ymin; }
	public double getXMax() { return xmax; }
	public double getYMax() { return ymax; }
	public String getCrs() { return crs; }

	public double width() { return xmax - xmin; }
	public double height() { return ymax - ymin; }
	public double area() { return width() * height(); }

	public double[] toArray() { return new double[] { xmin, ymin, xmax, ymax }; }

	/**
	 * @param other - another extent
	 * @return true if the open interiors of both extents overlap (touching edges do not count)
	 */
	public boolean intersects( final Extent other )
	{
		return xmin < other.xmax && other.xmin < xmax && ymin < other.ymax && other.ymin < ymax;
	}

	/**
	 * @param other - another extent
	 * @return the overlapping extent, or null if the interiors do not overlap
	 */
	public Extent intersection( final Extent other )
	{
		if ( !intersects( other ) )
			return null;

		return new Extent(
				Math.max( xmin, other.xmin ),
				Math.max( ymin, other.ymin ),
				Math.min( xmax, other.xmax ),
				Math.min( ymax, other.ymax ),
				crs );
	}

	public Extent union( final Extent other )
	{
		return new Extent(
				Math.min( xmin, other.xmin ),
				Math.min( ymin, other.ymin ),
				Math.max( xmax, other.xmax ),
				Math.max( ymax, other.ymax ),
				crs );
	}

	public Extent expand( final double margin )
	{
		return new Extent( xmin - margin, ymin - margin, xmax + margin, ymax + margin, crs );
	}

	public boolean contains( final double x, final double y )
	{
		return x >= xmin && x <= xmax && y >= ymin && y <= ymax;
	}

	@Override
	public int numDimensions() { return 2; }

	@Override
	public double realMin( final int d ) { return d == 0 ? xmin : ymin; }

	@Override
	public void realMin( final double[] min )
	{
		min[ 0 ] = xmin;
		min[ 1 ] = ymin;
	}

	@Override
	public void realMin( final RealPositionable min )
	{
		min.setPosition( xmin, 0 );
		min.setPosition( ymin, 1 );
	}

	@Override
	public double realMax( final int d ) { return d == 0 ? xmax : ymax; }

	@Override
	public void realMax( final double[] max )
	{
		max[ 0 ] = xmax;
		max[ 1 ] = ymax;
	}

	@Override
	public void realMax( final RealPositionable max )
	{
		max.setPosition( xmax, 0 );
		max.setPosition( ymax, 1 );
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof Extent ) )
			return false;

		final Extent e = ( Extent ) o;

		return Double.compare( xmin, e.xmin ) == 0 && Double.compare( ymin, e.ymin ) == 0 &&
				Double.compare( xmax, e.xmax ) == 0 && Double.compare( ymax, e.ymax ) == 0 &&
				Objects.equals( crs, e.crs );
	}

	@Override
	public int hashCode() { return Objects.hash( xmin, ymin, xmax, ymax, crs ); }

	@Override
	public String toString()
	{
		return "[" + xmin + ", " + xmax + "] x [" + ymin + ", " + ymax + "]" + ( crs == null ? "" : " (" + crs + ")" );
	}
}

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

import java.util.concurrent.atomic.AtomicInteger;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.data.PointCloud;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TriangulatedPoints;

/**
 * Stereo geometry for tests: the epipolar image maps linearly to the terrain,
 * x = ox + col * sx + 0.1 * d and y = oy + ( height - row ) * sy. Geographic requests
 * (EPSG:4326) get lon = 3 + x * 1e-5, lat = 45 + y * 1e-5. Every epipolar pixel yields one
 * point at its center with z = 100 + 0.01 * col.
 */
public class SyntheticStereoGeometry implements StereoGeometry
{
	private static final long serialVersionUID = 1L;

	public static final String CRS = "EPSG:32631";

	// static so it also counts calls made on deserialized copies
	public static final AtomicInteger GENERATE_CALLS = new AtomicInteger();

	int failRow = -1, failCol = -1;
	boolean malformed = false;
	long sleepMillis = 0;

	public SyntheticStereoGeometry failOnTile( final int row, final int col ) { this.failRow = row; this.failCol = col; return this; }
	public SyntheticStereoGeometry malformed() { this.malformed = true; return this; }
	public SyntheticStereoGeometry sleep( final long millis ) { this.sleepMillis = millis; return this; }

	/**
	 * 100x100 epipolar pixels, spacing 0.5, disparity [-5, 5], footprint [ox, ox + 50] x [oy, oy + 50].
	 */
	public static PairConfiguration pair( final String id, final double ox, final double oy )
	{
		return new PairConfiguration( id, id + "_left.tif", id + "_right.tif", 100, 100, -5, 5, 1.0, square( ox, oy, ox + 50, oy + 50 ), CRS )
				.setEpipolarGrid( new double[] { ox, oy }, new double[] { 0.5, 0.5 } );
	}

	public static Polygon square( final double xmin, final double ymin, final double xmax, final double ymax )
	{
		return new GeometryFactory().createPolygon( new Coordinate[] {
				new Coordinate( xmin, ymin ),
				new Coordinate( xmax, ymin ),
				new Coordinate( xmax, ymax ),
				new Coordinate( xmin, ymax ),
				new Coordinate( xmin, ymin ) } );
	}

	@Override
	public double[][] project( final PairConfiguration pair, final double[][] epipolarPositions, final double disparity, final String crs )
	{
		final double[][] result = new double[ epipolarPositions.length ][];

		for ( int i = 0; i < epipolarPositions.length; ++i )
		{
			final double x = terrainX( pair, epipolarPositions[ i ][ 0 ], disparity );
			final double y = terrainY( pair, epipolarPositions[ i ][ 1 ] );

			if ( UtmZones.WGS84.equals( crs ) )
				result[ i ] = new double[] { 3 + x * 1e-5, 45 + y * 1e-5 };
			else
				result[ i ] = new double[] { x, y };
		}

		return result;
	}

	@Override
	public TriangulatedPoints generatePoints( final PairConfiguration pair, final Tile epipolarTile, final double dispMin, final double dispMax, final PointGenerationOptions options )
	{
		GENERATE_CALLS.incrementAndGet();

		if ( epipolarTile.getRow() == failRow && epipolarTile.getCol() == failCol )
			throw new RuntimeException( "correlation failed" );

		if ( sleepMillis > 0 )
		{
			try
			{
				Thread.sleep( sleepMillis );
			}
			catch ( final InterruptedException e )
			{
				Thread.currentThread().interrupt();
				throw new RuntimeException( e );
			}
		}

		final Extent e = epipolarTile.getExtent();
		final int c0 = (int)Math.round( e.getXMin() ), c1 = (int)Math.round( e.getXMax() );
		final int r0 = (int)Math.round( e.getYMin() ), r1 = (int)Math.round( e.getYMax() );
		final int n = ( c1 - c0 ) * ( r1 - r0 );
		final int numBands = pair.getNumColorBands();

		final double[] x = new double[ n ], y = new double[ n ], z = new double[ n ];
		final float[][] color = new float[ numBands ][ n ];
		final int[] mask = options.addMask() ? new int[ n ] : null;

		int i = 0;

		for ( int row = r0; row < r1; ++row )
			for ( int col = c0; col < c1; ++col )
			{
				x[ i ] = terrainX( pair, col + 0.5, 0 );
				y[ i ] = terrainY( pair, row + 0.5 );
				z[ i ] = 100 + 0.01 * col;

				if ( options.getElevationReference() != null )
					z[ i ] -= options.getElevationReference().offset( x[ i ], y[ i ] );

				for ( int b = 0; b < numBands; ++b )
					color[ b ][ i ] = col;

				if ( mask != null )
					mask[ i ] = 1;

				++i;
			}

		final PointCloud reference = malformed ?
				new PointCloud( x, y, new double[ Math.max( 0, n - 1 ) ], color, mask ) :
				new PointCloud( x, y, z, color, mask );

		return new TriangulatedPoints( reference );
	}

	protected static double terrainX( final PairConfiguration pair, final double col, final double disparity )
	{
		return pair.getEpipolarOrigin()[ 0 ] + col * pair.getEpipolarSpacing()[ 0 ] + 0.1 * disparity;
	}

	protected static double terrainY( final PairConfiguration pair, final double row )
	{
		return pair.getEpipolarOrigin()[ 1 ] + ( pair.getEpipolarSizeY() - row ) * pair.getEpipolarSpacing()[ 1 ];
	}
}

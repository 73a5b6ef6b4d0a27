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
package net.preibisch.mvdsm.process.pointcloud;

import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import net.preibisch.mvdsm.data.PointCloud;
import net.preibisch.mvdsm.data.TriangulatedPoints;

/**
 * Stores point clouds in an N5 container. A cloud is a group with the attributes numPoints,
 * numBands and hasMask and (if not empty) a FLOAT64 dataset "columns" of size [numColumns, numPoints]
 * holding x, y, z, the color bands and the mask of each point.
 */
public class PointCloudIO
{
	public static final String COLUMNS = "columns";
	public static final String REFERENCE = "reference";
	public static final String SECONDARY = "secondary";

	public static int defaultBlockSize = 300_000;

	/**
	 * @param n5Writer - the container
	 * @param groupPath - group of the unit, e.g. "pairId/points/hash"
	 * @param points - reference and (optional) secondary points
	 */
	public static void saveTriangulated( final N5Writer n5Writer, final String groupPath, final TriangulatedPoints points )
	{
		save( n5Writer, groupPath + "/" + REFERENCE, points.getReference() );

		if ( points.hasSecondary() )
			save( n5Writer, groupPath + "/" + SECONDARY, points.getSecondary() );
	}

	public static TriangulatedPoints loadTriangulated( final N5Reader n5Reader, final String groupPath )
	{
		final PointCloud reference = load( n5Reader, groupPath + "/" + REFERENCE );

		if ( n5Reader.exists( groupPath + "/" + SECONDARY ) )
			return new TriangulatedPoints( reference, load( n5Reader, groupPath + "/" + SECONDARY ) );
		else
			return new TriangulatedPoints( reference );
	}

	public static void save( final N5Writer n5Writer, final String groupPath, final PointCloud cloud )
	{
		final int n = cloud.size();
		final int numBands = cloud.numBands();
		final int numColumns = numColumns( numBands, cloud.hasMask() );

		n5Writer.createGroup( groupPath );
		n5Writer.setAttribute( groupPath, "numPoints", n );
		n5Writer.setAttribute( groupPath, "numBands", numBands );
		n5Writer.setAttribute( groupPath, "hasMask", cloud.hasMask() );

		if ( n == 0 )
			return;

		// numColumns x N array, one row per point
		final double[] table = new double[ n * numColumns ];

		for ( int i = 0; i < n; ++i )
		{
			int j = i * numColumns;

			table[ j++ ] = cloud.getX()[ i ];
			table[ j++ ] = cloud.getY()[ i ];
			table[ j++ ] = cloud.getZ()[ i ];

			for ( int b = 0; b < numBands; ++b )
				table[ j++ ] = cloud.getColor()[ b ][ i ];

			if ( cloud.hasMask() )
				table[ j ] = cloud.getMask()[ i ];
		}

		N5Utils.save(
				ArrayImgs.doubles( table, numColumns, n ),
				n5Writer,
				groupPath + "/" + COLUMNS,
				new int[] { numColumns, Math.min( n, defaultBlockSize ) },
				new GzipCompression() );
	}

	public static PointCloud load( final N5Reader n5Reader, final String groupPath )
	{
		final int n = n5Reader.getAttribute( groupPath, "numPoints", Integer.class );
		final int numBands = n5Reader.getAttribute( groupPath, "numBands", Integer.class );
		final boolean hasMask = n5Reader.getAttribute( groupPath, "hasMask", Boolean.class );

		if ( n == 0 )
			return PointCloud.empty( numBands, hasMask );

		final RandomAccessibleInterval< DoubleType > table = N5Utils.open( n5Reader, groupPath + "/" + COLUMNS );

		if ( table.dimension( 0 ) != numColumns( numBands, hasMask ) || table.dimension( 1 ) != n )
			throw new IllegalStateException( "Point table of '" + groupPath + "' does not match its attributes." );

		final double[] x = new double[ n ], y = new double[ n ], z = new double[ n ];
		final float[][] color = new float[ numBands ][ n ];
		final int[] mask = hasMask ? new int[ n ] : null;

		final Cursor< DoubleType > cursor = Views.flatIterable( table ).cursor();

		for ( int i = 0; i < n; ++i )
		{
			x[ i ] = cursor.next().get();
			y[ i ] = cursor.next().get();
			z[ i ] = cursor.next().get();

			for ( int b = 0; b < numBands; ++b )
				color[ b ][ i ] = (float)cursor.next().get();

			if ( hasMask )
				mask[ i ] = (int)cursor.next().get();
		}

		return new PointCloud( x, y, z, color, mask );
	}

	/**
	 * @param n5Writer - the container
	 * @param groupPath - the stored cloud
	 * @return true if it was removed
	 */
	public static boolean remove( final N5Writer n5Writer, final String groupPath )
	{
		return n5Writer.remove( groupPath );
	}

	protected static int numColumns( final int numBands, final boolean hasMask )
	{
		return 3 + numBands + ( hasMask ? 1 : 0 );
	}
}

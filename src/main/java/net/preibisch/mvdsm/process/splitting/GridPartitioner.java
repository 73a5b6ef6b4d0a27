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
package net.preibisch.mvdsm.process.splitting;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TileGrid;

/**
 * Splits a 2d extent into a regular grid of tiles. Tiles are generated in row-major order starting
 * at (xmin, ymin); the last tile of each row and column is clipped to the extent, so tiles partition
 * the extent without gaps and overlaps.
 *
 * @author Stephan Preibisch
 */
public class GridPartitioner
{
	// relative tolerance below which a remainder does not open another row/column
	public static double stepTolerance = 1e-9;

	/**
	 * @param extent - the extent to split
	 * @param tileWidth - step in x
	 * @param tileHeight - step in y
	 * @return all tiles in row-major order
	 */
	public static List< Tile > partition( final Extent extent, final double tileWidth, final double tileHeight )
	{
		return grid( extent, tileWidth, tileHeight ).getTiles();
	}

	public static TileGrid grid( final Extent extent, final double tileWidth, final double tileHeight )
	{
		if ( !( tileWidth > 0 ) || !( tileHeight > 0 ) )
			throw new IllegalArgumentException( "Tile size must be positive, got " + tileWidth + "x" + tileHeight );

		final int cols = numSteps( extent.width(), tileWidth );
		final int rows = numSteps( extent.height(), tileHeight );

		final double[] xs = boundaries( extent.getXMin(), extent.getXMax(), tileWidth, cols );
		final double[] ys = boundaries( extent.getYMin(), extent.getYMax(), tileHeight, rows );

		final ArrayList< Tile > tiles = new ArrayList<>( rows * cols );

		for ( int row = 0; row < rows; ++row )
			for ( int col = 0; col < cols; ++col )
				tiles.add( new Tile( new Extent( xs[ col ], ys[ row ], xs[ col + 1 ], ys[ row + 1 ], extent.getCrs() ), row, col ) );

		return new TileGrid( extent, tileWidth, tileHeight, rows, cols, tiles );
	}

	/**
	 * @param length - length of the extent along one axis
	 * @param step - tile size along that axis
	 * @return number of tiles needed to cover the length
	 */
	public static int numSteps( final double length, final double step )
	{
		int n = Math.max( 1, (int)Math.ceil( length / step ) );

		// e.g. 150 / 0.3 may end up slightly above the exact quotient
		while ( n > 1 && ( n - 1 ) * step >= length - stepTolerance * step )
			--n;

		return n;
	}

	protected static double[] boundaries( final double min, final double max, final double step, final int n )
	{
		final double[] b = new double[ n + 1 ];

		for ( int i = 0; i < n; ++i )
			b[ i ] = min + i * step;

		b[ n ] = max;

		return b;
	}

	/**
	 * @param extent - tile bounds
	 * @return stable identifier of the bounds (md5 of a fixed-precision encoding)
	 */
	public static String regionHash( final Extent extent )
	{
		return regionHash( extent.getXMin(), extent.getYMin(), extent.getXMax(), extent.getYMax() );
	}

	public static String regionHash( final double xmin, final double ymin, final double xmax, final double ymax )
	{
		// + 0.0 maps -0.0 to 0.0
		final String encoded = String.format( Locale.ROOT, "%.10f_%.10f_%.10f_%.10f", xmin + 0.0, ymin + 0.0, xmax + 0.0, ymax + 0.0 );

		try
		{
			final byte[] digest = MessageDigest.getInstance( "MD5" ).digest( encoded.getBytes( StandardCharsets.UTF_8 ) );
			final StringBuilder hex = new StringBuilder( 2 * digest.length );

			for ( final byte b : digest )
				hex.append( String.format( "%02x", b ) );

			return hex.toString();
		}
		catch ( final NoSuchAlgorithmException e )
		{
			throw new IllegalStateException( "MD5 is not available: " + e, e );
		}
	}
}

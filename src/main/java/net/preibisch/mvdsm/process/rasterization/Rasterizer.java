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
package net.preibisch.mvdsm.process.rasterization;

import java.util.Arrays;
import java.util.List;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PointCloud;
import net.preibisch.mvdsm.data.Tile;

/**
 * Gaussian-weighted gridding of points. Every point contributes to all cells within radius pixels
 * of the cell it falls into, weighted by exp( -d^2 / (2 sigma^2) ) where d is the distance between
 * the point and the cell center. Elevation and color are weighted means, the mask value is taken
 * from the point with the largest weight. Cells without contribution are set to no-data.
 *
 * @author Stephan Preibisch
 */
public class Rasterizer
{
	public static RasterTile rasterize( final List< PointCloud > clouds, final Tile tile, final RasterizationParameters params )
	{
		final Extent extent = tile.getExtent();
		final double res = params.getResolution();

		final int w = Math.max( 1, (int)Math.round( extent.width() / res ) );
		final int h = Math.max( 1, (int)Math.round( extent.height() / res ) );
		final int numPixels = w * h;

		final double xStart = extent.getXMin();
		final double yStart = extent.getYMax();

		final int radius = params.getRadius();
		final double twoSigmaSq = 2 * params.getSigma() * params.getSigma();
		final int numBands = params.getNumBands();
		final boolean stats = params.writeStats();

		final double[] sumW = new double[ numPixels ];
		final double[] sumWZ = new double[ numPixels ];
		final double[][] sumWColor = new double[ numBands ][ numPixels ];
		final double[] maxW = params.writeMask() ? new double[ numPixels ] : null;
		final int[] mask = params.writeMask() ? new int[ numPixels ] : null;

		final int[] nPts = stats ? new int[ numPixels ] : null;
		final int[] pointsInCell = stats ? new int[ numPixels ] : null;
		final double[] sumZ = stats ? new double[ numPixels ] : null;
		final double[] sumZ2 = stats ? new double[ numPixels ] : null;

		if ( mask != null )
			Arrays.fill( mask, params.getMaskNoData() );

		for ( final PointCloud cloud : clouds )
		{
			final double[] xs = cloud.getX();
			final double[] ys = cloud.getY();
			final double[] zs = cloud.getZ();
			final int bands = Math.min( numBands, cloud.numBands() );

			for ( int p = 0; p < cloud.size(); ++p )
			{
				final double z = zs[ p ];

				if ( Double.isNaN( z ) )
					continue;

				final int col = (int)Math.floor( ( xs[ p ] - xStart ) / res );
				final int row = (int)Math.floor( ( yStart - ys[ p ] ) / res );

				if ( col < -radius || col >= w + radius || row < -radius || row >= h + radius )
					continue;

				if ( stats && col >= 0 && col < w && row >= 0 && row < h )
					++pointsInCell[ row * w + col ];

				for ( int r = Math.max( 0, row - radius ); r <= Math.min( h - 1, row + radius ); ++r )
					for ( int c = Math.max( 0, col - radius ); c <= Math.min( w - 1, col + radius ); ++c )
					{
						final double dx = xs[ p ] - ( xStart + ( c + 0.5 ) * res );
						final double dy = ys[ p ] - ( yStart - ( r + 0.5 ) * res );
						final double weight = Math.exp( -( dx * dx + dy * dy ) / twoSigmaSq );
						final int i = r * w + c;

						sumW[ i ] += weight;
						sumWZ[ i ] += weight * z;

						for ( int b = 0; b < bands; ++b )
							sumWColor[ b ][ i ] += weight * cloud.getColor()[ b ][ p ];

						if ( mask != null && cloud.hasMask() && weight > maxW[ i ] )
						{
							maxW[ i ] = weight;
							mask[ i ] = cloud.getMask()[ p ];
						}

						if ( stats )
						{
							++nPts[ i ];
							sumZ[ i ] += z;
							sumZ2[ i ] += z * z;
						}
					}
			}
		}

		final float[] dsm = new float[ numPixels ];
		final float[][] color = new float[ numBands ][ numPixels ];
		final float[] mean = stats ? new float[ numPixels ] : null;
		final float[] std = stats ? new float[ numPixels ] : null;

		for ( int i = 0; i < numPixels; ++i )
		{
			if ( sumW[ i ] > 0 )
			{
				dsm[ i ] = (float)( sumWZ[ i ] / sumW[ i ] );

				for ( int b = 0; b < numBands; ++b )
					color[ b ][ i ] = (float)( sumWColor[ b ][ i ] / sumW[ i ] );

				if ( stats )
				{
					final double m = sumZ[ i ] / nPts[ i ];
					mean[ i ] = (float)m;
					std[ i ] = (float)Math.sqrt( Math.max( 0, sumZ2[ i ] / nPts[ i ] - m * m ) );
				}
			}
			else
			{
				dsm[ i ] = params.getDsmNoData();

				for ( int b = 0; b < numBands; ++b )
					color[ b ][ i ] = params.getColorNoData();

				if ( stats )
				{
					mean[ i ] = params.getDsmNoData();
					std[ i ] = params.getDsmNoData();
				}
			}
		}

		return new RasterTile( tile, w, h, dsm, color, mask, mean, std, nPts, pointsInCell );
	}
}

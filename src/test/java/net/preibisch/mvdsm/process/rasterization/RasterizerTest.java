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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.Test;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PointCloud;
import net.preibisch.mvdsm.data.Tile;

public class RasterizerTest
{
	static final Tile TILE = new Tile( new Extent( 0, 0, 4, 4 ), 0, 0 );

	static PointCloud point( final double x, final double y, final double z, final float color, final int mask )
	{
		return new PointCloud( new double[] { x }, new double[] { y }, new double[] { z }, new float[][] { { color } }, new int[] { mask } );
	}

	@Test
	public void testSinglePoint()
	{
		final RasterizationParameters params = new RasterizationParameters( 1.0, 1, Double.NaN, 1, true, true );
		final RasterTile raster = Rasterizer.rasterize( Arrays.asList( point( 0.5, 3.5, 10, 7, 3 ) ), TILE, params );

		assertEquals( 4, raster.getWidth() );
		assertEquals( 4, raster.getHeight() );

		// row 0 is the top of the tile
		assertEquals( 10, raster.getDsm()[ 0 ], 1e-6 );
		assertEquals( 10, raster.getDsm()[ 5 ], 1e-6 );
		assertEquals( 7, raster.getColor()[ 0 ][ 1 ], 1e-6 );
		assertEquals( 3, raster.getMask()[ 4 ] );

		// beyond the radius
		assertEquals( -32768, raster.getDsm()[ 2 ], 0 );
		assertEquals( -32768, raster.getDsm()[ 15 ], 0 );
		assertEquals( 0, raster.getColor()[ 0 ][ 15 ], 0 );
		assertEquals( 65535, raster.getMask()[ 15 ] );

		assertEquals( 1, raster.getPointsInCell()[ 0 ] );
		assertEquals( 0, raster.getPointsInCell()[ 1 ] );
		assertEquals( 1, raster.getNPts()[ 1 ] );
		assertEquals( 0, raster.getNPts()[ 2 ] );
		assertEquals( 10, raster.getMean()[ 5 ], 1e-6 );
		assertEquals( 0, raster.getStd()[ 5 ], 1e-6 );
		assertEquals( -32768, raster.getStd()[ 15 ], 0 );
	}

	@Test
	public void testGaussianWeights()
	{
		final RasterizationParameters params = new RasterizationParameters( 1.0, 1, Double.NaN, 1, true, false );
		final RasterTile raster = Rasterizer.rasterize( Arrays.asList(
				point( 0.5, 3.5, 10, 0, 1 ),
				point( 1.5, 3.5, 20, 0, 2 ) ), TILE, params );

		final double w = Math.exp( -0.5 );

		assertEquals( ( 10 + 20 * w ) / ( 1 + w ), raster.getDsm()[ 0 ], 1e-5 );
		assertEquals( ( 10 * w + 20 ) / ( 1 + w ), raster.getDsm()[ 1 ], 1e-5 );

		// mask from the closest point
		assertEquals( 1, raster.getMask()[ 0 ] );
		assertEquals( 2, raster.getMask()[ 1 ] );
		assertEquals( 2, raster.getMask()[ 2 ] );

		assertNull( raster.getNPts() );
		assertNull( raster.getMean() );
	}

	@Test
	public void testPointsOutsideTheTileContribute()
	{
		final RasterizationParameters params = new RasterizationParameters( 1.0, 1, Double.NaN, 0, false, false );
		final RasterTile raster = Rasterizer.rasterize( Arrays.asList( point( -0.5, 3.5, 5, 0, 0 ) ), TILE, params );

		assertEquals( 5, raster.getDsm()[ 0 ], 1e-6 );
		assertEquals( -32768, raster.getDsm()[ 1 ], 0 );
		assertEquals( 0, raster.getColor().length );
		assertNull( raster.getMask() );
	}

	@Test
	public void testRepeatable()
	{
		final RasterizationParameters params = new RasterizationParameters( 0.5, 2, Double.NaN, 1, true, true ).setNoData( -9999, 255, 7 );
		final double[] x = new double[ 100 ], y = new double[ 100 ], z = new double[ 100 ];
		final float[][] c = new float[ 1 ][ 100 ];

		for ( int i = 0; i < 100; ++i )
		{
			x[ i ] = ( i * 37 % 100 ) / 25.0;
			y[ i ] = ( i * 53 % 100 ) / 25.0;
			z[ i ] = i;
			c[ 0 ][ i ] = i % 7;
		}

		final PointCloud cloud = new PointCloud( x, y, z, c, new int[ 100 ] );

		final RasterTile a = Rasterizer.rasterize( Arrays.asList( cloud ), TILE, params );
		final RasterTile b = Rasterizer.rasterize( Arrays.asList( cloud ), TILE, params );

		assertArrayEquals( a.getDsm(), b.getDsm(), 0 );
		assertArrayEquals( a.getColor()[ 0 ], b.getColor()[ 0 ], 0 );
		assertArrayEquals( a.getMask(), b.getMask() );
		assertArrayEquals( a.getStd(), b.getStd(), 0 );
		assertEquals( 64, a.getDsm().length );
	}

	@Test
	public void testTerrainMargin()
	{
		assertEquals( 0.75, new RasterizationParameters( 0.5, 1, Double.NaN, 1, false, false ).terrainMargin(), 0 );
		assertEquals( 5.75, new RasterizationParameters( 0.5, 1, Double.NaN, 1, false, false ).setSmallComponentsFilter( 3, 50, Double.NaN, 10 ).terrainMargin(), 0 );
	}
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

import net.preibisch.mvdsm.data.PointCloud;

public class SmallComponentsFilterTest
{
	// ten points in [0, 4.5], two points at 7 and 7.5, two points at 20 and 20.5
	static PointCloud threeClusters()
	{
		final double[] x = new double[ 14 ];

		for ( int i = 0; i < 10; ++i )
			x[ i ] = i * 0.5;

		x[ 10 ] = 20;
		x[ 11 ] = 7;
		x[ 12 ] = 20.5;
		x[ 13 ] = 7.5;

		final int[] mask = new int[ 14 ];
		mask[ 11 ] = 1;

		return new PointCloud( x, new double[ 14 ], new double[ 14 ], new float[ 0 ][ 14 ], mask );
	}

	@Test
	public void testLabels()
	{
		final int[] labels = new SmallComponentsFilter( 1, 5, Double.NaN ).label( threeClusters() );

		for ( int i = 1; i < 10; ++i )
			assertEquals( labels[ 0 ], labels[ i ] );

		assertEquals( labels[ 10 ], labels[ 12 ] );
		assertEquals( labels[ 11 ], labels[ 13 ] );
		assertNotEquals( labels[ 10 ], labels[ 11 ] );
		assertNotEquals( labels[ 0 ], labels[ 10 ] );
		assertEquals( 0, labels[ 0 ] );
	}

	@Test
	public void testRemovesSmallClusters()
	{
		final PointCloud filtered = new SmallComponentsFilter( 1, 5, Double.NaN ).filter( threeClusters() );

		assertEquals( 10, filtered.size() );
		assertEquals( 4.5, filtered.getX()[ 9 ], 0 );
		assertEquals( 10, filtered.getMask().length );
	}

	@Test
	public void testKeepsClustersCloseToLargeOnes()
	{
		final PointCloud filtered = new SmallComponentsFilter( 1, 5, 3 ).filter( threeClusters() );

		assertEquals( 12, filtered.size() );
		assertEquals( 7, filtered.getX()[ 10 ], 0 );
		assertEquals( 1, filtered.getMask()[ 10 ] );
		assertEquals( 7.5, filtered.getX()[ 11 ], 0 );
	}
}

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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.preibisch.mvdsm.data.PointCloud;

public class StatisticalOutliersFilterTest
{
	static PointCloud gridWithOutlier()
	{
		final int n = 26;
		final double[] x = new double[ n ], y = new double[ n ], z = new double[ n ];

		for ( int i = 0; i < 25; ++i )
		{
			x[ i ] = i % 5;
			y[ i ] = i / 5;
		}

		x[ 25 ] = 2;
		y[ 25 ] = 2;
		z[ 25 ] = 50;

		return new PointCloud( x, y, z, new float[][] { new float[ n ] }, null );
	}

	@Test
	public void testRemovesIsolatedPoint()
	{
		final PointCloud filtered = new StatisticalOutliersFilter( 4, 1.0 ).filter( gridWithOutlier() );

		assertEquals( 25, filtered.size() );
		assertEquals( 1, filtered.numBands() );

		for ( final double z : filtered.getZ() )
			assertTrue( z < 1 );
	}

	@Test
	public void testTinyClouds()
	{
		final PointCloud single = new PointCloud( new double[] { 1 }, new double[] { 1 }, new double[] { 1 }, null, null );
		assertSame( single, new StatisticalOutliersFilter( 50, 1.0 ).filter( single ) );

		final PointCloud empty = PointCloud.empty( 0, false );
		assertSame( empty, new StatisticalOutliersFilter( 50, 1.0 ).filter( empty ) );
	}
}

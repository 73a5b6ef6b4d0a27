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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.KNearestNeighborSearchOnKDTree;
import net.preibisch.mvdsm.data.PointCloud;

/**
 * Removes points whose mean distance to their k nearest neighbors is larger than
 * mean + stdDevFactor * std of that distance over the whole cloud.
 *
 * @author Stephan Preibisch
 */
public class StatisticalOutliersFilter
{
	private static final Logger LOG = LoggerFactory.getLogger( StatisticalOutliersFilter.class );

	final int k;
	final double stdDevFactor;

	public StatisticalOutliersFilter( final int k, final double stdDevFactor )
	{
		this.k = k;
		this.stdDevFactor = stdDevFactor;
	}

	public PointCloud filter( final PointCloud cloud )
	{
		final int n = cloud.size();
		final int numNeighbors = Math.min( k, n - 1 );

		if ( numNeighbors < 1 )
			return cloud;

		final List< RealPoint > positions = PointCloudTools.positions( cloud );
		final KDTree< Integer > tree = PointCloudTools.indexTree( cloud );

		// the first nearest neighbor is the point itself
		final KNearestNeighborSearchOnKDTree< Integer > search = new KNearestNeighborSearchOnKDTree<>( tree, numNeighbors + 1 );

		final double[] meanDistance = new double[ n ];
		double sum = 0;

		for ( int i = 0; i < n; ++i )
		{
			search.search( positions.get( i ) );

			double d = 0;
			for ( int j = 1; j <= numNeighbors; ++j )
				d += search.getDistance( j );

			meanDistance[ i ] = d / numNeighbors;
			sum += meanDistance[ i ];
		}

		final double mean = sum / n;

		double var = 0;
		for ( final double d : meanDistance )
			var += ( d - mean ) * ( d - mean );

		final double threshold = mean + stdDevFactor * Math.sqrt( var / n );

		final boolean[] keep = new boolean[ n ];
		int removed = 0;

		for ( int i = 0; i < n; ++i )
		{
			keep[ i ] = meanDistance[ i ] <= threshold;

			if ( !keep[ i ] )
				++removed;
		}

		LOG.debug( "Statistical outliers filter removed {} of {} points (threshold={}).", removed, n, threshold );

		return removed == 0 ? cloud : cloud.select( keep );
	}
}

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.imglib2.neighborsearch.RadiusNeighborSearchOnKDTree;
import net.preibisch.mvdsm.data.PointCloud;

/**
 * Removes clusters of points that are too small. Points closer than connectionDistance belong to the
 * same cluster; clusters with less than minPointsPerComponent points are removed, unless a
 * clustersDistanceThreshold is set and the cluster lies within that distance of a kept cluster.
 *
 * @author Stephan Preibisch
 */
public class SmallComponentsFilter
{
	private static final Logger LOG = LoggerFactory.getLogger( SmallComponentsFilter.class );

	final double connectionDistance;
	final int minPointsPerComponent;
	final double clustersDistanceThreshold;

	/**
	 * @param connectionDistance - maximal distance of connected points
	 * @param minPointsPerComponent - smaller clusters are removed
	 * @param clustersDistanceThreshold - small clusters closer than this to a kept cluster survive, NaN to disable
	 */
	public SmallComponentsFilter( final double connectionDistance, final int minPointsPerComponent, final double clustersDistanceThreshold )
	{
		this.connectionDistance = connectionDistance;
		this.minPointsPerComponent = minPointsPerComponent;
		this.clustersDistanceThreshold = clustersDistanceThreshold;
	}

	/**
	 * @param cloud - the points
	 * @return cluster label of every point, labels are 0...numClusters-1
	 */
	public int[] label( final PointCloud cloud )
	{
		final int n = cloud.size();
		final int[] labels = new int[ n ];
		Arrays.fill( labels, -1 );

		if ( n == 0 )
			return labels;

		final List< RealPoint > positions = PointCloudTools.positions( cloud );
		final RadiusNeighborSearchOnKDTree< Integer > search = new RadiusNeighborSearchOnKDTree<>( PointCloudTools.indexTree( cloud ) );
		final ArrayDeque< Integer > queue = new ArrayDeque<>();

		int label = 0;

		for ( int seed = 0; seed < n; ++seed )
		{
			if ( labels[ seed ] >= 0 )
				continue;

			labels[ seed ] = label;
			queue.add( seed );

			while ( !queue.isEmpty() )
			{
				final int i = queue.poll();
				search.search( positions.get( i ), connectionDistance, false );

				for ( int j = 0; j < search.numNeighbors(); ++j )
				{
					final int other = search.getSampler( j ).get();

					if ( labels[ other ] < 0 )
					{
						labels[ other ] = label;
						queue.add( other );
					}
				}
			}

			++label;
		}

		return labels;
	}

	public PointCloud filter( final PointCloud cloud )
	{
		final int n = cloud.size();

		if ( n == 0 )
			return cloud;

		final int[] labels = label( cloud );

		int numClusters = 0;
		for ( final int l : labels )
			numClusters = Math.max( numClusters, l + 1 );

		final int[] sizes = new int[ numClusters ];
		for ( final int l : labels )
			++sizes[ l ];

		final boolean[] keepCluster = new boolean[ numClusters ];
		for ( int c = 0; c < numClusters; ++c )
			keepCluster[ c ] = sizes[ c ] >= minPointsPerComponent;

		if ( !Double.isNaN( clustersDistanceThreshold ) )
			rescueCloseClusters( cloud, labels, keepCluster );

		final boolean[] keep = new boolean[ n ];
		int removed = 0;

		for ( int i = 0; i < n; ++i )
		{
			keep[ i ] = keepCluster[ labels[ i ] ];

			if ( !keep[ i ] )
				++removed;
		}

		LOG.debug( "Small components filter removed {} of {} points ({} clusters).", removed, n, numClusters );

		return removed == 0 ? cloud : cloud.select( keep );
	}

	protected void rescueCloseClusters( final PointCloud cloud, final int[] labels, final boolean[] keepCluster )
	{
		final ArrayList< Integer > kept = new ArrayList<>();
		final ArrayList< RealPoint > keptPositions = new ArrayList<>();
		final List< RealPoint > positions = PointCloudTools.positions( cloud );

		for ( int i = 0; i < labels.length; ++i )
			if ( keepCluster[ labels[ i ] ] )
			{
				kept.add( i );
				keptPositions.add( positions.get( i ) );
			}

		if ( kept.isEmpty() )
			return;

		final RadiusNeighborSearchOnKDTree< Integer > search =
				new RadiusNeighborSearchOnKDTree<>( new KDTree<>( new ArrayList<>( kept ), new ArrayList<>( keptPositions ) ) );

		final boolean[] rescued = new boolean[ keepCluster.length ];

		for ( int i = 0; i < labels.length; ++i )
		{
			final int l = labels[ i ];

			if ( keepCluster[ l ] || rescued[ l ] )
				continue;

			search.search( positions.get( i ), clustersDistanceThreshold, false );

			if ( search.numNeighbors() > 0 )
				rescued[ l ] = true;
		}

		for ( int c = 0; c < keepCluster.length; ++c )
			keepCluster[ c ] |= rescued[ c ];
	}
}

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

import java.util.ArrayList;
import java.util.List;

import net.imglib2.KDTree;
import net.imglib2.RealPoint;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PointCloud;

public class PointCloudTools
{
	/**
	 * @param cloud - the points
	 * @param extent - area to keep (borders inclusive)
	 * @return the points inside the extent
	 */
	public static PointCloud crop( final PointCloud cloud, final Extent extent )
	{
		final boolean[] keep = new boolean[ cloud.size() ];
		boolean all = true;

		for ( int i = 0; i < keep.length; ++i )
		{
			keep[ i ] = extent.contains( cloud.getX()[ i ], cloud.getY()[ i ] );
			all &= keep[ i ];
		}

		return all ? cloud : cloud.select( keep );
	}

	public static List< RealPoint > positions( final PointCloud cloud )
	{
		final ArrayList< RealPoint > positions = new ArrayList<>( cloud.size() );

		for ( int i = 0; i < cloud.size(); ++i )
			positions.add( new RealPoint( cloud.getX()[ i ], cloud.getY()[ i ], cloud.getZ()[ i ] ) );

		return positions;
	}

	/**
	 * Builds a 3d tree whose values are the point indices.
	 *
	 * @param cloud - the points (at least one)
	 * @return the tree
	 */
	public static KDTree< Integer > indexTree( final PointCloud cloud )
	{
		final ArrayList< Integer > indices = new ArrayList<>( cloud.size() );

		for ( int i = 0; i < cloud.size(); ++i )
			indices.add( i );

		// the KDTree may reorder the lists it is given
		return new KDTree<>( indices, positions( cloud ) );
	}
}

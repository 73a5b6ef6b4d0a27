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
package net.preibisch.mvdsm.process.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5Reader;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PointCloud;
import net.preibisch.mvdsm.data.PointCloudUnit;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TriangulatedPoints;
import net.preibisch.mvdsm.process.pointcloud.PointCloudIO;
import net.preibisch.mvdsm.process.pointcloud.PointCloudTools;
import net.preibisch.mvdsm.process.pointcloud.SmallComponentsFilter;
import net.preibisch.mvdsm.process.pointcloud.StatisticalOutliersFilter;
import net.preibisch.mvdsm.process.rasterization.RasterTile;
import net.preibisch.mvdsm.process.rasterization.RasterizationParameters;
import net.preibisch.mvdsm.process.rasterization.Rasterizer;

/**
 * Filters and rasterizes all points that may fall into one terrain tile. Reference points of all
 * contributing units come first (in contributor order), secondary points are appended.
 *
 * @author Stephan Preibisch
 */
public class RasterizationTask implements DsmTask< RasterTile >
{
	private static final long serialVersionUID = 2330914458361006517L;

	final Tile terrainTile;
	final List< PointCloudUnit > units;
	final RasterizationParameters params;
	final String container;

	/**
	 * @param terrainTile - the tile to rasterize
	 * @param units - the resolved point clouds of all contributors, in contributor order
	 * @param params - filtering and rasterization parameters
	 * @param container - N5 container of persisted units, may be null if all units are in memory
	 */
	public RasterizationTask( final Tile terrainTile, final List< PointCloudUnit > units, final RasterizationParameters params, final String container )
	{
		this.terrainTile = terrainTile;
		this.units = new ArrayList<>( units );
		this.params = params;
		this.container = container;
	}

	public Tile getTerrainTile() { return terrainTile; }
	public List< PointCloudUnit > getUnits() { return units; }

	@Override
	public RasterTile call() throws Exception
	{
		final List< TriangulatedPoints > points = load();

		final ArrayList< PointCloud > clouds = new ArrayList<>();

		for ( final TriangulatedPoints p : points )
			clouds.add( p.getReference() );

		for ( final TriangulatedPoints p : points )
			if ( p.hasSecondary() )
				clouds.add( p.getSecondary() );

		final Extent area = terrainTile.getExtent().expand( params.terrainMargin() );

		final ArrayList< PointCloud > cropped = new ArrayList<>();
		for ( final PointCloud cloud : clouds )
			cropped.add( PointCloudTools.crop( cloud, area ) );

		PointCloud cloud = PointCloud.concatenate( cropped );

		if ( params.useSmallComponentsFilter() )
			cloud = new SmallComponentsFilter(
					params.getConnectionDistance(),
					params.getMinPointsPerComponent(),
					params.getClustersDistanceThreshold() ).filter( cloud );

		if ( params.useStatisticalOutliersFilter() )
			cloud = new StatisticalOutliersFilter( params.getK(), params.getStdDevFactor() ).filter( cloud );

		return Rasterizer.rasterize( Collections.singletonList( cloud ), terrainTile, params );
	}

	protected List< TriangulatedPoints > load()
	{
		final ArrayList< TriangulatedPoints > points = new ArrayList<>();
		N5Reader n5 = null;

		try
		{
			for ( final PointCloudUnit unit : units )
			{
				if ( unit.isPersisted() )
				{
					if ( n5 == null )
						n5 = new N5FSReader( container );

					points.add( PointCloudIO.loadTriangulated( n5, unit.getDataset() ) );
				}
				else
				{
					points.add( unit.getPoints() );
				}
			}
		}
		finally
		{
			if ( n5 != null )
				n5.close();
		}

		return points;
	}

	@Override
	public String getDescription()
	{
		return "rasterization of terrain tile (" + terrainTile.getRow() + ", " + terrainTile.getCol() + ") " +
				terrainTile.regionHash() + " from " + units.size() + " point clouds";
	}
}

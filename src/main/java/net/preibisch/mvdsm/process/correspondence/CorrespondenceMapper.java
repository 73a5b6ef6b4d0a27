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
package net.preibisch.mvdsm.process.correspondence;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.data.CorrespondenceEntry;
import net.preibisch.mvdsm.data.EpipolarTileRef;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TileGrid;
import net.preibisch.mvdsm.geometry.StereoGeometry;
import net.preibisch.mvdsm.process.boundingbox.BoundingBoxTools;

/**
 * Finds, for every terrain tile, the epipolar tiles whose points may fall into it. Epipolar tile
 * corners are projected to the terrain at both disparity bounds, the bounding rectangle of these
 * eight positions is tested against the terrain tile.
 *
 * @author Stephan Preibisch
 */
public class CorrespondenceMapper
{
	private static final Logger LOG = LoggerFactory.getLogger( CorrespondenceMapper.class );

	/**
	 * Projects the nodes of the epipolar tile grid once per disparity bound and assembles one
	 * terrain rectangle per tile.
	 *
	 * @param geometry - the geometry collaborator
	 * @param pair - the pair with its epipolar tiling
	 * @param crs - output crs
	 * @return rectangles of all epipolar tiles of the pair
	 */
	public static EpipolarTileFootprints projectEpipolarGrid( final StereoGeometry geometry, final PairContext pair, final String crs )
	{
		final TileGrid grid = pair.getEpipolarGrid();
		final int rows = grid.numRows();
		final int cols = grid.numCols();

		final double[] xs = new double[ cols + 1 ];
		final double[] ys = new double[ rows + 1 ];

		for ( int c = 0; c < cols; ++c )
			xs[ c ] = grid.get( 0, c ).getExtent().getXMin();
		xs[ cols ] = grid.get( 0, cols - 1 ).getExtent().getXMax();

		for ( int r = 0; r < rows; ++r )
			ys[ r ] = grid.get( r, 0 ).getExtent().getYMin();
		ys[ rows ] = grid.get( rows - 1, 0 ).getExtent().getYMax();

		final double[][] nodes = new double[ ( rows + 1 ) * ( cols + 1 ) ][];

		for ( int r = 0; r <= rows; ++r )
			for ( int c = 0; c <= cols; ++c )
				nodes[ r * ( cols + 1 ) + c ] = new double[] { xs[ c ], ys[ r ] };

		final double[][] atMin = geometry.project( pair.getConfiguration(), nodes, pair.getDisparityRange().getMin(), crs );
		final double[][] atMax = geometry.project( pair.getConfiguration(), nodes, pair.getDisparityRange().getMax(), crs );

		final Extent[] rectangles = new Extent[ grid.size() ];

		for ( final Tile tile : grid.getTiles() )
		{
			final int r = tile.getRow();
			final int c = tile.getCol();

			final int[] corners = new int[] {
					r * ( cols + 1 ) + c,
					r * ( cols + 1 ) + c + 1,
					( r + 1 ) * ( cols + 1 ) + c,
					( r + 1 ) * ( cols + 1 ) + c + 1 };

			final double[][] positions = new double[ 2 * corners.length ][];

			for ( int i = 0; i < corners.length; ++i )
			{
				positions[ i ] = atMin[ corners[ i ] ];
				positions[ i + corners.length ] = atMax[ corners[ i ] ];
			}

			rectangles[ grid.index( tile ) ] = BoundingBoxTools.envelope( positions, crs );
		}

		return new EpipolarTileFootprints( pair.getIndex(), grid.getTiles(), rectangles );
	}

	/**
	 * @param terrainTiles - terrain tiles in row-major order
	 * @param pairs - epipolar tile rectangles of all pairs, in pair order
	 * @param margin - the terrain tile is expanded by this before testing
	 * @return one entry per terrain tile with at least one contributor; contributors ordered by pair, then epipolar tile
	 */
	public static List< CorrespondenceEntry > map( final List< Tile > terrainTiles, final List< EpipolarTileFootprints > pairs, final double margin )
	{
		final ArrayList< CorrespondenceEntry > entries = new ArrayList<>();

		for ( final Tile terrainTile : terrainTiles )
		{
			final Extent area = margin > 0 ? terrainTile.getExtent().expand( margin ) : terrainTile.getExtent();
			final ArrayList< EpipolarTileRef > contributors = new ArrayList<>();

			for ( final EpipolarTileFootprints pair : pairs )
				for ( int t = 0; t < pair.size(); ++t )
					if ( pair.getRectangle( t ).intersects( area ) )
						contributors.add( new EpipolarTileRef( pair.getPairIndex(), t, pair.getTiles().get( t ) ) );

			if ( contributors.size() > 0 )
				entries.add( new CorrespondenceEntry( terrainTile, contributors ) );
			else
				LOG.debug( "Terrain tile ({}, {}) has no contributing epipolar tile.", terrainTile.getRow(), terrainTile.getCol() );
		}

		logStatistics( terrainTiles.size(), entries );

		return entries;
	}

	protected static void logStatistics( final int numTerrainTiles, final List< CorrespondenceEntry > entries )
	{
		final TreeMap< Integer, Integer > histogram = new TreeMap<>();
		int max = 0;
		long sum = 0;

		for ( final CorrespondenceEntry e : entries )
		{
			histogram.merge( e.size(), 1, Integer::sum );
			max = Math.max( max, e.size() );
			sum += e.size();
		}

		LOG.info( "{} of {} terrain tiles have contributing epipolar tiles.", entries.size(), numTerrainTiles );

		if ( entries.size() > 0 )
		{
			LOG.info( "Contributing epipolar tiles per terrain tile: average={}, max={}", (double)sum / entries.size(), max );
			LOG.debug( "Histogram (contributors=terrain tiles): {}", histogram );
		}
	}
}

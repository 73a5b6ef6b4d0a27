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

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.preibisch.mvdsm.data.CorrespondenceEntry;
import net.preibisch.mvdsm.data.DisparityRange;
import net.preibisch.mvdsm.data.EpipolarTileRef;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.Tile;
import net.preibisch.mvdsm.data.TileGrid;
import net.preibisch.mvdsm.geometry.SyntheticStereoGeometry;
import net.preibisch.mvdsm.process.splitting.GridPartitioner;

public class CorrespondenceMapperTest
{
	static List< Tile > epipolarTiles( final int n )
	{
		return GridPartitioner.partition( new Extent( 0, 0, n * 10, 10 ), 10, 10 );
	}

	static String describe( final CorrespondenceEntry entry )
	{
		final ArrayList< String > refs = new ArrayList<>();

		for ( final EpipolarTileRef ref : entry.getContributors() )
			refs.add( ref.getPairIndex() + ":" + ref.getTileIndex() );

		return entry.getTerrainTile().getRow() + "," + entry.getTerrainTile().getCol() + "=" + refs;
	}

	@Test
	public void testExpectedContributors()
	{
		final EpipolarTileFootprints pair0 = new EpipolarTileFootprints( 0, epipolarTiles( 2 ), new Extent[] {
				new Extent( 0, 0, 9, 9 ),
				new Extent( 11, 0, 20, 9 ) } );

		final EpipolarTileFootprints pair1 = new EpipolarTileFootprints( 1, epipolarTiles( 1 ), new Extent[] {
				new Extent( 5, 5, 15, 15 ) } );

		final List< Tile > terrainTiles = GridPartitioner.partition( new Extent( 0, 0, 30, 20 ), 10, 10 );
		final List< CorrespondenceEntry > entries = CorrespondenceMapper.map( terrainTiles, Arrays.asList( pair0, pair1 ), 0 );

		final ArrayList< String > described = new ArrayList<>();
		for ( final CorrespondenceEntry e : entries )
			described.add( describe( e ) );

		// (0, 2) only touches the rectangle of pair 0 tile 1 and (1, 2) touches nothing
		assertEquals( Arrays.asList(
				"0,0=[0:0, 1:0]",
				"0,1=[0:1, 1:0]",
				"1,0=[1:0]",
				"1,1=[1:0]" ), described );
	}

	@Test
	public void testMarginAddsNeighbors()
	{
		final EpipolarTileFootprints pair0 = new EpipolarTileFootprints( 0, epipolarTiles( 1 ), new Extent[] { new Extent( 0, 0, 10, 10 ) } );
		final List< Tile > terrainTiles = GridPartitioner.partition( new Extent( 0, 0, 20, 10 ), 10, 10 );

		assertEquals( 1, CorrespondenceMapper.map( terrainTiles, Arrays.asList( pair0 ), 0 ).size() );
		assertEquals( 2, CorrespondenceMapper.map( terrainTiles, Arrays.asList( pair0 ), 0.75 ).size() );
	}

	@Test
	public void testProjectedEpipolarGrid()
	{
		final PairConfiguration pair = SyntheticStereoGeometry.pair( "one", 0, 0 );
		final TileGrid grid = GridPartitioner.grid( pair.getEpipolarExtent(), 50, 50 );
		final PairContext context = new PairContext( 0, pair, new DisparityRange( -5, 5 ), 50, grid, new Extent( 0, 0, 50, 50 ), 2500 );

		final EpipolarTileFootprints footprints = CorrespondenceMapper.projectEpipolarGrid( new SyntheticStereoGeometry(), context, SyntheticStereoGeometry.CRS );

		assertEquals( 4, footprints.size() );

		// epipolar rows 0-50 are the upper half of the terrain
		assertEquals( new Extent( -0.5, 25, 25.5, 50, SyntheticStereoGeometry.CRS ), footprints.getRectangle( grid.index( 0, 0 ) ) );
		assertEquals( new Extent( 24.5, 0, 50.5, 25, SyntheticStereoGeometry.CRS ), footprints.getRectangle( grid.index( 1, 1 ) ) );
	}
}

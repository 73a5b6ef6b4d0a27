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

import java.util.List;

import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.Tile;

/**
 * Terrain-space bounding rectangle of every epipolar tile of one pair, in tile grid order.
 */
public class EpipolarTileFootprints
{
	final int pairIndex;
	final List< Tile > tiles;
	final Extent[] rectangles;

	public EpipolarTileFootprints( final int pairIndex, final List< Tile > tiles, final Extent[] rectangles )
	{
		if ( tiles.size() != rectangles.length )
			throw new IllegalArgumentException( "Need one rectangle per tile, got " + rectangles.length + " for " + tiles.size() + " tiles." );

		this.pairIndex = pairIndex;
		this.tiles = tiles;
		this.rectangles = rectangles;
	}

	public int getPairIndex() { return pairIndex; }
	public List< Tile > getTiles() { return tiles; }
	public Extent getRectangle( final int tileIndex ) { return rectangles[ tileIndex ]; }
	public int size() { return rectangles.length; }
}

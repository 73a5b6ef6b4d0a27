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
package net.preibisch.mvdsm.data;

import java.io.Serializable;

/**
 * Identifies one (pair, epipolar tile) unit of work. Ordered by pair insertion order first,
 * then by the row-major index of the epipolar tile.
 */
public class EpipolarTileRef implements Comparable< EpipolarTileRef >, Serializable
{
	private static final long serialVersionUID = -6519232931050693346L;

	final int pairIndex, tileIndex;
	final Tile tile;

	public EpipolarTileRef( final int pairIndex, final int tileIndex, final Tile tile )
	{
		this.pairIndex = pairIndex;
		this.tileIndex = tileIndex;
		this.tile = tile;
	}

	public int getPairIndex() { return pairIndex; }
	public int getTileIndex() { return tileIndex; }
	public Tile getTile() { return tile; }

	@Override
	public int compareTo( final EpipolarTileRef o )
	{
		final int c = Integer.compare( pairIndex, o.pairIndex );
		return c != 0 ? c : Integer.compare( tileIndex, o.tileIndex );
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( !( o instanceof EpipolarTileRef ) )
			return false;

		final EpipolarTileRef r = ( EpipolarTileRef ) o;
		return pairIndex == r.pairIndex && tileIndex == r.tileIndex;
	}

	@Override
	public int hashCode() { return 31 * pairIndex + tileIndex; }

	@Override
	public String toString() { return "pair " + pairIndex + ", epipolar tile " + tileIndex + " (" + tile.getRow() + ", " + tile.getCol() + ")"; }
}

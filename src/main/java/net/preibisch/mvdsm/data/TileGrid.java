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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Regular grid of {@link Tile}s over an {@link Extent}, stored in row-major order.
 */
public class TileGrid implements Serializable
{
	private static final long serialVersionUID = -1968374035271307165L;

	// offsets of the 8-neighborhood, clockwise starting north
	private static final int[][] NEIGHBOR_OFFSETS = new int[][] {
		{ 1, 0 }, { 1, 1 }, { 0, 1 }, { -1, 1 }, { -1, 0 }, { -1, -1 }, { 0, -1 }, { 1, -1 } };

	final Extent extent;
	final double tileWidth, tileHeight;
	final int rows, cols;
	final List< Tile > tiles;

	public TileGrid( final Extent extent, final double tileWidth, final double tileHeight, final int rows, final int cols, final List< Tile > tiles )
	{
		if ( tiles.size() != rows * cols )
			throw new IllegalArgumentException( "Expected " + ( rows * cols ) + " tiles, got " + tiles.size() );

		this.extent = extent;
		this.tileWidth = tileWidth;
		this.tileHeight = tileHeight;
		this.rows = rows;
		this.cols = cols;
		this.tiles = Collections.unmodifiableList( new ArrayList<>( tiles ) );
	}

	public Extent getExtent() { return extent; }
	public double getTileWidth() { return tileWidth; }
	public double getTileHeight() { return tileHeight; }
	public int numRows() { return rows; }
	public int numCols() { return cols; }
	public int size() { return tiles.size(); }

	public List< Tile > getTiles() { return tiles; }

	public Tile get( final int row, final int col ) { return tiles.get( index( row, col ) ); }

	public int index( final int row, final int col ) { return row * cols + col; }

	public int index( final Tile tile ) { return index( tile.getRow(), tile.getCol() ); }

	/**
	 * @param tile - a tile of this grid
	 * @return the existing tiles of the 8-neighborhood, clockwise starting with the tile above (larger y)
	 */
	public List< Tile > neighbors( final Tile tile )
	{
		final ArrayList< Tile > neighbors = new ArrayList<>();

		for ( final int[] offset : NEIGHBOR_OFFSETS )
		{
			final int r = tile.getRow() + offset[ 0 ];
			final int c = tile.getCol() + offset[ 1 ];

			if ( r >= 0 && r < rows && c >= 0 && c < cols )
				neighbors.add( get( r, c ) );
		}

		return neighbors;
	}
}

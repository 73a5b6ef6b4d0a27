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

import net.preibisch.mvdsm.process.splitting.GridPartitioner;

/**
 * A pure coordinate descriptor: a sub-rectangle of a partitioned {@link Extent}
 * plus its (row, col) position in the tile grid. Rows count from ymin upwards.
 */
public class Tile implements Serializable
{
	private static final long serialVersionUID = 4386021763962018432L;

	final Extent extent;
	final int row, col;

	public Tile( final Extent extent, final int row, final int col )
	{
		this.extent = extent;
		this.row = row;
		this.col = col;
	}

	public Extent getExtent() { return extent; }
	public int getRow() { return row; }
	public int getCol() { return col; }

	/**
	 * @return stable identifier derived from the four bounds, used for file naming and caching
	 */
	public String regionHash() { return GridPartitioner.regionHash( extent ); }

	@Override
	public boolean equals( final Object o )
	{
		if ( this == o )
			return true;

		if ( !( o instanceof Tile ) )
			return false;

		final Tile t = ( Tile ) o;

		return row == t.row && col == t.col && extent.equals( t.extent );
	}

	@Override
	public int hashCode() { return 31 * ( 31 * extent.hashCode() + row ) + col; }

	@Override
	public String toString() { return "Tile(" + row + ", " + col + ") " + extent; }
}

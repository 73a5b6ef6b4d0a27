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
package net.preibisch.mvdsm.process.export;

import net.preibisch.mvdsm.data.Extent;

/**
 * Absolute pixel window of a terrain tile inside the output raster. Rows count from the top (ymax).
 */
public class MosaicWindow
{
	final long col, row, width, height;

	public MosaicWindow( final long col, final long row, final long width, final long height )
	{
		this.col = col;
		this.row = row;
		this.width = width;
		this.height = height;
	}

	/**
	 * @param tile - extent of the terrain tile
	 * @param global - extent of the output raster
	 * @param resolution - pixel size
	 * @return the window of the tile
	 * @throws IllegalStateException if the tile is not inside the output raster
	 */
	public static MosaicWindow compute( final Extent tile, final Extent global, final double resolution )
	{
		final long col = Math.round( ( tile.getXMin() - global.getXMin() ) / resolution );
		final long row = Math.round( ( global.getYMax() - tile.getYMax() ) / resolution );
		final long width = Math.max( 1, Math.round( tile.width() / resolution ) );
		final long height = Math.max( 1, Math.round( tile.height() / resolution ) );

		final long globalWidth = Math.round( global.width() / resolution );
		final long globalHeight = Math.round( global.height() / resolution );

		if ( col < 0 || row < 0 || col + width > globalWidth || row + height > globalHeight )
			throw new IllegalStateException( "Tile " + tile + " lies outside of the output raster " + global );

		return new MosaicWindow( col, row, width, height );
	}

	public long getCol() { return col; }
	public long getRow() { return row; }
	public long getWidth() { return width; }
	public long getHeight() { return height; }
	public long[] getMin() { return new long[] { col, row }; }
	public long[] getDimensions() { return new long[] { width, height }; }

	public boolean overlaps( final MosaicWindow other )
	{
		return col < other.col + other.width && other.col < col + width && row < other.row + other.height && other.row < row + height;
	}

	@Override
	public String toString() { return "[" + col + ", " + row + "] " + width + "x" + height; }
}

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
package net.preibisch.mvdsm.process.rasterization;

import java.io.Serializable;

import net.preibisch.mvdsm.data.Tile;

/**
 * Rasters of one terrain tile, row-major with row 0 at the top (ymax) of the tile.
 * Optional layers are null if they were not requested.
 */
public class RasterTile implements Serializable
{
	private static final long serialVersionUID = 5069215307549532818L;

	final Tile tile;
	final int width, height;

	final float[] dsm;
	final float[][] color; // [band][pixel]
	final int[] mask;
	final float[] mean, std;
	final int[] nPts, pointsInCell;

	public RasterTile(
			final Tile tile,
			final int width,
			final int height,
			final float[] dsm,
			final float[][] color,
			final int[] mask,
			final float[] mean,
			final float[] std,
			final int[] nPts,
			final int[] pointsInCell )
	{
		this.tile = tile;
		this.width = width;
		this.height = height;
		this.dsm = dsm;
		this.color = color;
		this.mask = mask;
		this.mean = mean;
		this.std = std;
		this.nPts = nPts;
		this.pointsInCell = pointsInCell;
	}

	public Tile getTile() { return tile; }
	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public float[] getDsm() { return dsm; }
	public float[][] getColor() { return color; }
	public int[] getMask() { return mask; }
	public float[] getMean() { return mean; }
	public float[] getStd() { return std; }
	public int[] getNPts() { return nPts; }
	public int[] getPointsInCell() { return pointsInCell; }
	public boolean hasStats() { return nPts != null; }
}

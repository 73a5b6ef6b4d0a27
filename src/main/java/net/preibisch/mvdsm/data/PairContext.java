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
 * Per-pair state of one run, created once the terrain footprint and epipolar tiling of the
 * pair are resolved and immutable afterwards.
 *
 * @author Stephan Preibisch
 */
public class PairContext implements Serializable
{
	private static final long serialVersionUID = -2786094713104063186L;

	final int index;
	final PairConfiguration configuration;
	final DisparityRange disparityRange;
	final int epipolarTileSize;
	final TileGrid epipolarGrid;
	final Extent terrainBox;
	final double terrainArea;

	public PairContext(
			final int index,
			final PairConfiguration configuration,
			final DisparityRange disparityRange,
			final int epipolarTileSize,
			final TileGrid epipolarGrid,
			final Extent terrainBox,
			final double terrainArea )
	{
		this.index = index;
		this.configuration = configuration;
		this.disparityRange = disparityRange;
		this.epipolarTileSize = epipolarTileSize;
		this.epipolarGrid = epipolarGrid;
		this.terrainBox = terrainBox;
		this.terrainArea = terrainArea;
	}

	public int getIndex() { return index; }
	public String getId() { return configuration.getId(); }
	public PairConfiguration getConfiguration() { return configuration; }
	public DisparityRange getDisparityRange() { return disparityRange; }
	public int getEpipolarTileSize() { return epipolarTileSize; }
	public TileGrid getEpipolarGrid() { return epipolarGrid; }
	public Extent getTerrainBox() { return terrainBox; }
	public double getTerrainArea() { return terrainArea; }
	public double[] getEpipolarOrigin() { return configuration.getEpipolarOrigin(); }
	public double[] getEpipolarSpacing() { return configuration.getEpipolarSpacing(); }

	public EpipolarTileRef ref( final int tileIndex )
	{
		return new EpipolarTileRef( index, tileIndex, epipolarGrid.getTiles().get( tileIndex ) );
	}
}

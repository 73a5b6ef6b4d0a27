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
 * One terrain tile and the ordered (pair, epipolar tile) units whose 3D points may fall into it.
 */
public class CorrespondenceEntry implements Serializable
{
	private static final long serialVersionUID = 1850432770133960224L;

	final Tile terrainTile;
	final List< EpipolarTileRef > contributors;

	public CorrespondenceEntry( final Tile terrainTile, final List< EpipolarTileRef > contributors )
	{
		this.terrainTile = terrainTile;
		this.contributors = Collections.unmodifiableList( new ArrayList<>( contributors ) );
	}

	public Tile getTerrainTile() { return terrainTile; }
	public List< EpipolarTileRef > getContributors() { return contributors; }
	public int size() { return contributors.size(); }
}

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content of the run manifest (content.json). Serialized field by field with Gson.
 */
public class RunManifest
{
	public static final String VERSION = "1.0";

	public static class PairEntry
	{
		public String id;
		public double minDisparity, maxDisparity;
		public int epipolarTileSize;
		public int numEpipolarTiles;
		public double[] terrainBox;

		public PairEntry( final String id, final double minDisparity, final double maxDisparity, final int epipolarTileSize, final int numEpipolarTiles, final double[] terrainBox )
		{
			this.id = id;
			this.minDisparity = minDisparity;
			this.maxDisparity = maxDisparity;
			this.epipolarTileSize = epipolarTileSize;
			this.numEpipolarTiles = numEpipolarTiles;
			this.terrainBox = terrainBox;
		}
	}

	public String version = VERSION;
	public String backend;
	public String crs;
	public String altReference;
	public double resolution;
	public double[] terrainBox;
	public long[] rasterSize;
	public double terrainTileSize;
	public int numTerrainTiles, numRasterizedTiles;
	public List< PairEntry > pairs = new ArrayList<>();
	public Map< String, String > outputs = new LinkedHashMap<>();
	public Map< String, Number > noData = new LinkedHashMap<>();
	public Map< String, Object > parameters = new LinkedHashMap<>();
	public List< String > warnings = new ArrayList<>();
}

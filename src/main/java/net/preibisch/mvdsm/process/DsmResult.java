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
package net.preibisch.mvdsm.process;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.preibisch.mvdsm.data.CorrespondenceEntry;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.TileGrid;
import net.preibisch.mvdsm.process.boundingbox.TerrainBoundingBox;
import net.preibisch.mvdsm.process.export.MosaicOutput;
import net.preibisch.mvdsm.process.export.RunManifest;
import net.preibisch.mvdsm.process.scheduler.CompletionCounter;

/**
 * Everything a successful run produced.
 */
public class DsmResult
{
	final MosaicOutput mosaic;
	final Map< String, String > outputs;
	final RunManifest manifest;
	final Path manifestFile;
	final TerrainBoundingBox terrainBox;
	final List< PairContext > pairs;
	final TileGrid terrainGrid;
	final List< CorrespondenceEntry > correspondences;
	final CompletionCounter pointClouds, rasterizations;
	final List< String > warnings;

	public DsmResult(
			final MosaicOutput mosaic,
			final Map< String, String > outputs,
			final RunManifest manifest,
			final Path manifestFile,
			final TerrainBoundingBox terrainBox,
			final List< PairContext > pairs,
			final TileGrid terrainGrid,
			final List< CorrespondenceEntry > correspondences,
			final CompletionCounter pointClouds,
			final CompletionCounter rasterizations,
			final List< String > warnings )
	{
		this.mosaic = mosaic;
		this.outputs = outputs;
		this.manifest = manifest;
		this.manifestFile = manifestFile;
		this.terrainBox = terrainBox;
		this.pairs = pairs;
		this.terrainGrid = terrainGrid;
		this.correspondences = correspondences;
		this.pointClouds = pointClouds;
		this.rasterizations = rasterizations;
		this.warnings = Collections.unmodifiableList( warnings );
	}

	public MosaicOutput getMosaic() { return mosaic; }
	public Map< String, String > getOutputs() { return outputs; }
	public RunManifest getManifest() { return manifest; }
	public Path getManifestFile() { return manifestFile; }
	public TerrainBoundingBox getTerrainBox() { return terrainBox; }
	public List< PairContext > getPairs() { return pairs; }
	public TileGrid getTerrainGrid() { return terrainGrid; }
	public List< CorrespondenceEntry > getCorrespondences() { return correspondences; }
	public CompletionCounter getPointCloudCounter() { return pointClouds; }
	public CompletionCounter getRasterizationCounter() { return rasterizations; }
	public List< String > getWarnings() { return warnings; }
}

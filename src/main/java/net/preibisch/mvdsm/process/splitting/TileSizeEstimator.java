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
package net.preibisch.mvdsm.process.splitting;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the edge length of epipolar tiles (bounded correlation memory) and of terrain tiles
 * (roughly constant number of epipolar tiles contributing to one terrain tile).
 *
 * @author Stephan Preibisch
 */
public class TileSizeEstimator
{
	private static final Logger LOG = LoggerFactory.getLogger( TileSizeEstimator.class );

	// memory taken by the correlator and its imports, in MiB
	public static int baseMemoryMiB = 200;

	/**
	 * Memory (in bits) one epipolar pixel costs the semi-global-matching correlator for a given
	 * disparity range: input images, disparity and validity maps, confidence, the cost volumes
	 * and the penalties.
	 *
	 * @param dispRange - dispMax - dispMin
	 * @return bits per pixel
	 */
	public static double bitsPerPixel( final double dispRange )
	{
		final double images = 32 * 2;
		final double disparity = 32;
		final double validity = 16;
		final double confidence = 32;
		final double costVolume = dispRange * 32;
		final double nanMask = dispRange * 8;
		final double costVolumeUInt = dispRange * 8;
		final double penalties = 8 * 32 * 2;
		final double crops = 32 * 2;

		return images + disparity + validity + confidence + 2 * costVolume + 2 * nanMask + 2 * costVolumeUInt + penalties + crops;
	}

	/**
	 * Larger disparity ranges shrink the tile, the result is clamped to [minTileSize, maxTileSize].
	 *
	 * @param dispMin - minimal disparity
	 * @param dispMax - maximal disparity
	 * @param minTileSize - smallest allowed edge
	 * @param maxTileSize - largest allowed edge
	 * @param maxRamPerWorkerMiB - memory a worker may use
	 * @param tileSizeRounding - the edge without margins is a multiple of this
	 * @param margin - margin added on each side of a tile
	 * @return edge length of square epipolar tiles in pixels
	 */
	public static int optimalEpipolarTileSize(
			final double dispMin,
			final double dispMax,
			final int minTileSize,
			final int maxTileSize,
			final int maxRamPerWorkerMiB,
			final int tileSizeRounding,
			final int margin )
	{
		final double pixels = ( ( maxRamPerWorkerMiB - baseMemoryMiB ) * Math.pow( 2, 23 ) ) / bitsPerPixel( dispMax - dispMin );

		int tileSize;

		if ( pixels <= margin )
			tileSize = minTileSize;
		else
			tileSize = 2 * margin + tileSizeRounding * (int)Math.floor( ( Math.sqrt( pixels ) - 2 * margin ) / tileSizeRounding );

		if ( tileSize > maxTileSize )
			tileSize = maxTileSize;
		else if ( tileSize < minTileSize )
			tileSize = minTileSize;

		return tileSize;
	}

	/**
	 * @param terrainArea - terrain area covered by one pair
	 * @param numEpipolarTiles - number of epipolar tiles of that pair
	 * @return edge of the square terrain area one epipolar tile covers on average
	 */
	public static double terrainTileCandidate( final double terrainArea, final int numEpipolarTiles )
	{
		return Math.sqrt( terrainArea / numEpipolarTiles );
	}

	/**
	 * Averages the per-pair candidates and rounds up to a multiple of the resolution.
	 *
	 * @param terrainAreas - terrain area of each pair
	 * @param numEpipolarTiles - number of epipolar tiles of each pair
	 * @param resolution - output resolution
	 * @return terrain tile edge, a positive multiple of resolution
	 */
	public static double optimalTerrainTileSize( final List< Double > terrainAreas, final List< Integer > numEpipolarTiles, final double resolution )
	{
		if ( terrainAreas.isEmpty() || terrainAreas.size() != numEpipolarTiles.size() )
			throw new IllegalArgumentException( "Need one terrain area and one tile count per pair." );

		double sum = 0;

		for ( int i = 0; i < terrainAreas.size(); ++i )
		{
			final double candidate = terrainTileCandidate( terrainAreas.get( i ), numEpipolarTiles.get( i ) );
			LOG.debug( "Terrain tile candidate of pair {}: {}", i, candidate );
			sum += candidate;
		}

		final double mean = sum / terrainAreas.size();
		final long pixels = Math.max( 1, (long)Math.ceil( mean / resolution - GridPartitioner.stepTolerance ) );

		return pixels * resolution;
	}
}

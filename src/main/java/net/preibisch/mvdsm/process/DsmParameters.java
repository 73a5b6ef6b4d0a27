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

import java.util.LinkedHashMap;
import java.util.Map;

import org.locationtech.jts.geom.Geometry;

import net.preibisch.mvdsm.Threads;
import net.preibisch.mvdsm.geometry.ElevationReference;
import net.preibisch.mvdsm.process.rasterization.RasterizationParameters;
import net.preibisch.mvdsm.process.scheduler.BackendType;

/**
 * All options of a DSM run. Validated once before anything is computed.
 *
 * @author Stephan Preibisch
 */
public class DsmParameters
{
	public static double defaultResolution = 0.5;
	public static int defaultRadius = 1;
	public static String defaultBackend = "worker_pool";
	public static long defaultTaskTimeoutSeconds = 600;

	protected String outputDirectory;
	protected double resolution = defaultResolution;
	protected String crs = null;
	protected Geometry roi = null;
	protected String roiCrs = null;

	protected int radius = defaultRadius;
	protected double sigma = Double.NaN;
	protected float dsmNoData = RasterizationParameters.defaultDsmNoData;
	protected float colorNoData = RasterizationParameters.defaultColorNoData;
	protected int maskNoData = RasterizationParameters.defaultMaskNoData;
	protected boolean writeStats = false;

	protected boolean smallComponentsFilter = false;
	protected boolean statisticalOutliersFilter = false;

	protected double minElevationOffset = Double.NaN;
	protected double maxElevationOffset = Double.NaN;
	protected int epipolarTileSize = 0;

	protected boolean useGeoidAltitude = false;
	protected ElevationReference elevationReference = null;
	protected boolean useSecondaryDisparity = false;
	protected boolean snapToFirstImage = false;
	protected boolean alignToLowResDem = false;
	protected boolean persistPointClouds = false;

	protected String backend = defaultBackend;
	protected int numWorkers = Threads.numThreads();
	protected String master = null;
	protected long taskTimeoutSeconds = defaultTaskTimeoutSeconds;

	protected StaticParameters staticParameters = null;

	public DsmParameters( final String outputDirectory )
	{
		this.outputDirectory = outputDirectory;
	}

	public DsmParameters setResolution( final double resolution ) { this.resolution = resolution; return this; }
	public DsmParameters setCrs( final String crs ) { this.crs = crs; return this; }

	/**
	 * @param roi - region of interest polygon
	 * @param roiCrs - its crs, null if it is given in the output crs
	 * @return this
	 */
	public DsmParameters setRegionOfInterest( final Geometry roi, final String roiCrs ) { this.roi = roi; this.roiCrs = roiCrs; return this; }

	public DsmParameters setRadius( final int radius ) { this.radius = radius; return this; }
	public DsmParameters setSigma( final double sigma ) { this.sigma = sigma; return this; }
	public DsmParameters setNoData( final float dsmNoData, final float colorNoData, final int maskNoData ) { this.dsmNoData = dsmNoData; this.colorNoData = colorNoData; this.maskNoData = maskNoData; return this; }
	public DsmParameters setWriteStats( final boolean writeStats ) { this.writeStats = writeStats; return this; }
	public DsmParameters setSmallComponentsFilter( final boolean enabled ) { this.smallComponentsFilter = enabled; return this; }
	public DsmParameters setStatisticalOutliersFilter( final boolean enabled ) { this.statisticalOutliersFilter = enabled; return this; }

	/**
	 * Overrides the disparity range of every pair with elevation offsets (converted through the
	 * disparity to altitude ratio of each pair). NaN keeps the estimated bound.
	 *
	 * @param min - minimal elevation offset in meters
	 * @param max - maximal elevation offset in meters
	 * @return this
	 */
	public DsmParameters setElevationOffsets( final double min, final double max ) { this.minElevationOffset = min; this.maxElevationOffset = max; return this; }

	/**
	 * @param epipolarTileSize - forced edge length of epipolar tiles, 0 to estimate it
	 * @return this
	 */
	public DsmParameters setEpipolarTileSize( final int epipolarTileSize ) { this.epipolarTileSize = epipolarTileSize; return this; }

	public DsmParameters setGeoidAltitude( final ElevationReference elevationReference ) { this.useGeoidAltitude = elevationReference != null; this.elevationReference = elevationReference; return this; }
	public DsmParameters setUseSecondaryDisparity( final boolean use ) { this.useSecondaryDisparity = use; return this; }
	public DsmParameters setSnapToFirstImage( final boolean snap ) { this.snapToFirstImage = snap; return this; }
	public DsmParameters setAlignToLowResDem( final boolean align ) { this.alignToLowResDem = align; return this; }
	public DsmParameters setPersistPointClouds( final boolean persist ) { this.persistPointClouds = persist; return this; }

	public DsmParameters setBackend( final String backend ) { this.backend = backend; return this; }
	public DsmParameters setNumWorkers( final int numWorkers ) { this.numWorkers = numWorkers; return this; }
	public DsmParameters setMaster( final String master ) { this.master = master; return this; }
	public DsmParameters setTaskTimeoutSeconds( final long seconds ) { this.taskTimeoutSeconds = seconds; return this; }
	public DsmParameters setStaticParameters( final StaticParameters staticParameters ) { this.staticParameters = staticParameters; return this; }

	public String getOutputDirectory() { return outputDirectory; }
	public double getResolution() { return resolution; }
	public String getCrs() { return crs; }
	public Geometry getRegionOfInterest() { return roi; }
	public String getRegionOfInterestCrs() { return roiCrs; }
	public int getRadius() { return radius; }
	public double getSigma() { return sigma; }
	public boolean writeStats() { return writeStats; }
	public boolean useSmallComponentsFilter() { return smallComponentsFilter; }
	public boolean useStatisticalOutliersFilter() { return statisticalOutliersFilter; }
	public double getMinElevationOffset() { return minElevationOffset; }
	public double getMaxElevationOffset() { return maxElevationOffset; }
	public int getEpipolarTileSize() { return epipolarTileSize; }
	public boolean useGeoidAltitude() { return useGeoidAltitude; }
	public ElevationReference getElevationReference() { return elevationReference; }
	public boolean useSecondaryDisparity() { return useSecondaryDisparity; }
	public boolean snapToFirstImage() { return snapToFirstImage; }
	public boolean alignToLowResDem() { return alignToLowResDem; }
	public boolean persistPointClouds() { return persistPointClouds; }
	public String getBackend() { return backend; }
	public int getNumWorkers() { return numWorkers; }
	public String getMaster() { return master; }
	public long getTaskTimeoutSeconds() { return taskTimeoutSeconds; }

	public StaticParameters getStaticParameters()
	{
		if ( staticParameters == null )
			staticParameters = StaticParameters.load();

		return staticParameters;
	}

	/**
	 * @throws DsmConfigurationException for the first invalid option
	 */
	public void validate()
	{
		if ( outputDirectory == null || outputDirectory.trim().isEmpty() )
			throw new DsmConfigurationException( "No output directory given." );

		if ( !( resolution > 0 ) )
			throw new DsmConfigurationException( "Resolution must be > 0, got " + resolution );

		if ( radius < 0 )
			throw new DsmConfigurationException( "Rasterization radius must be >= 0, got " + radius );

		if ( !Double.isNaN( sigma ) && !( sigma > 0 ) )
			throw new DsmConfigurationException( "Rasterization sigma must be > 0, got " + sigma );

		if ( numWorkers < 1 )
			throw new DsmConfigurationException( "Number of workers must be >= 1, got " + numWorkers );

		if ( taskTimeoutSeconds <= 0 )
			throw new DsmConfigurationException( "Task timeout must be > 0, got " + taskTimeoutSeconds );

		if ( epipolarTileSize < 0 )
			throw new DsmConfigurationException( "Epipolar tile size must be >= 0, got " + epipolarTileSize );

		if ( !Double.isNaN( minElevationOffset ) && !Double.isNaN( maxElevationOffset ) && minElevationOffset >= maxElevationOffset )
			throw new DsmConfigurationException( "Minimal elevation offset (" + minElevationOffset +
					") must be smaller than the maximal elevation offset (" + maxElevationOffset + ")" );

		if ( roi != null && roi.isEmpty() )
			throw new DsmConfigurationException( "Region of interest is empty." );

		BackendType.fromName( backend );

		final StaticParameters.Tiling tiling = getStaticParameters().tiling;

		if ( tiling.minEpipolarTileSize < 1 || tiling.maxEpipolarTileSize < tiling.minEpipolarTileSize || tiling.tileSizeRounding < 1 )
			throw new DsmConfigurationException( "Invalid epipolar tiling bounds [" + tiling.minEpipolarTileSize + ", " +
					tiling.maxEpipolarTileSize + "], rounding " + tiling.tileSizeRounding );
	}

	/**
	 * @param numBands - number of color bands of the output
	 * @param writeMask - whether a mask layer is produced
	 * @return the rasterization record shared by all rasterization tasks
	 */
	public RasterizationParameters rasterizationParameters( final int numBands, final boolean writeMask )
	{
		final RasterizationParameters p = new RasterizationParameters( resolution, radius, sigma, numBands, writeMask, writeStats )
				.setNoData( dsmNoData, colorNoData, maskNoData );

		final StaticParameters sp = getStaticParameters();

		if ( smallComponentsFilter )
			p.setSmallComponentsFilter(
					sp.smallComponents.connectionDistance,
					sp.smallComponents.minPointsPerComponent,
					sp.smallComponents.clustersDistanceThreshold(),
					sp.smallComponents.onGroundMargin );

		if ( statisticalOutliersFilter )
			p.setStatisticalOutliersFilter( sp.statisticalOutliers.k, sp.statisticalOutliers.stdDevFactor );

		return p;
	}

	/**
	 * @return the options as recorded in the manifest
	 */
	public Map< String, Object > toMap()
	{
		final LinkedHashMap< String, Object > map = new LinkedHashMap<>();

		map.put( "resolution", resolution );
		map.put( "radius", radius );
		map.put( "sigma", Double.isNaN( sigma ) ? resolution : sigma );
		map.put( "writeStats", writeStats );
		map.put( "smallComponentsFilter", smallComponentsFilter );
		map.put( "statisticalOutliersFilter", statisticalOutliersFilter );
		if ( !Double.isNaN( minElevationOffset ) )
			map.put( "minElevationOffset", minElevationOffset );
		if ( !Double.isNaN( maxElevationOffset ) )
			map.put( "maxElevationOffset", maxElevationOffset );
		map.put( "epipolarTileSize", epipolarTileSize );
		map.put( "useSecondaryDisparity", useSecondaryDisparity );
		map.put( "snapToFirstImage", snapToFirstImage );
		map.put( "alignToLowResDem", alignToLowResDem );
		map.put( "persistPointClouds", persistPointClouds );
		map.put( "numWorkers", numWorkers );
		map.put( "taskTimeoutSeconds", taskTimeoutSeconds );

		return map;
	}
}

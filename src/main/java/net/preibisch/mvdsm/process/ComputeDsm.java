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

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.data.CorrespondenceEntry;
import net.preibisch.mvdsm.data.DisparityRange;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.TileGrid;
import net.preibisch.mvdsm.geometry.CoordinateTransformer;
import net.preibisch.mvdsm.geometry.ElevationReference;
import net.preibisch.mvdsm.geometry.PointGenerationOptions;
import net.preibisch.mvdsm.geometry.Proj4jCoordinateTransformer;
import net.preibisch.mvdsm.geometry.StereoGeometry;
import net.preibisch.mvdsm.process.boundingbox.BoundingBoxTools;
import net.preibisch.mvdsm.process.boundingbox.PairFootprint;
import net.preibisch.mvdsm.process.boundingbox.TerrainBoundingBox;
import net.preibisch.mvdsm.process.boundingbox.TerrainBoundingBoxResolver;
import net.preibisch.mvdsm.process.correspondence.CorrespondenceMapper;
import net.preibisch.mvdsm.process.correspondence.EpipolarTileFootprints;
import net.preibisch.mvdsm.process.export.ManifestIO;
import net.preibisch.mvdsm.process.export.MosaicAssembler;
import net.preibisch.mvdsm.process.export.MosaicOutput;
import net.preibisch.mvdsm.process.export.MosaicWriter;
import net.preibisch.mvdsm.process.export.N5MosaicWriter;
import net.preibisch.mvdsm.process.export.RunManifest;
import net.preibisch.mvdsm.process.rasterization.RasterizationParameters;
import net.preibisch.mvdsm.process.scheduler.BackendType;
import net.preibisch.mvdsm.process.scheduler.BroadcastRef;
import net.preibisch.mvdsm.process.scheduler.ExecutionBackend;
import net.preibisch.mvdsm.process.scheduler.TaskScheduler;
import net.preibisch.mvdsm.process.splitting.GridPartitioner;
import net.preibisch.mvdsm.process.splitting.TileSizeEstimator;

/**
 * Computes one DSM from several prepared stereo pairs: resolves the terrain boxes, tiles the
 * epipolar images and the terrain, generates point clouds per epipolar tile, rasterizes every
 * terrain tile from the point clouds that may fall into it and writes the mosaic and a manifest.
 *
 * @author Stephan Preibisch
 */
public class ComputeDsm
{
	private static final Logger LOG = LoggerFactory.getLogger( ComputeDsm.class );

	public static String tmpContainerName = "tmp";

	final StereoGeometry geometry;
	final CoordinateTransformer transformer;
	MosaicWriter mosaicWriter = null;

	public ComputeDsm( final StereoGeometry geometry, final CoordinateTransformer transformer )
	{
		this.geometry = geometry;
		this.transformer = transformer;
	}

	public ComputeDsm( final StereoGeometry geometry )
	{
		this( geometry, new Proj4jCoordinateTransformer() );
	}

	/**
	 * @param mosaicWriter - writer for the final mosaic, null writes N5 into the output directory
	 * @return this
	 */
	public ComputeDsm setMosaicWriter( final MosaicWriter mosaicWriter )
	{
		this.mosaicWriter = mosaicWriter;
		return this;
	}

	public DsmResult run( final List< PairConfiguration > pairs, final DsmParameters params ) throws IOException
	{
		params.validate();
		checkPairs( pairs );

		final BackendType backendType = BackendType.fromName( params.getBackend() );
		final StaticParameters.Tiling tiling = params.getStaticParameters().tiling;
		final double resolution = params.getResolution();
		final Path outputDirectory = Paths.get( params.getOutputDirectory() );

		LOG.info( "Computing DSM from {} pair(s), resolution={}, backend={}", pairs.size(), resolution, backendType );

		final ArrayList< String > warnings = new ArrayList<>();
		advisoryWarnings( pairs, params, warnings );

		final List< DisparityRange > ranges = disparityRanges( pairs, params, warnings );

		// terrain boxes, fails before anything is scheduled if the region of interest is not feasible
		final TerrainBoundingBox terrainBox = new TerrainBoundingBoxResolver( geometry, transformer, resolution ).resolve(
				pairs, ranges, params.getCrs(), params.getRegionOfInterest(), params.getRegionOfInterestCrs() );

		warnings.addAll( terrainBox.getWarnings() );

		final String crs = terrainBox.getCrs();

		// epipolar tiling
		final ArrayList< PairContext > contexts = new ArrayList<>();
		final ArrayList< Double > terrainAreas = new ArrayList<>();
		final ArrayList< Integer > numEpipolarTiles = new ArrayList<>();

		for ( int i = 0; i < pairs.size(); ++i )
		{
			final PairConfiguration pair = pairs.get( i );
			final DisparityRange range = ranges.get( i );
			final PairFootprint footprint = terrainBox.getPair( i );

			final int tileSize = params.getEpipolarTileSize() > 0 ? params.getEpipolarTileSize() :
				TileSizeEstimator.optimalEpipolarTileSize(
						range.getMin(), range.getMax(),
						tiling.minEpipolarTileSize, tiling.maxEpipolarTileSize,
						tiling.maxRamPerWorkerMiB, tiling.tileSizeRounding, tiling.epipolarTileMargin );

			final TileGrid grid = GridPartitioner.grid( pair.getEpipolarExtent(), tileSize, tileSize );

			LOG.info( "Pair '{}': epipolar tile size {} pixels, {}x{} = {} epipolar tiles",
					pair.getId(), tileSize, grid.numRows(), grid.numCols(), grid.size() );

			contexts.add( new PairContext( i, pair, range, tileSize, grid, footprint.getBox(), footprint.getTerrainArea() ) );
			terrainAreas.add( footprint.getTerrainArea() );
			numEpipolarTiles.add( grid.size() );
		}

		// terrain tiling
		final double terrainTileSize = TileSizeEstimator.optimalTerrainTileSize( terrainAreas, numEpipolarTiles, resolution );
		final TileGrid terrainGrid = GridPartitioner.grid( terrainBox.getGlobal(), terrainTileSize, terrainTileSize );

		LOG.info( "Terrain tile size {} ({} pixels), {}x{} = {} terrain tiles",
				terrainTileSize, Math.round( terrainTileSize / resolution ), terrainGrid.numRows(), terrainGrid.numCols(), terrainGrid.size() );

		final boolean writeMask = hasMask( pairs );
		final RasterizationParameters rasterParams = params.rasterizationParameters( numColorBands( pairs ), writeMask );
		final MosaicAssembler assembler = new MosaicAssembler( new MosaicOutput( terrainBox.getGlobal(), crs, rasterParams ) );

		final ArrayList< PointGenerationOptions > options = new ArrayList<>();
		for ( final PairConfiguration pair : pairs )
			options.add( new PointGenerationOptions(
					crs,
					null,
					params.useSecondaryDisparity(),
					params.snapToFirstImage(),
					params.alignToLowResDem() && pair.hasLowResDemCorrection(),
					writeMask ) );

		final String container = params.persistPointClouds() ? outputDirectory.resolve( tmpContainerName ).toString() : null;

		if ( container != null )
			new N5FSWriter( container ).close();

		final List< CorrespondenceEntry > entries;
		final TaskScheduler scheduler;

		try ( final ExecutionBackend backend = backendType.create( params.getNumWorkers(), params.getMaster() ) )
		{
			backend.start();

			final BroadcastRef< ElevationReference > elevationReference =
					params.useGeoidAltitude() ? backend.broadcast( params.getElevationReference() ) : null;

			scheduler = new TaskScheduler( backend, params.getTaskTimeoutSeconds(), TimeUnit.SECONDS );
			scheduler.submitPointClouds( contexts, geometry, options, elevationReference, container );

			final ArrayList< EpipolarTileFootprints > footprints = new ArrayList<>();
			for ( final PairContext context : contexts )
				footprints.add( CorrespondenceMapper.projectEpipolarGrid( geometry, context, crs ) );

			entries = CorrespondenceMapper.map( terrainGrid.getTiles(), footprints, rasterParams.terrainMargin() );

			scheduler.rasterize( entries, rasterParams, assembler::write );
		}
		finally
		{
			if ( container != null )
				removeContainer( container );
		}

		final int tilePixels = (int)Math.round( terrainTileSize / resolution );
		final MosaicWriter writer = mosaicWriter != null ? mosaicWriter :
			new N5MosaicWriter( outputDirectory.resolve( N5MosaicWriter.containerName ).toString() );

		final Map< String, String > outputs = writer.write( assembler.getOutput(), new int[] { tilePixels, tilePixels } );

		final RunManifest manifest = manifest( params, backendType, terrainBox, contexts, terrainTileSize, terrainGrid, entries, assembler.getOutput(), outputs, warnings );
		final Path manifestFile = ManifestIO.write( manifest, outputDirectory );

		LOG.info( "DSM written, manifest: {}", manifestFile );

		return new DsmResult(
				assembler.getOutput(), outputs, manifest, manifestFile, terrainBox, contexts, terrainGrid, entries,
				scheduler.getPointCloudCounter(), scheduler.getRasterizationCounter(), warnings );
	}

	protected static void checkPairs( final List< PairConfiguration > pairs )
	{
		if ( pairs == null || pairs.isEmpty() )
			throw new DsmConfigurationException( "No stereo pairs given." );

		final HashSet< String > ids = new HashSet<>();

		for ( final PairConfiguration pair : pairs )
			if ( !ids.add( pair.getId() ) )
				throw new DsmConfigurationException( "Pair id '" + pair.getId() + "' is used more than once." );
	}

	/**
	 * Conditions that do not abort the run but change how a pair is processed.
	 *
	 * @param pairs - all pairs
	 * @param params - the run options
	 * @param warnings - collects the warnings
	 */
	public static void advisoryWarnings( final List< PairConfiguration > pairs, final DsmParameters params, final List< String > warnings )
	{
		final String firstLeft = pairs.get( 0 ).getLeftImage();

		for ( final PairConfiguration pair : pairs )
		{
			if ( params.snapToFirstImage() && !firstLeft.equals( pair.getLeftImage() ) )
				warn( warnings, "Snap to first image requested, but pair '" + pair.getId() + "' has a different reference image (" +
						pair.getLeftImage() + " instead of " + firstLeft + ")" );

			if ( params.alignToLowResDem() && !pair.hasLowResDemCorrection() )
				warn( warnings, "Alignment with the low resolution DEM requested, but pair '" + pair.getId() +
						"' has no correction, it is processed without alignment" );
		}
	}

	/**
	 * Applies the elevation offset overrides. The minimum is only replaced if the override is larger
	 * than the estimated minimum, the maximum is always replaced; narrowing the range is logged.
	 *
	 * @param pairs - all pairs
	 * @param params - the run options
	 * @param warnings - collects the warnings
	 * @return the disparity range used for each pair
	 * @throws DsmConfigurationException if a resulting range is empty
	 */
	public static List< DisparityRange > disparityRanges( final List< PairConfiguration > pairs, final DsmParameters params, final List< String > warnings )
	{
		final ArrayList< DisparityRange > ranges = new ArrayList<>();

		for ( final PairConfiguration pair : pairs )
		{
			final double ratio = pair.getDispToAltRatio();
			double dmin = pair.getMinDisparity();
			double dmax = pair.getMaxDisparity();

			if ( !Double.isNaN( params.getMinElevationOffset() ) )
			{
				final double userMin = params.getMinElevationOffset() / ratio;

				if ( userMin > dmin )
				{
					warn( warnings, String.format( "Overridden disparity minimum = %.3f pix. (= %.3f m.) is greater than the estimated minimum = %.3f pix. (= %.3f m.) for pair '%s'",
							userMin, params.getMinElevationOffset(), dmin, dmin * ratio, pair.getId() ) );
					dmin = userMin;
				}
			}

			if ( !Double.isNaN( params.getMaxElevationOffset() ) )
			{
				final double userMax = params.getMaxElevationOffset() / ratio;

				if ( userMax < dmax )
					warn( warnings, String.format( "Overridden disparity maximum = %.3f pix. (= %.3f m.) is lower than the estimated maximum = %.3f pix. (= %.3f m.) for pair '%s'",
							userMax, params.getMaxElevationOffset(), dmax, dmax * ratio, pair.getId() ) );

				dmax = userMax;
			}

			if ( !( dmin < dmax ) )
				throw new DsmConfigurationException( String.format( "Disparity range [%.3f, %.3f] of pair '%s' is empty, check the elevation offsets.", dmin, dmax, pair.getId() ) );

			final DisparityRange range = new DisparityRange( dmin, dmax );

			LOG.info( "Disparity range of pair '{}': {} (or [{} m., {} m.])", pair.getId(), range, dmin * ratio, dmax * ratio );

			ranges.add( range );
		}

		return ranges;
	}

	protected static boolean hasMask( final List< PairConfiguration > pairs )
	{
		for ( final PairConfiguration pair : pairs )
			if ( pair.hasLeftMask() )
				return true;

		return false;
	}

	protected static int numColorBands( final List< PairConfiguration > pairs )
	{
		int numBands = Integer.MAX_VALUE;

		for ( final PairConfiguration pair : pairs )
			numBands = Math.min( numBands, pair.getNumColorBands() );

		return numBands;
	}

	protected static void warn( final List< String > warnings, final String warning )
	{
		LOG.warn( warning );
		warnings.add( warning );
	}

	protected static void removeContainer( final String container )
	{
		final N5Writer n5 = new N5FSWriter( container );

		try
		{
			n5.remove();
		}
		finally
		{
			n5.close();
		}
	}

	protected static RunManifest manifest(
			final DsmParameters params,
			final BackendType backendType,
			final TerrainBoundingBox terrainBox,
			final List< PairContext > contexts,
			final double terrainTileSize,
			final TileGrid terrainGrid,
			final List< CorrespondenceEntry > entries,
			final MosaicOutput mosaic,
			final Map< String, String > outputs,
			final List< String > warnings )
	{
		final RunManifest manifest = new RunManifest();

		manifest.backend = backendType.name();
		manifest.crs = terrainBox.getCrs();
		manifest.altReference = params.useGeoidAltitude() ? "geoid" : "ellipsoid";
		manifest.resolution = params.getResolution();
		manifest.terrainBox = terrainBox.getGlobal().toArray();
		manifest.rasterSize = BoundingBoxTools.pixelSize( terrainBox.getGlobal(), params.getResolution() );
		manifest.terrainTileSize = terrainTileSize;
		manifest.numTerrainTiles = terrainGrid.size();
		manifest.numRasterizedTiles = entries.size();

		for ( final PairContext c : contexts )
			manifest.pairs.add( new RunManifest.PairEntry(
					c.getId(),
					c.getDisparityRange().getMin(),
					c.getDisparityRange().getMax(),
					c.getEpipolarTileSize(),
					c.getEpipolarGrid().size(),
					c.getTerrainBox().toArray() ) );

		manifest.outputs.putAll( outputs );

		final RasterizationParameters rp = mosaic.getParameters();
		manifest.noData.put( "dsm", rp.getDsmNoData() );
		manifest.noData.put( "color", rp.getColorNoData() );
		if ( mosaic.hasMask() )
			manifest.noData.put( "mask", rp.getMaskNoData() );

		manifest.parameters.putAll( params.toMap() );
		manifest.warnings.addAll( warnings );

		return manifest;
	}
}

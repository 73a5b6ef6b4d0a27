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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.preibisch.mvdsm.data.DisparityRange;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.geometry.ElevationReference;
import net.preibisch.mvdsm.geometry.SyntheticStereoGeometry;
import net.preibisch.mvdsm.process.export.ManifestIO;
import net.preibisch.mvdsm.process.export.MosaicOutput;
import net.preibisch.mvdsm.process.export.MosaicWriter;
import net.preibisch.mvdsm.process.export.N5MosaicWriter;
import net.preibisch.mvdsm.process.export.RunManifest;

public class ComputeDsmTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	static List< PairConfiguration > pairs()
	{
		return Arrays.asList(
				SyntheticStereoGeometry.pair( "one", 0, 0 ),
				SyntheticStereoGeometry.pair( "two", 100, 0 ) );
	}

	DsmParameters params( final String backend ) throws Exception
	{
		return new DsmParameters( folder.newFolder().getAbsolutePath() )
				.setCrs( SyntheticStereoGeometry.CRS )
				.setBackend( backend )
				.setNumWorkers( 2 )
				.setTaskTimeoutSeconds( 60 );
	}

	@Test
	public void testTwoPairs() throws Exception
	{
		final DsmParameters params = params( "sequential" );
		final DsmResult result = new ComputeDsm( new SyntheticStereoGeometry() ).run( pairs(), params );

		assertEquals( new Extent( 0, 0, 150, 50, SyntheticStereoGeometry.CRS ), result.getTerrainBox().getGlobal() );
		assertEquals( 3, result.getTerrainGrid().size() );
		assertEquals( 3, result.getCorrespondences().size() );

		// the middle terrain tile borders both pairs
		assertEquals( 2, result.getCorrespondences().get( 1 ).size() );
		assertEquals( 2, result.getPointCloudCounter().getCompleted() );
		assertEquals( 3, result.getRasterizationCounter().getCompleted() );

		final MosaicOutput mosaic = result.getMosaic();
		assertEquals( 300, mosaic.getWidth() );
		assertEquals( 100, mosaic.getHeight() );

		// both footprints are fully populated (the radius adds one column on each side), the gap is empty
		final float[] dsm = MosaicOutput.data( mosaic.getDsm() );

		for ( int row = 0; row < 100; ++row )
			for ( int col = 0; col < 300; ++col )
			{
				final float z = dsm[ row * 300 + col ];

				if ( col <= 100 || col >= 199 )
					assertTrue( "pixel (" + col + ", " + row + "): " + z, z >= 100 && z <= 101 );
				else
					assertEquals( "pixel (" + col + ", " + row + ")", -32768, z, 0 );
			}

		assertFalse( mosaic.hasMask() );
		assertTrue( new File( params.getOutputDirectory(), N5MosaicWriter.containerName + "/dsm" ).isDirectory() );

		final RunManifest manifest = ManifestIO.read( result.getManifestFile() );

		assertEquals( SyntheticStereoGeometry.CRS, manifest.crs );
		assertEquals( "ellipsoid", manifest.altReference );
		assertEquals( "SEQUENTIAL", manifest.backend );
		assertArrayEquals( new long[] { 300, 100 }, manifest.rasterSize );
		// sqrt of the envelope area [-0.5, 50.5] x [0, 50], rounded up to the resolution
		assertEquals( 50.5, manifest.terrainTileSize, 0 );
		assertEquals( 2, manifest.pairs.size() );
		assertEquals( "two", manifest.pairs.get( 1 ).id );
		assertEquals( 1, manifest.pairs.get( 1 ).numEpipolarTiles );
		assertEquals( Arrays.asList( "dsm", "clr/0" ), new ArrayList<>( manifest.outputs.keySet() ) );
		assertEquals( -32768, manifest.noData.get( "dsm" ).doubleValue(), 0 );
		assertTrue( manifest.warnings.isEmpty() );
	}

	@Test
	public void testMaskStatsAndGeoid() throws Exception
	{
		final List< PairConfiguration > pairs = Arrays.asList(
				SyntheticStereoGeometry.pair( "one", 0, 0 ).setLeftMask( "one_mask.tif" ),
				SyntheticStereoGeometry.pair( "two", 100, 0 ) );

		final ElevationReference geoid = ( lon, lat ) -> 10.0;

		final DsmParameters params = params( "sequential" )
				.setWriteStats( true )
				.setSigma( 1.0 )
				.setGeoidAltitude( geoid );

		final ArrayList< MosaicOutput > written = new ArrayList<>();

		final MosaicWriter writer = ( mosaic, blockSize ) ->
		{
			written.add( mosaic );
			final Map< String, String > outputs = new LinkedHashMap<>();
			outputs.put( "dsm", "memory" );
			return outputs;
		};

		final DsmResult result = new ComputeDsm( new SyntheticStereoGeometry() ).setMosaicWriter( writer ).run( pairs, params );
		final MosaicOutput mosaic = result.getMosaic();

		assertEquals( 1, written.size() );
		assertTrue( written.get( 0 ) == mosaic );
		assertFalse( new File( params.getOutputDirectory(), N5MosaicWriter.containerName ).exists() );

		assertTrue( mosaic.hasMask() );
		assertTrue( mosaic.hasStats() );

		final int populated = 50 * 300 + 50;
		final int gap = 50 * 300 + 150;

		assertEquals( 1, MosaicOutput.shortData( mosaic.getMask() )[ populated ] );
		assertEquals( mosaic.getParameters().getMaskNoData(), MosaicOutput.shortData( mosaic.getMask() )[ gap ] & 0xffff );
		assertTrue( MosaicOutput.shortData( mosaic.getNPts() )[ populated ] > 0 );
		assertEquals( 0, MosaicOutput.shortData( mosaic.getNPts() )[ gap ] );

		// heights are relative to the geoid
		final float z = MosaicOutput.data( mosaic.getDsm() )[ populated ];
		assertTrue( "z = " + z, z >= 90 && z <= 91 );

		final float mean = MosaicOutput.data( mosaic.getMean() )[ populated ];
		assertTrue( "mean = " + mean, mean >= 90 && mean <= 91 );

		final RunManifest manifest = ManifestIO.read( result.getManifestFile() );

		assertEquals( "geoid", manifest.altReference );
		assertEquals( "memory", manifest.outputs.get( "dsm" ) );
		assertEquals( 1, manifest.outputs.size() );
		assertTrue( manifest.noData.containsKey( "mask" ) );
	}

	@Test
	public void testBackendsAgree() throws Exception
	{
		final MosaicOutput sequential = new ComputeDsm( new SyntheticStereoGeometry() )
				.run( pairs(), params( "sequential" ).setEpipolarTileSize( 50 ) ).getMosaic();

		final DsmResult pool = new ComputeDsm( new SyntheticStereoGeometry().sleep( 5 ) )
				.run( pairs(), params( "multiprocessing" ).setEpipolarTileSize( 50 ) );

		assertEquals( 8, pool.getPointCloudCounter().getCompleted() );
		assertArrayEquals( MosaicOutput.data( sequential.getDsm() ), MosaicOutput.data( pool.getMosaic().getDsm() ), 0 );
		assertArrayEquals( MosaicOutput.data( sequential.getColor( 0 ) ), MosaicOutput.data( pool.getMosaic().getColor( 0 ) ), 0 );
	}

	@Test
	public void testSparkBackend() throws Exception
	{
		final MosaicOutput sequential = new ComputeDsm( new SyntheticStereoGeometry() )
				.run( pairs(), params( "sequential" ) ).getMosaic();

		final MosaicOutput spark = new ComputeDsm( new SyntheticStereoGeometry() )
				.run( pairs(), params( "spark" ) ).getMosaic();

		assertArrayEquals( MosaicOutput.data( sequential.getDsm() ), MosaicOutput.data( spark.getDsm() ), 0 );
	}

	@Test
	public void testPersistedPointCloudsAreRemoved() throws Exception
	{
		final DsmParameters params = params( "worker_pool" ).setPersistPointClouds( true ).setEpipolarTileSize( 50 );
		final DsmResult result = new ComputeDsm( new SyntheticStereoGeometry() ).run( pairs(), params );

		final MosaicOutput inMemory = new ComputeDsm( new SyntheticStereoGeometry() )
				.run( pairs(), params( "worker_pool" ).setEpipolarTileSize( 50 ) ).getMosaic();

		assertFalse( new File( params.getOutputDirectory(), ComputeDsm.tmpContainerName ).exists() );
		assertArrayEquals( MosaicOutput.data( inMemory.getDsm() ), MosaicOutput.data( result.getMosaic().getDsm() ), 0 );
	}

	@Test
	public void testRegionOfInterestOutsideOfAllPairs() throws Exception
	{
		final DsmParameters params = params( "sequential" )
				.setRegionOfInterest( SyntheticStereoGeometry.square( 1000, 1000, 1100, 1100 ), null );

		final int calls = SyntheticStereoGeometry.GENERATE_CALLS.get();

		try
		{
			new ComputeDsm( new SyntheticStereoGeometry() ).run( pairs(), params );
			fail( "region of interest outside of all pairs was accepted" );
		}
		catch ( final GeometricInfeasibilityException e )
		{
			assertEquals( calls, SyntheticStereoGeometry.GENERATE_CALLS.get() );
			assertFalse( new File( params.getOutputDirectory(), ManifestIO.FILE_NAME ).exists() );
		}
	}

	@Test
	public void testRegionOfInterest() throws Exception
	{
		final DsmParameters params = params( "sequential" )
				.setRegionOfInterest( SyntheticStereoGeometry.square( 10, 10, 30.2, 20 ), null );

		final DsmResult result = new ComputeDsm( new SyntheticStereoGeometry() ).run( pairs(), params );

		assertEquals( new Extent( 10, 10, 30.5, 20, SyntheticStereoGeometry.CRS ), result.getTerrainBox().getGlobal() );
		assertEquals( 41, result.getMosaic().getWidth() );
		assertEquals( 20, result.getMosaic().getHeight() );
		assertEquals( 1, result.getWarnings().size() );
		assertTrue( result.getWarnings().get( 0 ).contains( "'two'" ) );
	}

	@Test
	public void testUnknownBackend() throws Exception
	{
		final int calls = SyntheticStereoGeometry.GENERATE_CALLS.get();

		try
		{
			new ComputeDsm( new SyntheticStereoGeometry() ).run( pairs(), params( "mpi" ) );
			fail( "unknown backend was accepted" );
		}
		catch ( final DsmConfigurationException e )
		{
			assertTrue( e.getMessage().contains( "mpi" ) );
			assertEquals( calls, SyntheticStereoGeometry.GENERATE_CALLS.get() );
		}
	}

	@Test( expected = DsmConfigurationException.class )
	public void testDuplicatePairIds() throws Exception
	{
		new ComputeDsm( new SyntheticStereoGeometry() ).run(
				Arrays.asList( SyntheticStereoGeometry.pair( "one", 0, 0 ), SyntheticStereoGeometry.pair( "one", 100, 0 ) ),
				params( "sequential" ) );
	}

	@Test
	public void testTaskFailureAbortsTheRun() throws Exception
	{
		final DsmParameters params = params( "worker_pool" ).setPersistPointClouds( true ).setEpipolarTileSize( 50 );

		try
		{
			new ComputeDsm( new SyntheticStereoGeometry().failOnTile( 1, 0 ) ).run( pairs(), params );
			fail( "failing point cloud task was not reported" );
		}
		catch ( final TaskExecutionException e )
		{
			assertTrue( e.getTask(), e.getTask().contains( "epipolar tile (1, 0)" ) );
			assertFalse( new File( params.getOutputDirectory(), ComputeDsm.tmpContainerName ).exists() );
			assertFalse( new File( params.getOutputDirectory(), N5MosaicWriter.containerName ).exists() );
			assertFalse( new File( params.getOutputDirectory(), ManifestIO.FILE_NAME ).exists() );
		}
	}

	@Test
	public void testElevationOffsets() throws Exception
	{
		final ArrayList< String > warnings = new ArrayList<>();
		final List< DisparityRange > ranges = ComputeDsm.disparityRanges( pairs(), params( "sequential" ).setElevationOffsets( -2, 3 ), warnings );

		assertEquals( -2, ranges.get( 0 ).getMin(), 0 );
		assertEquals( 3, ranges.get( 0 ).getMax(), 0 );
		assertEquals( 4, warnings.size() );

		// a smaller minimum is ignored, the maximum is always applied
		warnings.clear();
		final List< DisparityRange > wider = ComputeDsm.disparityRanges( pairs(), params( "sequential" ).setElevationOffsets( -20, 20 ), warnings );

		assertEquals( -5, wider.get( 1 ).getMin(), 0 );
		assertEquals( 20, wider.get( 1 ).getMax(), 0 );
		assertTrue( warnings.isEmpty() );

		try
		{
			ComputeDsm.disparityRanges( pairs(), params( "sequential" ).setElevationOffsets( Double.NaN, -6 ), warnings );
			fail( "empty disparity range was accepted" );
		}
		catch ( final DsmConfigurationException e )
		{
			assertTrue( e.getMessage().contains( "'one'" ) );
		}
	}

	@Test
	public void testAdvisoryWarnings() throws Exception
	{
		final ArrayList< String > warnings = new ArrayList<>();
		final List< PairConfiguration > pairs = Arrays.asList(
				SyntheticStereoGeometry.pair( "one", 0, 0 ).setLowResDemCorrection( true ),
				SyntheticStereoGeometry.pair( "two", 100, 0 ) );

		ComputeDsm.advisoryWarnings( pairs, params( "sequential" ).setSnapToFirstImage( true ).setAlignToLowResDem( true ), warnings );

		assertEquals( 2, warnings.size() );
		assertTrue( warnings.get( 0 ).contains( "two_left.tif" ) );
		assertTrue( warnings.get( 1 ).contains( "without alignment" ) );
	}

	@Test
	public void testInvalidOptions() throws Exception
	{
		for ( final DsmParameters p : Arrays.asList(
				params( "sequential" ).setResolution( 0 ),
				params( "sequential" ).setRadius( -1 ),
				params( "sequential" ).setNumWorkers( 0 ),
				params( "sequential" ).setTaskTimeoutSeconds( 0 ),
				params( "sequential" ).setElevationOffsets( 5, 5 ),
				new DsmParameters( " " ) ) )
		{
			try
			{
				p.validate();
				fail( "invalid options were accepted" );
			}
			catch ( final DsmConfigurationException e )
			{
				assertFalse( e.getMessage().isEmpty() );
			}
		}
	}
}

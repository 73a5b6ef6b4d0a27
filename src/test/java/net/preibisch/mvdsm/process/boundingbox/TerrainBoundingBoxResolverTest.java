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
package net.preibisch.mvdsm.process.boundingbox;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.preibisch.mvdsm.data.DisparityRange;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.geometry.Proj4jCoordinateTransformer;
import net.preibisch.mvdsm.geometry.SyntheticStereoGeometry;
import net.preibisch.mvdsm.process.GeometricInfeasibilityException;

public class TerrainBoundingBoxResolverTest
{
	final SyntheticStereoGeometry geometry = new SyntheticStereoGeometry();
	final TerrainBoundingBoxResolver resolver = new TerrainBoundingBoxResolver( geometry, new Proj4jCoordinateTransformer(), 0.5 );

	final List< PairConfiguration > pairs = Arrays.asList(
			SyntheticStereoGeometry.pair( "one", 0, 0 ),
			SyntheticStereoGeometry.pair( "two", 100, 0 ) );

	final List< DisparityRange > ranges = Arrays.asList( new DisparityRange( -5, 5 ), new DisparityRange( -5, 5 ) );

	@Test
	public void testPairAndGlobalBoxes()
	{
		final TerrainBoundingBox box = resolver.resolve( pairs, ranges, SyntheticStereoGeometry.CRS, null, null );

		// the projected envelope is [-0.5, 50.5] x [0, 50], the footprint cuts it to [0, 50]
		assertEquals( new Extent( -0.5, 0, 50.5, 50, SyntheticStereoGeometry.CRS ), box.getPair( 0 ).getEnvelope() );
		assertEquals( new Extent( 0, 0, 50, 50, SyntheticStereoGeometry.CRS ), box.getPair( 0 ).getBox() );
		assertEquals( new Extent( 100, 0, 150, 50, SyntheticStereoGeometry.CRS ), box.getPair( 1 ).getBox() );
		assertEquals( 2550.0, box.getPair( 0 ).getTerrainArea(), 1e-9 );

		assertEquals( new Extent( 0, 0, 150, 50, SyntheticStereoGeometry.CRS ), box.getGlobal() );
		assertTrue( box.getWarnings().isEmpty() );
	}

	@Test
	public void testCrsFromUtmZone()
	{
		assertEquals( "EPSG:32631", resolver.resolveCrs( pairs.get( 0 ), ranges.get( 0 ) ) );

		final TerrainBoundingBox box = resolver.resolve( pairs, ranges, null, null, null );
		assertEquals( "EPSG:32631", box.getCrs() );
	}

	@Test
	public void testRegionOfInterestDisjointFromAllFootprints()
	{
		try
		{
			resolver.resolve( pairs, ranges, SyntheticStereoGeometry.CRS, SyntheticStereoGeometry.square( 1000, 1000, 1100, 1100 ), null );
			fail( "region of interest outside of all footprints must be rejected" );
		}
		catch ( final GeometricInfeasibilityException e )
		{
			assertTrue( e.getMessage().contains( "no intersection" ) );
		}
	}

	@Test
	public void testRegionOfInterestMissingOnePair()
	{
		final TerrainBoundingBox box = resolver.resolve( pairs, ranges, SyntheticStereoGeometry.CRS, SyntheticStereoGeometry.square( 10.2, 10.1, 30.3, 20 ), null );

		assertEquals( 1, box.getWarnings().size() );
		assertTrue( box.getWarnings().get( 0 ).contains( "'two'" ) );

		// replaced by the region of interest, snapped outwards
		assertEquals( new Extent( 10, 10, 30.5, 20, SyntheticStereoGeometry.CRS ), box.getGlobal() );
	}

	@Test( expected = GeometricInfeasibilityException.class )
	public void testEnvelopeOutsideOfFootprint()
	{
		final PairConfiguration shifted = new PairConfiguration( "shifted", "l", "r", 100, 100, -5, 5, 1.0,
				SyntheticStereoGeometry.square( 500, 500, 550, 550 ), SyntheticStereoGeometry.CRS );

		resolver.resolvePair( 0, shifted, new DisparityRange( -5, 5 ), SyntheticStereoGeometry.CRS );
	}
}

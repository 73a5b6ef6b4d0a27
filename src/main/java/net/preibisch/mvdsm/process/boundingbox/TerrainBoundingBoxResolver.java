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

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.data.DisparityRange;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.data.PairConfiguration;
import net.preibisch.mvdsm.geometry.CoordinateTransformer;
import net.preibisch.mvdsm.geometry.StereoGeometry;
import net.preibisch.mvdsm.geometry.UtmZones;
import net.preibisch.mvdsm.process.GeometricInfeasibilityException;

/**
 * Computes the terrain bounding box of every pair (projected epipolar corners intersected with
 * the ground footprint) and the global box of the run, optionally restricted to a region of interest.
 *
 * @author Stephan Preibisch
 */
public class TerrainBoundingBoxResolver
{
	private static final Logger LOG = LoggerFactory.getLogger( TerrainBoundingBoxResolver.class );

	final StereoGeometry geometry;
	final CoordinateTransformer transformer;
	final double resolution;

	public TerrainBoundingBoxResolver( final StereoGeometry geometry, final CoordinateTransformer transformer, final double resolution )
	{
		this.geometry = geometry;
		this.transformer = transformer;
		this.resolution = resolution;
	}

	/**
	 * @param pair - the pair
	 * @return the four corners of the full epipolar extent, (x, y)
	 */
	public static double[][] epipolarCorners( final PairConfiguration pair )
	{
		final double sx = pair.getEpipolarSizeX();
		final double sy = pair.getEpipolarSizeY();

		return new double[][] { { 0, 0 }, { sx, 0 }, { 0, sy }, { sx, sy } };
	}

	/**
	 * Derives the output crs from the UTM zone that contains the mean of the corners
	 * projected at minimal disparity.
	 *
	 * @param pair - the first pair
	 * @param range - its disparity range
	 * @return crs name, e.g. "EPSG:32631"
	 */
	public String resolveCrs( final PairConfiguration pair, final DisparityRange range )
	{
		final double[][] lonLat = geometry.project( pair, epipolarCorners( pair ), range.getMin(), UtmZones.WGS84 );

		double lon = 0, lat = 0;

		for ( final double[] p : lonLat )
		{
			lon += p[ 0 ];
			lat += p[ 1 ];
		}

		lon /= lonLat.length;
		lat /= lonLat.length;

		final String crs = UtmZones.epsgCode( lon, lat );

		LOG.info( "Output crs was not set, using {} (mean position lon={}, lat={})", crs, lon, lat );

		return crs;
	}

	public PairFootprint resolvePair( final int pairIndex, final PairConfiguration pair, final DisparityRange range, final String crs )
	{
		final double[][] corners = epipolarCorners( pair );
		final double[][] atMin = geometry.project( pair, corners, range.getMin(), crs );
		final double[][] atMax = geometry.project( pair, corners, range.getMax(), crs );

		final double[][] all = new double[ atMin.length + atMax.length ][];
		System.arraycopy( atMin, 0, all, 0, atMin.length );
		System.arraycopy( atMax, 0, all, atMin.length, atMax.length );

		final Extent envelope = BoundingBoxTools.envelope( all, crs );

		final Geometry footprint = transformer.transform( pair.getEnvelopesIntersection(), pair.getEnvelopesIntersectionCrs(), crs );
		final Extent footprintExtent = BoundingBoxTools.toExtent( footprint, crs );

		final Extent box = footprintExtent == null ? null : envelope.intersection( footprintExtent );

		if ( box == null )
			throw new GeometricInfeasibilityException(
					"Terrain envelope " + BoundingBoxTools.printExtent( envelope ) + " of " + pair +
					" does not intersect its ground footprint." );

		final Extent snapped = BoundingBoxTools.snapToGrid( box, resolution );

		LOG.info( "Terrain bounding box of {}: {}", pair.getId(), BoundingBoxTools.printExtent( snapped ) );

		return new PairFootprint( pairIndex, envelope, footprint, snapped );
	}

	/**
	 * @param pairs - all pairs in input order
	 * @param ranges - the disparity range used for each pair
	 * @param crs - output crs, or null to derive it from the first pair
	 * @param roi - region of interest, or null
	 * @param roiCrs - crs of the region of interest (null means output crs)
	 * @return footprints and global box
	 * @throws GeometricInfeasibilityException if the region of interest misses all footprints or the global box
	 */
	public TerrainBoundingBox resolve(
			final List< PairConfiguration > pairs,
			final List< DisparityRange > ranges,
			final String crs,
			final Geometry roi,
			final String roiCrs )
	{
		final String outputCrs = crs != null ? crs : resolveCrs( pairs.get( 0 ), ranges.get( 0 ) );

		final ArrayList< PairFootprint > footprints = new ArrayList<>();
		final ArrayList< Extent > boxes = new ArrayList<>();

		for ( int i = 0; i < pairs.size(); ++i )
		{
			final PairFootprint fp = resolvePair( i, pairs.get( i ), ranges.get( i ), outputCrs );
			footprints.add( fp );
			boxes.add( fp.getBox() );
		}

		Extent global = BoundingBoxTools.union( boxes );
		final ArrayList< String > warnings = new ArrayList<>();

		if ( roi != null )
		{
			final Geometry roiOut = transformer.transform( roi, roiCrs == null ? outputCrs : roiCrs, outputCrs );

			int hits = 0;

			for ( int i = 0; i < pairs.size(); ++i )
			{
				if ( roiOut.intersects( footprints.get( i ).getFootprint() ) )
				{
					++hits;
				}
				else
				{
					final String warning = "Region of interest does not intersect the footprint of pair '" + pairs.get( i ).getId() + "'";
					LOG.warn( warning );
					warnings.add( warning );
				}
			}

			if ( hits == 0 )
				throw new GeometricInfeasibilityException( "Region of interest does not intersect the footprint of any pair (no intersection)." );

			final Extent roiExtent = BoundingBoxTools.toExtent( roiOut, outputCrs );

			if ( roiExtent == null || !roiExtent.intersects( global ) )
				throw new GeometricInfeasibilityException( "Region of interest does not intersect the global terrain bounding box " +
						BoundingBoxTools.printExtent( global ) + " (no intersection)." );

			global = BoundingBoxTools.snapToGrid( roiExtent, resolution );

			LOG.info( "Terrain bounding box restricted to region of interest: {}", BoundingBoxTools.printExtent( global ) );
		}

		LOG.info( "Global terrain bounding box: {}", BoundingBoxTools.printExtent( global ) );

		return new TerrainBoundingBox( outputCrs, footprints, global, warnings );
	}
}

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
package net.preibisch.mvdsm.process.scheduler;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;

import net.preibisch.mvdsm.data.EpipolarTileRef;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.PointCloudUnit;
import net.preibisch.mvdsm.data.TriangulatedPoints;
import net.preibisch.mvdsm.geometry.ElevationReference;
import net.preibisch.mvdsm.geometry.PointGenerationOptions;
import net.preibisch.mvdsm.geometry.StereoGeometry;
import net.preibisch.mvdsm.process.pointcloud.PointCloudIO;

/**
 * Correlates and triangulates one epipolar tile of one pair.
 *
 * @author Stephan Preibisch
 */
public class PointCloudTask implements DsmTask< PointCloudUnit >
{
	private static final long serialVersionUID = -4981364025529873140L;

	final PairContext pair;
	final int tileIndex;
	final StereoGeometry geometry;
	final PointGenerationOptions options;
	final BroadcastRef< ElevationReference > elevationReference;
	final String container;

	/**
	 * @param pair - the pair
	 * @param tileIndex - index of the epipolar tile in the pair's grid
	 * @param geometry - the geometry collaborator
	 * @param options - generation options (without elevation reference)
	 * @param elevationReference - broadcast altitude reference or null
	 * @param container - N5 container to persist the points in, null to keep them in memory
	 */
	public PointCloudTask(
			final PairContext pair,
			final int tileIndex,
			final StereoGeometry geometry,
			final PointGenerationOptions options,
			final BroadcastRef< ElevationReference > elevationReference,
			final String container )
	{
		this.pair = pair;
		this.tileIndex = tileIndex;
		this.geometry = geometry;
		this.options = options;
		this.elevationReference = elevationReference;
		this.container = container;
	}

	public EpipolarTileRef getRef() { return pair.ref( tileIndex ); }

	public static String datasetName( final String pairId, final String regionHash )
	{
		return pairId + "/points/" + regionHash;
	}

	@Override
	public PointCloudUnit call() throws Exception
	{
		final EpipolarTileRef ref = getRef();

		final PointGenerationOptions opts = elevationReference == null ? options : options.withElevationReference( elevationReference.value() );

		final TriangulatedPoints points = geometry.generatePoints(
				pair.getConfiguration(),
				ref.getTile(),
				pair.getDisparityRange().getMin(),
				pair.getDisparityRange().getMax(),
				opts );

		if ( points == null || points.getReference() == null )
			throw new IllegalStateException( "malformed point cloud: no points returned" );

		String error = points.getReference().checkConsistency();

		if ( error == null && points.hasSecondary() )
			error = points.getSecondary().checkConsistency();

		if ( error != null )
			throw new IllegalStateException( "malformed point cloud: " + error );

		if ( container == null )
			return PointCloudUnit.inMemory( ref, pair.getId(), points );

		final String dataset = datasetName( pair.getId(), ref.getTile().regionHash() );
		final N5Writer n5 = new N5FSWriter( container );

		try
		{
			PointCloudIO.saveTriangulated( n5, dataset, points );
		}
		finally
		{
			n5.close();
		}

		return PointCloudUnit.persisted( ref, pair.getId(), dataset );
	}

	@Override
	public String getDescription()
	{
		return "point cloud of pair '" + pair.getId() + "', epipolar tile (" + getRef().getTile().getRow() + ", " +
				getRef().getTile().getCol() + ") " + getRef().getTile().regionHash();
	}
}

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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.data.CorrespondenceEntry;
import net.preibisch.mvdsm.data.EpipolarTileRef;
import net.preibisch.mvdsm.data.PairContext;
import net.preibisch.mvdsm.data.PointCloudUnit;
import net.preibisch.mvdsm.geometry.ElevationReference;
import net.preibisch.mvdsm.geometry.PointGenerationOptions;
import net.preibisch.mvdsm.geometry.StereoGeometry;
import net.preibisch.mvdsm.process.pointcloud.PointCloudIO;
import net.preibisch.mvdsm.process.rasterization.RasterTile;
import net.preibisch.mvdsm.process.rasterization.RasterizationParameters;

/**
 * Dispatches the two task kinds onto a backend. Point-cloud tasks of all epipolar tiles are
 * submitted first; a rasterization task is only created once all point-cloud tasks it
 * references have completed. Any failure or timeout aborts the run.
 *
 * @author Stephan Preibisch
 */
public class TaskScheduler
{
	private static final Logger LOG = LoggerFactory.getLogger( TaskScheduler.class );

	final ExecutionBackend backend;
	final long timeout;
	final TimeUnit unit;

	final CompletionCounter pointClouds = new CompletionCounter( "point clouds" );
	final CompletionCounter rasterizations = new CompletionCounter( "rasterizations" );

	final TreeMap< EpipolarTileRef, TaskHandle< PointCloudUnit > > pointCloudHandles = new TreeMap<>();
	final HashMap< EpipolarTileRef, PointCloudUnit > resolved = new HashMap<>();

	String container = null;

	public TaskScheduler( final ExecutionBackend backend, final long timeout, final TimeUnit unit )
	{
		this.backend = backend;
		this.timeout = timeout;
		this.unit = unit;
	}

	public CompletionCounter getPointCloudCounter() { return pointClouds; }
	public CompletionCounter getRasterizationCounter() { return rasterizations; }

	/**
	 * Submits one point-cloud task per epipolar tile of every pair.
	 *
	 * @param pairs - all pairs in input order
	 * @param geometry - the geometry collaborator
	 * @param options - point generation options of each pair
	 * @param elevationReference - broadcast altitude reference, may be null
	 * @param container - N5 container to persist point clouds in, null keeps them in memory
	 * @return number of submitted tasks
	 */
	public int submitPointClouds(
			final List< PairContext > pairs,
			final StereoGeometry geometry,
			final List< PointGenerationOptions > options,
			final BroadcastRef< ElevationReference > elevationReference,
			final String container )
	{
		this.container = container;

		int count = 0;

		for ( final PairContext pair : pairs )
		{
			for ( int t = 0; t < pair.getEpipolarGrid().size(); ++t )
			{
				final PointCloudTask task = new PointCloudTask( pair, t, geometry, options.get( pair.getIndex() ), elevationReference, container );
				pointCloudHandles.put( task.getRef(), backend.submit( task ) );
				pointClouds.submitted();
				++count;
			}
		}

		LOG.info( "Submitted {} point cloud tasks.", count );

		return count;
	}

	/**
	 * Creates one rasterization task per correspondence entry once its point clouds are available
	 * and hands every result to the sink (on the calling thread). A point cloud is dropped once its
	 * last consumer completed, persisted ones are also removed from the container.
	 *
	 * @param entries - terrain tiles with their contributors
	 * @param params - filtering and rasterization parameters
	 * @param sink - receives every rasterized tile
	 * @return number of rasterized tiles
	 */
	public int rasterize( final List< CorrespondenceEntry > entries, final RasterizationParameters params, final Consumer< RasterTile > sink )
	{
		final HashMap< EpipolarTileRef, Integer > consumers = new HashMap<>();

		for ( final CorrespondenceEntry entry : entries )
			for ( final EpipolarTileRef ref : entry.getContributors() )
				consumers.merge( ref, 1, Integer::sum );

		final ArrayList< TaskHandle< RasterTile > > handles = new ArrayList<>();

		for ( final CorrespondenceEntry entry : entries )
		{
			final ArrayList< PointCloudUnit > units = new ArrayList<>();

			for ( final EpipolarTileRef ref : entry.getContributors() )
				units.add( resolve( ref ) );

			handles.add( backend.submit( new RasterizationTask( entry.getTerrainTile(), units, params, container ) ) );
			rasterizations.submitted();
		}

		LOG.info( "Submitted {} rasterization tasks.", handles.size() );

		final N5Writer n5 = container == null ? null : new N5FSWriter( container );

		try
		{
			for ( int i = 0; i < handles.size(); ++i )
			{
				final RasterTile tile = backend.await( handles.get( i ), timeout, unit );
				handles.set( i, null );

				sink.accept( tile );
				rasterizations.completed();

				LOG.debug( "{}", rasterizations );

				for ( final EpipolarTileRef ref : entries.get( i ).getContributors() )
					if ( consumers.merge( ref, -1, Integer::sum ) == 0 )
						release( n5, ref );
			}

			// point clouds nobody consumes must still have succeeded
			for ( final EpipolarTileRef ref : new ArrayList<>( pointCloudHandles.keySet() ) )
				if ( !consumers.containsKey( ref ) )
				{
					resolve( ref );
					release( n5, ref );
				}
		}
		finally
		{
			if ( n5 != null )
				n5.close();
		}

		LOG.info( "{}, {}", pointClouds, rasterizations );

		return handles.size();
	}

	protected PointCloudUnit resolve( final EpipolarTileRef ref )
	{
		PointCloudUnit pointCloud = resolved.get( ref );

		if ( pointCloud == null )
		{
			final TaskHandle< PointCloudUnit > handle = pointCloudHandles.get( ref );

			if ( handle == null )
				throw new IllegalStateException( "No point cloud task was submitted for " + ref );

			pointCloud = backend.await( handle, timeout, unit );
			resolved.put( ref, pointCloud );
			pointClouds.completed();
		}

		return pointCloud;
	}

	/**
	 * Forgets a point cloud after its last consumer, persisted points are removed from the container.
	 */
	protected void release( final N5Writer n5, final EpipolarTileRef ref )
	{
		pointCloudHandles.remove( ref );
		final PointCloudUnit unit = resolved.remove( ref );

		if ( n5 != null && unit != null && unit.isPersisted() )
		{
			PointCloudIO.remove( n5, unit.getDataset() );
			LOG.debug( "Removed temporary points {}", unit.getDataset() );
		}
	}
}

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

import java.io.Serializable;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.Threads;
import net.preibisch.mvdsm.process.TaskExecutionException;

/**
 * Runs tasks on a fixed pool of local threads.
 *
 * @author Stephan Preibisch
 */
public class WorkerPoolBackend implements ExecutionBackend
{
	private static final Logger LOG = LoggerFactory.getLogger( WorkerPoolBackend.class );

	static class PoolHandle< R > implements TaskHandle< R >
	{
		final DsmTask< R > task;
		final Future< R > future;

		PoolHandle( final DsmTask< R > task, final Future< R > future )
		{
			this.task = task;
			this.future = future;
		}

		@Override
		public DsmTask< R > getTask() { return task; }
	}

	public static long terminationTimeoutSeconds = 60;

	final int numWorkers;
	ExecutorService service;

	public WorkerPoolBackend( final int numWorkers )
	{
		this.numWorkers = numWorkers;
	}

	@Override
	public BackendType getType() { return BackendType.WORKER_POOL; }

	@Override
	public void start()
	{
		if ( service != null )
			throw new IllegalStateException( "Worker pool was already started." );

		LOG.info( "Starting worker pool with {} threads.", numWorkers );
		service = Threads.createFixedExecutorService( numWorkers );
	}

	@Override
	public < R > TaskHandle< R > submit( final DsmTask< R > task )
	{
		if ( service == null )
			throw new IllegalStateException( "Worker pool is not started." );

		final Callable< R > callable = task::call;

		return new PoolHandle<>( task, service.submit( callable ) );
	}

	@Override
	public < R > R await( final TaskHandle< R > handle, final long timeout, final TimeUnit unit )
	{
		final PoolHandle< R > h = ( PoolHandle< R > ) handle;

		try
		{
			return h.future.get( timeout, unit );
		}
		catch ( final TimeoutException e )
		{
			h.future.cancel( true );
			throw new TaskExecutionException( h.getDescription(), "timed out after " + unit.toMillis( timeout ) + " ms", e );
		}
		catch ( final ExecutionException e )
		{
			throw new TaskExecutionException( h.getDescription(), String.valueOf( e.getCause() ), e.getCause() );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new TaskExecutionException( h.getDescription(), "interrupted", e );
		}
	}

	@Override
	public < T extends Serializable > BroadcastRef< T > broadcast( final T value )
	{
		return new LocalBroadcastRef<>( value );
	}

	@Override
	public void close()
	{
		if ( service != null )
		{
			service.shutdownNow();

			try
			{
				// running tasks may still write temporary point clouds
				if ( !service.awaitTermination( terminationTimeoutSeconds, TimeUnit.SECONDS ) )
					LOG.warn( "Worker pool did not terminate within {} seconds.", terminationTimeoutSeconds );
			}
			catch ( final InterruptedException e )
			{
				Thread.currentThread().interrupt();
				LOG.warn( "Interrupted while waiting for the worker pool to terminate." );
			}

			service = null;
			LOG.info( "Worker pool stopped." );
		}
	}
}

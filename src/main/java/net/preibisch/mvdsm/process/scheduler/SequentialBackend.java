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
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.process.TaskExecutionException;

/**
 * Runs every task on the calling thread when it is awaited. A task that took longer than
 * the timeout fails the run.
 */
public class SequentialBackend implements ExecutionBackend
{
	private static final Logger LOG = LoggerFactory.getLogger( SequentialBackend.class );

	static class SequentialHandle< R > implements TaskHandle< R >
	{
		final DsmTask< R > task;
		boolean done = false;
		R result;
		TaskExecutionException failure;

		SequentialHandle( final DsmTask< R > task )
		{
			this.task = task;
		}

		@Override
		public DsmTask< R > getTask() { return task; }
	}

	@Override
	public BackendType getType() { return BackendType.SEQUENTIAL; }

	@Override
	public void start()
	{
		LOG.info( "Running all tasks sequentially." );
	}

	@Override
	public < R > TaskHandle< R > submit( final DsmTask< R > task )
	{
		return new SequentialHandle<>( task );
	}

	@Override
	public < R > R await( final TaskHandle< R > handle, final long timeout, final TimeUnit unit )
	{
		final SequentialHandle< R > h = ( SequentialHandle< R > ) handle;

		if ( !h.done )
		{
			h.done = true;

			final long start = System.nanoTime();

			try
			{
				h.result = h.task.call();
			}
			catch ( final Exception e )
			{
				h.failure = new TaskExecutionException( h.getDescription(), e.toString(), e );
			}

			final long elapsed = System.nanoTime() - start;

			if ( h.failure == null && elapsed > unit.toNanos( timeout ) )
				h.failure = new TaskExecutionException( h.getDescription(),
						"timed out (" + TimeUnit.NANOSECONDS.toMillis( elapsed ) + " ms > " + unit.toMillis( timeout ) + " ms)" );
		}

		if ( h.failure != null )
			throw h.failure;

		return h.result;
	}

	@Override
	public < T extends Serializable > BroadcastRef< T > broadcast( final T value )
	{
		return new LocalBroadcastRef<>( value );
	}

	@Override
	public void close() {}
}

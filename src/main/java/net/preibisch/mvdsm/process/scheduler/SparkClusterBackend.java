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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaFutureAction;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.preibisch.mvdsm.process.TaskExecutionException;

/**
 * Runs every task as a single-partition Spark job. Jobs are submitted asynchronously, so
 * independent tasks run in parallel on the executors.
 *
 * @author Stephan Preibisch
 */
public class SparkClusterBackend implements ExecutionBackend
{
	private static final Logger LOG = LoggerFactory.getLogger( SparkClusterBackend.class );

	public static String appName = "multiview-dsm";

	static class SparkHandle< R > implements TaskHandle< R >
	{
		final DsmTask< R > task;
		final JavaFutureAction< List< R > > future;

		SparkHandle( final DsmTask< R > task, final JavaFutureAction< List< R > > future )
		{
			this.task = task;
			this.future = future;
		}

		@Override
		public DsmTask< R > getTask() { return task; }
	}

	static class SparkBroadcastRef< T > implements BroadcastRef< T >
	{
		private static final long serialVersionUID = 8141309232547062071L;

		final Broadcast< T > broadcast;

		SparkBroadcastRef( final Broadcast< T > broadcast )
		{
			this.broadcast = broadcast;
		}

		@Override
		public T value() { return broadcast.value(); }
	}

	final SparkConf conf;
	final boolean ownsContext;
	JavaSparkContext sc;

	/**
	 * @param master - e.g. "local[4]" or "spark://host:7077"
	 */
	public SparkClusterBackend( final String master )
	{
		this( defaultConf( master ) );
	}

	public SparkClusterBackend( final SparkConf conf )
	{
		this.conf = conf;
		this.ownsContext = true;
	}

	/**
	 * Uses an existing context, which is not stopped on close.
	 *
	 * @param sc - the spark context
	 */
	public SparkClusterBackend( final JavaSparkContext sc )
	{
		this.conf = sc.getConf();
		this.sc = sc;
		this.ownsContext = false;
	}

	public static SparkConf defaultConf( final String master )
	{
		final SparkConf conf = new SparkConf()
				.setMaster( master )
				.setAppName( appName )
				.set( "spark.ui.enabled", "false" );

		// local mode never leaves the machine
		if ( master.startsWith( "local" ) )
			conf.set( "spark.driver.host", "127.0.0.1" ).set( "spark.driver.bindAddress", "127.0.0.1" );

		return conf;
	}

	@Override
	public BackendType getType() { return BackendType.DISTRIBUTED_CLUSTER; }

	@Override
	public void start()
	{
		if ( sc == null )
		{
			LOG.info( "Starting spark context, master={}", conf.get( "spark.master", "<unset>" ) );
			sc = new JavaSparkContext( conf );
		}
	}

	public JavaSparkContext getSparkContext() { return sc; }

	@Override
	public < R > TaskHandle< R > submit( final DsmTask< R > task )
	{
		if ( sc == null )
			throw new IllegalStateException( "Spark context is not started." );

		sc.setJobDescription( task.getDescription() );

		final JavaFutureAction< List< R > > future = sc.parallelize( Collections.singletonList( task ), 1 ).map( t -> t.call() ).collectAsync();

		return new SparkHandle<>( task, future );
	}

	@Override
	public < R > R await( final TaskHandle< R > handle, final long timeout, final TimeUnit unit )
	{
		final SparkHandle< R > h = ( SparkHandle< R > ) handle;

		try
		{
			return h.future.get( timeout, unit ).get( 0 );
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
		return new SparkBroadcastRef<>( sc.broadcast( value ) );
	}

	@Override
	public void close()
	{
		if ( sc != null && ownsContext )
		{
			sc.close();
			LOG.info( "Spark context stopped." );
		}

		sc = null;
	}
}

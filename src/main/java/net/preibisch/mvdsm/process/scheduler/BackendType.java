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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import net.preibisch.mvdsm.process.DsmConfigurationException;

/**
 * The supported execution backends.
 */
public enum BackendType
{
	/** all tasks on the calling thread, one after the other */
	SEQUENTIAL( "sequential" ),
	/** fixed pool of local worker threads */
	WORKER_POOL( "worker_pool", "pool", "multiprocessing" ),
	/** Apache Spark, local or on a cluster */
	DISTRIBUTED_CLUSTER( "distributed_cluster", "cluster", "spark" );

	final List< String > names;

	BackendType( final String... names )
	{
		this.names = Arrays.asList( names );
	}

	public List< String > getNames() { return names; }

	/**
	 * @param name - a backend name (case-insensitive)
	 * @return the backend type
	 * @throws DsmConfigurationException if the name is unknown
	 */
	public static BackendType fromName( final String name )
	{
		if ( name != null )
		{
			final String n = name.trim().toLowerCase( Locale.ROOT );

			for ( final BackendType type : values() )
				if ( type.names.contains( n ) )
					return type;
		}

		throw new DsmConfigurationException( "Unsupported execution backend '" + name + "', supported are: " +
				Arrays.asList( SEQUENTIAL.names, WORKER_POOL.names, DISTRIBUTED_CLUSTER.names ) );
	}

	/**
	 * @param numWorkers - number of workers (threads or spark cores when running locally)
	 * @param master - spark master url, null means local
	 * @return a new, not yet started backend
	 */
	public ExecutionBackend create( final int numWorkers, final String master )
	{
		switch ( this )
		{
			case SEQUENTIAL:
				return new SequentialBackend();
			case WORKER_POOL:
				return new WorkerPoolBackend( numWorkers );
			default:
				return new SparkClusterBackend( master == null ? "local[" + numWorkers + "]" : master );
		}
	}
}

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

import net.preibisch.mvdsm.process.TaskExecutionException;

/**
 * Executes tasks. A backend is a scoped resource: started before scheduling, closed after the mosaic
 * is complete or the run failed.
 *
 * @author Stephan Preibisch
 */
public interface ExecutionBackend extends AutoCloseable
{
	public BackendType getType();

	/**
	 * Acquires workers, called once before the first submit.
	 */
	public void start();

	public < R > TaskHandle< R > submit( DsmTask< R > task );

	/**
	 * Blocks until the task completed.
	 *
	 * @param handle - the submitted task
	 * @param timeout - maximal time to wait
	 * @param unit - unit of timeout
	 * @return the result of the task
	 * @throws TaskExecutionException if the task failed or did not finish in time
	 */
	public < R > R await( TaskHandle< R > handle, long timeout, TimeUnit unit );

	public < T extends Serializable > BroadcastRef< T > broadcast( T value );

	@Override
	public void close();
}

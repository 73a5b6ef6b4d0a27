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

/**
 * A point-cloud or rasterization task failed or timed out. The run is aborted and no mosaic is written.
 */
public class TaskExecutionException extends DsmException
{
	private static final long serialVersionUID = -772538317394126009L;

	final String task;

	public TaskExecutionException( final String task, final String message, final Throwable cause )
	{
		super( "Task '" + task + "' failed: " + message, cause );
		this.task = task;
	}

	public TaskExecutionException( final String task, final String message )
	{
		this( task, message, null );
	}

	/**
	 * @return description of the offending task (pair and tile)
	 */
	public String getTask() { return task; }
}

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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts submitted and completed tasks of one kind. May be polled from any thread; nothing depends on it.
 */
public class CompletionCounter
{
	final String name;
	final AtomicInteger submitted = new AtomicInteger();
	final AtomicInteger completed = new AtomicInteger();

	public CompletionCounter( final String name )
	{
		this.name = name;
	}

	public void submitted() { submitted.incrementAndGet(); }
	public void completed() { completed.incrementAndGet(); }

	public String getName() { return name; }
	public int getSubmitted() { return submitted.get(); }
	public int getCompleted() { return completed.get(); }

	/**
	 * @return completed / submitted, 1 if nothing was submitted
	 */
	public double progress()
	{
		final int s = submitted.get();
		return s == 0 ? 1.0 : (double)completed.get() / s;
	}

	@Override
	public String toString() { return name + ": " + completed.get() + "/" + submitted.get(); }
}

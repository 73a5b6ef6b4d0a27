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
 * Small serializable tasks for the backend tests.
 */
public class TestTasks
{
	public static final AtomicInteger CALLS = new AtomicInteger();

	public static class Value implements DsmTask< Integer >
	{
		private static final long serialVersionUID = 1L;

		final int value;
		final long sleepMillis;

		public Value( final int value, final long sleepMillis )
		{
			this.value = value;
			this.sleepMillis = sleepMillis;
		}

		public Value( final int value )
		{
			this( value, 0 );
		}

		@Override
		public Integer call() throws Exception
		{
			CALLS.incrementAndGet();

			if ( sleepMillis > 0 )
				Thread.sleep( sleepMillis );

			return value;
		}

		@Override
		public String getDescription() { return "value " + value; }
	}

	public static class Failing implements DsmTask< Integer >
	{
		private static final long serialVersionUID = 1L;

		@Override
		public Integer call() throws Exception
		{
			throw new IllegalArgumentException( "broken input" );
		}

		@Override
		public String getDescription() { return "failing task"; }
	}

	public static class ReadBroadcast implements DsmTask< String >
	{
		private static final long serialVersionUID = 1L;

		final BroadcastRef< String > ref;

		public ReadBroadcast( final BroadcastRef< String > ref )
		{
			this.ref = ref;
		}

		@Override
		public String call() { return ref.value() + "!"; }

		@Override
		public String getDescription() { return "read broadcast"; }
	}
}

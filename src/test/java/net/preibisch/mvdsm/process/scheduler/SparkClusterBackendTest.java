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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import net.preibisch.mvdsm.process.TaskExecutionException;

public class SparkClusterBackendTest
{
	static SparkClusterBackend backend;

	@BeforeClass
	public static void startSpark()
	{
		backend = new SparkClusterBackend( "local[2]" );
		backend.start();
	}

	@AfterClass
	public static void stopSpark()
	{
		backend.close();
		assertNull( backend.getSparkContext() );
	}

	@Test
	public void testResults()
	{
		final ArrayList< TaskHandle< Integer > > handles = new ArrayList<>();

		for ( int i = 0; i < 4; ++i )
			handles.add( backend.submit( new TestTasks.Value( i ) ) );

		for ( int i = 0; i < 4; ++i )
			assertEquals( i, (int)backend.await( handles.get( i ), 60, TimeUnit.SECONDS ) );
	}

	@Test
	public void testBroadcast()
	{
		final BroadcastRef< String > ref = backend.broadcast( "geoid" );

		assertEquals( "geoid!", backend.await( backend.submit( new TestTasks.ReadBroadcast( ref ) ), 60, TimeUnit.SECONDS ) );
	}

	@Test
	public void testFailure()
	{
		try
		{
			backend.await( backend.submit( new TestTasks.Failing() ), 60, TimeUnit.SECONDS );
			fail( "failure was not reported" );
		}
		catch ( final TaskExecutionException e )
		{
			assertEquals( "failing task", e.getTask() );
			assertTrue( e.getMessage().contains( "broken input" ) );
		}
	}

	@Test
	public void testDefaultConf()
	{
		assertEquals( "127.0.0.1", SparkClusterBackend.defaultConf( "local[1]" ).get( "spark.driver.host" ) );
		assertEquals( "false", SparkClusterBackend.defaultConf( "spark://node:7077" ).get( "spark.ui.enabled" ) );
		assertTrue( !SparkClusterBackend.defaultConf( "spark://node:7077" ).contains( "spark.driver.host" ) );
	}
}

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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Tuning constants of tiling and filtering, read from JSON. The defaults ship as the
 * classpath resource dsm-static-configuration.json.
 *
 * @author Stephan Preibisch
 */
public class StaticParameters
{
	public static final String RESOURCE = "/dsm-static-configuration.json";

	public static class Tiling
	{
		public int minEpipolarTileSize = 100;
		public int maxEpipolarTileSize = 1500;
		public int epipolarTileMargin = 0;
		public int maxRamPerWorkerMiB = 2000;
		public int tileSizeRounding = 50;
	}

	public static class SmallComponents
	{
		public int onGroundMargin = 10;
		public double connectionDistance = 3.0;
		public int minPointsPerComponent = 50;
		public Double clustersDistanceThreshold = null;

		public double clustersDistanceThreshold()
		{
			return clustersDistanceThreshold == null ? Double.NaN : clustersDistanceThreshold;
		}
	}

	public static class StatisticalOutliers
	{
		public int k = 50;
		public double stdDevFactor = 5.0;
	}

	public Tiling tiling = new Tiling();
	public SmallComponents smallComponents = new SmallComponents();
	public StatisticalOutliers statisticalOutliers = new StatisticalOutliers();

	/**
	 * @return the defaults from the classpath
	 * @throws DsmConfigurationException if the resource is missing or cannot be parsed
	 */
	public static StaticParameters load()
	{
		try ( final InputStream in = StaticParameters.class.getResourceAsStream( RESOURCE ) )
		{
			if ( in == null )
				throw new DsmConfigurationException( "Resource " + RESOURCE + " not found on the classpath." );

			return parse( new InputStreamReader( in, StandardCharsets.UTF_8 ), RESOURCE );
		}
		catch ( final IOException e )
		{
			throw new DsmConfigurationException( "Cannot read " + RESOURCE + ": " + e );
		}
	}

	public static StaticParameters load( final Path file ) throws IOException
	{
		try ( final Reader reader = Files.newBufferedReader( file, StandardCharsets.UTF_8 ) )
		{
			return parse( reader, file.toString() );
		}
	}

	protected static StaticParameters parse( final Reader reader, final String source )
	{
		try
		{
			final StaticParameters p = new Gson().fromJson( reader, StaticParameters.class );

			if ( p == null )
				throw new DsmConfigurationException( "Static configuration " + source + " is empty." );

			// sections missing in the file keep their defaults
			if ( p.tiling == null )
				p.tiling = new Tiling();
			if ( p.smallComponents == null )
				p.smallComponents = new SmallComponents();
			if ( p.statisticalOutliers == null )
				p.statisticalOutliers = new StatisticalOutliers();

			return p;
		}
		catch ( final JsonParseException e )
		{
			throw new DsmConfigurationException( "Cannot parse static configuration " + source + ": " + e.getMessage() );
		}
	}
}

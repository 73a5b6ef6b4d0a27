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
package net.preibisch.mvdsm.process.export;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class ManifestIO
{
	public static final String FILE_NAME = "content.json";

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeSpecialFloatingPointValues().create();

	public static Path write( final RunManifest manifest, final Path outputDirectory ) throws IOException
	{
		Files.createDirectories( outputDirectory );

		final Path file = outputDirectory.resolve( FILE_NAME );
		Files.write( file, GSON.toJson( manifest ).getBytes( StandardCharsets.UTF_8 ) );

		return file;
	}

	public static RunManifest read( final Path file ) throws IOException
	{
		try ( final Reader reader = Files.newBufferedReader( file, StandardCharsets.UTF_8 ) )
		{
			return GSON.fromJson( reader, RunManifest.class );
		}
	}
}

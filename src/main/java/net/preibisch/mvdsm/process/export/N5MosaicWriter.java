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

import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.saalfeldlab.n5.Compression;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;

/**
 * Writes every layer of the mosaic as a 2d N5 dataset (x, y) into one container. The block size
 * is the terrain tile size in pixels, blocks start at the upper left corner of the mosaic. Each
 * dataset carries the attributes crs, resolution, origin (upper left corner) and noData.
 *
 * @author Stephan Preibisch
 */
public class N5MosaicWriter implements MosaicWriter
{
	private static final Logger LOG = LoggerFactory.getLogger( N5MosaicWriter.class );

	public static String containerName = "dsm.n5";

	final String n5Path;
	final Compression compression;

	public N5MosaicWriter( final String n5Path, final Compression compression )
	{
		this.n5Path = n5Path;
		this.compression = compression;
	}

	public N5MosaicWriter( final String n5Path )
	{
		this( n5Path, new GzipCompression() );
	}

	@Override
	public Map< String, String > write( final MosaicOutput mosaic, final int[] blockSize )
	{
		final LinkedHashMap< String, String > datasets = new LinkedHashMap<>();
		final N5Writer n5 = new N5FSWriter( n5Path );

		try
		{
			final float dsmNoData = mosaic.getParameters().getDsmNoData();

			save( n5, "dsm", mosaic.getDsm(), mosaic, blockSize, dsmNoData, datasets );

			for ( int b = 0; b < mosaic.numBands(); ++b )
				save( n5, "clr/" + b, mosaic.getColor( b ), mosaic, blockSize, mosaic.getParameters().getColorNoData(), datasets );

			if ( mosaic.hasMask() )
				save( n5, "msk", mosaic.getMask(), mosaic, blockSize, mosaic.getParameters().getMaskNoData(), datasets );

			if ( mosaic.hasStats() )
			{
				save( n5, "dsm_mean", mosaic.getMean(), mosaic, blockSize, dsmNoData, datasets );
				save( n5, "dsm_std", mosaic.getStd(), mosaic, blockSize, dsmNoData, datasets );
				save( n5, "dsm_n_pts", mosaic.getNPts(), mosaic, blockSize, 0, datasets );
				save( n5, "dsm_pts_in_cell", mosaic.getPointsInCell(), mosaic, blockSize, 0, datasets );
			}
		}
		finally
		{
			n5.close();
		}

		LOG.info( "Wrote {} layers of {}x{} pixels to {}", datasets.size(), mosaic.getWidth(), mosaic.getHeight(), n5Path );

		return datasets;
	}

	protected < T extends NativeType< T > > void save(
			final N5Writer n5,
			final String dataset,
			final RandomAccessibleInterval< T > layer,
			final MosaicOutput mosaic,
			final int[] blockSize,
			final Number noData,
			final Map< String, String > datasets )
	{
		N5Utils.save( layer, n5, dataset, blockSize, compression );

		n5.setAttribute( dataset, "crs", mosaic.getCrs() );
		n5.setAttribute( dataset, "resolution", mosaic.getResolution() );
		n5.setAttribute( dataset, "origin", new double[] { mosaic.getGlobal().getXMin(), mosaic.getGlobal().getYMax() } );
		n5.setAttribute( dataset, "noData", noData );

		datasets.put( dataset, n5Path + "/" + dataset );
	}
}

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

import java.util.Arrays;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.preibisch.mvdsm.data.Extent;
import net.preibisch.mvdsm.process.boundingbox.BoundingBoxTools;
import net.preibisch.mvdsm.process.rasterization.RasterizationParameters;

/**
 * The output rasters of a run over the global terrain box, all on the same pixel grid
 * (x = column, y = row from the top). Layers that were not requested are null.
 *
 * @author Stephan Preibisch
 */
public class MosaicOutput
{
	final Extent global;
	final double resolution;
	final String crs;
	final int width, height;
	final RasterizationParameters params;

	final ArrayImg< FloatType, FloatArray > dsm;
	final ArrayImg< FloatType, FloatArray >[] color;
	final ArrayImg< UnsignedShortType, ShortArray > mask;
	final ArrayImg< FloatType, FloatArray > mean, std;
	final ArrayImg< UnsignedShortType, ShortArray > nPts, pointsInCell;

	@SuppressWarnings( "unchecked" )
	public MosaicOutput( final Extent global, final String crs, final RasterizationParameters params )
	{
		this.global = global;
		this.resolution = params.getResolution();
		this.crs = crs;
		this.params = params;

		final long[] size = BoundingBoxTools.pixelSize( global, resolution );

		if ( size[ 0 ] * size[ 1 ] > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Output raster of " + size[ 0 ] + "x" + size[ 1 ] + " pixels is too large for one in-memory mosaic." );

		this.width = (int)size[ 0 ];
		this.height = (int)size[ 1 ];

		this.dsm = floats( params.getDsmNoData() );

		this.color = new ArrayImg[ params.getNumBands() ];
		for ( int b = 0; b < color.length; ++b )
			color[ b ] = floats( params.getColorNoData() );

		this.mask = params.writeMask() ? unsignedShorts( params.getMaskNoData() ) : null;

		if ( params.writeStats() )
		{
			this.mean = floats( params.getDsmNoData() );
			this.std = floats( params.getDsmNoData() );
			this.nPts = unsignedShorts( 0 );
			this.pointsInCell = unsignedShorts( 0 );
		}
		else
		{
			this.mean = this.std = null;
			this.nPts = this.pointsInCell = null;
		}
	}

	protected ArrayImg< FloatType, FloatArray > floats( final float noData )
	{
		final float[] data = new float[ width * height ];
		Arrays.fill( data, noData );
		return ArrayImgs.floats( data, width, height );
	}

	protected ArrayImg< UnsignedShortType, ShortArray > unsignedShorts( final int noData )
	{
		final short[] data = new short[ width * height ];
		Arrays.fill( data, (short)noData );
		return ArrayImgs.unsignedShorts( data, width, height );
	}

	public Extent getGlobal() { return global; }
	public double getResolution() { return resolution; }
	public String getCrs() { return crs; }
	public int getWidth() { return width; }
	public int getHeight() { return height; }
	public long[] getDimensions() { return new long[] { width, height }; }
	public RasterizationParameters getParameters() { return params; }

	public ArrayImg< FloatType, FloatArray > getDsm() { return dsm; }
	public ArrayImg< FloatType, FloatArray > getColor( final int band ) { return color[ band ]; }
	public int numBands() { return color.length; }
	public ArrayImg< UnsignedShortType, ShortArray > getMask() { return mask; }
	public ArrayImg< FloatType, FloatArray > getMean() { return mean; }
	public ArrayImg< FloatType, FloatArray > getStd() { return std; }
	public ArrayImg< UnsignedShortType, ShortArray > getNPts() { return nPts; }
	public ArrayImg< UnsignedShortType, ShortArray > getPointsInCell() { return pointsInCell; }
	public boolean hasMask() { return mask != null; }
	public boolean hasStats() { return nPts != null; }

	/**
	 * @param img - a float layer
	 * @return the backing array (row-major, row 0 at the top)
	 */
	public static float[] data( final ArrayImg< FloatType, FloatArray > img )
	{
		return img.update( null ).getCurrentStorageArray();
	}

	public static short[] shortData( final ArrayImg< UnsignedShortType, ShortArray > img )
	{
		return img.update( null ).getCurrentStorageArray();
	}
}

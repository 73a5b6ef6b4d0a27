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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import net.preibisch.mvdsm.process.rasterization.RasterTile;

/**
 * Writes rasterized terrain tiles into the mosaic at the absolute window derived from the tile
 * bounds and the global box. Completion order does not matter.
 *
 * @author Stephan Preibisch
 */
public class MosaicAssembler
{
	private static final Logger LOG = LoggerFactory.getLogger( MosaicAssembler.class );

	final MosaicOutput output;
	final ArrayList< MosaicWindow > written = new ArrayList<>();

	public MosaicAssembler( final MosaicOutput output )
	{
		this.output = output;
	}

	public synchronized MosaicWindow write( final RasterTile raster )
	{
		final MosaicWindow window = MosaicWindow.compute( raster.getTile().getExtent(), output.getGlobal(), output.getResolution() );

		if ( window.getWidth() != raster.getWidth() || window.getHeight() != raster.getHeight() )
			throw new IllegalStateException( "Raster of " + raster.getWidth() + "x" + raster.getHeight() + " does not fit window " + window );

		for ( final MosaicWindow other : written )
			if ( other.overlaps( window ) )
				throw new IllegalStateException( "Window " + window + " overlaps the already written window " + other );

		final long w = raster.getWidth(), h = raster.getHeight();

		copyFloats( raster.getDsm(), w, h, Views.offsetInterval( output.getDsm(), window.getMin(), window.getDimensions() ) );

		for ( int b = 0; b < output.numBands(); ++b )
			copyFloats( raster.getColor()[ b ], w, h, Views.offsetInterval( output.getColor( b ), window.getMin(), window.getDimensions() ) );

		if ( output.hasMask() && raster.getMask() != null )
			copyShorts( raster.getMask(), w, h, Views.offsetInterval( output.getMask(), window.getMin(), window.getDimensions() ) );

		if ( output.hasStats() && raster.hasStats() )
		{
			copyFloats( raster.getMean(), w, h, Views.offsetInterval( output.getMean(), window.getMin(), window.getDimensions() ) );
			copyFloats( raster.getStd(), w, h, Views.offsetInterval( output.getStd(), window.getMin(), window.getDimensions() ) );
			copyShorts( raster.getNPts(), w, h, Views.offsetInterval( output.getNPts(), window.getMin(), window.getDimensions() ) );
			copyShorts( raster.getPointsInCell(), w, h, Views.offsetInterval( output.getPointsInCell(), window.getMin(), window.getDimensions() ) );
		}

		written.add( window );

		LOG.debug( "Wrote terrain tile ({}, {}) to window {}", raster.getTile().getRow(), raster.getTile().getCol(), window );

		return window;
	}

	public MosaicOutput getOutput() { return output; }

	public synchronized List< MosaicWindow > getWrittenWindows() { return Collections.unmodifiableList( new ArrayList<>( written ) ); }

	protected static void copyFloats( final float[] source, final long w, final long h, final RandomAccessibleInterval< FloatType > target )
	{
		final Cursor< FloatType > in = ArrayImgs.floats( source, w, h ).cursor();
		final Cursor< FloatType > out = Views.flatIterable( target ).cursor();

		while ( in.hasNext() )
			out.next().set( in.next() );
	}

	protected static void copyShorts( final int[] source, final long w, final long h, final RandomAccessibleInterval< UnsignedShortType > target )
	{
		final Cursor< UnsignedShortType > out = Views.flatIterable( target ).cursor();

		for ( int i = 0; i < source.length; ++i )
			out.next().set( Math.min( 65535, Math.max( 0, source[ i ] ) ) );
	}
}

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
package net.preibisch.mvdsm.data;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Column-oriented table of 3D points with optional color bands and mask channel.
 *
 * @author Stephan Preibisch
 */
public class PointCloud implements Serializable
{
	private static final long serialVersionUID = -8243707914590447816L;

	final double[] x, y, z;
	final float[][] color; // [band][point], may be null
	final int[] mask; // may be null

	public PointCloud( final double[] x, final double[] y, final double[] z, final float[][] color, final int[] mask )
	{
		this.x = x;
		this.y = y;
		this.z = z;
		this.color = color;
		this.mask = mask;
	}

	public static PointCloud empty( final int numBands, final boolean hasMask )
	{
		return new PointCloud( new double[ 0 ], new double[ 0 ], new double[ 0 ], new float[ numBands ][ 0 ], hasMask ? new int[ 0 ] : null );
	}

	public int size() { return x.length; }
	public int numBands() { return color == null ? 0 : color.length; }
	public boolean hasMask() { return mask != null; }

	public double[] getX() { return x; }
	public double[] getY() { return y; }
	public double[] getZ() { return z; }
	public float[][] getColor() { return color; }
	public int[] getMask() { return mask; }

	/**
	 * @return a description of the inconsistency, or null if all columns have the same length
	 */
	public String checkConsistency()
	{
		final int n = x.length;

		if ( y.length != n || z.length != n )
			return "coordinate columns differ in length (" + n + ", " + y.length + ", " + z.length + ")";

		if ( color != null )
			for ( int b = 0; b < color.length; ++b )
				if ( color[ b ].length != n )
					return "color band " + b + " has " + color[ b ].length + " values for " + n + " points";

		if ( mask != null && mask.length != n )
			return "mask has " + mask.length + " values for " + n + " points";

		return null;
	}

	/**
	 * @param keep - which points to keep
	 * @return new point cloud containing only the selected points, order is preserved
	 */
	public PointCloud select( final boolean[] keep )
	{
		int n = 0;
		for ( final boolean k : keep )
			if ( k )
				++n;

		final double[] nx = new double[ n ], ny = new double[ n ], nz = new double[ n ];
		final float[][] nc = color == null ? null : new float[ color.length ][ n ];
		final int[] nm = mask == null ? null : new int[ n ];

		for ( int i = 0, j = 0; i < keep.length; ++i )
		{
			if ( !keep[ i ] )
				continue;

			nx[ j ] = x[ i ];
			ny[ j ] = y[ i ];
			nz[ j ] = z[ i ];

			if ( nc != null )
				for ( int b = 0; b < nc.length; ++b )
					nc[ b ][ j ] = color[ b ][ i ];

			if ( nm != null )
				nm[ j ] = mask[ i ];

			++j;
		}

		return new PointCloud( nx, ny, nz, nc, nm );
	}

	/**
	 * Appends clouds in list order. The number of color bands is the minimum over all clouds,
	 * the mask is kept only if every cloud has one.
	 *
	 * @param clouds - clouds to concatenate
	 * @return one point cloud
	 */
	public static PointCloud concatenate( final List< PointCloud > clouds )
	{
		if ( clouds.size() == 1 )
			return clouds.get( 0 );

		int n = 0;
		int numBands = Integer.MAX_VALUE;
		boolean hasMask = true;

		for ( final PointCloud cloud : clouds )
		{
			n += cloud.size();
			numBands = Math.min( numBands, cloud.numBands() );
			hasMask &= cloud.hasMask();
		}

		if ( clouds.isEmpty() )
			numBands = 0;

		final double[] nx = new double[ n ], ny = new double[ n ], nz = new double[ n ];
		final float[][] nc = new float[ numBands ][ n ];
		final int[] nm = hasMask ? new int[ n ] : null;

		int offset = 0;

		for ( final PointCloud cloud : clouds )
		{
			final int s = cloud.size();

			System.arraycopy( cloud.x, 0, nx, offset, s );
			System.arraycopy( cloud.y, 0, ny, offset, s );
			System.arraycopy( cloud.z, 0, nz, offset, s );

			for ( int b = 0; b < numBands; ++b )
				System.arraycopy( cloud.color[ b ], 0, nc[ b ], offset, s );

			if ( nm != null )
				System.arraycopy( cloud.mask, 0, nm, offset, s );

			offset += s;
		}

		return new PointCloud( nx, ny, nz, nc, nm );
	}

	@Override
	public boolean equals( final Object o )
	{
		if ( !( o instanceof PointCloud ) )
			return false;

		final PointCloud p = ( PointCloud ) o;

		return Arrays.equals( x, p.x ) && Arrays.equals( y, p.y ) && Arrays.equals( z, p.z ) &&
				Arrays.deepEquals( color, p.color ) && Arrays.equals( mask, p.mask );
	}

	@Override
	public int hashCode() { return 31 * Arrays.hashCode( x ) + Arrays.hashCode( z ); }

	@Override
	public String toString() { return "PointCloud(" + size() + " points, " + numBands() + " bands" + ( hasMask() ? ", mask)" : ")" ); }
}

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
package net.preibisch.mvdsm.geometry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * {@link CoordinateTransformer} backed by proj4j. Transforms are cached per (source, target).
 * Geographic systems expect (lon, lat) ordering.
 */
public class Proj4jCoordinateTransformer implements CoordinateTransformer
{
	private final CRSFactory crsFactory = new CRSFactory();
	private final CoordinateTransformFactory ctFactory = new CoordinateTransformFactory();
	private final Map< String, CoordinateTransform > cache = new ConcurrentHashMap<>();

	@Override
	public double[] transform( final double x, final double y, final String sourceCrs, final String targetCrs )
	{
		if ( sourceCrs.equals( targetCrs ) )
			return new double[] { x, y };

		final ProjCoordinate dst = new ProjCoordinate();
		transformFor( sourceCrs, targetCrs ).transform( new ProjCoordinate( x, y ), dst );

		return new double[] { dst.x, dst.y };
	}

	@Override
	public Geometry transform( final Geometry geometry, final String sourceCrs, final String targetCrs )
	{
		final Geometry copy = geometry.copy();

		if ( sourceCrs.equals( targetCrs ) )
			return copy;

		final CoordinateTransform ct = transformFor( sourceCrs, targetCrs );

		copy.apply( new CoordinateSequenceFilter()
		{
			@Override
			public void filter( final CoordinateSequence seq, final int i )
			{
				final ProjCoordinate dst = new ProjCoordinate();
				ct.transform( new ProjCoordinate( seq.getX( i ), seq.getY( i ) ), dst );
				seq.setOrdinate( i, 0, dst.x );
				seq.setOrdinate( i, 1, dst.y );
			}

			@Override
			public boolean isDone() { return false; }

			@Override
			public boolean isGeometryChanged() { return true; }
		} );

		copy.geometryChanged();

		return copy;
	}

	private CoordinateTransform transformFor( final String sourceCrs, final String targetCrs )
	{
		return cache.computeIfAbsent( sourceCrs + "->" + targetCrs, key ->
			ctFactory.createTransform(
					crsFactory.createFromName( sourceCrs ),
					crsFactory.createFromName( targetCrs ) ) );
	}
}

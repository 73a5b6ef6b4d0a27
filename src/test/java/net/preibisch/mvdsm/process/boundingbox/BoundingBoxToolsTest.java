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
package net.preibisch.mvdsm.process.boundingbox;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;

import org.junit.Test;

import net.preibisch.mvdsm.data.Extent;

public class BoundingBoxToolsTest
{
	@Test
	public void testSnapOutwards()
	{
		final Extent snapped = BoundingBoxTools.snapToGrid( new Extent( 0.1, 0.2, 49.9, 50.3, "EPSG:32631" ), 0.5 );

		assertEquals( new Extent( 0, 0, 50, 50.5, "EPSG:32631" ), snapped );
	}

	@Test
	public void testSnapKeepsAlignedBounds()
	{
		final Extent e = new Extent( -1.5, 2.0, 150, 50 );
		assertEquals( e, BoundingBoxTools.snapToGrid( e, 0.5 ) );

		// 0.3 * 3 is not exactly 0.9
		final Extent snapped = BoundingBoxTools.snapToGrid( new Extent( 0.3 * 3, 0, 0.3 * 7, 0.3 ), 0.3 );
		assertEquals( 0.9, snapped.getXMin(), 1e-12 );
		assertEquals( 2.1, snapped.getXMax(), 1e-12 );
	}

	@Test
	public void testPolygonConversion()
	{
		final Extent e = new Extent( 1, 2, 3, 5 );

		assertEquals( e, BoundingBoxTools.toExtent( BoundingBoxTools.toPolygon( e ), null ) );
		assertEquals( 6.0, BoundingBoxTools.toPolygon( e ).getArea(), 1e-12 );
		assertNull( BoundingBoxTools.toExtent( BoundingBoxTools.GEOMETRY_FACTORY.createPolygon(), null ) );
	}

	@Test
	public void testEnvelopeAndUnion()
	{
		final Extent envelope = BoundingBoxTools.envelope( new double[][] { { 3, 1 }, { -1, 4 }, { 2, -2 } }, null );
		assertEquals( new Extent( -1, -2, 3, 4 ), envelope );

		final Extent union = BoundingBoxTools.union( Arrays.asList( new Extent( 0, 0, 1, 1 ), new Extent( 5, -1, 6, 0.5 ) ) );
		assertEquals( new Extent( 0, -1, 6, 1 ), union );

		assertArrayEquals( new long[] { 300, 100 }, BoundingBoxTools.pixelSize( new Extent( 0, 0, 150, 50 ), 0.5 ) );
	}
}

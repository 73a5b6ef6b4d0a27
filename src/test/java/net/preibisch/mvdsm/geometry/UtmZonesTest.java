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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class UtmZonesTest
{
	@Test
	public void testZones()
	{
		assertEquals( 1, UtmZones.zone( -180, 0 ) );
		assertEquals( 31, UtmZones.zone( 3, 45 ) );
		assertEquals( 31, UtmZones.zone( 0, 45 ) );
		assertEquals( 30, UtmZones.zone( -0.1, 45 ) );
		assertEquals( 60, UtmZones.zone( 179.9, 45 ) );
		assertEquals( 1, UtmZones.zone( 180, 45 ) );
	}

	@Test
	public void testEpsgCodes()
	{
		assertEquals( "EPSG:32631", UtmZones.epsgCode( 3, 45 ) );
		assertEquals( "EPSG:32733", UtmZones.epsgCode( 14, -22 ) );
		assertEquals( "EPSG:32601", UtmZones.epsgCode( -177, 0 ) );
	}
}

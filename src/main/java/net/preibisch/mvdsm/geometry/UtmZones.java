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

public class UtmZones
{
	public static final String WGS84 = "EPSG:4326";

	/**
	 * @param lon - longitude in degrees
	 * @param lat - latitude in degrees
	 * @return the standard UTM zone number (1-60) containing the position
	 */
	public static int zone( final double lon, final double lat )
	{
		final double l = ( ( lon + 180.0 ) % 360.0 + 360.0 ) % 360.0;
		return Math.min( 60, (int)Math.floor( l / 6.0 ) + 1 );
	}

	/**
	 * @param lon - longitude in degrees
	 * @param lat - latitude in degrees
	 * @return WGS84 / UTM crs of the zone containing the position, e.g. "EPSG:32631"
	 */
	public static String epsgCode( final double lon, final double lat )
	{
		return "EPSG:" + ( ( lat >= 0 ? 32600 : 32700 ) + zone( lon, lat ) );
	}
}

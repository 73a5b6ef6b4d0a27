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

import java.io.Serializable;

public class PointGenerationOptions implements Serializable
{
	private static final long serialVersionUID = 6286339913322287055L;

	final String crs;
	final ElevationReference elevationReference;
	final boolean useSecondaryDisparity, snapToFirstImage, align, addMask;

	public PointGenerationOptions(
			final String crs,
			final ElevationReference elevationReference,
			final boolean useSecondaryDisparity,
			final boolean snapToFirstImage,
			final boolean align,
			final boolean addMask )
	{
		this.crs = crs;
		this.elevationReference = elevationReference;
		this.useSecondaryDisparity = useSecondaryDisparity;
		this.snapToFirstImage = snapToFirstImage;
		this.align = align;
		this.addMask = addMask;
	}

	public PointGenerationOptions withElevationReference( final ElevationReference elevationReference )
	{
		return new PointGenerationOptions( crs, elevationReference, useSecondaryDisparity, snapToFirstImage, align, addMask );
	}

	public String getCrs() { return crs; }

	/**
	 * @return the altitude reference, null means heights are relative to the ellipsoid
	 */
	public ElevationReference getElevationReference() { return elevationReference; }
	public boolean useSecondaryDisparity() { return useSecondaryDisparity; }
	public boolean snapToFirstImage() { return snapToFirstImage; }
	public boolean align() { return align; }
	public boolean addMask() { return addMask; }
}

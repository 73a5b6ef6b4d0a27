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

/**
 * Output of the triangulation of one epipolar tile: the point cloud from the reference
 * disparity map and, if requested, the one from the secondary disparity map.
 */
public class TriangulatedPoints implements Serializable
{
	private static final long serialVersionUID = -3360287211735232432L;

	final PointCloud reference;
	final PointCloud secondary;

	public TriangulatedPoints( final PointCloud reference, final PointCloud secondary )
	{
		this.reference = reference;
		this.secondary = secondary;
	}

	public TriangulatedPoints( final PointCloud reference )
	{
		this( reference, null );
	}

	public PointCloud getReference() { return reference; }
	public PointCloud getSecondary() { return secondary; }
	public boolean hasSecondary() { return secondary != null; }
}

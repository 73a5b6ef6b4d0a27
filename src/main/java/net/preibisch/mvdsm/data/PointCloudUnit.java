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
 * The 3D points of one (pair, epipolar tile), either held in memory or persisted
 * to a dataset of the temporary point-cloud container.
 */
public class PointCloudUnit implements Serializable
{
	private static final long serialVersionUID = 5391906719025301779L;

	final EpipolarTileRef ref;
	final String pairId;
	final TriangulatedPoints points;
	final String dataset;

	private PointCloudUnit( final EpipolarTileRef ref, final String pairId, final TriangulatedPoints points, final String dataset )
	{
		this.ref = ref;
		this.pairId = pairId;
		this.points = points;
		this.dataset = dataset;
	}

	public static PointCloudUnit inMemory( final EpipolarTileRef ref, final String pairId, final TriangulatedPoints points )
	{
		return new PointCloudUnit( ref, pairId, points, null );
	}

	public static PointCloudUnit persisted( final EpipolarTileRef ref, final String pairId, final String dataset )
	{
		return new PointCloudUnit( ref, pairId, null, dataset );
	}

	public EpipolarTileRef getRef() { return ref; }
	public Tile getEpipolarTile() { return ref.getTile(); }
	public String getPairId() { return pairId; }
	public boolean isPersisted() { return dataset != null; }
	public String getDataset() { return dataset; }

	/**
	 * @return the points if held in memory, null if persisted
	 */
	public TriangulatedPoints getPoints() { return points; }

	@Override
	public String toString() { return "PointCloudUnit(" + pairId + ", " + getEpipolarTile().regionHash() + ( isPersisted() ? ", " + dataset + ")" : ")" ); }
}

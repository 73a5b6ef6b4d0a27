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

import org.locationtech.jts.geom.Geometry;

/**
 * Everything the preparation step produced for one stereo pair: the images, the size and
 * sampling of the epipolar geometry, the estimated disparity range and the ground
 * footprint (intersection of both image envelopes).
 *
 * @author Stephan Preibisch
 */
public class PairConfiguration implements Serializable
{
	private static final long serialVersionUID = 7437826580392367164L;

	final String id;
	final String leftImage, rightImage;
	final int epipolarSizeX, epipolarSizeY;
	final double minDisparity, maxDisparity;
	final double dispToAltRatio;
	final Geometry envelopesIntersection;
	final String envelopesIntersectionCrs;

	double[] epipolarOrigin = new double[] { 0, 0 };
	double[] epipolarSpacing = new double[] { 1, 1 };
	String colorImage = null;
	String leftMask = null;
	int numColorBands = 1;
	boolean lowResDemCorrection = false;

	public PairConfiguration(
			final String id,
			final String leftImage,
			final String rightImage,
			final int epipolarSizeX,
			final int epipolarSizeY,
			final double minDisparity,
			final double maxDisparity,
			final double dispToAltRatio,
			final Geometry envelopesIntersection,
			final String envelopesIntersectionCrs )
	{
		this.id = id;
		this.leftImage = leftImage;
		this.rightImage = rightImage;
		this.epipolarSizeX = epipolarSizeX;
		this.epipolarSizeY = epipolarSizeY;
		this.minDisparity = minDisparity;
		this.maxDisparity = maxDisparity;
		this.dispToAltRatio = dispToAltRatio;
		this.envelopesIntersection = envelopesIntersection;
		this.envelopesIntersectionCrs = envelopesIntersectionCrs;
	}

	public PairConfiguration setEpipolarGrid( final double[] origin, final double[] spacing )
	{
		this.epipolarOrigin = origin.clone();
		this.epipolarSpacing = spacing.clone();
		return this;
	}

	public PairConfiguration setColorImage( final String colorImage, final int numColorBands )
	{
		this.colorImage = colorImage;
		this.numColorBands = numColorBands;
		return this;
	}

	public PairConfiguration setLeftMask( final String leftMask )
	{
		this.leftMask = leftMask;
		return this;
	}

	public PairConfiguration setLowResDemCorrection( final boolean available )
	{
		this.lowResDemCorrection = available;
		return this;
	}

	public String getId() { return id; }
	public String getLeftImage() { return leftImage; }
	public String getRightImage() { return rightImage; }
	public int getEpipolarSizeX() { return epipolarSizeX; }
	public int getEpipolarSizeY() { return epipolarSizeY; }
	public double getMinDisparity() { return minDisparity; }
	public double getMaxDisparity() { return maxDisparity; }
	public double getDispToAltRatio() { return dispToAltRatio; }
	public Geometry getEnvelopesIntersection() { return envelopesIntersection; }
	public String getEnvelopesIntersectionCrs() { return envelopesIntersectionCrs; }
	public double[] getEpipolarOrigin() { return epipolarOrigin; }
	public double[] getEpipolarSpacing() { return epipolarSpacing; }

	/**
	 * @return the color image, the left image is used if no color image was given
	 */
	public String getColorImage() { return colorImage == null ? leftImage : colorImage; }
	public int getNumColorBands() { return numColorBands; }
	public String getLeftMask() { return leftMask; }
	public boolean hasLeftMask() { return leftMask != null; }
	public boolean hasLowResDemCorrection() { return lowResDemCorrection; }

	/**
	 * @return the largest epipolar region, i.e. the full epipolar image
	 */
	public Extent getEpipolarExtent() { return new Extent( 0, 0, epipolarSizeX, epipolarSizeY ); }

	@Override
	public String toString() { return "Pair '" + id + "' (" + leftImage + ", " + rightImage + ")"; }
}

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
package net.preibisch.mvdsm.process.rasterization;

import java.io.Serializable;

/**
 * Everything a rasterization task needs to know about filtering and gridding, identical for all terrain tiles.
 *
 * @author Stephan Preibisch
 */
public class RasterizationParameters implements Serializable
{
	private static final long serialVersionUID = -1457232954630470658L;

	public static float defaultDsmNoData = -32768;
	public static float defaultColorNoData = 0;
	public static int defaultMaskNoData = 65535;

	final double resolution;
	final int radius;
	final double sigma;
	final int numBands;
	final boolean writeMask, writeStats;

	float dsmNoData = defaultDsmNoData;
	float colorNoData = defaultColorNoData;
	int maskNoData = defaultMaskNoData;

	boolean smallComponentsFilter = false;
	double connectionDistance = 3.0;
	int minPointsPerComponent = 50;
	double clustersDistanceThreshold = Double.NaN;
	int onGroundMargin = 10;

	boolean statisticalOutliersFilter = false;
	int k = 50;
	double stdDevFactor = 5.0;

	/**
	 * @param resolution - output pixel size
	 * @param radius - neighborhood (in pixels) a point contributes to
	 * @param sigma - standard deviation of the gaussian weight, NaN means resolution
	 * @param numBands - number of color bands
	 * @param writeMask - rasterize the mask channel
	 * @param writeStats - compute mean, std, number of points and points in cell layers
	 */
	public RasterizationParameters( final double resolution, final int radius, final double sigma, final int numBands, final boolean writeMask, final boolean writeStats )
	{
		this.resolution = resolution;
		this.radius = radius;
		this.sigma = Double.isNaN( sigma ) ? resolution : sigma;
		this.numBands = numBands;
		this.writeMask = writeMask;
		this.writeStats = writeStats;
	}

	public RasterizationParameters setNoData( final float dsmNoData, final float colorNoData, final int maskNoData )
	{
		this.dsmNoData = dsmNoData;
		this.colorNoData = colorNoData;
		this.maskNoData = maskNoData;
		return this;
	}

	public RasterizationParameters setSmallComponentsFilter( final double connectionDistance, final int minPointsPerComponent, final double clustersDistanceThreshold, final int onGroundMargin )
	{
		this.smallComponentsFilter = true;
		this.connectionDistance = connectionDistance;
		this.minPointsPerComponent = minPointsPerComponent;
		this.clustersDistanceThreshold = clustersDistanceThreshold;
		this.onGroundMargin = onGroundMargin;
		return this;
	}

	public RasterizationParameters setStatisticalOutliersFilter( final int k, final double stdDevFactor )
	{
		this.statisticalOutliersFilter = true;
		this.k = k;
		this.stdDevFactor = stdDevFactor;
		return this;
	}

	public double getResolution() { return resolution; }
	public int getRadius() { return radius; }
	public double getSigma() { return sigma; }
	public int getNumBands() { return numBands; }
	public boolean writeMask() { return writeMask; }
	public boolean writeStats() { return writeStats; }

	public float getDsmNoData() { return dsmNoData; }
	public float getColorNoData() { return colorNoData; }
	public int getMaskNoData() { return maskNoData; }

	public boolean useSmallComponentsFilter() { return smallComponentsFilter; }
	public double getConnectionDistance() { return connectionDistance; }
	public int getMinPointsPerComponent() { return minPointsPerComponent; }
	public double getClustersDistanceThreshold() { return clustersDistanceThreshold; }
	public int getOnGroundMargin() { return onGroundMargin; }

	public boolean useStatisticalOutliersFilter() { return statisticalOutliersFilter; }
	public int getK() { return k; }
	public double getStdDevFactor() { return stdDevFactor; }

	/**
	 * @return distance around a terrain tile whose points are needed to rasterize and filter it
	 */
	public double terrainMargin()
	{
		return ( radius + 0.5 + ( smallComponentsFilter ? onGroundMargin : 0 ) ) * resolution;
	}
}

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

import java.util.Collections;
import java.util.List;

import net.preibisch.mvdsm.data.Extent;

/**
 * Result of the terrain bounding-box resolution: the output crs, the footprint of every pair
 * and the global box that defines the output pixel grid.
 */
public class TerrainBoundingBox
{
	final String crs;
	final List< PairFootprint > pairs;
	final Extent global;
	final List< String > warnings;

	public TerrainBoundingBox( final String crs, final List< PairFootprint > pairs, final Extent global, final List< String > warnings )
	{
		this.crs = crs;
		this.pairs = Collections.unmodifiableList( pairs );
		this.global = global;
		this.warnings = Collections.unmodifiableList( warnings );
	}

	public String getCrs() { return crs; }
	public List< PairFootprint > getPairs() { return pairs; }
	public PairFootprint getPair( final int pairIndex ) { return pairs.get( pairIndex ); }
	public Extent getGlobal() { return global; }
	public List< String > getWarnings() { return warnings; }
}

/**
 **
 ** ProgressMonitor.java - progress and cooperative cancellation of stack loops
 **
 ** Copyright (C) 2026 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ProgressMonitor.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

package com.elphel.driftcorr.common;

/**
 * Receives progress of long per-layer loops and may ask them to stop. Implementations must be
 * thread safe, {@link #progress(int, int)} is called from the worker threads.
 */
public interface ProgressMonitor {
	/**
	 * @param done number of finished items
	 * @param total total number of items
	 */
	void progress(int done, int total);

	/** @return true to stop starting new items */
	default boolean isCanceled() {
		return false;
	}
}

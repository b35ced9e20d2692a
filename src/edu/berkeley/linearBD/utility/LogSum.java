 /*
    This file is part of linearBD.

    linearBD is free software: you can redistribute it and/or modify
    it under the terms of the GNU General Public License as published by
    the Free Software Foundation, either version 3 of the License, or
    (at your option) any later version.

    linearBD is distributed in the hope that it will be useful,
    but WITHOUT ANY WARRANTY; without even the implied warranty of
    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
    GNU General Public License for more details.

    You should have received a copy of the GNU General Public License
    along with linearBD.  If not, see <http://www.gnu.org/licenses/>.
  */

package edu.berkeley.linearBD.utility;

import gnu.trove.list.array.TDoubleArrayList;

/**
 * Accumulates non-negative summands given by their logarithms and returns the
 * logarithm of their sum, scaling everything against the largest summand so
 * that neither overflow nor underflow happens on the way.
 */
public final class LogSum {
	// the log summands, in the order they came in
	private final TDoubleArrayList logSummands;

	private double maxLogSummand;
	private int maxIndex;

	public LogSum(int expectedEntries) {
		this.logSummands = new TDoubleArrayList(Math.max(expectedEntries, 1));

		reset();
	}

	public final void reset() {
		this.logSummands.resetQuick();
		this.maxLogSummand = Double.NEGATIVE_INFINITY;
		this.maxIndex = -1;
	}

	public final void addLogSummand(double logSummand) {
		assert (!Double.isNaN(logSummand));

		// a zero summand does not change anything
		if (logSummand == Double.NEGATIVE_INFINITY) return;

		if (logSummand > this.maxLogSummand) {
			this.maxLogSummand = logSummand;
			this.maxIndex = this.logSummands.size();
		}
		this.logSummands.add(logSummand);
	}

	public final double retrieveLogSum() {
		if (this.maxIndex < 0) return Double.NEGATIVE_INFINITY;
		if (this.maxLogSummand == Double.POSITIVE_INFINITY) return Double.POSITIVE_INFINITY;

		// the maximum contributes exactly one, so only add up the rest
		double factorSum = 0d;
		for (int i = 0; i < this.logSummands.size(); i++) {
			if (i == this.maxIndex) continue;
			factorSum += Math.exp(this.logSummands.getQuick(i) - this.maxLogSummand);
		}

		return this.maxLogSummand + Math.log1p(factorSum);
	}
}

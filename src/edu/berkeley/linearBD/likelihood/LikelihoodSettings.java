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

package edu.berkeley.linearBD.likelihood;

public class LikelihoodSettings {

	public static final double DEFAULT_CRITICAL_EPSILON = 1e-8;
	public static final double DEFAULT_ROUNDING_TOLERANCE = 1e-10;

	public static final LikelihoodSettings DEFAULT = new LikelihoodSettings(DEFAULT_CRITICAL_EPSILON, DEFAULT_ROUNDING_TOLERANCE, null, false);

	// below this |(lambda - mu) t| the equal rates limit is used
	public final double criticalEpsilon;
	// how far 1 - alpha - beta or a log probability may stray before we complain
	public final double roundingTolerance;
	// null means sequential
	public final Integer parallelThreads;
	public final boolean verbose;

	public LikelihoodSettings(double criticalEpsilon, double roundingTolerance, Integer parallelThreads, boolean verbose) {
		if (!(criticalEpsilon >= 0d) || !(criticalEpsilon < 1d)) {
			throw new IllegalArgumentException("Critical epsilon has to be in [0, 1): " + criticalEpsilon);
		}
		if (!(roundingTolerance >= 0d) || !(roundingTolerance < 1d)) {
			throw new IllegalArgumentException("Rounding tolerance has to be in [0, 1): " + roundingTolerance);
		}
		if (parallelThreads != null && parallelThreads < 1) {
			throw new IllegalArgumentException("Need at least one thread: " + parallelThreads);
		}
		this.criticalEpsilon = criticalEpsilon;
		this.roundingTolerance = roundingTolerance;
		this.parallelThreads = parallelThreads;
		this.verbose = verbose;
	}

	public LikelihoodSettings withParallelThreads(Integer parallelThreads) {
		return new LikelihoodSettings(this.criticalEpsilon, this.roundingTolerance, parallelThreads, this.verbose);
	}

	public LikelihoodSettings withVerbose(boolean verbose) {
		return new LikelihoodSettings(this.criticalEpsilon, this.roundingTolerance, this.parallelThreads, verbose);
	}

	public String toString() {
		return "criticalEpsilon = " + this.criticalEpsilon + ", roundingTolerance = " + this.roundingTolerance + ", parallelThreads = " + this.parallelThreads + ", verbose = " + this.verbose;
	}
}

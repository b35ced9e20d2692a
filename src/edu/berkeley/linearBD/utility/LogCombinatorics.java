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

import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.CombinatoricsUtils;

public class LogCombinatorics {

	// beyond this the factorials are no longer tabulated
	private static final int MAX_TABULATED = 20;

	/**
	 * Log of the binomial coefficient n choose k in constant time. Uses the
	 * tabulated factorials for n up to 20 and log-gamma beyond that.
	 * @param n Size of the set, non-negative.
	 * @param k Size of the subset, 0 <= k <= n.
	 * @return log(n choose k)
	 */
	public static double logBinomial(int n, int k) {
		if (n < 0 || k < 0 || k > n) {
			throw new IllegalArgumentException("Invalid binomial coefficient: " + n + " choose " + k);
		}
		// the edges are exactly one
		if (k == 0 || k == n) return 0d;

		if (n <= MAX_TABULATED) {
			return CombinatoricsUtils.factorialLog(n) - CombinatoricsUtils.factorialLog(k) - CombinatoricsUtils.factorialLog(n - k);
		}
		return Gamma.logGamma(n + 1d) - Gamma.logGamma(k + 1d) - Gamma.logGamma(n - k + 1d);
	}

}

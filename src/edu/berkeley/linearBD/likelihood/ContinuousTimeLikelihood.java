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

import edu.berkeley.linearBD.observation.ContinuousTimeCollection;
import edu.berkeley.linearBD.observation.ContinuousTimeObservation;

/**
 * Process observed continuously over [0, T] (Darwin, 1956, Equation (24)):
 * l(lambda, mu | x) = sum log n[s] + B log lambda + D log mu - (lambda + mu) X
 */
public class ContinuousTimeLikelihood {

	public static double logLikelihood(BirthDeathRates rates, ContinuousTimeObservation x) {
		if (rates == null) throw new NullPointerException("rates");

		return x.sumLogN
				+ x.totBirths * Math.log(rates.birthRate)
				+ x.totDeaths * Math.log(rates.deathRate)
				- (rates.birthRate + rates.deathRate) * x.integratedJump;
	}

	// statistics are additive over independent processes, so pool first and evaluate once
	public static double logLikelihood(BirthDeathRates rates, ContinuousTimeCollection x) {
		return logLikelihood(rates, ReplicateAggregator.poolSufficientStatistics(x));
	}

}

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

import edu.berkeley.linearBD.observation.BirthDeathObservation;
import edu.berkeley.linearBD.observation.ContinuousTimeCollection;
import edu.berkeley.linearBD.observation.ContinuousTimeObservation;
import edu.berkeley.linearBD.observation.DiscreteTimeEqualObservation;
import edu.berkeley.linearBD.observation.DiscreteTimeUnequalCollection;
import edu.berkeley.linearBD.observation.DiscreteTimeUnequalObservation;

/**
 * Log-likelihood of the simple linear birth-death process, where lambda is the
 * birth rate, mu the death rate and x the observed sample. Natural log scale,
 * no constants dropped, so values for different rates on the same data compare.
 */
public class BirthDeathLikelihood {

	private final LikelihoodSettings settings;
	private final TransitionProbability transitionProbability;
	private final DiscreteTimeLikelihood discreteTimeLikelihood;

	public BirthDeathLikelihood() {
		this(LikelihoodSettings.DEFAULT);
	}

	public BirthDeathLikelihood(LikelihoodSettings settings) {
		if (settings == null) throw new NullPointerException("settings");
		this.settings = settings;
		this.transitionProbability = new TransitionProbability(settings);
		this.discreteTimeLikelihood = new DiscreteTimeLikelihood(this.transitionProbability, new ReplicateAggregator(settings));
	}

	public LikelihoodSettings getSettings() {
		return this.settings;
	}

	public double logLikelihood(BirthDeathRates rates, BirthDeathObservation x) {
		if (rates == null) throw new NullPointerException("rates");
		if (x == null) throw new NullPointerException("observation");

		switch (x.getType()) {
			case CONTINUOUS_TIME:
				return ContinuousTimeLikelihood.logLikelihood(rates, (ContinuousTimeObservation) x);
			case CONTINUOUS_TIME_COLLECTION:
				return ContinuousTimeLikelihood.logLikelihood(rates, (ContinuousTimeCollection) x);
			case DISCRETE_TIME_EQUAL:
				return this.discreteTimeLikelihood.logLikelihood(rates, (DiscreteTimeEqualObservation) x);
			case DISCRETE_TIME_UNEQUAL:
				return this.discreteTimeLikelihood.logLikelihood(rates, (DiscreteTimeUnequalObservation) x);
			case DISCRETE_TIME_UNEQUAL_COLLECTION:
				return this.discreteTimeLikelihood.logLikelihood(rates, (DiscreteTimeUnequalCollection) x);
			default:
				throw new IllegalArgumentException("Unknown observation type: " + x.getType());
		}
	}

	// log p(j | i, t, lambda, mu)
	public double transitionLogProbability(int from, int to, double elapsedTime, BirthDeathRates rates) {
		return this.transitionProbability.logProbability(from, to, elapsedTime, rates);
	}
}

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

package edu.berkeley.linearBD.maximum_likelihood;

import org.apache.commons.math3.analysis.MultivariateFunction;

import edu.berkeley.linearBD.likelihood.BirthDeathLikelihood;
import edu.berkeley.linearBD.likelihood.BirthDeathRates;
import edu.berkeley.linearBD.observation.BirthDeathObservation;

// the log-likelihood of one fixed sample, as a function of the two rates
public class BirthDeathObjectiveFunction implements MultivariateFunction {

	public enum ParameterScale {
		// point is (lambda, mu), points outside the positive quadrant are domain errors
		NATURAL,
		// point is (log lambda, log mu), every point is valid
		LOG
	}

	private final BirthDeathLikelihood likelihood;
	private final BirthDeathObservation observation;
	private final ParameterScale scale;

	public BirthDeathObjectiveFunction(BirthDeathLikelihood likelihood, BirthDeathObservation observation, ParameterScale scale) {
		if (likelihood == null) throw new NullPointerException("likelihood");
		if (observation == null) throw new NullPointerException("observation");
		if (scale == null) throw new NullPointerException("scale");
		this.likelihood = likelihood;
		this.observation = observation;
		this.scale = scale;
	}

	@Override
	public double value(double[] point) {
		return this.likelihood.logLikelihood(this.toRates(point), this.observation);
	}

	public BirthDeathRates toRates(double[] point) {
		if (point == null || point.length != 2) {
			throw new IllegalArgumentException("Need a point with two coordinates.");
		}

		switch (this.scale) {
			case NATURAL:
				return new BirthDeathRates(point[0], point[1]);
			case LOG:
				return new BirthDeathRates(Math.exp(point[0]), Math.exp(point[1]));
			default:
				throw new IllegalArgumentException("Unknown parameter scale: " + this.scale);
		}
	}

	public double[] toPoint(BirthDeathRates rates) {
		double[] point = rates.toArray();
		if (this.scale == ParameterScale.LOG) {
			for (int i = 0; i < point.length; i++) point[i] = Math.log(point[i]);
		}
		return point;
	}

	public BirthDeathObservation getObservation() {
		return this.observation;
	}

	public ParameterScale getScale() {
		return this.scale;
	}
}

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

import java.util.ArrayList;
import java.util.List;

import edu.berkeley.linearBD.likelihood.ReplicateAggregator.ReplicateLogLikelihood;
import edu.berkeley.linearBD.observation.DiscreteTimeEqualObservation;
import edu.berkeley.linearBD.observation.DiscreteTimeUnequalCollection;
import edu.berkeley.linearBD.observation.DiscreteTimeUnequalObservation;

/**
 * Process observed at time points t[0], ..., t[S] with sizes n[0], ..., n[S].
 * By the Markov property
 * l(lambda, mu | x) = sum_{s=1}^{S} log p(n[s] | n[s-1], t[s] - t[s-1], lambda, mu)
 */
public class DiscreteTimeLikelihood {

	private final TransitionProbability transitionProbability;
	private final ReplicateAggregator aggregator;

	public DiscreteTimeLikelihood(LikelihoodSettings settings) {
		this(new TransitionProbability(settings), new ReplicateAggregator(settings));
	}

	public DiscreteTimeLikelihood(TransitionProbability transitionProbability, ReplicateAggregator aggregator) {
		if (transitionProbability == null) throw new NullPointerException("transitionProbability");
		if (aggregator == null) throw new NullPointerException("aggregator");
		this.transitionProbability = transitionProbability;
		this.aggregator = aggregator;
	}

	// every replicate column on the same grid
	public double logLikelihood(final BirthDeathRates rates, DiscreteTimeEqualObservation x) {
		checkShape(x);
		if (!(x.stepSize > 0d) || Double.isInfinite(x.stepSize)) {
			throw new BirthDeathDomainException("Step size has to be positive and finite: u = " + x.stepSize);
		}

		List<int[]> trajectories = new ArrayList<int[]>();
		for (int r = 0; r < x.n; r++) {
			trajectories.add(x.getTrajectory(r));
		}

		final double stepSize = x.stepSize;
		return this.aggregator.sumLogLikelihoods(trajectories, new ReplicateLogLikelihood<int[]>() {
			@Override
			public double logLikelihood(int[] trajectory) {
				return equalStepLogLikelihood(rates, trajectory, stepSize);
			}
		});
	}

	public double logLikelihood(BirthDeathRates rates, DiscreteTimeUnequalObservation x) {
		checkShape(x);

		double logLik = 0d;
		for (int s = 1; s < x.getNumTimePoints(); s++) {
			logLik += this.transitionProbability.logProbability(x.getState(s - 1), x.getState(s), x.getWaitingTime(s - 1), rates);
		}
		return logLik;
	}

	public double logLikelihood(final BirthDeathRates rates, DiscreteTimeUnequalCollection x) {
		return this.aggregator.sumLogLikelihoods(x.getProcesses(), new ReplicateLogLikelihood<DiscreteTimeUnequalObservation>() {
			@Override
			public double logLikelihood(DiscreteTimeUnequalObservation process) {
				return DiscreteTimeLikelihood.this.logLikelihood(rates, process);
			}
		});
	}

	double equalStepLogLikelihood(BirthDeathRates rates, int[] trajectory, double stepSize) {
		double logLik = 0d;
		for (int s = 1; s < trajectory.length; s++) {
			logLik += this.transitionProbability.logProbability(trajectory[s - 1], trajectory[s], stepSize, rates);
		}
		return logLik;
	}

	static void checkShape(DiscreteTimeEqualObservation x) {
		if (x.getNumTimePoints() == 0) {
			throw new ShapeMismatchException("State has no time points.");
		}
		if (x.n < 0) {
			throw new ShapeMismatchException("Negative number of replicates: " + x.n);
		}
		for (int s = 0; s < x.getNumTimePoints(); s++) {
			if (x.getRowLength(s) != x.n) {
				throw new ShapeMismatchException("Time point " + s + " has " + x.getRowLength(s) + " replicates, expected " + x.n + ".");
			}
		}
	}

	static void checkShape(DiscreteTimeUnequalObservation x) {
		if (x.getNumTimePoints() == 0) {
			throw new ShapeMismatchException("State has no time points.");
		}
		if (x.getNumWaitingTimes() != x.getNumTimePoints() - 1) {
			throw new ShapeMismatchException("Got " + x.getNumWaitingTimes() + " waiting times for " + x.getNumTimePoints() + " time points, expected " + (x.getNumTimePoints() - 1) + ".");
		}
	}
}

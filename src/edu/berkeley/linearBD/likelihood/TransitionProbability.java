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

import edu.berkeley.linearBD.utility.LogCombinatorics;
import edu.berkeley.linearBD.utility.LogSum;

/**
 * Log of the transition probability p(j | i, t, lambda, mu) of the linear
 * birth-death process (Bailey, 1964):
 * sum_{h=0}^{min(i,j)} C(i,h) C(i+j-h-1,i-1) alpha^(i-h) beta^(j-h) (1-alpha-beta)^h
 * with alpha = (mu e^{(lambda-mu)t} - mu) / (lambda e^{(lambda-mu)t} - mu) and
 * beta = (lambda e^{(lambda-mu)t} - lambda) / (lambda e^{(lambda-mu)t} - mu).
 * Everything is done in log space.
 */
public class TransitionProbability {

	private static final double LOG_HALF = -Math.log(2d);

	private final LikelihoodSettings settings;

	public TransitionProbability() {
		this(LikelihoodSettings.DEFAULT);
	}

	public TransitionProbability(LikelihoodSettings settings) {
		if (settings == null) throw new NullPointerException("settings");
		this.settings = settings;
	}

	public LikelihoodSettings getSettings() {
		return this.settings;
	}

	/**
	 * @param from Population size i at time 0.
	 * @param to Population size j at time t.
	 * @param elapsedTime t, positive.
	 * @param rates The birth and death rates.
	 * @return log p(j | i, t, lambda, mu), at most 0.
	 */
	public double logProbability(int from, int to, double elapsedTime, BirthDeathRates rates) {
		if (from < 0 || to < 0) {
			throw new BirthDeathDomainException("Population sizes have to be non-negative: i = " + from + ", j = " + to);
		}
		if (!(elapsedTime > 0d) || Double.isInfinite(elapsedTime)) {
			throw new BirthDeathDomainException("Elapsed time has to be positive and finite: t = " + elapsedTime);
		}
		if (rates == null) throw new NullPointerException("rates");

		// zero is absorbing
		if (from == 0) {
			return (to == 0) ? 0d : Double.NEGATIVE_INFINITY;
		}

		Coefficients coef = this.coefficients(elapsedTime, rates);

		double logProb;
		if (coef == null) {
			// e^{(lambda - mu)t} overflowed, so every lineage that did not die out has run off to infinity
			logProb = (to == 0) ? from * (Math.log(rates.deathRate) - Math.log(rates.birthRate)) : Double.NEGATIVE_INFINITY;
		}
		else {
			if (coef.gamma < 0d && coef.gamma >= -this.settings.roundingTolerance) {
				if (this.settings.verbose) {
					System.err.println("# Warning: 1 - alpha - beta = " + coef.gamma + " clamped to zero [i = " + from + ", j = " + to + ", t = " + elapsedTime + ", " + rates + "]");
				}
				coef = coef.withZeroGamma();
			}

			if (coef.gamma >= 0d) {
				logProb = baileySeries(from, to, coef);
			}
			else {
				// past the crossover time the series alternates, so sum over founding lineages instead
				logProb = lineageSeries(from, to, coef);
			}
		}

		return this.checkLogProbability(logProb, from, to, elapsedTime, rates);
	}

	// a log probability above zero is only accepted within the rounding tolerance
	double checkLogProbability(double logProb, int from, int to, double elapsedTime, BirthDeathRates rates) {
		if (Double.isNaN(logProb)) {
			throw new NumericalDomainException("Transition log-probability is not a number", from, to, elapsedTime, rates);
		}
		if (logProb > 0d) {
			if (logProb > this.settings.roundingTolerance) {
				throw new NumericalDomainException("Transition log-probability " + logProb + " is positive beyond rounding", from, to, elapsedTime, rates);
			}
			logProb = 0d;
		}
		return logProb;
	}

	// (e^{(lambda - mu)t} - 1) / (lambda - mu), which is t when the rates agree
	double scaledTime(double netRate, double elapsedTime) {
		double w = netRate * elapsedTime;
		if (Math.abs(w) < this.settings.criticalEpsilon) {
			// series of expm1(w) / w
			return elapsedTime * (1d + w / 2d + w * w / 6d);
		}
		return Math.expm1(w) / netRate;
	}

	// null if the scaled time overflows
	Coefficients coefficients(double elapsedTime, BirthDeathRates rates) {
		double lambda = rates.birthRate;
		double mu = rates.deathRate;
		double netRate = rates.getNetGrowthRate();

		double s = this.scaledTime(netRate, elapsedTime);
		assert (s > 0d);
		if (Double.isInfinite(s) || Double.isInfinite(lambda * s) || Double.isInfinite(mu * s)) return null;

		// alpha = mu s / (1 + lambda s), beta = lambda s / (1 + lambda s)
		double logOnePlusLambdaS = Math.log1p(lambda * s);
		double logS = Math.log(s);
		double logAlpha = Math.log(mu) + logS - logOnePlusLambdaS;
		double logBeta = Math.log(lambda) + logS - logOnePlusLambdaS;
		// 1 - alpha = e^w / (1 + lambda s), 1 - beta = 1 / (1 + lambda s)
		double logOneMinusAlpha = netRate * elapsedTime - logOnePlusLambdaS;
		double logOneMinusBeta = -logOnePlusLambdaS;

		// near one, take the log through the complement
		if (logAlpha > LOG_HALF) logAlpha = Math.log1p(-Math.exp(logOneMinusAlpha));
		if (logBeta > LOG_HALF) logBeta = Math.log1p(-Math.exp(logOneMinusBeta));
		// 1 - alpha - beta = (1 - mu s) / (1 + lambda s)
		double gammaNumerator = 1d - mu * s;
		double gamma = gammaNumerator / (1d + lambda * s);
		double logAbsGamma = Math.log(Math.abs(gammaNumerator)) - logOnePlusLambdaS;

		return new Coefficients(logAlpha, logBeta, logOneMinusAlpha, logOneMinusBeta, gamma, logAbsGamma);
	}

	static double baileySeries(int from, int to, Coefficients coef) {
		assert (from > 0);
		assert (coef.gamma >= 0d);

		int hMax = Math.min(from, to);
		LogSum logSum = new LogSum(hMax + 1);
		for (int h = 0; h <= hMax; h++) {
			// 0^0 is still one
			if (h > 0 && coef.gamma == 0d) break;

			double logTerm = LogCombinatorics.logBinomial(from, h)
					+ LogCombinatorics.logBinomial(from + to - h - 1, from - 1)
					+ (from - h) * coef.logAlpha
					+ (to - h) * coef.logBeta;
			if (h > 0) logTerm += h * coef.logAbsGamma;

			logSum.addLogSummand(logTerm);
		}
		return logSum.retrieveLogSum();
	}

	// each founding lineage dies out (alpha) or leaves a geometric number of descendants
	static double lineageSeries(int from, int to, Coefficients coef) {
		assert (from > 0);

		if (to == 0) return from * coef.logAlpha;

		int mMax = Math.min(from, to);
		LogSum logSum = new LogSum(mMax);
		for (int m = 1; m <= mMax; m++) {
			double logTerm = LogCombinatorics.logBinomial(from, m)
					+ (from - m) * coef.logAlpha
					+ m * coef.logOneMinusAlpha
					+ LogCombinatorics.logBinomial(to - 1, m - 1)
					+ m * coef.logOneMinusBeta
					+ (to - m) * coef.logBeta;
			logSum.addLogSummand(logTerm);
		}
		return logSum.retrieveLogSum();
	}

	static class Coefficients {
		final double logAlpha;
		final double logBeta;
		final double logOneMinusAlpha;
		final double logOneMinusBeta;
		// 1 - alpha - beta, can be negative
		final double gamma;
		final double logAbsGamma;

		Coefficients(double logAlpha, double logBeta, double logOneMinusAlpha, double logOneMinusBeta, double gamma, double logAbsGamma) {
			this.logAlpha = logAlpha;
			this.logBeta = logBeta;
			this.logOneMinusAlpha = logOneMinusAlpha;
			this.logOneMinusBeta = logOneMinusBeta;
			this.gamma = gamma;
			this.logAbsGamma = logAbsGamma;
		}

		Coefficients withZeroGamma() {
			return new Coefficients(this.logAlpha, this.logBeta, this.logOneMinusAlpha, this.logOneMinusBeta, 0d, Double.NEGATIVE_INFINITY);
		}
	}
}

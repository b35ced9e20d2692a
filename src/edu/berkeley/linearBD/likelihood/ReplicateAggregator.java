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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

import edu.berkeley.linearBD.observation.ContinuousTimeCollection;
import edu.berkeley.linearBD.observation.ContinuousTimeObservation;
import edu.berkeley.linearBD.utility.SumArray;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.array.TDoubleArrayList;

/**
 * Independent replicates sharing one pair of rates have a log-likelihood that
 * is the sum of theirs. The per-replicate values may be computed in parallel,
 * but they are always summed in input order, so the result does not depend on
 * the number of threads.
 */
public class ReplicateAggregator {

	public interface ReplicateLogLikelihood<T> {
		public double logLikelihood(T replicate);
	}

	private final LikelihoodSettings settings;

	public ReplicateAggregator(LikelihoodSettings settings) {
		if (settings == null) throw new NullPointerException("settings");
		this.settings = settings;
	}

	public <T> double sumLogLikelihoods(List<T> replicates, ReplicateLogLikelihood<? super T> evaluator) {
		return SumArray.getSum(this.replicateLogLikelihoods(replicates, evaluator));
	}

	// the individual values, in the order of the replicates
	public <T> TDoubleList replicateLogLikelihoods(List<T> replicates, ReplicateLogLikelihood<? super T> evaluator) {
		TDoubleArrayList values = new TDoubleArrayList(Math.max(replicates.size(), 1));

		// not worth a pool
		if (this.settings.parallelThreads == null || replicates.size() < 2) {
			for (T replicate : replicates) {
				values.add(evaluator.logLikelihood(replicate));
			}
			return values;
		}

		if (this.settings.verbose) {
			System.out.println("# evaluating " + replicates.size() + " replicates on " + this.settings.parallelThreads + " threads");
		}

		ExecutorService taskExecutor = new ForkJoinPool(this.settings.parallelThreads);
		try {
			// submit them all
			List<Future<Double>> futures = new ArrayList<Future<Double>>();
			for (T replicate : replicates) {
				futures.add(taskExecutor.submit(new ReplicateThread<T>(replicate, evaluator)));
			}

			// and collect in order
			for (Future<Double> f : futures) {
				values.add(collect(f));
			}
		}
		finally {
			taskExecutor.shutdownNow();
		}

		return values;
	}

	private static double collect(Future<Double> future) {
		try {
			return future.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while collecting replicate log-likelihoods.", e);
		} catch (ExecutionException e) {
			// hand the original problem to the caller
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) throw (RuntimeException) cause;
			if (cause instanceof Error) throw (Error) cause;
			throw new RuntimeException("Evaluating a replicate failed.", cause);
		}
	}

	/**
	 * Adds up births, deaths, integrated population and log-population sums of
	 * all processes, left to right.
	 */
	public static ContinuousTimeObservation poolSufficientStatistics(ContinuousTimeCollection collection) {
		double births = 0d;
		double deaths = 0d;
		double integrated = 0d;
		double sumLogN = 0d;

		for (ContinuousTimeObservation process : collection.getProcesses()) {
			births += process.totBirths;
			deaths += process.totDeaths;
			integrated += process.integratedJump;
			sumLogN += process.sumLogN;
		}

		return new ContinuousTimeObservation(sumLogN, births, deaths, integrated);
	}

	static class ReplicateThread<T> implements Callable<Double> {

		private final T replicate;
		private final ReplicateLogLikelihood<? super T> evaluator;

		ReplicateThread(T replicate, ReplicateLogLikelihood<? super T> evaluator) {
			this.replicate = replicate;
			this.evaluator = evaluator;
		}

		@Override
		public Double call() {
			return this.evaluator.logLikelihood(this.replicate);
		}
	}
}

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

package edu.berkeley.linearBD.observation;

import java.util.Arrays;

/**
 * Panel data of n independent replicates, all observed on the same time grid
 * with spacing stepSize. The state is indexed [timeStep][replicate].
 */
public class DiscreteTimeEqualObservation extends BirthDeathObservation {

	private final int[][] state;
	public final double stepSize;
	public final int n;

	public DiscreteTimeEqualObservation(int[][] state, double stepSize, int n) {
		if (state == null) throw new NullPointerException("state");
		// deep copy, rows are not checked here
		this.state = new int[state.length][];
		for (int s = 0; s < state.length; s++) {
			this.state[s] = Arrays.copyOf(state[s], state[s].length);
		}
		this.stepSize = stepSize;
		this.n = n;
	}

	// single replicate
	public DiscreteTimeEqualObservation(int[] trajectory, double stepSize) {
		this(toColumn(trajectory), stepSize, 1);
	}

	private static int[][] toColumn(int[] trajectory) {
		int[][] column = new int[trajectory.length][];
		for (int s = 0; s < trajectory.length; s++) column[s] = new int[] {trajectory[s]};
		return column;
	}

	@Override
	public ObservationType getType() {
		return ObservationType.DISCRETE_TIME_EQUAL;
	}

	@Override
	public int getNumReplicates() {
		return this.n;
	}

	public int getNumTimePoints() {
		return this.state.length;
	}

	// length of the given row, might differ from n if the loader messed up
	public int getRowLength(int timeStep) {
		return this.state[timeStep].length;
	}

	public int getState(int timeStep, int replicate) {
		return this.state[timeStep][replicate];
	}

	public int[] getTrajectory(int replicate) {
		int[] trajectory = new int[this.state.length];
		for (int s = 0; s < this.state.length; s++) trajectory[s] = this.state[s][replicate];
		return trajectory;
	}
}

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

// one process observed at irregular times
public class DiscreteTimeUnequalObservation extends BirthDeathObservation {

	private final int[] state;
	// waitingTime[s] separates state[s] and state[s+1]
	private final double[] waitingTime;

	public DiscreteTimeUnequalObservation(int[] state, double[] waitingTime) {
		if (state == null) throw new NullPointerException("state");
		if (waitingTime == null) throw new NullPointerException("waitingTime");
		this.state = Arrays.copyOf(state, state.length);
		this.waitingTime = Arrays.copyOf(waitingTime, waitingTime.length);
	}

	@Override
	public ObservationType getType() {
		return ObservationType.DISCRETE_TIME_UNEQUAL;
	}

	@Override
	public int getNumReplicates() {
		return 1;
	}

	public int getNumTimePoints() {
		return this.state.length;
	}

	public int getNumWaitingTimes() {
		return this.waitingTime.length;
	}

	public int getState(int timeStep) {
		return this.state[timeStep];
	}

	public double getWaitingTime(int transition) {
		return this.waitingTime[transition];
	}
}

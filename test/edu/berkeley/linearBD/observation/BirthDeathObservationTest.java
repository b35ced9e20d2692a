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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import edu.berkeley.linearBD.observation.BirthDeathObservation.ObservationType;

public class BirthDeathObservationTest {

	@Test
	public void testEqualSpacingIsCopied() {
		int[][] state = {{5, 7, 2}, {6, 7, 1}, {9, 8, 0}};
		DiscreteTimeEqualObservation x = new DiscreteTimeEqualObservation(state, 0.5, 3);
		state[1][0] = 100;
		state[2] = new int[] {0};

		assertEquals(ObservationType.DISCRETE_TIME_EQUAL, x.getType());
		assertEquals(3, x.getNumReplicates());
		assertEquals(3, x.getNumTimePoints());
		assertEquals(3, x.getRowLength(2));
		assertEquals(6, x.getState(1, 0));
		assertArrayEquals(new int[] {2, 1, 0}, x.getTrajectory(2));
	}

	@Test
	public void testSingleTrajectory() {
		DiscreteTimeEqualObservation x = new DiscreteTimeEqualObservation(new int[] {4, 3, 6}, 1.5);
		assertEquals(1, x.n);
		assertEquals(1.5, x.stepSize, 0d);
		assertEquals(3, x.getNumTimePoints());
		assertArrayEquals(new int[] {4, 3, 6}, x.getTrajectory(0));
	}

	@Test
	public void testUnequalSpacingIsCopied() {
		int[] state = {3, 4, 2};
		double[] waitingTime = {0.2, 1.1};
		DiscreteTimeUnequalObservation x = new DiscreteTimeUnequalObservation(state, waitingTime);
		state[0] = 50;
		waitingTime[1] = 9d;

		assertEquals(ObservationType.DISCRETE_TIME_UNEQUAL, x.getType());
		assertEquals(1, x.getNumReplicates());
		assertEquals(3, x.getNumTimePoints());
		assertEquals(2, x.getNumWaitingTimes());
		assertEquals(3, x.getState(0));
		assertEquals(1.1, x.getWaitingTime(1), 0d);
	}

	@Test
	public void testCollections() {
		List<ContinuousTimeObservation> processes = new ArrayList<ContinuousTimeObservation>();
		processes.add(new ContinuousTimeObservation(1d, 2d, 1d, 3d));
		processes.add(new ContinuousTimeObservation(0.5, 0d, 4d, 6d));
		ContinuousTimeCollection continuous = new ContinuousTimeCollection(processes);
		processes.clear();

		assertEquals(ObservationType.CONTINUOUS_TIME_COLLECTION, continuous.getType());
		assertEquals(2, continuous.getNumReplicates());
		assertEquals(4d, continuous.getProcesses().get(1).totDeaths, 0d);
		assertThrows(UnsupportedOperationException.class, () -> continuous.getProcesses().clear());

		DiscreteTimeUnequalCollection discrete = new DiscreteTimeUnequalCollection(Arrays.asList(
				new DiscreteTimeUnequalObservation(new int[] {1, 2}, new double[] {0.3})));
		assertEquals(ObservationType.DISCRETE_TIME_UNEQUAL_COLLECTION, discrete.getType());
		assertEquals(1, discrete.getNumReplicates());

		ContinuousTimeObservation single = new ContinuousTimeObservation(0d, 0d, 0d, 0d);
		assertEquals(ObservationType.CONTINUOUS_TIME, single.getType());
		assertEquals(1, single.getNumReplicates());
	}
}

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

// sufficient statistics of one process watched continuously over [0, T]
public class ContinuousTimeObservation extends BirthDeathObservation {

	// sum of log n[s] over the jump points
	public final double sumLogN;
	// B
	public final double totBirths;
	// D
	public final double totDeaths;
	// X, population size integrated over time
	public final double integratedJump;

	public ContinuousTimeObservation(double sumLogN, double totBirths, double totDeaths, double integratedJump) {
		assert (sumLogN >= 0d);
		assert (totBirths >= 0d && totBirths == Math.rint(totBirths));
		assert (totDeaths >= 0d && totDeaths == Math.rint(totDeaths));
		assert (integratedJump >= 0d);

		this.sumLogN = sumLogN;
		this.totBirths = totBirths;
		this.totDeaths = totDeaths;
		this.integratedJump = integratedJump;
	}

	@Override
	public ObservationType getType() {
		return ObservationType.CONTINUOUS_TIME;
	}

	@Override
	public int getNumReplicates() {
		return 1;
	}

	public String toString() {
		return "[sumLogN = " + this.sumLogN + ", B = " + this.totBirths + ", D = " + this.totDeaths + ", X = " + this.integratedJump + "]";
	}
}

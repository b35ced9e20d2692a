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

/**
 * Observed data of one or more linear birth-death processes. The shapes are
 * fixed; the likelihood picks its reduction by the type tag.
 */
public abstract class BirthDeathObservation {

	public enum ObservationType {
		CONTINUOUS_TIME,
		DISCRETE_TIME_EQUAL,
		DISCRETE_TIME_UNEQUAL,
		CONTINUOUS_TIME_COLLECTION,
		DISCRETE_TIME_UNEQUAL_COLLECTION
	}

	// only the shapes in this package
	BirthDeathObservation() {
	}

	public abstract ObservationType getType();

	// number of independent processes in here
	public abstract int getNumReplicates();
}

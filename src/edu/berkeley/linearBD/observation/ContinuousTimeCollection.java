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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// independent continuously observed processes sharing the rates
public class ContinuousTimeCollection extends BirthDeathObservation {

	private final List<ContinuousTimeObservation> processes;

	public ContinuousTimeCollection(List<ContinuousTimeObservation> processes) {
		if (processes == null) throw new NullPointerException("processes");
		this.processes = Collections.unmodifiableList(new ArrayList<ContinuousTimeObservation>(processes));
		assert (!this.processes.contains(null));
	}

	@Override
	public ObservationType getType() {
		return ObservationType.CONTINUOUS_TIME_COLLECTION;
	}

	@Override
	public int getNumReplicates() {
		return this.processes.size();
	}

	public List<ContinuousTimeObservation> getProcesses() {
		return this.processes;
	}
}

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

public class BirthDeathRates {

	// lambda
	public final double birthRate;
	// mu
	public final double deathRate;

	public BirthDeathRates(double birthRate, double deathRate) {
		// also catches NaN
		if (!(birthRate > 0d) || Double.isInfinite(birthRate)) {
			throw new BirthDeathDomainException("Birth rate has to be positive and finite: " + birthRate);
		}
		if (!(deathRate > 0d) || Double.isInfinite(deathRate)) {
			throw new BirthDeathDomainException("Death rate has to be positive and finite: " + deathRate);
		}
		this.birthRate = birthRate;
		this.deathRate = deathRate;
	}

	public double getNetGrowthRate() {
		return this.birthRate - this.deathRate;
	}

	public double[] toArray() {
		return new double[] {this.birthRate, this.deathRate};
	}

	public boolean equals(Object o) {
		if (o != null && this.getClass() == o.getClass()) {
			BirthDeathRates other = (BirthDeathRates) o;
			return (Double.compare(this.birthRate, other.birthRate) == 0) && (Double.compare(this.deathRate, other.deathRate) == 0);
		}
		return false;
	}

	public int hashCode() {
		return (Double.hashCode(this.birthRate) * 0x1f1f1f1f) ^ Double.hashCode(this.deathRate);
	}

	public String toString() {
		return "lambda = " + this.birthRate + ", mu = " + this.deathRate;
	}
}

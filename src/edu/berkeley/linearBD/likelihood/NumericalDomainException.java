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

/**
 * Thrown when an intermediate quantity of the transition probability left its
 * valid range by more than the rounding tolerance. Carries the transition that
 * failed, so the caller can decide whether to retry at higher precision.
 */
public class NumericalDomainException extends BirthDeathDomainException {

	private static final long serialVersionUID = 1L;

	private final int from;
	private final int to;
	private final double elapsedTime;
	private final BirthDeathRates rates;

	public NumericalDomainException(String message, int from, int to, double elapsedTime, BirthDeathRates rates) {
		super(message + " [i = " + from + ", j = " + to + ", t = " + elapsedTime + ", " + rates + "]");
		this.from = from;
		this.to = to;
		this.elapsedTime = elapsedTime;
		this.rates = rates;
	}

	public int getFrom() {
		return this.from;
	}

	public int getTo() {
		return this.to;
	}

	public double getElapsedTime() {
		return this.elapsedTime;
	}

	public BirthDeathRates getRates() {
		return this.rates;
	}

}

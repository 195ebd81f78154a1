// This file is part of the Featherweight Ornaments Library (fwo).
//
// The Featherweight Ornaments Library is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Featherweight Ornaments Library is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Featherweight Ornaments Library. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package featherweightornaments.discovery;

/**
 * Determines how a choice is made between several positions which all qualify
 * as the newly inserted index.
 *
 * @author David J. Pearce
 *
 */
public enum DiscoveryPolicy {
	/**
	 * Choose the first qualifying position, scanning outer to inner.
	 */
	FIRST_MATCH,
	/**
	 * Fail unless exactly one position qualifies.
	 */
	STRICT
}

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
package featherweightornaments.lifting;

import java.util.HashMap;
import java.util.Map;

import featherweightornaments.discovery.CorrespondenceDescriptor;

/**
 * A store which outlives individual lifting requests. This records the
 * correspondences discovered between pairs of types, and for each
 * correspondence and direction the names of globals, types and constructors
 * which have already been lifted. Later requests then refer to the lifted
 * names rather than lifting the originals again.
 *
 * @author David J. Pearce
 *
 */
public class LiftingRegistry {
	private final Map<String, CorrespondenceDescriptor> ornaments = new HashMap<>();
	private final Map<String, String> liftings = new HashMap<>();

	public void saveOrnament(CorrespondenceDescriptor correspondence) {
		ornaments.put(correspondence.key(), correspondence);
	}

	/**
	 * Find the correspondence between two named types, or <code>null</code>
	 * if none has been discovered.
	 *
	 * @param before
	 * @param after
	 * @return
	 */
	public CorrespondenceDescriptor lookupOrnament(String before, String after) {
		return ornaments.get(before + "->" + after);
	}

	/**
	 * Record that a given name lifts to another along a correspondence in a
	 * given direction.
	 *
	 * @param correspondence
	 * @param direction
	 * @param from
	 * @param to
	 */
	public void saveLifting(CorrespondenceDescriptor correspondence, LiftingConfiguration.Direction direction,
			String from, String to) {
		liftings.put(key(correspondence, direction, from), to);
	}

	/**
	 * Forget that a given name lifts along a correspondence in a given
	 * direction.
	 *
	 * @param correspondence
	 * @param direction
	 * @param from
	 */
	public void removeLifting(CorrespondenceDescriptor correspondence, LiftingConfiguration.Direction direction,
			String from) {
		liftings.remove(key(correspondence, direction, from));
	}

	/**
	 * Get the name a given name lifts to, or <code>null</code> if it was not
	 * lifted before.
	 *
	 * @param correspondence
	 * @param direction
	 * @param from
	 * @return
	 */
	public String lookupLifting(CorrespondenceDescriptor correspondence, LiftingConfiguration.Direction direction,
			String from) {
		return liftings.get(key(correspondence, direction, from));
	}

	private static String key(CorrespondenceDescriptor correspondence, LiftingConfiguration.Direction direction,
			String name) {
		return correspondence.key() + ":" + direction + ":" + name;
	}
}

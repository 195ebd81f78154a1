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
package featherweightornaments.util;

/**
 * The root of all failures raised whilst discovering an ornament or lifting a
 * term across one. These are deterministic results of symbolic analysis: they
 * are raised at the point of detection, never recovered internally, and
 * retrying with unchanged input cannot help.
 *
 * @author David J. Pearce
 *
 */
public class OrnamentError extends RuntimeException {
	public static final long serialVersionUID = 1l;

	/**
	 * An element related to the error (e.g. the offending term or
	 * declaration), or <code>null</code>.
	 */
	private final Object element;

	public OrnamentError(String msg, Object element) {
		super(msg);
		this.element = element;
	}

	public Object element() {
		return element;
	}

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		return element == null ? msg : msg + " (" + element + ")";
	}

	/**
	 * The declarations have a shape which is not supported, such as being
	 * mutually recursive, coinductive, having differing numbers of parameters
	 * or differing by more than one index.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class UnsupportedShape extends OrnamentError {
		public static final long serialVersionUID = 1l;

		public UnsupportedShape(String msg, Object element) {
			super(msg, element);
		}
	}

	/**
	 * The new index could not be determined. Clients which do not need to
	 * distinguish why can catch this, whilst others can catch one of its two
	 * subclasses.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class IndexDiscoveryFailure extends OrnamentError {
		public static final long serialVersionUID = 1l;

		public IndexDiscoveryFailure(String msg, Object element) {
			super(msg, element);
		}
	}

	/**
	 * No position was found at which the new declaration introduces an index.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class IndexNotFound extends IndexDiscoveryFailure {
		public static final long serialVersionUID = 1l;

		public IndexNotFound(String msg, Object element) {
			super(msg, element);
		}
	}

	/**
	 * More than one position qualified as the new index, and the discovery
	 * policy does not permit choosing between them.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class AmbiguousIndex extends IndexDiscoveryFailure {
		public static final long serialVersionUID = 1l;

		public AmbiguousIndex(String msg, Object element) {
			super(msg, element);
		}
	}

	/**
	 * The arguments of corresponding constructors could not be aligned one to
	 * one, beyond the addition of the new index.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class AlignmentFailure extends OrnamentError {
		public static final long serialVersionUID = 1l;

		public AlignmentFailure(String msg, Object element) {
			super(msg, element);
		}
	}

	/**
	 * A case split or (co)fixpoint directly scrutinises a value of the type
	 * being lifted. Such terms must be expressed using eliminators first.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class UnliftableNode extends OrnamentError {
		public static final long serialVersionUID = 1l;

		public UnliftableNode(String msg, Object element) {
			super(msg, element);
		}
	}
}

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
 * This exception is thrown when a syntax error occurs whilst reading
 * declarations, definitions or terms.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {
	public static final long serialVersionUID = 1l;

	private final String msg;
	private final String filename;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in a source.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param filename
	 *            The source this error is referring to (may be
	 *            <code>null</code>).
	 * @param start
	 *            Index of first character of offending location.
	 * @param end
	 *            Index of last character of offending location.
	 */
	public SyntaxError(String msg, String filename, int start, int end) {
		this.msg = msg;
		this.filename = filename;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		String m = msg == null ? "" : msg;
		if (filename != null) {
			return filename + ":" + start + ": " + m;
		} else {
			return m + " (at " + start + ")";
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	public String filename() {
		return filename;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}
}

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

import featherweightornaments.core.Packing;
import featherweightornaments.core.Syntax.Term;
import featherweightornaments.core.Terms;
import featherweightornaments.core.TypeDeclaration;

/**
 * Describes a discovered correspondence between a type <code>A</code> and its
 * new representation. This is either an <em>algebraic</em> correspondence,
 * where a declaration <code>B</code> inserts one new index into
 * <code>A</code>, or a <em>curried record</em>, where the fields of a record
 * <code>A</code> are regrouped into nested pairs.
 *
 * The indexer, promote and forget functions are closed terms, and are
 * normally references to globals defined when the correspondence was found.
 *
 * @author David J. Pearce
 *
 */
public class CorrespondenceDescriptor {
	public enum Kind {
		ALGEBRAIC, CURRY_RECORD
	}

	private final Kind kind;
	private final TypeDeclaration before;
	private final String target;
	private final IndexDescriptor index;
	private final Term[] fields;
	private final Term indexer;
	private final Term promote;
	private final Term forget;

	private CorrespondenceDescriptor(Kind kind, TypeDeclaration before, String target, IndexDescriptor index,
			Term[] fields, Term indexer, Term promote, Term forget) {
		this.kind = kind;
		this.before = before;
		this.target = target;
		this.index = index;
		this.fields = fields;
		this.indexer = indexer;
		this.promote = promote;
		this.forget = forget;
	}

	public static CorrespondenceDescriptor algebraic(IndexDescriptor index, Term indexer, Term promote,
			Term forget) {
		return new CorrespondenceDescriptor(Kind.ALGEBRAIC, index.before(), index.after().name(), index, null,
				indexer, promote, forget);
	}

	/**
	 * Construct the correspondence between a record and its curried form.
	 *
	 * @param record
	 * @param target  The name of the definition giving the curried form.
	 * @param fields
	 * @param promote
	 * @param forget
	 * @return
	 */
	public static CorrespondenceDescriptor curryRecord(TypeDeclaration record, String target, Term[] fields,
			Term promote, Term forget) {
		return new CorrespondenceDescriptor(Kind.CURRY_RECORD, record, target, null, fields, null, promote, forget);
	}

	public Kind kind() {
		return kind;
	}

	public boolean isAlgebraic() {
		return kind == Kind.ALGEBRAIC;
	}

	/**
	 * Get the declaration being transported from.
	 *
	 * @return
	 */
	public TypeDeclaration before() {
		return before;
	}

	/**
	 * Get the name of the type being transported to. For a curried record this
	 * names the definition of the nested pairs.
	 *
	 * @return
	 */
	public String target() {
		return target;
	}

	/**
	 * Get a key identifying this correspondence, for use in registries.
	 *
	 * @return
	 */
	public String key() {
		return before.name() + "->" + target;
	}

	/**
	 * Get the declaration being transported to, or <code>null</code> for a
	 * curried record.
	 *
	 * @return
	 */
	public TypeDeclaration after() {
		return index == null ? null : index.after();
	}

	/**
	 * Get the description of the new index, or <code>null</code> for a curried
	 * record.
	 *
	 * @return
	 */
	public IndexDescriptor index() {
		return index;
	}

	/**
	 * Get the field types of a curried record (in the context of the record's
	 * parameters), or <code>null</code> for an algebraic correspondence.
	 *
	 * @return
	 */
	public Term[] fields() {
		return fields;
	}

	/**
	 * Get the indexer, or <code>null</code> for a curried record.
	 *
	 * @return
	 */
	public Term indexer() {
		return indexer;
	}

	public Term promote() {
		return promote;
	}

	public Term forget() {
		return forget;
	}

	@Override
	public String toString() {
		if (isAlgebraic()) {
			return "algebraic " + index;
		}
		return "curry " + key();
	}
}

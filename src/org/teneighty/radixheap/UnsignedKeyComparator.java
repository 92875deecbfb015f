/*
 * $Id$
 *
 * Copyright (c) 2005-2009 Fran Lattanzio
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.teneighty.radixheap;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Orders monotone heap entries by their keys, treating the keys as unsigned.
 * Values are ignored, so entries with equal keys compare as equal.
 *
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class UnsignedKeyComparator<TValue>
	extends Object
	implements Comparator<MonotoneHeap.Entry<TValue>>, Serializable
{

	/**
	 * Serial version.
	 */
	private static final long serialVersionUID = 4583458L;

	/**
	 * Constructor.
	 */
	public UnsignedKeyComparator()
	{
		super();
	}

	/**
	 * Compare two entries.
	 *
	 * @param e1 the first entry.
	 * @param e2 the second entry.
	 * @return like you'd expect from a
	 *         {@link java.util.Comparator#compare(Object, Object)} call.
	 * @throws NullPointerException If <code>e1</code> or <code>e2</code> are
	 *             <code>null</code>.
	 */
	public int compare(final MonotoneHeap.Entry<TValue> e1,
			final MonotoneHeap.Entry<TValue> e2)
		throws NullPointerException
	{
		if (e1 == null || e2 == null)
		{
			throw new NullPointerException();
		}

		return Integer.compareUnsigned(e1.getKey(), e2.getKey());
	}

	/**
	 * Check the specified object for equality.
	 * <p>
	 * We return <code>true</code> if other has the same type as this object and
	 * <code>false</code> otherwise, since this class is stateless.
	 *
	 * @param other the other object.
	 * @return <code>true</code> if <code>other</code> is of the same class as
	 *         this object; <code>false</code> otherwise.
	 */
	@Override
	public boolean equals(final Object other)
	{
		if (other == null)
		{
			return false;
		}

		if (this == other)
		{
			return true;
		}

		return this.getClass().equals(other.getClass());
	}

	/**
	 * Get the hashcode inline with equals.
	 *
	 * @return the hashcode.
	 */
	@Override
	public int hashCode()
	{
		return 1;
	}

	/**
	 * Get a (better) string representation of this object.
	 *
	 * @return the class name, actually.
	 */
	@Override
	public String toString()
	{
		return this.getClass().getName();
	}

}

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

/**
 * A lame little helper class: An append-only (well, mostly) array list which,
 * unlike <code>ArrayList</code>, will tell you its capacity.
 * <p>
 * The capacity is never reduced by removals or by {@link #clear()}. It only
 * grows, by doubling, when an append finds the backing array full.
 *
 * @param <TElement> the element type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
final class DynamicArray<TElement>
	extends Object
{

	/**
	 * The capacity used when growing from an empty backing array ({@value} ).
	 */
	private static final int MINIMUM_GROWTH = 4;

	/**
	 * Backing array of schmutz.
	 */
	private Object[] data;

	/**
	 * Number of slots actually in use.
	 */
	private int size;

	/**
	 * Constructor.
	 *
	 * @param cap the capacity.
	 * @throws IllegalArgumentException If <code>cap</code> &lt; 0.
	 */
	DynamicArray(final int cap)
			throws IllegalArgumentException
	{
		super();

		if (cap < 0)
		{
			throw new IllegalArgumentException("Invalid capacity: " + cap);
		}

		// Create data array
		this.data = new Object[cap];
		this.size = 0;
	}

	/**
	 * Get the number of elements.
	 *
	 * @return the size.
	 */
	int size()
	{
		return this.size;
	}

	/**
	 * Get the capacity of this array.
	 *
	 * @return the capacity.
	 */
	int capacity()
	{
		return this.data.length;
	}

	/**
	 * Is this array empty?
	 *
	 * @return <code>true</code> if empty.
	 */
	boolean isEmpty()
	{
		return (this.size == 0);
	}

	/**
	 * Append the specified element.
	 *
	 * @param val the element.
	 */
	void add(final TElement val)
	{
		if (this.size == this.data.length)
		{
			int new_capacity = (this.data.length == 0) ? MINIMUM_GROWTH
					: this.data.length * 2;

			// Re-alloc all the crap.
			Object[] new_data = new Object[new_capacity];
			System.arraycopy(this.data, 0, new_data, 0, this.size);
			this.data = new_data;
		}

		this.data[this.size++] = val;
	}

	/**
	 * Get the element at the specified index.
	 *
	 * @param index the index to get.
	 * @return the element at <code>index</code>.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	@SuppressWarnings("unchecked")
	TElement get(final int index)
		throws IndexOutOfBoundsException
	{
		this.checkIndex(index);
		return (TElement) this.data[index];
	}

	/**
	 * Remove the element at the specified index, shifting everything after it
	 * one slot to the left.
	 *
	 * @param index the index to remove.
	 * @return the removed element.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	@SuppressWarnings("unchecked")
	TElement remove(final int index)
		throws IndexOutOfBoundsException
	{
		this.checkIndex(index);

		TElement old = (TElement) this.data[index];
		int moved = this.size - index - 1;
		if (moved > 0)
		{
			System.arraycopy(this.data, index + 1, this.data, index, moved);
		}

		// Clear stale ref.
		this.data[--this.size] = null;
		return old;
	}

	/**
	 * Clear this object.
	 * <p>
	 * Nulls out the used slots; the backing array (and thus the capacity) is
	 * kept.
	 */
	void clear()
	{
		for (int index = 0; index < this.size; index++)
		{
			this.data[index] = null;
		}

		this.size = 0;
	}

	/**
	 * Bounds check.
	 *
	 * @param index the index to check.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	private void checkIndex(final int index)
		throws IndexOutOfBoundsException
	{
		if (index < 0 || index >= this.size)
		{
			throw new IndexOutOfBoundsException(String.format(
					"Index: %1$d, size: %2$d", index, this.size));
		}
	}

}

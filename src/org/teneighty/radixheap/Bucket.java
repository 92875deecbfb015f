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

import java.util.ArrayList;
import java.util.List;

/**
 * A radix heap bucket: An unordered bag of the entries that currently share a
 * distance class, plus a cached reference to the bag's minimum entry.
 * <p>
 * The cached minimum is the entry with the smallest key; among entries with
 * equal keys, the one inserted first wins. A later entry with an equal key
 * never displaces it.
 * <p>
 * Instances of this class are owned by exactly one {@link RadixHeap}, which
 * guarantees that {@link #extractMinimum()} is never called on an empty
 * bucket.
 *
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
final class Bucket<TValue>
	extends Object
{

	/**
	 * The distance class (index in the owning heap) of this bucket.
	 */
	private final int distance_class;

	/**
	 * The entries, in insertion order.
	 */
	private final DynamicArray<MonotoneHeap.Entry<TValue>> entries;

	/**
	 * The minimum entry, or <code>null</code> if empty.
	 */
	private MonotoneHeap.Entry<TValue> minimum;

	/**
	 * Constructor.
	 *
	 * @param distance_class the distance class.
	 * @param capacity the initial capacity.
	 * @throws IllegalArgumentException If <code>capacity</code> &lt; 0.
	 */
	Bucket(final int distance_class, final int capacity)
			throws IllegalArgumentException
	{
		super();

		this.distance_class = distance_class;
		this.entries = new DynamicArray<MonotoneHeap.Entry<TValue>>(capacity);
		this.minimum = null;
	}

	/**
	 * Get the distance class.
	 *
	 * @return the distance class.
	 */
	int getDistanceClass()
	{
		return this.distance_class;
	}

	/**
	 * Get the number of entries.
	 *
	 * @return the size.
	 */
	int getSize()
	{
		return this.entries.size();
	}

	/**
	 * Get the capacity of the backing storage.
	 *
	 * @return the capacity.
	 */
	int getCapacity()
	{
		return this.entries.capacity();
	}

	/**
	 * Is this bucket empty?
	 *
	 * @return <code>true</code> if empty.
	 */
	boolean isEmpty()
	{
		return this.entries.isEmpty();
	}

	/**
	 * Get the cached minimum entry.
	 *
	 * @return the minimum, or <code>null</code> if this bucket is empty.
	 */
	MonotoneHeap.Entry<TValue> getMinimum()
	{
		return this.minimum;
	}

	/**
	 * Get the entry at the specified position (insertion order).
	 *
	 * @param index the position.
	 * @return the entry.
	 * @throws IndexOutOfBoundsException If <code>index</code> is out of
	 *             bounds.
	 */
	MonotoneHeap.Entry<TValue> get(final int index)
		throws IndexOutOfBoundsException
	{
		return this.entries.get(index);
	}

	/**
	 * Append an entry, updating the cached minimum if the new entry's key is
	 * strictly smaller.
	 *
	 * @param entry the entry.
	 */
	void insert(final MonotoneHeap.Entry<TValue> entry)
	{
		this.entries.add(entry);

		if (this.minimum == null
				|| Integer.compareUnsigned(entry.getKey(), this.minimum.getKey()) < 0)
		{
			this.minimum = entry;
		}
	}

	/**
	 * Remove and return the minimum entry.
	 * <p>
	 * Takes time linear in the size of this bucket, since the new minimum has
	 * to be found by a full scan.
	 *
	 * @return the old minimum.
	 */
	MonotoneHeap.Entry<TValue> extractMinimum()
	{
		assert (this.isEmpty() == false) : "Extract from empty bucket "
				+ this.distance_class;

		MonotoneHeap.Entry<TValue> min = this.minimum;

		// First equal entry goes, which is the minimum itself.
		this.entries.remove(this.indexOf(min));

		// Rescan.
		this.minimum = null;
		MonotoneHeap.Entry<TValue> entry;
		for (int index = 0; index < this.entries.size(); index++)
		{
			entry = this.entries.get(index);
			if (this.minimum == null
					|| Integer.compareUnsigned(entry.getKey(), this.minimum
							.getKey()) < 0)
			{
				this.minimum = entry;
			}
		}

		return min;
	}

	/**
	 * Move every entry out of this bucket and into a new list, in insertion
	 * order. This bucket is empty afterwards.
	 *
	 * @return the entries.
	 */
	List<MonotoneHeap.Entry<TValue>> drain()
	{
		List<MonotoneHeap.Entry<TValue>> scratch = new ArrayList<MonotoneHeap.Entry<TValue>>(
				this.entries.size());

		for (int index = 0; index < this.entries.size(); index++)
		{
			scratch.add(this.entries.get(index));
		}

		this.clear();
		return scratch;
	}

	/**
	 * Clear this bucket. The capacity is kept.
	 */
	void clear()
	{
		this.entries.clear();
		this.minimum = null;
	}

	/**
	 * Create a copy of this bucket, with the same capacity, entries and
	 * minimum. Entries are immutable, so they are shared.
	 *
	 * @return the copy.
	 */
	Bucket<TValue> copy()
	{
		Bucket<TValue> copy = new Bucket<TValue>(this.distance_class, this
				.getCapacity());

		for (int index = 0; index < this.entries.size(); index++)
		{
			copy.entries.add(this.entries.get(index));
		}

		copy.minimum = this.minimum;
		return copy;
	}

	/**
	 * Find the position of the first entry equal to the specified entry.
	 *
	 * @param entry the entry to look for.
	 * @return the position.
	 * @throws IllegalStateException If no such entry exists.
	 */
	private int indexOf(final MonotoneHeap.Entry<TValue> entry)
		throws IllegalStateException
	{
		for (int index = 0; index < this.entries.size(); index++)
		{
			if (entry.equals(this.entries.get(index)))
			{
				return index;
			}
		}

		throw new IllegalStateException("Cached minimum not in bucket "
				+ this.distance_class);
	}

}

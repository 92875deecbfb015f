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

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A monotone heap: A priority queue whose keys are unsigned 32-bit integers
 * and from which entries are extracted in non-decreasing key order.
 * <p>
 * Unlike a general heap, a monotone heap remembers the key of the most
 * recently extracted entry, and refuses to accept any key smaller than it.
 * This restriction is what permits implementations like the
 * {@link RadixHeap} to beat the comparison based heaps on workloads like
 * Dijkstra's algorithm, where keys only ever grow.
 * <p>
 * Keys are Java <code>int</code>s, but are always interpreted as
 * <i>unsigned</i>. Thus, <code>-1</code> is the largest possible key, not the
 * smallest. Use {@link Integer#toUnsignedLong(int)} or
 * {@link Entry#getUnsignedKey()} if you need the numeric value.
 * <p>
 * Implementations are not required to be synchronized.
 *
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public interface MonotoneHeap<TValue>
	extends Iterable<MonotoneHeap.Entry<TValue>>
{

	/**
	 * Add a key/value pair to this heap.
	 *
	 * @param key the key, interpreted as unsigned.
	 * @param value the value; may be <code>null</code>.
	 * @return the entry created.
	 * @throws InvalidKeyException If <code>key</code> is smaller than the last
	 *             extracted key. The heap is left untouched.
	 */
	public Entry<TValue> insert(int key, TValue value)
		throws InvalidKeyException;

	/**
	 * Get the entry with the minimum key.
	 * <p>
	 * This method does <u>not</u> remove the returned entry.
	 *
	 * @return the entry.
	 * @throws NoSuchElementException If this heap is empty.
	 * @see #peekMinimum()
	 */
	public Entry<TValue> getMinimum()
		throws NoSuchElementException;

	/**
	 * Get the entry with the minimum key, or <code>null</code> if this heap is
	 * empty.
	 *
	 * @return the entry or <code>null</code>.
	 * @see #getMinimum()
	 */
	public Entry<TValue> peekMinimum();

	/**
	 * Remove and return the entry with the minimum key.
	 *
	 * @return the entry.
	 * @throws NoSuchElementException If this heap is empty.
	 * @see #pollMinimum()
	 */
	public Entry<TValue> extractMinimum()
		throws NoSuchElementException;

	/**
	 * Remove and return the entry with the minimum key, or return
	 * <code>null</code> if this heap is empty.
	 *
	 * @return the entry or <code>null</code>.
	 * @see #extractMinimum()
	 */
	public Entry<TValue> pollMinimum();

	/**
	 * Get the key of the most recently extracted entry.
	 * <p>
	 * No key smaller than this one may be inserted. A heap from which nothing
	 * was ever extracted returns <code>0</code>.
	 *
	 * @return the last extracted key, as an unsigned int.
	 */
	public int getLastExtractedKey();

	/**
	 * Get the number of entries in this heap.
	 *
	 * @return the size.
	 */
	public int getSize();

	/**
	 * Is this heap empty?
	 *
	 * @return <code>true</code> if this heap is empty.
	 * @see #getSize()
	 */
	public boolean isEmpty();

	/**
	 * Remove every entry from this heap.
	 * <p>
	 * The last extracted key survives a clear: Keys smaller than it are still
	 * refused afterwards.
	 */
	public void clear();

	/**
	 * Get a snapshot of all entries.
	 * <p>
	 * The order of the returned list is implementation specific and is
	 * <u>not</u> necessarily sorted by key.
	 *
	 * @return a new list of the entries.
	 */
	public List<Entry<TValue>> getEntries();

	/**
	 * Get a snapshot of all entries, sorted by (unsigned) key.
	 *
	 * @return a new sorted list of the entries.
	 */
	public List<Entry<TValue>> getSortedEntries();

	/**
	 * Get the keys of this heap, in the order of {@link #getSortedEntries()}.
	 *
	 * @return a new list of the keys.
	 */
	public List<Integer> getKeys();

	/**
	 * Get the values of this heap, in the order of
	 * {@link #getSortedEntries()}.
	 *
	 * @return a new list of the values.
	 */
	public List<TValue> getValues();

	/**
	 * Get an iterator over the entries of this heap, in the same order as
	 * {@link #getEntries()}.
	 *
	 * @return an iterator.
	 */
	public Iterator<Entry<TValue>> iterator();

	/**
	 * A monotone heap entry. Entries are immutable.
	 *
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	public static interface Entry<TValue>
	{

		/**
		 * Get the key.
		 *
		 * @return the key, as an unsigned int.
		 */
		public int getKey();

		/**
		 * Get the key, widened to its unsigned numeric value.
		 *
		 * @return the key in the range <code>[0, 2^32)</code>.
		 */
		public long getUnsignedKey();

		/**
		 * Get the value.
		 *
		 * @return the value.
		 */
		public TValue getValue();

	}

}

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
 * This class contains static methods which operate on monotone heaps. The
 * methods will operate on any monotone heap implementation, and return
 * decorators around the specified heap.
 * <p>
 * This is a stateless class that cannot be instantiated.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see org.teneighty.radixheap.MonotoneHeap
 */
public final class MonotoneHeaps
	extends Object
{

	/**
	 * Create and return an unmodifiable heap view, backed by the specified
	 * heap.
	 * <p>
	 * Changes to the backing heap show through the view. In order to
	 * guarantee unmodifiability, it is critical that <strong>all</strong>
	 * access to the backing heap is accomplished through the returned heap.
	 *
	 * @param <TValue> the value type.
	 * @param heap the heap to make unmodifiable.
	 * @return an unmodifiable view of the specified heap.
	 * @throws NullPointerException if <code>heap</code> is <code>null</code>.
	 */
	public static <TValue> MonotoneHeap<TValue> unmodifiableHeap(
			final MonotoneHeap<TValue> heap)
		throws NullPointerException
	{
		if (heap == null)
		{
			throw new NullPointerException();
		}

		return new UnmodifiableHeap<TValue>(heap);
	}

	/**
	 * Unmodifiable heap decorator.
	 * <p>
	 * The entries are immutable themselves, so they are handed out as is.
	 *
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class UnmodifiableHeap<TValue>
		extends Object
		implements MonotoneHeap<TValue>
	{

		/**
		 * The backing heap.
		 */
		private final MonotoneHeap<TValue> heap;

		/**
		 * Constructor.
		 *
		 * @param heap the backing heap.
		 */
		UnmodifiableHeap(final MonotoneHeap<TValue> heap)
		{
			super();

			// Store heap.
			this.heap = heap;
		}

		/**
		 * Add a mapping to this heap.
		 *
		 * @param key the key.
		 * @param value the value.
		 * @return never.
		 * @throws UnsupportedOperationException Always.
		 */
		public Entry<TValue> insert(final int key, final TValue value)
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

		/**
		 * Get the entry with the minimum key.
		 *
		 * @return the entry.
		 * @throws NoSuchElementException If this heap is empty.
		 */
		public Entry<TValue> getMinimum()
			throws NoSuchElementException
		{
			return this.heap.getMinimum();
		}

		/**
		 * Get the entry with the minimum key, or <code>null</code>.
		 *
		 * @return the entry or <code>null</code>.
		 */
		public Entry<TValue> peekMinimum()
		{
			return this.heap.peekMinimum();
		}

		/**
		 * Remove and return the entry with the minimum key.
		 *
		 * @return never.
		 * @throws UnsupportedOperationException Always.
		 */
		public Entry<TValue> extractMinimum()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

		/**
		 * Remove and return the entry with the minimum key.
		 *
		 * @return never.
		 * @throws UnsupportedOperationException Always.
		 */
		public Entry<TValue> pollMinimum()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

		/**
		 * Get the last extracted key.
		 *
		 * @return the last key.
		 */
		public int getLastExtractedKey()
		{
			return this.heap.getLastExtractedKey();
		}

		/**
		 * Get the number of entries in this heap.
		 *
		 * @return the size.
		 */
		public int getSize()
		{
			return this.heap.getSize();
		}

		/**
		 * Is this heap empty?
		 *
		 * @return true if this heap is empty.
		 */
		public boolean isEmpty()
		{
			return this.heap.isEmpty();
		}

		/**
		 * Clear this heap.
		 *
		 * @throws UnsupportedOperationException Always.
		 */
		public void clear()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

		/**
		 * Get a snapshot of the entries.
		 *
		 * @return the entries.
		 */
		public List<Entry<TValue>> getEntries()
		{
			return this.heap.getEntries();
		}

		/**
		 * Get a sorted snapshot of the entries.
		 *
		 * @return the entries.
		 */
		public List<Entry<TValue>> getSortedEntries()
		{
			return this.heap.getSortedEntries();
		}

		/**
		 * Get the keys.
		 *
		 * @return the keys.
		 */
		public List<Integer> getKeys()
		{
			return this.heap.getKeys();
		}

		/**
		 * Get the values.
		 *
		 * @return the values.
		 */
		public List<TValue> getValues()
		{
			return this.heap.getValues();
		}

		/**
		 * Get an iterator over the entries in this heap.
		 *
		 * @return an iterator over the entries.
		 */
		public Iterator<Entry<TValue>> iterator()
		{
			return new ImmutableEntryIterator<TValue>(this.heap.iterator());
		}

		/**
		 * Get a string representation of this object.
		 *
		 * @return a string representation.
		 */
		@Override
		public String toString()
		{
			return this.heap.toString();
		}

	}

	/**
	 * An iterator decorator that doesn't support the remove method.
	 *
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class ImmutableEntryIterator<TValue>
		extends Object
		implements Iterator<MonotoneHeap.Entry<TValue>>
	{

		/**
		 * The backing iterator.
		 */
		private final Iterator<MonotoneHeap.Entry<TValue>> backingIterator;

		/**
		 * Constructor.
		 *
		 * @param iterator the iterator to use to back this iterator.
		 */
		ImmutableEntryIterator(final Iterator<MonotoneHeap.Entry<TValue>> iterator)
		{
			super();

			this.backingIterator = iterator;
		}

		/**
		 * Check if this iterator has a next element.
		 *
		 * @return <code>true</code> if there's another entry;
		 *         <code>false</code> otherwise.
		 */
		public boolean hasNext()
		{
			return this.backingIterator.hasNext();
		}

		/**
		 * Get the next entry.
		 *
		 * @return the next entry.
		 * @throws NoSuchElementException If there are no elements left.
		 */
		public MonotoneHeap.Entry<TValue> next()
			throws NoSuchElementException
		{
			return this.backingIterator.next();
		}

		/**
		 * Remove the most recently iterated entry.
		 *
		 * @throws UnsupportedOperationException Always.
		 */
		public void remove()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

	}

	/**
	 * Constructor. Instances of this class are not allowed, so don't bother
	 * trying.
	 *
	 * @throws InternalError Always.
	 */
	private MonotoneHeaps()
			throws InternalError
	{
		throw new InternalError("Instances are not allowed");
	}

}

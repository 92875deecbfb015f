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
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * A radix heap implementation. A radix heap is a monotone priority queue: Keys
 * are unsigned 32-bit integers, and no key smaller than the most recently
 * extracted one (the <i>last key</i>) may be inserted.
 * <p>
 * The heap is an array of 33 buckets. An entry with key <code>k</code> lives
 * in bucket <code>0</code> if <code>k</code> equals the last key, and in
 * bucket <code>32 - nlz(k ^ last)</code> otherwise; that is, in the bucket
 * numbered by the (1-based) position of the highest bit in which it differs
 * from the last key. Every entry in a lower bucket is smaller than every entry
 * in a higher one, so the minimum is always the cached minimum of the first
 * non-empty bucket.
 * <p>
 * The structure is maintained across inserts and extract-mins as follows:
 * <ul>
 * <li>For inserts, the entry is simply appended to its bucket. This takes
 * constant (amortized) time.</li>
 * <li>For extract-min, the minimum of the first non-empty bucket is removed
 * and becomes the new last key. If that bucket was bucket <code>0</code>,
 * nothing else happens. Otherwise, all remaining entries of the bucket are
 * drained into a scratch list, the bucket is replaced by a fresh one, and the
 * drained entries are re-inserted against the new last key. Every one of them
 * lands in a strictly lower bucket, so each entry is moved at most 32 times
 * over its lifetime, which gives an amortized extraction cost logarithmic in
 * the largest key.</li>
 * </ul>
 * <p>
 * The collection-view methods of this class return snapshots; the iterator is
 * <i>fail-fast</i>: If the heap is structurally modified at any time after the
 * iterator is created, the iterator throws a
 * {@link ConcurrentModificationException}. The iterator does not support
 * <code>remove</code>.
 * <p>
 * This class is not synchronized (by choice). You must ensure sequential access
 * externally, or you may damage instances of this class.
 * <p>
 * This class implements the {@link java.lang.Cloneable} interface.
 *
 * @param <TValue> the value type.
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 */
public class RadixHeap<TValue>
	extends Object
	implements MonotoneHeap<TValue>, Cloneable
{

	/**
	 * The number of buckets ({@value} ): One per bit of key, plus one for keys
	 * equal to the last key.
	 */
	public static final int BUCKET_COUNT = Integer.SIZE + 1;

	/**
	 * The default capacity of each bucket ({@value} ).
	 */
	public static final int DEFAULT_BUCKET_CAPACITY = 0;

	/**
	 * The buckets, indexed by distance class.
	 */
	private Bucket<TValue>[] buckets;

	/**
	 * The key of the most recently extracted entry.
	 */
	private int last_key;

	/**
	 * The size of this heap.
	 */
	private int size;

	/**
	 * The mod count.
	 */
	private int mod_count;

	/**
	 * Constructor.
	 * <p>
	 * The buckets start out with no capacity at all.
	 */
	public RadixHeap()
	{
		this(DEFAULT_BUCKET_CAPACITY);
	}

	/**
	 * Constructor.
	 * <p>
	 * Every one of the buckets gets the specified initial capacity; it is not
	 * divided among them. Thus, the capacity of a new heap is
	 * <code>33 * initial_capacity</code>.
	 *
	 * @param initial_capacity the initial capacity of each bucket.
	 * @throws IllegalArgumentException If <code>initial_capacity</code> &lt; 0.
	 */
	@SuppressWarnings("unchecked")
	public RadixHeap(final int initial_capacity)
			throws IllegalArgumentException
	{
		super();

		if (initial_capacity < 0)
		{
			throw new IllegalArgumentException("Invalid initial capacity");
		}

		this.buckets = (Bucket<TValue>[]) new Bucket<?>[BUCKET_COUNT];
		for (int index = 0; index < BUCKET_COUNT; index++)
		{
			this.buckets[index] = new Bucket<TValue>(index, initial_capacity);
		}

		this.last_key = 0;
		this.size = 0;
		this.mod_count = 0;
	}

	/**
	 * Get the distance class of the specified key relative to the specified
	 * last key.
	 *
	 * @param key the key.
	 * @param last_key the last extracted key.
	 * @return the distance class, in <code>[0, 32]</code>.
	 */
	static int distanceClass(final int key, final int last_key)
	{
		return Integer.SIZE - Integer.numberOfLeadingZeros(key ^ last_key);
	}

	/**
	 * Get the size.
	 *
	 * @return the size.
	 */
	public int getSize()
	{
		return this.size;
	}

	/**
	 * Is this heap empty?
	 *
	 * @return <code>true</code> if this heap is empty.
	 */
	public boolean isEmpty()
	{
		return (this.size == 0);
	}

	/**
	 * Get the key of the most recently extracted entry.
	 *
	 * @return the last key, as an unsigned int.
	 */
	public int getLastExtractedKey()
	{
		return this.last_key;
	}

	/**
	 * Get the capacity of this heap, which is the sum of the capacities of all
	 * buckets.
	 * <p>
	 * This method is not specified by the <code>MonotoneHeap</code> interface,
	 * and is mostly useful for diagnostics.
	 *
	 * @return the capacity.
	 */
	public int getCapacity()
	{
		int capacity = 0;
		for (int index = 0; index < BUCKET_COUNT; index++)
		{
			capacity += this.buckets[index].getCapacity();
		}

		return capacity;
	}

	/**
	 * Get the number of entries in the bucket for the specified distance
	 * class.
	 * <p>
	 * This method is not specified by the <code>MonotoneHeap</code> interface.
	 *
	 * @param distance_class the distance class.
	 * @return the number of entries in that bucket.
	 * @throws IndexOutOfBoundsException If <code>distance_class</code> is not
	 *             in <code>[0, 32]</code>.
	 */
	public int getBucketSize(final int distance_class)
		throws IndexOutOfBoundsException
	{
		if (distance_class < 0 || distance_class >= BUCKET_COUNT)
		{
			throw new IndexOutOfBoundsException("Invalid distance class: "
					+ distance_class);
		}

		return this.buckets[distance_class].getSize();
	}

	/**
	 * Clear this heap.
	 * <p>
	 * The last key is <u>not</u> reset, and the buckets keep their capacity.
	 */
	public void clear()
	{
		for (int index = 0; index < BUCKET_COUNT; index++)
		{
			this.buckets[index].clear();
		}

		this.size = 0;
		this.mod_count += 1;
	}

	/**
	 * Add a key/value pair to this heap.
	 *
	 * @param key the key, interpreted as unsigned.
	 * @param value the value.
	 * @return the entry created.
	 * @throws InvalidKeyException If <code>key</code> is smaller than the last
	 *             extracted key.
	 */
	public MonotoneHeap.Entry<TValue> insert(final int key, final TValue value)
		throws InvalidKeyException
	{
		if (Integer.compareUnsigned(key, this.last_key) < 0)
		{
			throw new InvalidKeyException(key, this.last_key);
		}

		RadixHeapEntry<TValue> entry = new RadixHeapEntry<TValue>(key, value);
		this.place(entry);

		this.size += 1;
		this.mod_count += 1;

		return entry;
	}

	/**
	 * Get the entry with the minimum key.
	 * <p>
	 * This method does <u>not</u> remove the returned entry.
	 *
	 * @return the entry.
	 * @throws NoSuchElementException If this heap is empty.
	 * @see #extractMinimum()
	 */
	public MonotoneHeap.Entry<TValue> getMinimum()
		throws NoSuchElementException
	{
		if (this.isEmpty())
		{
			throw new NoSuchElementException();
		}

		return this.peekMinimum();
	}

	/**
	 * Get the entry with the minimum key, without touching anything.
	 *
	 * @return the entry, or <code>null</code> if this heap is empty.
	 */
	public MonotoneHeap.Entry<TValue> peekMinimum()
	{
		if (this.isEmpty())
		{
			return null;
		}

		return this.buckets[this.firstOccupied()].getMinimum();
	}

	/**
	 * Remove and return the entry minimum key.
	 *
	 * @return the entry.
	 * @throws NoSuchElementException If the heap is empty.
	 * @see #getMinimum()
	 */
	public MonotoneHeap.Entry<TValue> extractMinimum()
		throws NoSuchElementException
	{
		if (this.isEmpty())
		{
			throw new NoSuchElementException();
		}

		return this.pollMinimum();
	}

	/**
	 * Remove and return the entry minimum key.
	 *
	 * @return the entry, or <code>null</code> if this heap is empty.
	 */
	public MonotoneHeap.Entry<TValue> pollMinimum()
	{
		if (this.isEmpty())
		{
			return null;
		}

		int index = this.firstOccupied();
		Bucket<TValue> bucket = this.buckets[index];
		MonotoneHeap.Entry<TValue> min = bucket.extractMinimum();

		if (index != 0)
		{
			// The only place the last key moves.
			this.last_key = min.getKey();

			if (bucket.isEmpty() == false)
			{
				this.redistribute(index);
			}
		}

		this.size -= 1;
		this.mod_count += 1;

		return min;
	}

	/**
	 * Move every entry of the specified bucket to the bucket it belongs in
	 * relative to the (new) last key.
	 *
	 * @param index the bucket index.
	 */
	private void redistribute(final int index)
	{
		List<MonotoneHeap.Entry<TValue>> scratch = this.buckets[index].drain();
		this.buckets[index] = new Bucket<TValue>(index, 0);

		for (MonotoneHeap.Entry<TValue> entry : scratch)
		{
			assert (distanceClass(entry.getKey(), this.last_key) < index);
			this.place(entry);
		}
	}

	/**
	 * Put the entry into its bucket. Does not touch the size.
	 *
	 * @param entry the entry.
	 */
	private void place(final MonotoneHeap.Entry<TValue> entry)
	{
		this.buckets[distanceClass(entry.getKey(), this.last_key)]
				.insert(entry);
	}

	/**
	 * Find the first non-empty bucket.
	 * <p>
	 * Must only be called on a non-empty heap.
	 *
	 * @return the index of the bucket.
	 */
	private int firstOccupied()
	{
		for (int index = 0; index < BUCKET_COUNT; index++)
		{
			if (this.buckets[index].isEmpty() == false)
			{
				return index;
			}
		}

		throw new InternalError("Heap of size " + this.size
				+ " has no entries");
	}

	/**
	 * Get a snapshot of all entries, in bucket order.
	 * <p>
	 * The entries of bucket 0 come first, then those of bucket 1, and so on;
	 * within a bucket, entries appear in insertion order. This is <u>not</u>
	 * key order.
	 *
	 * @return a new list of the entries.
	 * @see #getSortedEntries()
	 */
	public List<MonotoneHeap.Entry<TValue>> getEntries()
	{
		List<MonotoneHeap.Entry<TValue>> entries = new ArrayList<MonotoneHeap.Entry<TValue>>(
				this.size);

		Bucket<TValue> bucket;
		for (int index = 0; index < BUCKET_COUNT; index++)
		{
			bucket = this.buckets[index];
			for (int jindex = 0; jindex < bucket.getSize(); jindex++)
			{
				entries.add(bucket.get(jindex));
			}
		}

		return entries;
	}

	/**
	 * Get a snapshot of all entries, sorted by unsigned key.
	 * <p>
	 * The sort is stable, so entries with equal keys stay in bucket order.
	 *
	 * @return a new sorted list of the entries.
	 */
	public List<MonotoneHeap.Entry<TValue>> getSortedEntries()
	{
		List<MonotoneHeap.Entry<TValue>> entries = this.getEntries();
		Collections.sort(entries, new UnsignedKeyComparator<TValue>());
		return entries;
	}

	/**
	 * Get the keys, sorted.
	 *
	 * @return a new list of the keys.
	 */
	public List<Integer> getKeys()
	{
		List<MonotoneHeap.Entry<TValue>> sorted = this.getSortedEntries();
		List<Integer> keys = new ArrayList<Integer>(sorted.size());
		for (MonotoneHeap.Entry<TValue> entry : sorted)
		{
			keys.add(Integer.valueOf(entry.getKey()));
		}

		return keys;
	}

	/**
	 * Get the values, in key order.
	 *
	 * @return a new list of the values.
	 */
	public List<TValue> getValues()
	{
		List<MonotoneHeap.Entry<TValue>> sorted = this.getSortedEntries();
		List<TValue> values = new ArrayList<TValue>(sorted.size());
		for (MonotoneHeap.Entry<TValue> entry : sorted)
		{
			values.add(entry.getValue());
		}

		return values;
	}

	/**
	 * Get an iterator over this heap's entries, in bucket order.
	 *
	 * @return an iterator over the entries.
	 */
	public Iterator<MonotoneHeap.Entry<TValue>> iterator()
	{
		return new EntryIterator();
	}

	/**
	 * Create and return a copy of this heap.
	 * <p>
	 * The copy has its own buckets, so modifying one heap does not affect the
	 * other; the (immutable) entries are shared.
	 *
	 * @return a copy of this heap.
	 */
	@SuppressWarnings("unchecked")
	@Override
	public Object clone()
	{
		try
		{
			RadixHeap<TValue> clone = (RadixHeap<TValue>) super.clone();

			clone.buckets = (Bucket<TValue>[]) new Bucket<?>[BUCKET_COUNT];
			for (int index = 0; index < BUCKET_COUNT; index++)
			{
				clone.buckets[index] = this.buckets[index].copy();
			}

			clone.mod_count = 0;
			return clone;
		}
		catch (final CloneNotSupportedException cnse)
		{
			throw (InternalError) new InternalError(
					"RadixHeap supports the Cloneable interface")
					.initCause(cnse);
		}
	}

	/**
	 * Get a string representation of this heap, in bucket order.
	 *
	 * @return a string.
	 */
	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("RadixHeap(").append(this.size).append("){");

		boolean first = true;
		for (MonotoneHeap.Entry<TValue> entry : this)
		{
			if (first == false)
			{
				sb.append(", ");
			}

			sb.append(entry);
			first = false;
		}

		sb.append("}");
		return sb.toString();
	}

	/**
	 * Radix heap iterator class. Walks the live buckets in order.
	 *
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private final class EntryIterator
		extends Object
		implements Iterator<MonotoneHeap.Entry<TValue>>
	{

		/**
		 * The current bucket.
		 */
		private int bucket_index;

		/**
		 * The position in the current bucket.
		 */
		private int position;

		/**
		 * Iterator mod count.
		 */
		private int it_mod_count;

		/**
		 * Constructor.
		 */
		EntryIterator()
		{
			super();

			this.bucket_index = 0;
			this.position = 0;

			// Copy mod count.
			this.it_mod_count = RadixHeap.this.mod_count;
		}

		/**
		 * Has next.
		 *
		 * @return <code>true</code> if a next entry exists; <code>false</code>
		 *         otherwise.
		 * @throws ConcurrentModificationException If concurrent modification
		 *             occurs.
		 */
		public boolean hasNext()
			throws ConcurrentModificationException
		{
			if (RadixHeap.this.mod_count != this.it_mod_count)
			{
				throw new ConcurrentModificationException();
			}

			// Skip exhausted buckets.
			while (this.bucket_index < BUCKET_COUNT
					&& this.position >= RadixHeap.this.buckets[this.bucket_index]
							.getSize())
			{
				this.bucket_index += 1;
				this.position = 0;
			}

			return (this.bucket_index < BUCKET_COUNT);
		}

		/**
		 * Get the next element and advance.
		 *
		 * @return the next element.
		 * @throws NoSuchElementException If there is no next element.
		 * @throws ConcurrentModificationException If concurrent modification
		 *             occurs.
		 */
		public MonotoneHeap.Entry<TValue> next()
			throws NoSuchElementException, ConcurrentModificationException
		{
			if (this.hasNext() == false)
			{
				throw new NoSuchElementException("The iterator is empty");
			}

			return RadixHeap.this.buckets[this.bucket_index]
					.get(this.position++);
		}

		/**
		 * Not supported.
		 *
		 * @throws UnsupportedOperationException always.
		 */
		public void remove()
			throws UnsupportedOperationException
		{
			throw new UnsupportedOperationException();
		}

	}

	/**
	 * Radix heap entry. Immutable; equality is by key and value.
	 *
	 * @param <TValue> the value type.
	 * @author Fran Lattanzio
	 * @version $Revision$ $Date$
	 */
	private static final class RadixHeapEntry<TValue>
		extends Object
		implements MonotoneHeap.Entry<TValue>
	{

		/**
		 * The key.
		 */
		private final int key;

		/**
		 * The value.
		 */
		private final TValue value;

		/**
		 * Constructor.
		 *
		 * @param key the key.
		 * @param value the value.
		 */
		RadixHeapEntry(final int key, final TValue value)
		{
			super();

			this.key = key;
			this.value = value;
		}

		/**
		 * Get the key.
		 *
		 * @return the key.
		 */
		public int getKey()
		{
			return this.key;
		}

		/**
		 * Get the key as an unsigned number.
		 *
		 * @return the key.
		 */
		public long getUnsignedKey()
		{
			return Integer.toUnsignedLong(this.key);
		}

		/**
		 * Get the value.
		 *
		 * @return the value.
		 */
		public TValue getValue()
		{
			return this.value;
		}

		/**
		 * Compare for equality: Same key and equal values.
		 *
		 * @param other the other object.
		 * @return <code>true</code> if equal; <code>false</code> otherwise.
		 */
		@Override
		public boolean equals(final Object other)
		{
			if (other == null)
			{
				return false;
			}

			if (other == this)
			{
				return true;
			}

			if (other instanceof MonotoneHeap.Entry<?>)
			{
				MonotoneHeap.Entry<?> that = (MonotoneHeap.Entry<?>) other;
				if (this.key != that.getKey())
				{
					return false;
				}

				return (this.value == null) ? that.getValue() == null
						: this.value.equals(that.getValue());
			}

			return false;
		}

		/**
		 * Get a hashcode inline with equals.
		 *
		 * @return the hashcode.
		 */
		@Override
		public int hashCode()
		{
			return (31 * this.key)
					+ ((this.value == null) ? 0 : this.value.hashCode());
		}

		/**
		 * Get a string representation of this entry.
		 *
		 * @return a string.
		 */
		@Override
		public String toString()
		{
			return String.format("%1$s=%2$s", Integer
					.toUnsignedString(this.key), this.value);
		}

	}

}

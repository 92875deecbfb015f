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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

/**
 * Randomized checks against a <code>PriorityQueue</code> of unsigned keys.
 */
public class RadixHeapRandomTest
{

	private static final long MAX_KEY = 0xFFFFFFFFL;

	private Random rng;

	@Before
	public void setup()
	{
		this.rng = new Random(0xcafebabeL);
	}

	@Test
	public void extractAllYieldsSortedKeysAndSameMultiset()
	{
		RadixHeap<Integer> heap = new RadixHeap<Integer>();

		final int count = 20_000;
		long[] keys = new long[count];
		for (int index = 0; index < count; index++)
		{
			keys[index] = this.rng.nextInt() & MAX_KEY;
			heap.insert((int) keys[index], Integer.valueOf(index));
		}

		assertEquals(count, heap.getSize());
		Arrays.sort(keys);

		List<Integer> seen = new ArrayList<Integer>(count);
		for (int index = 0; index < count; index++)
		{
			MonotoneHeap.Entry<Integer> entry = heap.extractMinimum();
			assertEquals(keys[index], entry.getUnsignedKey());
			seen.add(entry.getValue());
		}

		assertTrue(heap.isEmpty());
		Collections.sort(seen);
		for (int index = 0; index < count; index++)
		{
			assertEquals(index, seen.get(index).intValue());
		}
	}

	@Test
	public void interleavedOperationsMatchReference()
	{
		RadixHeap<Long> heap = new RadixHeap<Long>(4);
		PriorityQueue<Long> reference = new PriorityQueue<Long>();

		int inserted = 0;
		int extracted = 0;
		long previous = 0;

		for (int step = 0; step < 50_000; step++)
		{
			long floor = Integer.toUnsignedLong(heap.getLastExtractedKey());
			int choice = this.rng.nextInt(10);

			if (choice < 6 || heap.isEmpty())
			{
				// Mostly small steps above the floor, sometimes huge ones.
				long span = (choice == 0) ? MAX_KEY - floor : Math.min(
						1L << this.rng.nextInt(20), MAX_KEY - floor);
				long key = floor + (long) (this.rng.nextDouble() * (span + 1));
				key = Math.min(key, MAX_KEY);

				heap.insert((int) key, Long.valueOf(key));
				reference.add(Long.valueOf(key));
				inserted += 1;
			}
			else if (choice < 9)
			{
				MonotoneHeap.Entry<Long> peeked = heap.peekMinimum();
				MonotoneHeap.Entry<Long> entry = heap.extractMinimum();
				assertSame(peeked, entry);

				long expected = reference.poll().longValue();
				assertEquals(expected, entry.getUnsignedKey());
				assertEquals(expected, entry.getValue().longValue());
				assertTrue(entry.getUnsignedKey() >= previous);

				previous = entry.getUnsignedKey();
				extracted += 1;
			}
			else if (floor > 0)
			{
				try
				{
					heap.insert((int) (floor - 1), Long.valueOf(floor - 1));
					fail("Expected InvalidKeyException");
				}
				catch (final InvalidKeyException ike)
				{
					assertEquals(floor, Integer.toUnsignedLong(ike.getFloor()));
				}
			}

			assertEquals(inserted - extracted, heap.getSize());
			assertEquals(heap.getSize() == 0, heap.isEmpty());

			if (step % 1000 == 0)
			{
				assertEquals(reference.size(), heap.getEntries().size());
			}
		}
	}

	@Test
	public void dijkstraLikeWorkload()
	{
		RadixHeap<Integer> heap = new RadixHeap<Integer>();
		heap.insert(0, Integer.valueOf(0));

		int settled = 0;
		int last = 0;
		while (heap.isEmpty() == false && settled < 10_000)
		{
			MonotoneHeap.Entry<Integer> entry = heap.extractMinimum();
			assertTrue(Integer.compareUnsigned(last, entry.getKey()) <= 0);
			last = entry.getKey();
			settled += 1;

			// Relax a few edges.
			int fanout = this.rng.nextInt(3);
			for (int edge = 0; edge < fanout; edge++)
			{
				heap.insert(last + 1 + this.rng.nextInt(1000), Integer
						.valueOf(settled));
			}

			if (heap.isEmpty())
			{
				heap.insert(last + this.rng.nextInt(5), Integer.valueOf(-1));
			}
		}

		assertFalse(settled < 10_000);
	}

}

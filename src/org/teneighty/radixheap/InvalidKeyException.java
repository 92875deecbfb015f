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
 * Thrown when a key smaller than the last extracted key is inserted into a
 * monotone heap.
 * <p>
 * The heap is never modified by a rejected insert, so callers may catch this
 * exception and carry on.
 *
 * @author Fran Lattanzio
 * @version $Revision$ $Date$
 * @see MonotoneHeap#insert(int, Object)
 */
public class InvalidKeyException
	extends IllegalArgumentException
{

	/**
	 * Serial version UID.
	 */
	private static final long serialVersionUID = 9238472L;

	/**
	 * The rejected key.
	 */
	private final int key;

	/**
	 * The last extracted key at the time of the insert.
	 */
	private final int floor;

	/**
	 * Constructor.
	 *
	 * @param key the rejected key.
	 * @param floor the last extracted key.
	 */
	public InvalidKeyException(final int key, final int floor)
	{
		super(String.format(
				"Key %1$s is smaller than the last extracted key %2$s",
				Integer.toUnsignedString(key), Integer.toUnsignedString(floor)));

		this.key = key;
		this.floor = floor;
	}

	/**
	 * Get the rejected key.
	 *
	 * @return the key, as an unsigned int.
	 */
	public int getKey()
	{
		return this.key;
	}

	/**
	 * Get the last extracted key of the heap that refused the insert.
	 *
	 * @return the floor, as an unsigned int.
	 */
	public int getFloor()
	{
		return this.floor;
	}

}

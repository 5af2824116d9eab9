/*
 * Copyright 2025 InfParquet.
 *
 * This file is part of InfParquet.
 *
 * InfParquet is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * InfParquet is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with InfParquet.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.infparquet.core.stats;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A fixed-capacity frequency table of the most frequent keys.
 * <p>
 * The slots are kept sorted by count in descending order by insertion, so keys with equal
 * counts stay in the order they were first observed. When the table is full, an absent key
 * only replaces the least frequent slot if its observed weight is strictly greater than the
 * count of that slot. Hence a key that is frequent but arrives after the table is filled with
 * other keys may never be tracked, the result is approximate.
 *
 * @param <T> the key type, must implement equals
 */
public class TopKTracker<T>
{
    private final int capacity;
    private final List<Slot<T>> slots;

    public TopKTracker(int capacity)
    {
        checkArgument(capacity >= 0, "capacity must be non-negative");
        this.capacity = capacity;
        this.slots = new ArrayList<>(capacity);
    }

    /**
     * Observe one occurrence of the key.
     */
    public void observe(T key)
    {
        observe(key, 1L);
    }

    /**
     * Observe the key with the given number of occurrences, counted by the caller.
     *
     * @param key the key, not null
     * @param weight the number of occurrences, must be positive
     */
    public void observe(T key, long weight)
    {
        checkArgument(key != null, "key is null");
        checkArgument(weight > 0, "weight must be positive");
        int index = indexOf(key);
        if (index >= 0)
        {
            slots.get(index).count += weight;
            bubbleUp(index);
            return;
        }
        if (slots.size() < capacity)
        {
            slots.add(new Slot<>(key, weight));
            bubbleUp(slots.size() - 1);
            return;
        }
        if (slots.isEmpty())
        {
            return;
        }
        // the first slot holding the minimum count
        int minIndex = slots.size() - 1;
        long minCount = slots.get(minIndex).count;
        while (minIndex > 0 && slots.get(minIndex - 1).count == minCount)
        {
            minIndex--;
        }
        if (weight > minCount)
        {
            slots.set(minIndex, new Slot<>(key, weight));
            bubbleUp(minIndex);
        }
    }

    /**
     * Observe every entry of the other tracker, in its order, with its count as the weight.
     * The capacity of this tracker is kept.
     */
    public void merge(TopKTracker<T> other)
    {
        for (Slot<T> slot : other.slots)
        {
            observe(slot.key, slot.count);
        }
    }

    /**
     * @return the tracked entries ordered by count in descending order
     */
    public List<Entry<T>> snapshot()
    {
        ImmutableList.Builder<Entry<T>> builder = ImmutableList.builder();
        for (Slot<T> slot : slots)
        {
            builder.add(new Entry<>(slot.key, slot.count));
        }
        return builder.build();
    }

    public TopKTracker<T> copy()
    {
        TopKTracker<T> copy = new TopKTracker<>(capacity);
        for (Slot<T> slot : slots)
        {
            copy.slots.add(new Slot<>(slot.key, slot.count));
        }
        return copy;
    }

    public int getCapacity()
    {
        return capacity;
    }

    public int size()
    {
        return slots.size();
    }

    public boolean isEmpty()
    {
        return slots.isEmpty();
    }

    private int indexOf(T key)
    {
        for (int i = 0; i < slots.size(); ++i)
        {
            if (slots.get(i).key.equals(key))
            {
                return i;
            }
        }
        return -1;
    }

    private void bubbleUp(int index)
    {
        while (index > 0 && slots.get(index).count > slots.get(index - 1).count)
        {
            Slot<T> tmp = slots.get(index - 1);
            slots.set(index - 1, slots.get(index));
            slots.set(index, tmp);
            index--;
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof TopKTracker))
        {
            return false;
        }
        TopKTracker<?> that = (TopKTracker<?>) o;
        return capacity == that.capacity && snapshot().equals(that.snapshot());
    }

    @Override
    public int hashCode()
    {
        return 31 * capacity + snapshot().hashCode();
    }

    @Override
    public String toString()
    {
        return snapshot().toString();
    }

    private static class Slot<T>
    {
        private final T key;
        private long count;

        private Slot(T key, long count)
        {
            this.key = key;
            this.count = count;
        }
    }

    /**
     * An immutable (key, count) pair of a snapshot.
     */
    public static final class Entry<T>
    {
        private final T key;
        private final long count;

        public Entry(T key, long count)
        {
            this.key = key;
            this.count = count;
        }

        public T getKey()
        {
            return key;
        }

        public long getCount()
        {
            return count;
        }

        @Override
        public boolean equals(Object o)
        {
            if (this == o)
            {
                return true;
            }
            if (!(o instanceof Entry))
            {
                return false;
            }
            Entry<?> that = (Entry<?>) o;
            return count == that.count && Objects.equals(key, that.key);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(key, count);
        }

        @Override
        public String toString()
        {
            return "(" + key + ", " + count + ")";
        }
    }
}

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
package io.infparquet.core.custom;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The results of a predicate on a file: one row per row group holding one boolean per column.
 * Rows may have different widths.
 * <p>
 * The text form is a brace per row group inside an outer brace, with cells written as 1 or 0
 * and separated by commas, and no separator between rows, e.g. {{1,0}{0,0}}.
 */
public class ResultMatrix
{
    private final List<boolean[]> rows;

    /**
     * @param rows the rows in row group order, the arrays are copied
     */
    public ResultMatrix(List<boolean[]> rows)
    {
        requireNonNull(rows, "rows is null");
        ImmutableList.Builder<boolean[]> builder = ImmutableList.builder();
        for (boolean[] row : rows)
        {
            builder.add(requireNonNull(row, "row is null").clone());
        }
        this.rows = builder.build();
    }

    public int getRowCount()
    {
        return rows.size();
    }

    public int getColumnCount(int row)
    {
        return rows.get(row).length;
    }

    /**
     * @return the width of the widest row, 0 if there is no row
     */
    public int getMaxColumnCount()
    {
        int max = 0;
        for (boolean[] row : rows)
        {
            max = Math.max(max, row.length);
        }
        return max;
    }

    public boolean get(int row, int column)
    {
        return rows.get(row)[column];
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof ResultMatrix))
        {
            return false;
        }
        ResultMatrix that = (ResultMatrix) o;
        if (rows.size() != that.rows.size())
        {
            return false;
        }
        for (int i = 0; i < rows.size(); ++i)
        {
            if (!Arrays.equals(rows.get(i), that.rows.get(i)))
            {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode()
    {
        int result = 1;
        for (boolean[] row : rows)
        {
            result = 31 * result + Arrays.hashCode(row);
        }
        return result;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("{");
        for (boolean[] row : rows)
        {
            builder.append('{');
            for (int i = 0; i < row.length; ++i)
            {
                if (i > 0)
                {
                    builder.append(',');
                }
                builder.append(row[i] ? '1' : '0');
            }
            builder.append('}');
        }
        return builder.append('}').toString();
    }

    /**
     * Parse the text form produced by {@link #toString()}. Whitespace is ignored.
     *
     * @throws IllegalArgumentException if the text is malformed
     */
    public static ResultMatrix parse(String text)
    {
        requireNonNull(text, "text is null");
        String s = text.replaceAll("\\s", "");
        checkArgument(s.length() >= 2 && s.charAt(0) == '{' && s.charAt(s.length() - 1) == '}',
                "result matrix must be enclosed in braces: " + text);
        List<boolean[]> rows = new ArrayList<>();
        int pos = 1;
        int end = s.length() - 1;
        while (pos < end)
        {
            checkArgument(s.charAt(pos) == '{', "row must start with a brace at " + pos + ": " + text);
            int close = s.indexOf('}', pos);
            checkArgument(close > 0 && close < end, "row is not closed at " + pos + ": " + text);
            String body = s.substring(pos + 1, close);
            boolean[] row;
            if (body.isEmpty())
            {
                row = new boolean[0];
            }
            else
            {
                String[] cells = body.split(",", -1);
                row = new boolean[cells.length];
                for (int i = 0; i < cells.length; ++i)
                {
                    checkArgument(cells[i].equals("1") || cells[i].equals("0"),
                            "cell must be 1 or 0: " + text);
                    row[i] = cells[i].equals("1");
                }
            }
            rows.add(row);
            pos = close + 1;
        }
        return new ResultMatrix(rows);
    }
}

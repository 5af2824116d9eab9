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

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestResultMatrix
{
    @Test
    public void testTextForm()
    {
        ResultMatrix matrix = new ResultMatrix(Arrays.asList(new boolean[]{true, false}, new boolean[]{false, false}));
        assertEquals("{{1,0}{0,0}}", matrix.toString());
        assertEquals("{}", new ResultMatrix(Collections.emptyList()).toString());
        assertEquals("{{}{1}}", new ResultMatrix(Arrays.asList(new boolean[0], new boolean[]{true})).toString());
    }

    @Test
    public void testParse()
    {
        ResultMatrix matrix = ResultMatrix.parse("{ {1,0,1} {0} }");
        assertEquals(2, matrix.getRowCount());
        assertEquals(3, matrix.getColumnCount(0));
        assertEquals(1, matrix.getColumnCount(1));
        assertEquals(3, matrix.getMaxColumnCount());
        assertTrue(matrix.get(0, 2));
        assertFalse(matrix.get(1, 0));
        assertEquals("{{1,0,1}{0}}", matrix.toString());
        assertEquals(0, ResultMatrix.parse("{}").getRowCount());
        assertEquals(0, ResultMatrix.parse("{{}}").getColumnCount(0));
    }

    @Test
    public void testRowsAreCopied()
    {
        boolean[] row = {true};
        ResultMatrix matrix = new ResultMatrix(Collections.singletonList(row));
        row[0] = false;
        assertTrue(matrix.get(0, 0));
    }

    @Test
    public void testMalformedText()
    {
        for (String text : Arrays.asList("", "{", "{{1,0}", "{{1,2}}", "{{1,}}", "{1,0}", "[[1]]"))
        {
            try
            {
                ResultMatrix.parse(text);
                throw new AssertionError("malformed matrix is accepted: " + text);
            }
            catch (IllegalArgumentException e)
            {
                // expected
            }
        }
    }
}

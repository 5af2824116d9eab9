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
package io.infparquet.common.exception;

/**
 * Thrown when a null or out-of-range argument is passed to a public operation.
 */
public class InvalidArgumentException extends RuntimeException
{
    private static final long serialVersionUID = -2409837217634890211L;

    public InvalidArgumentException()
    {
    }

    public InvalidArgumentException(String message)
    {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public InvalidArgumentException(Throwable cause)
    {
        super(cause);
    }
}

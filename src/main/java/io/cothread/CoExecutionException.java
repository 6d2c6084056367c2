/*
 * Copyright (c) 2018, little-pan, All rights reserved.
 *
 * This library is free software; you can redistribute it and/or
 * modify it under the terms of the GNU Lesser General Public
 * License as published by the Free Software Foundation; either
 * version 3.0 of the License, or (at your option) any later version.
 *
 * This library is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
 * Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public
 * License along with this library.
 */
package io.cothread;

/**
 * <p>
 * Unchecked carrier of a coroutine body failure, for callers such as iterators that
 * can't throw {@link java.util.concurrent.ExecutionException}.
 * </p>
 * @author little-pan
 * @since 2018-09-03
 */
public class CoExecutionException extends RuntimeException {

    private static final long serialVersionUID = 6402538461172330175L;

    public CoExecutionException(String message, Throwable cause){
        super(message, cause);
    }

}

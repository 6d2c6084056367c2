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
 * Thrown at the call site that breaks the coroutine contract: reading without a value,
 * resuming a finished or closed coroutine, yielding from the caller side etc. It signals
 * a bug in the calling code, never a failure of the coroutine body.
 * </p>
 * @author little-pan
 * @since 2018-09-02
 */
public class CoContractException extends IllegalStateException {

    private static final long serialVersionUID = -2017863152098402781L;

    public CoContractException(String message){
        super(message);
    }

}

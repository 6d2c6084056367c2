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
 * The cooperative cancellation token of a coroutine. The worker checks it at each yield
 * point and unwinds the body with a {@link Teardown} signal once cancellation is requested.
 * </p>
 * @author little-pan
 * @since 2018-09-02
 */
final class CoCancellation {

    private volatile boolean cancelled;

    boolean isCancelled(){
        return cancelled;
    }

    void cancel(){
        cancelled = true;
    }

    void throwIfCancelled(){
        if(cancelled){
            throw Teardown.INSTANCE;
        }
    }

    /**
     * Unwinds the worker stack. It's an Error so that "catch(Exception e)" in a body
     * doesn't intercept it, and the worker never relies on its type to detect cancellation.
     */
    static final class Teardown extends Error {
        private static final long serialVersionUID = 1L;

        static final Teardown INSTANCE = new Teardown();

        private Teardown(){
            super("coroutine cancelled", null, false, false);
        }
    }// Teardown

}

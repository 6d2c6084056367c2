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

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutionException;

/**
 * <p>
 * Drives a coroutine as an iterator: hasNext() resumes the coroutine when no step is
 * pending, next() reads the value of that step.
 * </p>
 * @author little-pan
 * @since 2018-09-03
 */
final class CoIterator<V> implements Iterator<V> {

    private final CoThread<V> co;
    private boolean pending;

    CoIterator(CoThread<V> co){
        this.co = co;
    }

    @Override
    public boolean hasNext(){
        if(pending){
            return true;
        }
        if(!co.isAlive()){
            return false;
        }
        try{
            pending = co.resume();
        }catch(final ExecutionException e){
            throw new CoExecutionException(co + ": body failed", e.getCause());
        }
        return pending;
    }

    @Override
    public V next(){
        if(!hasNext()){
            throw new NoSuchElementException();
        }
        pending = false;
        return co.read();
    }

}

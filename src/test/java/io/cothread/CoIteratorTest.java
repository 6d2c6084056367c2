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

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.Assert.*;

public class CoIteratorTest {

    @Test(timeout = 10000L)
    public void testForEach() {
        final List<Integer> values = new ArrayList<>();
        try(final CoThread<Integer> co = CoThread.start((c, n) -> {
            for(int i = 1; i <= n; ++i){
                c.yield(i * i);
            }
        }, 4)){
            for(final int v: co){
                values.add(v);
            }
            assertFalse(co.isAlive());
        }
        assertEquals(Arrays.asList(1, 4, 9, 16), values);
    }

    @Test(timeout = 10000L)
    public void testHasNextIsIdempotent() {
        try(final CoThread<String> co = CoThread.start((c) -> c.yield("only"))){
            final Iterator<String> it = co.iterator();
            assertTrue(it.hasNext());
            assertTrue(it.hasNext());
            assertEquals("only", it.next());
            assertFalse(it.hasNext());
            assertFalse(it.hasNext());
            try{
                it.next();
                fail("next past the end");
            }catch(final NoSuchElementException e){
                // expected
            }
        }
    }

    @Test(timeout = 10000L)
    public void testEmpty() {
        try(final CoThread<String> co = CoThread.start((c) -> {})){
            assertFalse(co.iterator().hasNext());
        }
    }

    @Test(timeout = 10000L)
    public void testFailure() {
        try(final CoThread<String> co = CoThread.start((c) -> {
            c.yield("ok");
            throw new IOException("broken pipe");
        })){
            final Iterator<String> it = co.iterator();
            assertEquals("ok", it.next());
            try{
                it.hasNext();
                fail("body failure lost");
            }catch(final CoExecutionException e){
                assertTrue(e.getCause() instanceof IOException);
            }
            assertFalse(it.hasNext());
        }
    }

    @Test(timeout = 10000L)
    public void testStopEarly() {
        final CoThread<Integer> co = CoThread.start((c) -> {
            for(int i = 0;; ++i){
                c.yield(i);
            }
        });
        try{
            for(final int v: co){
                if(v == 10){
                    break;
                }
            }
            assertTrue(co.isAlive());
        }finally{
            co.close();
        }
        assertFalse(co.isAlive());
    }

}

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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <p>
 * The baton passed between the caller and the worker of a coroutine. Only the side that
 * holds the turn runs user code; the other one waits on the turn condition.
 * </p>
 * @author little-pan
 * @since 2018-09-02
 */
final class CoBaton {

    enum Turn {
        CALLER, WORKER
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition turnChanged = lock.newCondition();
    // The worker owns the turn from its start until the first yield.
    private Turn turn = Turn.WORKER;

    void lock(){
        lock.lock();
    }

    void unlock(){
        lock.unlock();
    }

    Turn turn(){
        return turn;
    }

    /**
     * Hands the turn to the other side. The caller must hold the lock.
     */
    void handTo(Turn next){
        turn = next;
        turnChanged.signalAll();
    }

    /**
     * Waits until the turn comes back. The caller must hold the lock.
     */
    void awaitTurn(Turn mine){
        while(turn != mine){
            turnChanged.awaitUninterruptibly();
        }
    }

    /**
     * Hands the turn over and waits until it comes back.
     */
    void pass(Turn mine){
        handTo(mine == Turn.CALLER? Turn.WORKER: Turn.CALLER);
        awaitTurn(mine);
    }

}

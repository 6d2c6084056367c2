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

import io.cothread.util.CoBody;
import io.cothread.util.CoBody1;
import io.cothread.util.CoBody2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <p>
 * A synchronous coroutine that runs its body on a dedicated worker thread. The caller drives
 * the body one step at a time: each {@link #resume()} hands the turn to the worker, which runs
 * until its next {@link #yield(Object)} or until the body returns. Caller and worker never run
 * at the same time.
 * </p>
 * <p>
 * The constructor runs the body up to its first yield, then that first step is delivered by
 * the first resume() without switching threads. So the n-th successful resume() always reports
 * the n-th yield:
 * <pre>
 * try(final CoThread&lt;Integer&gt; co = CoThread.start((c) -&gt; {
 *     c.yield(1);
 *     c.yield(2);
 * })){
 *     while(co.isAlive()){
 *         if(co.resume()){
 *             use(co.read());
 *         }
 *     }
 * }
 * </pre>
 * </p>
 * <p>
 * Cancellation by {@link #close()} is cooperative: the worker observes it at its next yield
 * point and unwinds the body, running its finally blocks. A body that never reaches a yield
 * point keeps close() waiting; use {@link #close(long, TimeUnit)} to bound that wait.
 * </p>
 * <p>
 * A coroutine is owned by one caller and can't be copied or serialized.
 * </p>
 *
 * @param <V> the yielded value type, {@link Void} for a coroutine that yields nothing
 * @author little-pan
 * @since 2018-09-02
 */
public final class CoThread<V> implements Iterable<V>, AutoCloseable {
    final static Logger log = LoggerFactory.getLogger(CoThread.class);

    private final static AtomicInteger nextId = new AtomicInteger(0);
    private final static ThreadLocal<CoThread<?>> current = new ThreadLocal<>();

    private final String name;
    private final Thread worker;
    private final CoBaton baton = new CoBaton();
    private final CoCancellation cancellation = new CoCancellation();

    // Guarded by the baton lock, volatile for the non-blocking queries
    private volatile CoState state = CoState.INITIALIZING;
    private volatile boolean valueAvailable;
    private volatile boolean primed;
    private volatile boolean retired;
    private V value;
    private Throwable failure;

    private CoThread(final Builder builder, final CoBody<V> body){
        this.name = String.format("%s-worker-%d", builder.name, nextId.incrementAndGet());
        this.worker = new Thread(null, () -> run(body), name, builder.stackSize);
        this.worker.setDaemon(builder.daemon);

        baton.lock();
        try{
            worker.start();
            baton.awaitTurn(CoBaton.Turn.CALLER);
            primed = (state == CoState.SUSPENDED || failure != null);
        }finally{
            baton.unlock();
        }
    }

    public static <V> CoThread<V> start(CoBody<V> body){
        return newBuilder().build(body);
    }

    public static <V, A> CoThread<V> start(CoBody1<V, A> body, A a){
        return newBuilder().build(body, a);
    }

    public static <V, A, B> CoThread<V> start(CoBody2<V, A, B> body, A a, B b){
        return newBuilder().build(body, a, b);
    }

    /**
     * @return the coroutine whose body runs on the current thread, or null
     */
    public static CoThread<?> current(){
        return current.get();
    }

    /**
     * <p>
     * Publishes the value and suspends the body until the next resume. Worker side only.
     * </p>
     * <p>
     * If the coroutine is closed meanwhile, this call doesn't return: the body is unwound
     * by an internal signal that "catch(Exception e)" doesn't intercept.
     * </p>
     * @param value the value for the caller to read
     * @throws CoContractException if not called from the body of this coroutine
     */
    public void yield(V value){
        if(Thread.currentThread() != worker){
            throw new CoContractException(name + ": yield called outside of the coroutine body");
        }

        baton.lock();
        try{
            cancellation.throwIfCancelled();
            this.value = value;
            state = CoState.SUSPENDED;
            baton.pass(CoBaton.Turn.WORKER);
            cancellation.throwIfCancelled();
        }finally{
            baton.unlock();
        }
    }

    /**
     * <p>
     * Suspends a coroutine that yields nothing, the value read by the caller is null.
     * </p>
     * @see #yield(Object)
     */
    public void yield(){
        this.yield(null);
    }

    /**
     * <p>
     * Runs the body until its next yield or its end. Caller side only.
     * </p>
     *
     * @return true if the body yielded and a value can be read, false if the body has ended
     * @throws ExecutionException if the body failed in this step
     * @throws CoContractException if the coroutine is finished, closed or already resuming
     */
    public boolean resume() throws ExecutionException {
        checkCaller("resume");

        baton.lock();
        try{
            if(cancellation.isCancelled()){
                throw new CoContractException(name + ": resume on a closed coroutine");
            }
            if(primed){
                primed = false;
                valueAvailable = false;
                return deliver();
            }
            final CoState s = state;
            if(s == CoState.FINISHED){
                throw new CoContractException(name + ": resume on a finished coroutine");
            }
            if(s != CoState.SUSPENDED){
                throw new CoContractException(name + ": resume while " + s);
            }
            valueAvailable = false;
            state = CoState.RUNNING;
            baton.pass(CoBaton.Turn.CALLER);
            return deliver();
        }finally{
            baton.unlock();
        }
    }

    private boolean deliver() throws ExecutionException {
        if(state == CoState.SUSPENDED){
            valueAvailable = true;
            return true;
        }

        final Throwable cause = failure;
        if(cause == null){
            return false;
        }
        failure = null;
        if(cause instanceof ExecutionException){
            throw (ExecutionException)cause;
        }
        throw new ExecutionException(cause);
    }

    /**
     * <p>
     * Reads the value of the step reported by the last resume. Caller side only, never blocks.
     * </p>
     * @throws CoContractException if the last resume reported no value or another resume began
     */
    public V read(){
        checkCaller("read");
        if(!valueAvailable){
            throw new CoContractException(name + ": no value available");
        }
        return value;
    }

    /**
     * @return true until the body ends or the coroutine is closed, never blocks
     */
    public boolean isAlive(){
        if(cancellation.isCancelled()){
            return false;
        }
        return (primed || state != CoState.FINISHED);
    }

    /**
     * @return true once close has been requested; a body doing long work between
     * yields can poll it to return early
     */
    public boolean isCancelled(){
        return cancellation.isCancelled();
    }

    public CoState getState(){
        return state;
    }

    public String getName(){
        return name;
    }

    /**
     * <p>
     * An iterator that drives this coroutine. A body failure is thrown as
     * {@link CoExecutionException}.
     * </p>
     */
    @Override
    public Iterator<V> iterator(){
        checkCaller("iterator");
        return new CoIterator<>(this);
    }

    /**
     * <p>
     * Cancels the coroutine and waits for its worker to end. A body suspended in a yield is
     * unwound at once; a body running between yields is waited for, without timeout, until it
     * reaches a yield or returns. Idempotent.
     * </p>
     * @throws CoContractException if called from the body of this coroutine
     */
    @Override
    public void close(){
        cancel();
        retire(-1L);
    }

    /**
     * <p>
     * Cancels the coroutine and waits at most the timeout for its worker to end. A worker
     * still running after the timeout is abandoned: it will unwind at its next yield point.
     * </p>
     * @return true if the worker has ended
     * @throws CoContractException if called from the body of this coroutine
     */
    public boolean close(long timeout, TimeUnit unit){
        if(timeout < 0L){
            throw new IllegalArgumentException("timeout smaller than 0: " + timeout);
        }
        cancel();
        return retire(unit.toMillis(timeout));
    }

    private void cancel(){
        if(Thread.currentThread() == worker){
            throw new CoContractException(name + ": close called from the coroutine body");
        }

        baton.lock();
        try{
            if(cancellation.isCancelled()){
                return;
            }
            cancellation.cancel();
            primed = false;
            valueAvailable = false;
            if(state == CoState.SUSPENDED && baton.turn() == CoBaton.Turn.CALLER){
                baton.handTo(CoBaton.Turn.WORKER);
            }
            log.debug("{}: Cancel requested in state {}", name, state);
        }finally{
            baton.unlock();
        }
    }

    // timeoutMillis < 0 waits without bound.
    private boolean retire(final long timeoutMillis){
        if(retired){
            return true;
        }

        boolean interrupted = false;
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        try{
            for(;;){
                try{
                    if(timeoutMillis < 0L){
                        worker.join();
                        break;
                    }
                    final long left = deadline - System.nanoTime();
                    if(left <= 0L){
                        break;
                    }
                    TimeUnit.NANOSECONDS.timedJoin(worker, left);
                    break;
                }catch(final InterruptedException e){
                    interrupted = true;
                }
            }
        }finally{
            if(interrupted){
                Thread.currentThread().interrupt();
            }
        }
        if(worker.isAlive()){
            log.warn("{}: Worker still running after {}ms, abandoned", name, timeoutMillis);
            return false;
        }

        final Throwable lost;
        baton.lock();
        try{
            if(retired){
                return true;
            }
            retired = true;
            lost = failure;
            failure = null;
        }finally{
            baton.unlock();
        }
        if(lost != null){
            log.warn("{}: Body failure never reported by resume", name, lost);
        }
        log.debug("{}: Retired", name);
        return true;
    }

    private void run(final CoBody<V> body){
        log.debug("{}: Started", name);
        current.set(this);
        Throwable cause = null;
        try{
            body.run(this);
        }catch(final Throwable e){
            cause = e;
        }finally{
            current.remove();
        }

        baton.lock();
        try{
            if(cause == null){
                log.debug("{}: Stopped", name);
            }else if(cancellation.isCancelled()){
                if(cause != CoCancellation.Teardown.INSTANCE){
                    log.warn("{}: Body failed while being cancelled", name, cause);
                }else{
                    log.debug("{}: Cancelled", name);
                }
            }else{
                log.debug("{}: Failed", name, cause);
                failure = cause;
            }
            value = null;
            state = CoState.FINISHED;
            baton.handTo(CoBaton.Turn.CALLER);
        }finally{
            baton.unlock();
        }
    }

    private void checkCaller(String op){
        if(Thread.currentThread() == worker){
            throw new CoContractException(name + ": " + op + " called from the coroutine body");
        }
    }

    @Override
    public String toString(){
        return name;
    }

    public final static Builder newBuilder(){
        return new Builder();
    }

    public static class Builder {
        private String name = "coThread";
        private boolean daemon = true;
        private long stackSize;

        protected Builder(){

        }

        public Builder setName(String name){
            if(name == null || name.isEmpty()){
                throw new IllegalArgumentException("name empty");
            }
            this.name = name;
            return this;
        }

        public Builder setDaemon(boolean daemon){
            this.daemon = daemon;
            return this;
        }

        /**
         * @param stackSize the worker stack size in bytes, 0 for the JVM default
         */
        public Builder setStackSize(long stackSize){
            this.stackSize = stackSize;
            return this;
        }

        public <V> CoThread<V> build(CoBody<V> body){
            if(body == null){
                throw new NullPointerException("body");
            }
            if(stackSize < 0L){
                throw new IllegalArgumentException("stackSize smaller than 0: " + stackSize);
            }
            return new CoThread<>(this, body);
        }

        public <V, A> CoThread<V> build(CoBody1<V, A> body, A a){
            if(body == null){
                throw new NullPointerException("body");
            }
            return build(body.bind(a));
        }

        public <V, A, B> CoThread<V> build(CoBody2<V, A, B> body, A a, B b){
            if(body == null){
                throw new NullPointerException("body");
            }
            return build(body.bind(a, b));
        }

    }// Builder

}

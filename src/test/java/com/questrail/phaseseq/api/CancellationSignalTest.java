package com.questrail.phaseseq.api;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class CancellationSignalTest
{
    @Test
    void callbacksRunOnceOnCancel()
    {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately()
    {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void removedCallbackDoesNotRun()
    {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        Runnable callback = calls::incrementAndGet;
        signal.onCancel(callback);
        signal.removeCallback(callback);

        signal.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void noneIsNotCancelled()
    {
        assertFalse(CancellationSignal.none().isCancelled());
    }
}

package nl.bytesoflife.xdot.viewer.animation;

import java.util.function.BooleanSupplier;

/**
 * Periodic callback source for animations. Ticks run on the UI thread.
 */
public interface AnimationTimer {

    /**
     * Call {@code tick} every {@code periodMillis} until it returns false or the handle is cancelled.
     */
    TimerHandle schedule(long periodMillis, BooleanSupplier tick);

    interface TimerHandle {

        void cancel();
    }
}

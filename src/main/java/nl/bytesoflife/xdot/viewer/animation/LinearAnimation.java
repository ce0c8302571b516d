package nl.bytesoflife.xdot.viewer.animation;

import nl.bytesoflife.xdot.viewer.DotController;

/**
 * Runs {@link #animate(double)} with t going from 0 to 1 over a fixed duration.
 */
public abstract class LinearAnimation extends Animation {

    public static final long DURATION_MILLIS = 600;

    private long started;

    protected LinearAnimation(DotController controller) {
        super(controller);
    }

    @Override
    public void start() {
        started = controller.currentTimeMillis();
        super.start();
    }

    @Override
    protected boolean tick() {
        double t = (controller.currentTimeMillis() - started) / (double) DURATION_MILLIS;
        animate(Math.max(0, Math.min(t, 1)));
        return t < 1;
    }

    protected abstract void animate(double t);
}

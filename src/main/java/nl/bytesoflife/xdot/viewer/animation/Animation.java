package nl.bytesoflife.xdot.viewer.animation;

import nl.bytesoflife.xdot.viewer.DotController;

/**
 * A timer-driven change of the view. At most one animation runs per controller.
 */
public abstract class Animation {

    public static final long STEP_MILLIS = 30;

    protected final DotController controller;

    private AnimationTimer.TimerHandle timerHandle;

    protected Animation(DotController controller) {
        this.controller = controller;
    }

    public void start() {
        timerHandle = controller.getAnimationTimer().schedule(STEP_MILLIS, this::step);
    }

    public void stop() {
        controller.animationStopped(this);
        if (timerHandle != null) {
            timerHandle.cancel();
            timerHandle = null;
        }
    }

    public boolean isRunning() {
        return timerHandle != null;
    }

    /**
     * Advance one frame; false when the animation is finished.
     */
    protected boolean tick() {
        return false;
    }

    private boolean step() {
        boolean more = tick();
        if (!more) {
            stop();
        }
        return more;
    }
}

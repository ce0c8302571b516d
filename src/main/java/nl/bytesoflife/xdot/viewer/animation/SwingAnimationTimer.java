package nl.bytesoflife.xdot.viewer.animation;

import javax.swing.Timer;
import java.util.function.BooleanSupplier;

/**
 * Animation timer backed by {@link javax.swing.Timer}, so ticks arrive on the event dispatch thread.
 */
public class SwingAnimationTimer implements AnimationTimer {

    @Override
    public TimerHandle schedule(long periodMillis, BooleanSupplier tick) {
        Timer timer = new Timer((int) periodMillis, null);
        timer.addActionListener(e -> {
            if (!tick.getAsBoolean()) {
                timer.stop();
            }
        });
        timer.setRepeats(true);
        timer.start();
        return timer::stop;
    }
}

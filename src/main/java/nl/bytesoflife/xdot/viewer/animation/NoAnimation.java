package nl.bytesoflife.xdot.viewer.animation;

import nl.bytesoflife.xdot.viewer.DotController;

public class NoAnimation extends Animation {

    public NoAnimation(DotController controller) {
        super(controller);
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
    }
}

package net.littleredcomputer.boolprop.trail;

/**
 * A one-way switch: once on, it stays on until the trail is popped past the point where it was
 * switched.
 */
public final class RevSwitch {
    private final Trail trail;
    private boolean on = false;

    RevSwitch(Trail trail) {
        this.trail = trail;
    }

    public boolean isOn() {
        return on;
    }

    public void switchOn() {
        if (on) return;
        on = true;
        trail.record(() -> on = false);
    }

    @Override
    public String toString() {
        return on ? "on" : "off";
    }
}

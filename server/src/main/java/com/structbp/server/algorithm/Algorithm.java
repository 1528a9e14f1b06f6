package com.structbp.server.algorithm;

/**
 * Start/kill lifecycle shared by inference algorithms. An algorithm is active between a
 * successful {@link #start()} and {@link #kill()}; a start that throws leaves it inactive.
 */
public abstract class Algorithm {

    private boolean active;

    public boolean isActive() {
        return active;
    }

    public void start() {
        if (active) {
            throw new AlgorithmActiveException();
        }
        initialize();
        doStart();
        active = true;
    }

    public void kill() {
        if (!active) {
            throw new AlgorithmInactiveException();
        }
        doKill();
        cleanUp();
        active = false;
    }

    protected void initialize() {
    }

    protected void cleanUp() {
    }

    protected abstract void doStart();

    protected abstract void doKill();
}

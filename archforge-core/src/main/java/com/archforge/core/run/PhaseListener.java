package com.archforge.core.run;

/**
 * Observer of run phase changes.
 */
@FunctionalInterface
public interface PhaseListener {

    void onTransition(PhaseTransition transition);
}

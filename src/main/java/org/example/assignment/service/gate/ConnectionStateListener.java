package org.example.assignment.service.gate;

@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called on the gate's scheduler thread after every state transition.
     */
    void onStateChange(ConnectionState previous, ConnectionStatus current);
}

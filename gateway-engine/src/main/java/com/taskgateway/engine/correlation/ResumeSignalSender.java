package com.taskgateway.engine.correlation;

/**
 * Delivers resume signals to the workflow engine.
 */
@FunctionalInterface
public interface ResumeSignalSender {

    /**
     * @throws com.taskgateway.core.exception.SignalDeliveryException if the engine did not accept the signal
     */
    void send(ResumeSignal signal);
}

package com.example.ytmdl.service;

public interface RunnerHandle {

    /**
     * Asks the run to stop. Returns immediately; the run confirms with a cancelled result.
     */
    void cancel();
}

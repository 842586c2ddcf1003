package com.example.ytmdl.service;

import com.example.ytmdl.utils.model.RunnerEvent;
import com.example.ytmdl.utils.model.RunnerRequest;

import java.util.function.Consumer;

/**
 * Executes one download outside of the caller's thread.
 */
public interface DownloadRunner {

    /**
     * Starts a run and returns without waiting for the downloader. Every message of the run goes to
     * {@code channel} in order; the last one carries the result, and exactly one result is sent.
     */
    RunnerHandle start(RunnerRequest request, Consumer<RunnerEvent> channel);
}

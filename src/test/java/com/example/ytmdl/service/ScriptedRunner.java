package com.example.ytmdl.service;

import com.example.ytmdl.utils.model.JobMetadata;
import com.example.ytmdl.utils.model.Progress;
import com.example.ytmdl.utils.model.RunnerEvent;
import com.example.ytmdl.utils.model.RunnerRequest;
import com.example.ytmdl.utils.model.RunnerResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runner whose runs are finished by the test. Cancellation is acknowledged right away unless
 * {@link #setAcknowledgeCancel(boolean)} turns it off.
 */
class ScriptedRunner implements DownloadRunner {
    private final List<Run> runs = new CopyOnWriteArrayList<>();
    private volatile boolean acknowledgeCancel = true;
    private volatile RuntimeException startFailure;
    private volatile Runnable onCancel = () -> { };

    @Override
    public RunnerHandle start(RunnerRequest request, Consumer<RunnerEvent> channel) {
        RuntimeException failure = startFailure;
        if (failure != null) {
            throw failure;
        }
        Run run = new Run(request, channel);
        runs.add(run);
        return run;
    }

    void setAcknowledgeCancel(boolean acknowledgeCancel) {
        this.acknowledgeCancel = acknowledgeCancel;
    }

    void onCancel(Runnable action) {
        this.onCancel = action;
    }

    void failStartsWith(RuntimeException failure) {
        this.startFailure = failure;
    }

    List<Run> runs() {
        return runs;
    }

    int runCount() {
        return runs.size();
    }

    Run lastRunOf(String jobId) {
        for (int i = runs.size() - 1; i >= 0; i--) {
            if (runs.get(i).request.getJobId().equals(jobId)) {
                return runs.get(i);
            }
        }
        throw new AssertionError("No run started for job " + jobId);
    }

    final class Run implements RunnerHandle {
        private final RunnerRequest request;
        private final Consumer<RunnerEvent> channel;
        private final AtomicInteger cancelCalls = new AtomicInteger();

        private Run(RunnerRequest request, Consumer<RunnerEvent> channel) {
            this.request = request;
            this.channel = channel;
        }

        @Override
        public void cancel() {
            cancelCalls.incrementAndGet();
            onCancel.run();
            if (acknowledgeCancel) {
                finish(RunnerResult.cancelled());
            }
        }

        RunnerRequest request() {
            return request;
        }

        int cancelCalls() {
            return cancelCalls.get();
        }

        void progress(Progress progress) {
            channel.accept(RunnerEvent.progress(request.getJobId(), request.getRunId(), progress));
        }

        void succeed() {
            succeed(null);
        }

        void succeed(JobMetadata metadata) {
            finish(RunnerResult.success(metadata));
        }

        void fail(String message) {
            finish(RunnerResult.executionError(message, 1));
        }

        void finish(RunnerResult result) {
            channel.accept(RunnerEvent.finished(request.getJobId(), request.getRunId(), result));
        }
    }
}

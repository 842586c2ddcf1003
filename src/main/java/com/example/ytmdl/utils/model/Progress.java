package com.example.ytmdl.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Advisory progress of a download. Any field except {@code stage} may be missing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Progress {
    private DownloadStage stage;
    private Float percentage;
    private String currentStep;
    private Integer currentStepIndex;
    private Integer totalSteps;

    public Progress(Progress other) {
        this.stage = other.stage;
        this.percentage = other.percentage;
        this.currentStep = other.currentStep;
        this.currentStepIndex = other.currentStepIndex;
        this.totalSteps = other.totalSteps;
    }

    public static Progress of(DownloadStage stage, String currentStep) {
        return new Progress(stage, null, currentStep, null, null);
    }

    public static Progress waiting() {
        return of(DownloadStage.INITIALIZING, "Waiting in queue");
    }

    public static Progress initializing() {
        return of(DownloadStage.INITIALIZING, "Initializing download...");
    }

    public static Progress completed() {
        return new Progress(DownloadStage.COMPLETED, 100f, "Download completed successfully", null, null);
    }

    public static Progress failed(String cause) {
        return of(DownloadStage.FAILED, "Error: " + cause);
    }
}

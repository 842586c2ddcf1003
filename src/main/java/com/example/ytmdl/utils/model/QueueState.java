package com.example.ytmdl.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueState {
    private List<DownloadJob> jobs;
    private boolean paused;
    private int concurrentLimit;
}

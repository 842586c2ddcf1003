package com.example.ytmdl.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {
    private int total;
    private int queued;
    private int running;
    private int completed;
    private int failed;
    private int cancelled;
    private boolean paused;
    private int concurrentLimit;
}

package com.example.ytmdl.utils.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddJobResponse {
    private String jobId;
    private boolean success;
    private String error;
}

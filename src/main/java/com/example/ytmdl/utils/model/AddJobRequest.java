package com.example.ytmdl.utils.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AddJobRequest {
    @NotBlank(message = "URL is required")
    private String url;
}

package com.example.ytmdl.utils.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobMetadata {
    private String title;
    private String artist;
    private String album;

    public JobMetadata(JobMetadata other) {
        this(other.title, other.artist, other.album);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && artist == null && album == null;
    }
}

package com.example.ytmdl.utils.model;

public enum CoverFormat {
    JPG,
    PNG,
    WEBP;

    public String argument() {
        return name().toLowerCase();
    }
}

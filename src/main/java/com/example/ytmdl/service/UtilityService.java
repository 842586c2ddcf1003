package com.example.ytmdl.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class UtilityService {
    @Getter
    private final String binaryPath;

    public UtilityService(@Value("${gytmdl.path}") String binaryPath) {
        this.binaryPath = binaryPath;
    }

    /**
     * Runs {@code gytmdl --version}.
     *
     * @throws IOException if the binary cannot be started or does not answer with a version
     */
    public String getGytmdlVersion() throws IOException, InterruptedException {
        Process process = new ProcessBuilder(binaryPath, "--version")
                .redirectErrorStream(true)
                .start();

        String version;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            version = reader.readLine();
        }

        if (!process.waitFor(10, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new IOException("gytmdl --version did not finish in time");
        }
        if (process.exitValue() != 0) {
            throw new IOException("gytmdl --version exited with code " + process.exitValue()
                    + (version != null ? ": " + version : ""));
        }
        return version != null ? version.trim() : "unknown version";
    }
}

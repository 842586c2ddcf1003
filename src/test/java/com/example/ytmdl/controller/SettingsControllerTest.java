package com.example.ytmdl.controller;

import com.example.ytmdl.config.ApplicationConfig;
import com.example.ytmdl.exception.ValidationException;
import com.example.ytmdl.utils.model.DownloaderSettings;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SettingsController.class)
class SettingsControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApplicationConfig appConfig;

    private final DownloaderSettings defaults = new ApplicationConfig().snapshot();

    @Test
    void returnsCurrentSettings() throws Exception {
        when(appConfig.snapshot()).thenReturn(defaults);

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itag").value("141"))
                .andExpect(jsonPath("$.coverFormat").value("JPG"))
                .andExpect(jsonPath("$.saveCover").value(true));
    }

    @Test
    void updatesSettings() throws Exception {
        when(appConfig.snapshot()).thenReturn(defaults.toBuilder().itag("251").build());

        mockMvc.perform(put("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"outputPath\":\"/music\",\"tempPath\":\"/tmp\",\"itag\":\"251\","
                                + "\"downloadMode\":\"AUDIO\",\"saveCover\":false,\"coverSize\":1400,"
                                + "\"coverFormat\":\"PNG\",\"coverQuality\":90,\"templateFolder\":\"{album}\","
                                + "\"templateFile\":\"{title}\",\"templateDate\":\"%Y\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.itag").value("251"));

        verify(appConfig).updateSettings(argThat(settings ->
                settings.getOutputPath().equals("/music") && !settings.isSaveCover()));
    }

    @Test
    void invalidSettingsAreBadRequest() throws Exception {
        doThrow(new ValidationException("Cover quality must be between 1 and 100"))
                .when(appConfig).updateSettings(any());

        mockMvc.perform(put("/api/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"coverQuality\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cover quality must be between 1 and 100"));
    }
}

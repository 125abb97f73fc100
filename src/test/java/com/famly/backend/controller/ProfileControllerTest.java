package com.famly.backend.controller;

import com.famly.backend.exception.InvalidProfileChoiceException;
import com.famly.backend.exception.ProfileNotFoundException;
import com.famly.backend.model.ProfileRecord;
import com.famly.backend.service.ProfilingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProfileController Tests")
class ProfileControllerTest {

    @Mock
    private ProfilingService profilingService;

    @InjectMocks
    private ProfileController profileController;

    private MockMvc mockMvc;
    private String userId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(profileController)
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
        userId = UUID.randomUUID().toString();
    }

    @Test
    void getProfile_ReturnsStoredAnswers() throws Exception {
        ProfileRecord record = new ProfileRecord(userId, "goals", "What are your goals in Fam.ly?",
            List.of("Connect more often"));
        when(profilingService.getUserResponses(userId)).thenReturn(record);

        mockMvc.perform(get("/profile").requestAttr("userId", userId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.question").value("What are your goals in Fam.ly?"))
            .andExpect(jsonPath("$.selectedChoices[0]").value("Connect more often"));
    }

    @Test
    void getProfile_WithoutAnswers_Returns404() throws Exception {
        when(profilingService.getUserResponses(userId))
            .thenThrow(new ProfileNotFoundException(userId, "What are your goals in Fam.ly?"));

        mockMvc.perform(get("/profile").requestAttr("userId", userId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void getProfile_WhenLoggedOut_Returns401() throws Exception {
        mockMvc.perform(get("/profile"))
            .andExpect(status().isUnauthorized());
        verifyNoInteractions(profilingService);
    }

    @Test
    void updateProfile_ReplacesAnswers() throws Exception {
        List<String> choices = List.of("Learn family history", "Learn about identity");
        when(profilingService.updateProfile(userId, choices)).thenReturn("Profile updated successfully!");

        mockMvc.perform(patch("/profile")
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"selectedChoices\":[\"Learn family history\",\"Learn about identity\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.msg").value("Profile updated successfully!"));
    }

    @Test
    void updateProfile_WithUnknownChoice_Returns400() throws Exception {
        when(profilingService.updateProfile(userId, List.of("Win")))
            .thenThrow(new InvalidProfileChoiceException(List.of("Win")));

        mockMvc.perform(patch("/profile")
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"selectedChoices\":[\"Win\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid choices: Win"));
    }

    @Test
    void updateProfile_WithoutChoices_Returns400() throws Exception {
        mockMvc.perform(patch("/profile")
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
        verifyNoInteractions(profilingService);
    }

    @Test
    void getQuestion_ListsConfiguredOptions() throws Exception {
        when(profilingService.getQuestion()).thenReturn("What are your goals in Fam.ly?");
        when(profilingService.getOptions()).thenReturn(List.of("Learn family history", "Connect more often"));

        mockMvc.perform(get("/profile/question"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.question").value("What are your goals in Fam.ly?"))
            .andExpect(jsonPath("$.options.length()").value(2))
            .andExpect(jsonPath("$.options[1]").value("Connect more often"));
    }
}

package com.famly.backend.controller;

import com.famly.backend.exception.UnauthorizedException;
import com.famly.backend.model.User;
import com.famly.backend.service.SessionService;
import com.famly.backend.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class SessionControllerTest {

    @Mock
    private SessionService sessionService;

    @Mock
    private UserService userService;

    @InjectMocks
    private SessionController sessionController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(sessionController)
                .setMessageConverters(new MappingJackson2HttpMessageConverter())
                .build();
    }

    @Test
    void login_ReturnsBearerToken() throws Exception {
        User user = new User("alice", "hashed");
        when(userService.authenticate("alice", "secret")).thenReturn(user);
        when(sessionService.start(user.getId().toString())).thenReturn("signed-token");
        when(sessionService.getTtlSeconds()).thenReturn(3600L);

        mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\",\"password\":\"secret\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.msg").value("Logged in!"))
            .andExpect(jsonPath("$.accessToken").value("signed-token"))
            .andExpect(jsonPath("$.tokenType").value("Bearer"))
            .andExpect(jsonPath("$.expiresIn").value(3600));
    }

    @Test
    void login_WithWrongPassword_Returns401() throws Exception {
        when(userService.authenticate("alice", "nope"))
            .thenThrow(new UnauthorizedException("Username or password is incorrect."));

        mockMvc.perform(post("/login")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"username\":\"alice\",\"password\":\"nope\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("Username or password is incorrect."));
        verify(sessionService, never()).start(anyString());
    }

    @Test
    void logout_EndsCurrentSession() throws Exception {
        String sessionId = UUID.randomUUID().toString();
        when(sessionService.getSessionId(any())).thenReturn(sessionId);

        mockMvc.perform(post("/logout").requestAttr("userId", UUID.randomUUID().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.msg").value("Logged out!"));
        verify(sessionService).end(sessionId);
    }

    @Test
    void logout_WhenLoggedOut_Returns401() throws Exception {
        mockMvc.perform(post("/logout"))
            .andExpect(status().isUnauthorized());
        verify(sessionService, never()).end(any());
    }

    @Test
    void getSessionUser_ReturnsCurrentUser() throws Exception {
        User user = new User("alice", "hashed");
        when(userService.getUserById(user.getId().toString())).thenReturn(user);

        mockMvc.perform(get("/session").requestAttr("userId", user.getId().toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.username").value("alice"))
            .andExpect(jsonPath("$.id").value(user.getId().toString()));
    }
}

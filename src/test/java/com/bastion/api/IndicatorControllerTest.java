package com.bastion.api;

import com.bastion.domain.Indicator;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.indicator.DuplicateIndicatorException;
import com.bastion.indicator.IndicatorRequest;
import com.bastion.indicator.IndicatorService;
import com.bastion.indicator.NoteAccessDeniedException;
import com.bastion.indicator.WhitelistedIndicatorException;
import com.bastion.security.MissingIdentityException;
import com.bastion.storage.IndicatorQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndicatorController Tests")
class IndicatorControllerTest {

    @Mock
    private IndicatorService indicatorService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new IndicatorController(indicatorService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should pass list filters through to the query")
    void shouldListWithFilters() throws Exception {
        // Given
        when(indicatorService.find(any(IndicatorQuery.class)))
            .thenReturn(new PageResult<>(List.of(indicator()), 1, 2, 10));

        // When
        mockMvc.perform(get("/api/indicators")
                .param("type", "domain")
                .param("isActive", "true")
                .param("search", "example")
                .param("page", "2")
                .param("limit", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(1));

        // Then
        ArgumentCaptor<IndicatorQuery> captor = ArgumentCaptor.forClass(IndicatorQuery.class);
        verify(indicatorService).find(captor.capture());
        assertThat(captor.getValue().getType()).isEqualTo(IndicatorType.DOMAIN);
        assertThat(captor.getValue().getActive()).isTrue();
        assertThat(captor.getValue().getSearch()).isEqualTo("example");
        assertThat(captor.getValue().getPage()).isEqualTo(2);
        assertThat(captor.getValue().getLimit()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject an unknown type filter")
    void shouldRejectUnknownType() throws Exception {
        mockMvc.perform(get("/api/indicators").param("type", "email"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Should map whitelist and duplicate refusals")
    void shouldMapCreateRefusals() throws Exception {
        // Given
        when(indicatorService.create(any(IndicatorRequest.class)))
            .thenThrow(new WhitelistedIndicatorException("mail.example.com", "example.com"))
            .thenThrow(new DuplicateIndicatorException("evil.example.com", IndicatorType.DOMAIN));
        String body = "{\"value\": \"mail.example.com\", \"type\": \"domain\"}";

        // Then
        mockMvc.perform(post("/api/indicators").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("WHITELISTED"));
        mockMvc.perform(post("/api/indicators").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("DUPLICATE"));
    }

    @Test
    @DisplayName("Should validate the temporary activation duration")
    void shouldValidateDuration() throws Exception {
        mockMvc.perform(post("/api/indicators/3/temp-activate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"durationHours\": 200}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Duration must be between 1 and 168 hours"));
        verifyNoInteractions(indicatorService);
    }

    @Test
    @DisplayName("Should return 403 and 401 for note authorship problems")
    void shouldMapNoteErrors() throws Exception {
        when(indicatorService.updateNote(eq(8L), anyString())).thenThrow(new NoteAccessDeniedException());
        when(indicatorService.updateNote(eq(9L), anyString())).thenThrow(new MissingIdentityException());

        mockMvc.perform(put("/api/indicator-notes/8")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"edited\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("ACCESS_DENIED"));
        mockMvc.perform(put("/api/indicator-notes/9")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\": \"edited\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    @DisplayName("Should reject a malformed request body")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/indicators").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    private static Indicator indicator() {
        return Indicator.builder()
            .id(3L)
            .value("evil.example.com")
            .type(IndicatorType.DOMAIN)
            .source(Indicator.MANUAL_SOURCE)
            .active(true)
            .build();
    }
}

package ru.tigran.eventfeedbackanalyzer.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormRequest;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormResponse;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackResponseDTO;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackSubmissionRequest;
import ru.tigran.eventfeedbackanalyzer.exception.ErrorCode;
import ru.tigran.eventfeedbackanalyzer.exception.ResourceNotFoundException;
import ru.tigran.eventfeedbackanalyzer.service.FeedbackFormService;
import ru.tigran.eventfeedbackanalyzer.service.FeedbackResponseService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Модульные тесты для FeedbackFormController.
 * Использует @WebMvcTest для изоляции слоев.
 */
@WebMvcTest(FeedbackFormController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("FeedbackFormController модульные тесты")
class FeedbackFormControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private FeedbackFormService feedbackFormService;

    @MockBean
    private FeedbackResponseService feedbackResponseService;

    private static final String FORMS_URL = "/api/v1/forms";
    private static final UUID FORM_ID = UUID.randomUUID();

    private FeedbackFormResponse formResponse() {
        LocalDateTime now = LocalDateTime.now();
        return new FeedbackFormResponse(FORM_ID, "Launch", LocalDate.of(2026, 5, 1), "Product launch", now, now);
    }

    @Test
    @DisplayName("POST /forms - форма создана, 201")
    void createFormSuccess() throws Exception {
        FeedbackFormRequest request = new FeedbackFormRequest("Launch", LocalDate.of(2026, 5, 1), "Product launch");
        when(feedbackFormService.createForm(request)).thenReturn(formResponse());

        mockMvc.perform(post(FORMS_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", equalTo(FORM_ID.toString())))
                .andExpect(jsonPath("$.eventName", equalTo("Launch")));
    }

    @Test
    @DisplayName("POST /forms - пустое название мероприятия, 400")
    void createFormBlankEventName() throws Exception {
        mockMvc.perform(post(FORMS_URL)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"eventName\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.VALIDATION_ERROR.getCode())));

        verifyNoInteractions(feedbackFormService);
    }

    @Test
    @DisplayName("GET /forms/{id} - несуществующая форма, 404")
    void getFormNotFound() throws Exception {
        when(feedbackFormService.getForm(FORM_ID)).thenThrow(new ResourceNotFoundException(
                "Feedback form with id " + FORM_ID + " not found", ErrorCode.FORM_NOT_FOUND.getCode()));

        mockMvc.perform(get(FORMS_URL + "/" + FORM_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code", equalTo("FORM_NOT_FOUND")));
    }

    @Test
    @DisplayName("GET /forms/{id} - некорректный UUID, 400")
    void getFormInvalidId() throws Exception {
        mockMvc.perform(get(FORMS_URL + "/not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("PUT /forms/{id} - частичное обновление, 200")
    void updateFormSuccess() throws Exception {
        when(feedbackFormService.updateForm(eq(FORM_ID), any())).thenReturn(formResponse());

        mockMvc.perform(put(FORMS_URL + "/" + FORM_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"Product launch\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.description", equalTo("Product launch")));
    }

    @Test
    @DisplayName("DELETE /forms/{id} - форма удалена, 204")
    void deleteFormSuccess() throws Exception {
        mockMvc.perform(delete(FORMS_URL + "/" + FORM_ID))
                .andExpect(status().isNoContent());

        verify(feedbackFormService).deleteForm(FORM_ID);
    }

    @Test
    @DisplayName("POST /forms/{id}/responses - отзыв принят, 201")
    void submitResponseSuccess() throws Exception {
        FeedbackSubmissionRequest request = new FeedbackSubmissionRequest("Bob", 5, "Great");
        when(feedbackResponseService.submitResponse(FORM_ID, request)).thenReturn(new FeedbackResponseDTO(
                UUID.randomUUID(), FORM_ID, "Bob", 5, "Great", LocalDateTime.now()));

        mockMvc.perform(post(FORMS_URL + "/" + FORM_ID + "/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.rating", equalTo(5)))
                .andExpect(jsonPath("$.formId", equalTo(FORM_ID.toString())));
    }

    @Test
    @DisplayName("POST /forms/{id}/responses - рейтинг 0, 400")
    void submitResponseRatingTooLow() throws Exception {
        mockMvc.perform(post(FORMS_URL + "/" + FORM_ID + "/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FeedbackSubmissionRequest(null, 0, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code", equalTo(ErrorCode.VALIDATION_ERROR.getCode())));

        verifyNoInteractions(feedbackResponseService);
    }

    @Test
    @DisplayName("POST /forms/{id}/responses - рейтинг 6, 400")
    void submitResponseRatingTooHigh() throws Exception {
        mockMvc.perform(post(FORMS_URL + "/" + FORM_ID + "/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FeedbackSubmissionRequest(null, 6, null))))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(feedbackResponseService);
    }

    @Test
    @DisplayName("POST /forms/{id}/responses - без рейтинга, 400")
    void submitResponseMissingRating() throws Exception {
        mockMvc.perform(post(FORMS_URL + "/" + FORM_ID + "/responses")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"comment\":\"no rating\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /forms/{id}/responses - список отзывов")
    void getResponses() throws Exception {
        when(feedbackResponseService.getResponses(FORM_ID)).thenReturn(List.of(
                new FeedbackResponseDTO(UUID.randomUUID(), FORM_ID, null, 4, null, LocalDateTime.now()),
                new FeedbackResponseDTO(UUID.randomUUID(), FORM_ID, "Eve", 2, "Too long", LocalDateTime.now())
        ));

        mockMvc.perform(get(FORMS_URL + "/" + FORM_ID + "/responses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].comment", equalTo("Too long")));
    }

    @Test
    @DisplayName("OPTIONS /forms - CORS preflight для разрешённого origin")
    void corsPreflightAllowedOrigin() throws Exception {
        mockMvc.perform(options(FORMS_URL)
                .header("Origin", "http://localhost:3000")
                .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "http://localhost:3000"))
                .andExpect(header().doesNotExist("Access-Control-Allow-Credentials"));
    }

    @Test
    @DisplayName("OPTIONS /forms - CORS preflight для чужого origin отклоняется")
    void corsPreflightUnknownOrigin() throws Exception {
        mockMvc.perform(options(FORMS_URL)
                .header("Origin", "http://evil.example")
                .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isForbidden());
    }
}

package com.project.image.emojify;

import com.project.image.emojify.DTOs.EmojifyResult;
import com.project.image.emojify.controller.EmojifyController;
import com.project.image.emojify.controller.HomeController;
import com.project.image.emojify.exceptions.ErrorCode;
import com.project.image.emojify.service.EmojifyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest({EmojifyController.class, HomeController.class})
class EmojifyControllerTest {

    @Autowired MockMvc mvc;
    @MockBean EmojifyService emojifyService;

    @Test
    void root_returns_plain_text_greeting() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Hi there!"));
    }

    @Test
    void success_envelope_has_path_url_and_status_only() throws Exception {
        when(emojifyService.emojify("face.jpg")).thenReturn(EmojifyResult.success(
                "emojified/emojified-face.jpg",
                "https://storage.googleapis.com/b/emojified/emojified-face.jpg"));

        mvc.perform(get("/emojify").param("objectName", "face.jpg"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.objectPath").value("emojified/emojified-face.jpg"))
                .andExpect(jsonPath("$.emojifiedUrl").value("https://storage.googleapis.com/b/emojified/emojified-face.jpg"))
                .andExpect(jsonPath("$.statusCode").value(200))
                .andExpect(jsonPath("$.errorCode").doesNotExist())
                .andExpect(jsonPath("$.errorMessage").doesNotExist())
                .andExpect(jsonPath("$.success").doesNotExist());
    }

    @Test
    void failure_envelope_sets_http_status_and_error_code() throws Exception {
        when(emojifyService.emojify("a/b")).thenReturn(
                EmojifyResult.failure(HttpStatus.BAD_REQUEST, ErrorCode.SLASHES_FORBIDDEN, null));

        mvc.perform(get("/emojify").param("objectName", "a/b"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.statusCode").value(400))
                .andExpect(jsonPath("$.errorCode").value(101))
                .andExpect(jsonPath("$.errorMessage").value("Slashes are intentionally forbidden in objectName."))
                .andExpect(jsonPath("$.objectPath").doesNotExist());
    }

    @Test
    void missing_parameter_reaches_service_as_null() throws Exception {
        when(emojifyService.emojify(isNull())).thenReturn(
                EmojifyResult.failure(HttpStatus.BAD_REQUEST, ErrorCode.OBJECT_NAME_MISSING, null));

        mvc.perform(get("/emojify"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(106));
        verify(emojifyService).emojify(isNull());
    }

    @Test
    void unexpected_exception_becomes_other_error() throws Exception {
        when(emojifyService.emojify("face.jpg")).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/emojify").param("objectName", "face.jpg"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.statusCode").value(500))
                .andExpect(jsonPath("$.errorCode").value(100))
                .andExpect(jsonPath("$.errorMessage").value("boom"));
    }

    @Test
    void unknown_path_keeps_not_found_status() throws Exception {
        mvc.perform(get("/favicon.ico"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").doesNotExist());
    }

    @Test
    void wrong_method_keeps_method_not_allowed_status() throws Exception {
        mvc.perform(post("/emojify").param("objectName", "face.jpg"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.errorCode").doesNotExist());
        verifyNoInteractions(emojifyService);
    }
}

package com.project.image.grainstats;

import com.project.image.grainstats.exceptions.GlobalExceptionHandler;
import com.project.image.grainstats.exceptions.GrainStatsException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {
    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void badInput_isClientError() {
        ProblemDetail problem = handler.handleDomainException(new GrainStatsException("Image is empty"));

        assertThat(problem.getStatus()).isEqualTo(400);
        assertThat(problem.getDetail()).isEqualTo("Image is empty");
    }

    @Test
    void missingNativeLibrary_isServerError() {
        ProblemDetail problem = handler.handleUnknownException(
                new IllegalStateException("Canny edge detection requires the OpenCV native library, which failed to load"));

        assertThat(problem.getStatus()).isEqualTo(500);
    }
}

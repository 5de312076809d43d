package com.ammann.dashboard.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.NotSupportedException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GlobalExceptionHandlerTest
{

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
        handler.uriInfo = null;
    }

    @Test
    void mapsValidationExceptionToBadRequest()
    {
        Response response = handler.toResponse(ValidationException.unsupportedFormat("report.xlsx"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.path).isNull();
        assertThat(body.code).isEqualTo("VALIDATION_ERROR");
        assertThat(body.message).contains("report.xlsx");
        assertThat(body.status).isEqualTo(400);
    }

    @Test
    void mapsUnsupportedInputToUnprocessableEntity()
    {
        Response response = handler.toResponse(UnsupportedInputException.duplicateColumn("sales"));

        assertThat(response.getStatus()).isEqualTo(422);
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("UNSUPPORTED_INPUT");
        assertThat(body.message).contains("sales");
    }

    @Test
    void mapsNotFoundTo404()
    {
        Response response = handler.toResponse(new NotFoundException("missing"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.NOT_FOUND.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("NOT_FOUND");
    }

    @Test
    void keepsStatusOfFrameworkErrors()
    {
        Response unsupported = handler.toResponse(new NotSupportedException("text/plain not accepted"));
        Response notAllowed = handler.toResponse(new WebApplicationException(405));

        assertThat(unsupported.getStatus()).isEqualTo(415);
        assertThat(((GlobalExceptionHandler.ErrorResponse) unsupported.getEntity()).code).isEqualTo("HTTP_415");
        assertThat(notAllowed.getStatus()).isEqualTo(405);
        assertThat(((GlobalExceptionHandler.ErrorResponse) notAllowed.getEntity()).status).isEqualTo(405);
    }

    @Test
    void mapsUnhandledTo500WithoutLeakingMessage()
    {
        Response response = handler.toResponse(new RuntimeException("boom"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.INTERNAL_SERVER_ERROR.getStatusCode());
        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse) response.getEntity();
        assertThat(body.code).isEqualTo("INTERNAL_ERROR");
        assertThat(body.message).isEqualTo("An unexpected error occurred");
    }

    @Test
    void includesRequestPathWhenAvailable()
    {
        UriInfo uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/v1/datasets/analyze");
        handler.uriInfo = uriInfo;

        GlobalExceptionHandler.ErrorResponse body = (GlobalExceptionHandler.ErrorResponse)
                handler.toResponse(new ValidationException("bad")).getEntity();

        assertThat(body.path).isEqualTo("/api/v1/datasets/analyze");
        assertThat(body.timestamp).isNotNull();
    }
}

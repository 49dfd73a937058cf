/*
 * Copyright (C) 2025 The Polity Hierarchy Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.polity.hierarchy.engine.controller;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.CONFLICT;
import static org.springframework.http.HttpStatus.INTERNAL_SERVER_ERROR;
import static org.springframework.http.HttpStatus.LOCKED;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.web.context.request.RequestAttributes.SCOPE_REQUEST;

import com.polity.hierarchy.common.exception.ConcurrencyConflictException;
import com.polity.hierarchy.common.exception.IntegrityViolationException;
import com.polity.hierarchy.common.exception.NodeNotFoundException;
import com.polity.hierarchy.common.exception.ScopeNotFoundException;
import com.polity.hierarchy.common.exception.ValidationException;
import java.util.List;
import lombok.CustomLog;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.lang.Nullable;
import org.springframework.validation.Errors;
import org.springframework.validation.FieldError;
import org.springframework.validation.method.MethodValidationResult;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import org.springframework.web.util.WebUtils;

@ControllerAdvice
@CustomLog
@Order(Ordered.HIGHEST_PRECEDENCE)
class GenericControllerAdvice extends ResponseEntityExceptionHandler {

    @ExceptionHandler({HttpMessageConversionException.class, IllegalArgumentException.class})
    private ResponseEntity<Object> badRequest(final Exception e, final WebRequest request) {
        return handleExceptionInternal(e, null, null, BAD_REQUEST, request);
    }

    @ExceptionHandler
    private ResponseEntity<Object> validation(final ValidationException e, final WebRequest request) {
        return respond(e, e.getFailure().name(), BAD_REQUEST, request);
    }

    @ExceptionHandler({NodeNotFoundException.class, ScopeNotFoundException.class})
    private ResponseEntity<Object> notFound(final Exception e, final WebRequest request) {
        return handleExceptionInternal(e, null, null, NOT_FOUND, request);
    }

    @ExceptionHandler
    private ResponseEntity<Object> conflict(final ConcurrencyConflictException e, final WebRequest request) {
        return handleExceptionInternal(e, null, null, CONFLICT, request);
    }

    @ExceptionHandler
    private ResponseEntity<Object> quarantined(final IntegrityViolationException e, final WebRequest request) {
        return handleExceptionInternal(e, null, null, LOCKED, request);
    }

    @ExceptionHandler
    private ResponseEntity<Object> defaultExceptionHandler(final Exception e, final WebRequest request) {
        log.error("Generic error: ", e);
        var headers = e instanceof ErrorResponse er ? er.getHeaders() : null;
        return handleExceptionInternal(e, null, headers, INTERNAL_SERVER_ERROR, request);
    }

    @Nullable
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex, @Nullable Object body, HttpHeaders headers, HttpStatusCode statusCode, WebRequest request) {
        if (ex instanceof Errors errors) {
            return respond(ex, errorResponse(errors.getAllErrors()), headers, statusCode, request);
        } else if (ex instanceof MethodValidationResult errors) {
            return respond(ex, errorResponse(errors.getAllErrors()), headers, statusCode, request);
        }

        var detail = body instanceof ProblemDetail pb ? pb.getDetail() : ex.getMessage();
        var nonSensitiveDetail = !statusCode.is5xxServerError() ? detail : StringUtils.EMPTY;
        var error = ApiError.of(reason(statusCode), nonSensitiveDetail, null);
        return respond(ex, error, headers, statusCode, request);
    }

    private ResponseEntity<Object> respond(Exception ex, String code, HttpStatus status, WebRequest request) {
        var error = ApiError.of(reason(status), ex.getMessage(), code);
        return respond(ex, error, null, status, request);
    }

    private ResponseEntity<Object> respond(
            Exception ex, Object error, HttpHeaders headers, HttpStatusCode statusCode, WebRequest request) {
        request.setAttribute(WebUtils.ERROR_EXCEPTION_ATTRIBUTE, ex, SCOPE_REQUEST);
        return new ResponseEntity<>(error, headers, statusCode);
    }

    private ApiError errorResponse(List<? extends MessageSourceResolvable> errors) {
        var messages = errors.stream()
                .map(error -> {
                    var detail = error instanceof FieldError fieldError
                            ? fieldError.getField() + " field " + fieldError.getDefaultMessage()
                            : error.getDefaultMessage();
                    return new ApiError.Message(null, detail, BAD_REQUEST.getReasonPhrase());
                })
                .toList();
        return ApiError.of(messages);
    }

    private static String reason(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus hs ? hs.getReasonPhrase() : statusCode.toString();
    }
}

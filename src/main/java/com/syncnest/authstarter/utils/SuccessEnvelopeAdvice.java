package com.syncnest.authstarter.utils;

import com.syncnest.authstarter.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Puts successful auth endpoint results into {@link ApiResponse}: the token pair, user view
 * or logout acknowledgement becomes {@code data}, next to the request id and the
 * {@link ResponseMessage} text. Problem documents and non-2xx bodies pass through.
 */
@RestControllerAdvice(basePackages = "com.syncnest.authstarter.controller")
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return AbstractJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {
        if (body == null || body instanceof ApiResponse<?> || body instanceof ProblemDetail) {
            return body;
        }
        if (!MediaType.APPLICATION_JSON.isCompatibleWith(selectedContentType)) {
            return body;
        }
        if (response instanceof ServletServerHttpResponse servlet
                && !HttpStatusCode.valueOf(servlet.getServletResponse().getStatus()).is2xxSuccessful()) {
            return body;
        }
        return ApiResponse.of(requestId(request, response), messageFor(returnType), body);
    }

    private static String messageFor(MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return ann != null && StringUtils.hasText(ann.value()) ? ann.value() : "OK";
    }

    /** Id assigned by {@link RequestIdFilter}; the echoed response header otherwise. */
    private static String requestId(ServerHttpRequest request, ServerHttpResponse response) {
        if (request instanceof ServletServerHttpRequest servlet
                && servlet.getServletRequest().getAttribute(RequestIdFilter.REQUEST_ID_ATTR) instanceof String id
                && StringUtils.hasText(id)) {
            return id;
        }
        return response.getHeaders().getFirst(RequestIdFilter.REQUEST_ID_HEADER);
    }
}

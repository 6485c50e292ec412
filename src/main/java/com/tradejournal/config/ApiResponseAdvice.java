package com.tradejournal.config;

import com.tradejournal.api.dto.response.ApiErrorResponse;
import com.tradejournal.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps the journal API's return values in {@link ApiResponse}. Scoped to the API package, so
 * actuator output is never touched. Plain strings and bodies that are already envelopes pass
 * through as they are.
 */
@RestControllerAdvice(basePackages = "com.tradejournal.api")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        boolean wrapped = body instanceof ApiResponse<?> || body instanceof ApiErrorResponse;
        return wrapped ? body : ApiResponse.of(body);
    }
}

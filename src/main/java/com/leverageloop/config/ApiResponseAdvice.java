package com.leverageloop.config;

import com.leverageloop.api.dto.response.ApiErrorResponse;
import com.leverageloop.api.dto.response.ApiResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps bodies returned by the loop controllers in {@link ApiResponse}. Only handlers
 * under {@code com.leverageloop.api} are wrapped, so actuator and error output keep
 * their own shape.
 */
@RestControllerAdvice(basePackages = "com.leverageloop.api")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final boolean paperTrading;

    public ApiResponseAdvice(@Value("${leverage.paper-trading:true}") boolean paperTrading) {
        this.paperTrading = paperTrading;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // String bodies go through StringHttpMessageConverter, which cannot write an envelope
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
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        return ApiResponse.of(body, paperTrading);
    }
}

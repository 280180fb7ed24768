package com.aiinpocket.parkfinder.security;

import org.springframework.core.MethodParameter;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * 將目前請求的 Authentication 轉成 {@link Caller}，讓 Controller 直接宣告 {@code Caller caller} 參數。
 * 未帶 token 的請求解析為匿名呼叫者。
 */
@Component
public class CallerArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ADMIN_AUTHORITY = "ROLE_ADMIN";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Caller.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return fromAuthentication(SecurityContextHolder.getContext().getAuthentication());
    }

    static Caller fromAuthentication(Authentication auth) {
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return Caller.anonymous();
        }
        boolean admin = auth.getAuthorities().stream()
                .anyMatch(a -> ADMIN_AUTHORITY.equals(a.getAuthority()));
        return new Caller(auth.getName(), admin);
    }
}

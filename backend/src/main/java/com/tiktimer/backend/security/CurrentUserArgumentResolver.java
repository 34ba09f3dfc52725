package com.tiktimer.backend.security;

import com.tiktimer.backend.exception.InvalidCredentialsException;
import com.tiktimer.backend.model.User;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

@Component
@RequiredArgsConstructor
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final AuthenticationGate authenticationGate;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && (User.class.equals(parameter.getParameterType())
                || UserPrincipal.class.equals(parameter.getParameterType()));
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof UserPrincipal principal)) {
            throw new InvalidCredentialsException("No authenticated principal for " + parameter.getMethod());
        }
        CurrentUser annotation = parameter.getParameterAnnotation(CurrentUser.class);
        AuthenticationContext context = authenticationGate.authorize(principal.getContext(), annotation.value());
        if (User.class.equals(parameter.getParameterType())) {
            return context.getUser();
        }
        return principal;
    }
}

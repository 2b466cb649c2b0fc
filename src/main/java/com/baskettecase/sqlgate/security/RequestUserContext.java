package com.baskettecase.sqlgate.security;

import com.baskettecase.sqlgate.store.AppUser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Access to the user {@link UserIdentityFilter} resolved for the current request.
 */
public final class RequestUserContext {

    static final String USER_ATTRIBUTE = "appUser";

    private RequestUserContext() {
    }

    /**
     * @throws IllegalStateException when no user was resolved for the request
     */
    public static AppUser getCurrentUser() {
        AppUser user = (AppUser) getCurrentRequest().getAttribute(USER_ATTRIBUTE);
        if (user == null) {
            throw new IllegalStateException(
                "No user found in request context. Ensure UserIdentityFilter is configured correctly.");
        }
        return user;
    }

    private static HttpServletRequest getCurrentRequest() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            throw new IllegalStateException("No request context available");
        }
        return attributes.getRequest();
    }
}

package com.tiktimer.backend.security;

/**
 * One check of the authentication pipeline. Returns the (possibly enriched) context or throws the
 * rejection that ends the request.
 */
@FunctionalInterface
public interface GateStep {

    AuthenticationContext apply(AuthenticationContext context);

    default GateStep then(GateStep next) {
        return context -> next.apply(apply(context));
    }
}

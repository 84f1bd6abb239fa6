package com.example.boundary.identity.resolver;

import com.example.boundary.identity.exception.AuthenticationException;
import com.example.boundary.identity.model.Actor;
import org.springframework.core.MethodParameter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.BindingContext;
import org.springframework.web.reactive.result.method.HandlerMethodArgumentResolver;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Resolves {@link Actor} controller parameters from the exchange attribute
 * stored by {@link com.example.boundary.identity.filter.GatewayIdentityFilter}.
 */
@Component
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(@NonNull MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    @NonNull
    public Mono<Object> resolveArgument(
            @NonNull MethodParameter parameter,
            @NonNull BindingContext bindingContext,
            @NonNull ServerWebExchange exchange) {

        Actor actor = exchange.getAttribute(Actor.EXCHANGE_ATTRIBUTE);
        if (actor == null) {
            return Mono.error(new AuthenticationException("No gateway identity on request"));
        }
        return Mono.just(actor);
    }
}

package com.rolegate.guardedservice.api;

import static org.springframework.web.servlet.function.RouterFunctions.route;

import com.rolegate.guardedservice.infrastructure.web.GuardFilterFunction;
import com.rolegate.guardedservice.infrastructure.web.RouteGuards;
import com.rolegate.security.DecisionEngine;
import com.rolegate.security.Principal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Demo routes, each guarded by exactly one requirement.
 *
 * <pre>
 * GET /              public
 * GET /admin         role admin
 * GET /profile/edit  permission edit_profile
 * GET /special       permission special_access
 * GET /api/v1/me     permission view_profile
 * </pre>
 */
@Configuration
public class GuardedRoutes {

    @Bean
    public RouterFunction<ServerResponse> guardedRouter(RouteGuards guards, DecisionEngine decisions) {
        return route()
                .GET("/", request -> message("Hello, world!"))
                .add(route()
                        .GET("/admin", request -> message("Welcome, admin!"))
                        .filter(guards.requireRole("admin"))
                        .build())
                .add(route()
                        .GET("/profile/edit", request -> message("Edit your profile here"))
                        .filter(guards.requirePermission("edit_profile"))
                        .build())
                .add(route()
                        .GET("/special", request -> message("This is a special area!"))
                        .filter(guards.requirePermission("special_access"))
                        .build())
                .add(route()
                        .GET("/api/v1/me", request -> me(request, decisions))
                        .filter(guards.requirePermission("view_profile"))
                        .build())
                .build();
    }

    private static ServerResponse message(String text) {
        return ServerResponse.ok().body(Map.of("message", text));
    }

    private static ServerResponse me(ServerRequest request, DecisionEngine decisions) {
        Principal principal = GuardFilterFunction.principal(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", principal.id());
        body.put("displayName", principal.displayName());
        body.put("roles", principal.roles());
        body.put("permissions", decisions.effectivePermissions(principal));
        return ServerResponse.ok().body(body);
    }
}

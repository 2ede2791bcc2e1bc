package com.cinelink.federation.api;

import com.cinelink.federation.api.dto.UserMoviesResponse;
import com.cinelink.federation.service.FederationGateway;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UserController {
    private final FederationGateway gateway;

    public UserController(FederationGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/users/{name}")
    public UserMoviesResponse userMovies(@PathVariable("name") String name) {
        return gateway.userMovies(name);
    }
}

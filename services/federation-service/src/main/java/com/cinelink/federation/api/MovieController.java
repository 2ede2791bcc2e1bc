package com.cinelink.federation.api;

import com.cinelink.federation.api.dto.CommonMoviesResponse;
import com.cinelink.federation.api.dto.MovieListResponse;
import com.cinelink.federation.api.dto.MovieSearchResponse;
import com.cinelink.federation.api.dto.MovieUpdateResponse;
import com.cinelink.federation.api.dto.MovieUsersResponse;
import com.cinelink.federation.service.FederationGateway;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/movies")
public class MovieController {
    private final FederationGateway gateway;

    public MovieController(FederationGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping
    public MovieListResponse listMovies(
        @RequestParam(value = "page", required = false) String page,
        @RequestParam(value = "limit", required = false) String limit
    ) {
        return gateway.listMovies(page, limit);
    }

    @GetMapping("/search")
    public MovieSearchResponse searchMovies(
        @RequestParam(value = "name", required = false) String name,
        @RequestParam(value = "actor", required = false) String actor
    ) {
        return gateway.searchMovies(name, actor);
    }

    @GetMapping("/common")
    public CommonMoviesResponse commonMovies() {
        return gateway.commonMovies();
    }

    @PutMapping("/{name}")
    public MovieUpdateResponse updateMovie(
        @PathVariable("name") String name,
        @RequestBody(required = false) Map<String, Object> body
    ) {
        return gateway.updateMovie(name, body);
    }

    @GetMapping("/{name}/users")
    public MovieUsersResponse movieUsers(@PathVariable("name") String name) {
        return gateway.movieUsers(name);
    }
}

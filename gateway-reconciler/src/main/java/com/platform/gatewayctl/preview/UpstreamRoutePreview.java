package com.platform.gatewayctl.preview;

import com.platform.gatewayctl.model.DeployedRoute;
import com.platform.gatewayctl.model.PathSegment;
import com.platform.gatewayctl.model.RouteDefinition;
import com.platform.gatewayctl.reconcile.MethodStack;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a request path to the upstream URI a stage would call for it.
 * <p>
 * Literal segments match exactly, {@code {v}} binds one segment and {@code {v+}} binds all remaining
 * segments. When several routes match, the one with the most literal segments wins, and a route
 * without a greedy capture beats one with.
 */
public class UpstreamRoutePreview {

    private final List<DeployedRoute> routes;

    public UpstreamRoutePreview(List<DeployedRoute> routes) {
        this.routes = List.copyOf(routes);
    }

    /**
     * Preview built from desired routes, for control planes whose stages cannot be inspected.
     */
    public static UpstreamRoutePreview ofDesired(List<RouteDefinition> routes) {
        return new UpstreamRoutePreview(routes.stream()
            .map(r -> new DeployedRoute(r.path(), r.verb(), MethodStack.of(r).integration()))
            .toList());
    }

    public record Resolution(DeployedRoute route, Map<String, String> bindings, String upstreamUri) {

        public Resolution {
            bindings = Map.copyOf(bindings);
        }
    }

    public Optional<Resolution> resolve(String verb, String requestPath) {
        String[] parts = split(requestPath);
        return routes.stream()
            .filter(route -> route.verb().accepts(verb))
            .sorted(Comparator.<DeployedRoute>comparingLong(UpstreamRoutePreview::literalCount).reversed()
                .thenComparing(UpstreamRoutePreview::hasGreedy))
            .map(route -> match(route, parts))
            .flatMap(Optional::stream)
            .findFirst();
    }

    public Optional<Resolution> resolve(String requestPath) {
        return resolve("GET", requestPath);
    }

    private static Optional<Resolution> match(DeployedRoute route, String[] parts) {
        List<PathSegment> segments = route.path().segments();
        Map<String, String> bindings = new LinkedHashMap<>();
        int i = 0;
        for (PathSegment segment : segments) {
            if (i >= parts.length) {
                return Optional.empty();
            }
            switch (segment.kind()) {
                case LITERAL -> {
                    if (!segment.name().equals(parts[i])) {
                        return Optional.empty();
                    }
                    i++;
                }
                case CAPTURE -> bindings.put(segment.name(), parts[i++]);
                case GREEDY_CAPTURE -> {
                    bindings.put(segment.name(), String.join("/", Arrays.copyOfRange(parts, i, parts.length)));
                    i = parts.length;
                }
            }
        }
        if (i != parts.length) {
            return Optional.empty();
        }
        return Optional.of(new Resolution(route, bindings, substitute(route.integration().uri(), bindings)));
    }

    private static String substitute(String uriTemplate, Map<String, String> bindings) {
        String uri = uriTemplate;
        for (Map.Entry<String, String> binding : bindings.entrySet()) {
            uri = uri.replace("{" + binding.getKey() + "}", binding.getValue());
        }
        return uri;
    }

    private static String[] split(String requestPath) {
        String path = requestPath == null ? "" : requestPath.trim();
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        return Arrays.stream(path.split("/"))
            .filter(part -> !part.isEmpty())
            .toArray(String[]::new);
    }

    private static long literalCount(DeployedRoute route) {
        return route.path().segments().stream().filter(s -> !s.isCapture()).count();
    }

    private static boolean hasGreedy(DeployedRoute route) {
        return route.path().segments().stream().anyMatch(s -> s.kind() == PathSegment.Kind.GREEDY_CAPTURE);
    }
}

package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A slash-separated path template such as {@code /api/{proxy+}}.
 * A greedy capture may only appear as the last segment and variable names are unique.
 */
public record PathTemplate(List<PathSegment> segments) {
    
    public PathTemplate {
        segments = List.copyOf(segments);
        Set<String> variables = new HashSet<>();
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            if (segment.kind() == PathSegment.Kind.GREEDY_CAPTURE && i != segments.size() - 1) {
                throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "path", render(segments),
                    "a greedy capture must be the last segment");
            }
            if (segment.isCapture() && !variables.add(segment.name())) {
                throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "path", render(segments),
                    "duplicate path variable '" + segment.name() + "'");
            }
        }
    }
    
    public static PathTemplate parse(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "path", path, "must start with '/'");
        }
        if (path.equals("/")) {
            return new PathTemplate(List.of());
        }
        String body = path.endsWith("/") ? path.substring(1, path.length() - 1) : path.substring(1);
        List<PathSegment> segments = new ArrayList<>();
        for (String part : body.split("/", -1)) {
            segments.add(PathSegment.parse(part));
        }
        return new PathTemplate(segments);
    }
    
    /**
     * Names of all capture variables, in path order.
     */
    public List<String> captureVariables() {
        return segments.stream()
            .filter(PathSegment::isCapture)
            .map(PathSegment::name)
            .toList();
    }
    
    public boolean isRoot() {
        return segments.isEmpty();
    }
    
    /**
     * First literal segment, used to build the public invoke URL.
     */
    public String firstLiteral() {
        return segments.stream()
            .filter(s -> !s.isCapture())
            .map(PathSegment::name)
            .findFirst()
            .orElse("");
    }
    
    public String path() {
        return render(segments);
    }
    
    private static String render(List<PathSegment> segments) {
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (PathSegment segment : segments) {
            sb.append('/').append(segment.text());
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return path();
    }
}

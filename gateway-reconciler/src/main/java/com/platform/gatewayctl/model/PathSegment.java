package com.platform.gatewayctl.model;

import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.ValidationException;

import java.util.regex.Pattern;

/**
 * One segment of a path template.
 * Two segments are equal only when both kind and name match, so the literal
 * {@code proxy} and the capture {@code {proxy+}} never match each other.
 */
public record PathSegment(Kind kind, String name) {
    
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._~-]+");
    
    public enum Kind {
        LITERAL,
        /** {@code {name}}: exactly one path component. */
        CAPTURE,
        /** {@code {name+}}: one or more trailing path components bound as one variable. */
        GREEDY_CAPTURE
    }
    
    public static PathSegment literal(String name) {
        return new PathSegment(Kind.LITERAL, name);
    }
    
    public static PathSegment capture(String name) {
        return new PathSegment(Kind.CAPTURE, name);
    }
    
    public static PathSegment greedy(String name) {
        return new PathSegment(Kind.GREEDY_CAPTURE, name);
    }
    
    /**
     * Parse a single path part as the control plane stores it, e.g. {@code api},
     * {@code {id}} or {@code {proxy+}}.
     */
    public static PathSegment parse(String part) {
        if (part == null || part.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "pathPart", part, "empty path segment");
        }
        boolean opens = part.startsWith("{");
        boolean closes = part.endsWith("}");
        if (opens != closes) {
            throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "pathPart", part, "unbalanced braces");
        }
        if (!opens) {
            return literal(checkedName(part, part));
        }
        String inner = part.substring(1, part.length() - 1);
        if (inner.endsWith("+")) {
            return greedy(checkedName(inner.substring(0, inner.length() - 1), part));
        }
        return capture(checkedName(inner, part));
    }
    
    private static String checkedName(String name, String part) {
        if (!NAME.matcher(name).matches()) {
            throw new ValidationException(ErrorCode.INVALID_PATH_TEMPLATE, "pathPart", part,
                "segment names may only contain letters, digits and . _ ~ -");
        }
        return name;
    }
    
    public boolean isCapture() {
        return kind != Kind.LITERAL;
    }
    
    /**
     * The segment as it appears in a path, e.g. {@code {proxy+}}.
     */
    public String text() {
        return switch (kind) {
            case LITERAL -> name;
            case CAPTURE -> "{" + name + "}";
            case GREEDY_CAPTURE -> "{" + name + "+}";
        };
    }
    
    /**
     * Whether a stored path part denotes this very segment.
     */
    public boolean matchesPathPart(String pathPart) {
        if (pathPart == null || pathPart.isEmpty()) {
            return false;
        }
        try {
            return equals(parse(pathPart));
        } catch (ValidationException e) {
            // parts created outside this tool may not parse; they are never ours
            return false;
        }
    }
    
    @Override
    public String toString() {
        return text();
    }
}

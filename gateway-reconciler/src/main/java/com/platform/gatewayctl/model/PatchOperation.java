package com.platform.gatewayctl.model;

/**
 * A single JSON-Patch style field change for a partial update call.
 * Map keys inside the path are escaped as JSON pointers ({@code /} becomes {@code ~1}).
 */
public record PatchOperation(Op op, String path, String value) {
    
    public enum Op {
        ADD,
        REPLACE,
        REMOVE
    }
    
    public static PatchOperation add(String path, String value) {
        return new PatchOperation(Op.ADD, path, value);
    }
    
    public static PatchOperation replace(String path, String value) {
        return new PatchOperation(Op.REPLACE, path, value);
    }
    
    public static PatchOperation remove(String path) {
        return new PatchOperation(Op.REMOVE, path, null);
    }
    
    /**
     * Path of an entry of a map-valued field, e.g. {@code /requestTemplates/application~1json}.
     */
    public static String mapEntryPath(String field, String key) {
        return "/" + field + "/" + escape(key);
    }
    
    public static String escape(String key) {
        return key.replace("~", "~0").replace("/", "~1");
    }
    
    public static String unescape(String key) {
        return key.replace("~1", "/").replace("~0", "~");
    }
    
    @Override
    public String toString() {
        return value == null
            ? op.name().toLowerCase() + " " + path
            : op.name().toLowerCase() + " " + path + "=" + value;
    }
}

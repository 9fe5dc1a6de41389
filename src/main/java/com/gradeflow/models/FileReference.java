package com.gradeflow.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Locale;

/**
 * A submitted file, addressed by a local path or an http(s) URL
 */
public record FileReference(String name, String location) {

    @JsonIgnore
    public boolean isRemote() {
        if (location == null) {
            return false;
        }
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    /**
     * Lower-case extension of the file name, or an empty string
     */
    @JsonIgnore
    public String extension() {
        String source = name != null && !name.isBlank() ? name : location;
        if (source == null) {
            return "";
        }
        int dot = source.lastIndexOf('.');
        int slash = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
        if (dot < 0 || dot < slash || dot == source.length() - 1) {
            return "";
        }
        return source.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}

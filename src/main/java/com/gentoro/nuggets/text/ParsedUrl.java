package com.gentoro.nuggets.text;

/**
 * Components of a URL. {@code path} holds path, query and fragment; a bare root path is empty.
 * When the input could not be parsed, {@code valid} is false and {@code domain} holds the input.
 */
public record ParsedUrl(
    String protocol, String domain, String path, boolean valid, String originalUrl) {}

package com.github.dimitryivaniuta.gatekeeper.auth;

import java.util.Collection;
import java.util.List;

/**
 * Routes exempt from IP and token authorization. One instance is shared by both authorizers so
 * they can never disagree about what is public.
 *
 * <p>A route matches a path exactly or as a {@code route + "/"} prefix, after the optional base URL
 * has been stripped from the path.
 */
public final class PublicRoutes {

    private final String baseUrl;
    private final List<String> routes;

    public PublicRoutes(String baseUrl, Collection<String> routes) {
        this.baseUrl = normalizeBase(baseUrl);
        this.routes = routes.stream()
                .filter(r -> r != null && !r.isBlank())
                .map(String::trim)
                .map(PublicRoutes::trimTrailingSlash)
                .distinct()
                .toList();
    }

    public boolean isPublic(String path) {
        String p = stripBase(path == null || path.isEmpty() ? "/" : path);
        for (String route : routes) {
            if (p.equals(route)) return true;
            if (!route.equals("/") && p.startsWith(route + "/")) return true;
        }
        return false;
    }

    public List<String> routes() {
        return routes;
    }

    String stripBase(String path) {
        if (baseUrl.isEmpty()) return path;
        if (path.equals(baseUrl)) return "/";
        if (path.startsWith(baseUrl + "/")) return path.substring(baseUrl.length());
        return path;
    }

    private static String normalizeBase(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) return "";
        String b = trimTrailingSlash(baseUrl.trim());
        if (b.equals("/")) return "";
        return b.startsWith("/") ? b : "/" + b;
    }

    private static String trimTrailingSlash(String s) {
        String r = s;
        while (r.length() > 1 && r.endsWith("/")) r = r.substring(0, r.length() - 1);
        return r;
    }
}
